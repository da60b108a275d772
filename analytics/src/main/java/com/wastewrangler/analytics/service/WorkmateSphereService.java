package com.wastewrangler.analytics.service;

import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.store.FleetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Workmate sphere of a driver: everyone who shared a trip with them, and
 * recursively everyone who shared a trip with one of those.
 */
@Service
public class WorkmateSphereService {

    private static final Logger log = LoggerFactory.getLogger(WorkmateSphereService.class);

    private final FleetStore store;

    public WorkmateSphereService(FleetStore store) {
        this.store = store;
    }

    public SchedulingResult<Set<Integer>> workmateSphere(int employeeId) {
        if (!store.isDriver(employeeId)) {
            log.debug("Employee {} is not a driver", employeeId);
            return SchedulingResult.failure(SchedulingError.INVALID_DRIVER, Set.of());
        }
        Set<Integer> sphere = WorkmateGraph.fromTrips(store.findAllTrips()).reachableFrom(employeeId);
        log.debug("Workmate sphere of {} has {} members", employeeId, sphere.size());
        return SchedulingResult.success(sphere);
    }
}
