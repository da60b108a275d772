package com.wastewrangler.gateway.service;

import com.wastewrangler.analytics.service.WorkmateSphereService;
import com.wastewrangler.compliance.io.QualificationFileReader;
import com.wastewrangler.compliance.model.QualificationRecord;
import com.wastewrangler.compliance.service.QualificationImporter;
import com.wastewrangler.dispatch.service.BatchTripScheduler;
import com.wastewrangler.dispatch.service.TripScheduler;
import com.wastewrangler.dispatch.service.WasteRerouteService;
import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.util.OperationContext;
import com.wastewrangler.vehicles.service.MaintenanceScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Public operations of the scheduler.
 *
 * None of these methods throw. Rejections and storage failures alike come
 * back as {@code false}, {@code 0} or an empty set; the reason is logged.
 */
@Service
public class WasteWrangler {

    private static final Logger log = LoggerFactory.getLogger(WasteWrangler.class);

    private final TripScheduler tripScheduler;
    private final BatchTripScheduler batchTripScheduler;
    private final MaintenanceScheduler maintenanceScheduler;
    private final WasteRerouteService rerouteService;
    private final WorkmateSphereService workmateSphereService;
    private final QualificationImporter qualificationImporter;
    private final QualificationFileReader qualificationFileReader;

    public WasteWrangler(TripScheduler tripScheduler,
                         BatchTripScheduler batchTripScheduler,
                         MaintenanceScheduler maintenanceScheduler,
                         WasteRerouteService rerouteService,
                         WorkmateSphereService workmateSphereService,
                         QualificationImporter qualificationImporter,
                         QualificationFileReader qualificationFileReader) {
        this.tripScheduler = tripScheduler;
        this.batchTripScheduler = batchTripScheduler;
        this.maintenanceScheduler = maintenanceScheduler;
        this.rerouteService = rerouteService;
        this.workmateSphereService = workmateSphereService;
        this.qualificationImporter = qualificationImporter;
        this.qualificationFileReader = qualificationFileReader;
    }

    public boolean scheduleTrip(int routeId, LocalDateTime time) {
        return run("scheduleTrip", () -> tripScheduler.scheduleTrip(routeId, time)).isSuccess();
    }

    public int scheduleTrips(int truckId, LocalDate date) {
        return count(run("scheduleTrips", () -> batchTripScheduler.scheduleTrips(truckId, date)));
    }

    public int updateTechnicians(List<QualificationRecord> records) {
        return count(run("updateTechnicians", () -> qualificationImporter.updateTechnicians(records)));
    }

    /**
     * Reads a qualification file and applies it. An unreadable file counts as
     * zero applied records.
     */
    public int updateTechnicians(Path qualificationsFile) {
        List<QualificationRecord> records;
        try (OperationContext.Scope ignored = OperationContext.open("updateTechnicians")) {
            try {
                records = qualificationFileReader.read(qualificationsFile);
            } catch (IOException e) {
                log.error("Could not read qualification file {}", qualificationsFile, e);
                return 0;
            }
        }
        return updateTechnicians(records);
    }

    public Set<Integer> workmateSphere(int employeeId) {
        SchedulingResult<Set<Integer>> result = run("workmateSphere",
            () -> workmateSphereService.workmateSphere(employeeId));
        return result.value() == null ? Set.of() : result.value();
    }

    public int scheduleMaintenance(LocalDate date) {
        return count(run("scheduleMaintenance", () -> maintenanceScheduler.scheduleMaintenance(date)));
    }

    public int rerouteWaste(int facilityId, LocalDate date) {
        return count(run("rerouteWaste", () -> rerouteService.rerouteWaste(facilityId, date)));
    }

    private <T> SchedulingResult<T> run(String operation, Supplier<SchedulingResult<T>> call) {
        try (OperationContext.Scope ignored = OperationContext.open(operation)) {
            try {
                SchedulingResult<T> result = call.get();
                if (!result.isSuccess()) {
                    log.debug("{} finished with {}", operation, result.error());
                }
                return result;
            } catch (RuntimeException e) {
                log.error("{} aborted by a storage failure", operation, e);
                return SchedulingResult.failure(SchedulingError.STORAGE_FAILURE);
            }
        }
    }

    private static int count(SchedulingResult<Integer> result) {
        return result.value() == null ? 0 : result.value();
    }
}
