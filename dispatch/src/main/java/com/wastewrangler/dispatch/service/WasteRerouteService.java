package com.wastewrangler.dispatch.service;

import com.wastewrangler.shared.model.Facility;
import com.wastewrangler.shared.model.Trip;
import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.store.FleetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sends a day's loads bound for one facility to the lowest-id other facility
 * taking the same waste. Every matching trip moves, or none does.
 */
@Service
public class WasteRerouteService {

    private static final Logger log = LoggerFactory.getLogger(WasteRerouteService.class);

    private final FleetStore store;

    public WasteRerouteService(FleetStore store) {
        this.store = store;
    }

    @Transactional
    public SchedulingResult<Integer> rerouteWaste(int facilityId, LocalDate date) {
        List<Trip> trips = store.findTripsOn(date).stream()
            .filter(t -> t.getFacilityId() == facilityId)
            .collect(Collectors.toList());
        if (trips.isEmpty()) {
            log.debug("No trips to facility {} on {}", facilityId, date);
            return SchedulingResult.failure(SchedulingError.NO_TRIPS_TO_REROUTE, 0);
        }

        Optional<Facility> alternate = findAlternate(facilityId);
        if (alternate.isEmpty()) {
            log.warn("No alternate facility for facility {}; {} trips on {} stay put",
                facilityId, trips.size(), date);
            return SchedulingResult.failure(SchedulingError.NO_ALTERNATE_FACILITY, 0);
        }

        List<Long> ids = trips.stream().map(Trip::getId).collect(Collectors.toList());
        store.updateTripFacility(ids, alternate.get().getId());
        log.info("Rerouted {} trips on {} from facility {} to facility {}",
            ids.size(), date, facilityId, alternate.get().getId());
        return SchedulingResult.success(ids.size());
    }

    Optional<Facility> findAlternate(int facilityId) {
        return store.findFacility(facilityId)
            .flatMap(closed -> store.findFacilitiesByWasteType(closed.getWasteType()).stream()
                .filter(f -> f.getId() != facilityId)
                .findFirst());
    }
}
