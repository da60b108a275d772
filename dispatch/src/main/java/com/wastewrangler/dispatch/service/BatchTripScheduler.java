package com.wastewrangler.dispatch.service;

import com.wastewrangler.dispatch.model.DriverCandidate;
import com.wastewrangler.dispatch.model.DriverPair;
import com.wastewrangler.shared.config.SchedulingPolicy;
import com.wastewrangler.shared.model.*;
import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.store.FleetStore;
import com.wastewrangler.shared.util.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Packs one truck's day with the routes nobody has run yet that day.
 *
 * One crew and one facility serve the whole day. Routes are taken in id
 * order from the workday start with a buffer between trips; packing stops at
 * the first route that would not end before the workday end. Each trip is
 * committed as it is placed.
 *
 * Trips the truck already has keep their place: a route whose window would
 * reach into one of their buffered windows starts when that window ends
 * instead. A truck in maintenance that day gets nothing.
 */
@Service
public class BatchTripScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchTripScheduler.class);

    private final FleetStore store;
    private final AvailabilityResolver availability;
    private final SchedulingPolicy policy;

    public BatchTripScheduler(FleetStore store, AvailabilityResolver availability, SchedulingPolicy policy) {
        this.store = store;
        this.availability = availability;
        this.policy = policy;
    }

    public SchedulingResult<Integer> scheduleTrips(int truckId, LocalDate date) {
        Optional<Truck> truck = store.findTruck(truckId);
        if (truck.isEmpty()) {
            return none(SchedulingError.INVALID_TRUCK, truckId, date);
        }
        Optional<TruckType> truckType = store.findTruckType(truck.get().getTruckType());
        if (truckType.isEmpty()) {
            return none(SchedulingError.INVALID_TRUCK, truckId, date);
        }
        if (availability.inMaintenance(truckId, date)) {
            return none(SchedulingError.NO_AVAILABLE_TRUCK, truckId, date);
        }
        String wasteType = truckType.get().getWasteType();

        List<Route> routes = unscheduledRoutes(wasteType, date);
        if (routes.isEmpty()) {
            return none(SchedulingError.NO_CANDIDATE_ROUTES, truckId, date);
        }

        List<DriverCandidate> drivers = availability.fullDayFreeDrivers(date);
        Optional<DriverPair> crew = DriverPairing.pick(drivers, truckType.get().getCode());
        if (crew.isEmpty()) {
            return none(SchedulingError.NO_AVAILABLE_DRIVER, truckId, date);
        }

        List<Facility> facilities = store.findFacilitiesByWasteType(wasteType);
        if (facilities.isEmpty()) {
            return none(SchedulingError.NO_FACILITY, truckId, date);
        }
        int facilityId = facilities.get(0).getId();

        List<TimeWindow> committed = availability.truckCommitments(truckId, date);
        LocalDateTime closing = policy.workdayEnd(date);
        LocalDateTime start = policy.workdayStart(date);
        int scheduled = 0;
        for (Route route : routes) {
            TimeWindow slot = clearOf(TimeWindow.of(start, policy.travelTime(route.getLengthKm())), committed);
            if (!slot.end().isBefore(closing)) {
                log.debug("Route {} would end at {}; truck {} is full for {}", route.getId(), slot.end(), truckId, date);
                break;
            }
            try {
                store.insertTrip(new Trip(route.getId(), truckId, slot.start(),
                    crew.get().high(), crew.get().low(), facilityId));
            } catch (RuntimeException e) {
                log.error("Failed to store trip for route {} on truck {} at {}", route.getId(), truckId, slot.start(), e);
                return SchedulingResult.failure(SchedulingError.STORAGE_FAILURE, scheduled);
            }
            scheduled++;
            start = slot.end().plus(policy.buffer());
        }
        log.info("Packed {} of {} open routes onto truck {} for {}", scheduled, routes.size(), truckId, date);
        return SchedulingResult.success(scheduled);
    }

    /**
     * Routes of the waste type with no trip yet on {@code date}, ascending by id.
     */
    List<Route> unscheduledRoutes(String wasteType, LocalDate date) {
        Set<Integer> taken = store.findTripsOn(date).stream()
            .map(Trip::getRouteId)
            .collect(Collectors.toSet());
        return store.findRoutesByWasteType(wasteType).stream()
            .filter(r -> !taken.contains(r.getId()))
            .collect(Collectors.toList());
    }

    /**
     * Earliest window of the same length, starting no earlier than
     * {@code slot}, that overlaps none of {@code committed}.
     */
    static TimeWindow clearOf(TimeWindow slot, List<TimeWindow> committed) {
        TimeWindow candidate = slot;
        boolean moved = true;
        while (moved) {
            moved = false;
            for (TimeWindow busy : committed) {
                if (busy.overlaps(candidate)) {
                    candidate = TimeWindow.of(busy.end(), candidate.length());
                    moved = true;
                }
            }
        }
        return candidate;
    }

    private SchedulingResult<Integer> none(SchedulingError error, int truckId, LocalDate date) {
        log.debug("No trips packed for truck {} on {}: {}", truckId, date, error);
        return SchedulingResult.failure(error, 0);
    }
}
