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
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Schedules a single route at a requested time.
 *
 * All checks run before the one insert, so a rejected request leaves the
 * store untouched.
 */
@Service
public class TripScheduler {

    private static final Logger log = LoggerFactory.getLogger(TripScheduler.class);

    static final Comparator<Truck> BY_CAPACITY =
        Comparator.comparingDouble(Truck::getCapacity).reversed().thenComparing(Truck::getId);

    private final FleetStore store;
    private final AvailabilityResolver availability;
    private final SchedulingPolicy policy;

    public TripScheduler(FleetStore store, AvailabilityResolver availability, SchedulingPolicy policy) {
        this.store = store;
        this.availability = availability;
        this.policy = policy;
    }

    @Transactional
    public SchedulingResult<Trip> scheduleTrip(int routeId, LocalDateTime startTime) {
        Optional<Route> maybeRoute = store.findRoute(routeId);
        if (maybeRoute.isEmpty()) {
            return reject(SchedulingError.INVALID_ROUTE, routeId, startTime);
        }
        Route route = maybeRoute.get();
        TimeWindow window = TimeWindow.of(startTime, policy.travelTime(route.getLengthKm()));

        if (!withinWorkingHours(window)) {
            return reject(SchedulingError.WORKING_HOURS_VIOLATION, routeId, startTime);
        }

        LocalDate day = startTime.toLocalDate();
        boolean alreadyScheduled = store.findTripsOn(day).stream()
            .anyMatch(t -> t.getRouteId().equals(route.getId()));
        if (alreadyScheduled) {
            return reject(SchedulingError.DUPLICATE_ROUTE_SAME_DAY, routeId, startTime);
        }

        List<Facility> facilities = store.findFacilitiesByWasteType(route.getWasteType());
        if (facilities.isEmpty()) {
            return reject(SchedulingError.NO_FACILITY, routeId, startTime);
        }
        Facility facility = facilities.get(0);

        Optional<Truck> truck = selectTruck(window, route.getWasteType());
        if (truck.isEmpty()) {
            return reject(SchedulingError.NO_AVAILABLE_TRUCK, routeId, startTime);
        }

        List<DriverCandidate> drivers = availability.availableDrivers(window);
        Optional<DriverPair> crew = DriverPairing.pick(drivers, truck.get().getTruckType());
        if (crew.isEmpty()) {
            return reject(SchedulingError.NO_AVAILABLE_DRIVER, routeId, startTime);
        }

        Trip trip = store.insertTrip(new Trip(route.getId(), truck.get().getId(), startTime,
            crew.get().high(), crew.get().low(), facility.getId()));
        log.info("Scheduled route {} at {} on truck {} with drivers {}/{} to facility {}",
            route.getId(), startTime, trip.getTruckId(), trip.getDriverHigh(), trip.getDriverLow(),
            trip.getFacilityId());
        return SchedulingResult.success(trip);
    }

    /**
     * Start no earlier than the workday start and no later than its end, and
     * finish by the workday end.
     */
    boolean withinWorkingHours(TimeWindow window) {
        LocalDate day = window.start().toLocalDate();
        LocalDateTime open = policy.workdayStart(day);
        LocalDateTime close = policy.workdayEnd(day);
        return !window.start().isBefore(open)
            && !window.start().isAfter(close)
            && !window.end().isAfter(close);
    }

    /**
     * Largest free truck able to carry {@code wasteType}; lowest id on equal capacity.
     */
    Optional<Truck> selectTruck(TimeWindow window, String wasteType) {
        Map<String, String> wasteByTruckType = store.findAllTruckTypes().stream()
            .collect(Collectors.toMap(TruckType::getCode, TruckType::getWasteType));
        return availability.availableTrucks(window).stream()
            .filter(t -> wasteType.equals(wasteByTruckType.get(t.getTruckType())))
            .min(BY_CAPACITY);
    }

    private SchedulingResult<Trip> reject(SchedulingError error, int routeId, LocalDateTime startTime) {
        log.debug("Route {} at {} not scheduled: {}", routeId, startTime, error);
        return SchedulingResult.failure(error);
    }
}
