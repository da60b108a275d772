package com.wastewrangler.dispatch.service;

import com.wastewrangler.dispatch.model.DriverCandidate;
import com.wastewrangler.shared.config.SchedulingPolicy;
import com.wastewrangler.shared.model.*;
import com.wastewrangler.shared.store.FleetStore;
import com.wastewrangler.shared.util.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Works out which trucks and drivers are free for a time window.
 *
 * An existing trip blocks its truck and both of its drivers for its buffered
 * window (start - buffer, end + buffer). A maintenance record blocks its
 * truck for the whole calendar day.
 */
@Service
public class AvailabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityResolver.class);

    private final FleetStore store;
    private final SchedulingPolicy policy;

    public AvailabilityResolver(FleetStore store, SchedulingPolicy policy) {
        this.store = store;
        this.policy = policy;
    }

    /**
     * Trucks not committed during {@code window}, ascending by id. The day of
     * {@code window.start()} decides the maintenance exclusion.
     */
    public List<Truck> availableTrucks(TimeWindow window) {
        LocalDate day = window.start().toLocalDate();
        Set<Integer> busy = new HashSet<>();
        for (Trip trip : conflictingTrips(window)) {
            busy.add(trip.getTruckId());
        }
        for (MaintenanceRecord record : store.findMaintenanceBetween(day, day)) {
            busy.add(record.getTruckId());
        }
        List<Truck> free = store.findAllTrucks().stream()
            .filter(t -> !busy.contains(t.getId()))
            .collect(Collectors.toList());
        log.debug("{} trucks busy during {}, {} free", busy.size(), window, free.size());
        return free;
    }

    /**
     * Drivers not on any trip whose buffered window overlaps {@code window},
     * most senior first (hire date, then id).
     */
    public List<DriverCandidate> availableDrivers(TimeWindow window) {
        Set<Integer> busy = new HashSet<>();
        for (Trip trip : conflictingTrips(window)) {
            busy.add(trip.getDriverHigh());
            busy.add(trip.getDriverLow());
        }
        return driverCandidatesExcluding(busy);
    }

    /**
     * Drivers with no trip at all on {@code date}, most senior first.
     */
    public List<DriverCandidate> fullDayFreeDrivers(LocalDate date) {
        Set<Integer> busy = new HashSet<>();
        for (Trip trip : store.findTripsOn(date)) {
            busy.add(trip.getDriverHigh());
            busy.add(trip.getDriverLow());
        }
        return driverCandidatesExcluding(busy);
    }

    /**
     * Buffered window of an existing trip, using the route's length for its end.
     */
    public TimeWindow bufferedWindow(Trip trip, Route route) {
        return TimeWindow.of(trip.getStartTime(), policy.travelTime(route.getLengthKm()))
            .buffered(policy.buffer());
    }

    /**
     * Whether {@code truckId} has a maintenance record on {@code date}.
     */
    public boolean inMaintenance(int truckId, LocalDate date) {
        return store.findMaintenanceBetween(date, date).stream()
            .anyMatch(m -> m.getTruckId() == truckId);
    }

    /**
     * Buffered windows of the trips {@code truckId} already has that reach
     * into the workday of {@code date}, ordered by start.
     */
    public List<TimeWindow> truckCommitments(int truckId, LocalDate date) {
        TimeWindow workday = new TimeWindow(policy.workdayStart(date), policy.workdayEnd(date));
        return committedWindows(workday).entrySet().stream()
            .filter(e -> e.getKey().getTruckId() == truckId)
            .map(Map.Entry::getValue)
            .sorted(Comparator.comparing(TimeWindow::start))
            .collect(Collectors.toList());
    }

    List<Trip> conflictingTrips(TimeWindow window) {
        return new ArrayList<>(committedWindows(window).keySet());
    }

    /**
     * Trips whose buffered window overlaps {@code window}, each with that
     * buffered window. A trip on an unknown route blocks the whole of
     * {@code window}.
     */
    private Map<Trip, TimeWindow> committedWindows(TimeWindow window) {
        // a valid trip is shorter than a day, so anything further out cannot reach the window
        LocalDateTime from = window.start().minusDays(1);
        LocalDateTime to = window.end().plusDays(1);
        List<Trip> nearby = store.findTripsStartingBetween(from, to);
        Map<Trip, TimeWindow> committed = new LinkedHashMap<>();
        if (nearby.isEmpty()) {
            return committed;
        }
        Map<Integer, Route> routes = store.findRoutes(
                nearby.stream().map(Trip::getRouteId).collect(Collectors.toSet()))
            .stream()
            .collect(Collectors.toMap(Route::getId, Function.identity()));

        for (Trip trip : nearby) {
            Route route = routes.get(trip.getRouteId());
            if (route == null) {
                log.warn("Trip {} references unknown route {}; treating it as conflicting",
                    trip.getId(), trip.getRouteId());
                committed.put(trip, window);
                continue;
            }
            TimeWindow buffered = bufferedWindow(trip, route);
            if (buffered.overlaps(window)) {
                committed.put(trip, buffered);
            }
        }
        return committed;
    }

    private List<DriverCandidate> driverCandidatesExcluding(Set<Integer> busy) {
        Map<Integer, Set<String>> qualifications = new HashMap<>();
        for (Driver driver : store.findDriverQualifications()) {
            qualifications.computeIfAbsent(driver.getEmployeeId(), k -> new TreeSet<>())
                .add(driver.getTruckType());
        }
        return store.findDriverEmployees().stream()
            .filter(e -> !busy.contains(e.getId()))
            .map(e -> new DriverCandidate(e.getId(), e.getHireDate(),
                qualifications.getOrDefault(e.getId(), Set.of())))
            .collect(Collectors.toList());
    }
}
