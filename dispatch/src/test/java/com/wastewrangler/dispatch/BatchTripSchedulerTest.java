package com.wastewrangler.dispatch;

import com.wastewrangler.dispatch.service.AvailabilityResolver;
import com.wastewrangler.dispatch.service.BatchTripScheduler;
import com.wastewrangler.dispatch.service.TripScheduler;
import com.wastewrangler.shared.config.SchedulingPolicy;
import com.wastewrangler.shared.model.*;
import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.store.InMemoryFleetStore;
import com.wastewrangler.shared.util.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static com.wastewrangler.dispatch.DispatchFixture.DAY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@Tag("unit")
public class BatchTripSchedulerTest {

    private final SchedulingPolicy policy = SchedulingPolicy.defaults();

    private InMemoryFleetStore store;
    private BatchTripScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = DispatchFixture.fleet();
        scheduler = newScheduler(store);
    }

    private BatchTripScheduler newScheduler(InMemoryFleetStore fleetStore) {
        return new BatchTripScheduler(fleetStore, new AvailabilityResolver(fleetStore, policy), policy);
    }

    private static List<LocalDateTime> starts(List<Trip> trips) {
        return trips.stream().map(Trip::getStartTime).collect(Collectors.toList());
    }

    private static void assertCount(SchedulingResult<Integer> result, int expected) {
        assertEquals(expected, result.value());
    }

    // ====== Packing ======

    @Test
    void test_packs_routes_in_id_order_with_buffer() {
        // routes 1, 2, 3 take 3h, 2h and 1h
        SchedulingResult<Integer> result = scheduler.scheduleTrips(1, DAY);

        assertTrue(result.isSuccess());
        assertCount(result, 3);
        List<Trip> trips = store.findTripsOn(DAY);
        assertEquals(List.of(DAY.atTime(8, 0), DAY.atTime(11, 30), DAY.atTime(14, 0)), starts(trips));
        assertEquals(List.of(1, 2, 3), trips.stream().map(Trip::getRouteId).collect(Collectors.toList()));
        for (Trip trip : trips) {
            assertEquals(1, trip.getTruckId());
            assertEquals(1, trip.getFacilityId());
            assertEquals(2, trip.getDriverHigh());
            assertEquals(1, trip.getDriverLow());
        }
    }

    @Test
    void test_route_ending_at_closing_is_not_packed() {
        InMemoryFleetStore glass = new InMemoryFleetStore();
        glass.addTruckType(new TruckType("G", "glass"));
        glass.addTruck(new Truck(1, "G", 10));
        glass.addFacility(new Facility(1, "glass"));
        glass.addRoute(new Route(11, "glass", 10));
        glass.addRoute(new Route(12, "glass", 5));
        glass.addRoute(new Route(13, "glass", 20));
        glass.addEmployee(new Employee(1, "Ada Moss", DAY.minusYears(5)));
        glass.addEmployee(new Employee(2, "Ben Ortiz", DAY.minusYears(3)));
        glass.addDriver(new Driver(1, "G"));
        glass.addDriver(new Driver(2, "G"));

        // 08:00-10:00, 10:30-11:30, then 12:00-16:00 does not end before 16:00
        SchedulingResult<Integer> result = newScheduler(glass).scheduleTrips(1, DAY);

        assertCount(result, 2);
        assertEquals(List.of(DAY.atTime(8, 0), DAY.atTime(10, 30)), starts(glass.findTripsOn(DAY)));
    }

    @Test
    void test_routes_already_run_today_are_skipped() {
        store.insertTrip(new Trip(1, 3, DAY.atTime(8, 0), 4, 5, 2));

        SchedulingResult<Integer> result = scheduler.scheduleTrips(1, DAY);

        assertCount(result, 2);
        List<Trip> packed = store.findTripsOn(DAY).stream()
            .filter(t -> t.getTruckId() == 1)
            .collect(Collectors.toList());
        assertEquals(List.of(2, 3), packed.stream().map(Trip::getRouteId).collect(Collectors.toList()));
        assertEquals(List.of(DAY.atTime(8, 0), DAY.atTime(10, 30)), starts(packed));
    }

    @Test
    void test_drivers_with_any_trip_that_day_are_not_used() {
        store.insertTrip(new Trip(6, 4, DAY.atTime(15, 0), 1, 2, 3));

        scheduler.scheduleTrips(1, DAY);

        Trip first = store.findTripsOn(DAY).get(0);
        assertEquals(1, first.getTruckId());
        assertEquals(4, first.getDriverHigh());
        assertEquals(3, first.getDriverLow());
    }

    @Test
    void test_second_call_finds_nothing_left() {
        scheduler.scheduleTrips(1, DAY);

        SchedulingResult<Integer> again = scheduler.scheduleTrips(2, DAY);

        assertCount(again, 0);
        assertEquals(SchedulingError.NO_CANDIDATE_ROUTES, again.errorKind().orElseThrow());
    }

    // ====== Trips the truck already has ======

    @Test
    void test_existing_trip_on_truck_is_worked_around() {
        store.addRoute(new Route(20, "recycling", 5));
        AvailabilityResolver availability = new AvailabilityResolver(store, policy);
        TripScheduler single = new TripScheduler(store, availability, policy);
        assertEquals(1, single.scheduleTrip(20, DAY.atTime(8, 0)).value().getTruckId());

        // route 20 holds the truck until 09:30; route 3 would end at 16:30
        SchedulingResult<Integer> result = scheduler.scheduleTrips(1, DAY);

        assertCount(result, 2);
        List<Trip> truckTrips = store.findTripsOn(DAY).stream()
            .filter(t -> t.getTruckId() == 1)
            .collect(Collectors.toList());
        assertEquals(List.of(DAY.atTime(8, 0), DAY.atTime(9, 30), DAY.atTime(13, 0)), starts(truckTrips));
        for (Trip a : truckTrips) {
            TimeWindow blocked = availability.bufferedWindow(a, store.findRoute(a.getRouteId()).orElseThrow());
            for (Trip b : truckTrips) {
                if (a == b) {
                    continue;
                }
                Route route = store.findRoute(b.getRouteId()).orElseThrow();
                TimeWindow window = TimeWindow.of(b.getStartTime(), policy.travelTime(route.getLengthKm()));
                assertFalse(blocked.overlaps(window),
                    "truck 1 double-booked: route " + a.getRouteId() + " and route " + b.getRouteId());
            }
        }
    }

    @Test
    void test_midday_trip_pushes_packing_past_it() {
        store.addRoute(new Route(20, "recycling", 5));
        store.insertTrip(new Trip(20, 1, DAY.atTime(11, 0), 4, 5, 1));

        // route 1 would run 08:00-11:00 into the 10:30-12:30 block
        SchedulingResult<Integer> result = scheduler.scheduleTrips(1, DAY);

        assertCount(result, 1);
        Trip packed = store.findTripsOn(DAY).stream()
            .filter(t -> t.getRouteId() == 1)
            .findFirst().orElseThrow();
        assertEquals(DAY.atTime(12, 30), packed.getStartTime());
    }

    @Test
    void test_truck_in_maintenance_schedules_nothing() {
        store.insertMaintenance(new MaintenanceRecord(1, 6, DAY));

        SchedulingResult<Integer> result = scheduler.scheduleTrips(1, DAY);

        assertCount(result, 0);
        assertEquals(SchedulingError.NO_AVAILABLE_TRUCK, result.errorKind().orElseThrow());
        assertTrue(store.findAllTrips().isEmpty());
    }

    // ====== Rejections ======

    @Test
    void test_unknown_truck_schedules_nothing() {
        SchedulingResult<Integer> result = scheduler.scheduleTrips(99, DAY);

        assertCount(result, 0);
        assertEquals(SchedulingError.INVALID_TRUCK, result.errorKind().orElseThrow());
        assertTrue(store.findAllTrips().isEmpty());
    }

    @Test
    void test_no_qualified_crew_schedules_nothing() {
        // only drivers 1 and 5 hold type C
        store.insertTrip(new Trip(1, 1, DAY.atTime(8, 0), 1, 5, 1));

        SchedulingResult<Integer> result = scheduler.scheduleTrips(4, DAY);

        assertCount(result, 0);
        assertEquals(SchedulingError.NO_AVAILABLE_DRIVER, result.errorKind().orElseThrow());
        assertEquals(1, store.findAllTrips().size());
    }

    @Test
    void test_no_facility_schedules_nothing() {
        store.addTruckType(new TruckType("G", "glass"));
        store.addTruck(new Truck(9, "G", 12));
        store.addDriver(new Driver(2, "G"));

        SchedulingResult<Integer> result = scheduler.scheduleTrips(9, DAY);

        assertCount(result, 0);
        assertEquals(SchedulingError.NO_FACILITY, result.errorKind().orElseThrow());
    }

    @Test
    void test_storage_failure_keeps_trips_already_placed() {
        InMemoryFleetStore failing = spy(store);
        doCallRealMethod()
            .doThrow(new DataAccessResourceFailureException("disk full"))
            .when(failing).insertTrip(any(Trip.class));

        SchedulingResult<Integer> result = newScheduler(failing).scheduleTrips(1, DAY);

        assertFalse(result.isSuccess());
        assertEquals(SchedulingError.STORAGE_FAILURE, result.errorKind().orElseThrow());
        assertCount(result, 1);
        assertEquals(1, failing.findAllTrips().size());
        verify(failing, times(2)).insertTrip(any(Trip.class));
    }
}
