package com.wastewrangler.shared;

import com.wastewrangler.shared.model.*;
import com.wastewrangler.shared.store.InMemoryFleetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class InMemoryFleetStoreTest {

    private static final LocalDate DAY = LocalDate.of(2023, 5, 4);

    private InMemoryFleetStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFleetStore();
        store.addFacility(new Facility(7, "compost"));
        store.addFacility(new Facility(3, "compost"));
        store.addFacility(new Facility(5, "glass"));
        store.addRoute(new Route(9, "compost", 5));
        store.addRoute(new Route(2, "compost", 10));
        store.addEmployee(new Employee(4, "Dana Field", LocalDate.of(2010, 1, 1)));
        store.addEmployee(new Employee(2, "Ravi Shah", LocalDate.of(2010, 1, 1)));
        store.addEmployee(new Employee(9, "Mo Chen", LocalDate.of(2001, 6, 1)));
        store.addEmployee(new Employee(1, "Lee Park", LocalDate.of(1999, 1, 1)));
        store.addDriver(new Driver(4, "A"));
        store.addDriver(new Driver(2, "A"));
        store.addDriver(new Driver(2, "B"));
        store.addDriver(new Driver(9, "C"));
    }

    @Test
    void test_facilities_ordered_by_id() {
        List<Integer> ids = store.findFacilitiesByWasteType("compost").stream()
            .map(Facility::getId).collect(Collectors.toList());

        assertEquals(List.of(3, 7), ids);
    }

    @Test
    void test_routes_ordered_by_id() {
        List<Integer> ids = store.findRoutesByWasteType("compost").stream()
            .map(Route::getId).collect(Collectors.toList());

        assertEquals(List.of(2, 9), ids);
        assertEquals(1, store.findRoutes(List.of(9, 42)).size());
    }

    @Test
    void test_driver_employees_by_seniority_then_id() {
        List<Integer> ids = store.findDriverEmployees().stream()
            .map(Employee::getId).collect(Collectors.toList());

        // employee 1 holds no driver qualification
        assertEquals(List.of(9, 2, 4), ids);
        assertTrue(store.isDriver(2));
        assertFalse(store.isDriver(1));
    }

    @Test
    void test_trips_on_day_ordered_by_start() {
        store.insertTrip(new Trip(2, 1, DAY.atTime(13, 0), 2, 4, 3));
        store.insertTrip(new Trip(9, 1, DAY.atTime(8, 0), 2, 4, 3));
        store.insertTrip(new Trip(9, 1, DAY.plusDays(1).atTime(8, 0), 2, 4, 3));

        List<Trip> trips = store.findTripsOn(DAY);

        assertEquals(2, trips.size());
        assertEquals(LocalDateTime.of(2023, 5, 4, 8, 0), trips.get(0).getStartTime());
        assertEquals(3, store.findAllTrips().size());
    }

    @Test
    void test_trip_stores_drivers_as_high_low() {
        Trip trip = store.insertTrip(new Trip(2, 1, DAY.atTime(13, 0), 2, 4, 3));

        assertEquals(4, trip.getDriverHigh());
        assertEquals(2, trip.getDriverLow());
        assertNull(trip.getVolume());
        assertNotNull(trip.getId());
    }

    @Test
    void test_update_trip_facility_moves_listed_trips_only() {
        Trip moved = store.insertTrip(new Trip(2, 1, DAY.atTime(8, 0), 2, 4, 3));
        Trip kept = store.insertTrip(new Trip(9, 1, DAY.atTime(12, 0), 2, 4, 3));

        int updated = store.updateTripFacility(List.of(moved.getId(), 999L), 7);

        assertEquals(1, updated);
        assertEquals(7, moved.getFacilityId());
        assertEquals(3, kept.getFacilityId());
    }

    @Test
    void test_maintenance_between_is_inclusive() {
        store.insertMaintenance(new MaintenanceRecord(1, 5, DAY));
        store.insertMaintenance(new MaintenanceRecord(1, 5, DAY.plusDays(10)));
        store.insertMaintenance(new MaintenanceRecord(1, 5, DAY.plusDays(11)));

        assertEquals(2, store.findMaintenanceBetween(DAY, DAY.plusDays(10)).size());
    }

    @Test
    void test_technician_qualifications() {
        store.insertTechnician(new Technician(1, "A"));
        store.insertTechnician(new Technician(9, "A"));

        assertTrue(store.hasTechnicianQualification(1, "A"));
        assertFalse(store.hasTechnicianQualification(1, "B"));
        assertEquals(List.of(1, 9), store.findTechniciansByTruckType("A").stream()
            .map(Technician::getEmployeeId).collect(Collectors.toList()));
    }

    @Test
    void test_employee_lookup_by_full_name() {
        assertEquals(1, store.findEmployeesByName("Mo Chen").size());
        assertTrue(store.findEmployeesByName("Mo").isEmpty());
    }
}
