package com.wastewrangler.shared.store;

import com.wastewrangler.shared.model.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator for the schedulers.
 *
 * Every list is returned in a stable order (documented per method) because
 * the scheduling tie-break rules depend on it. Writes become visible to
 * subsequent reads on the same store immediately. Implementations signal
 * infrastructure problems with unchecked exceptions.
 */
public interface FleetStore {

    // ---- reference data ----

    Optional<Route> findRoute(int routeId);

    /** Routes carrying the given waste type, ascending by id. */
    List<Route> findRoutesByWasteType(String wasteType);

    /** Routes with the given ids, ascending by id; unknown ids are ignored. */
    List<Route> findRoutes(Collection<Integer> routeIds);

    Optional<Truck> findTruck(int truckId);

    /** All trucks, ascending by id. */
    List<Truck> findAllTrucks();

    Optional<TruckType> findTruckType(String code);

    /** All truck types, ascending by code. */
    List<TruckType> findAllTruckTypes();

    Optional<Facility> findFacility(int facilityId);

    /** Facilities accepting the given waste type, ascending by id. */
    List<Facility> findFacilitiesByWasteType(String wasteType);

    /** Employees whose full name equals {@code fullName}, ascending by id. */
    List<Employee> findEmployeesByName(String fullName);

    /** Employees holding at least one driver qualification, ascending by hire date then id. */
    List<Employee> findDriverEmployees();

    /** Every driver qualification, ascending by employee id then truck type. */
    List<Driver> findDriverQualifications();

    boolean isDriver(int employeeId);

    /** Technicians qualified for the truck type, ascending by employee id. */
    List<Technician> findTechniciansByTruckType(String truckType);

    boolean hasTechnicianQualification(int employeeId, String truckType);

    // ---- trips ----

    /** Trips with {@code from <= start < to}, ascending by start time then id. */
    List<Trip> findTripsStartingBetween(LocalDateTime from, LocalDateTime to);

    /** Trips starting on the given calendar date, ascending by start time then id. */
    default List<Trip> findTripsOn(LocalDate date) {
        return findTripsStartingBetween(date.atStartOfDay(), date.plusDays(1).atStartOfDay());
    }

    /** All trips, ascending by id. */
    List<Trip> findAllTrips();

    Trip insertTrip(Trip trip);

    /**
     * Points every listed trip at {@code facilityId} in one mutation.
     *
     * @return number of trips updated
     */
    int updateTripFacility(Collection<Long> tripIds, int facilityId);

    // ---- maintenance ----

    /** Records dated within [from, to] inclusive, ascending by date then id. */
    List<MaintenanceRecord> findMaintenanceBetween(LocalDate from, LocalDate to);

    /** All records, ascending by truck id then date. */
    List<MaintenanceRecord> findAllMaintenance();

    MaintenanceRecord insertMaintenance(MaintenanceRecord record);

    // ---- qualifications ----

    Technician insertTechnician(Technician technician);
}
