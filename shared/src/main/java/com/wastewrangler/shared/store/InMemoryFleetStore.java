package com.wastewrangler.shared.store;

import com.wastewrangler.shared.model.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory fleet store keyed by id.
 *
 * Backs the unit tests and the {@code memory} store profile, and doubles as
 * the executable contract for the ordering rules of {@link FleetStore}.
 * Assumes a single writer per scheduling call.
 */
public class InMemoryFleetStore implements FleetStore {

    private static final Comparator<Employee> BY_SENIORITY =
        Comparator.comparing(Employee::getHireDate).thenComparing(Employee::getId);

    private static final Comparator<Trip> BY_START =
        Comparator.comparing(Trip::getStartTime).thenComparing(Trip::getId);

    private final Map<Integer, Route> routes = new ConcurrentSkipListMap<>();
    private final Map<String, TruckType> truckTypes = new ConcurrentSkipListMap<>();
    private final Map<Integer, Truck> trucks = new ConcurrentSkipListMap<>();
    private final Map<Integer, Employee> employees = new ConcurrentSkipListMap<>();
    private final Map<Integer, Facility> facilities = new ConcurrentSkipListMap<>();
    private final Map<Long, Driver> drivers = new ConcurrentSkipListMap<>();
    private final Map<Long, Technician> technicians = new ConcurrentSkipListMap<>();
    private final Map<Long, Trip> trips = new ConcurrentSkipListMap<>();
    private final Map<Long, MaintenanceRecord> maintenance = new ConcurrentSkipListMap<>();

    private final AtomicLong sequence = new AtomicLong(0);

    // ---- loading reference data ----

    public void addRoute(Route route) {
        routes.put(route.getId(), route);
    }

    public void addTruckType(TruckType truckType) {
        truckTypes.put(truckType.getCode(), truckType);
    }

    public void addTruck(Truck truck) {
        trucks.put(truck.getId(), truck);
    }

    public void addEmployee(Employee employee) {
        employees.put(employee.getId(), employee);
    }

    public void addFacility(Facility facility) {
        facilities.put(facility.getId(), facility);
    }

    public Driver addDriver(Driver driver) {
        driver.setId(sequence.incrementAndGet());
        drivers.put(driver.getId(), driver);
        return driver;
    }

    // ---- reference data ----

    @Override
    public Optional<Route> findRoute(int routeId) {
        return Optional.ofNullable(routes.get(routeId));
    }

    @Override
    public List<Route> findRoutesByWasteType(String wasteType) {
        return routes.values().stream()
            .filter(r -> r.getWasteType().equals(wasteType))
            .collect(Collectors.toList());
    }

    @Override
    public List<Route> findRoutes(Collection<Integer> routeIds) {
        return new TreeSet<>(routeIds).stream()
            .map(routes::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Truck> findTruck(int truckId) {
        return Optional.ofNullable(trucks.get(truckId));
    }

    @Override
    public List<Truck> findAllTrucks() {
        return new ArrayList<>(trucks.values());
    }

    @Override
    public Optional<TruckType> findTruckType(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(truckTypes.get(code));
    }

    @Override
    public List<TruckType> findAllTruckTypes() {
        return new ArrayList<>(truckTypes.values());
    }

    @Override
    public Optional<Facility> findFacility(int facilityId) {
        return Optional.ofNullable(facilities.get(facilityId));
    }

    @Override
    public List<Facility> findFacilitiesByWasteType(String wasteType) {
        return facilities.values().stream()
            .filter(f -> f.getWasteType().equals(wasteType))
            .collect(Collectors.toList());
    }

    @Override
    public List<Employee> findEmployeesByName(String fullName) {
        return employees.values().stream()
            .filter(e -> e.getName().equals(fullName))
            .collect(Collectors.toList());
    }

    @Override
    public List<Employee> findDriverEmployees() {
        Set<Integer> driverIds = drivers.values().stream()
            .map(Driver::getEmployeeId)
            .collect(Collectors.toSet());
        return driverIds.stream()
            .map(employees::get)
            .filter(Objects::nonNull)
            .sorted(BY_SENIORITY)
            .collect(Collectors.toList());
    }

    @Override
    public List<Driver> findDriverQualifications() {
        return drivers.values().stream()
            .sorted(Comparator.comparing(Driver::getEmployeeId).thenComparing(Driver::getTruckType))
            .collect(Collectors.toList());
    }

    @Override
    public boolean isDriver(int employeeId) {
        return drivers.values().stream().anyMatch(d -> d.getEmployeeId() == employeeId);
    }

    @Override
    public List<Technician> findTechniciansByTruckType(String truckType) {
        return technicians.values().stream()
            .filter(t -> t.getTruckType().equals(truckType))
            .sorted(Comparator.comparing(Technician::getEmployeeId))
            .collect(Collectors.toList());
    }

    @Override
    public boolean hasTechnicianQualification(int employeeId, String truckType) {
        return technicians.values().stream()
            .anyMatch(t -> t.getEmployeeId() == employeeId && t.getTruckType().equals(truckType));
    }

    // ---- trips ----

    @Override
    public List<Trip> findTripsStartingBetween(LocalDateTime from, LocalDateTime to) {
        return trips.values().stream()
            .filter(t -> !t.getStartTime().isBefore(from) && t.getStartTime().isBefore(to))
            .sorted(BY_START)
            .collect(Collectors.toList());
    }

    @Override
    public List<Trip> findAllTrips() {
        return new ArrayList<>(trips.values());
    }

    @Override
    public Trip insertTrip(Trip trip) {
        trip.setId(sequence.incrementAndGet());
        trips.put(trip.getId(), trip);
        return trip;
    }

    @Override
    public int updateTripFacility(Collection<Long> tripIds, int facilityId) {
        List<Trip> matched = tripIds.stream()
            .map(trips::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        matched.forEach(t -> t.setFacilityId(facilityId));
        return matched.size();
    }

    // ---- maintenance ----

    @Override
    public List<MaintenanceRecord> findMaintenanceBetween(LocalDate from, LocalDate to) {
        return maintenance.values().stream()
            .filter(m -> !m.getMaintenanceDate().isBefore(from) && !m.getMaintenanceDate().isAfter(to))
            .sorted(Comparator.comparing(MaintenanceRecord::getMaintenanceDate)
                .thenComparing(MaintenanceRecord::getId))
            .collect(Collectors.toList());
    }

    @Override
    public List<MaintenanceRecord> findAllMaintenance() {
        return maintenance.values().stream()
            .sorted(Comparator.comparing(MaintenanceRecord::getTruckId)
                .thenComparing(MaintenanceRecord::getMaintenanceDate))
            .collect(Collectors.toList());
    }

    @Override
    public MaintenanceRecord insertMaintenance(MaintenanceRecord record) {
        record.setId(sequence.incrementAndGet());
        maintenance.put(record.getId(), record);
        return record;
    }

    // ---- qualifications ----

    @Override
    public Technician insertTechnician(Technician technician) {
        technician.setId(sequence.incrementAndGet());
        technicians.put(technician.getId(), technician);
        return technician;
    }
}
