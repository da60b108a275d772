package com.wastewrangler.shared.store;

import com.wastewrangler.shared.model.*;
import com.wastewrangler.shared.repository.*;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link FleetStore} over the relational schema via Spring Data JPA.
 *
 * Write methods join the caller's transaction when there is one, so the
 * all-or-nothing schedulers roll back as a unit while the incremental ones
 * commit each write on its own.
 */
@Repository
@ConditionalOnProperty(name = "wastewrangler.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaFleetStore implements FleetStore {

    private final RouteRepository routeRepository;
    private final TruckRepository truckRepository;
    private final TruckTypeRepository truckTypeRepository;
    private final FacilityRepository facilityRepository;
    private final EmployeeRepository employeeRepository;
    private final DriverRepository driverRepository;
    private final TechnicianRepository technicianRepository;
    private final TripRepository tripRepository;
    private final MaintenanceRecordRepository maintenanceRepository;

    public JpaFleetStore(RouteRepository routeRepository,
                         TruckRepository truckRepository,
                         TruckTypeRepository truckTypeRepository,
                         FacilityRepository facilityRepository,
                         EmployeeRepository employeeRepository,
                         DriverRepository driverRepository,
                         TechnicianRepository technicianRepository,
                         TripRepository tripRepository,
                         MaintenanceRecordRepository maintenanceRepository) {
        this.routeRepository = routeRepository;
        this.truckRepository = truckRepository;
        this.truckTypeRepository = truckTypeRepository;
        this.facilityRepository = facilityRepository;
        this.employeeRepository = employeeRepository;
        this.driverRepository = driverRepository;
        this.technicianRepository = technicianRepository;
        this.tripRepository = tripRepository;
        this.maintenanceRepository = maintenanceRepository;
    }

    @Override
    public Optional<Route> findRoute(int routeId) {
        return routeRepository.findById(routeId);
    }

    @Override
    public List<Route> findRoutesByWasteType(String wasteType) {
        return routeRepository.findByWasteTypeOrderByIdAsc(wasteType);
    }

    @Override
    public List<Route> findRoutes(Collection<Integer> routeIds) {
        if (routeIds.isEmpty()) {
            return List.of();
        }
        return routeRepository.findByIdInOrderByIdAsc(routeIds);
    }

    @Override
    public Optional<Truck> findTruck(int truckId) {
        return truckRepository.findById(truckId);
    }

    @Override
    public List<Truck> findAllTrucks() {
        return truckRepository.findAllByOrderByIdAsc();
    }

    @Override
    public Optional<TruckType> findTruckType(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return truckTypeRepository.findById(code);
    }

    @Override
    public List<TruckType> findAllTruckTypes() {
        return truckTypeRepository.findAllByOrderByCodeAsc();
    }

    @Override
    public Optional<Facility> findFacility(int facilityId) {
        return facilityRepository.findById(facilityId);
    }

    @Override
    public List<Facility> findFacilitiesByWasteType(String wasteType) {
        return facilityRepository.findByWasteTypeOrderByIdAsc(wasteType);
    }

    @Override
    public List<Employee> findEmployeesByName(String fullName) {
        return employeeRepository.findByNameOrderByIdAsc(fullName);
    }

    @Override
    public List<Employee> findDriverEmployees() {
        return employeeRepository.findDriversBySeniority();
    }

    @Override
    public List<Driver> findDriverQualifications() {
        return driverRepository.findAllByOrderByEmployeeIdAscTruckTypeAsc();
    }

    @Override
    public boolean isDriver(int employeeId) {
        return driverRepository.existsByEmployeeId(employeeId);
    }

    @Override
    public List<Technician> findTechniciansByTruckType(String truckType) {
        return technicianRepository.findByTruckTypeOrderByEmployeeIdAsc(truckType);
    }

    @Override
    public boolean hasTechnicianQualification(int employeeId, String truckType) {
        return technicianRepository.existsByEmployeeIdAndTruckType(employeeId, truckType);
    }

    @Override
    public List<Trip> findTripsStartingBetween(LocalDateTime from, LocalDateTime to) {
        return tripRepository.findStartingBetween(from, to);
    }

    @Override
    public List<Trip> findAllTrips() {
        return tripRepository.findAllByOrderByIdAsc();
    }

    @Override
    @Transactional
    public Trip insertTrip(Trip trip) {
        return tripRepository.save(trip);
    }

    @Override
    @Transactional
    public int updateTripFacility(Collection<Long> tripIds, int facilityId) {
        if (tripIds.isEmpty()) {
            return 0;
        }
        return tripRepository.updateFacility(tripIds, facilityId);
    }

    @Override
    public List<MaintenanceRecord> findMaintenanceBetween(LocalDate from, LocalDate to) {
        return maintenanceRepository.findByMaintenanceDateBetweenOrderByMaintenanceDateAscIdAsc(from, to);
    }

    @Override
    public List<MaintenanceRecord> findAllMaintenance() {
        return maintenanceRepository.findAllByOrderByTruckIdAscMaintenanceDateAsc();
    }

    @Override
    @Transactional
    public MaintenanceRecord insertMaintenance(MaintenanceRecord record) {
        return maintenanceRepository.save(record);
    }

    @Override
    @Transactional
    public Technician insertTechnician(Technician technician) {
        return technicianRepository.save(technician);
    }
}
