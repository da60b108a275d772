package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.MaintenanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface MaintenanceRecordRepository extends JpaRepository<MaintenanceRecord, Long> {

    List<MaintenanceRecord> findByMaintenanceDateBetweenOrderByMaintenanceDateAscIdAsc(LocalDate from, LocalDate to);

    List<MaintenanceRecord> findAllByOrderByTruckIdAscMaintenanceDateAsc();
}
