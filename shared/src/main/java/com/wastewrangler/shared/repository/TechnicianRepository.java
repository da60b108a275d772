package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Technician;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TechnicianRepository extends JpaRepository<Technician, Long> {

    List<Technician> findByTruckTypeOrderByEmployeeIdAsc(String truckType);

    boolean existsByEmployeeIdAndTruckType(Integer employeeId, String truckType);
}
