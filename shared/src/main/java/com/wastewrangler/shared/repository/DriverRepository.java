package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Driver;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DriverRepository extends JpaRepository<Driver, Long> {

    List<Driver> findAllByOrderByEmployeeIdAscTruckTypeAsc();

    boolean existsByEmployeeId(Integer employeeId);
}
