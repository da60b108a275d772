package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Employee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Integer> {

    List<Employee> findByNameOrderByIdAsc(String name);

    @Query("SELECT e FROM Employee e WHERE e.id IN (SELECT d.employeeId FROM Driver d) "
        + "ORDER BY e.hireDate ASC, e.id ASC")
    List<Employee> findDriversBySeniority();
}
