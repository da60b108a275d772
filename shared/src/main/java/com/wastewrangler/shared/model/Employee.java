package com.wastewrangler.shared.model;

import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "employees")
public class Employee {

    @Id
    private Integer id;

    @Column(nullable = false, unique = true, length = 200)
    private String name;

    @Column(name = "hire_date", nullable = false)
    private LocalDate hireDate;

    public Employee() {}

    public Employee(Integer id, String name, LocalDate hireDate) {
        this.id = id;
        this.name = name;
        this.hireDate = hireDate;
    }

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public LocalDate getHireDate() { return hireDate; }
    public void setHireDate(LocalDate hireDate) { this.hireDate = hireDate; }
}
