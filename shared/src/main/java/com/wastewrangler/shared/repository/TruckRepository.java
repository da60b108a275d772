package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Truck;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TruckRepository extends JpaRepository<Truck, Integer> {

    List<Truck> findAllByOrderByIdAsc();
}
