package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.TruckType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TruckTypeRepository extends JpaRepository<TruckType, String> {

    List<TruckType> findAllByOrderByCodeAsc();
}
