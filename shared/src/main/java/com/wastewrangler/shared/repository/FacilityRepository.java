package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Facility;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FacilityRepository extends JpaRepository<Facility, Integer> {

    List<Facility> findByWasteTypeOrderByIdAsc(String wasteType);
}
