package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Route;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RouteRepository extends JpaRepository<Route, Integer> {

    List<Route> findByWasteTypeOrderByIdAsc(String wasteType);

    List<Route> findByIdInOrderByIdAsc(Collection<Integer> ids);
}
