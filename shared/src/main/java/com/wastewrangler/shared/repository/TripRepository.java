package com.wastewrangler.shared.repository;

import com.wastewrangler.shared.model.Trip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface TripRepository extends JpaRepository<Trip, Long> {

    @Query("SELECT t FROM Trip t WHERE t.startTime >= :from AND t.startTime < :to "
        + "ORDER BY t.startTime ASC, t.id ASC")
    List<Trip> findStartingBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    List<Trip> findAllByOrderByIdAsc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trip t SET t.facilityId = :facilityId WHERE t.id IN :ids")
    int updateFacility(@Param("ids") Collection<Long> ids, @Param("facilityId") Integer facilityId);
}
