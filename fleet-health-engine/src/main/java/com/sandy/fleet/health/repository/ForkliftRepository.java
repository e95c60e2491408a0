package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.Forklift;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ForkliftRepository extends JpaRepository<Forklift, String> {
    List<Forklift> findByStatusNotOrderByIdAsc(Forklift.Status status);
    List<Forklift> findByStatusInOrderByIdAsc(Collection<Forklift.Status> statuses);
    List<Forklift> findByRiskScoreGreaterThanEqualOrderByRiskScoreDesc(Integer minScore);
}
