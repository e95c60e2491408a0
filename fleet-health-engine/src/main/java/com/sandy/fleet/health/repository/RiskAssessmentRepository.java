package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.RiskAssessment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RiskAssessmentRepository extends JpaRepository<RiskAssessment, Long> {
    Optional<RiskAssessment> findTopByForkliftIdOrderByAssessmentDateDescIdDesc(String forkliftId);
    List<RiskAssessment> findByForkliftIdOrderByAssessmentDateDescIdDesc(String forkliftId);
    long countByForkliftId(String forkliftId);
}
