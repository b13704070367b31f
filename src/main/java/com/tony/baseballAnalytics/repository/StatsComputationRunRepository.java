package com.tony.baseballAnalytics.repository;

import com.tony.baseballAnalytics.model.StatsComputationRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StatsComputationRunRepository extends JpaRepository<StatsComputationRun, Long> {

    List<StatsComputationRun> findTop20ByOrderByStartedAtDesc();

    List<StatsComputationRun> findByPeriodOrderByStartedAtDesc(String period);
}
