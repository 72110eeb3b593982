package com.agentrunner.repository;

import com.agentrunner.model.ScheduleExecution;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ScheduleExecutionRepository extends JpaRepository<ScheduleExecution, UUID> {

    List<ScheduleExecution> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId, Pageable pageable);
}
