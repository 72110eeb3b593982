package com.agentrunner.repository;

import com.agentrunner.model.AgentSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface AgentScheduleRepository extends JpaRepository<AgentSchedule, UUID> {

    @Query("SELECT s FROM AgentSchedule s WHERE s.active = true")
    List<AgentSchedule> findAllActive();

    @Modifying
    @Query("UPDATE AgentSchedule s SET s.lastFiredAt = :firedAt WHERE s.id = :id")
    int updateLastFiredAt(@Param("id") UUID id, @Param("firedAt") LocalDateTime firedAt);
}
