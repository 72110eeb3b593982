package com.agentrunner.service;

import com.agentrunner.model.AgentSchedule;
import com.agentrunner.repository.AgentScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaScheduleStore implements ScheduleStore {

    private final AgentScheduleRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<AgentSchedule> listEnabledSchedules() {
        return repository.findAllActive();
    }

    @Override
    @Transactional
    public void updateLastFired(UUID scheduleId, LocalDateTime firedAt) {
        int updated = repository.updateLastFiredAt(scheduleId, firedAt);
        if (updated == 0) {
            log.debug("No schedule row updated for {}, it was probably deleted", scheduleId);
        }
    }
}
