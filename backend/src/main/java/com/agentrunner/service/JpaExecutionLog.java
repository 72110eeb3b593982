package com.agentrunner.service;

import com.agentrunner.model.ScheduleExecution;
import com.agentrunner.repository.ScheduleExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class JpaExecutionLog implements ExecutionLog {

    private final ScheduleExecutionRepository repository;

    @Override
    @Transactional
    public UUID append(ScheduleExecution record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("Execution records are append-only: " + record.getId());
        }
        return repository.save(record).getId();
    }
}
