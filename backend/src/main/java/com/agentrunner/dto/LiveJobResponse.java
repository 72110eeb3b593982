package com.agentrunner.dto;

import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LiveJobResponse {
    private String scheduleId;
    private String name;
    private Long agentConfigId;
    private String cronExpression;
    private boolean executing;
    private long skippedFires;
    private LocalDateTime lastFiredAt;
    private LocalDateTime nextFireAt;
}
