package com.agentrunner.service;

import com.agentrunner.config.SchedulerConfig;
import com.agentrunner.dto.JobRequest;
import com.agentrunner.exception.JobExecutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Runs an agent configuration by calling the agent runtime over HTTP.
 * <p>
 * The runtime answers with {@code {"success": bool, "output": ..., "error": ...}}; a body with
 * {@code success=false} or a non-2xx status is a failed execution. The RestTemplate read timeout
 * bounds how long one execution may take.
 */
@Service
@Slf4j
public class HttpJobExecutor implements JobExecutor {

    static final String EXECUTE_PATH = "/api/agents/{agentConfigId}/execute";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public HttpJobExecutor(@Qualifier(SchedulerConfig.AGENT_REST_TEMPLATE) RestTemplate restTemplate,
                           ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String execute(JobRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("scheduleId", request.scheduleId().toString());
        body.set("input", parseInput(request.inputPayload()));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(EXECUTE_PATH, new HttpEntity<>(body.toString(), headers),
                    String.class, request.agentConfigId());
        } catch (HttpStatusCodeException e) {
            throw new JobExecutionException("Agent runtime returned " + e.getStatusCode().value()
                    + " for agent " + request.agentConfigId() + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new JobExecutionException("Agent runtime call failed for agent "
                    + request.agentConfigId() + ": " + e.getMessage(), e);
        }

        String output = response.getBody() != null ? response.getBody() : "";
        rejectReportedFailure(request, output);
        log.debug("Agent {} returned {} chars for schedule {}", request.agentConfigId(), output.length(), request.scheduleId());
        return output;
    }

    private JsonNode parseInput(String inputPayload) {
        if (inputPayload == null || inputPayload.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(inputPayload);
        } catch (JsonProcessingException e) {
            throw new JobExecutionException("Invalid input payload: " + e.getOriginalMessage(), e);
        }
    }

    private void rejectReportedFailure(JobRequest request, String output) {
        JsonNode result;
        try {
            result = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            // plain-text output, nothing to inspect
            return;
        }
        if (result != null && result.isObject() && result.path("success").isBoolean() && !result.path("success").asBoolean()) {
            String error = result.path("error").asText("");
            throw new JobExecutionException(error.isBlank()
                    ? "Agent " + request.agentConfigId() + " reported a failed run"
                    : error);
        }
    }
}
