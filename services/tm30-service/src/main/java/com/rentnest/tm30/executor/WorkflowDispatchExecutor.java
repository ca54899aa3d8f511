package com.rentnest.tm30.executor;

import com.rentnest.tm30.client.WorkflowDispatchClient;
import com.rentnest.tm30.client.dto.WorkflowDispatchRequest;
import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.ExecutorResult;
import com.rentnest.tm30.domain.SubmissionBatch;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts the filing workflow through a repository-dispatch event
 */
@Slf4j
public class WorkflowDispatchExecutor implements AutomationExecutor {

    static final String SUBMIT_ACTION = "submit_tm30";

    private final WorkflowDispatchClient client;
    private final String eventType;
    private final String owner;
    private final String repo;

    public WorkflowDispatchExecutor(WorkflowDispatchClient client, Tm30Properties.Executor settings) {
        this.client = client;
        this.eventType = settings.getEventType();
        String repository = settings.getRepository();
        int slash = repository == null ? -1 : repository.indexOf('/');
        if (slash <= 0 || slash == repository.length() - 1) {
            throw new IllegalStateException("tm30.executor.repository must be in owner/name form, got: " + repository);
        }
        this.owner = repository.substring(0, slash);
        this.repo = repository.substring(slash + 1);
    }

    @Override
    public ExecutorResult trigger(SubmissionBatch batch) {
        WorkflowDispatchRequest request = WorkflowDispatchRequest.builder()
                .eventType(eventType)
                .clientPayload(clientPayload(batch))
                .build();
        try {
            ResponseEntity<Void> response = client.dispatch(owner, repo, request);
            if (response != null && response.getStatusCode().is2xxSuccessful()) {
                log.info("Workflow dispatch accepted for booking {} ({} guests)",
                        batch.getBookingId(), batch.getSubmissions().size());
                return ExecutorResult.accepted("Workflow dispatch accepted");
            }
            String status = response == null ? "no response" : String.valueOf(response.getStatusCode().value());
            return ExecutorResult.rejected("Workflow dispatch returned " + status);
        } catch (FeignException e) {
            log.error("Workflow dispatch rejected for booking {}: HTTP {}", batch.getBookingId(), e.status());
            return ExecutorResult.rejected("Workflow dispatch failed: HTTP " + e.status() + " " + e.contentUTF8());
        } catch (Exception e) {
            log.error("Workflow dispatch failed for booking {}: {}", batch.getBookingId(), e.getMessage());
            return ExecutorResult.rejected("Workflow dispatch failed: " + e.getMessage());
        }
    }

    @Override
    public String name() {
        return "workflow-dispatch";
    }

    Map<String, Object> clientPayload(SubmissionBatch batch) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", SUBMIT_ACTION);
        payload.put("bookingId", batch.getBookingId().toString());
        payload.put("submissions", batch.getSubmissions());
        payload.put("triggeredBy", batch.getTriggeredBy().getWireName());
        payload.put("triggeredAt", batch.getTriggeredAt().toString());
        return payload;
    }
}
