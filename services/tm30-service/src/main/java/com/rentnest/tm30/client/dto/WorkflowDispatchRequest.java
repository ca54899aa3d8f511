package com.rentnest.tm30.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Repository-dispatch request that starts the filing workflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowDispatchRequest {

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("client_payload")
    private Map<String, Object> clientPayload;
}
