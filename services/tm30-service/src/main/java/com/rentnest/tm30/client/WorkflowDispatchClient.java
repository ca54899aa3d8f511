package com.rentnest.tm30.client;

import com.rentnest.tm30.client.dto.WorkflowDispatchRequest;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the workflow-dispatch API that starts the TM30 filing automation
 */
@FeignClient(
    name = "automation-executor",
    url = "${tm30.executor.url:https://api.github.com}",
    configuration = WorkflowDispatchClientConfig.class
)
public interface WorkflowDispatchClient {

    /**
     * Fire a repository dispatch event. The API answers 204 with no body on success
     */
    @PostMapping("/repos/{owner}/{repo}/dispatches")
    ResponseEntity<Void> dispatch(@PathVariable("owner") String owner,
                                  @PathVariable("repo") String repo,
                                  @RequestBody WorkflowDispatchRequest request);
}
