package com.rentnest.tm30.config;

import com.rentnest.tm30.client.WorkflowDispatchClient;
import com.rentnest.tm30.executor.AutomationExecutor;
import com.rentnest.tm30.executor.ManualHandoffExecutor;
import com.rentnest.tm30.executor.WorkflowDispatchExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Picks the automation executor once, at startup
 */
@Slf4j
@Configuration
public class AutomationExecutorConfig {

    @Bean
    public AutomationExecutor automationExecutor(Tm30Properties properties, WorkflowDispatchClient client) {
        Tm30Properties.Executor settings = properties.getExecutor();
        if (!StringUtils.hasText(settings.getToken())) {
            log.warn("tm30.executor.token not set - TM30 submissions will be returned for manual filing");
            return new ManualHandoffExecutor();
        }
        log.info("TM30 submissions dispatched to workflow repository {}", settings.getRepository());
        return new WorkflowDispatchExecutor(client, settings);
    }
}
