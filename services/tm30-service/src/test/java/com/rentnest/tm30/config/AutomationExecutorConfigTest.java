package com.rentnest.tm30.config;

import com.rentnest.tm30.client.WorkflowDispatchClient;
import com.rentnest.tm30.executor.AutomationExecutor;
import com.rentnest.tm30.executor.ManualHandoffExecutor;
import com.rentnest.tm30.executor.WorkflowDispatchExecutor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AutomationExecutorConfigTest {

    private final AutomationExecutorConfig config = new AutomationExecutorConfig();
    private final WorkflowDispatchClient client = mock(WorkflowDispatchClient.class);

    @Test
    void shouldFallBackToManualHandoffWithoutToken() {
        Tm30Properties properties = new Tm30Properties();

        AutomationExecutor executor = config.automationExecutor(properties, client);

        assertThat(executor).isInstanceOf(ManualHandoffExecutor.class);
    }

    @Test
    void shouldUseWorkflowDispatchWhenTokenIsSet() {
        Tm30Properties properties = new Tm30Properties();
        properties.getExecutor().setToken("token");
        properties.getExecutor().setRepository("rentnest/tm30-automation");

        AutomationExecutor executor = config.automationExecutor(properties, client);

        assertThat(executor).isInstanceOf(WorkflowDispatchExecutor.class);
        assertThat(executor.name()).isEqualTo("workflow-dispatch");
    }
}
