package io.petitions.mover;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowSchedulerTest {

    private final SignaturesMoverWorkflow workflow = mock(SignaturesMoverWorkflow.class);
    private final LogContext ctx = new LogContext("job-42", "server-a", "worker-b");

    @Test
    void runOnceUsesAFreshContext() {
        when(workflow.newContext()).thenReturn(ctx);
        when(workflow.run("job-42", "server-a", "worker-b", Map.of())).thenReturn(Uni.createFrom().item(true));

        Boolean ok = new WorkflowScheduler(workflow).runOnce().await().indefinitely();

        assertThat(ok).isTrue();
        verify(workflow).run("job-42", "server-a", "worker-b", Map.of());
    }

    @Test
    void runOnceSurvivesAFailingRun() {
        when(workflow.newContext()).thenReturn(ctx);
        when(workflow.run("job-42", "server-a", "worker-b", Map.of()))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));

        Boolean ok = new WorkflowScheduler(workflow).runOnce().await().indefinitely();

        assertThat(ok).isFalse();
    }
}
