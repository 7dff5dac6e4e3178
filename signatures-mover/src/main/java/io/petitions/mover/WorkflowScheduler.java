package io.petitions.mover;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link SignaturesMoverWorkflow} on a fixed interval.
 *
 * <p>Ticks that arrive while a run is still in progress are dropped, so runs never overlap
 * within one process.</p>
 */
@ApplicationScoped
public class WorkflowScheduler {

    private static final Logger LOG = Logger.getLogger(WorkflowScheduler.class);

    final SignaturesMoverWorkflow workflow;

    public WorkflowScheduler(SignaturesMoverWorkflow workflow) {
        this.workflow = workflow;
    }

    @ConfigProperty(name = "app.schedule.interval-ms", defaultValue = "60000")
    long intervalMs;

    private final AtomicReference<Cancellable> ticks = new AtomicReference<>();

    public void start() {
        if (ticks.get() != null) {
            LOG.warn("WorkflowScheduler already running; start() ignored.");
            return;
        }
        Cancellable c = Multi.createFrom().ticks()
                .every(Duration.ofMillis(intervalMs))
                .onOverflow().drop()
                .call(t -> runOnce())
                .subscribe().with(
                        t -> {
                        },
                        e -> LOG.error("Scheduler stream failed", e)
                );
        if (!ticks.compareAndSet(null, c)) {
            c.cancel();
            return;
        }
        LOG.infof("WorkflowScheduler started, interval=%d ms", intervalMs);
    }

    public void stop() {
        Cancellable c = ticks.getAndSet(null);
        if (c != null) {
            c.cancel();
            LOG.info("WorkflowScheduler stopped.");
        }
    }

    Uni<Boolean> runOnce() {
        LogContext ctx = workflow.newContext();
        return workflow.run(ctx.jobId(), ctx.serverName(), ctx.workerName(), Map.of())
                .onFailure().invoke(e -> LOG.errorf(e, "Signatures mover run failed%s", ctx.suffix()))
                .onFailure().recoverWithItem(Boolean.FALSE);
    }
}
