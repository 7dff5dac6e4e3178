package io.petitions.mover;

import io.petitions.mover.model.BatchResult;
import io.petitions.mover.queue.WorkQueueFactory;
import io.quarkus.reactive.datasource.ReactiveDataSource;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One run of the signatures mover: every {@link TransferRoute} is drained once, in order.
 *
 * <p>Target tables and the processed ledger live on the {@code signatures} datasource; that pool
 * is handed to the worker explicitly for every batch.</p>
 */
@ApplicationScoped
public class SignaturesMoverWorkflow {

    private static final Logger LOG = Logger.getLogger(SignaturesMoverWorkflow.class);

    final WorkQueueFactory queues;
    final BatchTransferWorker worker;
    final Pool signaturesDb;

    public SignaturesMoverWorkflow(WorkQueueFactory queues,
                                   BatchTransferWorker worker,
                                   @ReactiveDataSource("signatures") Pool signaturesDb) {
        this.queues = queues;
        this.worker = worker;
        this.signaturesDb = signaturesDb;
    }

    @ConfigProperty(name = "app.batch-size", defaultValue = "1000")
    int batchSize;

    @ConfigProperty(name = "app.queue.prefix")
    Optional<String> queuePrefix = Optional.empty();

    @ConfigProperty(name = "app.server-name", defaultValue = "localhost")
    String serverName;

    @ConfigProperty(name = "app.worker-name", defaultValue = "signatures-mover")
    String workerName;

    /**
     * Runs every route once.
     *
     * @param jobId      id of the job run, for log correlation
     * @param serverName host the job runs on, may be null
     * @param workerName worker that picked up the job, may be null
     * @param options    reserved, currently ignored
     * @return always {@code true}; per-item failures only show up in the logs and the queue
     */
    public Uni<Boolean> run(String jobId, String serverName, String workerName, Map<String, String> options) {
        return transfer(new LogContext(jobId, serverName, workerName), options)
                .replaceWith(Boolean.TRUE);
    }

    /**
     * Same as {@link #run} but hands back the counters of every route.
     */
    public Uni<List<BatchResult>> transfer(LogContext ctx, Map<String, String> options) {
        if (options != null && !options.isEmpty()) {
            LOG.debugf("Ignoring workflow options %s%s", options.keySet(), ctx.suffix());
        }
        LOG.infof("Signatures mover started, batch size %d%s", batchSize, ctx.suffix());
        long started = System.nanoTime();
        return Multi.createFrom().items(TransferRoute.values())
                .onItem().transformToUniAndConcatenate(route ->
                        worker.processBatch(queues.get(queueName(route)), signaturesDb, route, batchSize, ctx))
                .collect().asList()
                .invoke(results -> LOG.infof("Signatures mover finished %d route(s) in %d ms%s",
                        results.size(), (System.nanoTime() - started) / 1_000_000, ctx.suffix()));
    }

    public String queueName(TransferRoute route) {
        return route.queueName(queuePrefix.orElse(""));
    }

    public LogContext newContext() {
        return LogContext.newJob(serverName, workerName);
    }
}
