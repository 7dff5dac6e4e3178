package io.petitions.mover.api;

import io.petitions.mover.LogContext;
import io.petitions.mover.SignaturesMoverWorkflow;
import io.petitions.mover.TransferRoute;
import io.petitions.mover.model.BatchResult;
import io.petitions.mover.queue.WorkQueueFactory;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: trigger a run outside the schedule and look at queue depths.
 */
@Path("/signatures-mover")
@Produces(MediaType.APPLICATION_JSON)
public class MoverResource {

    final SignaturesMoverWorkflow workflow;
    final WorkQueueFactory queues;

    public MoverResource(SignaturesMoverWorkflow workflow, WorkQueueFactory queues) {
        this.workflow = workflow;
        this.queues = queues;
    }

    public record RunReport(String jobId, List<BatchResult> results) {
    }

    public record QueueDepth(String route, String queue, int items) {
    }

    @POST
    @Path("/run")
    public Uni<RunReport> run() {
        LogContext ctx = workflow.newContext();
        return workflow.transfer(ctx, Map.of())
                .map(results -> new RunReport(ctx.jobId(), results));
    }

    @GET
    @Path("/queues")
    public Uni<List<QueueDepth>> queues() {
        return Multi.createFrom().items(TransferRoute.values())
                .onItem().transformToUniAndConcatenate(route -> {
                    String name = workflow.queueName(route);
                    return queues.get(name).numberOfItems()
                            .map(n -> new QueueDepth(route.name(), name, n));
                })
                .collect().asList();
    }
}
