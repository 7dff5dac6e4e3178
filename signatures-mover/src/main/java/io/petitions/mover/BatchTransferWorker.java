package io.petitions.mover;

import io.petitions.mover.model.BatchResult;
import io.petitions.mover.model.MalformedItemException;
import io.petitions.mover.model.SignatureRecord;
import io.petitions.mover.model.SignatureRecordDecoder;
import io.petitions.mover.queue.QueueItem;
import io.petitions.mover.queue.WorkQueue;
import io.petitions.mover.storage.ProcessedLedger;
import io.petitions.mover.storage.SignatureStore;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.SqlClient;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drains up to a fixed number of items from one queue into one table.
 *
 * <p>Items are handled one at a time, in claim order:</p>
 * <ul>
 *     <li>saved or duplicate items are deleted from the queue;</li>
 *     <li>items with an empty or undecodable payload are deleted as well, there is nothing to retry;</li>
 *     <li>items that fail to persist stay in the queue and are released once the batch is over, so
 *     the next run picks them up again.</li>
 * </ul>
 *
 * <p>{@link #processBatch} never fails; every outcome ends up in the returned {@link BatchResult}.</p>
 */
@ApplicationScoped
public class BatchTransferWorker {

    private static final Logger LOG = Logger.getLogger(BatchTransferWorker.class);

    enum ItemOutcome {
        SAVED(true),
        SKIPPED(true),
        FAILED(true),
        MALFORMED(true),
        QUEUE_EMPTY(false),
        CLAIM_FAILED(false);

        final boolean claimed;

        ItemOutcome(boolean claimed) {
            this.claimed = claimed;
        }
    }

    final SignatureStore store;
    final ProcessedLedger ledger;
    final SignatureRecordDecoder decoder;

    public BatchTransferWorker(SignatureStore store, ProcessedLedger ledger, SignatureRecordDecoder decoder) {
        this.store = store;
        this.ledger = ledger;
        this.decoder = decoder;
    }

    /**
     * @param queue        queue to drain
     * @param target       connection to the datastore holding the target table and the ledger
     * @param route        decides the record shape, the target table and whether the ledger is consulted
     * @param maxBatchSize upper bound on claims in this batch
     * @param ctx          log correlation
     * @return counters of this batch
     */
    public Uni<BatchResult> processBatch(WorkQueue queue, SqlClient target, TransferRoute route,
                                         int maxBatchSize, LogContext ctx) {
        Counters counters = new Counters();
        List<QueueItem> toRelease = new ArrayList<>();

        if (maxBatchSize <= 0) {
            LOG.infof("Batch size is %d, leaving %s untouched%s", maxBatchSize, queue.name(), ctx.suffix());
        }
        Uni<Void> drain = maxBatchSize <= 0 ? Uni.createFrom().voidItem() : Multi.createFrom().range(0, maxBatchSize)
                .onItem().transformToUniAndConcatenate(i -> claimAndTransfer(queue, target, route, toRelease, ctx))
                .select().first(outcome -> outcome.claimed)
                .onItem().invoke(counters::record)
                .collect().asList()
                .replaceWithVoid()
                .onFailure().invoke(e -> LOG.errorf(e, "Batch on %s aborted after %d claim(s)%s",
                        queue.name(), counters.retrieved, ctx.suffix()))
                .onFailure().recoverWithNull();

        return queue.createQueue()
                .chain(() -> queue.numberOfItems())
                .onFailure().invoke(e -> LOG.errorf(e, "Could not open %s or read its depth%s", queue.name(), ctx.suffix()))
                .onFailure().recoverWithItem(0)
                .invoke(queued -> counters.queued = queued == null ? 0 : queued)
                .chain(() -> drain)
                .chain(() -> release(queue, toRelease, ctx))
                .map(v -> counters.toResult(queue.name(), route.table().tableName()))
                .invoke(result -> logSummary(result, ctx));
    }

    private Uni<ItemOutcome> claimAndTransfer(WorkQueue queue, SqlClient target, TransferRoute route,
                                              List<QueueItem> toRelease, LogContext ctx) {
        return queue.claimItem()
                .onFailure().invoke(e -> LOG.errorf(e, "Claim on %s failed, ending batch%s", queue.name(), ctx.suffix()))
                .onItem().transformToUni(item -> item == null
                        ? Uni.createFrom().item(ItemOutcome.QUEUE_EMPTY)
                        : transfer(queue, target, route, item, toRelease, ctx))
                .onFailure().recoverWithItem(ItemOutcome.CLAIM_FAILED);
    }

    private Uni<ItemOutcome> transfer(WorkQueue queue, SqlClient target, TransferRoute route,
                                      QueueItem item, List<QueueItem> toRelease, LogContext ctx) {
        // the ledger only needs the key, so duplicates are recognised before the payload is decoded
        Uni<Boolean> duplicate = route.checksLedger() && item.data() != null
                ? ledger.isProcessed(target, Objects.toString(item.data().getValue(ProcessedLedger.KEY_COLUMN), null))
                : Uni.createFrom().item(Boolean.FALSE);

        return duplicate
                .onItem().transformToUni(processed -> {
                    if (Boolean.TRUE.equals(processed)) {
                        LOG.infof("Item %s:%d was already processed, removing it without inserting%s",
                                queue.name(), item.itemId(), ctx.suffix());
                        return delete(queue, item, ctx).replaceWith(ItemOutcome.SKIPPED);
                    }
                    return decodeAndInsert(queue, target, route, item, ctx);
                })
                .onFailure().recoverWithItem(e -> {
                    LOG.errorf(e, "Item %s:%d could not be stored in %s and stays queued%s",
                            queue.name(), item.itemId(), route.table().tableName(), ctx.suffix());
                    toRelease.add(item);
                    return ItemOutcome.FAILED;
                });
    }

    private Uni<ItemOutcome> decodeAndInsert(WorkQueue queue, SqlClient target, TransferRoute route,
                                             QueueItem item, LogContext ctx) {
        SignatureRecord record;
        try {
            record = decoder.decode(route.table(), item.data());
        } catch (MalformedItemException e) {
            LOG.errorf("Discarding item %s:%d, %s%s", queue.name(), item.itemId(), e.getMessage(), ctx.suffix());
            return delete(queue, item, ctx).replaceWith(ItemOutcome.MALFORMED);
        }
        return store.insert(target, record)
                .invoke(rowId -> LOG.debugf("Item %s:%d stored as %s.%s=%d%s", queue.name(), item.itemId(),
                        route.table().tableName(), route.table().keyColumn(), rowId, ctx.suffix()))
                .chain(() -> delete(queue, item, ctx))
                .replaceWith(ItemOutcome.SAVED);
    }

    private Uni<Void> delete(WorkQueue queue, QueueItem item, LogContext ctx) {
        return queue.deleteItem(item)
                .onFailure().invoke(e -> LOG.warnf(e, "Item %s:%d could not be deleted and will be delivered again%s",
                        queue.name(), item.itemId(), ctx.suffix()))
                .onFailure().recoverWithNull();
    }

    private Uni<Void> release(WorkQueue queue, List<QueueItem> items, LogContext ctx) {
        if (items.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return Multi.createFrom().iterable(items)
                .onItem().transformToUniAndConcatenate(item -> queue.releaseItem(item)
                        .onFailure().invoke(e -> LOG.warnf(e, "Item %s:%d stays leased until its claim expires%s",
                                queue.name(), item.itemId(), ctx.suffix()))
                        .onFailure().recoverWithNull())
                .collect().asList()
                .replaceWithVoid();
    }

    private void logSummary(BatchResult r, LogContext ctx) {
        if (r.retrieved() == 0) {
            LOG.infof("Nothing to move from %s (queued=%d)%s", r.queue(), r.queued(), ctx.suffix());
        } else if (r.clean()) {
            LOG.infof("Moved %d item(s) from %s to %s: saved=%d skipped=%d queued=%d%s",
                    r.retrieved(), r.queue(), r.table(), r.saved(), r.skipped(), r.queued(), ctx.suffix());
        } else {
            LOG.errorf("Moving %d item(s) from %s to %s had errors: saved=%d skipped=%d failed=%d malformed=%d queued=%d%s",
                    r.retrieved(), r.queue(), r.table(), r.saved(), r.skipped(), r.failed(), r.malformed(),
                    r.queued(), ctx.suffix());
        }
    }

    private static final class Counters {
        int queued;
        int retrieved;
        int saved;
        int skipped;
        int failed;
        int malformed;

        void record(ItemOutcome outcome) {
            retrieved++;
            switch (outcome) {
                case SAVED -> saved++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                case MALFORMED -> malformed++;
                default -> throw new IllegalStateException("Not a claimed outcome: " + outcome);
            }
        }

        BatchResult toResult(String queue, String table) {
            return new BatchResult(queue, table, queued, retrieved, saved, skipped, failed, malformed);
        }
    }
}
