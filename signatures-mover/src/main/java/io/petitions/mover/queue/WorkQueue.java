package io.petitions.mover.queue;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

/**
 * A named queue with claim/delete semantics and at-least-once delivery.
 *
 * <p>A claimed item is invisible to other claimants until it is deleted, released, or its lease
 * runs out.</p>
 */
public interface WorkQueue {

    String name();

    /**
     * Makes sure the queue can accept items. Idempotent.
     */
    Uni<Void> createQueue();

    /**
     * @return the id of the new item
     */
    Uni<Long> createItem(JsonObject data);

    /**
     * @return all items of the queue, claimed or not
     */
    Uni<Integer> numberOfItems();

    /**
     * Claims the oldest available item.
     *
     * @return the claimed item, or {@code null} when nothing is available
     */
    Uni<QueueItem> claimItem();

    Uni<Void> deleteItem(QueueItem item);

    /**
     * Ends the claim on an item so the next claimant can pick it up again.
     */
    Uni<Void> releaseItem(QueueItem item);
}
