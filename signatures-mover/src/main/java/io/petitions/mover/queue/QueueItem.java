package io.petitions.mover.queue;

import io.vertx.core.json.JsonObject;

/**
 * A claimed unit of work. {@code data} may be null when a producer enqueued an empty entry.
 */
public record QueueItem(long itemId, String queueName, JsonObject data) {
}
