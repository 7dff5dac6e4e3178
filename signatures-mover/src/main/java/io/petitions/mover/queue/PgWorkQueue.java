package io.petitions.mover.queue;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.Tuple;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * PostgreSQL-backed {@link WorkQueue}.
 *
 * <p>All named queues share the {@code queue} table. Claiming leases one row with
 * {@code FOR UPDATE SKIP LOCKED}; a lease that expires makes the row claimable again.</p>
 */
public class PgWorkQueue implements WorkQueue {

    private static final Logger LOG = Logger.getLogger(PgWorkQueue.class);

    private final Pool pg;
    private final String name;
    private final int leaseSeconds;

    public PgWorkQueue(Pool pg, String name, int leaseSeconds) {
        this.pg = pg;
        this.name = name;
        this.leaseSeconds = leaseSeconds;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Uni<Void> createQueue() {
        // rows of every queue live in the shared table; nothing to provision per name
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Long> createItem(JsonObject data) {
        String sql = """
                INSERT INTO queue (name, data, created_at)
                VALUES ($1, $2, now())
                RETURNING item_id
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(name, data))
                .onItem().transform(rows -> rows.iterator().next().getLong("item_id"));
    }

    @Override
    public Uni<Integer> numberOfItems() {
        return pg.preparedQuery("SELECT COUNT(*) AS n FROM queue WHERE name = $1")
                .execute(Tuple.of(name))
                .onItem().transform(rows -> rows.iterator().next().getLong("n").intValue());
    }

    @Override
    public Uni<QueueItem> claimItem() {
        String sql = """
                WITH picked AS (
                SELECT item_id
                FROM queue
                WHERE name = $1
                  AND (lease_expires_at IS NULL OR lease_expires_at < now())
                ORDER BY created_at, item_id
                FOR UPDATE SKIP LOCKED
                LIMIT 1
                )
                UPDATE queue q
                SET lease_expires_at = now() + ($2::int * interval '1 second')
                FROM picked p
                WHERE q.item_id = p.item_id
                RETURNING q.item_id, q.data;
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(name, leaseSeconds))
                .onItem().transform(rows -> {
                    if (rows.rowCount() == 0) {
                        return null;
                    }
                    Row r = rows.iterator().next();
                    Object data = r.getValue("data");
                    return new QueueItem(r.getLong("item_id"), name, data instanceof JsonObject json ? json : null);
                });
    }

    @Override
    public Uni<Void> deleteItem(QueueItem item) {
        return pg.preparedQuery("DELETE FROM queue WHERE item_id = $1")
                .execute(Tuple.of(item.itemId()))
                .onFailure().retry().withBackOff(Duration.ofMillis(10), Duration.ofMillis(100)).atMost(3)
                .onFailure().invoke(e -> LOG.errorf(e, "delete failed for %s:%d", name, item.itemId()))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> releaseItem(QueueItem item) {
        return pg.preparedQuery("UPDATE queue SET lease_expires_at = NULL WHERE item_id = $1")
                .execute(Tuple.of(item.itemId()))
                .onFailure().retry().withBackOff(Duration.ofMillis(10), Duration.ofMillis(100)).atMost(3)
                .onFailure().invoke(e -> LOG.errorf(e, "release failed for %s:%d", name, item.itemId()))
                .replaceWithVoid();
    }
}
