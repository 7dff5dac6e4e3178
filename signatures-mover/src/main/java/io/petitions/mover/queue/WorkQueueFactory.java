package io.petitions.mover.queue;

import io.vertx.mutiny.sqlclient.Pool;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Hands out {@link WorkQueue}s by name, all backed by the default datasource.
 */
@ApplicationScoped
public class WorkQueueFactory {

    final Pool pg;

    public WorkQueueFactory(Pool pg) {
        this.pg = pg;
    }

    @ConfigProperty(name = "app.queue.lease-seconds", defaultValue = "60")
    int leaseSeconds;

    public WorkQueue get(String name) {
        return new PgWorkQueue(pg, name, leaseSeconds);
    }
}
