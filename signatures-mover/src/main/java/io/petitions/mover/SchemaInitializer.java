package io.petitions.mover;

import io.petitions.mover.storage.ProcessedLedger;
import io.petitions.mover.storage.TargetTable;
import io.quarkus.reactive.datasource.ReactiveDataSource;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Creates the queue table and the signatures tables when {@code app.schema.init} is set.
 * Every statement is idempotent.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger LOG = Logger.getLogger(SchemaInitializer.class);

    static final List<String> QUEUE_DDL = List.of("""
                    CREATE TABLE IF NOT EXISTS queue (
                        item_id BIGSERIAL PRIMARY KEY,
                        name VARCHAR(255) NOT NULL,
                        data JSONB,
                        lease_expires_at TIMESTAMPTZ,
                        created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                    )
                    """,
            "CREATE INDEX IF NOT EXISTS idx_queue_name_created ON queue(name, created_at, item_id)");

    static final List<String> SIGNATURES_DDL = List.of("""
                    CREATE TABLE IF NOT EXISTS signatures_pending_validation (
                        sid BIGSERIAL PRIMARY KEY,
                        signature_source_api_key VARCHAR(255),
                        petition_id VARCHAR(255) NOT NULL,
                        first_name VARCHAR(255),
                        last_name VARCHAR(255),
                        zip VARCHAR(10),
                        email VARCHAR(255),
                        signup INTEGER NOT NULL DEFAULT 0,
                        timestamp_petition_close BIGINT NOT NULL DEFAULT 0,
                        timestamp_validation_close BIGINT NOT NULL DEFAULT 0,
                        timestamp_received_new_signature BIGINT NOT NULL DEFAULT 0,
                        timestamp_initiated_signature_validation BIGINT NOT NULL DEFAULT 0,
                        secret_validation_key VARCHAR(255) NOT NULL
                    )
                    """, """
                    CREATE TABLE IF NOT EXISTS validations (
                        vid BIGSERIAL PRIMARY KEY,
                        secret_validation_key VARCHAR(255) NOT NULL,
                        signature_source_api_key VARCHAR(255),
                        timestamp_validated BIGINT NOT NULL DEFAULT 0,
                        timestamp_validation_close BIGINT NOT NULL DEFAULT 0,
                        client_ip VARCHAR(45),
                        petition_id VARCHAR(255) NOT NULL
                    )
                    """, """
                    CREATE TABLE IF NOT EXISTS validations_processed (
                        secret_validation_key VARCHAR(255) PRIMARY KEY,
                        petition_id VARCHAR(255),
                        timestamp_processed BIGINT NOT NULL DEFAULT 0
                    )
                    """,
            "CREATE INDEX IF NOT EXISTS idx_validations_secret_key ON validations(secret_validation_key)");

    final Pool pg;
    final Pool signaturesDb;

    public SchemaInitializer(Pool pg, @ReactiveDataSource("signatures") Pool signaturesDb) {
        this.pg = pg;
        this.signaturesDb = signaturesDb;
    }

    @ConfigProperty(name = "app.schema.init", defaultValue = "false")
    boolean enabled;

    public Uni<Void> init() {
        if (!enabled) {
            return Uni.createFrom().voidItem();
        }
        return execute(pg, QUEUE_DDL)
                .chain(() -> execute(signaturesDb, SIGNATURES_DDL))
                .invoke(() -> LOG.infof("Schema ready (version %d, ledger %s)",
                        TargetTable.SCHEMA_VERSION, ProcessedLedger.TABLE));
    }

    private Uni<Void> execute(Pool pool, List<String> statements) {
        return Multi.createFrom().iterable(statements)
                .onItem().transformToUniAndConcatenate(sql -> pool.query(sql).execute())
                .collect().asList()
                .replaceWithVoid();
    }
}
