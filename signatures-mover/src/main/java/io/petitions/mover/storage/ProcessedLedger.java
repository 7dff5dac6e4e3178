package io.petitions.mover.storage;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.SqlClient;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Read-only view of the ledger of validations that were already processed downstream.
 */
@ApplicationScoped
public class ProcessedLedger {

    public static final String TABLE = "validations_processed";
    public static final String KEY_COLUMN = "secret_validation_key";

    final SignatureStore store;

    public ProcessedLedger(SignatureStore store) {
        this.store = store;
    }

    /**
     * @param secretKey the secret validation key of a validation
     * @return whether the ledger already holds the key; blank keys never do
     */
    public Uni<Boolean> isProcessed(SqlClient client, String secretKey) {
        if (secretKey == null || secretKey.isBlank()) {
            return Uni.createFrom().item(Boolean.FALSE);
        }
        return store.exists(client, TABLE, KEY_COLUMN, secretKey);
    }
}
