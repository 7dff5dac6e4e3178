package io.petitions.mover.storage;

import io.petitions.mover.model.SignatureRecord;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.SqlClient;

/**
 * Writes decoded records into their target table and answers existence questions.
 *
 * <p>Every call names the connection it runs on; there is no implicit "current" database.</p>
 */
public interface SignatureStore {

    /**
     * Inserts the record into {@link SignatureRecord#table()}.
     *
     * @return the generated row id; fails on constraint or connection errors
     */
    Uni<Long> insert(SqlClient client, SignatureRecord record);

    /**
     * @return whether at least one row of {@code table} has {@code column = value}
     */
    Uni<Boolean> exists(SqlClient client, String table, String column, Object value);
}
