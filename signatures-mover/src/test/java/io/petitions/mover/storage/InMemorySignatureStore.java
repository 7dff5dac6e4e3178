package io.petitions.mover.storage;

import io.petitions.mover.model.SignatureRecord;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.SqlClient;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * {@link SignatureStore} kept in memory, with injectable insert and lookup failures.
 */
public class InMemorySignatureStore implements SignatureStore {

    public final List<SignatureRecord> inserted = new ArrayList<>();
    public final List<SqlClient> clients = new ArrayList<>();
    private final Set<String> rows = new HashSet<>();
    private long nextKey = 1;

    public Predicate<SignatureRecord> failWhen = r -> false;
    public boolean failExists;

    public void addRow(String table, String column, Object value) {
        rows.add(table + "." + column + "=" + value);
    }

    @Override
    public Uni<Long> insert(SqlClient client, SignatureRecord record) {
        return Uni.createFrom().deferred(() -> {
            clients.add(client);
            if (failWhen.test(record)) {
                return Uni.createFrom().failure(new IllegalStateException(
                        "duplicate key value violates unique constraint on " + record.table().tableName()));
            }
            inserted.add(record);
            return Uni.createFrom().item(nextKey++);
        });
    }

    @Override
    public Uni<Boolean> exists(SqlClient client, String table, String column, Object value) {
        if (failExists) {
            return Uni.createFrom().failure(new IllegalStateException("relation " + table + " is locked"));
        }
        return Uni.createFrom().item(() -> {
            clients.add(client);
            return rows.contains(table + "." + column + "=" + value);
        });
    }
}
