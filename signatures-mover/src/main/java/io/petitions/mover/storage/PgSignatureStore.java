package io.petitions.mover.storage;

import io.petitions.mover.model.SignatureRecord;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowIterator;
import io.vertx.mutiny.sqlclient.SqlClient;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.regex.Pattern;

/**
 * PostgreSQL-backed {@link SignatureStore}.
 */
@ApplicationScoped
public class PgSignatureStore implements SignatureStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    @Override
    public Uni<Long> insert(SqlClient client, SignatureRecord record) {
        TargetTable table = record.table();
        Tuple params;
        try {
            params = table.bind(record);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }
        return client.preparedQuery(table.insertSql())
                .execute(params)
                .onItem().transform(rows -> {
                    RowIterator<Row> it = rows.iterator();
                    if (!it.hasNext()) {
                        throw new IllegalStateException("Insert into " + table.tableName() + " returned no key");
                    }
                    return it.next().getLong(table.keyColumn());
                });
    }

    @Override
    public Uni<Boolean> exists(SqlClient client, String table, String column, Object value) {
        String sql;
        try {
            sql = existsSql(table, column);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }
        return client.preparedQuery(sql)
                .execute(Tuple.of(value))
                .onItem().transform(rows -> rows.rowCount() > 0);
    }

    static String existsSql(String table, String column) {
        return "SELECT 1 FROM " + identifier(table) + " WHERE " + identifier(column) + " = $1 LIMIT 1";
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
        return name;
    }
}
