package io.petitions.mover.storage;

import io.petitions.mover.model.SignatureRecord;
import io.vertx.mutiny.sqlclient.Tuple;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed column mapping of the tables queue items are moved into.
 *
 * <p>Bump {@link #SCHEMA_VERSION} together with the DDL in
 * {@link io.petitions.mover.SchemaInitializer} whenever a column list changes.</p>
 */
public enum TargetTable {

    PENDING_SIGNATURES("signatures_pending_validation", "sid", List.of(
            "signature_source_api_key",
            "petition_id",
            "first_name",
            "last_name",
            "zip",
            "email",
            "signup",
            "timestamp_petition_close",
            "timestamp_validation_close",
            "timestamp_received_new_signature",
            "timestamp_initiated_signature_validation",
            "secret_validation_key")),

    VALIDATIONS("validations", "vid", List.of(
            "secret_validation_key",
            "signature_source_api_key",
            "timestamp_validated",
            "timestamp_validation_close",
            "client_ip",
            "petition_id"));

    public static final int SCHEMA_VERSION = 1;

    private final String tableName;
    private final String keyColumn;
    private final List<String> columns;
    private final String insertSql;

    TargetTable(String tableName, String keyColumn, List<String> columns) {
        if (new HashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column in " + tableName);
        }
        this.tableName = tableName;
        this.keyColumn = keyColumn;
        this.columns = columns;
        this.insertSql = "INSERT INTO " + tableName
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + IntStream.rangeClosed(1, columns.size())
                .mapToObj(i -> "$" + i)
                .collect(Collectors.joining(", ")) + ")"
                + " RETURNING " + keyColumn;
    }

    public String tableName() {
        return tableName;
    }

    public String keyColumn() {
        return keyColumn;
    }

    public List<String> columns() {
        return columns;
    }

    public String insertSql() {
        return insertSql;
    }

    /**
     * Binds a record's values positionally for {@link #insertSql()}.
     *
     * @throws IllegalArgumentException if the record belongs to another table or its arity drifted
     */
    public Tuple bind(SignatureRecord record) {
        if (record.table() != this) {
            throw new IllegalArgumentException(record.getClass().getSimpleName() + " cannot be stored in " + tableName);
        }
        List<Object> values = record.values();
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " values for " + tableName
                    + " but got " + values.size());
        }
        return Tuple.from(values);
    }
}
