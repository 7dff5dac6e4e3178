package io.petitions.mover.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.petitions.mover.storage.TargetTable;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns raw queue payloads into typed {@link SignatureRecord}s.
 *
 * <p>Fields of another known shape (a {@code signup} flag on a validation, say) are dropped.
 * Fields no target table knows, empty payloads and records without a petition id or secret
 * validation key are rejected.</p>
 */
@ApplicationScoped
public class SignatureRecordDecoder {

    static final String SIGNUP = "signup";

    private static final Set<String> KNOWN_FIELDS = Arrays.stream(TargetTable.values())
            .flatMap(t -> t.columns().stream())
            .collect(Collectors.toUnmodifiableSet());

    private final ObjectMapper om;

    public SignatureRecordDecoder(ObjectMapper om) {
        this.om = om.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public SignatureRecord decode(TargetTable table, JsonObject data) throws MalformedItemException {
        if (data == null || data.isEmpty()) {
            throw new MalformedItemException("empty payload");
        }
        Map<String, Object> fields = new LinkedHashMap<>(data.getMap());
        Class<? extends SignatureRecord> type = switch (table) {
            case PENDING_SIGNATURES -> PendingSignature.class;
            case VALIDATIONS -> ValidationRecord.class;
        };
        fields.keySet().removeIf(field -> KNOWN_FIELDS.contains(field) && !table.columns().contains(field));
        if (table.columns().contains(SIGNUP)) {
            fields.put(SIGNUP, normalizeSignup(fields.get(SIGNUP)));
        }

        SignatureRecord record;
        try {
            record = om.convertValue(fields, type);
        } catch (IllegalArgumentException e) {
            throw new MalformedItemException("payload does not match " + table.tableName() + ": " + rootMessage(e), e);
        }
        requireText(record.petitionId(), "petition_id");
        requireText(record.secretValidationKey(), "secret_validation_key");
        return record;
    }

    /**
     * Coerces the signup flag producers send as boolean, number or string into 0/1.
     */
    static int normalizeSignup(Object raw) throws MalformedItemException {
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (raw instanceof Number n) {
            return n.doubleValue() != 0 ? 1 : 0;
        }
        if (raw instanceof String s) {
            return switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "1", "true", "yes", "on" -> 1;
                case "", "0", "false", "no", "off" -> 0;
                default -> throw new MalformedItemException("signup is not a flag: '" + s + "'");
            };
        }
        throw new MalformedItemException("signup has unsupported type " + raw.getClass().getSimpleName());
    }

    private static void requireText(String value, String field) throws MalformedItemException {
        if (value == null || value.isBlank()) {
            throw new MalformedItemException(field + " is missing");
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String m = root.getMessage();
        if (m == null) return root.getClass().getSimpleName();
        return m.length() > 300 ? m.substring(0, 300) : m;
    }
}
