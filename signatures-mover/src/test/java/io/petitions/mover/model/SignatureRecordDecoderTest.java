package io.petitions.mover.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.petitions.mover.storage.TargetTable;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureRecordDecoderTest {

    private SignatureRecordDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new SignatureRecordDecoder(new ObjectMapper());
    }

    @Test
    void decodesPendingSignature() throws Exception {
        JsonObject data = new JsonObject()
                .put("petition_id", "p-1")
                .put("first_name", "Grace")
                .put("email", "grace@example.org")
                .put("signup", true)
                .put("timestamp_received_new_signature", "1700000000")
                .put("secret_validation_key", "abc");

        SignatureRecord record = decoder.decode(TargetTable.PENDING_SIGNATURES, data);

        assertThat(record).isInstanceOf(PendingSignature.class);
        PendingSignature s = (PendingSignature) record;
        assertThat(s.signup()).isEqualTo(1);
        assertThat(s.timestampReceivedNewSignature()).isEqualTo(1_700_000_000L);
        assertThat(s.lastName()).isNull();
        assertThat(s.table()).isEqualTo(TargetTable.PENDING_SIGNATURES);
    }

    @Test
    void decodesValidation() throws Exception {
        JsonObject data = new JsonObject()
                .put("secret_validation_key", "abc")
                .put("petition_id", "p-1")
                .put("client_ip", "198.51.100.7")
                .put("timestamp_validated", 1_700_000_100L);

        SignatureRecord record = decoder.decode(TargetTable.VALIDATIONS, data);

        assertThat(record).isEqualTo(new ValidationRecord("abc", null, 1_700_000_100L, 0L, "198.51.100.7", "p-1"));
    }

    @Test
    void missingSignupMeansNoSignup() throws Exception {
        JsonObject data = new JsonObject().put("petition_id", "p-1").put("secret_validation_key", "abc");

        PendingSignature s = (PendingSignature) decoder.decode(TargetTable.PENDING_SIGNATURES, data);

        assertThat(s.signup()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "true", "TRUE", "yes", "on", " 1 "})
    void truthySignupStringsBecomeOne(String raw) throws Exception {
        assertThat(SignatureRecordDecoder.normalizeSignup(raw)).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "false", "no", "off", ""})
    void falsySignupStringsBecomeZero(String raw) throws Exception {
        assertThat(SignatureRecordDecoder.normalizeSignup(raw)).isZero();
    }

    @Test
    void numericAndBooleanSignupAreNormalized() throws Exception {
        assertThat(SignatureRecordDecoder.normalizeSignup(1)).isEqualTo(1);
        assertThat(SignatureRecordDecoder.normalizeSignup(7L)).isEqualTo(1);
        assertThat(SignatureRecordDecoder.normalizeSignup(0)).isZero();
        assertThat(SignatureRecordDecoder.normalizeSignup(Boolean.FALSE)).isZero();
        assertThat(SignatureRecordDecoder.normalizeSignup(null)).isZero();
    }

    @Test
    void rejectsUnreadableSignup() {
        JsonObject data = new JsonObject()
                .put("petition_id", "p-1")
                .put("secret_validation_key", "abc")
                .put("signup", "maybe");

        assertThatThrownBy(() -> decoder.decode(TargetTable.PENDING_SIGNATURES, data))
                .isInstanceOf(MalformedItemException.class)
                .hasMessageContaining("signup");
    }

    @Test
    void rejectsUnknownFields() {
        JsonObject data = new JsonObject()
                .put("secret_validation_key", "abc")
                .put("petition_id", "p-1")
                .put("favourite_colour", "green");

        assertThatThrownBy(() -> decoder.decode(TargetTable.VALIDATIONS, data))
                .isInstanceOf(MalformedItemException.class)
                .hasMessageContaining("validations");
    }

    @Test
    void dropsPendingSignatureFieldsFromValidations() throws Exception {
        JsonObject data = new JsonObject()
                .put("secret_validation_key", "abc")
                .put("petition_id", "p-1")
                .put("client_ip", "192.0.2.1")
                .put("signup", "1")
                .put("first_name", "Grace");

        SignatureRecord record = decoder.decode(TargetTable.VALIDATIONS, data);

        assertThat(record).isInstanceOfSatisfying(ValidationRecord.class, v -> {
            assertThat(v.secretValidationKey()).isEqualTo("abc");
            assertThat(v.clientIp()).isEqualTo("192.0.2.1");
        });
    }

    @Test
    void dropsValidationFieldsFromPendingSignatures() throws Exception {
        JsonObject data = new JsonObject()
                .put("secret_validation_key", "abc")
                .put("petition_id", "p-1")
                .put("client_ip", "192.0.2.1")
                .put("timestamp_validated", 1_700_000_000L);

        SignatureRecord record = decoder.decode(TargetTable.PENDING_SIGNATURES, data);

        assertThat(record).isInstanceOf(PendingSignature.class);
        assertThat(record.table()).isEqualTo(TargetTable.PENDING_SIGNATURES);
    }

    @Test
    void rejectsEmptyPayloads() {
        assertThatThrownBy(() -> decoder.decode(TargetTable.VALIDATIONS, null))
                .isInstanceOf(MalformedItemException.class);
        assertThatThrownBy(() -> decoder.decode(TargetTable.VALIDATIONS, new JsonObject()))
                .isInstanceOf(MalformedItemException.class);
    }

    @Test
    void rejectsRecordsWithoutSecretKey() {
        JsonObject data = new JsonObject().put("petition_id", "p-1").put("secret_validation_key", "  ");

        assertThatThrownBy(() -> decoder.decode(TargetTable.VALIDATIONS, data))
                .isInstanceOf(MalformedItemException.class)
                .hasMessageContaining("secret_validation_key");
    }
}
