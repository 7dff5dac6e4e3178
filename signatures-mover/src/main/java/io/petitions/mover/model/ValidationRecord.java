package io.petitions.mover.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.petitions.mover.storage.TargetTable;

import java.util.Arrays;
import java.util.List;

public record ValidationRecord(
        @JsonProperty("secret_validation_key") String secretValidationKey,
        @JsonProperty("signature_source_api_key") String signatureSourceApiKey,
        @JsonProperty("timestamp_validated") long timestampValidated,
        @JsonProperty("timestamp_validation_close") long timestampValidationClose,
        @JsonProperty("client_ip") String clientIp,
        @JsonProperty("petition_id") String petitionId) implements SignatureRecord {

    @Override
    public TargetTable table() {
        return TargetTable.VALIDATIONS;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(
                secretValidationKey,
                signatureSourceApiKey,
                timestampValidated,
                timestampValidationClose,
                clientIp,
                petitionId);
    }
}
