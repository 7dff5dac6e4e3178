package io.petitions.mover.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.petitions.mover.storage.TargetTable;

import java.util.Arrays;
import java.util.List;

public record PendingSignature(
        @JsonProperty("signature_source_api_key") String signatureSourceApiKey,
        @JsonProperty("petition_id") String petitionId,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("zip") String zip,
        @JsonProperty("email") String email,
        @JsonProperty("signup") int signup,
        @JsonProperty("timestamp_petition_close") long timestampPetitionClose,
        @JsonProperty("timestamp_validation_close") long timestampValidationClose,
        @JsonProperty("timestamp_received_new_signature") long timestampReceivedNewSignature,
        @JsonProperty("timestamp_initiated_signature_validation") long timestampInitiatedSignatureValidation,
        @JsonProperty("secret_validation_key") String secretValidationKey) implements SignatureRecord {

    @Override
    public TargetTable table() {
        return TargetTable.PENDING_SIGNATURES;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(
                signatureSourceApiKey,
                petitionId,
                firstName,
                lastName,
                zip,
                email,
                signup,
                timestampPetitionClose,
                timestampValidationClose,
                timestampReceivedNewSignature,
                timestampInitiatedSignatureValidation,
                secretValidationKey);
    }
}
