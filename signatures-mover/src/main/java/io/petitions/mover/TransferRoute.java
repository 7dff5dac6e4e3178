package io.petitions.mover;

import io.petitions.mover.storage.TargetTable;

/**
 * The queue/table pairs drained by one workflow run, in processing order.
 */
public enum TransferRoute {

    PENDING_SIGNATURES("signatures_pending_validation_queue", TargetTable.PENDING_SIGNATURES, false),
    VALIDATIONS("validations_queue", TargetTable.VALIDATIONS, true);

    private final String queueBaseName;
    private final TargetTable table;
    private final boolean checksLedger;

    TransferRoute(String queueBaseName, TargetTable table, boolean checksLedger) {
        this.queueBaseName = queueBaseName;
        this.table = table;
        this.checksLedger = checksLedger;
    }

    public String queueName(String prefix) {
        return prefix == null ? queueBaseName : prefix + queueBaseName;
    }

    public TargetTable table() {
        return table;
    }

    /**
     * Whether items are looked up in the processed ledger before being inserted.
     */
    public boolean checksLedger() {
        return checksLedger;
    }
}
