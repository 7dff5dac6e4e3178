package io.petitions.mover.model;

import io.petitions.mover.storage.TargetTable;

import java.util.List;

/**
 * A queue payload decoded into one of the known record shapes.
 *
 * <p>Each shape is bound to exactly one {@link TargetTable}; {@link #values()} lists the column
 * values in the order of {@link TargetTable#columns()}.</p>
 */
public sealed interface SignatureRecord permits PendingSignature, ValidationRecord {

    TargetTable table();

    String petitionId();

    String secretValidationKey();

    List<Object> values();
}
