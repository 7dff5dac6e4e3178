package io.petitions.mover.storage;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.SqlClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProcessedLedgerTest {

    private final SignatureStore store = mock(SignatureStore.class);
    private final SqlClient client = mock(SqlClient.class);
    private final ProcessedLedger ledger = new ProcessedLedger(store);

    @Test
    void looksUpTheSecretKeyInTheLedgerTable() {
        when(store.exists(client, "validations_processed", "secret_validation_key", "abc"))
                .thenReturn(Uni.createFrom().item(true));
        when(store.exists(client, "validations_processed", "secret_validation_key", "xyz"))
                .thenReturn(Uni.createFrom().item(false));

        assertThat(ledger.isProcessed(client, "abc").await().indefinitely()).isTrue();
        assertThat(ledger.isProcessed(client, "xyz").await().indefinitely()).isFalse();
    }

    @Test
    void blankKeysAreNeverProcessed() {
        assertThat(ledger.isProcessed(client, null).await().indefinitely()).isFalse();
        assertThat(ledger.isProcessed(client, " ").await().indefinitely()).isFalse();
        verifyNoInteractions(store);
    }
}
