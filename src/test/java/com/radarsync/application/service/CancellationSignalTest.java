package com.radarsync.application.service;

import com.radarsync.core.exception.ReconciliationCancelledException;
import com.radarsync.core.model.ReconciliationPhase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationSignalTest {

    @Test
    void throwsOnlyAfterCancel() {
        CancellationSignal signal = CancellationSignal.create();

        assertThatCode(() -> signal.throwIfCancelled(ReconciliationPhase.DIFFING)).doesNotThrowAnyException();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThatThrownBy(() -> signal.throwIfCancelled(ReconciliationPhase.DIFFING))
                .isInstanceOf(ReconciliationCancelledException.class)
                .hasMessageContaining("DIFFING");
    }

    @Test
    void sharedNoopSignalCannotBeCancelled() {
        assertThatThrownBy(() -> CancellationSignal.none().cancel())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(CancellationSignal.none().isCancelled()).isFalse();
    }
}
