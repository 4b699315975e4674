package com.z254.butterfly.conclave.health;

import com.z254.butterfly.conclave.registry.Registry;
import com.z254.butterfly.conclave.store.SharedStore;
import com.z254.butterfly.conclave.store.StoreException;
import com.z254.butterfly.conclave.support.ConclaveJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ConclaveHealthIndicator.
 */
@ExtendWith(MockitoExtension.class)
class ConclaveHealthIndicatorTest {

    @Mock
    private SharedStore store;

    @Test
    void shouldReportDownWhenStoreUnreachable() {
        when(store.isAvailable()).thenReturn(false);
        when(store.backend()).thenReturn("redis");
        ConclaveHealthIndicator indicator = new ConclaveHealthIndicator(store,
                new Registry(store, ConclaveJson.mapper(), "test"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("backend", "redis").containsEntry("store", "DOWN");
    }

    @Test
    void shouldReportDownOnStoreFailure() {
        when(store.isAvailable()).thenThrow(new StoreException("connection reset"));
        when(store.backend()).thenReturn("redis");
        ConclaveHealthIndicator indicator = new ConclaveHealthIndicator(store,
                new Registry(store, ConclaveJson.mapper(), "test"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "connection reset");
    }
}
