package com.fairway.tenant.limits;

import static com.fairway.tenant.TenantFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fairway.tenant.MutableClock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryUsageCounterStore")
class InMemoryUsageCounterStoreTest {

    private MutableClock clock;
    private InMemoryUsageCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryUsageCounterStore(clock);
    }

    @Test
    @DisplayName("unknown tenants have empty usage for the current period")
    void emptyForUnknown() {
        TenantUsage usage = store.current("nobody");

        assertThat(usage.billingPeriod()).isEqualTo(YearMonth.of(2024, 6));
        assertThat(usage.get(GovernedResource.API_CALLS)).isZero();
    }

    @Test
    @DisplayName("increments accumulate and set overwrites")
    void incrementAndSet() {
        store.increment("club", GovernedResource.API_CALLS, 100);
        assertThat(store.increment("club", GovernedResource.API_CALLS, 50)).isEqualTo(150);
        store.set("club", GovernedResource.STORAGE_MB, 2048);
        store.set("club", GovernedResource.STORAGE_MB, 1024);

        TenantUsage usage = store.current("club");
        assertThat(usage.get(GovernedResource.API_CALLS)).isEqualTo(150);
        assertThat(usage.get(GovernedResource.STORAGE_MB)).isEqualTo(1024);
    }

    @Test
    @DisplayName("counters start over in a new month")
    void rollover() {
        store.increment("club", GovernedResource.BOOKINGS, 40);

        clock.set(Instant.parse("2024-07-01T00:00:00Z"));

        assertThat(store.current("club").get(GovernedResource.BOOKINGS)).isZero();
        assertThat(store.increment("club", GovernedResource.BOOKINGS, 2)).isEqualTo(2);
        assertThat(store.current("club").billingPeriod()).isEqualTo(YearMonth.of(2024, 7));
    }

    @Test
    @DisplayName("negative amounts are rejected")
    void rejectsNegative() {
        assertThatThrownBy(() -> store.increment("club", GovernedResource.USERS, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent increments are not lost")
    void concurrentIncrements() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    for (int j = 0; j < 1_000; j++) {
                        store.increment("club", GovernedResource.API_CALLS, 1);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.current("club").get(GovernedResource.API_CALLS)).isEqualTo(8_000);
    }
}
