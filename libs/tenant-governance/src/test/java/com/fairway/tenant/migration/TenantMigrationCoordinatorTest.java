package com.fairway.tenant.migration;

import static com.fairway.tenant.TenantFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fairway.common.BoundedCall;
import com.fairway.tenant.MutableClock;
import com.fairway.tenant.TenantException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantMigrationCoordinator")
class TenantMigrationCoordinatorTest {

    private final List<MigrationItem> calls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicReference<TenantDataMigrator> behaviour = new AtomicReference<>();

    private TenantMigrationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        TenantDataMigrator recording = (migrationId, item, from, to, preserveIds) -> {
            calls.add(item);
            return behaviour.get().migrate(migrationId, item, from, to, preserveIds);
        };
        coordinator = new TenantMigrationCoordinator(recording, new BoundedCall(Duration.ofSeconds(2)),
                new MutableClock(NOW));
        behaviour.set((migrationId, item, from, to, preserveIds) -> 5L);
    }

    @Nested
    @DisplayName("final status")
    class FinalStatus {

        @Test
        @DisplayName("completed when every item succeeds")
        void completed() {
            MigrationResult result = coordinator.migrate("a", "b", MigrationOptions.fullMigration());

            assertThat(result.status()).isEqualTo(MigrationStatus.COMPLETED);
            assertThat(result.statistics()).isEqualTo(new MigrationStatistics(4, 4, 0));
            assertThat(result.migratedItems()).containsEntry(MigrationItem.SETTINGS, 5L);
            assertThat(result.completedAt()).isEqualTo(NOW);
            assertThat(calls).containsExactly(MigrationItem.USERS, MigrationItem.COURSES, MigrationItem.BOOKINGS,
                    MigrationItem.SETTINGS);
        }

        @Test
        @DisplayName("data transfer leaves settings behind")
        void dataTransfer() {
            MigrationResult result = coordinator.migrate("a", "b", MigrationOptions.dataTransfer());

            assertThat(calls).doesNotContain(MigrationItem.SETTINGS);
            assertThat(result.statistics().totalItems()).isEqualTo(3);
        }

        @Test
        @DisplayName("partially completed when some items fail and some succeed")
        void partial() {
            behaviour.set((migrationId, item, from, to, preserveIds) -> {
                if (item == MigrationItem.BOOKINGS) {
                    throw new IllegalStateException("bookings store offline");
                }
                return 3L;
            });

            MigrationResult result = coordinator.migrate("a", "b", MigrationOptions.fullMigration());

            assertThat(result.status()).isEqualTo(MigrationStatus.PARTIALLY_COMPLETED);
            assertThat(result.statistics()).isEqualTo(new MigrationStatistics(4, 3, 1));
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.item()).isEqualTo(MigrationItem.BOOKINGS);
                assertThat(error.code()).isEqualTo("UPSTREAM_FAILURE");
                assertThat(error.message()).contains("bookings store offline");
            });
        }

        @Test
        @DisplayName("failed when nothing succeeds")
        void failed() {
            behaviour.set((migrationId, item, from, to, preserveIds) -> {
                throw new IllegalStateException("down");
            });

            MigrationResult result = coordinator.migrate("a", "b", MigrationOptions.dataTransfer());

            assertThat(result.status()).isEqualTo(MigrationStatus.FAILED);
            assertThat(result.statistics()).isEqualTo(new MigrationStatistics(3, 0, 3));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("stops before the next item")
        void stopsBeforeNextItem() {
            behaviour.set((migrationId, item, from, to, preserveIds) -> {
                if (item == MigrationItem.COURSES) {
                    coordinator.cancel(migrationId);
                }
                return 1L;
            });

            MigrationResult result = coordinator.migrate("a", "b", MigrationOptions.fullMigration());

            assertThat(result.status()).isEqualTo(MigrationStatus.CANCELLED);
            assertThat(calls).containsExactly(MigrationItem.USERS, MigrationItem.COURSES);
            assertThat(result.statistics()).isEqualTo(new MigrationStatistics(4, 2, 0));
            assertThat(coordinator.find(result.migrationId())).get()
                    .extracting(MigrationResult::status).isEqualTo(MigrationStatus.CANCELLED);
        }

        @Test
        @DisplayName("an ended migration cannot be cancelled")
        void endedMigration() {
            MigrationResult result = coordinator.migrate("a", "b", MigrationOptions.dataTransfer());

            assertThatThrownBy(() -> coordinator.cancel(result.migrationId()))
                    .isInstanceOfSatisfying(TenantException.class,
                            e -> assertThat(e.code()).isEqualTo(TenantException.INVALID_MIGRATION_TRANSITION));
        }

        @Test
        @DisplayName("unknown migrations are not found")
        void unknown() {
            assertThatThrownBy(() -> coordinator.cancel("missing"))
                    .isInstanceOfSatisfying(TenantException.class,
                            e -> assertThat(e.code()).isEqualTo(TenantException.MIGRATION_NOT_FOUND));
            assertThat(coordinator.find("missing")).isEmpty();
        }
    }

    @Test
    @DisplayName("status machine")
    void statusMachine() {
        assertThat(MigrationStatus.PENDING.canTransitionTo(MigrationStatus.IN_PROGRESS)).isTrue();
        assertThat(MigrationStatus.PENDING.canTransitionTo(MigrationStatus.COMPLETED)).isFalse();
        assertThat(MigrationStatus.IN_PROGRESS.canTransitionTo(MigrationStatus.PARTIALLY_COMPLETED)).isTrue();
        assertThat(MigrationStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(MigrationStatus.CANCELLED.allowedTargets()).isEmpty();
    }
}
