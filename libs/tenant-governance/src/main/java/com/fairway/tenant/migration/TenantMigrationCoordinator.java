package com.fairway.tenant.migration;

import com.fairway.common.BoundedCall;
import com.fairway.common.FairwayException;
import com.fairway.tenant.TenantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs tenant data migrations item by item and keeps their status.
 *
 * <p>Each item goes through the {@link TenantDataMigrator} under a {@link BoundedCall}. A failed
 * item is recorded and the migration carries on with the next one. The final status is
 * COMPLETED when every item succeeded, PARTIALLY_COMPLETED when some succeeded and some failed,
 * and FAILED when none succeeded. {@link #cancel(String)} stops a migration before its next item.
 */
public class TenantMigrationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TenantMigrationCoordinator.class);

    private final TenantDataMigrator migrator;
    private final BoundedCall boundedCall;
    private final Clock clock;
    private final Map<String, Run> runs = new ConcurrentHashMap<>();

    public TenantMigrationCoordinator(TenantDataMigrator migrator, BoundedCall boundedCall, Clock clock) {
        this.migrator = migrator;
        this.boundedCall = boundedCall;
        this.clock = clock;
    }

    /**
     * Runs a migration to its end on the calling thread.
     */
    public MigrationResult migrate(String fromTenantId, String toTenantId, MigrationOptions options) {
        Run run = new Run(UUID.randomUUID().toString(), fromTenantId, toTenantId, options, clock.instant());
        runs.put(run.migrationId, run);
        log.info("Migration {} from {} to {} started with {}", run.migrationId, fromTenantId, toTenantId,
                options.items());
        run.moveTo(MigrationStatus.IN_PROGRESS, null);

        for (MigrationItem item : MigrationItem.values()) {
            if (!options.includes(item)) {
                continue;
            }
            if (run.status() == MigrationStatus.CANCELLED) {
                break;
            }
            try {
                long moved = boundedCall.call("tenant-migrator." + item.value(), () -> migrator.migrate(
                        run.migrationId, item, fromTenantId, toTenantId, options.preserveIds()));
                run.succeeded(item, moved);
            } catch (FairwayException e) {
                log.warn("Migration {} item {} failed: {}", run.migrationId, item.value(), e.getMessage());
                run.failed(new MigrationError(item, e.code(), e.getMessage()));
            }
        }

        run.finish(clock.instant());
        MigrationResult result = run.snapshot();
        log.info("Migration {} ended {}: {} succeeded, {} failed", result.migrationId(), result.status().value(),
                result.statistics().successfulItems(), result.statistics().failedItems());
        return result;
    }

    /**
     * @throws TenantException MIGRATION_NOT_FOUND for an unknown id,
     *                         INVALID_MIGRATION_TRANSITION if the migration already ended
     */
    public MigrationResult cancel(String migrationId) {
        Run run = runs.get(migrationId);
        if (run == null) {
            throw TenantException.migrationNotFound(migrationId);
        }
        run.moveTo(MigrationStatus.CANCELLED, clock.instant());
        log.info("Migration {} cancelled", migrationId);
        return run.snapshot();
    }

    public Optional<MigrationResult> find(String migrationId) {
        return Optional.ofNullable(runs.get(migrationId)).map(Run::snapshot);
    }

    private static final class Run {

        private final String migrationId;
        private final String fromTenantId;
        private final String toTenantId;
        private final int totalItems;
        private final Instant startedAt;
        private final Map<MigrationItem, Long> migrated = new EnumMap<>(MigrationItem.class);
        private final List<MigrationError> errors = new ArrayList<>();
        private MigrationStatus status = MigrationStatus.PENDING;
        private Instant completedAt;

        private Run(String migrationId, String fromTenantId, String toTenantId, MigrationOptions options,
                    Instant startedAt) {
            this.migrationId = migrationId;
            this.fromTenantId = fromTenantId;
            this.toTenantId = toTenantId;
            this.totalItems = options.items().size();
            this.startedAt = startedAt;
        }

        synchronized MigrationStatus status() {
            return status;
        }

        synchronized void moveTo(MigrationStatus target, Instant now) {
            if (!status.canTransitionTo(target)) {
                throw TenantException.invalidMigrationTransition(migrationId, status.value(), target.value());
            }
            status = target;
            if (target.isTerminal()) {
                completedAt = now;
            }
        }

        synchronized void succeeded(MigrationItem item, long moved) {
            migrated.put(item, moved);
        }

        synchronized void failed(MigrationError error) {
            errors.add(error);
        }

        synchronized void finish(Instant now) {
            if (status.isTerminal()) {
                return;
            }
            MigrationStatus outcome;
            if (errors.isEmpty()) {
                outcome = MigrationStatus.COMPLETED;
            } else if (migrated.isEmpty()) {
                outcome = MigrationStatus.FAILED;
            } else {
                outcome = MigrationStatus.PARTIALLY_COMPLETED;
            }
            moveTo(outcome, now);
        }

        synchronized MigrationResult snapshot() {
            return new MigrationResult(migrationId, fromTenantId, toTenantId, status, startedAt, completedAt,
                    migrated, errors, new MigrationStatistics(totalItems, migrated.size(), errors.size()));
        }
    }
}
