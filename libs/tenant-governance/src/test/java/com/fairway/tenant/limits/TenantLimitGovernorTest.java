package com.fairway.tenant.limits;

import static com.fairway.tenant.TenantFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fairway.common.ErrorKind;
import com.fairway.tenant.InMemoryTenantRepository;
import com.fairway.tenant.MutableClock;
import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantException;
import com.fairway.tenant.TenantFixtures;
import com.fairway.tenant.TenantTier;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantLimitGovernor")
class TenantLimitGovernorTest {

    private InMemoryTenantRepository repository;
    private InMemoryUsageCounterStore usage;
    private TenantLimitGovernor governor;
    private Tenant parent;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTenantRepository();
        usage = new InMemoryUsageCounterStore(new MutableClock(NOW));
        governor = new TenantLimitGovernor(repository, usage);
        parent = TenantFixtures.root("parent", "parent", TenantTier.ENTERPRISE);
        repository.save(parent);
    }

    @Nested
    @DisplayName("overage")
    class Overage {

        @Test
        @DisplayName("API usage 27,300 against 25,000 overages by 2,300 and nothing else")
        void apiOverage() {
            Tenant club = TenantFixtures.root("club", "club", TenantTier.SMALL_BUSINESS);
            EnumMap<GovernedResource, Long> consumed = new EnumMap<>(GovernedResource.class);
            consumed.put(GovernedResource.API_CALLS, 27_300L);
            consumed.put(GovernedResource.BOOKINGS, 400L);
            TenantUsage current = new TenantUsage("club", YearMonth.of(2024, 6), consumed);

            TenantOverage overage = governor.computeOverage(club, current);

            assertThat(overage.get(GovernedResource.API_CALLS)).isEqualTo(2_300);
            for (GovernedResource resource : GovernedResource.values()) {
                if (resource != GovernedResource.API_CALLS) {
                    assertThat(overage.get(resource)).as(resource.value()).isZero();
                }
            }
            assertThat(overage.hasOverage()).isTrue();
        }

        @Test
        @DisplayName("equals max(0, usage - limit)")
        void formula() {
            assertThat(TenantLimitGovernor.overage(100, 99)).isZero();
            assertThat(TenantLimitGovernor.overage(100, 100)).isZero();
            assertThat(TenantLimitGovernor.overage(100, 101)).isEqualTo(1);
            assertThat(TenantLimitGovernor.overage(0, 7)).isEqualTo(7);
        }

        @Test
        @DisplayName("unbounded resources never overage")
        void unbounded() {
            assertThat(TenantLimitGovernor.overage(TenantLimits.UNBOUNDED, Long.MAX_VALUE)).isZero();

            Tenant custom = TenantFixtures.root("custom", "custom", TenantTier.CUSTOM);
            repository.save(custom);
            usage.increment("custom", GovernedResource.API_CALLS, 9_000_000_000L);

            assertThat(governor.currentOverage(custom).hasOverage()).isFalse();
        }
    }

    @Nested
    @DisplayName("effective limits")
    class EffectiveLimits {

        @Test
        @DisplayName("an override wins over the tier")
        void overrideWins() {
            TenantLimits override = TenantLimits.individual().withLimit(GovernedResource.USERS, 3);
            Tenant club = new Tenant("club", "Club", "club", TenantTier.ENTERPRISE, null, override,
                    null, null, null, NOW);

            assertThat(governor.resolveLimits(club)).isEqualTo(override);
        }

        @Test
        @DisplayName("a child without a tier derives from its parent")
        void childDerives() {
            Tenant child = TenantFixtures.child("child", "child", "parent");
            repository.save(child);

            TenantLimits limits = governor.resolveLimits(child);

            assertThat(limits.limit(GovernedResource.API_CALLS)).isEqualTo(100_000);
            assertThat(limits.limit(GovernedResource.USERS)).isEqualTo(200);
        }

        @Test
        @DisplayName("grandchildren derive from the derived limits")
        void grandchildDerives() {
            Tenant middle = new Tenant("middle", "Middle", "middle", null, "parent",
                    TenantLimits.childDefault(TenantLimits.enterprise()).withLimit(GovernedResource.CHILD_TENANTS, 2),
                    null, null, null, NOW);
            repository.save(middle);
            Tenant leaf = TenantFixtures.child("leaf", "leaf", "middle");
            repository.save(leaf);

            assertThat(governor.resolveLimits(leaf).limit(GovernedResource.API_CALLS)).isEqualTo(10_000);
        }

        @Test
        @DisplayName("a missing parent is reported")
        void missingParent() {
            Tenant orphan = TenantFixtures.child("orphan", "orphan", "nobody");

            assertThatThrownBy(() -> governor.resolveLimits(orphan))
                    .isInstanceOfSatisfying(TenantException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
        }
    }

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("remaining allocation subtracts the other children's consumption")
        void remaining() {
            repository.save(TenantFixtures.child("a", "a", "parent"));
            repository.save(TenantFixtures.child("b", "b", "parent"));
            usage.increment("a", GovernedResource.API_CALLS, 300_000);
            usage.increment("b", GovernedResource.API_CALLS, 200_000);

            Map<GovernedResource, Long> remaining = governor.parentRemaining(parent, null);
            Map<GovernedResource, Long> excludingB = governor.parentRemaining(parent, "b");

            assertThat(remaining.get(GovernedResource.API_CALLS)).isEqualTo(500_000);
            assertThat(excludingB.get(GovernedResource.API_CALLS)).isEqualTo(700_000);
        }

        @Test
        @DisplayName("child limits above the remaining allocation are rejected")
        void rejectsOverAllocation() {
            repository.save(TenantFixtures.child("a", "a", "parent"));
            usage.increment("a", GovernedResource.USERS, 900);
            TenantLimits request = TenantLimits.childDefault(TenantLimits.enterprise())
                    .withLimit(GovernedResource.USERS, 150);

            assertThatThrownBy(() -> governor.validateChildAllocation(parent, null, request))
                    .isInstanceOfSatisfying(TenantException.class, e -> {
                        assertThat(e.code()).isEqualTo(TenantException.HIERARCHY_LIMIT_EXCEEDED);
                        assertThat(e.getMessage()).contains("users").contains("150").contains("100");
                    });
        }

        @Test
        @DisplayName("an unbounded child under a bounded parent is rejected")
        void rejectsUnboundedChild() {
            assertThatThrownBy(() -> governor.validateChildAllocation(parent, null, TenantLimits.custom()))
                    .hasFieldOrPropertyWithValue("code", TenantException.HIERARCHY_LIMIT_EXCEEDED);
        }

        @Test
        @DisplayName("child defaults fit an unused parent")
        void defaultsFit() {
            governor.validateChildAllocation(parent, null, TenantLimits.childDefault(TenantLimits.enterprise()));
        }
    }

    @Test
    @DisplayName("usage ratio")
    void usageRatio() {
        Tenant club = TenantFixtures.root("club", "club", TenantTier.SMALL_BUSINESS);
        repository.save(club);
        usage.increment("club", GovernedResource.API_CALLS, 20_000);

        assertThat(governor.usageRatio(club, GovernedResource.API_CALLS)).isEqualTo(0.8);
        assertThat(governor.usageRatio(club, GovernedResource.CHILD_TENANTS)).isZero();
        usage.increment("club", GovernedResource.CHILD_TENANTS, 1);
        assertThat(governor.usageRatio(club, GovernedResource.CHILD_TENANTS)).isInfinite();
    }
}
