package com.fairway.tenant.limits;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fairway.tenant.TenantTier;
import java.math.BigDecimal;
import java.util.EnumMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("TenantLimits")
class TenantLimitsTest {

    @Nested
    @DisplayName("tier defaults")
    class TierDefaults {

        @Test
        @DisplayName("small business")
        void smallBusiness() {
            TenantLimits limits = TenantTier.SMALL_BUSINESS.defaultLimits();

            assertThat(limits.limit(GovernedResource.API_CALLS)).isEqualTo(25_000);
            assertThat(limits.limit(GovernedResource.STORAGE_MB)).isEqualTo(10 * 1024);
            assertThat(limits.limit(GovernedResource.BOOKINGS)).isEqualTo(500);
            assertThat(limits.limit(GovernedResource.CHILD_TENANTS)).isZero();
            assertThat(limits.supportLevel()).isEqualTo(SupportLevel.EMAIL);
            assertThat(limits.slaUptime()).isEqualByComparingTo("0.95");
            assertThat(limits.version()).isEqualTo(1);
        }

        @Test
        @DisplayName("individual has no SLA")
        void individualWithoutSla() {
            assertThat(TenantLimits.individual().slaUptime()).isNull();
            assertThat(TenantLimits.individual().backupRetentionDays()).isEqualTo(7);
        }

        @Test
        @DisplayName("custom is unbounded everywhere")
        void customUnbounded() {
            TenantLimits custom = TenantLimits.custom();

            for (GovernedResource resource : GovernedResource.values()) {
                assertThat(custom.isUnbounded(resource)).as(resource.value()).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("child defaults")
    class ChildDefaults {

        @Test
        @DisplayName("divide the parent's ceilings per resource")
        void divides() {
            TenantLimits child = TenantLimits.childDefault(TenantLimits.enterprise());

            assertThat(child.limit(GovernedResource.API_CALLS)).isEqualTo(100_000);
            assertThat(child.limit(GovernedResource.USERS)).isEqualTo(200);
            assertThat(child.limit(GovernedResource.WEBHOOKS)).isEqualTo(4);
            assertThat(child.limit(GovernedResource.CHILD_TENANTS)).isZero();
            assertThat(child.limit(GovernedResource.CUSTOM_DOMAINS)).isZero();
            assertThat(child.supportLevel()).isEqualTo(SupportLevel.DEDICATED);
        }

        @ParameterizedTest
        @EnumSource(TenantTier.class)
        @DisplayName("never exceed the parent")
        void neverExceedParent(TenantTier tier) {
            TenantLimits parent = tier.defaultLimits();
            TenantLimits child = TenantLimits.childDefault(parent);

            for (GovernedResource resource : GovernedResource.values()) {
                long parentLimit = parent.limit(resource);
                long childLimit = child.limit(resource);
                assertThat(childLimit).as(resource.value()).isLessThanOrEqualTo(parentLimit);
                if (parentLimit > 0 && !parent.isUnbounded(resource) && resource.childDivisor() > 1) {
                    assertThat(childLimit).as(resource.value()).isLessThan(parentLimit);
                }
            }
        }

        @Test
        @DisplayName("keep unbounded ceilings unbounded")
        void unboundedStays() {
            TenantLimits child = TenantLimits.childDefault(TenantLimits.custom());

            assertThat(child.isUnbounded(GovernedResource.API_CALLS)).isTrue();
            assertThat(child.limit(GovernedResource.CHILD_TENANTS)).isZero();
        }
    }

    @Test
    @DisplayName("withLimit bumps the version and leaves the original untouched")
    void withLimit() {
        TenantLimits original = TenantLimits.medium();
        TenantLimits changed = original.withLimit(GovernedResource.USERS, 40);

        assertThat(changed.limit(GovernedResource.USERS)).isEqualTo(40);
        assertThat(changed.version()).isEqualTo(2);
        assertThat(original.limit(GovernedResource.USERS)).isEqualTo(25);
    }

    @Test
    @DisplayName("every resource needs a ceiling")
    void rejectsMissingCeiling() {
        EnumMap<GovernedResource, Long> ceilings = new EnumMap<>(GovernedResource.class);
        ceilings.put(GovernedResource.API_CALLS, 10L);

        assertThatThrownBy(() -> new TenantLimits(ceilings, SupportLevel.EMAIL, null, 7, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("SLA uptime must be a fraction")
    void rejectsSlaAboveOne() {
        TenantLimits base = TenantLimits.medium();

        assertThatThrownBy(() -> new TenantLimits(base.ceilings(), SupportLevel.EMAIL, new BigDecimal("1.5"), 7, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
