package com.fairway.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Role")
class RoleTest {

    @Test
    @DisplayName("platform admin implies every role")
    void platformAdmin() {
        for (Role role : Role.values()) {
            assertThat(Role.PLATFORM_ADMIN.implies(role)).isTrue();
        }
    }

    @Test
    @DisplayName("tenant admin does not imply platform admin")
    void tenantAdmin() {
        assertThat(Role.TENANT_ADMIN.implies(Role.BILLING_ADMIN)).isTrue();
        assertThat(Role.TENANT_ADMIN.implies(Role.PLATFORM_ADMIN)).isFalse();
    }

    @Test
    @DisplayName("analyst and billing admin are siblings")
    void siblings() {
        assertThat(Role.ANALYST.implies(Role.VIEWER)).isTrue();
        assertThat(Role.ANALYST.implies(Role.BILLING_ADMIN)).isFalse();
        assertThat(Role.BILLING_ADMIN.implies(Role.ANALYST)).isFalse();
    }

    @Test
    @DisplayName("fromString accepts canonical and bare names")
    void parsing() {
        assertThat(Role.fromString("ROLE_ANALYST")).contains(Role.ANALYST);
        assertThat(Role.fromString(" TENANT_ADMIN ")).contains(Role.TENANT_ADMIN);
        assertThat(Role.fromString("ROLE_TRADER")).isEmpty();
        assertThat(Role.fromString(null)).isEmpty();
    }
}
