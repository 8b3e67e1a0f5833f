package com.fairway.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fairway.security.testing.TestSecurityContextFactory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityContextValidator")
class SecurityContextValidatorTest {

    @Test
    @DisplayName("a complete context is valid")
    void complete() {
        assertThat(SecurityContextValidator.isValid(TestSecurityContextFactory.create())).isTrue();
    }

    @Test
    @DisplayName("reports every missing field")
    void missingFields() {
        var ctx = new FairwaySecurityContext(null, " ", List.of(), "corr-1");

        assertThat(SecurityContextValidator.validate(ctx))
                .hasSize(3)
                .anyMatch(e -> e.contains("userId"))
                .anyMatch(e -> e.contains("tenantId"))
                .anyMatch(e -> e.contains("roles"));
    }
}
