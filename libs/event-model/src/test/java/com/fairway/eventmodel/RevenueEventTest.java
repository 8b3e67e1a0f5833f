package com.fairway.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RevenueEvent")
class RevenueEventTest {

    private static final Instant AT = Instant.parse("2024-03-10T12:00:00Z");

    @Nested
    @DisplayName("contribution")
    class Contribution {

        @Test
        @DisplayName("refund recorded as a magnitude subtracts")
        void refundMagnitude() {
            var refund = RevenueEventFactory.create("club-1", RevenueEventType.REFUND,
                    new BigDecimal("50.00"), "USD", AT, RevenueSource.STRIPE);

            assertThat(refund.contribution()).isEqualByComparingTo("-50");
        }

        @Test
        @DisplayName("refund recorded already signed subtracts the same")
        void refundSigned() {
            var refund = RevenueEventFactory.create("club-1", RevenueEventType.REFUND,
                    new BigDecimal("-50.00"), "USD", AT, RevenueSource.STRIPE);

            assertThat(refund.contribution()).isEqualByComparingTo("-50");
        }

        @Test
        @DisplayName("cancellation contributes nothing")
        void cancellationNeutral() {
            var cancel = RevenueEventFactory.create("club-1", RevenueEventType.SUBSCRIPTION_CANCELLED,
                    new BigDecimal("99"), "USD", AT, RevenueSource.STRIPE);

            assertThat(cancel.contribution()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("factory")
    class Factory {

        @Test
        @DisplayName("refundOf references the original invoice and customer")
        void refundOf() {
            var charge = new RevenueEvent(java.util.UUID.randomUUID(), "club-1",
                    RevenueEventType.ONE_TIME_PAYMENT, new BigDecimal("120"), "EUR", AT,
                    null, "cust-1", "inv-9", null, RevenueSource.INVOICE);

            var refund = RevenueEventFactory.refundOf(charge, new BigDecimal("20"), AT.plusSeconds(60));

            assertThat(refund.type()).isEqualTo(RevenueEventType.REFUND);
            assertThat(refund.invoiceId()).isEqualTo("inv-9");
            assertThat(refund.customerId()).isEqualTo("cust-1");
            assertThat(refund.currency()).isEqualTo("EUR");
            assertThat(refund.metadata()).isEmpty();
        }

        @Test
        @DisplayName("refundOf rejects refunding more than was charged")
        void refundTooLarge() {
            var charge = RevenueEventFactory.create("club-1", RevenueEventType.SETUP_FEE,
                    new BigDecimal("10"), "USD", AT, RevenueSource.MANUAL);

            assertThatThrownBy(() -> RevenueEventFactory.refundOf(charge, new BigDecimal("11"), AT))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("subscription rejects non-subscription types")
        void subscriptionTypeCheck() {
            assertThatThrownBy(() -> RevenueEventFactory.subscription("club-1", RevenueEventType.REFUND,
                    "sub-1", "cust-1", BigDecimal.TEN, "USD", AT))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
