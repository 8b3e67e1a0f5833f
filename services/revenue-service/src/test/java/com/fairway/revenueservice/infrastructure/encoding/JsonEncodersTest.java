package com.fairway.revenueservice.infrastructure.encoding;

import static org.assertj.core.api.Assertions.assertThat;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEventFactory;
import com.fairway.eventmodel.RevenueEventSerializer;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.eventmodel.RevenueSource;
import com.fairway.revenue.period.RevenuePeriod;
import com.fairway.revenue.report.EncodedDocument;
import com.fairway.revenue.report.ExportFormat;
import com.fairway.revenue.report.ReportFormat;
import com.fairway.revenue.report.RevenueExport;
import com.fairway.revenue.report.RevenueReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JSON encoders")
class JsonEncodersTest {

    private static final Instant GENERATED = Instant.parse("2024-04-01T00:00:00Z");

    private final ObjectMapper mapper = RevenueEventSerializer.objectMapper();

    @Nested
    @DisplayName("JsonReportEncoder")
    class Reports {

        private final JsonReportEncoder encoder = new JsonReportEncoder(mapper);

        @Test
        @DisplayName("supports JSON only")
        void supportsJsonOnly() {
            assertThat(encoder.supports(ReportFormat.JSON)).isTrue();
            assertThat(encoder.supports(ReportFormat.PDF)).isFalse();
            assertThat(encoder.supports(ReportFormat.CSV)).isFalse();
        }

        @Test
        @DisplayName("renders the report without its own document")
        void rendersReport() throws Exception {
            UUID id = UUID.randomUUID();
            EncodedDocument stale = new EncodedDocument("text/plain", "old.txt", "old".getBytes(StandardCharsets.UTF_8));
            RevenueReport report = new RevenueReport(id, "club-1", "Revenue report 2024-03 for Club",
                    RevenuePeriod.month(YearMonth.of(2024, 3)), GENERATED, null, null, List.of(), List.of(),
                    ReportFormat.JSON, stale);

            EncodedDocument document = encoder.encode(report);

            assertThat(document.contentType()).isEqualTo("application/json");
            assertThat(document.fileName()).isEqualTo("revenue-report-" + id + ".json");
            JsonNode json = mapper.readTree(document.content());
            assertThat(json.get("tenantId").asText()).isEqualTo("club-1");
            assertThat(json.get("title").asText()).isEqualTo("Revenue report 2024-03 for Club");
            assertThat(json.get("document").isNull()).isTrue();
        }
    }

    @Nested
    @DisplayName("JsonExportEncoder")
    class Exports {

        private final JsonExportEncoder encoder = new JsonExportEncoder(mapper);

        @Test
        @DisplayName("supports JSON only")
        void supportsJsonOnly() {
            assertThat(encoder.supports(ExportFormat.JSON)).isTrue();
            assertThat(encoder.supports(ExportFormat.XML)).isFalse();
        }

        @Test
        @DisplayName("writes the range and the events with their wire values")
        void writesEvents() throws Exception {
            var event = RevenueEventFactory.create("club-1", RevenueEventType.USAGE_CHARGE, new BigDecimal("12.50"),
                    "USD", Instant.parse("2024-03-05T09:00:00Z"), RevenueSource.STRIPE);
            var export = new RevenueExport("club-1",
                    DateRange.of(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z")),
                    ExportFormat.JSON, List.of(event), GENERATED);

            EncodedDocument document = encoder.encode(export);

            assertThat(document.fileName()).isEqualTo("revenue-events-club-1.json");
            JsonNode json = mapper.readTree(document.content());
            assertThat(json.get("events")).hasSize(1);
            assertThat(json.get("events").get(0).get("type").asText()).isEqualTo("usage_charge");
            assertThat(json.get("events").get(0).get("source").asText()).isEqualTo("stripe");
            assertThat(json.get("events").get(0).get("id").asText()).isEqualTo(event.id().toString());
        }

        @Test
        @DisplayName("names a platform-wide export after the platform")
        void platformExport() {
            var export = new RevenueExport(null,
                    DateRange.of(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z")),
                    ExportFormat.JSON, List.of(), GENERATED);

            assertThat(encoder.encode(export).fileName()).isEqualTo("revenue-events-platform.json");
        }
    }
}
