package com.fairway.revenue.report;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;

import java.time.Instant;
import java.util.List;

/**
 * Raw ledger events handed to an {@link ExportEncoder}.
 *
 * @param tenantId    tenant, or null for platform-wide
 * @param range       exported window
 * @param format      requested format
 * @param events      events in canonical order
 * @param generatedAt snapshot time
 */
public record RevenueExport(String tenantId, DateRange range, ExportFormat format, List<RevenueEvent> events,
                            Instant generatedAt) {

    public RevenueExport {
        events = List.copyOf(events);
    }

    public int eventCount() {
        return events.size();
    }
}
