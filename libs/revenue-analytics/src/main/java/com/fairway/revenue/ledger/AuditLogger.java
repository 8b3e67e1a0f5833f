package com.fairway.revenue.ledger;

import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventSerializer;
import com.fairway.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one JSON line per accepted event to the {@value #AUDIT_LOGGER} logger.
 * <p>
 * With redaction on, sensitive metadata values (card data, contact details) are masked before
 * the line is written.
 */
public class AuditLogger implements LedgerListener {

    public static final String AUDIT_LOGGER = "fairway.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final SensitiveDataRedactor redactor;
    private final boolean redact;

    public AuditLogger(SensitiveDataRedactor redactor, boolean redact) {
        this.redactor = redactor;
        this.redact = redact;
    }

    @Override
    public void onAppend(LedgerEntry entry) {
        if (audit.isInfoEnabled()) {
            audit.info(render(entry));
        }
    }

    /** The JSON line written for {@code entry}. */
    public String render(LedgerEntry entry) {
        RevenueEvent event = entry.event();
        if (redact) {
            event = new RevenueEvent(event.id(), event.tenantId(), event.type(), event.amount(),
                    event.currency(), event.timestamp(), event.subscriptionId(), event.customerId(),
                    event.invoiceId(), redactor.redact(event.metadata()), event.source());
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("action", "revenue.event.appended");
        record.put("sequence", entry.sequence());
        record.put("event", event);
        return RevenueEventSerializer.serializeValue(record);
    }
}
