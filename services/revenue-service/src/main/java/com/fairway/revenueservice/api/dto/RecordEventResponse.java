package com.fairway.revenueservice.api.dto;

import java.util.UUID;

/**
 * @param eventId  id of the accepted event
 * @param sequence ledger sequence assigned on append
 */
public record RecordEventResponse(UUID eventId, long sequence) {
}
