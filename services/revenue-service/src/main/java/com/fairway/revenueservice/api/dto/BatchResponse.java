package com.fairway.revenueservice.api.dto;

import com.fairway.common.batch.BatchResult;
import com.fairway.common.batch.ItemOutcome;
import java.util.List;

/**
 * Wire form of a {@link BatchResult}: the counts plus one entry per item.
 */
public record BatchResponse<T>(
        String batchName,
        int total,
        long succeeded,
        long failed,
        long cancelled,
        List<Item<T>> items) {

    public record Item<T>(
            String key,
            String status,
            T value,
            String errorKind,
            String errorCode,
            String message) {

        static <T> Item<T> from(ItemOutcome<String, T> outcome) {
            return new Item<>(
                    outcome.key(),
                    outcome.status().name(),
                    outcome.value(),
                    outcome.errorKind() == null ? null : outcome.errorKind().name(),
                    outcome.errorCode(),
                    outcome.message());
        }
    }

    public static <T> BatchResponse<T> from(BatchResult<String, T> result) {
        return new BatchResponse<>(
                result.batchName(),
                result.total(),
                result.succeeded(),
                result.failed(),
                result.cancelled(),
                result.outcomes().stream().map(Item::from).toList());
    }
}
