package com.fairway.revenueservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record RecordUsageRequest(@NotBlank String resource, @PositiveOrZero long amount) {
}
