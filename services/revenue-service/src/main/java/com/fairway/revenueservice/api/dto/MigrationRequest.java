package com.fairway.revenueservice.api.dto;

import com.fairway.tenant.TenantException;
import com.fairway.tenant.migration.MigrationItem;
import com.fairway.tenant.migration.MigrationOptions;
import jakarta.validation.constraints.NotBlank;
import java.util.EnumSet;
import java.util.Set;

/**
 * Body of {@code POST /api/v1/tenants/migrations}. Without {@code items} every item is migrated.
 */
public record MigrationRequest(
        @NotBlank String fromTenantId,
        @NotBlank String toTenantId,
        Set<String> items,
        Boolean preserveIds) {

    public MigrationOptions toOptions() {
        MigrationOptions defaults = MigrationOptions.fullMigration();
        Set<MigrationItem> selected = defaults.items();
        if (items != null && !items.isEmpty()) {
            EnumSet<MigrationItem> parsed = EnumSet.noneOf(MigrationItem.class);
            for (String item : items) {
                parsed.add(MigrationItem.fromString(item)
                        .orElseThrow(() -> TenantException.invalidRequest("unknown migration item: " + item)));
            }
            selected = parsed;
        }
        return new MigrationOptions(selected, preserveIds == null ? defaults.preserveIds() : preserveIds);
    }
}
