package com.fairway.revenueservice.api.dto;

import com.fairway.tenant.TenantException;
import com.fairway.tenant.limits.GovernedResource;
import com.fairway.tenant.limits.SupportLevel;
import com.fairway.tenant.limits.TenantLimits;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Partial limits: every field left out keeps the value of the limits it is applied to.
 *
 * @param ceilings ceilings keyed by resource name ({@code api_calls}, {@code users}, ...); a
 *                 negative value means unbounded
 */
public record TenantLimitsRequest(
        Map<String, Long> ceilings,
        String supportLevel,
        BigDecimal slaUptime,
        Integer backupRetentionDays) {

    public TenantLimits applyTo(TenantLimits base) {
        Map<GovernedResource, Long> merged = new EnumMap<>(base.ceilings());
        if (ceilings != null) {
            ceilings.forEach((name, ceiling) -> {
                GovernedResource resource = GovernedResource.fromString(name)
                        .orElseThrow(() -> TenantException.invalidRequest("unknown resource: " + name));
                if (ceiling == null) {
                    throw TenantException.invalidRequest("a ceiling is required for " + name);
                }
                merged.put(resource, ceiling < 0 ? TenantLimits.UNBOUNDED : ceiling);
            });
        }
        SupportLevel level = supportLevel == null
                ? base.supportLevel()
                : SupportLevel.fromString(supportLevel)
                        .orElseThrow(() -> TenantException.invalidRequest("unknown support level: " + supportLevel));
        try {
            return new TenantLimits(
                    merged,
                    level,
                    slaUptime == null ? base.slaUptime() : slaUptime,
                    backupRetentionDays == null ? base.backupRetentionDays() : backupRetentionDays,
                    base.version());
        } catch (IllegalArgumentException e) {
            throw TenantException.invalidRequest(e.getMessage());
        }
    }
}
