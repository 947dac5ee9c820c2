package com.paylens.service.core.model;

import java.util.List;

/**
 * Caller context resolved upstream. Merchant-keyed domains need {@code merchantId}, SDK-keyed domains
 * need {@code publishableKey}; {@code profileIds} narrows merchant data further when non-empty.
 */
public record AnalyticsScope(String merchantId, List<String> profileIds, String publishableKey) {

    public AnalyticsScope {
        profileIds = profileIds == null ? List.of() : List.copyOf(profileIds);
    }

    public static AnalyticsScope merchant(String merchantId) {
        return new AnalyticsScope(merchantId, List.of(), null);
    }

    public static AnalyticsScope publishableKey(String publishableKey) {
        return new AnalyticsScope(null, List.of(), publishableKey);
    }

    public boolean hasMerchant() {
        return merchantId != null && !merchantId.isBlank();
    }

    public boolean hasPublishableKey() {
        return publishableKey != null && !publishableKey.isBlank();
    }
}
