package com.paylens.service.core.sdkevents;

import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryValue;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record SdkEventFilters(
        List<String> paymentMethod,
        List<String> platform,
        List<String> browserName,
        List<String> source,
        List<String> component,
        List<String> paymentExperience) {

    public SdkEventFilters {
        paymentMethod = paymentMethod == null ? List.of() : List.copyOf(paymentMethod);
        platform = platform == null ? List.of() : List.copyOf(platform);
        browserName = browserName == null ? List.of() : List.copyOf(browserName);
        source = source == null ? List.of() : List.copyOf(source);
        component = component == null ? List.of() : List.copyOf(component);
        paymentExperience = paymentExperience == null ? List.of() : List.copyOf(paymentExperience);
    }

    public static SdkEventFilters none() {
        return new SdkEventFilters(null, null, null, null, null, null);
    }

    public void applyTo(QueryBuilder builder) throws QueryBuildingException {
        Map<SdkEventDimensions, List<String>> byDimension = new EnumMap<>(SdkEventDimensions.class);
        byDimension.put(SdkEventDimensions.PAYMENT_METHOD, paymentMethod);
        byDimension.put(SdkEventDimensions.PLATFORM, platform);
        byDimension.put(SdkEventDimensions.BROWSER_NAME, browserName);
        byDimension.put(SdkEventDimensions.SOURCE, source);
        byDimension.put(SdkEventDimensions.COMPONENT, component);
        byDimension.put(SdkEventDimensions.PAYMENT_EXPERIENCE, paymentExperience);
        for (Map.Entry<SdkEventDimensions, List<String>> filter : byDimension.entrySet()) {
            if (!filter.getValue().isEmpty()) {
                builder.addFilterInRangeClause(filter.getKey().column(), QueryValue.ofStrings(filter.getValue()));
            }
        }
    }
}
