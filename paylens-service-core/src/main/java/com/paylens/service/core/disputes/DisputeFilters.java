package com.paylens.service.core.disputes;

import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryValue;
import java.util.List;

public record DisputeFilters(List<DisputeStage> disputeStage, List<String> connector, List<String> currency) {

    public DisputeFilters {
        disputeStage = disputeStage == null ? List.of() : List.copyOf(disputeStage);
        connector = connector == null ? List.of() : List.copyOf(connector);
        currency = currency == null ? List.of() : List.copyOf(currency);
    }

    public static DisputeFilters none() {
        return new DisputeFilters(null, null, null);
    }

    public void applyTo(QueryBuilder builder) throws QueryBuildingException {
        if (!disputeStage.isEmpty()) {
            builder.addFilterInRangeClause(DisputeDimensions.DISPUTE_STAGE.column(), QueryValue.ofEnums(disputeStage));
        }
        if (!connector.isEmpty()) {
            builder.addFilterInRangeClause(DisputeDimensions.CONNECTOR.column(), QueryValue.ofStrings(connector));
        }
        if (!currency.isEmpty()) {
            builder.addFilterInRangeClause(DisputeDimensions.CURRENCY.column(), QueryValue.ofStrings(currency));
        }
    }
}
