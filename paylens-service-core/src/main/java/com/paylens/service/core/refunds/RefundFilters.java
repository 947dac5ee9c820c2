package com.paylens.service.core.refunds;

import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryValue;
import java.util.List;

public record RefundFilters(
        List<String> currency, List<RefundStatus> refundStatus, List<String> connector, List<RefundType> refundType) {

    public RefundFilters {
        currency = currency == null ? List.of() : List.copyOf(currency);
        refundStatus = refundStatus == null ? List.of() : List.copyOf(refundStatus);
        connector = connector == null ? List.of() : List.copyOf(connector);
        refundType = refundType == null ? List.of() : List.copyOf(refundType);
    }

    public static RefundFilters none() {
        return new RefundFilters(null, null, null, null);
    }

    public void applyTo(QueryBuilder builder) throws QueryBuildingException {
        if (!currency.isEmpty()) {
            builder.addFilterInRangeClause(RefundDimensions.CURRENCY.column(), QueryValue.ofStrings(currency));
        }
        if (!refundStatus.isEmpty()) {
            builder.addFilterInRangeClause(RefundDimensions.REFUND_STATUS.column(), QueryValue.ofEnums(refundStatus));
        }
        if (!connector.isEmpty()) {
            builder.addFilterInRangeClause(RefundDimensions.CONNECTOR.column(), QueryValue.ofStrings(connector));
        }
        if (!refundType.isEmpty()) {
            builder.addFilterInRangeClause(RefundDimensions.REFUND_TYPE.column(), QueryValue.ofEnums(refundType));
        }
    }
}
