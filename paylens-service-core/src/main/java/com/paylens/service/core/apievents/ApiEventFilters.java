package com.paylens.service.core.apievents;

import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryValue;
import java.util.List;

public record ApiEventFilters(List<Integer> statusCode, List<String> flowType, List<String> apiFlow) {

    public ApiEventFilters {
        statusCode = statusCode == null ? List.of() : List.copyOf(statusCode);
        flowType = flowType == null ? List.of() : List.copyOf(flowType);
        apiFlow = apiFlow == null ? List.of() : List.copyOf(apiFlow);
    }

    public static ApiEventFilters none() {
        return new ApiEventFilters(null, null, null);
    }

    public void applyTo(QueryBuilder builder) throws QueryBuildingException {
        if (!statusCode.isEmpty()) {
            builder.addFilterInRangeClause(ApiEventDimensions.STATUS_CODE.column(), QueryValue.ofNumbers(statusCode));
        }
        if (!flowType.isEmpty()) {
            builder.addFilterInRangeClause(ApiEventDimensions.FLOW_TYPE.column(), QueryValue.ofStrings(flowType));
        }
        if (!apiFlow.isEmpty()) {
            builder.addFilterInRangeClause(ApiEventDimensions.API_FLOW.column(), QueryValue.ofStrings(apiFlow));
        }
    }
}
