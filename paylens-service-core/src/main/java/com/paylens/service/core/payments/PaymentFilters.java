package com.paylens.service.core.payments;

import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryValue;
import java.util.List;

/** Value sets per dimension. An empty set leaves that dimension unconstrained. */
public record PaymentFilters(
        List<String> currency,
        List<AttemptStatus> status,
        List<String> connector,
        List<AuthenticationType> authType,
        List<String> paymentMethod,
        List<String> paymentMethodType,
        List<String> clientSource,
        List<String> clientVersion) {

    public PaymentFilters {
        currency = copy(currency);
        status = copy(status);
        connector = copy(connector);
        authType = copy(authType);
        paymentMethod = copy(paymentMethod);
        paymentMethodType = copy(paymentMethodType);
        clientSource = copy(clientSource);
        clientVersion = copy(clientVersion);
    }

    public static PaymentFilters none() {
        return new PaymentFilters(null, null, null, null, null, null, null, null);
    }

    public void applyTo(QueryBuilder builder) throws QueryBuildingException {
        if (!currency.isEmpty()) {
            builder.addFilterInRangeClause(PaymentDimensions.CURRENCY.column(), QueryValue.ofStrings(currency));
        }
        if (!status.isEmpty()) {
            builder.addFilterInRangeClause(PaymentDimensions.PAYMENT_STATUS.column(), QueryValue.ofEnums(status));
        }
        if (!connector.isEmpty()) {
            builder.addFilterInRangeClause(PaymentDimensions.CONNECTOR.column(), QueryValue.ofStrings(connector));
        }
        if (!authType.isEmpty()) {
            builder.addFilterInRangeClause(PaymentDimensions.AUTH_TYPE.column(), QueryValue.ofEnums(authType));
        }
        if (!paymentMethod.isEmpty()) {
            builder.addFilterInRangeClause(
                    PaymentDimensions.PAYMENT_METHOD.column(), QueryValue.ofStrings(paymentMethod));
        }
        if (!paymentMethodType.isEmpty()) {
            builder.addFilterInRangeClause(
                    PaymentDimensions.PAYMENT_METHOD_TYPE.column(), QueryValue.ofStrings(paymentMethodType));
        }
        if (!clientSource.isEmpty()) {
            builder.addFilterInRangeClause(
                    PaymentDimensions.CLIENT_SOURCE.column(), QueryValue.ofStrings(clientSource));
        }
        if (!clientVersion.isEmpty()) {
            builder.addFilterInRangeClause(
                    PaymentDimensions.CLIENT_VERSION.column(), QueryValue.ofStrings(clientVersion));
        }
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
