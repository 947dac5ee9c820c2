package com.paylens.service.core.query;

import com.paylens.service.core.backend.DbEnum;
import com.paylens.service.core.backend.QueryDialect;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** Literal value of a predicate. Rendering goes through the dialect method for the value's type. */
public sealed interface QueryValue
        permits QueryValue.Text, QueryValue.Numeric, QueryValue.Timestamp, QueryValue.EnumLiteral {

    String render(QueryDialect dialect);

    static QueryValue of(String value) {
        return new Text(value);
    }

    static QueryValue of(Number value) {
        return new Numeric(value);
    }

    static QueryValue of(Instant value) {
        return new Timestamp(value);
    }

    static QueryValue of(DbEnum value) {
        return new EnumLiteral(value);
    }

    static List<QueryValue> ofStrings(Collection<String> values) {
        return values.stream().map(QueryValue::of).toList();
    }

    static List<QueryValue> ofNumbers(Collection<? extends Number> values) {
        return values.stream().<QueryValue>map(QueryValue::of).toList();
    }

    static List<QueryValue> ofEnums(Collection<? extends DbEnum> values) {
        return values.stream().<QueryValue>map(QueryValue::of).toList();
    }

    record Text(String value) implements QueryValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render(QueryDialect dialect) {
            return dialect.string(value);
        }
    }

    record Numeric(Number value) implements QueryValue {
        public Numeric {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render(QueryDialect dialect) {
            return dialect.number(value);
        }
    }

    record Timestamp(Instant value) implements QueryValue {
        public Timestamp {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render(QueryDialect dialect) {
            return dialect.timestamp(value);
        }
    }

    record EnumLiteral(DbEnum value) implements QueryValue {
        public EnumLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render(QueryDialect dialect) {
            return dialect.enumValue(value);
        }
    }
}
