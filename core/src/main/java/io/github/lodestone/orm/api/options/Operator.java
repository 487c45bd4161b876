package io.github.lodestone.orm.api.options;

import io.github.lodestone.orm.api.exceptions.ValidationException;

/**
 * Comparison operators supported in query filters.
 */
public enum Operator {
    EQ("eq", "="),
    LT("lt", "<"),
    LTE("lte", "<="),
    GT("gt", ">"),
    GTE("gte", ">=");

    private final String keyword;
    private final String symbol;

    Operator(String keyword, String symbol) {
        this.keyword = keyword;
        this.symbol = symbol;
    }

    public String keyword() {
        return keyword;
    }

    public String symbol() {
        return symbol;
    }

    public static Operator fromKeyword(String keyword) {
        for (Operator operator : values()) {
            if (operator.keyword.equals(keyword)) {
                return operator;
            }
        }
        throw new ValidationException("'" + keyword + "' is not a valid comparator");
    }
}
