package com.convector.filter;

public enum FilterOperator {
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    RANGE("<=>");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static FilterOperator fromSymbol(String symbol) {
        if ("==".equals(symbol)) {
            return EQUALS;
        }
        for (FilterOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + symbol);
    }
}
