package com.convector.filter;

/**
 * One parsed label filter expression. A condition without an operator is an
 * inclusion directive: it selects {@code field} for the reduced output instead
 * of filtering records.
 */
public record FilterCondition(String field, FilterOperator operator, String value) {

    public FilterCondition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("filter field must not be blank");
        }
    }

    public static FilterCondition inclusion(String field) {
        return new FilterCondition(field, null, null);
    }

    public boolean isInclusion() {
        return operator == null;
    }

    @Override
    public String toString() {
        return isInclusion() ? field : field + operator.symbol() + value;
    }
}
