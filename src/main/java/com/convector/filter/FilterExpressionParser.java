package com.convector.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.convector.config.ConfigurationException;

/**
 * Parses {@code field[operator value]} expressions such as {@code user_id>50},
 * {@code metadata.age<50}, {@code metadata.temp<=>1,3} or a bare {@code conversation_id}.
 */
public final class FilterExpressionParser {
    private static final Pattern COMPARISON = Pattern.compile("^\\s*([^<>!=\\s]+)\\s*(<=>|==|!=|=|<|>)\\s*(.*?)\\s*$");
    private static final Pattern FIELD_PATH = Pattern.compile("^[A-Za-z0-9_$\\-]+(?:\\.[A-Za-z0-9_$\\-]+)*$");
    private static final String OPERATOR_CHARS = "<>!=";

    private FilterExpressionParser() {
    }

    public static List<FilterCondition> parseAll(List<String> expressions) {
        List<FilterCondition> conditions = new ArrayList<>();
        if (expressions == null) {
            return conditions;
        }
        for (String expression : expressions) {
            conditions.add(parse(expression));
        }
        return conditions;
    }

    public static FilterCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Filter expression must not be blank");
        }
        Matcher matcher = COMPARISON.matcher(expression);
        if (matcher.matches()) {
            String field = requireFieldPath(matcher.group(1), expression);
            FilterOperator operator = FilterOperator.fromSymbol(matcher.group(2));
            String value = matcher.group(3);
            if (value.isEmpty() || OPERATOR_CHARS.indexOf(value.charAt(0)) >= 0) {
                throw new ConfigurationException("Invalid filter expression '" + expression + "': missing or malformed value");
            }
            if (operator == FilterOperator.RANGE) {
                requireRangeBounds(value, expression);
            }
            return new FilterCondition(field, operator, value);
        }
        if (expression.chars().anyMatch(c -> OPERATOR_CHARS.indexOf(c) >= 0)) {
            throw new ConfigurationException("Invalid filter expression '" + expression + "'");
        }
        return FilterCondition.inclusion(requireFieldPath(expression.trim(), expression));
    }

    static String[] rangeBounds(String value) {
        String[] parts = value.split(",", -1);
        return new String[] { parts[0].trim(), parts[1].trim() };
    }

    private static void requireRangeBounds(String value, String expression) {
        String[] parts = value.split(",", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ConfigurationException("Range filter '" + expression + "' must be written as field<=>low,high");
        }
    }

    private static String requireFieldPath(String field, String expression) {
        if (!FIELD_PATH.matcher(field).matches()) {
            throw new ConfigurationException("Invalid field path '" + field + "' in filter expression '" + expression + "'");
        }
        return field;
    }
}
