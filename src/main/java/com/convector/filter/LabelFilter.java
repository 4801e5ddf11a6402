package com.convector.filter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.extract.NormalizedRecord;

/**
 * Applies comparison conditions (all combined with AND) and then reduces the
 * record to the inclusion fields, if any were given.
 */
public class LabelFilter {
    private static final Logger log = LoggerFactory.getLogger(LabelFilter.class);

    private final List<FilterCondition> comparisons;
    private final List<FilterCondition> inclusions;

    public LabelFilter(List<FilterCondition> conditions) {
        this.comparisons = conditions.stream().filter(condition -> !condition.isInclusion()).toList();
        this.inclusions = conditions.stream().filter(FilterCondition::isInclusion).toList();
    }

    public static LabelFilter parse(List<String> expressions) {
        return new LabelFilter(FilterExpressionParser.parseAll(expressions));
    }

    public boolean hasInclusions() {
        return !inclusions.isEmpty();
    }

    public boolean matches(Map<String, Object> item) {
        for (FilterCondition condition : comparisons) {
            Optional<Object> value = FieldPaths.lookup(item, condition.field());
            if (value.isEmpty()) {
                log.debug("filter.field.missing field={} condition={}", condition.field(), condition);
                return false;
            }
            if (!evaluate(condition, value.get())) {
                return false;
            }
        }
        return true;
    }

    public Map<String, Object> reduce(Map<String, Object> item) {
        if (inclusions.isEmpty()) {
            return item;
        }
        Map<String, Object> reduced = new LinkedHashMap<>();
        for (FilterCondition inclusion : inclusions) {
            FieldPaths.lookup(item, inclusion.field()).ifPresent(value -> reduced.put(inclusion.field(), value));
        }
        return reduced;
    }

    public Optional<Map<String, Object>> apply(Map<String, Object> item) {
        if (!matches(item)) {
            return Optional.empty();
        }
        return Optional.of(reduce(item));
    }

    public Optional<FilteredRecord> apply(NormalizedRecord record) {
        if (comparisons.isEmpty() && inclusions.isEmpty()) {
            return Optional.of(FilteredRecord.unreduced(record));
        }
        Map<String, Object> view = record.toMap();
        if (!matches(view)) {
            return Optional.empty();
        }
        return Optional.of(new FilteredRecord(record, inclusions.isEmpty() ? null : reduce(view)));
    }

    static boolean evaluate(FilterCondition condition, Object rawValue) {
        Object actual = FilterValues.cast(rawValue);
        if (condition.operator() == FilterOperator.RANGE) {
            String[] bounds = FilterExpressionParser.rangeBounds(condition.value());
            Object low = FilterValues.cast(bounds[0]);
            Object high = FilterValues.cast(bounds[1]);
            return FilterValues.compare(actual, low) >= 0 && FilterValues.compare(actual, high) <= 0;
        }
        Object expected = FilterValues.cast(condition.value());
        return switch (condition.operator()) {
            case EQUALS -> FilterValues.equal(actual, expected);
            case NOT_EQUALS -> !FilterValues.equal(actual, expected);
            case LESS_THAN -> FilterValues.compare(actual, expected) < 0;
            case GREATER_THAN -> FilterValues.compare(actual, expected) > 0;
            case RANGE -> throw new IllegalStateException("range handled above");
        };
    }
}
