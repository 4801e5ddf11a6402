package com.convector.filter;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.convector.config.ConfigurationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterExpressionParserTest {

    @Test
    void shouldParseComparisonOperators() {
        assertEquals(new FilterCondition("user_id", FilterOperator.GREATER_THAN, "50"),
                FilterExpressionParser.parse("user_id>50"));
        assertEquals(new FilterCondition("metadata.age", FilterOperator.LESS_THAN, "50"),
                FilterExpressionParser.parse("metadata.age<50"));
        assertEquals(new FilterCondition("lang", FilterOperator.EQUALS, "en"),
                FilterExpressionParser.parse("lang=en"));
        assertEquals(new FilterCondition("lang", FilterOperator.EQUALS, "en"),
                FilterExpressionParser.parse("lang == en"));
        assertEquals(new FilterCondition("lang", FilterOperator.NOT_EQUALS, "de"),
                FilterExpressionParser.parse("lang!=de"));
    }

    @Test
    void shouldParseRangeOperator() {
        FilterCondition condition = FilterExpressionParser.parse("metadata.temp<=>1,3");

        assertEquals("metadata.temp", condition.field());
        assertEquals(FilterOperator.RANGE, condition.operator());
        assertEquals("1,3", condition.value());
    }

    @Test
    void shouldTreatBareFieldAsInclusionDirective() {
        FilterCondition condition = FilterExpressionParser.parse("conversation_id");

        assertTrue(condition.isInclusion());
        assertEquals("conversation_id", condition.field());
    }

    @Test
    void shouldRejectMalformedExpressions() {
        for (String expression : List.of("", "age>", ">5", "age<=5", "temp<=>1", "temp<=>1,", "bad field", "a..b")) {
            assertThrows(ConfigurationException.class, () -> FilterExpressionParser.parse(expression), expression);
        }
    }
}
