package teranet.mapdev.forge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import teranet.mapdev.forge.model.FilterGroup;
import teranet.mapdev.forge.model.FilterSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.forge.util.TestDataFactory.filter;
import static teranet.mapdev.forge.util.TestDataFactory.group;
import static teranet.mapdev.forge.util.TestDataFactory.row;
import static teranet.mapdev.forge.util.TestDataFactory.rows;

/**
 * Unit tests for FilterEvaluator
 * Covers every operator family and the OR-of-AND group semantics
 */
class FilterEvaluatorTest {

    private FilterEvaluator evaluator;

    private final Map<String, String> order = row(
            "id", "7", "name", "Widget Pro", "amount", "42.5", "shipped", "2024-03-10", "note", "NULL");

    @BeforeEach
    void setUp() {
        evaluator = new FilterEvaluator();
    }

    @ParameterizedTest
    @CsvSource({
            "note, blank, , true",
            "missing, blank, , true",
            "name, blank, , false",
            "note, notblank, , false",
            "name, contains, widget, true",
            "name, contains_cs, widget, false",
            "name, startswith, WIDGET, true",
            "name, startswith_cs, Widget, true",
            "name, endswith, PRO, true",
            "name, endswith_cs, PRO, false",
            "name, eq, Widget Pro, true",
            "name, eq, widget pro, false",
            "name, neq, Other, true",
            "note, eq, '', true",
            "id, in, '1, 7 ,9', true",
            "id, notin, '1,9', true",
            "amount, gt, 42, true",
            "amount, gte, 42.5, true",
            "amount, lt, 42.5, false",
            "amount, lte, 1e2, true",
            "shipped, date_gt, 2024-03-01, true",
            "shipped, date_gte, 03/10/2024, true",
            "shipped, date_lt, 2024-03-10, false",
            "shipped, date_lte, 2024-03-10T00:00:00, true",
            "name, regex, 'W\\w+\\s', true",
            "name, regex, ^Pro, false"
    })
    void testMatches_Operators(String column, String op, String value, boolean expected) {
        assertEquals(expected, evaluator.matches(filter(column, op, value), order));
    }

    @Test
    void testMatches_OperatorNameIsCaseInsensitive() {
        assertTrue(evaluator.matches(filter("name", " CONTAINS ", "pro"), order));
    }

    @Test
    void testMatches_UnparsableComparisonsDoNotMatch() {
        assertFalse(evaluator.matches(filter("name", "gt", "1"), order));
        assertFalse(evaluator.matches(filter("amount", "gt", "abc"), order));
        assertFalse(evaluator.matches(filter("name", "date_lt", "2024-01-01"), order));
        assertFalse(evaluator.matches(filter("note", "lt", "100"), order));
    }

    @Test
    void testMatches_InvalidRegexDoesNotMatch() {
        assertFalse(evaluator.matches(filter("name", "regex", "([unclosed"), order));
        assertFalse(evaluator.matches(filter("name", "regex", "([unclosed"), order));
        assertTrue(evaluator.compiledPattern("([unclosed").isEmpty());
    }

    @Test
    void testApply_RegexCompiledOncePerPattern() {
        // Given
        List<Map<String, String>> input = rows("name", "Widget Pro", "Gadget", "Widget Mini");

        // When
        List<Map<String, String>> kept = evaluator.apply(input,
                List.of(group(filter("name", "regex", "^Widget"))));

        // Then: every row reused the same compiled pattern
        assertThat(kept).extracting(r -> r.get("name")).containsExactly("Widget Pro", "Widget Mini");
        assertSame(evaluator.compiledPattern("^Widget").get(), evaluator.compiledPattern("^Widget").get());
    }

    @Test
    void testMatches_UnknownOperatorMatches() {
        assertTrue(evaluator.matches(filter("name", "similar_to", "x"), order));
    }

    @Test
    void testMatchesAny_OrOfAnd() {
        // Given: groups [[A, B], [C]]
        FilterSpec a = filter("x", "eq", "1");
        FilterSpec b = filter("y", "eq", "1");
        FilterSpec c = filter("z", "eq", "1");
        List<FilterGroup> groups = List.of(group(a, b), group(c));

        // Then: row matches iff (A and B) or C
        assertTrue(evaluator.matchesAny(groups, row("x", "1", "y", "1", "z", "0")));
        assertFalse(evaluator.matchesAny(groups, row("x", "1", "y", "0", "z", "0")));
        assertTrue(evaluator.matchesAny(groups, row("x", "0", "y", "0", "z", "1")));
        assertFalse(evaluator.matchesAny(groups, row("x", "0", "y", "1", "z", "0")));
    }

    @Test
    void testMatchesAny_AllEmptyGroupsPassEveryRow() {
        List<FilterGroup> groups = List.of(new FilterGroup(), new FilterGroup(new ArrayList<>()));

        assertTrue(evaluator.matchesAny(groups, order));
        assertTrue(evaluator.matchesAny(new ArrayList<>(), order));
        assertTrue(evaluator.matchesAny(null, order));
    }

    @Test
    void testMatchesAny_EmptyGroupNeverContributesMatch() {
        List<FilterGroup> groups = List.of(new FilterGroup(), group(filter("id", "eq", "8")));

        assertFalse(evaluator.matchesAny(groups, order));
    }

    @Test
    void testApply_KeepsOrderOfMatchingRows() {
        List<Map<String, String>> input = rows("id,status", "1,open", "2,closed", "3,open");

        List<Map<String, String>> kept = evaluator.apply(input, List.of(group(filter("status", "eq", "open"))));

        assertThat(kept).extracting(r -> r.get("id")).containsExactly("1", "3");
    }
}
