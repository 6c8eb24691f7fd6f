package teranet.mapdev.forge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.forge.dto.JoinHealthDto;
import teranet.mapdev.forge.dto.JoinStepHealthDto;
import teranet.mapdev.forge.model.JoinStep;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.forge.util.TestDataFactory.join;
import static teranet.mapdev.forge.util.TestDataFactory.rows;

class JoinHealthServiceTest {

    private JoinHealthService joinHealthService;

    @BeforeEach
    void setUp() {
        joinHealthService = new JoinHealthService(new JoinEngine());
    }

    @Test
    void testCompute_Rates() {
        // Given: left keys 1,1,2,<blank>; right keys 1,3,3
        List<Map<String, String>> left = rows("k", "1", "1", "2", "");
        Map<String, List<Map<String, String>>> rights = new HashMap<>();
        rights.put("b", rows("k", "1", "3", "3"));

        // When
        JoinHealthDto health = joinHealthService.compute(left, rights, List.of(join("b", "left", "k", "k")));

        // Then
        assertEquals(1, health.getSteps().size());
        JoinStepHealthDto step = health.getSteps().get(0);
        assertEquals("b", step.getRight());
        assertEquals("left", step.getHow());
        assertEquals(4, step.getLeftRows());
        assertEquals(3, step.getRightRows());
        assertThat(step.getLeftKeyBlankRate()).isCloseTo(0.25, within(1e-9));
        assertThat(step.getRightKeyBlankRate()).isCloseTo(0.0, within(1e-9));
        assertThat(step.getLeftKeyDuplicateRate()).isCloseTo(1.0 - 2.0 / 3.0, within(1e-9));
        assertThat(step.getRightKeyDuplicateRate()).isCloseTo(1.0 - 2.0 / 3.0, within(1e-9));
        assertThat(step.getMatchRate()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void testCompute_RatesAreNullWithoutDenominator() {
        List<Map<String, String>> left = rows("k", "", "");
        Map<String, List<Map<String, String>>> rights = new HashMap<>();
        rights.put("b", rows("k"));

        JoinStepHealthDto step = joinHealthService.compute(left, rights, List.of(join("b", "left", "k", "k")))
                .getSteps().get(0);

        assertThat(step.getLeftKeyBlankRate()).isCloseTo(1.0, within(1e-9));
        assertNull(step.getRightKeyBlankRate());
        assertNull(step.getLeftKeyDuplicateRate());
        assertNull(step.getRightKeyDuplicateRate());
        assertNull(step.getMatchRate());
    }

    @Test
    void testCompute_SkipsDisabledKeylessAndUnloadedSteps() {
        List<Map<String, String>> left = rows("k", "1");
        Map<String, List<Map<String, String>>> rights = new HashMap<>();
        rights.put("b", rows("k", "1"));
        JoinStep disabled = join("b", "left", "k", "k");
        disabled.setEnabled(false);

        JoinHealthDto health = joinHealthService.compute(left, rights, List.of(
                disabled, JoinStep.disabled("c"), join("d", "left", "k", "k")));

        assertTrue(health.getSteps().isEmpty());
    }

    @Test
    void testCompute_LaterStepMeasuredAgainstJoinedRows() {
        // Given: step c keys on b's prefixed column
        List<Map<String, String>> left = rows("id", "1", "2");
        Map<String, List<Map<String, String>>> rights = new HashMap<>();
        rights.put("b", rows("id,code", "1,X", "2,Y"));
        rights.put("c", rows("code,label", "X,first"));

        JoinHealthDto health = joinHealthService.compute(left, rights, List.of(
                join("b", "left", "id", "id"),
                join("c", "left", "b__code", "code")));

        assertEquals(2, health.getSteps().size());
        JoinStepHealthDto second = health.getSteps().get(1);
        assertEquals(2, second.getLeftRows());
        assertThat(second.getLeftKeyBlankRate()).isCloseTo(0.0, within(1e-9));
        assertThat(second.getMatchRate()).isCloseTo(0.5, within(1e-9));
    }
}
