package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.dto.JoinHealthDto;
import teranet.mapdev.forge.dto.JoinStepHealthDto;
import teranet.mapdev.forge.model.JoinKeyPair;
import teranet.mapdev.forge.model.JoinStep;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sample-based key quality metrics per join step.
 *
 * The left side of a step is the row set produced by the earlier executable
 * steps, so prefixed left keys resolve the same way they do in the preview.
 * Steps that are disabled, key-less or whose right-hand rows are missing
 * produce no entry.
 */
@Service
@Slf4j
public class JoinHealthService {

    private final JoinEngine joinEngine;

    public JoinHealthService(JoinEngine joinEngine) {
        this.joinEngine = joinEngine;
    }

    public JoinHealthDto compute(List<Map<String, String>> primaryRows,
            Map<String, List<Map<String, String>>> rightRows,
            List<JoinStep> steps) {
        JoinHealthDto health = new JoinHealthDto();
        if (steps == null) {
            return health;
        }

        List<Map<String, String>> current = primaryRows;
        for (JoinStep step : steps) {
            if (!step.isExecutable()) {
                continue;
            }
            List<Map<String, String>> right = rightRows.get(step.getRight());
            if (right == null) {
                log.debug("No rows for dataset {}, skipping join health", step.getRight());
                continue;
            }
            health.getSteps().add(measure(current, right, step));
            current = joinEngine.applyStep(current, right, step);
        }
        return health;
    }

    JoinStepHealthDto measure(List<Map<String, String>> leftRows,
            List<Map<String, String>> rightRows,
            JoinStep step) {
        List<JoinKeyPair> keys = step.getCompleteKeys();
        List<String> leftColumns = keys.stream().map(JoinKeyPair::getLeftTrimmed).collect(Collectors.toList());
        List<String> rightColumns = keys.stream().map(JoinKeyPair::getRightTrimmed).collect(Collectors.toList());

        List<List<String>> leftKeys = nonBlankKeys(leftRows, leftColumns);
        List<List<String>> rightKeys = nonBlankKeys(rightRows, rightColumns);
        Set<List<String>> rightKeySet = new HashSet<>(rightKeys);
        long matches = leftKeys.stream().filter(rightKeySet::contains).count();

        JoinStepHealthDto dto = JoinStepHealthDto.builder()
                .right(step.getRight())
                .how(step.getJoinType().getName())
                .keys(keys)
                .leftRows(leftRows.size())
                .rightRows(rightRows.size())
                .leftKeyBlankRate(rate(leftRows.size() - leftKeys.size(), leftRows.size()))
                .rightKeyBlankRate(rate(rightRows.size() - rightKeys.size(), rightRows.size()))
                .leftKeyDuplicateRate(duplicateRate(leftKeys))
                .rightKeyDuplicateRate(duplicateRate(rightKeySet.size(), rightKeys.size()))
                .matchRate(rate(matches, leftKeys.size()))
                .build();

        log.debug("Join health for {}: match rate {}", step.getRight(), dto.getMatchRate());
        return dto;
    }

    private List<List<String>> nonBlankKeys(List<Map<String, String>> rows, List<String> columns) {
        List<List<String>> keys = new ArrayList<>();
        for (Map<String, String> row : rows) {
            List<String> key = joinEngine.keyTuple(row, columns);
            if (key != null) {
                keys.add(key);
            }
        }
        return keys;
    }

    private Double duplicateRate(List<List<String>> keys) {
        return duplicateRate(new HashSet<>(keys).size(), keys.size());
    }

    private Double duplicateRate(int distinct, int total) {
        return total == 0 ? null : 1.0 - (double) distinct / total;
    }

    private Double rate(long numerator, long denominator) {
        return denominator == 0 ? null : (double) numerator / denominator;
    }
}
