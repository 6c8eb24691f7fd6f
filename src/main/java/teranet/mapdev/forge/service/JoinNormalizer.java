package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.JoinKeyPair;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.JoinType;
import teranet.mapdev.forge.model.LegacyJoin;
import teranet.mapdev.forge.model.TransformSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes the join configuration of a transform.
 *
 * The result holds one step per declared right-hand dataset, in declaration
 * order, followed by steps naming datasets that are not declared (kept so
 * validation can report them). The legacy {@code join_enabled}/{@code join}
 * fields are read only when no {@code joins} list exists, and are rewritten
 * from the first canonical step afterwards.
 */
@Service
@Slf4j
public class JoinNormalizer {

    static final String FALLBACK_RIGHT_TAG = "b";

    /**
     * Rebuild {@code transform.joins} in canonical form and refresh the legacy mirror.
     *
     * @param transform the transform to normalize (modified in place)
     * @param rightTags declared right-hand dataset tags, in declaration order
     * @return the canonical step list now held by the transform
     */
    public List<JoinStep> normalize(TransformSpec transform, List<String> rightTags) {
        List<JoinStep> declared = transform.getJoins() != null
                ? transform.getJoins()
                : fromLegacy(transform, rightTags);

        Map<String, JoinStep> byRight = new LinkedHashMap<>();
        for (JoinStep step : declared) {
            if (step == null || step.getRight() == null || step.getRight().isBlank()) {
                continue;
            }
            String right = step.getRight().trim();
            if (byRight.containsKey(right)) {
                log.debug("Ignoring duplicate join step for dataset {}", right);
                continue;
            }
            byRight.put(right, canonicalize(right, step));
        }

        List<JoinStep> canonical = new ArrayList<>();
        for (String tag : rightTags) {
            JoinStep step = byRight.remove(tag);
            canonical.add(step != null ? step : JoinStep.disabled(tag));
        }
        // Steps for datasets that are not registered keep their configured order
        canonical.addAll(byRight.values());

        transform.setJoins(canonical);
        mirrorLegacy(transform);
        return canonical;
    }

    private List<JoinStep> fromLegacy(TransformSpec transform, List<String> rightTags) {
        List<JoinStep> steps = new ArrayList<>();
        LegacyJoin legacy = transform.getJoin();
        if (transform.getJoinEnabled() == null && legacy == null) {
            return steps;
        }

        String target = rightTags.isEmpty() ? FALLBACK_RIGHT_TAG : rightTags.get(0);
        List<JoinKeyPair> keys = new ArrayList<>();
        String how = JoinType.LEFT.getName();
        if (legacy != null) {
            how = legacy.getHow();
            if (legacy.getKeys() != null) {
                for (LegacyJoin.KeyPair pair : legacy.getKeys()) {
                    if (pair != null) {
                        keys.add(new JoinKeyPair(pair.getA(), pair.getB()));
                    }
                }
            }
        }

        log.debug("Migrating legacy join configuration to a step for dataset {}", target);
        steps.add(new JoinStep(target, Boolean.TRUE.equals(transform.getJoinEnabled()), how, keys));
        return steps;
    }

    private JoinStep canonicalize(String right, JoinStep step) {
        List<JoinKeyPair> keys = new ArrayList<>();
        if (step.getKeys() != null) {
            for (JoinKeyPair key : step.getKeys()) {
                if (key != null) {
                    keys.add(new JoinKeyPair(key.getLeftTrimmed(), key.getRightTrimmed()));
                }
            }
        }
        if (keys.isEmpty()) {
            keys.add(JoinKeyPair.placeholder());
        }

        // Unrecognized values are kept so validation can report them
        String how = step.getHow() == null || step.getHow().isBlank()
                ? JoinType.LEFT.getName()
                : step.getHow().trim().toLowerCase(Locale.ROOT);

        return new JoinStep(right, step.isEnabled(), how, keys);
    }

    private void mirrorLegacy(TransformSpec transform) {
        List<LegacyJoin.KeyPair> pairs = new ArrayList<>();
        if (transform.getJoins().isEmpty()) {
            pairs.add(new LegacyJoin.KeyPair("", ""));
            transform.setJoinEnabled(false);
            transform.setJoin(new LegacyJoin(JoinType.LEFT.getName(), pairs));
            return;
        }

        JoinStep first = transform.getJoins().get(0);
        for (JoinKeyPair key : first.getKeys()) {
            pairs.add(new LegacyJoin.KeyPair(key.getLeftTrimmed(), key.getRightTrimmed()));
        }
        transform.setJoinEnabled(first.isEnabled());
        transform.setJoin(new LegacyJoin(first.getHow(), pairs));
    }
}
