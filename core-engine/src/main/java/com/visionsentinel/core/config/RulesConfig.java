package com.visionsentinel.core.config;

import com.visionsentinel.core.model.AlarmRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - id: helmet
 *     classNames: [no_helmet]
 *     minConfidence: 0.5
 *     consecutiveFrames: 3
 *     cooldownSeconds: 30
 *     timeRange: {start: "08:00", end: "18:00"}
 *     channels: [LOG, CALLBACK]
 * algorithms:
 *   - code: helmet_detection
 *     modelId: models/helmet.pt
 *     postProcessing: REQUIRED_EQUIPMENT
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every entry is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<AlarmRule> rules = new ArrayList<>();

    private List<AlgorithmDefinition> algorithms = new ArrayList<>();

    /**
     * @return unmodifiable list of alarm rules
     */
    public List<AlarmRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /** Bound by SnakeYAML; {@code null} means no rules. */
    public void setRules(List<AlarmRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of algorithm definitions
     */
    public List<AlgorithmDefinition> getAlgorithms() {
        return Collections.unmodifiableList(algorithms);
    }

    public void setAlgorithms(List<AlgorithmDefinition> algorithms) {
        this.algorithms = algorithms != null ? new ArrayList<>(algorithms) : new ArrayList<>();
    }

    /**
     * Check every rule and algorithm, including duplicate rule ids and
     * algorithm codes. All problems are reported in one exception.
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        check(rules, "Rule", AlarmRule::validate, AlarmRule::getId, "Duplicate rule id", errors);
        check(algorithms, "Algorithm", AlgorithmDefinition::validate, AlgorithmDefinition::getCode,
                "Duplicate algorithm code", errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private static <T> void check(List<T> entries, String kind, Consumer<T> validator,
            Function<T, String> key, String duplicateMessage, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            T entry = entries.get(i);
            if (entry == null) {
                errors.add(kind + " at index " + i + " is empty");
                continue;
            }
            try {
                validator.accept(entry);
                if (!seen.add(key.apply(entry))) {
                    errors.add(duplicateMessage + ": '" + key.apply(entry) + "'");
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + ", algorithms=" + algorithms + '}';
    }
}
