package com.vgen.dialogue.state;

import com.vgen.config.ConfigDocuments;
import com.vgen.config.ConfigParseException;
import com.vgen.config.ConfigValue;
import com.vgen.dialogue.model.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link StateSpec} from a JSON or indented-config document:
 * <pre>
 * entry:
 *   sequence: onboarding_seq
 *   message: 1
 * branch_mode: resolve
 * variables:
 *   user.name: Alice
 * choices:
 *   - sequence: onboarding_seq
 *     message: 4
 *     by: index
 *     value: 1
 * limits:
 *   max_depth: 200
 *   max_paths: 5000
 * </pre>
 */
public final class StateSpecLoader {

    private static final Logger log = LoggerFactory.getLogger(StateSpecLoader.class);

    private StateSpecLoader() {
    }

    public static StateSpec load(Path path) {
        StateSpec spec = fromValue(ConfigDocuments.read(path));
        log.info("State spec loaded from {} (branch_mode={}, {} variable(s), {} choice directive(s))",
                path, spec.getBranchMode().toValue(), spec.getVariables().size(), spec.getChoices().size());
        return spec;
    }

    /**
     * @throws ConfigParseException when a field has the wrong shape or an unknown enum value
     */
    public static StateSpec fromValue(ConfigValue root) {
        if (root.kind() != ConfigValue.Kind.MAP) {
            throw new ConfigParseException(0, "State spec must be a map");
        }
        try {
            ConfigValue entry = root.get("entry");
            String entrySequence = entry.get("sequence").asString(null);
            Integer entryMessage = entry.get("message").isNull() ? null : requireInt(entry.get("message"), "entry.message");

            BranchMode mode = BranchMode.fromValue(root.get("branch_mode").asString(null));

            Map<String, Object> variables = new LinkedHashMap<>();
            for (Map.Entry<String, ConfigValue> e : root.get("variables").entries().entrySet()) {
                variables.put(e.getKey(), e.getValue().toPlain());
            }

            List<ChoiceDirective> directives = new ArrayList<>();
            List<ConfigValue> items = root.get("choices").items();
            for (int i = 0; i < items.size(); i++) {
                directives.add(directive(items.get(i), i));
            }

            ConfigValue limitsValue = root.get("limits");
            TraversalLimits limits = new TraversalLimits(
                    limitsValue.get("max_depth").asInt(TraversalLimits.DEFAULT.getMaxDepth()),
                    limitsValue.get("max_paths").asInt(TraversalLimits.DEFAULT.getMaxPaths()));

            return new StateSpec(entrySequence, entryMessage, mode, variables, directives, limits);
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException("Invalid state spec: " + e.getMessage(), e);
        }
    }

    private static ChoiceDirective directive(ConfigValue item, int index) {
        String sequence = item.get("sequence").asString(null);
        if (sequence == null || sequence.isBlank()) {
            throw new IllegalArgumentException("choices[" + index + "].sequence is required");
        }
        int message = requireInt(item.get("message"), "choices[" + index + "].message");
        SelectionMethod method = SelectionMethod.fromValue(item.get("by").asString("index"));
        String selector = item.get("value").asString(null);
        if (selector == null) {
            throw new IllegalArgumentException("choices[" + index + "].value is required");
        }
        return new ChoiceDirective(new NodeAddress(sequence, message), method, selector);
    }

    private static int requireInt(ConfigValue value, String field) {
        long v = value.asLong(Long.MIN_VALUE);
        if (v == Long.MIN_VALUE || v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return (int) v;
    }
}
