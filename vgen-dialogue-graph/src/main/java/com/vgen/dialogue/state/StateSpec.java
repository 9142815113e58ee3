package com.vgen.dialogue.state;

import com.vgen.dialogue.model.NodeAddress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hypothetical user state used to resolve a path: where traversal starts, how branches are decided,
 * the variables conditions see, which options are taken at choice nodes, and search limits.
 */
public final class StateSpec {

    private final String entrySequence;
    private final Integer entryMessage;
    private final BranchMode branchMode;
    private final Map<String, Object> variables;
    private final List<ChoiceDirective> choices;
    private final TraversalLimits limits;

    /**
     * @param entrySequence sequence to start in; null = the target's own sequence
     * @param entryMessage  start node id; null = the entry node of {@code entrySequence}
     */
    public StateSpec(String entrySequence, Integer entryMessage, BranchMode branchMode,
                     Map<String, Object> variables, List<ChoiceDirective> choices, TraversalLimits limits) {
        this.entrySequence = entrySequence != null && !entrySequence.isBlank() ? entrySequence : null;
        this.entryMessage = entryMessage;
        this.branchMode = branchMode != null ? branchMode : BranchMode.RESOLVE;
        this.variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
        this.choices = choices != null ? List.copyOf(choices) : List.of();
        this.limits = limits != null ? limits : TraversalLimits.DEFAULT;
    }

    /** Start at the target's sequence entry, resolve branches, no variables or directives. */
    public static StateSpec empty() {
        return new StateSpec(null, null, BranchMode.RESOLVE, Map.of(), List.of(), TraversalLimits.DEFAULT);
    }

    public Optional<String> getEntrySequence() {
        return Optional.ofNullable(entrySequence);
    }

    public Optional<Integer> getEntryMessage() {
        return Optional.ofNullable(entryMessage);
    }

    public BranchMode getBranchMode() {
        return branchMode;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public List<ChoiceDirective> getChoices() {
        return choices;
    }

    public TraversalLimits getLimits() {
        return limits;
    }

    /** First directive declared for {@code address}. */
    public Optional<ChoiceDirective> directiveFor(NodeAddress address) {
        for (ChoiceDirective d : choices) {
            if (d.address().equals(address)) return Optional.of(d);
        }
        return Optional.empty();
    }

    /** Plain-map form, in the same layout as the state document, for archive records. */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("sequence", entrySequence);
        entry.put("message", entryMessage);
        Map<String, Object> limitsMap = new LinkedHashMap<>();
        limitsMap.put("max_depth", limits.getMaxDepth());
        limitsMap.put("max_paths", limits.getMaxPaths());
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("entry", entry);
        m.put("branch_mode", branchMode.toValue());
        m.put("variables", variables);
        m.put("choices", choices.stream().map(ChoiceDirective::toSnapshot).toList());
        m.put("limits", limitsMap);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateSpec that = (StateSpec) o;
        return Objects.equals(entrySequence, that.entrySequence)
                && Objects.equals(entryMessage, that.entryMessage)
                && branchMode == that.branchMode
                && variables.equals(that.variables)
                && choices.equals(that.choices)
                && limits.equals(that.limits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entrySequence, entryMessage, branchMode, variables, choices, limits);
    }
}
