package com.vgen.dialogue.state;

import com.vgen.dialogue.model.ChoiceOption;
import com.vgen.dialogue.model.NodeAddress;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Pins the option taken at one CHOICE node.
 */
public record ChoiceDirective(NodeAddress address, SelectionMethod method, String selector) {

    public ChoiceDirective {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(selector, "selector");
    }

    /** Index of the selected option, or empty when the selector matches none. */
    public OptionalInt select(List<ChoiceOption> options) {
        switch (method) {
            case BY_INDEX:
                try {
                    int index = Integer.parseInt(selector.trim());
                    return index >= 0 && index < options.size() ? OptionalInt.of(index) : OptionalInt.empty();
                } catch (NumberFormatException e) {
                    return OptionalInt.empty();
                }
            case BY_TEXT:
                for (int i = 0; i < options.size(); i++) {
                    if (selector.equals(options.get(i).getText())) return OptionalInt.of(i);
                }
                return OptionalInt.empty();
            case BY_CONTENT_KEY:
                for (int i = 0; i < options.size(); i++) {
                    if (selector.equals(options.get(i).getContentKey())) return OptionalInt.of(i);
                }
                return OptionalInt.empty();
            default:
                return OptionalInt.empty();
        }
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sequence", address.sequenceId());
        m.put("message", address.messageId());
        m.put("by", method.toValue());
        m.put("value", selector);
        return m;
    }
}
