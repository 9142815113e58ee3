package com.vgen.config.settings;

import com.vgen.config.ConfigParseException;
import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class SafetySettings {

    public static final SafetySettings DEFAULTS = new SafetySettings(List.of(), List.of());

    private final List<String> blocklist;
    private final List<String> piiRegexes;

    public SafetySettings(List<String> blocklist, List<String> piiRegexes) {
        this.blocklist = blocklist != null ? List.copyOf(blocklist) : List.of();
        this.piiRegexes = piiRegexes != null ? List.copyOf(piiRegexes) : List.of();
    }

    /**
     * @throws ConfigParseException when a {@code pii_regexes} entry is not a valid regular expression
     */
    public static SafetySettings from(ConfigValue section) {
        List<String> piiRegexes = section.get("pii_regexes").asStringList(DEFAULTS.piiRegexes);
        for (String regex : piiRegexes) {
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new ConfigParseException("Invalid safety.pii_regexes entry '" + regex + "': "
                        + e.getDescription(), e);
            }
        }
        return new SafetySettings(section.get("blocklist").asStringList(DEFAULTS.blocklist), piiRegexes);
    }

    /** Substrings rejected case-insensitively. */
    public List<String> getBlocklist() {
        return blocklist;
    }

    public List<String> getPiiRegexes() {
        return piiRegexes;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("blocklist", blocklist);
        m.put("pii_regexes", piiRegexes);
        return m;
    }
}
