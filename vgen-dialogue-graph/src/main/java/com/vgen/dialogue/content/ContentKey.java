package com.vgen.dialogue.content;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Dotted content identifier {@code actor.action.subject[.modifier...]} and its file address under the
 * assets root: {@code content/<actor>/<action>/<subject>[_<modifier>...].txt}.
 * <p>
 * A key with fewer than three segments, or with an empty segment, is parsed as invalid; its path
 * accessors throw.
 */
public final class ContentKey {

    static final String CONTENT_DIR = "content";

    private final String key;
    private final String actor;
    private final String action;
    private final String subject;
    private final List<String> modifiers;
    private final boolean valid;

    private ContentKey(String key, String actor, String action, String subject, List<String> modifiers, boolean valid) {
        this.key = key;
        this.actor = actor;
        this.action = action;
        this.subject = subject;
        this.modifiers = modifiers;
        this.valid = valid;
    }

    public static ContentKey parse(String key) {
        String raw = key != null ? key.trim() : "";
        String[] parts = raw.split("\\.", -1);
        boolean valid = parts.length >= 3 && Arrays.stream(parts).noneMatch(String::isEmpty);
        if (!valid) {
            return new ContentKey(raw, "", "", "", List.of(), false);
        }
        return new ContentKey(raw, parts[0], parts[1], parts[2],
                List.of(Arrays.copyOfRange(parts, 3, parts.length)), true);
    }

    public boolean isValid() {
        return valid;
    }

    /** The key as given (trimmed). */
    public String getKey() {
        return key;
    }

    public String getActor() {
        return actor;
    }

    public String getAction() {
        return action;
    }

    public String getSubject() {
        return subject;
    }

    public List<String> getModifiers() {
        return modifiers;
    }

    /** Relative file address, e.g. {@code content/bot/acknowledge/completion_positive.txt}. */
    public String toFilePath() {
        requireValid();
        String name = modifiers.isEmpty() ? subject : subject + "_" + String.join("_", modifiers);
        return siblingsDir() + name + ".txt";
    }

    /** Directory holding this key and its siblings, with a trailing slash. */
    public String siblingsDir() {
        requireValid();
        return CONTENT_DIR + "/" + actor + "/" + action + "/";
    }

    private void requireValid() {
        if (!valid) {
            throw new IllegalStateException("Invalid content key '" + key
                    + "' (expected actor.action.subject[.modifier...])");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return key.equals(((ContentKey) o).key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return key;
    }
}
