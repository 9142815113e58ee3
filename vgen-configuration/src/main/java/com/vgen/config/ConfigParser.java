package com.vgen.config;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parser for the indentation-based configuration subset: nested maps and lists, {@code - } list items
 * (including {@code - key: value} and dash-only map items), flow lists {@code [a, b]}, quoted and bare
 * scalars and {@code #} comments. Anchors, multi-line strings and flow maps are not supported.
 * <p>
 * Open blocks are tracked on an explicit stack of frames. Each frame records the indent of the line that
 * opened it and the indent of its first child; every later child must use the same indent.
 */
public final class ConfigParser {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private ConfigParser() {
    }

    /** Parses {@code text} into a map-rooted value tree. Empty text yields an empty map. */
    public static ConfigValue parse(String text) {
        if (text == null) {
            return new ConfigValue.MapValue(Map.of());
        }
        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        Map<String, Object> root = new LinkedHashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(-1, root));

        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = stripComment(lines[i]);
            if (line.isBlank()) {
                continue;
            }
            int indent = indentOf(line, lineNo);
            String content = line.strip();

            while (stack.size() > 1 && indent <= stack.peek().indent) {
                stack.pop();
            }
            Frame top = stack.peek();
            if (top.childIndent < 0) {
                top.childIndent = indent;
            } else if (indent != top.childIndent) {
                throw new ConfigParseException(lineNo, "indentation does not match any open block");
            }

            if (content.equals("-") || content.startsWith("- ")) {
                if (top.list == null) {
                    throw new ConfigParseException(lineNo, "list item where a map entry is expected");
                }
                String item = content.substring(1).strip();
                if (item.isEmpty()) {
                    Map<String, Object> map = new LinkedHashMap<>();
                    top.list.add(map);
                    stack.push(new Frame(indent, map));
                } else if (keyColon(item) >= 0 && !isQuoted(item) && !item.startsWith("[")) {
                    Map<String, Object> map = new LinkedHashMap<>();
                    top.list.add(map);
                    int entryIndent = indent + content.indexOf(item);
                    Frame itemFrame = new Frame(indent, map);
                    itemFrame.childIndent = entryIndent;
                    stack.push(itemFrame);
                    putEntry(itemFrame, item, entryIndent, lines, i, stack);
                } else {
                    top.list.add(scalar(item));
                }
                continue;
            }

            if (keyColon(content) < 0) {
                throw new ConfigParseException(lineNo, "expected 'key: value' or '- item' but got '" + content + "'");
            }
            if (top.map == null) {
                throw new ConfigParseException(lineNo, "map entry where a list item is expected");
            }
            putEntry(top, content, indent, lines, i, stack);
        }
        return ConfigValue.fromPlain(root);
    }

    private static void putEntry(Frame frame, String entry, int entryIndent, String[] lines, int lineIndex,
                                 Deque<Frame> stack) {
        int colon = keyColon(entry);
        String key = unquote(entry.substring(0, colon).strip());
        if (key.isEmpty()) {
            throw new ConfigParseException(lineIndex + 1, "empty key");
        }
        String rest = entry.substring(colon + 1).strip();
        if (!rest.isEmpty()) {
            frame.map.put(key, scalar(rest));
            return;
        }
        if (nextStartsList(lines, lineIndex, entryIndent)) {
            List<Object> list = new ArrayList<>();
            frame.map.put(key, list);
            stack.push(new Frame(entryIndent, list));
        } else {
            Map<String, Object> map = new LinkedHashMap<>();
            frame.map.put(key, map);
            stack.push(new Frame(entryIndent, map));
        }
    }

    /** Lookahead: whether the next significant line is a list item nested under {@code ownerIndent}. */
    private static boolean nextStartsList(String[] lines, int from, int ownerIndent) {
        for (int j = from + 1; j < lines.length; j++) {
            String next = stripComment(lines[j]);
            if (next.isBlank()) {
                continue;
            }
            int indent = next.length() - next.stripLeading().length();
            String content = next.strip();
            return indent > ownerIndent && (content.equals("-") || content.startsWith("- "));
        }
        return false;
    }

    private static int indentOf(String line, int lineNo) {
        int n = 0;
        while (n < line.length()) {
            char c = line.charAt(n);
            if (c == ' ') {
                n++;
            } else if (c == '\t') {
                throw new ConfigParseException(lineNo, "tab characters are not allowed in indentation");
            } else {
                break;
            }
        }
        return n;
    }

    /** Removes a {@code #} comment that starts the line or follows whitespace, outside quotes. */
    static String stripComment(String line) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (c == '#' && !inSingle && !inDouble
                    && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    /** Index of the key separator: the first ':' outside quotes followed by a space or the end of the line. */
    private static int keyColon(String s) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (c == ':' && !inSingle && !inDouble
                    && (i + 1 == s.length() || s.charAt(i + 1) == ' ')) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isQuoted(String s) {
        return s.length() >= 2
                && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")));
    }

    private static String unquote(String s) {
        return isQuoted(s) ? s.substring(1, s.length() - 1) : s;
    }

    /** Coerces a scalar or flow list; returns plain Java values for {@link ConfigValue#fromPlain}. */
    static Object scalar(String raw) {
        String s = raw.strip();
        if (s.startsWith("[") && s.endsWith("]")) {
            List<Object> out = new ArrayList<>();
            for (String part : splitFlow(s.substring(1, s.length() - 1))) {
                String element = part.strip();
                if (!element.isEmpty()) {
                    out.add(scalar(element));
                }
            }
            return out;
        }
        if (s.equals("{}")) {
            return new LinkedHashMap<String, Object>();
        }
        if (isQuoted(s)) {
            return unquote(s);
        }
        switch (s) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
            case "~":
                return null;
            default:
                break;
        }
        if (INTEGER.matcher(s).matches()) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                return s;
            }
        }
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        return s;
    }

    private static List<String> splitFlow(String body) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        int depth = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble) {
                if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                    continue;
                }
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private static final class Frame {
        final int indent;
        final Map<String, Object> map;
        final List<Object> list;
        int childIndent = -1;

        @SuppressWarnings("unchecked")
        Frame(int indent, Object container) {
            this.indent = indent;
            this.map = container instanceof Map ? (Map<String, Object>) container : null;
            this.list = container instanceof List ? (List<Object>) container : null;
        }
    }
}
