package com.vgen.generation.validation;

import com.vgen.config.PipelineConfig;
import com.vgen.config.settings.GenerationSettings;
import com.vgen.config.settings.SafetySettings;
import com.vgen.config.settings.StyleSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Filters generated candidates. Each candidate is trimmed and has tabs replaced by spaces, then must
 * pass, in order: placeholder brace balance, bubble count and per-bubble length ({@code |||} separates
 * bubbles), the pipe and emoji style rules, the safety blocklist and PII patterns, and finally
 * near-duplicate checks against the existing lines and then against lines accepted earlier in the batch.
 */
public final class VariantValidator {

    private static final Logger log = LoggerFactory.getLogger(VariantValidator.class);

    public static final String BUBBLE_SEPARATOR = "|||";

    private final GenerationSettings gen;
    private final StyleSettings style;
    private final List<String> blocklist;
    private final List<Pattern> piiPatterns;

    public VariantValidator(GenerationSettings gen, StyleSettings style, SafetySettings safety) {
        this.gen = gen;
        this.style = style;
        this.blocklist = safety.getBlocklist().stream()
                .filter(w -> !w.isBlank())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .toList();
        this.piiPatterns = compile(safety.getPiiRegexes());
    }

    public VariantValidator(PipelineConfig config) {
        this(config.getGen(), config.getStyle(), config.getSafety());
    }

    public ValidationResult validate(List<String> candidates, List<String> existing) {
        List<String> accepted = new ArrayList<>();
        List<ValidationResult.Rejection> rejected = new ArrayList<>();
        for (String raw : candidates) {
            String line = raw == null ? "" : raw.trim().replace('\t', ' ');
            RejectionReason reason = check(line, existing, accepted);
            if (reason == null) {
                accepted.add(line);
            } else {
                log.debug("Rejected candidate ({}): {}", reason, line);
                rejected.add(new ValidationResult.Rejection(line, reason));
            }
        }
        log.debug("Validation accepted {} of {} candidates", accepted.size(), candidates.size());
        return new ValidationResult(accepted, rejected);
    }

    private RejectionReason check(String line, List<String> existing, List<String> accepted) {
        if (line.isEmpty()) {
            return RejectionReason.EMPTY;
        }
        if (!bracesBalanced(line)) {
            return RejectionReason.UNBALANCED_PLACEHOLDER;
        }
        if (!style.isAllowPipes() && line.contains(BUBBLE_SEPARATOR)) {
            return RejectionReason.PIPES_NOT_ALLOWED;
        }
        String[] bubbles = line.split(Pattern.quote(BUBBLE_SEPARATOR), -1);
        if (bubbles.length > gen.getMaxBubblesPerLine()) {
            return RejectionReason.TOO_MANY_BUBBLES;
        }
        for (String bubble : bubbles) {
            if (bubble.trim().length() > gen.getMaxCharsPerBubble()) {
                return RejectionReason.BUBBLE_TOO_LONG;
            }
        }
        if (style.isForbidEmojis() && containsEmoji(line)) {
            return RejectionReason.EMOJI;
        }
        String lowered = line.toLowerCase(Locale.ROOT);
        for (String word : blocklist) {
            if (lowered.contains(word)) {
                return RejectionReason.BLOCKLISTED;
            }
        }
        for (Pattern pii : piiPatterns) {
            if (pii.matcher(line).find()) {
                return RejectionReason.PII;
            }
        }
        if (isNearDuplicate(line, existing)) {
            return RejectionReason.DUPLICATE_OF_EXISTING;
        }
        if (isNearDuplicate(line, accepted)) {
            return RejectionReason.DUPLICATE_IN_BATCH;
        }
        return null;
    }

    private boolean isNearDuplicate(String line, List<String> pool) {
        for (String other : pool) {
            if (TokenSimilarity.jaccard(line, other) >= gen.getDedupeThreshold()) {
                return true;
            }
        }
        return false;
    }

    /** Every '}' closes an earlier '{' and nothing stays open. */
    static boolean bracesBalanced(String s) {
        int open = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '{') {
                open++;
            } else if (c == '}') {
                open--;
                if (open < 0) {
                    return false;
                }
            }
        }
        return open == 0;
    }

    static boolean containsEmoji(String s) {
        return s.codePoints().anyMatch(cp ->
                (cp >= 0x1F000 && cp <= 0x1FAFF)
                        || (cp >= 0x2600 && cp <= 0x27BF)
                        || (cp >= 0x2B00 && cp <= 0x2BFF)
                        || cp == 0xFE0F);
    }

    private static List<Pattern> compile(List<String> regexes) {
        List<Pattern> out = new ArrayList<>();
        for (String regex : regexes) {
            try {
                out.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid safety.pii_regexes entry '" + regex + "'", e);
            }
        }
        return List.copyOf(out);
    }
}
