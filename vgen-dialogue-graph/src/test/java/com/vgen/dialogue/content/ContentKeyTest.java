package com.vgen.dialogue.content;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentKeyTest {

    @Test
    void parse_keyWithModifier() {
        ContentKey key = ContentKey.parse("bot.acknowledge.completion.positive");

        assertTrue(key.isValid());
        assertEquals("bot", key.getActor());
        assertEquals("acknowledge", key.getAction());
        assertEquals("completion", key.getSubject());
        assertEquals(List.of("positive"), key.getModifiers());
        assertEquals("content/bot/acknowledge/completion_positive.txt", key.toFilePath());
        assertEquals("content/bot/acknowledge/", key.siblingsDir());
    }

    @Test
    void parse_threeSegmentsHasNoModifierSuffix() {
        ContentKey key = ContentKey.parse("bot.greet.morning");

        assertEquals("content/bot/greet/morning.txt", key.toFilePath());
        assertEquals("bot.greet.morning", key.toString());
    }

    @Test
    void parse_multipleModifiersJoinedWithUnderscore() {
        assertEquals("content/user/choose/plan_weekly_short.txt",
                ContentKey.parse("user.choose.plan.weekly.short").toFilePath());
    }

    @Test
    void parse_tooFewOrEmptySegmentsInvalid() {
        assertFalse(ContentKey.parse("bot.greet").isValid());
        assertFalse(ContentKey.parse("bot..morning").isValid());
        assertFalse(ContentKey.parse("").isValid());
        assertFalse(ContentKey.parse(null).isValid());
        assertThrows(IllegalStateException.class, () -> ContentKey.parse("bot.greet").toFilePath());
    }
}
