package com.vgen.dialogue.path;

/**
 * Option taken at a CHOICE node: zero-based index, display text and optional content key.
 */
public record ChoiceSelection(int index, String text, String contentKey) {
}
