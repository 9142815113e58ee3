package com.vgen.dialogue.model;

/**
 * Traversal behaviour of a dialogue node, derived from its declared type and fields.
 *
 * @see DialogueNode#getKind()
 */
public enum NodeKind {
    MESSAGE,
    CHOICE,
    CONDITIONAL_BRANCH,
    ACTION,
    /** Hands control to the entry node of another sequence. */
    CROSS_JUMP;

    /** Whether nodes of this kind are shown in the chat transcript. */
    public boolean isDisplayable() {
        return this == MESSAGE || this == CHOICE;
    }
}
