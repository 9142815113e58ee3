package com.vgen.dialogue.context;

import com.vgen.config.settings.ContextSettings;
import com.vgen.dialogue.content.ContentCorpus;
import com.vgen.dialogue.content.ContentKey;
import com.vgen.dialogue.index.SequenceIndex;
import com.vgen.dialogue.model.DialogueNode;
import com.vgen.dialogue.model.NodeKind;
import com.vgen.dialogue.path.ChoiceSelection;
import com.vgen.dialogue.path.ResolvedPath;
import com.vgen.dialogue.path.ResolvedPathNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Projects a resolved path onto the last {@code context.history_bubbles} displayable turns before the
 * target. Branch and action nodes are not displayed and are skipped. A jump node that carries a message
 * is shown as a message turn.
 */
public final class ContextWindowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextWindowBuilder.class);

    static final String CHOICE_PLACEHOLDER = "(user choice)";

    private final SequenceIndex index;
    private final ContentCorpus corpus;
    private final ContextSettings settings;

    public ContextWindowBuilder(SequenceIndex index, ContentCorpus corpus, ContextSettings settings) {
        this.index = index;
        this.corpus = corpus;
        this.settings = settings;
    }

    public List<ContextTurn> build(ResolvedPath path) {
        List<ResolvedPathNode> nodes = path.nodes();
        List<ContextTurn> turns = new ArrayList<>();
        for (int i = nodes.size() - 2; i >= 0 && turns.size() < settings.getHistoryBubbles(); i--) {
            ResolvedPathNode step = nodes.get(i);
            switch (step.kind()) {
                case MESSAGE:
                    turns.add(messageTurn(step));
                    break;
                case CHOICE:
                    turns.add(choiceTurn(step, nodes.get(i + 1).selection()));
                    break;
                case CROSS_JUMP:
                    DialogueNode jump = index.require(step.address());
                    if (jump.isDisplayable()) {
                        turns.add(messageTurn(step));
                    }
                    break;
                default:
                    break;
            }
        }
        Collections.reverse(turns);
        log.debug("Context window for {}: {} turn(s)", path.last().address(), turns.size());
        return turns;
    }

    private ContextTurn messageTurn(ResolvedPathNode step) {
        DialogueNode node = index.require(step.address());
        String key = node.getContentKey();
        String reference = key != null ? ContextTurn.CONTENT_KEY_PREFIX + key
                : (node.getText() != null ? node.getText() : "");
        return new ContextTurn(step.sequenceId(), step.messageId(), node.effectiveSender(), NodeKind.MESSAGE,
                reference, examplesFor(key));
    }

    private ContextTurn choiceTurn(ResolvedPathNode step, ChoiceSelection selection) {
        String key = selection != null ? selection.contentKey() : null;
        String reference;
        if (key != null) {
            reference = ContextTurn.CONTENT_KEY_PREFIX + key;
        } else if (selection != null && selection.text() != null && !selection.text().isBlank()) {
            reference = selection.text();
        } else {
            reference = CHOICE_PLACEHOLDER;
        }
        return new ContextTurn(step.sequenceId(), step.messageId(), "user", step.kind(), reference, examplesFor(key));
    }

    private List<String> examplesFor(String key) {
        if (key == null || settings.getExamplesPerTurn() == 0) {
            return List.of();
        }
        ContentKey contentKey = ContentKey.parse(key);
        if (!contentKey.isValid()) {
            log.debug("Context turn references invalid content key '{}'; no examples attached", key);
            return List.of();
        }
        List<String> lines = corpus.readLines(contentKey);
        return lines.subList(0, Math.min(lines.size(), settings.getExamplesPerTurn()));
    }
}
