package com.vgen.dialogue.index;

import com.vgen.dialogue.model.DialogueNode;
import com.vgen.dialogue.model.NodeAddress;
import com.vgen.dialogue.model.NodeKind;
import com.vgen.dialogue.model.SequenceDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceIndexTest {

    private static final String ONBOARDING = """
            {
              "sequenceId": "onboarding",
              "name": "Onboarding",
              "messages": [
                {"id": 1, "type": "bot", "text": "Hi", "contentKey": "bot.greet.morning", "placeholders": ["x"]},
                {"id": 2, "type": "choice", "choices": [
                  {"text": "Yes", "nextMessageId": 3},
                  {"text": "Later", "sequenceId": "later"}
                ]},
                {"id": 3, "type": "autoroute", "routes": [{"condition": "user.a == 1", "nextMessageId": 4}, {"default": true, "sequenceId": "later"}]},
                {"id": 4, "type": "dataAction"},
                {"id": 5, "type": "user", "text": "ok"},
                {"id": 6, "sequenceId": "later"},
                {"id": 7, "sequenceId": "onboarding", "text": "self"},
                {"id": 8, "isChoice": true, "choices": []},
                {"id": 9, "type": "textInput"}
              ]
            }
            """;

    @TempDir
    Path assets;

    private SequenceIndex fileIndex() throws Exception {
        Path dir = Files.createDirectories(assets.resolve("sequences"));
        Files.writeString(dir.resolve("onboarding.json"), ONBOARDING);
        Files.writeString(dir.resolve("later.json"), """
                {"sequenceId": "later", "messages": [{"id": 10, "text": "first"}, {"id": 11, "text": "second"}]}
                """);
        return new SequenceIndex(new FileSequenceSource(assets));
    }

    @Test
    void nodes_kindMapping() throws Exception {
        SequenceIndex index = fileIndex();

        assertEquals(NodeKind.MESSAGE, kind(index, 1));
        assertEquals(NodeKind.CHOICE, kind(index, 2));
        assertEquals(NodeKind.CONDITIONAL_BRANCH, kind(index, 3));
        assertEquals(NodeKind.ACTION, kind(index, 4));
        assertEquals(NodeKind.MESSAGE, kind(index, 5));
        assertEquals(NodeKind.CROSS_JUMP, kind(index, 6));
        assertEquals(NodeKind.MESSAGE, kind(index, 7));
        assertEquals(NodeKind.CHOICE, kind(index, 8));
        assertEquals(NodeKind.MESSAGE, kind(index, 9));
    }

    @Test
    void nodes_fieldsBoundToOwningSequence() throws Exception {
        DialogueNode node = fileIndex().require(new NodeAddress("onboarding", 2));

        assertEquals("onboarding", node.getOwningSequence());
        assertEquals(2, node.getChoices().size());
        assertEquals("later", node.getChoices().get(1).getSequenceId());
        assertEquals("bot", node.effectiveSender());
        assertEquals("user", fileIndex().require(new NodeAddress("onboarding", 5)).effectiveSender());
    }

    @Test
    void entryOf_prefersMessageOneElseFirstDeclared() throws Exception {
        SequenceIndex index = fileIndex();

        assertEquals(Optional.of(new NodeAddress("onboarding", 1)), index.entryOf("onboarding"));
        assertEquals(Optional.of(new NodeAddress("later", 10)), index.entryOf("later"));
        assertTrue(index.entryOf("nope").isEmpty());
    }

    @Test
    void require_unknownNodeOrSequenceFails() throws Exception {
        SequenceIndex index = fileIndex();

        assertThrows(SequenceLoadException.class, () -> index.require(new NodeAddress("onboarding", 99)));
        assertThrows(SequenceLoadException.class, () -> index.require(new NodeAddress("nope", 1)));
        assertFalse(index.find("nope", 1).isPresent());
    }

    @Test
    void load_malformedDocumentFails() throws Exception {
        Path dir = Files.createDirectories(assets.resolve("sequences"));
        Files.writeString(dir.resolve("broken.json"), "{\"messages\": [ {\"id\": ");
        SequenceIndex index = new SequenceIndex(new FileSequenceSource(assets));

        assertThrows(SequenceLoadException.class, () -> index.nodes("broken"));
    }

    @Test
    void load_cachedPerSequence() {
        AtomicInteger loads = new AtomicInteger();
        SequenceSource source = new SequenceSource() {
            @Override
            public Optional<SequenceDocument> load(String sequenceId) {
                loads.incrementAndGet();
                return Optional.of(new SequenceDocument(sequenceId, null, null, List.of()));
            }
        };
        SequenceIndex index = new SequenceIndex(source);

        index.hasSequence("a");
        index.find("a", 1);
        index.entryOf("a");

        assertEquals(1, loads.get());
        assertTrue(index.entryOf("a").isEmpty());
    }

    private static NodeKind kind(SequenceIndex index, int id) {
        return index.require(new NodeAddress("onboarding", id)).getKind();
    }
}
