package com.vgen.dialogue.state;

import com.vgen.config.ConfigParseException;
import com.vgen.dialogue.model.NodeAddress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateSpecLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_yamlDocument() throws Exception {
        Path path = tempDir.resolve("state.yaml");
        Files.writeString(path, """
                entry:
                  sequence: onboarding_seq
                  message: 1            # optional
                branch_mode: default
                variables:
                  user.name: Alice
                  user.streak: 3
                  user.premium: false
                choices:
                  - sequence: onboarding_seq
                    message: 4
                    by: index
                    value: 1
                  - sequence: onboarding_seq
                    message: 9
                    by: content_key
                    value: user.choose.plan.weekly
                limits:
                  max_depth: 50
                  max_paths: 100
                """);

        StateSpec spec = StateSpecLoader.load(path);

        assertEquals(Optional.of("onboarding_seq"), spec.getEntrySequence());
        assertEquals(Optional.of(1), spec.getEntryMessage());
        assertEquals(BranchMode.ALWAYS_DEFAULT, spec.getBranchMode());
        assertEquals("Alice", spec.getVariables().get("user.name"));
        assertEquals(3L, spec.getVariables().get("user.streak"));
        assertEquals(false, spec.getVariables().get("user.premium"));
        assertEquals(new ChoiceDirective(new NodeAddress("onboarding_seq", 4), SelectionMethod.BY_INDEX, "1"),
                spec.getChoices().get(0));
        assertEquals(SelectionMethod.BY_CONTENT_KEY, spec.directiveFor(new NodeAddress("onboarding_seq", 9)).get().method());
        assertEquals(new TraversalLimits(50, 100), spec.getLimits());
    }

    @Test
    void load_jsonDocumentWithDefaults() throws Exception {
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, """
                {"variables": {"user": {"vip": true}}}
                """);

        StateSpec spec = StateSpecLoader.load(path);

        assertTrue(spec.getEntrySequence().isEmpty());
        assertTrue(spec.getEntryMessage().isEmpty());
        assertEquals(BranchMode.RESOLVE, spec.getBranchMode());
        assertEquals(Map.of("vip", true), spec.getVariables().get("user"));
        assertEquals(TraversalLimits.DEFAULT, spec.getLimits());
    }

    @Test
    void snapshot_mirrorsDocumentLayout() {
        StateSpec spec = StateSpec.empty();

        Map<String, Object> snapshot = spec.toSnapshot();

        assertEquals("resolve", snapshot.get("branch_mode"));
        assertEquals(Map.of("max_depth", 200, "max_paths", 5000), snapshot.get("limits"));
    }

    @Test
    void load_invalidValuesFail() throws Exception {
        Path badMode = tempDir.resolve("mode.yaml");
        Files.writeString(badMode, "branch_mode: sometimes\n");
        Path badChoice = tempDir.resolve("choice.yaml");
        Files.writeString(badChoice, "choices:\n  - sequence: s\n    message: two\n    value: 1\n");
        Path badLimits = tempDir.resolve("limits.yaml");
        Files.writeString(badLimits, "limits:\n  max_depth: 0\n");

        assertThrows(ConfigParseException.class, () -> StateSpecLoader.load(badMode));
        assertThrows(ConfigParseException.class, () -> StateSpecLoader.load(badChoice));
        assertThrows(ConfigParseException.class, () -> StateSpecLoader.load(badLimits));
    }
}
