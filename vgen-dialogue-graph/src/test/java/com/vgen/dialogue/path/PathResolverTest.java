package com.vgen.dialogue.path;

import com.vgen.dialogue.index.InMemorySequenceSource;
import com.vgen.dialogue.index.SequenceIndex;
import com.vgen.dialogue.index.SequenceLoadException;
import com.vgen.dialogue.model.NodeAddress;
import com.vgen.dialogue.model.NodeKind;
import com.vgen.dialogue.state.BranchMode;
import com.vgen.dialogue.state.ChoiceDirective;
import com.vgen.dialogue.state.SelectionMethod;
import com.vgen.dialogue.state.StateSpec;
import com.vgen.dialogue.state.TraversalLimits;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathResolverTest {

    private static final String CHAIN = """
            [{"id": 1, "text": "a"}, {"id": 2, "text": "b"}, {"id": 3, "text": "c"},
             {"id": 4, "text": "d"}, {"id": 5, "text": "e"}]
            """;

    private static final String CHOICE = """
            [{"id": 1, "text": "Pick one"},
             {"id": 2, "type": "choice", "choices": [
                {"text": "A", "nextMessageId": 10},
                {"text": "B", "nextMessageId": 20, "contentKey": "user.choose.b"},
                {"text": "C", "nextMessageId": 30}]},
             {"id": 10, "text": "via A"},
             {"id": 11, "text": "still A", "nextMessageId": 20},
             {"id": 20, "text": "target"},
             {"id": 30, "text": "dead end", "nextMessageId": 99}]
            """;

    private static final String BRANCH = """
            [{"id": 1, "type": "autoroute", "routes": [
                {"condition": "user.vip == true", "nextMessageId": 2},
                {"default": true, "nextMessageId": 3}]},
             {"id": 2, "text": "vip", "nextMessageId": 4},
             {"id": 3, "text": "regular", "nextMessageId": 4},
             {"id": 4, "text": "target"}]
            """;

    private static final String LOOP = """
            [{"id": 1, "type": "choice", "choices": [
                {"text": "Again", "nextMessageId": 1},
                {"text": "Go on", "nextMessageId": 2}]},
             {"id": 2, "text": "almost", "nextMessageId": 3},
             {"id": 3, "text": "target", "nextMessageId": 1},
             {"id": 9, "text": "never reached"}]
            """;

    private static final String CONVERGE = """
            [{"id": 1, "type": "choice", "choices": [
                {"text": "Left", "nextMessageId": 5},
                {"text": "Right", "nextMessageId": 5, "contentKey": "user.choose.right"}]},
             {"id": 5, "text": "merged", "nextMessageId": 6},
             {"id": 6, "text": "target"}]
            """;

    private final SequenceIndex index = new SequenceIndex(new InMemorySequenceSource()
            .with("chain", CHAIN)
            .with("choice", CHOICE)
            .with("branch", BRANCH)
            .with("loop", LOOP)
            .with("converge", CONVERGE)
            .with("main", "[{\"id\": 1, \"text\": \"hi\"}, {\"id\": 2, \"sequenceId\": \"other\"}]")
            .with("other", "[{\"id\": 5, \"text\": \"first\"}, {\"id\": 6, \"text\": \"target\"}]"));

    private final PathResolver resolver = new PathResolver(index);

    @Test
    void resolve_linearChain() {
        ResolvedPath path = resolver.resolve(StateSpec.empty(), new NodeAddress("chain", 5));

        assertFalse(path.fallback());
        assertEquals(List.of(1, 2, 3, 4, 5), ids(path));
    }

    @Test
    void resolve_exploresAllOptionsAndReturnsShortest() {
        ResolvedPath path = resolver.resolve(StateSpec.empty(), new NodeAddress("choice", 20));

        assertEquals(List.of(1, 2, 20), ids(path));
        assertEquals(NodeKind.CHOICE, path.nodes().get(1).kind());
        assertEquals(new ChoiceSelection(1, "B", "user.choose.b"), path.last().selection());
    }

    @Test
    void resolve_directivePinsOption() {
        StateSpec state = withChoice(new ChoiceDirective(new NodeAddress("choice", 2), SelectionMethod.BY_TEXT, "A"));

        ResolvedPath path = resolver.resolve(state, new NodeAddress("choice", 20));

        assertEquals(List.of(1, 2, 10, 11, 20), ids(path));
        assertEquals(0, path.nodes().get(2).selection().index());
        assertNull(path.last().selection());
    }

    @Test
    void resolve_outOfRangeIndexFallsBackToExploreAll() {
        StateSpec state = withChoice(new ChoiceDirective(new NodeAddress("choice", 2), SelectionMethod.BY_INDEX, "7"));

        ResolvedPath path = resolver.resolve(state, new NodeAddress("choice", 20));

        assertEquals(List.of(1, 2, 20), ids(path));
        assertFalse(path.fallback());
    }

    @Test
    void resolve_crossJumpEntersOtherSequence() {
        StateSpec state = new StateSpec("main", null, BranchMode.RESOLVE, Map.of(), List.of(), TraversalLimits.DEFAULT);

        ResolvedPath path = resolver.resolve(state, new NodeAddress("other", 6));

        assertFalse(path.fallback());
        assertEquals(List.of("main:1", "main:2", "other:5", "other:6"),
                path.nodes().stream().map(n -> n.address().toString()).collect(Collectors.toList()));
        assertEquals(NodeKind.CROSS_JUMP, path.nodes().get(1).kind());
    }

    @Test
    void resolve_startsAtTargetSequenceEntryByDefault() {
        ResolvedPath path = resolver.resolve(StateSpec.empty(), new NodeAddress("other", 6));

        assertEquals(List.of(5, 6), ids(path));
    }

    @Test
    void resolve_branchModes() {
        NodeAddress target = new NodeAddress("branch", 4);

        assertEquals(List.of(1, 2, 4), ids(resolver.resolve(state(BranchMode.RESOLVE, Map.of("user.vip", true)), target)));
        assertEquals(List.of(1, 3, 4), ids(resolver.resolve(state(BranchMode.RESOLVE, Map.of("user.vip", false)), target)));
        assertEquals(List.of(1, 3, 4), ids(resolver.resolve(state(BranchMode.ALWAYS_DEFAULT, Map.of("user.vip", true)), target)));
    }

    @Test
    void resolve_messageWithoutNextContinuesAtFollowingId() {
        ResolvedPath path = resolver.resolve(StateSpec.empty(), new NodeAddress("choice", 11));

        assertEquals(List.of(1, 2, 10, 11), ids(path));
    }

    @Test
    void resolve_unreachableTargetFallsBack() {
        ResolvedPath path = resolver.resolve(state(BranchMode.ALWAYS_DEFAULT, Map.of()), new NodeAddress("branch", 2));

        assertTrue(path.fallback());
        assertEquals(List.of(2), ids(path));
    }

    @Test
    void resolve_unknownStartFallsBackAndUnknownTargetFails() {
        StateSpec badStart = new StateSpec("chain", 42, BranchMode.RESOLVE, Map.of(), List.of(), TraversalLimits.DEFAULT);

        ResolvedPath path = resolver.resolve(badStart, new NodeAddress("chain", 3));

        assertTrue(path.fallback());
        assertEquals(List.of(3), ids(path));
        assertThrows(SequenceLoadException.class, () -> resolver.resolve(StateSpec.empty(), new NodeAddress("chain", 9)));
    }

    @Test
    void resolve_limitsStopSearch() {
        NodeAddress target = new NodeAddress("chain", 5);

        assertTrue(resolver.resolve(limited(3, 5000), target).fallback());
        assertTrue(resolver.resolve(limited(200, 2), target).fallback());
        assertFalse(resolver.resolve(limited(5, 5), target).fallback());
    }

    @Test
    void resolve_cycleWithUnreachableTargetTerminatesWithFallback() {
        StateSpec unbounded = limited(10_000, Integer.MAX_VALUE);

        ResolvedPath path = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> resolver.resolve(unbounded, new NodeAddress("loop", 9)));

        assertTrue(path.fallback());
        assertEquals(List.of(9), ids(path));
    }

    @Test
    void resolve_cycleDoesNotReexpandVisitedNodes() {
        // [1], [1 1] skipped as visited, [1 2], [1 2 3]
        ResolvedPath path = resolver.resolve(limited(200, 4), new NodeAddress("loop", 3));

        assertFalse(path.fallback());
        assertEquals(List.of(1, 2, 3), ids(path));
    }

    @Test
    void resolve_convergingOptionsKeepFirstExpandedSelection() {
        ResolvedPath path = resolver.resolve(limited(200, 4), new NodeAddress("converge", 6));

        assertFalse(path.fallback());
        assertEquals(List.of(1, 5, 6), ids(path));
        assertEquals(new ChoiceSelection(0, "Left", null), path.nodes().get(1).selection());
    }

    @Test
    void resolve_targetSuccessorIsEnqueuedBeforeSiblings() {
        // [1], [1 2], then option B (the target) ahead of options A and C
        ResolvedPath path = resolver.resolve(limited(200, 3), new NodeAddress("choice", 20));

        assertFalse(path.fallback());
        assertEquals(List.of(1, 2, 20), ids(path));
        assertEquals(1, path.last().selection().index());
    }

    private static List<Integer> ids(ResolvedPath path) {
        return path.nodes().stream().map(ResolvedPathNode::messageId).collect(Collectors.toList());
    }

    private static StateSpec withChoice(ChoiceDirective directive) {
        return new StateSpec(null, null, BranchMode.RESOLVE, Map.of(), List.of(directive), TraversalLimits.DEFAULT);
    }

    private static StateSpec state(BranchMode mode, Map<String, Object> vars) {
        return new StateSpec(null, null, mode, vars, List.of(), TraversalLimits.DEFAULT);
    }

    private static StateSpec limited(int maxDepth, int maxPaths) {
        return new StateSpec(null, null, BranchMode.RESOLVE, Map.of(), List.of(), new TraversalLimits(maxDepth, maxPaths));
    }
}
