package com.vgen.dialogue.path;

import com.vgen.dialogue.condition.ExpressionEvaluator;
import com.vgen.dialogue.index.SequenceIndex;
import com.vgen.dialogue.model.BranchRoute;
import com.vgen.dialogue.model.ChoiceOption;
import com.vgen.dialogue.model.DialogueNode;
import com.vgen.dialogue.model.NodeAddress;
import com.vgen.dialogue.state.BranchMode;
import com.vgen.dialogue.state.ChoiceDirective;
import com.vgen.dialogue.state.StateSpec;
import com.vgen.dialogue.state.TraversalLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Breadth-first search from the state's entry node to a target node. The frontier holds whole paths so
 * the first accepted path is returned as is.
 * <p>
 * Successors by node kind:
 * <ul>
 *   <li>CROSS_JUMP: entry node of the named sequence</li>
 *   <li>CONDITIONAL_BRANCH: one route; first matching condition in RESOLVE mode, else the default route,
 *       else the first declared route</li>
 *   <li>CHOICE: the option pinned by a matching directive, otherwise every option</li>
 *   <li>ACTION, MESSAGE: explicit next node, else the next message id in the same sequence</li>
 * </ul>
 * A node is marked visited only after it has been expanded. When no path is found the result is the
 * target alone with {@code fallback = true}.
 */
public final class PathResolver {

    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    private final SequenceIndex index;

    public PathResolver(SequenceIndex index) {
        this.index = index;
    }

    /**
     * @throws com.vgen.dialogue.index.SequenceLoadException when the target node does not exist or a
     *                                                        visited sequence document is malformed
     */
    public ResolvedPath resolve(StateSpec state, NodeAddress target) {
        DialogueNode targetNode = index.require(target);
        String startSequence = state.getEntrySequence().orElse(target.sequenceId());
        Optional<NodeAddress> start = state.getEntryMessage()
                .map(id -> new NodeAddress(startSequence, id))
                .or(() -> index.entryOf(startSequence));
        Optional<DialogueNode> startNode = start.flatMap(index::find);
        if (startNode.isEmpty()) {
            log.warn("Start node {} not found; using single-node fallback path for {}",
                    start.map(NodeAddress::toString).orElse(startSequence), target);
            return fallback(targetNode);
        }

        TraversalLimits limits = state.getLimits();
        Deque<List<ResolvedPathNode>> frontier = new ArrayDeque<>();
        frontier.add(List.of(step(startNode.get(), null)));
        Set<NodeAddress> visited = new HashSet<>();
        int explored = 0;

        while (!frontier.isEmpty()) {
            if (explored >= limits.getMaxPaths()) {
                log.warn("Path search for {} stopped after {} paths (max_paths)", target, explored);
                break;
            }
            List<ResolvedPathNode> path = frontier.pollFirst();
            explored++;
            ResolvedPathNode last = path.get(path.size() - 1);
            NodeAddress at = last.address();
            if (at.equals(target)) {
                log.debug("Resolved path to {} with {} node(s) after exploring {} path(s)", target, path.size(), explored);
                return new ResolvedPath(path, false);
            }
            if (path.size() > limits.getMaxDepth() || visited.contains(at)) {
                continue;
            }
            List<ResolvedPathNode> successors = expand(index.require(at), state);
            visited.add(at);

            List<ResolvedPathNode> ordered = new ArrayList<>(successors.size());
            for (ResolvedPathNode s : successors) {
                if (s.address().equals(target)) ordered.add(s);
            }
            for (ResolvedPathNode s : successors) {
                if (!s.address().equals(target)) ordered.add(s);
            }
            for (ResolvedPathNode s : ordered) {
                List<ResolvedPathNode> next = new ArrayList<>(path.size() + 1);
                next.addAll(path);
                next.add(s);
                frontier.addLast(next);
            }
        }
        log.warn("No path found to {} from {}; using single-node fallback path", target, start.get());
        return fallback(targetNode);
    }

    private List<ResolvedPathNode> expand(DialogueNode node, StateSpec state) {
        List<ResolvedPathNode> out = new ArrayList<>();
        switch (node.getKind()) {
            case CROSS_JUMP:
                jumpTo(node.getSequenceId(), null).ifPresent(out::add);
                break;
            case CONDITIONAL_BRANCH: {
                BranchRoute route = chooseRoute(node, state);
                if (route == null) {
                    linearSuccessor(node, null).ifPresent(out::add);
                } else {
                    follow(node, route.getSequenceId(), route.getNextMessageId(), null).ifPresent(out::add);
                }
                break;
            }
            case CHOICE:
                out.addAll(expandChoice(node, state));
                break;
            case ACTION:
            case MESSAGE:
            default:
                linearSuccessor(node, null).ifPresent(out::add);
                break;
        }
        return out;
    }

    private List<ResolvedPathNode> expandChoice(DialogueNode node, StateSpec state) {
        List<ChoiceOption> options = node.getChoices();
        List<ResolvedPathNode> out = new ArrayList<>();
        if (options.isEmpty()) {
            linearSuccessor(node, null).ifPresent(out::add);
            return out;
        }
        Optional<ChoiceDirective> directive = state.directiveFor(node.address());
        if (directive.isPresent()) {
            OptionalInt selected = directive.get().select(options);
            if (selected.isPresent()) {
                optionSuccessor(node, options, selected.getAsInt()).ifPresent(out::add);
                return out;
            }
            log.debug("Choice directive {} matches no option of {}; exploring all options",
                    directive.get(), node.address());
        }
        for (int i = 0; i < options.size(); i++) {
            optionSuccessor(node, options, i).ifPresent(out::add);
        }
        return out;
    }

    private Optional<ResolvedPathNode> optionSuccessor(DialogueNode node, List<ChoiceOption> options, int i) {
        ChoiceOption option = options.get(i);
        ChoiceSelection selection = new ChoiceSelection(i, option.getText(), option.getContentKey());
        return follow(node, option.getSequenceId(), option.getNextMessageId(), selection);
    }

    static BranchRoute chooseRoute(DialogueNode node, StateSpec state) {
        List<BranchRoute> routes = node.getRoutes();
        if (routes.isEmpty()) {
            return null;
        }
        if (state.getBranchMode() == BranchMode.RESOLVE) {
            for (BranchRoute r : routes) {
                if (!r.isDefault() && r.getCondition() != null
                        && ExpressionEvaluator.evaluate(r.getCondition(), state.getVariables())) {
                    return r;
                }
            }
        }
        for (BranchRoute r : routes) {
            if (r.isDefault()) return r;
        }
        return routes.get(0);
    }

    /** Destination named by a route or option: another sequence's entry, an explicit node, or the linear successor. */
    private Optional<ResolvedPathNode> follow(DialogueNode from, String sequenceId, Integer nextMessageId,
                                              ChoiceSelection selection) {
        if (sequenceId != null) {
            return jumpTo(sequenceId, selection);
        }
        if (nextMessageId != null) {
            return nodeAt(new NodeAddress(from.getOwningSequence(), nextMessageId), selection);
        }
        return linearSuccessor(from, selection);
    }

    private Optional<ResolvedPathNode> linearSuccessor(DialogueNode node, ChoiceSelection selection) {
        if (node.getNextMessageId() != null) {
            return nodeAt(new NodeAddress(node.getOwningSequence(), node.getNextMessageId()), selection);
        }
        return index.find(node.getOwningSequence(), node.getId() + 1).map(n -> step(n, selection));
    }

    private Optional<ResolvedPathNode> jumpTo(String sequenceId, ChoiceSelection selection) {
        Optional<NodeAddress> entry = index.entryOf(sequenceId);
        if (entry.isEmpty()) {
            log.warn("Jump to sequence {} has no entry node; treating as dead end", sequenceId);
            return Optional.empty();
        }
        return nodeAt(entry.get(), selection);
    }

    private Optional<ResolvedPathNode> nodeAt(NodeAddress address, ChoiceSelection selection) {
        Optional<DialogueNode> node = index.find(address);
        if (node.isEmpty()) {
            log.debug("Successor {} does not exist; dead end", address);
        }
        return node.map(n -> step(n, selection));
    }

    private static ResolvedPathNode step(DialogueNode node, ChoiceSelection selection) {
        return new ResolvedPathNode(node.getOwningSequence(), node.getId(), node.getKind(), selection);
    }

    private static ResolvedPath fallback(DialogueNode target) {
        return new ResolvedPath(List.of(step(target, null)), true);
    }
}
