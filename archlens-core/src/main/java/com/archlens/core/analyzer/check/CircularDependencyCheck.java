package com.archlens.core.analyzer.check;

import com.archlens.core.analyzer.GraphIndex;
import com.archlens.core.analyzer.HealthCheck;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.IssueKind;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports dependency cycles.
 *
 * <p>Depth-first search from every unvisited node, in node order. Each edge back to a
 * node on the current path yields one cycle: the path slice from that node to the
 * current node. The search keeps an explicit frame stack, so graph depth is not
 * bounded by the call stack.
 *
 * <p>Cycles reached from different roots are reported as found, without deduplication.
 */
public class CircularDependencyCheck implements HealthCheck {

    @Override
    public String getId() {
        return IssueKind.CIRCULAR.value();
    }

    @Override
    public List<AnalysisIssue> check(GraphIndex index) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (Node node : index.graph().nodes()) {
            if (!visited.contains(node.id())) {
                search(node.id(), index, visited, cycles);
            }
        }

        List<AnalysisIssue> issues = new ArrayList<>();
        for (List<String> cycle : cycles) {
            String labels = cycle.stream().map(index::labelOf).collect(Collectors.joining(" -> "));
            issues.add(AnalysisIssue.of(
                IssueKind.CIRCULAR,
                IssueSeverity.CRITICAL,
                "Circular dependency: " + labels + " -> " + index.labelOf(cycle.get(0)),
                cycle
            ));
        }
        return issues;
    }

    private void search(String root, GraphIndex index, Set<String> visited, List<List<String>> cycles) {
        Deque<Frame> frames = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();

        enter(root, index, frames, path, onPath, visited);
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (frame.hasNext()) {
                String target = frame.next();
                if (!visited.contains(target)) {
                    enter(target, index, frames, path, onPath, visited);
                } else if (onPath.contains(target)) {
                    cycles.add(List.copyOf(path.subList(path.indexOf(target), path.size())));
                }
            } else {
                frames.pop();
                onPath.remove(frame.nodeId);
                path.remove(path.size() - 1);
            }
        }
    }

    private static void enter(String nodeId, GraphIndex index, Deque<Frame> frames,
                              List<String> path, Set<String> onPath, Set<String> visited) {
        visited.add(nodeId);
        onPath.add(nodeId);
        path.add(nodeId);
        frames.push(new Frame(nodeId, index.successors(nodeId)));
    }

    private static final class Frame {

        private final String nodeId;
        private final List<String> successors;
        private int cursor;

        Frame(String nodeId, List<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }

        boolean hasNext() {
            return cursor < successors.size();
        }

        String next() {
            return successors.get(cursor++);
        }
    }
}
