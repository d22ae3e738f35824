package com.navgraph.core.analysis;

import com.navgraph.core.exception.UnknownEntryPointException;
import com.navgraph.core.graph.NavigationGraph;
import com.navgraph.core.model.AllowedTerminalSet;
import com.navgraph.core.model.EntryPointSet;
import com.navgraph.core.model.ReachabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies every route as reachable, orphan or dead end.
 *
 * <p>Traversal starts from all entry points at once and visits each node at most once,
 * so cycles are harmless. An explicit stack is used instead of recursion so long link
 * chains cannot overflow the call stack.
 *
 * <ul>
 *   <li><b>Orphan</b>: not reached from any entry point, whatever its outbound links.</li>
 *   <li><b>Dead end</b>: reached, no outbound links, not an allowed terminal.</li>
 *   <li><b>Reachable</b>: every other reached node.</li>
 * </ul>
 */
public class ReachabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    private static final String PHASE = "reachability";

    private final AnalysisDeadline deadline;

    public ReachabilityAnalyzer() {
        this(AnalysisDeadline.none());
    }

    public ReachabilityAnalyzer(AnalysisDeadline deadline) {
        this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
    }

    /**
     * Analyzes reachability from the given entry points.
     *
     * @param graph the navigation graph
     * @param entryPoints traversal roots, all of which must be routes in the graph
     * @param terminals routes allowed to have no outbound links
     * @return the three disjoint node sets
     * @throws UnknownEntryPointException if an entry point is not a route in the graph
     */
    public ReachabilityResult analyze(NavigationGraph graph, EntryPointSet entryPoints, AllowedTerminalSet terminals) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(entryPoints, "entryPoints must not be null");
        Objects.requireNonNull(terminals, "terminals must not be null");

        Set<String> unknown = new LinkedHashSet<>();
        for (String entry : entryPoints.paths()) {
            if (!graph.containsNode(entry)) {
                unknown.add(entry);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownEntryPointException(unknown);
        }

        Set<String> visited = traverse(graph, entryPoints);

        Set<String> reachable = new HashSet<>();
        Set<String> orphans = new HashSet<>();
        Set<String> deadEnds = new HashSet<>();
        for (String path : graph.nodePaths()) {
            if (!visited.contains(path)) {
                orphans.add(path);
            } else if (graph.outDegree(path) == 0 && !terminals.contains(path)) {
                deadEnds.add(path);
            } else {
                reachable.add(path);
            }
        }

        log.info("Reachability: {} reachable, {} orphan(s), {} dead end(s)",
            reachable.size(), orphans.size(), deadEnds.size());
        if (!orphans.isEmpty()) {
            log.debug("Orphans: {}", orphans);
        }
        return new ReachabilityResult(reachable, orphans, deadEnds);
    }

    private Set<String> traverse(NavigationGraph graph, EntryPointSet entryPoints) {
        Set<String> visited = new HashSet<>(graph.nodeCount() * 2);
        Deque<String> stack = new ArrayDeque<>(entryPoints.paths());

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            deadline.check(PHASE);
            for (String next : graph.successors(current)) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return visited;
    }
}
