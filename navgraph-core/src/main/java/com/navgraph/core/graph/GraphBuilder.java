package com.navgraph.core.graph;

import com.navgraph.core.exception.DanglingEdgeException;
import com.navgraph.core.exception.DuplicateNodeException;
import com.navgraph.core.model.LinkEdge;
import com.navgraph.core.model.RouteNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles a {@link NavigationGraph} from extracted routes and links.
 *
 * <p>Referential integrity is enforced, never repaired:
 * <ul>
 *   <li>a path declared twice raises {@link DuplicateNodeException}</li>
 *   <li>a link to or from an undeclared path raises {@link DanglingEdgeException}</li>
 * </ul>
 *
 * <p>Exact duplicate links (same {@code from}, {@code to} and {@code kind}) are expected when
 * several extractors report the same link, and are dropped silently. Forward and reverse
 * adjacency are built in the same pass, O(N + E).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NavigationGraph graph = GraphBuilder.build(
 *     List.of(RouteNode.of("/"), RouteNode.of("/login")),
 *     List.of(LinkEdge.of("/", "/login"))
 * );
 * }</pre>
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private GraphBuilder() {
        // Utility class
    }

    /**
     * Builds an immutable graph.
     *
     * @param nodes declared routes
     * @param edges declared links
     * @return the constructed graph
     * @throws DuplicateNodeException if two routes share a path
     * @throws DanglingEdgeException if a link references an undeclared route
     */
    public static NavigationGraph build(List<RouteNode> nodes, List<LinkEdge> edges) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");

        Map<String, RouteNode> nodesByPath = new LinkedHashMap<>();
        Map<String, Set<String>> successors = new LinkedHashMap<>();
        Map<String, Set<String>> predecessors = new LinkedHashMap<>();

        for (RouteNode node : nodes) {
            Objects.requireNonNull(node, "nodes must not contain null");
            if (nodesByPath.putIfAbsent(node.path(), node) != null) {
                throw new DuplicateNodeException(node.path());
            }
            successors.put(node.path(), new LinkedHashSet<>());
            predecessors.put(node.path(), new LinkedHashSet<>());
        }

        Set<LinkEdge> uniqueEdges = new LinkedHashSet<>();
        int duplicates = 0;
        for (LinkEdge edge : edges) {
            Objects.requireNonNull(edge, "edges must not contain null");
            if (!nodesByPath.containsKey(edge.from())) {
                throw new DanglingEdgeException(edge, edge.from());
            }
            if (!nodesByPath.containsKey(edge.to())) {
                throw new DanglingEdgeException(edge, edge.to());
            }
            if (!uniqueEdges.add(edge)) {
                duplicates++;
                continue;
            }
            successors.get(edge.from()).add(edge.to());
            predecessors.get(edge.to()).add(edge.from());
        }

        if (duplicates > 0) {
            log.debug("Dropped {} duplicate link(s)", duplicates);
        }

        NavigationGraph graph = new NavigationGraph(
            Collections.unmodifiableMap(nodesByPath),
            List.copyOf(uniqueEdges),
            freeze(successors),
            freeze(predecessors)
        );
        log.info("Built navigation graph: {} routes, {} links", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }
}
