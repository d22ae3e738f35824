package com.navgraph.core.graph;

import com.navgraph.core.model.LinkEdge;
import com.navgraph.core.model.RouteNode;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable directed graph of routes and the links between them.
 *
 * <p>Instances are produced only by {@link GraphBuilder}, which also derives the forward
 * ({@code from -> [to]}) and reverse ({@code to -> [from]}) adjacency used by the
 * analyzers. Every node has an entry in both adjacency maps, possibly empty.
 *
 * <p>Safe to share between threads once built.
 */
public final class NavigationGraph {

    private final Map<String, RouteNode> nodes;
    private final List<LinkEdge> edges;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    NavigationGraph(
        Map<String, RouteNode> nodes,
        List<LinkEdge> edges,
        Map<String, Set<String>> successors,
        Map<String, Set<String>> predecessors
    ) {
        this.nodes = nodes;
        this.edges = edges;
        this.successors = successors;
        this.predecessors = predecessors;
    }

    public boolean containsNode(String path) {
        return nodes.containsKey(path);
    }

    /**
     * Looks up a route by path.
     *
     * @param path route path
     * @return the route, or null if the graph has no such node
     */
    public RouteNode node(String path) {
        return nodes.get(path);
    }

    /**
     * @return every route path, in declaration order
     */
    public Set<String> nodePaths() {
        return nodes.keySet();
    }

    public Collection<RouteNode> nodes() {
        return nodes.values();
    }

    /**
     * @return deduplicated links, in declaration order
     */
    public List<LinkEdge> edges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the targets of the outbound links of a route.
     *
     * @param path route path
     * @return successor paths, empty for unknown routes and routes without outbound links
     */
    public Set<String> successors(String path) {
        return successors.getOrDefault(path, Collections.emptySet());
    }

    /**
     * Returns the sources of the inbound links of a route.
     *
     * @param path route path
     * @return predecessor paths, empty for unknown routes and routes without inbound links
     */
    public Set<String> predecessors(String path) {
        return predecessors.getOrDefault(path, Collections.emptySet());
    }

    /**
     * Checks for a link in the given direction. A reverse link does not count.
     *
     * @param from source path
     * @param to target path
     * @return true if a link leads from {@code from} to {@code to}
     */
    public boolean hasEdge(String from, String to) {
        return successors(from).contains(to);
    }

    public int outDegree(String path) {
        return successors(path).size();
    }

    public int inDegree(String path) {
        return predecessors(path).size();
    }

    @Override
    public String toString() {
        return "NavigationGraph[nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}
