///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 1998, 1999, 2000, 2001, 2002, 2003, 2004, 2005, 2006,       //
// 2007, 2008, 2009, 2010, 2014, 2015 by Peter Spirtes, Richard Scheines, Joseph   //
// Ramsey, and Clark Glymour.                                                //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package edu.cmu.adjust.graph;

import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * A graph over named variables, in one of two modes.
 * <p>
 * In directed mode the graph is a causal DAG: every edge insertion is followed by a check over the whole graph and an
 * insertion that would close a directed cycle is undone and reported with a {@link CycleException}. In undirected
 * mode (the output of moralization) edges are symmetric and self-loops are refused.
 * <p>
 * Nodes and edges iterate in insertion order. {@link #copy()} and {@link #subgraph} build new graphs that share no
 * structure with this one, so a graph that is no longer modified may be shared by several threads deriving their own
 * graphs from it.
 *
 * @author jdramsey
 */
public final class Graph {

    public enum Mode {DIRECTED, UNDIRECTED}

    private final Mode mode;

    /**
     * Nodes by name, in insertion order.
     */
    private final Map<String, Node> nodes = new LinkedHashMap<>();

    /**
     * Edges in insertion order. Keys and values are equal edges; the value carries the current attributes.
     */
    private final Map<Edge, Edge> edges = new LinkedHashMap<>();

    /**
     * Children in directed mode, neighbors in undirected mode.
     */
    private final Map<Node, Set<Node>> out = new HashMap<>();

    /**
     * Parents in directed mode, neighbors in undirected mode.
     */
    private final Map<Node, Set<Node>> in = new HashMap<>();

    //================================CONSTRUCTORS==========================//

    private Graph(Mode mode) {
        this.mode = mode;
    }

    /**
     * @return a new, empty causal DAG.
     */
    public static Graph directed() {
        return new Graph(Mode.DIRECTED);
    }

    /**
     * @return a new, empty undirected graph.
     */
    public static Graph undirected() {
        return new Graph(Mode.UNDIRECTED);
    }

    /**
     * @return a deep, independent copy of this graph.
     */
    public Graph copy() {
        Graph copy = new Graph(mode);

        for (Node node : nodes.values()) {
            copy.addNode(node);
        }

        for (Edge edge : edges.values()) {
            copy.insert(edge);
        }

        return copy;
    }

    //==============================PUBLIC METHODS==========================//

    public boolean isDirected() {
        return mode == Mode.DIRECTED;
    }

    /**
     * Adds the node with the given name if it is not already present.
     *
     * @return the node of this graph with that name.
     */
    public Node addNode(String name) {
        return addNode(new Node(name));
    }

    public Node addNode(Node node) {
        Node existing = nodes.get(node.getName());

        if (existing != null) {
            return existing;
        }

        nodes.put(node.getName(), node);
        out.put(node, new LinkedHashSet<>());
        in.put(node, new LinkedHashSet<>());
        return node;
    }

    /**
     * @return the node with the given name, or null if there is none.
     */
    public Node getNode(String name) {
        return nodes.get(name);
    }

    public boolean containsNode(Node node) {
        return nodes.containsKey(node.getName());
    }

    public List<Node> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public List<String> getNodeNames() {
        return new ArrayList<>(nodes.keySet());
    }

    public int getNumNodes() {
        return nodes.size();
    }

    public Edge addEdge(String from, String to) {
        return addEdge(new Node(from), new Node(to), Collections.emptyMap());
    }

    public Edge addEdge(String from, String to, Map<String, String> attributes) {
        return addEdge(new Node(from), new Node(to), attributes);
    }

    public Edge addEdge(Node from, Node to) {
        return addEdge(from, to, Collections.emptyMap());
    }

    /**
     * Adds an edge, creating its endpoints if necessary. Adding an edge that is already present merges the given
     * attributes into the existing edge.
     *
     * @throws CycleException           in directed mode, if the edge would create a directed cycle. The graph is then
     *                                  unchanged.
     * @throws IllegalArgumentException in undirected mode, for a self-loop.
     */
    public Edge addEdge(Node from, Node to, Map<String, String> attributes) {
        if (mode == Mode.UNDIRECTED && from.equals(to)) {
            throw new IllegalArgumentException("Undirected graphs may not contain self-loops: " + from);
        }

        Edge edge = new Edge(from, to, isDirected(), attributes);
        Edge existing = edges.get(edge);

        if (existing != null) {
            Edge merged = existing.withAttributes(attributes);
            edges.put(existing, merged);
            return merged;
        }

        boolean newFrom = !nodes.containsKey(from.getName());
        boolean newTo = !nodes.containsKey(to.getName());

        addNode(from);
        addNode(to);
        insert(edge);

        if (isDirected() && !isAcyclic()) {
            removeEdge(edge.getNode1(), edge.getNode2());
            if (newFrom) removeNode(from);
            if (newTo && !from.equals(to)) removeNode(to);
            throw new CycleException(from, to);
        }

        return edge;
    }

    /**
     * @return the edge between the given nodes (from node1 to node2 in directed mode), or null.
     */
    public Edge getEdge(Node node1, Node node2) {
        return edges.get(new Edge(node1, node2, isDirected()));
    }

    public List<Edge> getEdges() {
        return new ArrayList<>(edges.values());
    }

    public int getNumEdges() {
        return edges.size();
    }

    public boolean removeEdge(Node node1, Node node2) {
        Edge edge = edges.remove(new Edge(node1, node2, isDirected()));

        if (edge == null) {
            return false;
        }

        out.get(edge.getNode1()).remove(edge.getNode2());
        in.get(edge.getNode2()).remove(edge.getNode1());

        if (!isDirected()) {
            out.get(edge.getNode2()).remove(edge.getNode1());
            in.get(edge.getNode1()).remove(edge.getNode2());
        }

        return true;
    }

    /**
     * Removes a node and every edge incident to it.
     */
    public boolean removeNode(Node node) {
        if (!containsNode(node)) {
            return false;
        }

        for (Node child : new ArrayList<>(out.get(node))) {
            removeEdge(node, child);
        }

        for (Node parent : new ArrayList<>(in.get(node))) {
            removeEdge(parent, node);
        }

        nodes.remove(node.getName());
        out.remove(node);
        in.remove(node);
        return true;
    }

    /**
     * @return the direct causes of the node. Directed mode only.
     */
    public List<Node> getParents(Node node) {
        requireDirected();
        return new ArrayList<>(checkedGet(in, node));
    }

    /**
     * @return the direct effects of the node. Directed mode only.
     */
    public List<Node> getChildren(Node node) {
        requireDirected();
        return new ArrayList<>(checkedGet(out, node));
    }

    /**
     * @return the nodes sharing an edge with the given one, in either direction.
     */
    public List<Node> getAdjacentNodes(Node node) {
        Set<Node> adjacent = new LinkedHashSet<>(checkedGet(in, node));
        adjacent.addAll(out.get(node));
        return new ArrayList<>(adjacent);
    }

    public boolean isAdjacentTo(Node node1, Node node2) {
        return edges.containsKey(new Edge(node1, node2, isDirected()))
                || edges.containsKey(new Edge(node2, node1, isDirected()));
    }

    public boolean isParentOf(Node parent, Node child) {
        requireDirected();
        return checkedGet(out, parent).contains(child);
    }

    /**
     * @return the nodes reachable from the given one by a directed path, excluding the node itself.
     */
    public Set<Node> getDescendants(Node node) {
        Set<Node> descendants = reach(Collections.singleton(node), out);
        descendants.remove(node);
        return descendants;
    }

    /**
     * @return the nodes from which the given one is reachable by a directed path, excluding the node itself.
     */
    public Set<Node> getAncestors(Node node) {
        Set<Node> ancestors = reach(Collections.singleton(node), in);
        ancestors.remove(node);
        return ancestors;
    }

    /**
     * Returns the given nodes together with all of their descendants; each node counts as its own descendant.
     */
    public Set<Node> getDescendants(Collection<Node> nodes) {
        return reach(nodes, out);
    }

    /**
     * Returns the given nodes together with all of their ancestors; each node counts as its own ancestor.
     */
    public Set<Node> getAncestors(Collection<Node> nodes) {
        return reach(nodes, in);
    }

    /**
     * Checks for directed cycles over the whole graph by repeatedly peeling off nodes without parents. Undirected
     * graphs are acyclic for this purpose.
     */
    public boolean isAcyclic() {
        if (!isDirected()) {
            return true;
        }

        Map<Node, Integer> inDegree = new HashMap<>();
        LinkedList<Node> sources = new LinkedList<>();

        for (Node node : nodes.values()) {
            int degree = in.get(node).size();
            inDegree.put(node, degree);
            if (degree == 0) sources.add(node);
        }

        int removed = 0;

        while (!sources.isEmpty()) {
            Node node = sources.removeFirst();
            removed++;

            for (Node child : out.get(node)) {
                int degree = inDegree.get(child) - 1;
                inDegree.put(child, degree);
                if (degree == 0) sources.add(child);
            }
        }

        return removed == nodes.size();
    }

    /**
     * @return a new graph of the same mode over the given nodes, with every edge of this graph between two of them.
     */
    public Graph subgraph(Collection<Node> keep) {
        Graph subgraph = new Graph(mode);

        for (Node node : nodes.values()) {
            if (keep.contains(node)) {
                subgraph.addNode(node);
            }
        }

        for (Edge edge : edges.values()) {
            if (subgraph.containsNode(edge.getNode1()) && subgraph.containsNode(edge.getNode2())) {
                subgraph.insert(edge);
            }
        }

        return subgraph;
    }

    @Override
    public String toString() {
        return "Nodes: [" + StringUtils.join(nodes.keySet(), ", ") + "]\n"
                + "Edges: [" + StringUtils.join(edges.values(), ", ") + "]";
    }

    //==============================PRIVATE METHODS=========================//

    /**
     * Inserts an edge whose endpoints are already present, without any acyclicity check.
     */
    private void insert(Edge edge) {
        edges.put(edge, edge);
        out.get(edge.getNode1()).add(edge.getNode2());
        in.get(edge.getNode2()).add(edge.getNode1());

        if (!isDirected()) {
            out.get(edge.getNode2()).add(edge.getNode1());
            in.get(edge.getNode1()).add(edge.getNode2());
        }
    }

    private Set<Node> reach(Collection<Node> start, Map<Node, Set<Node>> links) {
        Set<Node> reached = new LinkedHashSet<>();
        LinkedList<Node> queue = new LinkedList<>();

        for (Node node : start) {
            checkedGet(links, node);
            if (reached.add(node)) queue.add(node);
        }

        while (!queue.isEmpty()) {
            Node node = queue.removeFirst();

            for (Node next : links.get(node)) {
                if (reached.add(next)) queue.add(next);
            }
        }

        return reached;
    }

    private Set<Node> checkedGet(Map<Node, Set<Node>> links, Node node) {
        Set<Node> linked = links.get(node);

        if (linked == null) {
            throw new UnknownNodeException(Collections.singletonList(node.getName()), nodes.values());
        }

        return linked;
    }

    private void requireDirected() {
        if (!isDirected()) {
            throw new IllegalStateException("Parents and children are only defined for directed graphs.");
        }
    }
}
