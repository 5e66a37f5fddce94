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

import java.util.*;

/**
 * Basic graph utilities.
 *
 * @author jdramsey
 */
public final class GraphUtils {

    private GraphUtils() {
    }

    /**
     * Looks up nodes by name.
     *
     * @throws UnknownNodeException naming every name that is not a node of the graph.
     */
    public static List<Node> getNodes(Graph graph, Collection<String> names) {
        List<Node> nodes = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (String name : names) {
            Node node = graph.getNode(name);

            if (node == null) {
                missing.add(name);
            } else {
                nodes.add(node);
            }
        }

        if (!missing.isEmpty()) {
            throw new UnknownNodeException(missing, graph.getNodes());
        }

        return nodes;
    }

    public static List<Node> getNodes(Graph graph, String... names) {
        return getNodes(graph, Arrays.asList(names));
    }

    /**
     * @throws UnknownNodeException naming every one of the given nodes that is not in the graph.
     */
    public static void checkNodes(Graph graph, Collection<Node> nodes) {
        List<String> missing = new ArrayList<>();

        for (Node node : nodes) {
            if (!graph.containsNode(node)) {
                missing.add(node.getName());
            }
        }

        if (!missing.isEmpty()) {
            throw new UnknownNodeException(missing, graph.getNodes());
        }
    }

    /**
     * Whether the node is one of the given outputs or depends, through some chain of parents, on one of them. That is,
     * whether the value of the node can only be known once the outputs have been produced.
     * <p>
     * Searches parents iteratively, visiting each node at most once.
     */
    public static boolean dependsOn(Graph graph, Node node, Set<Node> outputs) {
        checkNodes(graph, Collections.singletonList(node));

        Set<Node> visited = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(node);

        while (!pending.isEmpty()) {
            Node current = pending.pop();

            if (!visited.add(current)) {
                continue;
            }

            if (outputs.contains(current)) {
                return true;
            }

            for (Node parent : graph.getParents(current)) {
                if (!visited.contains(parent)) {
                    pending.push(parent);
                }
            }
        }

        return false;
    }

    /**
     * The nodes connected to any of the start nodes by a path that avoids the blocked nodes. Start nodes that are
     * themselves blocked are not expanded. Edge direction is ignored.
     */
    public static Set<Node> getReachableNodes(Graph graph, Collection<Node> start, Set<Node> blocked) {
        Set<Node> reached = new LinkedHashSet<>();
        LinkedList<Node> queue = new LinkedList<>();

        for (Node node : start) {
            if (!blocked.contains(node) && reached.add(node)) {
                queue.add(node);
            }
        }

        while (!queue.isEmpty()) {
            Node node = queue.removeFirst();

            for (Node adjacent : graph.getAdjacentNodes(node)) {
                if (!blocked.contains(adjacent) && reached.add(adjacent)) {
                    queue.add(adjacent);
                }
            }
        }

        return reached;
    }

    /**
     * The neighbors of a set of nodes, not counting the nodes of the set themselves.
     */
    public static Set<Node> getNeighbors(Graph graph, Collection<Node> nodes) {
        Set<Node> neighbors = new LinkedHashSet<>();

        for (Node node : nodes) {
            neighbors.addAll(graph.getAdjacentNodes(node));
        }

        neighbors.removeAll(nodes);
        return neighbors;
    }
}
