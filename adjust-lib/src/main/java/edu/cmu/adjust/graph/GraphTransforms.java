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
 * Derived graphs used by adjustment-set identification. Every method leaves its input untouched and returns a new,
 * independently owned graph.
 * <p>
 * References: Textor and Liskiewicz, Adjustment criteria in causal diagrams: an algorithmic perspective (2012); Zander,
 * Liskiewicz and Textor, Separators and adjustment sets in causal graphs: complete criteria and an algorithmic
 * framework (2019).
 *
 * @author jdramsey
 */
public final class GraphTransforms {

    private GraphTransforms() {
    }

    /**
     * The back-door graph: every edge leaving a treatment is removed.
     */
    public static Graph backdoorGraph(Graph graph, Collection<Node> treatments) {
        requireDirected(graph);
        GraphUtils.checkNodes(graph, treatments);

        Graph backdoorGraph = graph.copy();

        for (Node treatment : treatments) {
            for (Node child : graph.getChildren(treatment)) {
                backdoorGraph.removeEdge(treatment, child);
            }
        }

        return backdoorGraph;
    }

    /**
     * The nodes on a proper causal path from the treatments to the outcomes:
     * <pre>
     *     PCP(X, Y) = (De(X) \ X) intersect An_X(Y)
     * </pre>
     * where De(X) are the descendants of X in the graph and An_X(Y) the ancestors of Y (Y included) in the back-door
     * graph relative to X.
     *
     * @throws UnknownNodeException if a treatment or outcome is not in the graph.
     */
    public static Set<Node> properCausalPathway(Graph graph, Collection<Node> treatments, Collection<Node> outcomes) {
        requireDirected(graph);
        GraphUtils.checkNodes(graph, treatments);
        GraphUtils.checkNodes(graph, outcomes);

        Set<Node> pathway = graph.getDescendants(treatments);
        pathway.removeAll(treatments);

        Graph backdoorGraph = backdoorGraph(graph, treatments);
        pathway.retainAll(backdoorGraph.getAncestors(outcomes));

        return pathway;
    }

    /**
     * The proper back-door graph (Zander et al., Definition 3): the first edge of every proper causal path from the
     * treatments to the outcomes is removed, that is every edge from a treatment into a node of the proper causal
     * pathway.
     *
     * @throws UnknownNodeException if a treatment or outcome is not in the graph.
     */
    public static Graph properBackdoorGraph(Graph graph, Collection<Node> treatments, Collection<Node> outcomes) {
        Set<Node> pathway = properCausalPathway(graph, treatments, outcomes);
        Graph properBackdoorGraph = graph.copy();

        for (Node treatment : treatments) {
            for (Node child : graph.getChildren(treatment)) {
                if (pathway.contains(child)) {
                    properBackdoorGraph.removeEdge(treatment, child);
                }
            }
        }

        return properBackdoorGraph;
    }

    /**
     * The ancestor graph G[An(W)]: the subgraph over the focal nodes and all of their ancestors.
     */
    public static Graph ancestorGraph(Graph graph, Collection<Node> focalNodes) {
        requireDirected(graph);
        GraphUtils.checkNodes(graph, focalNodes);
        return graph.subgraph(graph.getAncestors(focalNodes));
    }

    /**
     * The counterpart of the back-door graph for direct effects: only edges pointing directly from a treatment to an
     * outcome are removed.
     */
    public static Graph indirectGraph(Graph graph, Collection<Node> treatments, Collection<Node> outcomes) {
        requireDirected(graph);
        GraphUtils.checkNodes(graph, treatments);
        GraphUtils.checkNodes(graph, outcomes);

        Graph indirectGraph = graph.copy();

        for (Node treatment : treatments) {
            for (Node outcome : outcomes) {
                indirectGraph.removeEdge(treatment, outcome);
            }
        }

        return indirectGraph;
    }

    /**
     * The moral graph: the undirected skeleton of the graph plus an edge between every two parents of a common child.
     * An undirected graph has no parents to marry, so moralizing it returns a copy with the same edges.
     */
    public static Graph moralGraph(Graph graph) {
        Graph moralGraph = Graph.undirected();

        for (Node node : graph.getNodes()) {
            moralGraph.addNode(node);
        }

        for (Edge edge : graph.getEdges()) {
            if (!edge.getNode1().equals(edge.getNode2())) {
                moralGraph.addEdge(edge.getNode1(), edge.getNode2());
            }
        }

        if (graph.isDirected()) {
            for (Node child : graph.getNodes()) {
                List<Node> parents = graph.getParents(child);

                for (int i = 0; i < parents.size(); i++) {
                    for (int j = i + 1; j < parents.size(); j++) {
                        moralGraph.addEdge(parents.get(i), parents.get(j));
                    }
                }
            }
        }

        return moralGraph;
    }

    private static void requireDirected(Graph graph) {
        if (!graph.isDirected()) {
            throw new IllegalArgumentException("Expecting a directed graph.");
        }
    }
}
