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
 * Decides d-separation in a DAG. Z d-separates X from Y in G exactly when X and Y are disconnected in the moral graph
 * of the ancestor graph G[An(X u Y u Z)] once Z has been removed (Lauritzen et al., 1990).
 *
 * @author jdramsey
 */
public final class DSeparation {

    private DSeparation() {
    }

    /**
     * @param graph A directed acyclic graph.
     * @param xs    The first set of nodes.
     * @param ys    The second set of nodes.
     * @param zs    The conditioning set.
     * @return true if zs d-separates xs from ys in the graph. Empty xs or ys are trivially separated.
     * @throws UnknownNodeException     if a node is not in the graph.
     * @throws IllegalArgumentException if the three sets are not pairwise disjoint.
     */
    public static boolean isDSeparated(Graph graph, Collection<Node> xs, Collection<Node> ys, Collection<Node> zs) {
        if (!graph.isDirected()) {
            throw new IllegalArgumentException("d-separation is defined over directed graphs.");
        }

        GraphUtils.checkNodes(graph, xs);
        GraphUtils.checkNodes(graph, ys);
        GraphUtils.checkNodes(graph, zs);

        checkDisjoint(xs, ys, "X", "Y");
        checkDisjoint(xs, zs, "X", "Z");
        checkDisjoint(ys, zs, "Y", "Z");

        if (xs.isEmpty() || ys.isEmpty()) {
            return true;
        }

        Set<Node> focal = new LinkedHashSet<>(xs);
        focal.addAll(ys);
        focal.addAll(zs);

        Graph moralGraph = GraphTransforms.moralGraph(GraphTransforms.ancestorGraph(graph, focal));
        Set<Node> reachable = GraphUtils.getReachableNodes(moralGraph, xs, new HashSet<>(zs));

        for (Node y : ys) {
            if (reachable.contains(y)) {
                return false;
            }
        }

        return true;
    }

    public static boolean isDSeparated(Graph graph, Node x, Node y, Collection<Node> zs) {
        return isDSeparated(graph, Collections.singleton(x), Collections.singleton(y), zs);
    }

    private static void checkDisjoint(Collection<Node> a, Collection<Node> b, String aName, String bName) {
        for (Node node : a) {
            if (b.contains(node)) {
                throw new IllegalArgumentException("The sets " + aName + " and " + bName
                        + " are not disjoint; both contain " + node + ".");
            }
        }
    }
}
