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

package edu.cmu.adjust.search;

import edu.cmu.adjust.graph.Edge;
import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.Node;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * Chooses one adjustment set per causal edge, as needed to fit a regression surrogate for the effect along that edge.
 * Edges take part if they carry the {@link Edge#INCLUDED} attribute.
 *
 * @author jdramsey
 */
public final class EdgeIdentification {

    private final AdjustmentSets adjustmentSets;

    public EdgeIdentification(AdjustmentSets adjustmentSets) {
        this.adjustmentSets = adjustmentSets;
    }

    /**
     * The smallest minimal adjustment set for the effect of the treatment on the outcome. Among sets of equal size the
     * one whose sorted names come first is taken, so the choice does not depend on enumeration order.
     *
     * @throws IllegalStateException if there is no adjustment set.
     */
    public Set<Node> identify(Node treatment, Node outcome) {
        List<Set<Node>> candidates = adjustmentSets.enumerateMinimalAdjustmentSets(
                Collections.singleton(treatment), Collections.singleton(outcome));

        if (candidates.isEmpty()) {
            throw new IllegalStateException("No adjustment set identifies the effect of " + treatment + " on "
                    + outcome + ".");
        }

        Set<Node> best = null;

        for (Set<Node> candidate : candidates) {
            if (best == null || candidate.size() < best.size()
                    || (candidate.size() == best.size() && sortedKey(candidate).compareTo(sortedKey(best)) < 0)) {
                best = candidate;
            }
        }

        return best;
    }

    /**
     * @return for each included edge of the DAG, in edge order, the adjustment set chosen by {@link #identify}.
     */
    public Map<Edge, Set<Node>> includedEdgeAdjustmentSets() {
        Graph dag = adjustmentSets.getDag();
        Map<Edge, Set<Node>> sets = new LinkedHashMap<>();

        for (Edge edge : dag.getEdges()) {
            if (edge.hasAttribute(Edge.INCLUDED)) {
                sets.put(edge, identify(edge.getNode1(), edge.getNode2()));
            }
        }

        return sets;
    }

    private static String sortedKey(Set<Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes);
        Collections.sort(sorted);
        return StringUtils.join(sorted, ",");
    }
}
