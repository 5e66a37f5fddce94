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

import edu.cmu.adjust.graph.DSeparation;
import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.Node;
import edu.cmu.adjust.util.AdjustLogger;
import edu.cmu.adjust.util.Parameters;
import org.apache.commons.math3.util.CombinatoricsUtils;

import java.util.*;

/**
 * Lists the conditional independence facts implied by a causal DAG, by d-separation.
 * <p>
 * Every unordered pair {x, y} of distinct nodes is considered once, x being the earlier node in the graph's order. If
 * x and y are d-separated given the empty set, that single fact is recorded. Otherwise conditioning sets drawn from
 * the remaining nodes are tried by size, smallest first (largest first for {@link SearchHeuristic#MAXIMAL}); every
 * separating set of the first size that has any is recorded, or of every size for {@link SearchHeuristic#ALL}.
 *
 * @author jdramsey
 */
public final class IndependenceSearch {

    private final Graph dag;
    private SearchHeuristic heuristic = SearchHeuristic.MINIMAL;

    //================================CONSTRUCTORS==========================//

    public IndependenceSearch(Graph dag) {
        if (!dag.isDirected()) {
            throw new IllegalArgumentException("Implied independencies are read off causal DAGs.");
        }

        this.dag = dag;
    }

    public IndependenceSearch(Graph dag, Parameters parameters) {
        this(dag);
        setHeuristic(SearchHeuristic.fromName(parameters.getString(Parameters.SEARCH_HEURISTIC)));
    }

    //==============================PUBLIC METHODS==========================//

    public SearchHeuristic getHeuristic() {
        return heuristic;
    }

    public void setHeuristic(SearchHeuristic heuristic) {
        if (heuristic == null) {
            throw new NullPointerException("Heuristic must not be null.");
        }

        this.heuristic = heuristic;
    }

    /**
     * @return the implied conditional independence facts, pair by pair in node order. Empty for fewer than two
     * nodes.
     */
    public List<ConditionalIndependence> search() {
        List<ConditionalIndependence> facts = new ArrayList<>();
        List<Node> nodes = dag.getNodes();

        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                facts.addAll(searchPair(nodes.get(i), nodes.get(j)));
            }
        }

        AdjustLogger.getInstance().log(AdjustLogger.INFO, "{} independence facts found using the {} heuristic.",
                facts.size(), heuristic);
        return facts;
    }

    /**
     * @return the recorded facts for one pair of nodes.
     */
    public List<ConditionalIndependence> searchPair(Node x, Node y) {
        if (DSeparation.isDSeparated(dag, x, y, Collections.emptySet())) {
            log(x, y, Collections.emptySet());
            return Collections.singletonList(new ConditionalIndependence(x, y));
        }

        List<Node> others = dag.getNodes();
        others.remove(x);
        others.remove(y);

        List<Node> directCauses = new ArrayList<>();

        if (heuristic == SearchHeuristic.MIN_DIRECT) {
            directCauses.addAll(dag.getParents(y));
            directCauses.remove(x);
        }

        Set<Set<Node>> separating = new LinkedHashSet<>();
        int n = others.size();

        for (int k = 1; k <= n; k++) {
            int size = heuristic == SearchHeuristic.MAXIMAL ? n + 1 - k : k;
            boolean found = false;

            Iterator<int[]> choices = CombinatoricsUtils.combinationsIterator(n, size);

            while (choices.hasNext()) {
                Set<Node> z = new LinkedHashSet<>();

                for (int index : choices.next()) {
                    z.add(others.get(index));
                }

                z.addAll(directCauses);

                if (DSeparation.isDSeparated(dag, Collections.singleton(x), Collections.singleton(y), z)) {
                    found = true;

                    if (separating.add(z)) {
                        log(x, y, z);
                    }
                }
            }

            if (found && heuristic != SearchHeuristic.ALL) {
                break;
            }
        }

        List<ConditionalIndependence> facts = new ArrayList<>();

        for (Set<Node> z : separating) {
            facts.add(new ConditionalIndependence(x, y, z));
        }

        return facts;
    }

    private void log(Node x, Node y, Set<Node> z) {
        AdjustLogger.getInstance().log(AdjustLogger.INDEPENDENCIES, "{} _||_ {} | {}", x, y, z);
    }
}
