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

import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.GraphUtils;
import edu.cmu.adjust.graph.Node;
import edu.cmu.adjust.util.AdjustLogger;
import edu.cmu.adjust.util.Parameters;
import edu.cmu.adjust.util.RandomUtil;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.*;

/**
 * Lists all minimal separators between a treatment node and an outcome node of an undirected graph, using the
 * backtracking procedures CloseSeparator and ListMinSep of Takata, Space-optimal, backtracking algorithms to list the
 * minimal vertex separators of a graph (2013).
 * <p>
 * The search grows a treatment side X (containing the treatment node) and an outcome side Y (containing the outcome
 * node), which stay disjoint. At each step one frontier node of X outside Y is put on the treatment side in one branch
 * and on the outcome side in the other. Which frontier node is chosen affects only the order in which separators are
 * listed: by default the node with the lowest name is taken, or a random one if a random generator is set.
 *
 * @author jdramsey
 */
public final class MinimalSeparators {

    private final Graph graph;
    private final Node treatmentNode;
    private final Node outcomeNode;

    /**
     * Chooses the branching node; null means lowest name first.
     */
    private RandomGenerator randomGenerator = null;

    //================================CONSTRUCTORS==========================//

    /**
     * @param graph         An undirected graph. It is not modified.
     * @param treatmentNode The node to separate from the outcome node.
     * @param outcomeNode   The node to separate from the treatment node.
     */
    public MinimalSeparators(Graph graph, Node treatmentNode, Node outcomeNode) {
        if (graph.isDirected()) {
            throw new IllegalArgumentException("Minimal separators are listed over undirected graphs.");
        }

        GraphUtils.checkNodes(graph, Arrays.asList(treatmentNode, outcomeNode));

        if (treatmentNode.equals(outcomeNode)) {
            throw new IllegalArgumentException("Treatment and outcome nodes must differ: " + treatmentNode);
        }

        this.graph = graph;
        this.treatmentNode = treatmentNode;
        this.outcomeNode = outcomeNode;
    }

    //==============================PUBLIC METHODS==========================//

    /**
     * Sets the source of random branching choices, or null to branch on the lowest-named node.
     */
    public void setRandomGenerator(RandomGenerator randomGenerator) {
        this.randomGenerator = randomGenerator;
    }

    /**
     * Configures branching from the "separatorBranching" and "seed" parameters.
     */
    public void setParameters(Parameters parameters) {
        String branching = parameters.getString(Parameters.SEPARATOR_BRANCHING);

        if ("lowest_first".equals(branching)) {
            setRandomGenerator(null);
        } else if ("random".equals(branching)) {
            long seed = parameters.getLong(Parameters.SEED);
            setRandomGenerator(seed < 0 ? RandomUtil.getInstance().newGenerator() : RandomUtil.newGenerator(seed));
        } else {
            throw new IllegalArgumentException("Unknown separator branching rule: " + branching);
        }
    }

    /**
     * The close separator of a treatment set X: remove the neighbors of X from the graph, take the connected component
     * C containing the outcome node, and return the neighbors of C in the full graph. Every node of the result is
     * adjacent to X.
     *
     * @param treatmentSet X; must contain the treatment node.
     * @throws NoSeparatorException if the outcome node is itself a neighbor of X.
     */
    public Set<Node> closeSeparator(Set<Node> treatmentSet) {
        Set<Node> neighbors = new HashSet<>();

        for (Node node : treatmentSet) {
            neighbors.addAll(graph.getAdjacentNodes(node));
        }

        if (neighbors.contains(outcomeNode)) {
            throw new NoSeparatorException(treatmentNode, outcomeNode);
        }

        Set<Node> component = GraphUtils.getReachableNodes(graph, Collections.singleton(outcomeNode), neighbors);
        return GraphUtils.getNeighbors(graph, component);
    }

    /**
     * Lists every minimal treatment-outcome separator reachable from the given partial sides. The neighbors of the
     * outcome node are added to the outcome side before the search starts, since the backtracking needs the closed
     * neighborhood of the outcome node there; they may still be listed as separator nodes.
     *
     * @param treatmentSet The treatment side; must contain the treatment node.
     * @param outcomeSet   The outcome side; must contain the outcome node and be disjoint from the treatment side.
     * @return the separators, each listed once, in the order found.
     * @throws NoSeparatorException if a node of the treatment side is adjacent to the outcome node.
     */
    public List<Set<Node>> listAllMinimalSeparators(Set<Node> treatmentSet, Set<Node> outcomeSet) {
        if (!treatmentSet.contains(treatmentNode)) {
            throw new IllegalArgumentException("Treatment set must contain " + treatmentNode);
        }

        if (!outcomeSet.contains(outcomeNode)) {
            throw new IllegalArgumentException("Outcome set must contain " + outcomeNode);
        }

        if (!Collections.disjoint(treatmentSet, outcomeSet)) {
            throw new IllegalArgumentException("Treatment and outcome sets must be disjoint: "
                    + treatmentSet + ", " + outcomeSet);
        }

        GraphUtils.checkNodes(graph, treatmentSet);
        GraphUtils.checkNodes(graph, outcomeSet);

        Set<Node> closedOutcomeSet = new LinkedHashSet<>(outcomeSet);
        closedOutcomeSet.addAll(graph.getAdjacentNodes(outcomeNode));

        if (!Collections.disjoint(treatmentSet, closedOutcomeSet)) {
            throw new NoSeparatorException(treatmentNode, outcomeNode);
        }

        List<Set<Node>> separators = new ArrayList<>();
        listMinSep(new LinkedHashSet<>(treatmentSet), closedOutcomeSet, separators);
        return separators;
    }

    //==============================PRIVATE METHODS=========================//

    private void listMinSep(Set<Node> treatmentSet, Set<Node> outcomeSet, List<Set<Node>> separators) {
        Set<Node> closeSeparator = closeSeparator(treatmentSet);

        // The treatment side grows to the whole component of the treatment node once the close separator is removed.
        Set<Node> component = GraphUtils.getReachableNodes(graph, Collections.singleton(treatmentNode),
                closeSeparator);

        if (!Collections.disjoint(component, outcomeSet)) {
            return;
        }

        Set<Node> frontier = GraphUtils.getNeighbors(graph, component);
        SortedSet<Node> eligible = new TreeSet<>(frontier);
        eligible.removeAll(outcomeSet);

        if (eligible.isEmpty()) {
            AdjustLogger.getInstance().log(AdjustLogger.SEPARATORS, "Minimal separator {}", frontier);
            separators.add(Collections.unmodifiableSet(frontier));
            return;
        }

        Node node = choose(eligible);

        Set<Node> largerTreatmentSet = new LinkedHashSet<>(component);
        largerTreatmentSet.add(node);
        listMinSep(largerTreatmentSet, outcomeSet, separators);

        Set<Node> largerOutcomeSet = new LinkedHashSet<>(outcomeSet);
        largerOutcomeSet.add(node);
        listMinSep(component, largerOutcomeSet, separators);
    }

    private Node choose(SortedSet<Node> eligible) {
        if (randomGenerator == null) {
            return eligible.first();
        }

        List<Node> candidates = new ArrayList<>(eligible);
        return candidates.get(randomGenerator.nextInt(candidates.size()));
    }
}
