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

import edu.cmu.adjust.graph.*;
import edu.cmu.adjust.util.AdjustLogger;
import edu.cmu.adjust.util.Parameters;

import java.util.*;

/**
 * Finds and checks covariate adjustment sets for the causal effect of a set of treatments on a set of outcomes in a
 * causal DAG.
 * <p>
 * Minimal adjustment sets are listed following Textor and Liskiewicz, Adjustment criteria in causal diagrams: an
 * algorithmic perspective (2012), as extended by Zander et al., Separators and adjustment sets in causal graphs:
 * complete criteria and an algorithmic framework (2019):
 * <ol>
 * <li>Build the proper back-door graph (the first edge of every proper causal path removed).</li>
 * <li>Take its ancestor graph over treatments and outcomes and moralize it.</li>
 * <li>Attach a treatment anchor and an outcome anchor, then eliminate the treatments, the outcomes and the
 * descendants of the proper causal pathway, so that only admissible covariates remain between the anchors.</li>
 * <li>List the minimal separators between the anchors with Takata's algorithm.</li>
 * </ol>
 * The DAG is never modified, so one instance may serve any number of queries.
 *
 * @author jdramsey
 */
public final class AdjustmentSets {

    static final String TREATMENT = "TREATMENT";
    static final String OUTCOME = "OUTCOME";

    private final Graph dag;
    private Parameters parameters = new Parameters();

    //================================CONSTRUCTORS==========================//

    public AdjustmentSets(Graph dag) {
        if (!dag.isDirected()) {
            throw new IllegalArgumentException("Adjustment sets are defined for causal DAGs.");
        }

        this.dag = dag;
    }

    public AdjustmentSets(Graph dag, Parameters parameters) {
        this(dag);
        setParameters(parameters);
    }

    //==============================PUBLIC METHODS==========================//

    public Graph getDag() {
        return dag;
    }

    public void setParameters(Parameters parameters) {
        if (parameters == null) {
            throw new NullPointerException("Parameters must not be null.");
        }

        this.parameters = parameters;
    }

    /**
     * Lists the minimal sets of covariates that block every back-door path from the treatments to the outcomes, for
     * the total effect.
     *
     * @throws UnknownNodeException     if a treatment or outcome is not in the DAG.
     * @throws IllegalArgumentException if treatments or outcomes are empty or overlap.
     */
    public List<Set<Node>> enumerateMinimalAdjustmentSets(Collection<Node> treatments, Collection<Node> outcomes) {
        checkQuery(treatments, outcomes);

        Graph properBackdoorGraph = GraphTransforms.properBackdoorGraph(dag, treatments, outcomes);
        Set<Node> descendants = dag.getDescendants(GraphTransforms.properCausalPathway(dag, treatments, outcomes));
        List<Set<Node>> adjustmentSets = minimalSeparators(properBackdoorGraph, treatments, outcomes, descendants);

        if (adjustmentSets.isEmpty()) {
            AdjustLogger.getInstance().warn("The effect of X={} on Y={} cannot be identified by adjustment.",
                    treatments, outcomes);
        }

        AdjustLogger.getInstance().log(AdjustLogger.ADJUSTMENT_SETS,
                "Minimal adjustment sets for X={} on Y={}: {}", treatments, outcomes, adjustmentSets);
        return adjustmentSets;
    }

    /**
     * Lists the minimal adjustment sets for the direct effect of the treatments on the outcomes. Only the edges
     * pointing directly from a treatment to an outcome are removed before separating, so mediators are adjusted for.
     *
     * @throws UnknownNodeException     if a treatment or outcome is not in the DAG.
     * @throws IllegalArgumentException if treatments or outcomes are empty or overlap.
     */
    public List<Set<Node>> directEffectAdjustmentSets(Collection<Node> treatments, Collection<Node> outcomes) {
        checkQuery(treatments, outcomes);

        Graph indirectGraph = GraphTransforms.indirectGraph(dag, treatments, outcomes);
        List<Set<Node>> adjustmentSets = minimalSeparators(indirectGraph, treatments, outcomes,
                Collections.<Node>emptySet());

        AdjustLogger.getInstance().log(AdjustLogger.ADJUSTMENT_SETS,
                "Direct effect adjustment sets for X={} on Y={}: {}", treatments, outcomes, adjustmentSets);
        return adjustmentSets;
    }

    /**
     * The constructive back-door criterion (Zander et al., Definition 4). Covariates Z satisfy it for treatments X
     * and outcomes Y if
     * <ol>
     * <li>no node of Z is a descendant (inclusively) of a node on a proper causal path from X to Y, and</li>
     * <li>Z d-separates X and Y in the proper back-door graph relative to X and Y.</li>
     * </ol>
     *
     * @param properBackdoorGraph The proper back-door graph of this DAG relative to the treatments and outcomes.
     * @return the verdict, saying which condition failed if either did.
     * @throws UnknownNodeException     if a treatment, outcome or covariate is not in the DAG.
     * @throws IllegalArgumentException if the covariates overlap the treatments or outcomes.
     */
    public BackdoorCriterionResult constructiveBackdoorCriterion(Graph properBackdoorGraph,
                                                                 Collection<Node> treatments,
                                                                 Collection<Node> outcomes,
                                                                 Collection<Node> covariates) {
        GraphUtils.checkNodes(dag, covariates);
        Set<Node> zs = new LinkedHashSet<>(covariates);

        Set<Node> pathway = GraphTransforms.properCausalPathway(dag, treatments, outcomes);
        Set<Node> descendants = dag.getDescendants(pathway);

        Set<Node> offending = new LinkedHashSet<>(zs);
        offending.retainAll(descendants);

        if (!offending.isEmpty()) {
            AdjustLogger.getInstance().log(AdjustLogger.BACKDOOR_CRITERION,
                    "Failed condition 1: Z={} is a descendant of some variable on a proper causal path "
                            + "between X={} and Y={}.", zs, treatments, outcomes);
            return new BackdoorCriterionResult(BackdoorCriterionResult.Reason.DESCENDANT_OF_PROPER_CAUSAL_PATH,
                    zs, offending);
        }

        if (!DSeparation.isDSeparated(properBackdoorGraph, treatments, outcomes, zs)) {
            AdjustLogger.getInstance().log(AdjustLogger.BACKDOOR_CRITERION,
                    "Failed condition 2: Z={} does not d-separate X={} and Y={} in the proper back-door graph.",
                    zs, treatments, outcomes);
            return new BackdoorCriterionResult(BackdoorCriterionResult.Reason.NOT_D_SEPARATED,
                    zs, Collections.emptySet());
        }

        return new BackdoorCriterionResult(BackdoorCriterionResult.Reason.SATISFIED, zs, Collections.emptySet());
    }

    /**
     * Checks the constructive back-door criterion against the proper back-door graph of this DAG.
     */
    public BackdoorCriterionResult constructiveBackdoorCriterion(Collection<Node> treatments,
                                                                 Collection<Node> outcomes,
                                                                 Collection<Node> covariates) {
        checkQuery(treatments, outcomes);
        Graph properBackdoorGraph = GraphTransforms.properBackdoorGraph(dag, treatments, outcomes);
        return constructiveBackdoorCriterion(properBackdoorGraph, treatments, outcomes, covariates);
    }

    /**
     * Whether the adjustment set is minimal: no covariate can be dropped without breaking the constructive back-door
     * criterion (Zander et al., Corollary 5).
     *
     * @throws InvalidAdjustmentSetException if the set does not satisfy the criterion to begin with.
     */
    public boolean adjustmentSetIsMinimal(Collection<Node> treatments, Collection<Node> outcomes,
                                          Collection<Node> adjustmentSet) {
        return getRedundantCovariate(treatments, outcomes, adjustmentSet) == null;
    }

    /**
     * Finds a covariate that can be dropped from a valid adjustment set while leaving a valid adjustment set.
     *
     * @return the first such covariate, or null if the set is minimal.
     * @throws InvalidAdjustmentSetException if the set does not satisfy the constructive back-door criterion.
     */
    public Node getRedundantCovariate(Collection<Node> treatments, Collection<Node> outcomes,
                                      Collection<Node> adjustmentSet) {
        checkQuery(treatments, outcomes);

        Graph properBackdoorGraph = GraphTransforms.properBackdoorGraph(dag, treatments, outcomes);
        BackdoorCriterionResult result = constructiveBackdoorCriterion(properBackdoorGraph, treatments, outcomes,
                adjustmentSet);

        if (!result.isSatisfied()) {
            throw new InvalidAdjustmentSetException(result);
        }

        Set<Node> zs = new LinkedHashSet<>(adjustmentSet);

        for (Node variable : zs) {
            Set<Node> smaller = new LinkedHashSet<>(zs);
            smaller.remove(variable);

            if (constructiveBackdoorCriterion(properBackdoorGraph, treatments, outcomes, smaller).isSatisfied()) {
                AdjustLogger.getInstance().log(AdjustLogger.ADJUSTMENT_SETS,
                        "Z={} is not minimal because Z'=Z\\{{}}={} is also a valid adjustment set.",
                        zs, variable, smaller);
                return variable;
            }
        }

        return null;
    }

    //==============================PRIVATE METHODS=========================//

    /**
     * Moralizes the ancestor graph of the given graph, attaches the anchors, eliminates every node that may not be
     * adjusted for and lists the minimal separators between the anchors.
     *
     * @param forbidden Nodes other than the treatments and outcomes that no adjustment set may contain.
     */
    private List<Set<Node>> minimalSeparators(Graph graph, Collection<Node> treatments, Collection<Node> outcomes,
                                              Set<Node> forbidden) {
        Set<Node> focal = new LinkedHashSet<>(treatments);
        focal.addAll(outcomes);

        Graph moralGraph = GraphTransforms.moralGraph(GraphTransforms.ancestorGraph(graph, focal));

        Node treatmentAnchor = freshNode(moralGraph, TREATMENT);
        moralGraph.addNode(treatmentAnchor);
        Node outcomeAnchor = freshNode(moralGraph, OUTCOME);
        moralGraph.addNode(outcomeAnchor);

        for (Node treatment : treatments) {
            moralGraph.addEdge(treatmentAnchor, treatment);
        }

        for (Node outcome : outcomes) {
            moralGraph.addEdge(outcomeAnchor, outcome);
        }

        // Separation between the anchors by sets avoiding an eliminated node is unchanged.
        Set<Node> eliminated = new LinkedHashSet<>(focal);
        eliminated.addAll(forbidden);

        for (Node node : eliminated) {
            eliminate(moralGraph, node);
        }

        if (moralGraph.isAdjacentTo(treatmentAnchor, outcomeAnchor)) {
            AdjustLogger.getInstance().log(AdjustLogger.SEPARATORS,
                    "No allowed covariates separate X={} from Y={}.", treatments, outcomes);
            return new ArrayList<>();
        }

        Set<Node> treatmentSet = new LinkedHashSet<>();
        treatmentSet.add(treatmentAnchor);

        Set<Node> outcomeSet = new LinkedHashSet<>();
        outcomeSet.add(outcomeAnchor);

        MinimalSeparators separators = new MinimalSeparators(moralGraph, treatmentAnchor, outcomeAnchor);
        separators.setParameters(parameters);
        return separators.listAllMinimalSeparators(treatmentSet, outcomeSet);
    }

    /**
     * Removes the node, joining its neighbors pairwise.
     */
    private void eliminate(Graph graph, Node node) {
        if (!graph.containsNode(node)) {
            return;
        }

        List<Node> neighbors = graph.getAdjacentNodes(node);
        graph.removeNode(node);

        for (int i = 0; i < neighbors.size(); i++) {
            for (int j = i + 1; j < neighbors.size(); j++) {
                graph.addEdge(neighbors.get(i), neighbors.get(j));
            }
        }
    }

    private Node freshNode(Graph graph, String name) {
        String fresh = name;

        for (int i = 1; graph.getNode(fresh) != null || dag.getNode(fresh) != null; i++) {
            fresh = name + "_" + i;
        }

        return new Node(fresh);
    }

    private void checkQuery(Collection<Node> treatments, Collection<Node> outcomes) {
        if (treatments.isEmpty()) {
            throw new IllegalArgumentException("At least one treatment is required.");
        }

        if (outcomes.isEmpty()) {
            throw new IllegalArgumentException("At least one outcome is required.");
        }

        GraphUtils.checkNodes(dag, treatments);
        GraphUtils.checkNodes(dag, outcomes);

        if (!Collections.disjoint(treatments, outcomes)) {
            throw new IllegalArgumentException("Treatments " + treatments + " and outcomes " + outcomes
                    + " must not overlap.");
        }
    }
}
