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

package edu.cmu.adjust.test;

import edu.cmu.adjust.graph.*;
import org.junit.Test;

import java.util.*;

import static edu.cmu.adjust.test.TestGraph.*;
import static org.junit.Assert.*;

/**
 * Tests the derived graphs used to find adjustment sets.
 *
 * @author jdramsey
 */
public class TestGraphTransforms {

    private static Graph mediatedDag() {
        return dag("X1->X2", "X2->V", "X2->D1", "X2->D2", "D1->Y", "D1->D2", "Y->D3", "Z->X2", "Z->Y");
    }

    @Test
    public void testBackdoorGraph() {
        Graph graph = mediatedDag();
        Graph backdoor = GraphTransforms.backdoorGraph(graph, GraphUtils.getNodes(graph, "X1", "X2"));

        assertEquals(new HashSet<>(Arrays.asList("D1 --> Y", "D1 --> D2", "Y --> D3", "Z --> X2", "Z --> Y")),
                new HashSet<>(edgeStrings(backdoor)));
        assertEquals(graph.getNodeNames(), backdoor.getNodeNames());
        assertEquals(9, graph.getNumEdges());
    }

    @Test
    public void testProperBackdoorGraphDropsFirstEdgeOfCausalPath() {
        Graph graph = mediatedDag();
        List<Node> treatments = GraphUtils.getNodes(graph, "X1", "X2");
        List<Node> outcomes = GraphUtils.getNodes(graph, "Y");

        assertEquals(set("D1", "Y"), names(GraphTransforms.properCausalPathway(graph, treatments, outcomes)));

        Graph properBackdoor = GraphTransforms.properBackdoorGraph(graph, treatments, outcomes);
        Set<String> expected = new HashSet<>(edgeStrings(graph));
        expected.remove("X2 --> D1");

        assertEquals(expected, new HashSet<>(edgeStrings(properBackdoor)));
        assertEquals(9, graph.getNumEdges());
    }

    @Test
    public void testCausalPathThroughAnotherTreatment() {
        Graph graph = dag("X1->X2", "X2->Y");
        List<Node> treatments = GraphUtils.getNodes(graph, "X1", "X2");
        List<Node> outcomes = GraphUtils.getNodes(graph, "Y");

        // X2 lies on the path from X1 but is a treatment, so it is not on a proper causal path.
        assertEquals(set("Y"), names(GraphTransforms.properCausalPathway(graph, treatments, outcomes)));
        assertEquals(Collections.singletonList("X1 --> X2"),
                edgeStrings(GraphTransforms.properBackdoorGraph(graph, treatments, outcomes)));
    }

    @Test
    public void testAncestorGraph() {
        Graph graph = mediatedDag();
        Graph ancestors = GraphTransforms.ancestorGraph(graph, GraphUtils.getNodes(graph, "X1", "X2", "Y"));

        assertEquals(Arrays.asList("X1", "X2", "D1", "Y", "Z"), ancestors.getNodeNames());
        assertEquals(new HashSet<>(Arrays.asList("X1 --> X2", "X2 --> D1", "D1 --> Y", "Z --> X2", "Z --> Y")),
                new HashSet<>(edgeStrings(ancestors)));
    }

    @Test
    public void testIndirectGraph() {
        Graph graph = dag("X->M", "M->Y", "X->Y", "W->Y");
        Graph indirect = GraphTransforms.indirectGraph(graph, GraphUtils.getNodes(graph, "X"),
                GraphUtils.getNodes(graph, "Y"));

        assertEquals(new HashSet<>(Arrays.asList("X --> M", "M --> Y", "W --> Y")),
                new HashSet<>(edgeStrings(indirect)));
    }

    @Test
    public void testMoralGraph() {
        Graph graph = mediatedDag();
        Graph ancestors = GraphTransforms.ancestorGraph(graph, GraphUtils.getNodes(graph, "X1", "X2", "Y"));
        Graph moral = GraphTransforms.moralGraph(ancestors);

        assertFalse(moral.isDirected());
        assertEquals(ancestors.getNodeNames(), moral.getNodeNames());

        // Skeleton plus the married parents of X2 and of Y.
        assertEquals(7, moral.getNumEdges());
        assertTrue(moral.isAdjacentTo(new Node("X1"), new Node("Z")));
        assertTrue(moral.isAdjacentTo(new Node("D1"), new Node("Z")));
        assertTrue(moral.isAdjacentTo(new Node("X2"), new Node("X1")));

        for (Node node : moral.getNodes()) {
            assertFalse(moral.isAdjacentTo(node, node));
        }
    }

    @Test
    public void testMoralGraphIsIdempotent() {
        Graph graph = mediatedDag();
        Graph moral = GraphTransforms.moralGraph(graph);
        Graph twice = GraphTransforms.moralGraph(moral);

        assertEquals(new HashSet<>(moral.getEdges()), new HashSet<>(twice.getEdges()));
        assertEquals(moral.getNodeNames(), twice.getNodeNames());
    }

    @Test
    public void testUnknownTreatment() {
        Graph graph = mediatedDag();

        try {
            GraphTransforms.properBackdoorGraph(graph, Collections.singleton(new Node("Q")),
                    GraphUtils.getNodes(graph, "Y"));
            fail("Expected an unknown node.");
        } catch (UnknownNodeException e) {
            assertEquals(Collections.singletonList("Q"), e.getMissing());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBackdoorGraphOfUndirectedGraph() {
        Graph graph = Graph.undirected();
        graph.addEdge("a", "b");
        GraphTransforms.backdoorGraph(graph, GraphUtils.getNodes(graph, "a"));
    }
}
