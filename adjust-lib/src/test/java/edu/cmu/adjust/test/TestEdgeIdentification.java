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

import edu.cmu.adjust.graph.Edge;
import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.Node;
import edu.cmu.adjust.search.AdjustmentSets;
import edu.cmu.adjust.search.EdgeIdentification;
import org.junit.Test;

import java.util.*;

import static edu.cmu.adjust.test.TestGraph.*;
import static org.junit.Assert.*;

/**
 * Tests the choice of one adjustment set per included edge.
 *
 * @author jdramsey
 */
public class TestEdgeIdentification {

    private static Graph graph() {
        Map<String, String> included = Collections.singletonMap(Edge.INCLUDED, "true");

        Graph graph = Graph.directed();
        graph.addEdge("Z", "X", included);
        graph.addEdge("Z", "Y");
        graph.addEdge("X", "Y", included);
        graph.addEdge("W", "Z");
        return graph;
    }

    @Test
    public void testIdentify() {
        EdgeIdentification identification = new EdgeIdentification(new AdjustmentSets(graph()));

        assertEquals(set("Z"), names(identification.identify(new Node("X"), new Node("Y"))));
        assertTrue(identification.identify(new Node("Z"), new Node("X")).isEmpty());
    }

    @Test
    public void testSmallestSetIsChosen() {
        // Both {Z1} and {Z2} block the back-door path; the first by name is taken.
        Graph graph = dag("Z2->X", "Z1->Z2", "Z1->Y", "X->Y");
        EdgeIdentification identification = new EdgeIdentification(new AdjustmentSets(graph));

        assertEquals(set("Z1"), names(identification.identify(new Node("X"), new Node("Y"))));
    }

    @Test
    public void testIncludedEdges() {
        Map<Edge, Set<Node>> sets = new EdgeIdentification(new AdjustmentSets(graph())).includedEdgeAdjustmentSets();

        assertEquals(Arrays.asList("Z --> X", "X --> Y"), toStrings(sets.keySet()));

        Iterator<Set<Node>> values = sets.values().iterator();
        assertTrue(values.next().isEmpty());
        assertEquals(set("Z"), names(values.next()));
    }

    private static List<String> toStrings(Collection<Edge> edges) {
        List<String> strings = new ArrayList<>();

        for (Edge edge : edges) {
            strings.add(edge.toString());
        }

        return strings;
    }
}
