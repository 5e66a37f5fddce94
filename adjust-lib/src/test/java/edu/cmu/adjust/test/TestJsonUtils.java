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

import edu.cmu.adjust.graph.CycleException;
import edu.cmu.adjust.graph.Edge;
import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.Node;
import edu.cmu.adjust.util.JsonUtils;
import org.json.JSONObject;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static edu.cmu.adjust.test.TestGraph.*;
import static org.junit.Assert.*;

/**
 * Tests reading and writing graphs as JSON.
 *
 * @author jdramsey
 */
public class TestJsonUtils {

    @Test
    public void testParseGraph() {
        Graph graph = JsonUtils.parseJSONObjectToGraph("{\"nodes\": [\"A\", \"B\", \"E\"],"
                + " \"edges\": [{\"from\": \"A\", \"to\": \"B\"},"
                + " {\"from\": \"B\", \"to\": \"C\", \"attributes\": {\"included\": true}}]}");

        assertTrue(graph.isDirected());
        assertEquals(Arrays.asList("A", "B", "E", "C"), graph.getNodeNames());
        assertEquals(Arrays.asList("A --> B", "B --> C"), edgeStrings(graph));
        assertEquals("true", graph.getEdge(new Node("B"), new Node("C")).getAttribute(Edge.INCLUDED));
    }

    @Test
    public void testWrittenGraphReadsBack() {
        Graph graph = dag("A->B", "B->C", "D->C");
        graph.addEdge("A", "D", Collections.singletonMap(Edge.EXPECTED, "negative"));

        JSONObject wrapped = new JSONObject();
        wrapped.put("graph", JsonUtils.graphToJSONObject(graph));
        Graph copy = JsonUtils.parseJSONObjectToGraph(wrapped.toString());

        assertEquals(graph.getNodeNames(), copy.getNodeNames());
        assertEquals(graph.getEdges(), copy.getEdges());
        assertEquals("negative", copy.getEdge(new Node("A"), new Node("D")).getAttribute(Edge.EXPECTED));
    }

    @Test
    public void testUndirectedGraph() {
        Graph graph = JsonUtils.parseJSONObjectToGraph(
                "{\"directed\": false, \"edges\": [{\"from\": \"a\", \"to\": \"b\"}]}");

        assertFalse(graph.isDirected());
        assertTrue(graph.isAdjacentTo(new Node("b"), new Node("a")));
    }

    @Test(expected = CycleException.class)
    public void testCyclicGraph() {
        JsonUtils.parseJSONObjectToGraph("{\"edges\": [{\"from\": \"A\", \"to\": \"B\"},"
                + " {\"from\": \"B\", \"to\": \"A\"}]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        JsonUtils.parseJSONObjectToGraph("{\"edges\": [{\"from\": \"A\"}]}");
    }
}
