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

package edu.cmu.adjust.util;

import edu.cmu.adjust.graph.Edge;
import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.Node;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes graphs as JSON:
 * <pre>
 * {
 *   "directed": true,
 *   "nodes": ["A", "B"],
 *   "edges": [{"from": "A", "to": "B", "attributes": {"included": "true"}}]
 * }
 * </pre>
 * "directed" defaults to true and "attributes" may be left out. Endpoints of edges need not be listed among the nodes.
 *
 * @author jdramsey
 */
public class JsonUtils {

    public static Graph parseJSONObjectToGraph(String json) {
        try {
            return parseJSONObjectToGraph(new JSONObject(json));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed graph description: " + e.getMessage(), e);
        }
    }

    public static Graph parseJSONObjectToGraph(JSONObject jObj) {
        try {
            if (jObj.has("graph")) {
                return parseJSONObjectToGraph(jObj.getJSONObject("graph"));
            }

            Graph graph = jObj.optBoolean("directed", true) ? Graph.directed() : Graph.undirected();

            // Nodes
            JSONArray nodes = jObj.optJSONArray("nodes");

            if (nodes != null) {
                for (int i = 0; i < nodes.length(); i++) {
                    graph.addNode(nodes.getString(i));
                }
            }

            // Edges
            JSONArray edges = jObj.optJSONArray("edges");

            if (edges != null) {
                for (int i = 0; i < edges.length(); i++) {
                    JSONObject edge = edges.getJSONObject(i);
                    graph.addEdge(edge.getString("from"), edge.getString("to"),
                            parseAttributes(edge.optJSONObject("attributes")));
                }
            }

            return graph;
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed graph description: " + e.getMessage(), e);
        }
    }

    public static JSONObject graphToJSONObject(Graph graph) {
        JSONObject jObj = new JSONObject();
        jObj.put("directed", graph.isDirected());

        JSONArray nodes = new JSONArray();

        for (Node node : graph.getNodes()) {
            nodes.put(node.getName());
        }

        jObj.put("nodes", nodes);

        JSONArray edges = new JSONArray();

        for (Edge edge : graph.getEdges()) {
            JSONObject jEdge = new JSONObject();
            jEdge.put("from", edge.getNode1().getName());
            jEdge.put("to", edge.getNode2().getName());

            if (!edge.getAttributes().isEmpty()) {
                jEdge.put("attributes", new JSONObject(edge.getAttributes()));
            }

            edges.put(jEdge);
        }

        jObj.put("edges", edges);
        return jObj;
    }

    private static Map<String, String> parseAttributes(JSONObject jObj) {
        Map<String, String> attributes = new LinkedHashMap<>();

        if (jObj == null) {
            return attributes;
        }

        for (String key : jObj.keySet()) {
            attributes.put(key, String.valueOf(jObj.get(key)));
        }

        return attributes;
    }
}
