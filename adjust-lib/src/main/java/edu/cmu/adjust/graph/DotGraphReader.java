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

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.graph.Pseudograph;
import org.jgrapht.nio.ImportException;
import org.jgrapht.nio.dot.DOTImporter;

import java.io.StringReader;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a graph written in the Graphviz DOT language, for example
 * <pre>
 * digraph G {
 *     A -> B;
 *     B -> C -> D [included=true, expected="positive"];
 *     E;
 * }
 * </pre>
 * A "digraph" gives a directed graph and a "graph" an undirected one. The text is parsed by JGraphT's DOT importer;
 * attributes on edge statements are kept as edge attributes, all other attributes are ignored.
 *
 * @author jdramsey
 */
public final class DotGraphReader {

    private static final Pattern HEADER = Pattern.compile("^\\s*(?:strict\\s+)?(digraph|graph)\\b",
            Pattern.CASE_INSENSITIVE);

    private DotGraphReader() {
    }

    /**
     * @throws IllegalArgumentException if the text is not valid DOT.
     * @throws CycleException           if a digraph has a directed cycle.
     */
    public static Graph read(String text) {
        Matcher matcher = HEADER.matcher(text);

        if (!matcher.find()) {
            throw new IllegalArgumentException("Expecting a DOT 'digraph' or 'graph'.");
        }

        boolean directed = "digraph".equalsIgnoreCase(matcher.group(1));

        org.jgrapht.Graph<String, DefaultEdge> imported = directed
                ? new DirectedPseudograph<>(DefaultEdge.class)
                : new Pseudograph<>(DefaultEdge.class);

        Map<DefaultEdge, Map<String, String>> attributes = new HashMap<>();

        DOTImporter<String, DefaultEdge> importer = new DOTImporter<>();
        importer.setVertexFactory(id -> id);
        importer.addEdgeAttributeConsumer((pair, attribute) ->
                attributes.computeIfAbsent(pair.getFirst(), e -> new LinkedHashMap<>())
                        .put(pair.getSecond(), attribute.getValue()));

        try {
            importer.importGraph(imported, new StringReader(text));
        } catch (ImportException e) {
            throw new IllegalArgumentException("Could not read DOT graph: " + e.getMessage(), e);
        }

        Graph graph = directed ? Graph.directed() : Graph.undirected();

        for (String vertex : imported.vertexSet()) {
            graph.addNode(vertex);
        }

        for (DefaultEdge edge : imported.edgeSet()) {
            Map<String, String> edgeAttributes = attributes.get(edge);
            graph.addEdge(imported.getEdgeSource(edge), imported.getEdgeTarget(edge),
                    edgeAttributes == null ? Collections.<String, String>emptyMap() : edgeAttributes);
        }

        return graph;
    }
}
