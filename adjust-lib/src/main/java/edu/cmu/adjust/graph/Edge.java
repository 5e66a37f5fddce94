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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An edge between two nodes. A directed edge points from node1 to node2; an undirected edge has no orientation and is
 * equal to its reverse. Edges may carry string attributes (for instance "included" and "expected") which the graph
 * algorithms carry along but never interpret.
 * <p>
 * Edges are immutable, so graphs may share them freely when copied.
 *
 * @author jdramsey
 */
public final class Edge {

    public static final String INCLUDED = "included";
    public static final String EXPECTED = "expected";

    private final Node node1;
    private final Node node2;
    private final boolean directed;
    private final Map<String, String> attributes;

    //================================CONSTRUCTORS==========================//

    public Edge(Node node1, Node node2, boolean directed) {
        this(node1, node2, directed, Collections.emptyMap());
    }

    public Edge(Node node1, Node node2, boolean directed, Map<String, String> attributes) {
        if (node1 == null || node2 == null) {
            throw new NullPointerException("Nodes must not be null.");
        }

        this.node1 = node1;
        this.node2 = node2;
        this.directed = directed;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    //==============================PUBLIC METHODS==========================//

    /**
     * @return the tail of a directed edge, or the first endpoint of an undirected one.
     */
    public Node getNode1() {
        return node1;
    }

    /**
     * @return the head of a directed edge, or the second endpoint of an undirected one.
     */
    public Node getNode2() {
        return node2;
    }

    public boolean isDirected() {
        return directed;
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * @return a copy of this edge whose attributes are these attributes overwritten by the given ones.
     */
    public Edge withAttributes(Map<String, String> more) {
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        merged.putAll(more);
        return new Edge(node1, node2, directed, merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;

        if (directed != edge.directed) return false;

        if (directed) {
            return node1.equals(edge.node1) && node2.equals(edge.node2);
        }

        return (node1.equals(edge.node1) && node2.equals(edge.node2))
                || (node1.equals(edge.node2) && node2.equals(edge.node1));
    }

    @Override
    public int hashCode() {
        if (directed) {
            return Objects.hash(node1, node2, true);
        }

        // Symmetric in the endpoints.
        return node1.hashCode() + node2.hashCode();
    }

    @Override
    public String toString() {
        return node1 + (directed ? " --> " : " --- ") + node2;
    }
}
