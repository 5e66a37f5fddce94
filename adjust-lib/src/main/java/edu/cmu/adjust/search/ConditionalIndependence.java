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

import edu.cmu.adjust.graph.Node;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * A conditional independence fact X &#x2AEB; Y | Z. Two facts are equal when they have the same X, the same Y and the
 * same conditioning set; X and Y are not interchangeable.
 *
 * @author jdramsey
 */
public final class ConditionalIndependence {

    private final Node x;
    private final Node y;
    private final Set<Node> z;

    public ConditionalIndependence(Node x, Node y) {
        this(x, y, Collections.emptySet());
    }

    public ConditionalIndependence(Node x, Node y, Collection<Node> z) {
        if (x.equals(y)) {
            throw new IllegalArgumentException("X and Y must differ: " + x);
        }

        if (z.contains(x) || z.contains(y)) {
            throw new IllegalArgumentException("Conditioning set " + z + " may not contain " + x + " or " + y);
        }

        this.x = x;
        this.y = y;
        this.z = Collections.unmodifiableSet(new LinkedHashSet<>(z));
    }

    public Node getX() {
        return x;
    }

    public Node getY() {
        return y;
    }

    public Set<Node> getZ() {
        return z;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConditionalIndependence)) return false;
        ConditionalIndependence that = (ConditionalIndependence) o;
        return x.equals(that.x) && y.equals(that.y) && z.equals(that.z);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    /**
     * @return the fact as X⫫Y, or X⫫Y|{Z1, Z2} with the conditioning variables sorted.
     */
    @Override
    public String toString() {
        String base = x + "⫫" + y;

        if (z.isEmpty()) {
            return base;
        }

        List<Node> sorted = new ArrayList<>(z);
        Collections.sort(sorted);
        return base + "|{" + StringUtils.join(sorted, ", ") + "}";
    }
}
