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

/**
 * Limits which conditioning sets {@link IndependenceSearch} reports for a pair of variables.
 *
 * @author jdramsey
 */
public enum SearchHeuristic {

    /**
     * The smallest conditioning sets that separate the pair.
     */
    MINIMAL("minimal"),

    /**
     * As minimal, but the direct causes of the second variable are always conditioned on.
     */
    MIN_DIRECT("min_direct"),

    /**
     * The largest conditioning sets that separate the pair.
     */
    MAXIMAL("maximal"),

    /**
     * Every separating conditioning set. May be very many.
     */
    ALL("all");

    private final String name;

    SearchHeuristic(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static SearchHeuristic fromName(String name) {
        for (SearchHeuristic heuristic : values()) {
            if (heuristic.name.equalsIgnoreCase(name)) {
                return heuristic;
            }
        }

        throw new IllegalArgumentException("Unknown search heuristic: " + name
                + ". Expecting one of minimal, min_direct, maximal, all.");
    }

    @Override
    public String toString() {
        return name;
    }
}
