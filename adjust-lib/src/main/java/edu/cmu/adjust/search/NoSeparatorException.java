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

/**
 * Thrown when a close separator is requested but the outcome anchor cannot be separated from the treatment side,
 * because it lies in the neighborhood of the treatment set. This means the anchors passed in were invalid.
 *
 * @author jdramsey
 */
public class NoSeparatorException extends IllegalStateException {

    static final long serialVersionUID = 23L;

    private final Node treatmentNode;
    private final Node outcomeNode;

    public NoSeparatorException(Node treatmentNode, Node outcomeNode) {
        super("No " + treatmentNode + "-" + outcomeNode + " separator in the graph.");
        this.treatmentNode = treatmentNode;
        this.outcomeNode = outcomeNode;
    }

    public Node getTreatmentNode() {
        return treatmentNode;
    }

    public Node getOutcomeNode() {
        return outcomeNode;
    }
}
