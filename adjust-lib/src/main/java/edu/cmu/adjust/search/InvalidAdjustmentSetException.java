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

import java.util.Set;

/**
 * Thrown when minimality is asked of a covariate set that is not a valid adjustment set at all, i.e. that fails the
 * constructive back-door criterion.
 *
 * @author jdramsey
 */
public class InvalidAdjustmentSetException extends IllegalArgumentException {

    static final long serialVersionUID = 23L;

    private final BackdoorCriterionResult result;

    public InvalidAdjustmentSetException(BackdoorCriterionResult result) {
        super(result.getCovariates() + " is not a valid adjustment set. " + result);
        this.result = result;
    }

    public Set<Node> getCovariates() {
        return result.getCovariates();
    }

    /**
     * @return the criterion result saying which condition failed.
     */
    public BackdoorCriterionResult getResult() {
        return result;
    }
}
