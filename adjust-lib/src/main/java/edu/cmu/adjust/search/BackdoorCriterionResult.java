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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The verdict of the constructive back-door criterion for one covariate set, with the condition that failed, if any.
 *
 * @author jdramsey
 */
public final class BackdoorCriterionResult {

    public enum Reason {
        /**
         * Both conditions hold.
         */
        SATISFIED,

        /**
         * Condition (1) fails: some covariate is a descendant of a node on a proper causal path.
         */
        DESCENDANT_OF_PROPER_CAUSAL_PATH,

        /**
         * Condition (2) fails: the covariates do not d-separate treatments and outcomes in the proper back-door graph.
         */
        NOT_D_SEPARATED
    }

    private final Reason reason;
    private final Set<Node> covariates;
    private final Set<Node> offendingCovariates;

    BackdoorCriterionResult(Reason reason, Set<Node> covariates, Set<Node> offendingCovariates) {
        this.reason = reason;
        this.covariates = Collections.unmodifiableSet(new LinkedHashSet<>(covariates));
        this.offendingCovariates = Collections.unmodifiableSet(new LinkedHashSet<>(offendingCovariates));
    }

    public boolean isSatisfied() {
        return reason == Reason.SATISFIED;
    }

    public Reason getReason() {
        return reason;
    }

    public Set<Node> getCovariates() {
        return covariates;
    }

    /**
     * @return the covariates that are descendants of a proper causal path; empty unless condition (1) failed.
     */
    public Set<Node> getOffendingCovariates() {
        return offendingCovariates;
    }

    @Override
    public String toString() {
        switch (reason) {
            case SATISFIED:
                return "Z=" + covariates + " satisfies the constructive back-door criterion";
            case DESCENDANT_OF_PROPER_CAUSAL_PATH:
                return "Failed condition 1: " + offendingCovariates
                        + " descend from a variable on a proper causal path";
            default:
                return "Failed condition 2: Z=" + covariates
                        + " does not d-separate treatments and outcomes in the proper back-door graph";
        }
    }
}
