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

import edu.cmu.adjust.util.AdjustLogger;
import edu.cmu.adjust.util.Parameters;
import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Tests the parameter bag and the event switches of the logger.
 *
 * @author jdramsey
 */
public class TestParameters {

    @After
    public void resetLogger() {
        AdjustLogger.getInstance().reset();
    }

    @Test
    public void testDefaults() {
        Parameters parameters = new Parameters();

        assertEquals("minimal", parameters.getString(Parameters.SEARCH_HEURISTIC));
        assertEquals("lowest_first", parameters.getString(Parameters.SEPARATOR_BRANCHING));
        assertEquals(-1L, parameters.getLong(Parameters.SEED));
        assertFalse(parameters.getBoolean(Parameters.VERBOSE));
        assertFalse(parameters.isSet(Parameters.SEED));
    }

    @Test
    public void testValuesGivenAsText() {
        Parameters parameters = new Parameters();
        parameters.set(Parameters.SEED, "42");
        parameters.set(Parameters.VERBOSE, "TRUE");

        assertEquals(42L, parameters.getLong(Parameters.SEED));
        assertEquals(42, parameters.getInt(Parameters.SEED));
        assertTrue(parameters.getBoolean(Parameters.VERBOSE));
    }

    @Test
    public void testCopyIsIndependent() {
        Parameters parameters = new Parameters();
        parameters.set(Parameters.SEARCH_HEURISTIC, "all");

        Parameters copy = new Parameters(parameters);
        copy.set(Parameters.SEARCH_HEURISTIC, "maximal");

        assertEquals("all", parameters.getString(Parameters.SEARCH_HEURISTIC));
        assertTrue(copy.getParametersNames().contains(Parameters.SEARCH_HEURISTIC));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParameter() {
        new Parameters().get("alpha");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotANumber() {
        Parameters parameters = new Parameters();
        parameters.set(Parameters.SEED, "many");
        parameters.getLong(Parameters.SEED);
    }

    @Test
    public void testLoggerEvents() {
        AdjustLogger logger = AdjustLogger.getInstance();

        assertTrue(logger.isEventActive(AdjustLogger.ADJUSTMENT_SETS));
        assertFalse(logger.isEventActive(AdjustLogger.SEPARATORS));

        logger.setEventsToLog(AdjustLogger.ALL_EVENTS.toArray(new String[0]));
        assertTrue(logger.isEventActive(AdjustLogger.SEPARATORS));

        logger.removeEventToLog(AdjustLogger.SEPARATORS);
        assertFalse(logger.isEventActive(AdjustLogger.SEPARATORS));

        logger.setLogging(false);
        assertFalse(logger.isEventActive(AdjustLogger.INFO));

        logger.reset();
        assertTrue(logger.isLogging());
        assertFalse(logger.isEventActive(AdjustLogger.INDEPENDENCIES));
    }
}
