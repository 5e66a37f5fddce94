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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide logger for search events. Messages are tagged with an event type and written only if that event type
 * is currently enabled; forced messages are always written. Output goes to SLF4J under the "edu.cmu.adjust" logger.
 *
 * @author jdramsey
 */
public class AdjustLogger {

    public static final String ADJUSTMENT_SETS = "adjustmentSets";
    public static final String BACKDOOR_CRITERION = "backdoorCriterion";
    public static final String SEPARATORS = "separators";
    public static final String INDEPENDENCIES = "independencies";
    public static final String INFO = "info";

    /**
     * Every event type emitted by this library.
     */
    public static final List<String> ALL_EVENTS = Collections.unmodifiableList(Arrays.asList(
            ADJUSTMENT_SETS, BACKDOOR_CRITERION, SEPARATORS, INDEPENDENCIES, INFO));

    private static final List<String> DEFAULT_EVENTS = Arrays.asList(ADJUSTMENT_SETS, BACKDOOR_CRITERION, INFO);

    private static final AdjustLogger INSTANCE = new AdjustLogger();

    private final Logger logger = LoggerFactory.getLogger("edu.cmu.adjust");
    private final Set<String> eventsToLog = ConcurrentHashMap.newKeySet();
    private volatile boolean logging = true;

    private AdjustLogger() {
        reset();
    }

    public static AdjustLogger getInstance() {
        return INSTANCE;
    }

    /**
     * Restores the default event types and turns logging back on.
     */
    public void reset() {
        eventsToLog.clear();
        eventsToLog.addAll(DEFAULT_EVENTS);
        logging = true;
    }

    /**
     * Replaces the enabled event types with the given ones.
     */
    public void setEventsToLog(String... events) {
        eventsToLog.clear();
        eventsToLog.addAll(Arrays.asList(events));
    }

    public void removeEventToLog(String event) {
        eventsToLog.remove(event);
    }

    public boolean isEventActive(String event) {
        return logging && eventsToLog.contains(event);
    }

    public boolean isLogging() {
        return logging;
    }

    public void setLogging(boolean logging) {
        this.logging = logging;
    }

    /**
     * Logs a message for the given event type, if that type is enabled. The message is an SLF4J format string and is
     * only formatted when written.
     */
    public void log(String event, String format, Object... args) {
        if (isEventActive(event) && logger.isInfoEnabled()) {
            logger.info("[" + event + "] " + format, args);
        }
    }

    /**
     * Writes the message whatever event types are enabled.
     */
    public void forceLogMessage(String message) {
        logger.info(message);
    }

    /**
     * Writes a warning whatever event types are enabled.
     */
    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }
}
