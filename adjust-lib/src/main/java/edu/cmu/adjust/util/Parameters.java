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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Stores named options for the searches. Options that have not been set fall back to their documented defaults:
 * <ul>
 * <li>searchHeuristic: "minimal". One of minimal, min_direct, maximal, all.</li>
 * <li>separatorBranching: "lowest_first". One of lowest_first, random.</li>
 * <li>seed: -1, meaning the shared {@link RandomUtil} stream is used unseeded.</li>
 * <li>verbose: false. If true every logger event type is written.</li>
 * </ul>
 *
 * @author jdramsey
 */
public class Parameters {

    public static final String SEARCH_HEURISTIC = "searchHeuristic";
    public static final String SEPARATOR_BRANCHING = "separatorBranching";
    public static final String SEED = "seed";
    public static final String VERBOSE = "verbose";

    private static final Map<String, Object> DEFAULTS;

    static {
        Map<String, Object> defaults = new HashMap<>();
        defaults.put(SEARCH_HEURISTIC, "minimal");
        defaults.put(SEPARATOR_BRANCHING, "lowest_first");
        defaults.put(SEED, -1L);
        defaults.put(VERBOSE, false);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Object> parameters = new LinkedHashMap<>();

    public Parameters() {
    }

    public Parameters(Parameters parameters) {
        this.parameters.putAll(parameters.parameters);
    }

    public void set(String name, Object value) {
        if (value == null) {
            throw new NullPointerException("Value for " + name + " must not be null.");
        }

        parameters.put(name, value);
    }

    public Object get(String name) {
        Object value = parameters.get(name);

        if (value == null) {
            value = DEFAULTS.get(name);
        }

        if (value == null) {
            throw new IllegalArgumentException("No value or default for parameter '" + name + "'.");
        }

        return value;
    }

    public String getString(String name) {
        return get(name).toString();
    }

    public int getInt(String name) {
        Object value = get(name);

        if (value instanceof Number) {
            return ((Number) value).intValue();
        }

        return parse(name, value, Integer::parseInt);
    }

    public long getLong(String name) {
        Object value = get(name);

        if (value instanceof Number) {
            return ((Number) value).longValue();
        }

        return parse(name, value, Long::parseLong);
    }

    public boolean getBoolean(String name) {
        Object value = get(name);

        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        String text = value.toString();

        if ("true".equalsIgnoreCase(text)) return true;
        if ("false".equalsIgnoreCase(text)) return false;

        throw new IllegalArgumentException("Parameter '" + name + "' is not a boolean: " + value);
    }

    public boolean isSet(String name) {
        return parameters.containsKey(name);
    }

    public Set<String> getParametersNames() {
        return Collections.unmodifiableSet(parameters.keySet());
    }

    @Override
    public String toString() {
        return parameters.toString();
    }

    private interface Parser<T> {
        T parse(String text);
    }

    private static <T> T parse(String name, Object value, Parser<T> parser) {
        try {
            return parser.parse(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not a number: " + value, e);
        }
    }
}
