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

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Shared source of random numbers. Seeding it makes every randomized choice in the library reproducible; searches
 * that need their own stream take a {@link RandomGenerator} from {@link #newGenerator()} instead.
 *
 * @author jdramsey
 */
public class RandomUtil {

    private static final RandomUtil INSTANCE = new RandomUtil();

    private RandomGenerator randomGenerator;

    private RandomUtil() {
        setSeed(System.nanoTime());
    }

    public static RandomUtil getInstance() {
        return INSTANCE;
    }

    public synchronized void setSeed(long seed) {
        this.randomGenerator = new MersenneTwister(seed);
    }

    /**
     * @return a new generator seeded from this one, for use by a single search.
     */
    public synchronized RandomGenerator newGenerator() {
        return new MersenneTwister(randomGenerator.nextLong());
    }

    /**
     * @return a new generator with the given seed.
     */
    public static RandomGenerator newGenerator(long seed) {
        return new MersenneTwister(seed);
    }
}
