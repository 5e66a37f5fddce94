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

import com.google.gson.Gson;
import edu.cmu.adjust.cmd.AdjustCmd;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

import static org.junit.Assert.*;

/**
 * Runs the command line front end on small graph files.
 *
 * @author jdramsey
 */
public class TestAdjustCmd {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private File dot;

    @Before
    public void setUp() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        dot = write("dag.dot", "digraph {\n"
                + "  X1 -> X2; X2 -> V; X2 -> D1; X2 -> D2;\n"
                + "  D1 -> Y; D1 -> D2; Y -> D3; Z -> X2; Z -> Y;\n"
                + "}\n");
    }

    private File write(String name, String text) throws IOException {
        File file = folder.newFile(name);
        Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private int run(String... args) {
        AdjustCmd cmd = new AdjustCmd(new PrintStream(out, true), new PrintStream(err, true));
        return cmd.run(args);
    }

    private Map<?, ?> output() {
        return new Gson().fromJson(new String(out.toByteArray(), StandardCharsets.UTF_8), Map.class);
    }

    @Test
    public void testAdjustmentSets() {
        assertEquals(0, run("--graph", dot.getPath(), "--treatments", "X1,X2", "--outcomes", "Y"));

        Map<?, ?> result = output();
        assertEquals("total", result.get("effect"));
        assertEquals(Collections.singletonList(Collections.singletonList("Z")), result.get("adjustmentSets"));
    }

    @Test
    public void testDirectEffectFromJson() throws IOException {
        File json = write("dag.json", "{\"edges\": [{\"from\": \"X\", \"to\": \"M\"},"
                + " {\"from\": \"M\", \"to\": \"Y\"}, {\"from\": \"X\", \"to\": \"Y\"}]}");

        assertEquals(0, run("--graph", json.getPath(), "--treatments", "X", "--outcomes", "Y", "--direct"));

        Map<?, ?> result = output();
        assertEquals("direct", result.get("effect"));
        assertEquals(Collections.singletonList(Collections.singletonList("M")), result.get("adjustmentSets"));
    }

    @Test
    public void testMinimality() {
        assertEquals(0, run("--graph", dot.getPath(), "--treatments", "X1,X2", "--outcomes", "Y",
                "--covariates", "Z,V"));

        Map<?, ?> result = output();
        assertEquals(Boolean.TRUE, result.get("valid"));
        assertEquals(Boolean.FALSE, result.get("minimal"));
        assertEquals("V", result.get("redundant"));
    }

    @Test
    public void testInvalidCovariates() {
        assertEquals(2, run("--graph", dot.getPath(), "--treatments", "X1,X2", "--outcomes", "Y",
                "--covariates", "D1"));

        Map<?, ?> result = output();
        assertEquals(Boolean.FALSE, result.get("valid"));
        assertEquals("DESCENDANT_OF_PROPER_CAUSAL_PATH", result.get("reason"));
    }

    @Test
    public void testIndependencies() throws IOException {
        File chain = write("chain.dot", "digraph { A -> B -> C }");

        assertEquals(0, run("--graph", chain.getPath(), "--independencies", "--heuristic", "all", "--seed", "3"));

        Map<?, ?> result = output();
        assertEquals("all", result.get("heuristic"));
        assertEquals(Collections.singletonList("A⫫C|{B}"), result.get("independencies"));
    }

    @Test
    public void testUnknownNode() {
        assertEquals(2, run("--graph", dot.getPath(), "--treatments", "Q", "--outcomes", "Y"));
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("Q"));
    }

    @Test
    public void testBadArguments() {
        assertEquals(1, run("--graph", dot.getPath(), "--treatments", "X1"));
        assertEquals(1, run("--graph", dot.getPath(), "--independencies", "--heuristic", "widest"));
        assertEquals(1, run("--graph", new File(folder.getRoot(), "missing.dot").getPath(), "--independencies"));
        assertEquals(0, out.size());
    }

    @Test
    public void testCyclicGraphFile() throws IOException {
        File cyclic = write("cyclic.dot", "digraph { A -> B; B -> A; }");

        assertEquals(1, run("--graph", cyclic.getPath(), "--independencies"));
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("cycle"));
    }
}
