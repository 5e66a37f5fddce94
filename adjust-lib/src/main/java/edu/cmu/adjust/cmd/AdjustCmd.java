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

package edu.cmu.adjust.cmd;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import edu.cmu.adjust.graph.DotGraphReader;
import edu.cmu.adjust.graph.Graph;
import edu.cmu.adjust.graph.GraphUtils;
import edu.cmu.adjust.graph.Node;
import edu.cmu.adjust.search.*;
import edu.cmu.adjust.util.AdjustLogger;
import edu.cmu.adjust.util.JsonUtils;
import edu.cmu.adjust.util.Parameters;
import edu.cmu.adjust.util.RandomUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.*;

/**
 * Command-line front end. Reads a causal DAG from a DOT or JSON file and prints, as JSON, one of
 * <ul>
 * <li>the minimal adjustment sets for --treatments and --outcomes (--direct for the direct effect),</li>
 * <li>whether --covariates is a minimal adjustment set for them, or</li>
 * <li>the conditional independencies the DAG implies (--independencies).</li>
 * </ul>
 * Example: {@code --graph dag.dot --treatments X1,X2 --outcomes Y}
 *
 * @author jdramsey
 */
public final class AdjustCmd {
    private String graphFileName;
    private List<String> treatmentNames = new ArrayList<>();
    private List<String> outcomeNames = new ArrayList<>();
    private List<String> covariateNames = null;
    private boolean direct = false;
    private boolean independencies = false;
    private final Parameters parameters = new Parameters();

    private final PrintStream out;
    private final PrintStream err;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public AdjustCmd(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] argv) {
        int status = new AdjustCmd(System.out, System.err).run(argv);

        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the exit status: 0 on success, 1 on bad arguments or input, 2 on a failed search.
     */
    public int run(String[] argv) {
        Graph graph;

        try {
            readArguments(argv);
            graph = loadGraph();

            if (parameters.getBoolean(Parameters.VERBOSE)) {
                AdjustLogger.getInstance().forceLogMessage("Read " + graph.getNumNodes() + " nodes and "
                        + graph.getNumEdges() + " edges from " + graphFileName);
            }
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            err.println(usage());
            AdjustLogger.getInstance().reset();
            return 1;
        }

        try {
            if (independencies) {
                runIndependencies(graph);
            } else if (covariateNames != null) {
                runMinimality(graph);
            } else {
                runAdjustmentSets(graph);
            }
        } catch (InvalidAdjustmentSetException e) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("valid", false);
            result.put("reason", e.getResult().getReason().name());
            result.put("message", e.getResult().toString());
            out.println(gson.toJson(result));
            return 2;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        } finally {
            AdjustLogger.getInstance().reset();
        }

        return 0;
    }

    //==============================PRIVATE METHODS=========================//

    private void readArguments(String[] argv) {
        Deque<String> args = new ArrayDeque<>(Arrays.asList(argv));

        while (!args.isEmpty()) {
            String arg = args.removeFirst();

            switch (arg) {
                case "--graph":
                    graphFileName = value(arg, args);
                    break;
                case "--treatments":
                    treatmentNames = names(value(arg, args));
                    break;
                case "--outcomes":
                    outcomeNames = names(value(arg, args));
                    break;
                case "--covariates":
                    covariateNames = names(value(arg, args));
                    break;
                case "--direct":
                    direct = true;
                    break;
                case "--independencies":
                    independencies = true;
                    break;
                case "--heuristic":
                    String heuristic = value(arg, args);
                    SearchHeuristic.fromName(heuristic);
                    parameters.set(Parameters.SEARCH_HEURISTIC, heuristic);
                    break;
                case "--seed":
                    parameters.set(Parameters.SEED, value(arg, args));
                    parameters.set(Parameters.SEPARATOR_BRANCHING, "random");
                    RandomUtil.getInstance().setSeed(parameters.getLong(Parameters.SEED));
                    break;
                case "--verbose":
                    parameters.set(Parameters.VERBOSE, true);
                    break;
                default:
                    throw new IllegalArgumentException("Unrecognized argument: " + arg);
            }
        }

        if (graphFileName == null) {
            throw new IllegalArgumentException("A graph file must be given with --graph.");
        }

        if (!independencies && (treatmentNames.isEmpty() || outcomeNames.isEmpty())) {
            throw new IllegalArgumentException("--treatments and --outcomes are required.");
        }

        if (parameters.getBoolean(Parameters.VERBOSE)) {
            AdjustLogger.getInstance().setEventsToLog(AdjustLogger.ALL_EVENTS.toArray(new String[0]));
        }
    }

    private Graph loadGraph() throws IOException {
        String text = new String(Files.readAllBytes(Paths.get(graphFileName)), StandardCharsets.UTF_8);

        if (graphFileName.toLowerCase().endsWith(".json")) {
            return JsonUtils.parseJSONObjectToGraph(text);
        }

        return DotGraphReader.read(text);
    }

    private void runAdjustmentSets(Graph graph) {
        List<Node> treatments = GraphUtils.getNodes(graph, treatmentNames);
        List<Node> outcomes = GraphUtils.getNodes(graph, outcomeNames);
        AdjustmentSets search = new AdjustmentSets(graph, parameters);

        List<Set<Node>> sets = direct
                ? search.directEffectAdjustmentSets(treatments, outcomes)
                : search.enumerateMinimalAdjustmentSets(treatments, outcomes);

        List<List<String>> names = new ArrayList<>();

        for (Set<Node> set : sets) {
            names.add(sortedNames(set));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("treatments", treatmentNames);
        result.put("outcomes", outcomeNames);
        result.put("effect", direct ? "direct" : "total");
        result.put("adjustmentSets", names);
        out.println(gson.toJson(result));
    }

    private void runMinimality(Graph graph) {
        List<Node> treatments = GraphUtils.getNodes(graph, treatmentNames);
        List<Node> outcomes = GraphUtils.getNodes(graph, outcomeNames);
        List<Node> covariates = GraphUtils.getNodes(graph, covariateNames);

        Node redundant = new AdjustmentSets(graph, parameters).getRedundantCovariate(treatments, outcomes, covariates);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("valid", true);
        result.put("minimal", redundant == null);

        if (redundant != null) {
            result.put("redundant", redundant.getName());
        }

        out.println(gson.toJson(result));
    }

    private void runIndependencies(Graph graph) {
        List<ConditionalIndependence> facts = new IndependenceSearch(graph, parameters).search();
        List<String> lines = new ArrayList<>();

        for (ConditionalIndependence fact : facts) {
            lines.add(fact.toString());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("heuristic", parameters.getString(Parameters.SEARCH_HEURISTIC));
        result.put("independencies", lines);
        out.println(gson.toJson(result));
    }

    private static String value(String flag, Deque<String> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(flag + " needs a value.");
        }

        return args.removeFirst();
    }

    private static List<String> names(String list) {
        List<String> names = new ArrayList<>();

        for (String name : list.split(",")) {
            if (!name.trim().isEmpty()) {
                names.add(name.trim());
            }
        }

        return names;
    }

    private static List<String> sortedNames(Set<Node> nodes) {
        List<String> names = new ArrayList<>();

        for (Node node : nodes) {
            names.add(node.getName());
        }

        Collections.sort(names);
        return names;
    }

    private static String usage() {
        return "Usage: --graph <file.dot|file.json> (--treatments a,b --outcomes y [--direct] [--covariates z1,z2]"
                + " | --independencies [--heuristic minimal|min_direct|maximal|all]) [--seed n] [--verbose]";
    }
}
