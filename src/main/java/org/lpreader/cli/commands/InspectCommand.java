package org.lpreader.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lpreader.LpReader;
import org.lpreader.api.LpReadException;
import org.lpreader.cli.CommandLineInterface;
import org.lpreader.config.ReaderOptions;
import org.lpreader.model.Constraint;
import org.lpreader.model.Expression;
import org.lpreader.model.LinearTerm;
import org.lpreader.model.Model;
import org.lpreader.model.QuadraticTerm;
import org.lpreader.model.SosEntry;
import org.lpreader.model.SpecialOrderedSet;
import org.lpreader.model.Variable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "inspect", description = "Reads an LP file and prints a JSON summary of the model.")
public class InspectCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the LP file.")
    private File file;

    @Option(names = "--codec", description = "Decompression codec: auto, none, gzip or zstd (default: from configuration).")
    private String codec;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ReaderOptions options = parent.getReaderOptions();
        if (codec != null) {
            options = options.withCodec(codec);
        }

        Model model;
        try {
            model = new LpReader(options).read(file.toPath());
        } catch (LpReadException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }

        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeSpecialFloatingPointValues()
                .serializeNulls()
                .create();
        PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(summarize(model)));
        out.flush();
        return 0;
    }

    /**
     * Builds a JSON-friendly view of a model in which variables are referred to by name.
     * @param model The model.
     * @return Nested maps and lists in a stable key order.
     */
    static Map<String, Object> summarize(Model model) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("sense", model.sense().name());
        root.put("variableCount", model.variableCount());
        root.put("constraintCount", model.constraintCount());
        root.put("objective", expression(model, model.objective()));

        List<Object> variables = new ArrayList<>();
        for (Variable variable : model.variables()) {
            Map<String, Object> v = new LinkedHashMap<>();
            v.put("name", variable.name());
            v.put("type", variable.type().name());
            v.put("lowerBound", variable.lowerBound());
            v.put("upperBound", variable.upperBound());
            variables.add(v);
        }
        root.put("variables", variables);

        List<Object> constraints = new ArrayList<>();
        for (Constraint constraint : model.constraints()) {
            Map<String, Object> c = expression(model, constraint.expression());
            c.put("lowerBound", constraint.lowerBound());
            c.put("upperBound", constraint.upperBound());
            constraints.add(c);
        }
        root.put("constraints", constraints);

        List<Object> sets = new ArrayList<>();
        for (SpecialOrderedSet set : model.specialOrderedSets()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("name", set.name());
            s.put("type", set.type());
            List<Object> entries = new ArrayList<>();
            for (SosEntry entry : set.entries()) {
                entries.add(Map.of("variable", model.variable(entry.variable()).name(), "weight", entry.weight()));
            }
            s.put("entries", entries);
            sets.add(s);
        }
        root.put("specialOrderedSets", sets);
        return root;
    }

    private static Map<String, Object> expression(Model model, Expression expression) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("name", expression.name());
        e.put("offset", expression.offset());
        List<Object> linear = new ArrayList<>();
        for (LinearTerm term : expression.linearTerms()) {
            linear.add(Map.of("coefficient", term.coefficient(), "variable", model.variable(term.variable()).name()));
        }
        e.put("linearTerms", linear);
        List<Object> quadratic = new ArrayList<>();
        for (QuadraticTerm term : expression.quadraticTerms()) {
            quadratic.add(Map.of(
                    "coefficient", term.coefficient(),
                    "variable1", model.variable(term.variable1()).name(),
                    "variable2", model.variable(term.variable2()).name()));
        }
        e.put("quadraticTerms", quadratic);
        return e;
    }
}
