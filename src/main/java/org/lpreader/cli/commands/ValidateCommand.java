package org.lpreader.cli.commands;

import org.lpreader.LpReader;
import org.lpreader.api.LpReadException;
import org.lpreader.cli.CommandLineInterface;
import org.lpreader.model.Model;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Checks that an LP file can be read.")
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the LP file.")
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            Model model = new LpReader(parent.getReaderOptions()).read(file.toPath());
            spec.commandLine().getOut().printf("OK %d variables, %d constraints%n",
                    model.variableCount(), model.constraintCount());
            spec.commandLine().getOut().flush();
            return 0;
        } catch (LpReadException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }
}
