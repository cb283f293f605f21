package org.seatplan.cli.commands;

import org.seatplan.problem.ProblemLoader;
import org.seatplan.problem.ProblemValidationException;
import org.seatplan.problem.SeatingProblem;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Checks a problem file and prints its statistics.")
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, defaultValue = "input.json", description = "The problem file (default: ${DEFAULT-VALUE}).")
    private File file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final SeatingProblem problem;
        try {
            problem = ProblemLoader.loadFromFile(file.toPath());
        } catch (ProblemValidationException e) {
            spec.commandLine().getErr().println("Invalid problem: " + e.getMessage());
            return 1;
        }

        out.println("Problem '" + file + "' is valid.");
        out.printf("  People:          %d%n", problem.getPeopleCount());
        out.printf("  Tables:          %d%n", problem.getTableCapacities().size());
        out.printf("  Seats:           %d%n", problem.getTotalSeats());
        out.printf("  Preferences:     %d%n", problem.getPreferenceCount());
        out.printf("  Companion pairs: %d%n", problem.getCompanions().size());
        out.flush();
        return 0;
    }
}
