package org.seatplan.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.seatplan.cli.CommandLineInterface;
import org.seatplan.cli.rendering.OutputFormat;
import org.seatplan.cli.rendering.SolutionRenderer;
import org.seatplan.problem.ProblemLoader;
import org.seatplan.problem.ProblemValidationException;
import org.seatplan.problem.SeatingProblem;
import org.seatplan.runtime.anneal.AnnealingException;
import org.seatplan.runtime.anneal.AnnealingParameters;
import org.seatplan.runtime.anneal.AnnealingResult;
import org.seatplan.runtime.anneal.IRoundListener;
import org.seatplan.runtime.anneal.ReplicaExchangeAnnealer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "solve", description = "Seats the people of a problem file and prints the seating plan.")
public class SolveCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolveCommand.class);
    private static final String ANNEALING = AnnealingParameters.CONFIG_PATH + ".";

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-f", "--file"}, defaultValue = "input.json", description = "The problem file (default: ${DEFAULT-VALUE}).")
    private File file;

    @Option(names = {"-m", "--mode"}, description = "Objective: hybrid, sum or count.")
    private String mode;

    @Option(names = {"-b", "--base-temperature"}, description = "Temperature of the coldest annealer in the first round; annealer i runs at base * 2^i.")
    private Double baseTemperature;

    @Option(names = {"-e", "--final-temperature"}, description = "The schedule stops once the base temperature reaches this value.")
    private Double finalTemperature;

    @Option(names = {"-c", "--cooling-rate"}, description = "Factor applied to the base temperature after every round, between 0 and 1.")
    private Double coolingRate;

    @Option(names = {"-i", "--iterations"}, description = "Iterations per annealer per round.")
    private Integer iterations;

    @Option(names = {"-s", "--swaps"}, description = "Seat swaps per neighbouring candidate.")
    private Integer swaps;

    @Option(names = {"-a", "--annealers"}, description = "Number of concurrent annealers.")
    private Integer annealers;

    @Option(names = "--seed", description = "Master seed for a reproducible run.")
    private Long seed;

    @Option(names = "--format", defaultValue = "TEXT", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format;

    @Option(names = "--progress", description = "Report the best score of every round on stderr.")
    private boolean progress;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final AnnealingParameters parameters;
        final SeatingProblem problem;
        try {
            parameters = AnnealingParameters.fromConfig(withOverrides(parent.getConfig()));
            problem = ProblemLoader.loadFromFile(file.toPath());
        } catch (ProblemValidationException | IllegalArgumentException | ConfigException e) {
            LOGGER.error("Cannot start annealing: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        final AnnealingResult result;
        try {
            final ReplicaExchangeAnnealer annealer = new ReplicaExchangeAnnealer(problem, parameters);
            final IRoundListener listener = progress
                    ? snapshot -> err.printf("Round %d: base temperature %.6g, best score %s%n",
                            snapshot.round(), snapshot.baseTemperature(), snapshot.coldestScore())
                    : IRoundListener.NONE;
            result = annealer.anneal(listener);
        } catch (ProblemValidationException e) {
            LOGGER.error("Cannot start annealing: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (AnnealingException e) {
            LOGGER.error("Annealing failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.println(new SolutionRenderer(problem.getCompanions()).render(result, format));
        out.flush();
        return 0;
    }

    /**
     * Layers the options given on the command line over the configured annealing settings.
     */
    Config withOverrides(Config config) {
        final Map<String, Object> overrides = new HashMap<>();
        if (mode != null) overrides.put(ANNEALING + "objective", mode);
        if (baseTemperature != null) overrides.put(ANNEALING + "base-temperature", baseTemperature);
        if (finalTemperature != null) overrides.put(ANNEALING + "final-temperature", finalTemperature);
        if (coolingRate != null) overrides.put(ANNEALING + "cooling-rate", coolingRate);
        if (iterations != null) overrides.put(ANNEALING + "iterations", iterations);
        if (swaps != null) overrides.put(ANNEALING + "swaps", swaps);
        if (annealers != null) overrides.put(ANNEALING + "annealers", annealers);
        if (seed != null) overrides.put(ANNEALING + "seed", seed);
        return ConfigFactory.parseMap(overrides).withFallback(config);
    }
}
