package org.seatplan.runtime.anneal;

import org.seatplan.problem.ProblemValidationException;
import org.seatplan.problem.SeatingProblem;
import org.seatplan.runtime.internal.services.SeededRandomProvider;
import org.seatplan.runtime.model.Assignment;
import org.seatplan.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Anneals a seating problem with a ladder of chains at geometrically increasing temperatures
 * (parallel tempering).
 *
 * <p>Every cooling round runs one {@link ChainIterator} invocation per level concurrently and
 * waits for all of them. A single adjacent exchange pass then walks the ladder from the hottest
 * level down and swaps two neighbouring levels whenever the hotter one holds the better score.
 * Finally the base temperature is multiplied by the cooling rate. The run ends once the base
 * temperature has dropped to the final temperature, and the coldest level's assignment is the
 * result.</p>
 *
 * <p>Chain states move between the coordinator and the tasks by hand-off only; each level draws
 * from its own random stream derived from the master seed, so a seeded run is reproducible
 * regardless of thread scheduling.</p>
 */
public final class ReplicaExchangeAnnealer {

    private static final Logger LOG = LoggerFactory.getLogger(ReplicaExchangeAnnealer.class);

    private final SeatingProblem problem;
    private final AnnealingParameters parameters;
    private final ChainIterator chainIterator;

    /**
     * @param problem    the problem to solve, validated here before any work starts
     * @param parameters the run configuration
     * @throws ProblemValidationException if the problem is inconsistent
     */
    public ReplicaExchangeAnnealer(SeatingProblem problem, AnnealingParameters parameters) throws ProblemValidationException {
        problem.validate();
        this.problem = problem;
        this.parameters = parameters;
        this.chainIterator = new ChainIterator(parameters.objective(), problem.getCompanions(),
                parameters.internalIterations(), parameters.swapCount());
    }

    public AnnealingResult anneal() {
        return anneal(IRoundListener.NONE);
    }

    /**
     * Runs the full cooling schedule.
     *
     * @param listener notified after every round
     * @return the coldest level's final state
     * @throws AnnealingException if a chain task fails or the calling thread is interrupted
     */
    public AnnealingResult anneal(IRoundListener listener) {
        final long seed = parameters.seed() != null ? parameters.seed() : System.nanoTime() ^ System.currentTimeMillis();
        final IRandomProvider master = new SeededRandomProvider(seed);
        final int ladderSize = parameters.ladderSize();

        LOG.info("Annealing {} people at {} tables with {} chains (objective={}, seed={})",
                problem.getPeopleCount(), problem.getTableCapacities().size(), ladderSize,
                parameters.objective().getConfigName(), seed);

        Assignment initial = Assignment.random(problem.getPeople(), problem.getTableCapacities(),
                master.deriveFor("initialisation", 0));
        double initialScore = parameters.objective().score(initial, problem.getCompanions());

        ChainState[] ladder = new ChainState[ladderSize];
        IRandomProvider[] streams = new IRandomProvider[ladderSize];
        for (int level = 0; level < ladderSize; level++) {
            ladder[level] = new ChainState(initial.copy(), initialScore);
            streams[level] = master.deriveFor("chain", level);
        }

        final long start = System.currentTimeMillis();
        double baseTemperature = parameters.baseTemperature();
        int round = 0;
        ExecutorService executor = Executors.newFixedThreadPool(poolSize(ladderSize), new ChainThreadFactory());
        try {
            while (baseTemperature > parameters.finalTemperature()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new AnnealingException("Annealing interrupted after round " + round, new InterruptedException());
                }
                round++;
                runRound(executor, ladder, streams, baseTemperature);
                exchange(ladder);

                RoundSnapshot snapshot = snapshot(round, baseTemperature, ladder);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Round {} at base temperature {}: scores {}", round, baseTemperature, snapshot.levelScores());
                }
                listener.onRoundCompleted(snapshot);

                baseTemperature *= parameters.coolingRate();
            }
        } finally {
            executor.shutdownNow();
        }

        ChainState coldest = ladder[0];
        LOG.info("Annealing finished after {} rounds in {} ms: score {} (initial {})",
                round, System.currentTimeMillis() - start, coldest.score(), initialScore);
        return new AnnealingResult(coldest.assignment(), coldest.score(), initialScore, round, seed);
    }

    /**
     * At most one thread per processor. Levels beyond the pool size queue up and still finish
     * before the round barrier.
     */
    static int poolSize(int ladderSize) {
        return Math.max(1, Math.min(ladderSize, Runtime.getRuntime().availableProcessors()));
    }

    private void runRound(ExecutorService executor, ChainState[] ladder, IRandomProvider[] streams, double baseTemperature) {
        List<Callable<ChainState>> tasks = new ArrayList<>(ladder.length);
        for (int level = 0; level < ladder.length; level++) {
            final ChainState state = ladder[level];
            final IRandomProvider stream = streams[level];
            final double temperature = AnnealingParameters.levelTemperature(baseTemperature, level);
            tasks.add(() -> chainIterator.iterate(state, temperature, stream));
        }

        final List<Future<ChainState>> results;
        try {
            results = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnnealingException("Annealing interrupted while waiting for chains", e);
        }

        for (int level = 0; level < ladder.length; level++) {
            try {
                ladder[level] = results.get(level).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnnealingException("Annealing interrupted while collecting chain " + level, e);
            } catch (ExecutionException e) {
                throw new AnnealingException("Chain " + level + " failed: " + e.getCause().getMessage(), e.getCause());
            }
        }
    }

    /**
     * One adjacent exchange pass from the hottest level to the coldest. Whenever a level scores
     * strictly better than the next colder one the two states trade places. This is a single
     * sweep, so the ladder is not necessarily sorted afterwards.
     *
     * @param ladder chain states, coldest first; reordered in place
     */
    static void exchange(ChainState[] ladder) {
        for (int level = ladder.length - 1; level > 0; level--) {
            if (ladder[level].score() > ladder[level - 1].score()) {
                ChainState colder = ladder[level - 1];
                ladder[level - 1] = ladder[level];
                ladder[level] = colder;
            }
        }
    }

    private static RoundSnapshot snapshot(int round, double baseTemperature, ChainState[] ladder) {
        Double[] scores = new Double[ladder.length];
        for (int level = 0; level < ladder.length; level++) {
            scores[level] = ladder[level].score();
        }
        return new RoundSnapshot(round, baseTemperature, Arrays.asList(scores));
    }

    private static final class ChainThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "annealer-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
