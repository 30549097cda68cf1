package benchmark;

import application.SearchConfiguration;
import application.SearchEngineFactory;
import domain.model.NumericDomain;
import domain.model.SearchOutcome;
import domain.observer.SearchObserver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Benchmark comparing the two frontier realizations on the same problems.
 *
 * <p>For each problem every strategy runs a few warmup searches, then the measured ones.
 * The reported time is the median of the measured runs. Both strategies must prove the
 * same term count; a mismatch is printed as a correctness failure.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * java -cp target/classes benchmark.FrontierStrategyBenchmark
 * }</pre>
 *
 * <h3>Output Format</h3>
 * <pre>
 * ========================================
 * Frontier Strategy Comparison Benchmark
 * ========================================
 *
 * Problem: 2018 from [42, 777] (INTEGER, max 1000000)
 * +-----------------+-------+------------+-----------+------------+
 * | Strategy        | Terms | Median (ms)| Settled   | Stale skip |
 * +-----------------+-------+------------+-----------+------------+
 * | INDEXED_HEAP    |     9 |       1234 |    123456 |      45678 |
 * | LEVEL_BUCKET    |     9 |       1456 |    123456 |          0 |
 * +-----------------+-------+------------+-----------+------------+
 *   ✓ Term counts identical
 * </pre>
 */
public class FrontierStrategyBenchmark {

    private static final int WARMUP_ITERATIONS = 1;
    private static final int MEASURED_ITERATIONS = 3;

    private static final String BORDER =
        "+-----------------+-------+------------+-----------+------------+";

    /**
     * One benchmark problem.
     */
    static class Problem {
        final double goal;
        final List<Double> seeds;
        final NumericDomain domain;
        final double maxMagnitude;

        Problem(double goal, List<Double> seeds, NumericDomain domain, double maxMagnitude) {
            this.goal = goal;
            this.seeds = seeds;
            this.domain = domain;
            this.maxMagnitude = maxMagnitude;
        }

        SearchConfiguration toConfiguration(SearchConfiguration.FrontierStrategy strategy) {
            return new SearchConfiguration.Builder()
                .setGoal(goal)
                .setSeeds(seeds)
                .setNumericDomain(domain)
                .setMaxMagnitude(maxMagnitude)
                .setFrontierStrategy(strategy)
                .build();
        }

        @Override
        public String toString() {
            List<String> seedText = new ArrayList<>();
            for (double seed : seeds) {
                seedText.add(domain.format(seed));
            }
            return domain.format(goal) + " from " + seedText
                + " (" + domain + ", max " + domain.format(maxMagnitude) + ")";
        }
    }

    /**
     * Measurements for one strategy on one problem.
     */
    static class BenchmarkResult {
        SearchConfiguration.FrontierStrategy strategy;
        int termCount;
        long medianMs;
        int settled;
        long staleSkipped;
    }

    public static void main(String[] args) {
        List<Problem> problems = Arrays.asList(
            new Problem(2018, Arrays.asList(42.0, 777.0), NumericDomain.INTEGER, 1e6),
            new Problem(1000, Arrays.asList(7.0), NumericDomain.INTEGER, 1e6),
            new Problem(0.375, Arrays.asList(2.0, 3.0), NumericDomain.REAL, 1e6));

        System.out.println("========================================");
        System.out.println("Frontier Strategy Comparison Benchmark");
        System.out.println("========================================");
        System.out.printf("Warmup iterations = %d, measured iterations = %d%n",
            WARMUP_ITERATIONS, MEASURED_ITERATIONS);

        for (Problem problem : problems) {
            System.out.println();
            System.out.println("Problem: " + problem);

            List<BenchmarkResult> results = new ArrayList<>();
            for (SearchConfiguration.FrontierStrategy strategy : SearchConfiguration.FrontierStrategy.values()) {
                results.add(benchmark(problem, strategy));
            }
            printResults(results);
        }
    }

    private static BenchmarkResult benchmark(Problem problem, SearchConfiguration.FrontierStrategy strategy) {
        SearchConfiguration config = problem.toConfiguration(strategy);

        for (int i = 0; i < WARMUP_ITERATIONS; i++) {
            runOnce(config);
        }

        long[] times = new long[MEASURED_ITERATIONS];
        SearchOutcome last = null;
        for (int i = 0; i < MEASURED_ITERATIONS; i++) {
            long start = System.nanoTime();
            last = runOnce(config);
            times[i] = (System.nanoTime() - start) / 1_000_000;
        }
        Arrays.sort(times);

        BenchmarkResult result = new BenchmarkResult();
        result.strategy = strategy;
        result.termCount = last.getTermCount();
        result.medianMs = times[MEASURED_ITERATIONS / 2];
        result.settled = last.getStatistics().getSettledCount();
        result.staleSkipped = last.getStatistics().getStaleSkipped();
        return result;
    }

    private static SearchOutcome runOnce(SearchConfiguration config) {
        return SearchEngineFactory.createSearchEngine(config, SearchObserver.NONE).search();
    }

    private static void printResults(List<BenchmarkResult> results) {
        System.out.println(BORDER);
        System.out.println("| Strategy        | Terms | Median (ms)| Settled   | Stale skip |");
        System.out.println(BORDER);
        for (BenchmarkResult r : results) {
            System.out.printf(Locale.ROOT, "| %-15s | %5d | %10d | %9d | %10d |%n",
                r.strategy, r.termCount, r.medianMs, r.settled, r.staleSkipped);
        }
        System.out.println(BORDER);

        boolean identical = true;
        for (BenchmarkResult r : results) {
            if (r.termCount != results.get(0).termCount) {
                identical = false;
            }
        }
        System.out.println(identical
            ? "  ✓ Term counts identical"
            : "  ✗ Term counts DIFFER between strategies");
    }
}
