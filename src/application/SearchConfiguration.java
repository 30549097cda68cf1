package application;

import domain.model.NumericDomain;
import domain.model.Operator;
import infrastructure.util.NumericalConstants;
import infrastructure.util.ValidationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable value object encapsulating all user-facing search parameters.
 *
 * <p>Constructed exclusively via the nested {@link Builder}, which validates each
 * parameter before allowing {@link Builder#build()} to succeed.
 *
 * <h3>Key parameters</h3>
 * <ul>
 *   <li><b>seeds</b>: leaf values the expression may use, any number of times.</li>
 *   <li><b>goal</b>: the value the expression must evaluate to.</li>
 *   <li><b>minMagnitude / maxMagnitude</b>: candidates with {@code |v|} outside
 *       {@code [min, max)} are pruned.</li>
 *   <li><b>numericDomain</b>: INTEGER (exact division only) or REAL (tolerant goal match).</li>
 *   <li><b>frontierStrategy</b>: which open-set realization drives extraction.</li>
 * </ul>
 *
 * <p>All fields are accessed through read-only getters. The class is {@code final} and the
 * builder copies every collection, so a configuration can be reused for several runs.
 */
public final class SearchConfiguration {

    /**
     * Open-set realizations. Both satisfy the same contract and yield the same term count.
     */
    public enum FrontierStrategy {
        /** Cost-ordered heap with lazy skipping of superseded records (default). */
        INDEXED_HEAP,
        /** Cost-level cache rebuilt by a forward-moving scan of the live entries. */
        LEVEL_BUCKET
    }

    private final List<Double> seeds;
    private final double goal;
    private final NumericDomain numericDomain;
    private final double goalTolerance;
    private final double minMagnitude;
    private final double maxMagnitude;
    private final Set<Operator> operators;
    private final FrontierStrategy frontierStrategy;
    private final int initialTermBound;
    private final boolean debugMode;

    private SearchConfiguration(Builder builder, double minMagnitude, int initialTermBound) {
        this.seeds = Collections.unmodifiableList(new ArrayList<>(builder.seeds));
        this.goal = builder.goal;
        this.numericDomain = builder.numericDomain;
        this.goalTolerance = builder.numericDomain == NumericDomain.INTEGER ? 0.0 : builder.goalTolerance;
        this.minMagnitude = minMagnitude;
        this.maxMagnitude = builder.maxMagnitude;
        this.operators = Collections.unmodifiableSet(EnumSet.copyOf(builder.operators));
        this.frontierStrategy = builder.frontierStrategy;
        this.initialTermBound = initialTermBound;
        this.debugMode = builder.debugMode;
    }

    public List<Double> getSeeds() { return seeds; }
    public double getGoal() { return goal; }
    public NumericDomain getNumericDomain() { return numericDomain; }
    public double getGoalTolerance() { return goalTolerance; }
    public double getMinMagnitude() { return minMagnitude; }
    public double getMaxMagnitude() { return maxMagnitude; }
    public Set<Operator> getOperators() { return operators; }
    public FrontierStrategy getFrontierStrategy() { return frontierStrategy; }
    public int getInitialTermBound() { return initialTermBound; }
    public boolean isDebugMode() { return debugMode; }

    @Override
    public String toString() {
        return "SearchConfiguration{seeds=" + seeds
            + ", goal=" + goal
            + ", domain=" + numericDomain
            + ", band=[" + minMagnitude + ", " + maxMagnitude + ")"
            + ", tolerance=" + goalTolerance
            + ", operators=" + operators
            + ", frontier=" + frontierStrategy
            + ", initialTermBound=" + initialTermBound + "}";
    }

    /**
     * Fluent builder for {@link SearchConfiguration}.
     *
     * <p>Defaults:
     * <ul>
     *   <li>{@code numericDomain}: {@link NumericDomain#INTEGER}</li>
     *   <li>{@code minMagnitude}: 0 in INTEGER mode,
     *       {@link NumericalConstants#DEFAULT_REAL_MIN_MAGNITUDE} in REAL mode</li>
     *   <li>{@code maxMagnitude}: {@link NumericalConstants#DEFAULT_MAX_MAGNITUDE}</li>
     *   <li>{@code goalTolerance}: {@link NumericalConstants#DEFAULT_GOAL_TOLERANCE} (REAL only)</li>
     *   <li>{@code operators}: all four</li>
     *   <li>{@code frontierStrategy}: from {@link SearchEngineFactory#configuredFrontierStrategy()}</li>
     *   <li>{@code initialTermBound}: {@link OrchestratorConfiguration#defaultInitialTermBound(double)}</li>
     * </ul>
     */
    public static class Builder {
        private final List<Double> seeds = new ArrayList<>();
        private double goal;
        private boolean goalSet = false;
        private NumericDomain numericDomain = NumericDomain.INTEGER;
        private double goalTolerance = NumericalConstants.DEFAULT_GOAL_TOLERANCE;
        private Double minMagnitude = null;  // Default depends on the domain
        private double maxMagnitude = NumericalConstants.DEFAULT_MAX_MAGNITUDE;
        private Set<Operator> operators = EnumSet.of(Operator.ADD, Operator.SUB, Operator.MUL, Operator.DIV);
        private FrontierStrategy frontierStrategy = SearchEngineFactory.configuredFrontierStrategy();
        private Integer initialTermBound = null;  // Default depends on the goal
        private boolean debugMode = false;

        public Builder addSeed(double seed) {
            ValidationUtils.validateFinite(seed, "seed");
            this.seeds.add(seed);
            return this;
        }

        public Builder setSeeds(List<Double> seeds) {
            ValidationUtils.validateNotEmpty(seeds, "seeds");
            this.seeds.clear();
            for (Double seed : seeds) {
                if (seed == null) throw new IllegalArgumentException("seeds must not contain null");
                addSeed(seed);
            }
            return this;
        }

        public Builder setGoal(double goal) {
            ValidationUtils.validateFinite(goal, "goal");
            this.goal = goal == 0.0 ? 0.0 : goal;
            this.goalSet = true;
            return this;
        }

        public Builder setNumericDomain(NumericDomain domain) {
            if (domain == null) throw new IllegalArgumentException("numericDomain cannot be null");
            this.numericDomain = domain;
            return this;
        }

        /**
         * Sets the REAL-mode goal matching tolerance. Ignored in INTEGER mode.
         *
         * @param tolerance maximum {@code |value - goal|} treated as a match
         * @return this builder
         */
        public Builder setGoalTolerance(double tolerance) {
            ValidationUtils.validateNonNegative(tolerance, "goalTolerance");
            this.goalTolerance = tolerance;
            return this;
        }

        public Builder setMinMagnitude(double minMagnitude) {
            ValidationUtils.validateNonNegative(minMagnitude, "minMagnitude");
            this.minMagnitude = minMagnitude;
            return this;
        }

        /**
         * Sets the exclusive upper bound on candidate magnitude.
         *
         * @param maxMagnitude candidates with {@code |v| >= maxMagnitude} are pruned
         * @return this builder
         */
        public Builder setMaxMagnitude(double maxMagnitude) {
            ValidationUtils.validateNonNegative(maxMagnitude, "maxMagnitude");
            this.maxMagnitude = maxMagnitude;
            return this;
        }

        public Builder setOperators(Set<Operator> operators) {
            ValidationUtils.validateNotEmpty(operators, "operators");
            if (operators.contains(Operator.NONE)) {
                throw new IllegalArgumentException("operators must not contain NONE");
            }
            this.operators = EnumSet.copyOf(operators);
            return this;
        }

        public Builder setFrontierStrategy(FrontierStrategy strategy) {
            if (strategy == null) throw new IllegalArgumentException("frontierStrategy cannot be null");
            this.frontierStrategy = strategy;
            return this;
        }

        /**
         * Sets the loose starting bound on the goal's term count.
         *
         * <p>Candidates must cost strictly less than the bound; it tightens the first time
         * the goal is found. A goal needing this many terms or more is reported unreachable.
         *
         * @param bound starting bound, at least {@link OrchestratorConfiguration#MIN_INITIAL_TERM_BOUND}
         * @return this builder
         */
        public Builder setInitialTermBound(int bound) {
            ValidationUtils.validateAtLeast(bound, OrchestratorConfiguration.MIN_INITIAL_TERM_BOUND,
                "initialTermBound");
            this.initialTermBound = bound;
            return this;
        }

        public Builder setDebugMode(boolean debug) {
            this.debugMode = debug;
            return this;
        }

        public SearchConfiguration build() {
            if (seeds.isEmpty()) {
                throw new IllegalArgumentException("At least one seed is required");
            }
            if (!goalSet) {
                throw new IllegalArgumentException("goal must be set");
            }

            double min = minMagnitude != null ? minMagnitude
                : (numericDomain == NumericDomain.REAL ? NumericalConstants.DEFAULT_REAL_MIN_MAGNITUDE : 0.0);
            if (min >= maxMagnitude) {
                throw new IllegalArgumentException(
                    "minMagnitude must be below maxMagnitude, got [" + min + ", " + maxMagnitude + ")");
            }

            if (numericDomain == NumericDomain.INTEGER) {
                ValidationUtils.validateIntegral(goal, "goal");
                for (double seed : seeds) {
                    ValidationUtils.validateIntegral(seed, "seed");
                    // 2^53 itself is where distinct inputs start to collapse onto one double
                    if (Math.abs(seed) >= NumericalConstants.MAX_EXACT_INTEGER) {
                        throw new IllegalArgumentException(
                            "seed must lie below 2^53 in magnitude in INTEGER mode, got: " + seed);
                    }
                }
                if (maxMagnitude > NumericalConstants.MAX_EXACT_INTEGER) {
                    throw new IllegalArgumentException(
                        "maxMagnitude must not exceed 2^53 in INTEGER mode, got: " + maxMagnitude);
                }
            }

            double goalMagnitude = Math.abs(goal);
            if (goalMagnitude < min || goalMagnitude >= maxMagnitude) {
                throw new IllegalArgumentException(
                    "goal " + goal + " lies outside the magnitude band [" + min + ", " + maxMagnitude + ")");
            }

            int bound = initialTermBound != null ? initialTermBound
                : OrchestratorConfiguration.defaultInitialTermBound(goal);

            return new SearchConfiguration(this, min, bound);
        }
    }
}
