package com.optionpricing.engine.domain.service.montecarlo;

import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.PathBundle;
import com.optionpricing.engine.exception.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for PathSimulator covering bundle shape, antithetic pairing, the odd path
 * count policy and reproducibility under a seeded generator.
 */
class PathSimulatorTest {

    private static final ModelParameters PARAMS = new ModelParameters(100, 100, 1, 0.05, 0.2, 0.01);

    private final PathSimulator simulator = new PathSimulator();

    private static double stepDrift(ModelParameters params, int numSteps) {
        double sigma = params.volatility();
        return (params.rate() - params.dividendYield() - 0.5 * sigma * sigma) * params.maturity() / numSteps;
    }

    private static double priceAt(PathBundle bundle, int step, int path) {
        return bundle.samplePaths(path + 1)[path][step];
    }

    @Nested
    @DisplayName("Bundle shape")
    class BundleShape {

        @Test
        @DisplayName("Holds numSteps + 1 rows with S0 in row 0 for every path")
        void initialRowIsSpot() {
            PathBundle bundle = simulator.simulate(PARAMS, 12, 8, false, new SplittableRandom(1));

            assertThat(bundle.getNumSteps()).isEqualTo(12);
            assertThat(bundle.getNumSimulations()).isEqualTo(8);
            assertThat(bundle.getRetainedPathCount()).isEqualTo(8);
            for (int i = 0; i < 8; i++) {
                assertThat(priceAt(bundle, 0, i)).isEqualTo(100.0);
                assertThat(priceAt(bundle, 12, i)).isEqualTo(bundle.terminalPrices()[i]);
            }
        }

        @Test
        @DisplayName("Keeps full trajectories only for the retained paths")
        void retainsLimitedPaths() {
            PathBundle bundle = simulator.simulate(PARAMS, 5, 100, false, 20, new SplittableRandom(2));

            assertThat(bundle.getRetainedPathCount()).isEqualTo(20);
            assertThat(bundle.terminalPrices()).hasSize(100);
            assertThat(bundle.samplePaths(50)).hasNumberOfRows(20);

            double[][] sample = bundle.samplePaths(20);
            assertThat(sample).hasNumberOfRows(20);
            assertThat(sample[3]).hasSize(6);
            assertThat(sample[3][0]).isEqualTo(100.0);
            assertThat(sample[3][5]).isEqualTo(bundle.terminalPrices()[3]);
        }

        @Test
        @DisplayName("Sample is capped at the number of simulated paths")
        void sampleCappedByPathCount() {
            PathBundle bundle = simulator.simulate(PARAMS, 3, 7, true, 20, new SplittableRandom(3));

            assertThat(bundle.samplePaths(20)).hasNumberOfRows(7);
        }

        @Test
        @DisplayName("Prices stay strictly positive")
        void pricesPositive() {
            PathBundle bundle = simulator.simulate(
                    new ModelParameters(50, 50, 2, 0.0, 1.5, 0.0), 50, 200, false, new SplittableRandom(4));

            for (double price : bundle.terminalPrices()) {
                assertThat(price).isPositive().isFinite();
            }
        }
    }

    @Nested
    @DisplayName("Log-price accumulation")
    class Accumulation {

        @Test
        @DisplayName("Zero draws give the deterministic drift path")
        void zeroShocks() {
            RandomGenerator zero = new ConstantGaussian(0.0);
            PathBundle bundle = simulator.simulate(PARAMS, 4, 2, false, zero);

            double drift = stepDrift(PARAMS, 4);
            for (int t = 0; t <= 4; t++) {
                assertThat(priceAt(bundle, t, 0)).isCloseTo(100 * Math.exp(t * drift), within(1e-10));
            }
        }

        @Test
        @DisplayName("Constant draws accumulate instead of restarting at each step")
        void cumulativeIncrements() {
            RandomGenerator one = new ConstantGaussian(1.0);
            PathBundle bundle = simulator.simulate(PARAMS, 4, 1, false, one);

            double drift = stepDrift(PARAMS, 4);
            double diffusion = 0.2 * Math.sqrt(0.25);
            assertThat(bundle.terminalPrices()[0]).isCloseTo(100 * Math.exp(4 * (drift + diffusion)), within(1e-9));
        }
    }

    @Nested
    @DisplayName("Antithetic pairing")
    class AntitheticPairing {

        @Test
        @DisplayName("Paths 2k and 2k+1 mirror each other's shocks at every step")
        void pairsMirror() {
            int steps = 10;
            PathBundle bundle = simulator.simulate(PARAMS, steps, 6, true, new SplittableRandom(11));

            double drift = stepDrift(PARAMS, steps);
            double logSpot = Math.log(100);
            for (int k = 0; k < 3; k++) {
                for (int t = 1; t <= steps; t++) {
                    double sum = Math.log(priceAt(bundle, t, 2 * k)) + Math.log(priceAt(bundle, t, 2 * k + 1));
                    assertThat(sum).isCloseTo(2 * (logSpot + t * drift), within(1e-10));
                }
            }
        }

        @Test
        @DisplayName("Even count draws half the normals of standard mode")
        void halvesTheDraws() {
            CountingGaussian antithetic = new CountingGaussian(5);
            CountingGaussian standard = new CountingGaussian(5);

            simulator.simulate(PARAMS, 3, 10, true, antithetic);
            simulator.simulate(PARAMS, 3, 10, false, standard);

            assertThat(antithetic.draws).isEqualTo(15);
            assertThat(standard.draws).isEqualTo(30);
        }

        @Test
        @DisplayName("Odd count yields exactly n paths with the last one unpaired")
        void oddCount() {
            CountingGaussian rng = new CountingGaussian(9);
            PathBundle bundle = simulator.simulate(PARAMS, 3, 5, true, rng);

            assertThat(bundle.getNumSimulations()).isEqualTo(5);
            assertThat(rng.draws).isEqualTo(2 * 3 + 3);

            double drift = stepDrift(PARAMS, 3);
            double logSpot = Math.log(100);
            for (int k = 0; k < 2; k++) {
                double sum = Math.log(priceAt(bundle, 3, 2 * k)) + Math.log(priceAt(bundle, 3, 2 * k + 1));
                assertThat(sum).isCloseTo(2 * (logSpot + 3 * drift), within(1e-10));
            }
        }

        @Test
        @DisplayName("A single antithetic path is simulated on its own")
        void singlePath() {
            PathBundle bundle = simulator.simulate(PARAMS, 3, 1, true, new SplittableRandom(6));

            assertThat(bundle.getNumSimulations()).isEqualTo(1);
            assertThat(priceAt(bundle, 0, 0)).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Retention boundary inside a pair keeps only the first path")
        void retentionSplitsPair() {
            PathBundle bundle = simulator.simulate(PARAMS, 2, 4, true, 3, new SplittableRandom(8));

            assertThat(bundle.getRetainedPathCount()).isEqualTo(3);
            assertThat(priceAt(bundle, 2, 2)).isEqualTo(bundle.terminalPrices()[2]);
        }
    }

    @Test
    @DisplayName("Same seed reproduces the same paths")
    void reproducible() {
        PathBundle first = simulator.simulate(PARAMS, 20, 50, true, new SplittableRandom(42));
        PathBundle second = simulator.simulate(PARAMS, 20, 50, true, new SplittableRandom(42));

        assertThat(first.terminalPrices()).containsExactly(second.terminalPrices());
    }

    @Test
    @DisplayName("Rejects non-positive step and path counts")
    void rejectsInvalidCounts() {
        assertThatThrownBy(() -> simulator.simulate(PARAMS, 0, 10, false, new SplittableRandom()))
                .isInstanceOf(InvalidParameterException.class)
                .extracting("parameter").isEqualTo("numSteps");
        assertThatThrownBy(() -> simulator.simulate(PARAMS, 10, -1, false, new SplittableRandom()))
                .isInstanceOf(InvalidParameterException.class)
                .extracting("parameter").isEqualTo("numSimulations");
    }

    @Test
    @DisplayName("Rejects step counts above the cap before allocating the path matrix")
    void rejectsOversizedSteps() {
        assertThatThrownBy(() -> simulator.simulate(PARAMS, Integer.MAX_VALUE, 10, false, new SplittableRandom()))
                .isInstanceOf(InvalidParameterException.class)
                .extracting("parameter").isEqualTo("numSteps");
    }

    static final class ConstantGaussian implements RandomGenerator {

        private final double value;

        ConstantGaussian(double value) {
            this.value = value;
        }

        @Override
        public long nextLong() {
            return 0L;
        }

        @Override
        public double nextGaussian() {
            return value;
        }
    }

    static final class CountingGaussian implements RandomGenerator {

        private final SplittableRandom delegate;
        private int draws;

        CountingGaussian(long seed) {
            this.delegate = new SplittableRandom(seed);
        }

        @Override
        public long nextLong() {
            return delegate.nextLong();
        }

        @Override
        public double nextGaussian() {
            draws++;
            return delegate.nextGaussian();
        }
    }
}
