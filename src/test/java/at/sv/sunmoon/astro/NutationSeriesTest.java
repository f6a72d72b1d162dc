package at.sv.sunmoon.astro;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NutationSeriesTest {

    /**
     * 1987 April 10, 0h TD.
     */
    private static final double T_EXAMPLE_22A = -0.127296372348;

    @Test
    void table_hasAllPeriodicTerms() {
        assertThat(NutationSeries.termCount()).isEqualTo(63);
    }

    @Test
    void compute_meeusExample22a() {
        Nutation nutation = NutationSeries.compute(T_EXAMPLE_22A);

        assertThat(nutation.longitude() * 3600).isCloseTo(-3.788, within(0.001));
        assertThat(nutation.obliquity() * 3600).isCloseTo(9.443, within(0.001));
    }

    @Test
    void convenienceMethods_matchCompute() {
        Nutation nutation = NutationSeries.compute(0.2);

        assertThat(NutationSeries.nutationInLongitude(0.2)).isEqualTo(nutation.longitude());
        assertThat(NutationSeries.nutationInObliquity(0.2)).isEqualTo(nutation.obliquity());
    }

    @Test
    void fundamentalArguments_meeusExample22a() {
        assertThat(NutationSeries.moonMeanElongation(T_EXAMPLE_22A)).isCloseTo(136.9623, within(0.0001));
        assertThat(NutationSeries.sunMeanAnomaly(T_EXAMPLE_22A)).isCloseTo(94.9792, within(0.0001));
        assertThat(NutationSeries.moonMeanAnomaly(T_EXAMPLE_22A)).isCloseTo(229.2784, within(0.0001));
        assertThat(NutationSeries.moonArgumentOfLatitude(T_EXAMPLE_22A)).isCloseTo(143.4079, within(0.0001));
        assertThat(NutationSeries.moonAscendingNodeLongitude(T_EXAMPLE_22A)).isCloseTo(11.2531, within(0.0001));
    }

    @Test
    void nutation_staysWithinKnownAmplitude() {
        for (double t = -2; t <= 2; t += 0.01) {
            Nutation nutation = NutationSeries.compute(t);
            assertThat(Math.abs(nutation.longitude() * 3600)).isLessThan(20);
            assertThat(Math.abs(nutation.obliquity() * 3600)).isLessThan(11);
        }
    }
}
