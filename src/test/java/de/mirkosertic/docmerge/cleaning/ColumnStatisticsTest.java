package de.mirkosertic.docmerge.cleaning;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ColumnStatisticsTest {

    @Test
    void shouldInterpolateQuantiles() {
        final List<Double> values = List.of(4.0, 1.0, 3.0, 2.0, 100.0);

        assertThat(ColumnStatistics.quantile(values, 0.25)).isEqualTo(2.0);
        assertThat(ColumnStatistics.quantile(values, 0.75)).isEqualTo(4.0);
        assertThat(ColumnStatistics.quantile(List.of(1.0, 2.0), 0.5)).isEqualTo(1.5);
        assertThat(ColumnStatistics.quantile(List.of(), 0.5)).isNaN();
    }

    @Test
    void shouldComputeSampleStandardDeviation() {
        assertThat(ColumnStatistics.standardDeviation(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0)))
                .isCloseTo(2.138, within(0.001));
        assertThat(ColumnStatistics.standardDeviation(List.of(1.0))).isNaN();
    }

    @Test
    void shouldIgnoreMissingValues() {
        assertThat(ColumnStatistics.numbers(Arrays.asList(1L, null, 2.5, "x"))).containsExactly(1.0, 2.5);
        assertThat(ColumnStatistics.mode(Arrays.asList(null, null))).isNull();
    }

    @Test
    void shouldPreferSmallestValueOnModeTies() {
        assertThat(ColumnStatistics.mode(Arrays.asList(3L, 1L, 3L, 1L, 2L))).isEqualTo(1L);
    }
}
