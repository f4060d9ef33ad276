package de.mirkosertic.docmerge.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CellValuesTest {

    @Test
    void shouldParseIntegersAsLong() {
        assertThat(CellValues.parseNumber(" 42 ")).isEqualTo(42L);
        assertThat(CellValues.parseNumber("-7")).isEqualTo(-7L);
    }

    @Test
    void shouldParseDecimalsAsDouble() {
        assertThat(CellValues.parseNumber("3.25")).isEqualTo(3.25);
        assertThat(CellValues.parseNumber(".5")).isEqualTo(0.5);
        assertThat(CellValues.parseNumber("1e3")).isEqualTo(1000.0);
    }

    @Test
    void shouldFallBackToDoubleForHugeIntegers() {
        assertThat(CellValues.parseNumber("123456789012345678901234")).isInstanceOf(Double.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "abc", "1,5", "12abc", "--1"})
    void shouldRejectNonNumbers(final String text) {
        assertThat(CellValues.parseNumber(text)).isNull();
    }

    @Test
    void shouldParseBooleansCaseInsensitive() {
        assertThat(CellValues.parseBoolean("TRUE")).isTrue();
        assertThat(CellValues.parseBoolean(" false ")).isFalse();
        assertThat(CellValues.parseBoolean("yes")).isNull();
    }

    @Test
    void shouldParseCommonDateNotations() {
        final LocalDateTime day = LocalDateTime.of(2024, 3, 15, 0, 0);
        assertThat(CellValues.parseDateTime("2024-03-15")).isEqualTo(day);
        assertThat(CellValues.parseDateTime("2024/03/15")).isEqualTo(day);
        assertThat(CellValues.parseDateTime("03/15/2024")).isEqualTo(day);
        assertThat(CellValues.parseDateTime("15.03.2024")).isEqualTo(day);
        assertThat(CellValues.parseDateTime("15 Mar 2024")).isEqualTo(day);
        assertThat(CellValues.parseDateTime("2024-03-15 08:30:00")).isEqualTo(day.withHour(8).withMinute(30));
        assertThat(CellValues.parseDateTime("2024-03-15T08:30:00")).isEqualTo(day.withHour(8).withMinute(30));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2024", "hello world", "2024-13-45", "12345"})
    void shouldRejectNonDates(final String text) {
        assertThat(CellValues.parseDateTime(text)).isNull();
    }

    @Test
    void shouldCoerceIntegerColumnWithBlanksToDouble() {
        assertThat(CellValues.coerceColumn(Arrays.asList("1", "", "3")))
                .containsExactly(1.0, null, 3.0);
        assertThat(CellValues.coerceColumn(List.of("1", "2", "3")))
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void shouldKeepMixedColumnsAsText() {
        assertThat(CellValues.coerceColumn(Arrays.asList("1", "two", null)))
                .containsExactly("1", "two", null);
    }

    @Test
    void shouldKeepAllBlankColumnEmpty() {
        assertThat(CellValues.coerceColumn(Arrays.asList("", null)))
                .containsExactly(null, null);
    }

    @Test
    void shouldNarrowIntegralDoubles() {
        assertThat(CellValues.narrowIntegers(List.of(1.0, 2.0))).containsExactly(1L, 2L);
        assertThat(CellValues.narrowIntegers(List.of(1.0, 2.5))).containsExactly(1.0, 2.5);
        assertThat(CellValues.narrowIntegers(Arrays.asList(1.0, null))).containsExactly(1.0, null);
    }

    @Test
    void shouldFormatValues() {
        assertThat(CellValues.format(null)).isEmpty();
        assertThat(CellValues.format(2.5)).isEqualTo("2.5");
        assertThat(CellValues.format(1.0E-5)).isEqualTo("0.000010");
        assertThat(CellValues.format(LocalDateTime.of(2024, 1, 2, 0, 0))).isEqualTo("2024-01-02");
        assertThat(CellValues.format(LocalDateTime.of(2024, 1, 2, 3, 4, 5))).isEqualTo("2024-01-02 03:04:05");
    }

    @Test
    void shouldCompareNumbersAcrossTypes() {
        assertThat(CellValues.compare(2L, 2.5)).isNegative();
        assertThat(CellValues.compare("b", "a")).isPositive();
        assertThat(CellValues.compare(1L, "a")).isNotZero();
    }
}
