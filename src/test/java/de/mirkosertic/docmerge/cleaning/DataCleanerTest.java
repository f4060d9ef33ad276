package de.mirkosertic.docmerge.cleaning;

import de.mirkosertic.docmerge.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DataCleaner Tests")
class DataCleanerTest {

    private CleaningConfig config;

    @BeforeEach
    void setUp() {
        config = new CleaningConfig();
    }

    private static Table table(final List<String> columns, final Object[]... rows) {
        final List<List<Object>> data = new ArrayList<>();
        for (final Object[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return Table.of(columns, data);
    }

    private CleaningResult clean(final Table table) {
        return new DataCleaner(config).clean(table);
    }

    @Nested
    @DisplayName("Deduplication")
    class DeduplicationTests {

        private final Table input = table(List.of("name", "value"),
                new Object[]{"A", 1}, new Object[]{"A", 1}, new Object[]{"B", 2});

        @Test
        @DisplayName("Should keep the first of duplicate rows")
        void shouldKeepFirst() {
            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getRows()).containsExactly(List.of("A", 1L), List.of("B", 2L));
            assertThat(result.report().duplicatesRemoved()).isEqualTo(1);
            assertThat(result.report().originalShape()).isEqualTo(new CleaningReport.TableShape(3, 2));
            assertThat(result.report().finalShape()).isEqualTo(new CleaningReport.TableShape(2, 2));
        }

        @Test
        @DisplayName("Should drop every duplicated row with keep policy NONE")
        void shouldKeepNone() {
            // Given
            config.setKeepDuplicate(KeepPolicy.NONE);

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getRows()).containsExactly(List.of("B", 2L));
            assertThat(result.report().duplicatesRemoved()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should keep the last occurrence of a subset key in original order")
        void shouldKeepLastBySubset() {
            // Given
            config.setKeepDuplicate(KeepPolicy.LAST);
            config.setDuplicateSubset(List.of("name"));
            final Table table = table(List.of("name", "note"),
                    new Object[]{"A", "first"}, new Object[]{"B", "only"}, new Object[]{"A", "last"});

            // When
            final CleaningResult result = clean(table);

            // Then
            assertThat(result.table().getRows()).containsExactly(List.of("B", "only"), List.of("A", "last"));
        }

        @Test
        @DisplayName("Should reject unknown subset columns")
        void shouldRejectUnknownSubsetColumn() {
            config.setDuplicateSubset(List.of("missing"));

            assertThatThrownBy(() -> clean(input))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Should leave the input table untouched")
        void shouldNotMutateInput() {
            // When
            clean(input);

            // Then
            assertThat(input.rowCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Null handling")
    class NullHandlingTests {

        @BeforeEach
        void disableOtherSteps() {
            config.setRemoveDuplicates(false);
            config.setInferTypes(false);
            config.setNormalizeNames(false);
        }

        @Test
        @DisplayName("Should fill numeric nulls with the mean")
        void shouldFillWithMean() {
            // Given
            final Table input = table(List.of("col"), new Object[]{1}, new Object[]{null}, new Object[]{3});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("col")).containsExactly(1.0, 2.0, 3.0);
            assertThat(result.report().nullsFilled()).containsEntry("col", 1);
        }

        @Test
        @DisplayName("Should fill numeric nulls with the median")
        void shouldFillWithMedian() {
            // Given
            config.setFillStrategy(FillStrategy.MEDIAN);
            final Table input = table(List.of("col"),
                    new Object[]{1}, new Object[]{null}, new Object[]{2}, new Object[]{10});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("col")).containsExactly(1.0, 2.0, 2.0, 10.0);
        }

        @Test
        @DisplayName("Should fall back to an empty string for text columns under MEAN")
        void shouldFallBackForTextColumns() {
            // Given
            final Table input = table(List.of("text", "number"),
                    new Object[]{"a", 1}, new Object[]{null, 2}, new Object[]{"c", 3});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("text")).containsExactly("a", "", "c");
            assertThat(result.report().nullsFilled()).containsOnlyKeys("text");
        }

        @Test
        @DisplayName("Should fill with the most frequent value, smallest on ties")
        void shouldFillWithMode() {
            // Given
            config.setFillStrategy(FillStrategy.MODE);
            final Table input = table(List.of("frequent", "tied"),
                    new Object[]{"x", "b"}, new Object[]{"y", "a"}, new Object[]{"x", null}, new Object[]{null, "c"});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("frequent")).containsExactly("x", "y", "x", "x");
            assertThat(result.table().column("tied")).containsExactly("b", "a", "a", "c");
        }

        @Test
        @DisplayName("Should forward fill and keep leading nulls")
        void shouldForwardFill() {
            // Given
            config.setFillStrategy(FillStrategy.FFILL);
            final Table input = table(List.of("col"),
                    new Object[]{null}, new Object[]{1}, new Object[]{null}, new Object[]{3});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("col")).containsExactly(null, 1L, 1L, 3L);
            assertThat(result.report().nullsFilled()).containsEntry("col", 2);
        }

        @Test
        @DisplayName("Should backward fill and keep trailing nulls")
        void shouldBackwardFill() {
            // Given
            config.setFillStrategy(FillStrategy.BFILL);
            final Table input = table(List.of("col"),
                    new Object[]{1}, new Object[]{null}, new Object[]{3}, new Object[]{null});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("col")).containsExactly(1L, 3L, 3L, null);
        }

        @Test
        @DisplayName("Should drop rows with nulls")
        void shouldDropRows() {
            // Given
            config.setFillStrategy(FillStrategy.DROP);
            final Table input = table(List.of("a", "b"),
                    new Object[]{1, "x"}, new Object[]{null, "y"}, new Object[]{3, "z"});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getRows()).containsExactly(List.of(1L, "x"), List.of(3L, "z"));
            assertThat(result.report().finalShape()).isEqualTo(new CleaningReport.TableShape(2, 2));
        }

        @Test
        @DisplayName("Should fill defaults by column type")
        void shouldFillDefaults() {
            // Given
            config.setFillStrategy(FillStrategy.DEFAULT);
            final Table input = table(List.of("int", "float", "text"),
                    new Object[]{1, 1.5, "a"}, new Object[]{null, null, null}, new Object[]{3, 2.5, "c"});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getRows().get(1)).containsExactly(0L, 0.0, "");
        }

        @Test
        @DisplayName("Should drop columns whose null fraction exceeds the threshold")
        void shouldDropSparseColumns() {
            // Given
            final Table input = table(List.of("sparse", "half", "dense"),
                    new Object[]{null, null, 1}, new Object[]{null, 2, 2},
                    new Object[]{1, null, 3}, new Object[]{null, 4, 4});

            // When
            final CleaningResult result = clean(input);

            // Then: 3/4 nulls is above 0.5, 2/4 is not
            assertThat(result.report().columnsDropped()).containsExactly("sparse");
            assertThat(result.table().getColumns()).containsExactly("half", "dense");
        }
    }

    @Nested
    @DisplayName("Name normalization")
    class NameNormalizationTests {

        @Test
        @DisplayName("Should normalize names and resolve collisions")
        void shouldNormalizeNames() {
            // Given
            final Table input = table(List.of("First Name", "Amount ($)", "a_b", "A  B", "!!!"),
                    new Object[]{"x", 1, 2, 3, 4});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getColumns())
                    .containsExactly("first_name", "amount", "a_b", "a_b_2", "column_5");
            assertThat(result.report().columnsRenamed())
                    .containsEntry("First Name", "first_name")
                    .containsEntry("A  B", "a_b_2")
                    .doesNotContainKey("a_b")
                    .hasSize(4);
        }

        @Test
        @DisplayName("Should keep unicode letters")
        void shouldKeepUnicodeLetters() {
            assertThat(DataCleaner.normalizeName(" Größe (cm) ")).isEqualTo("größe_cm");
        }
    }

    @Nested
    @DisplayName("Type inference")
    class TypeInferenceTests {

        @Test
        @DisplayName("Should convert mostly numeric text columns")
        void shouldConvertNumericText() {
            // Given
            final Table input = table(List.of("amount", "count", "label"),
                    new Object[]{"1.5", "1", "x"}, new Object[]{"2", "2", "1"},
                    new Object[]{"3", "3", "y"}, new Object[]{"n/a", "4", "z"},
                    new Object[]{"5", "5", "w"});

            // When
            final CleaningResult result = clean(input);

            // Then: 4 of 5 values convert, which meets the 80% threshold
            assertThat(result.table().column("amount")).containsExactly(1.5, 2.0, 3.0, null, 5.0);
            assertThat(result.table().column("count")).containsExactly(1L, 2L, 3L, 4L, 5L);
            assertThat(result.table().column("label")).containsExactly("x", "1", "y", "z", "w");
            assertThat(result.report().typesConverted())
                    .containsEntry("amount", "object → float64")
                    .containsEntry("count", "object → int64")
                    .doesNotContainKey("label");
        }

        @Test
        @DisplayName("Should convert mostly date-like text columns")
        void shouldConvertDates() {
            // Given
            final Table input = table(List.of("date"),
                    new Object[]{"2024-01-01"}, new Object[]{"2024-02-01"}, new Object[]{"unknown"},
                    new Object[]{"2024-03-01"}, new Object[]{"2024-04-01"});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("date"))
                    .containsExactly(LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 2, 1, 0, 0), null,
                            LocalDateTime.of(2024, 3, 1, 0, 0), LocalDateTime.of(2024, 4, 1, 0, 0));
            assertThat(result.report().typesConverted()).containsEntry("date", "object → datetime64");
        }

        @Test
        @DisplayName("Should leave dates alone when date parsing is off")
        void shouldSkipDatesWhenDisabled() {
            // Given
            config.setParseDates(false);
            final Table input = table(List.of("date"), new Object[]{"2024-01-01"}, new Object[]{"2024-02-01"});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().column("date")).containsExactly("2024-01-01", "2024-02-01");
            assertThat(result.report().typesConverted()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Outlier detection")
    class OutlierDetectionTests {

        @BeforeEach
        void enableOutliers() {
            config.setDetectOutliers(true);
        }

        @Test
        @DisplayName("Should flag values outside the IQR fences")
        void shouldFlagIqrOutliers() {
            // Given
            final Table input = table(List.of("value"),
                    new Object[]{1}, new Object[]{2}, new Object[]{3}, new Object[]{4}, new Object[]{100});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getColumns()).containsExactly("value", "value_outlier");
            assertThat(result.table().column("value_outlier")).containsExactly(false, false, false, false, true);
            assertThat(result.report().outliersDetected()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should flag values beyond the z-score threshold")
        void shouldFlagZScoreOutliers() {
            // Given
            config.setOutlierMethod(OutlierMethod.ZSCORE);
            config.setZScoreThreshold(2.0);
            config.setRemoveDuplicates(false);
            final Object[][] rows = new Object[10][];
            for (int i = 0; i < 9; i++) {
                rows[i] = new Object[]{10};
            }
            rows[9] = new Object[]{50};

            // When
            final CleaningResult result = clean(table(List.of("value"), rows));

            // Then
            assertThat(result.table().column("value_outlier")).containsOnlyOnce(true);
            assertThat(result.report().outliersDetected()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should overwrite an existing flag column instead of adding a renamed one")
        void shouldReplaceExistingFlagColumn() {
            // Given
            final Table input = table(List.of("value", "value_outlier"),
                    new Object[]{1, 0}, new Object[]{2, 0}, new Object[]{3, 0}, new Object[]{4, 0},
                    new Object[]{100, 0});

            // When
            final CleaningResult result = clean(input);

            // Then
            assertThat(result.table().getColumns()).containsExactly("value", "value_outlier");
            assertThat(result.table().column("value_outlier")).containsExactly(false, false, false, false, true);
            assertThat(result.report().outliersDetected()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not add a flag column when nothing is flagged")
        void shouldNotFlagConstantColumns() {
            // Given
            config.setOutlierMethod(OutlierMethod.ZSCORE);
            config.setRemoveDuplicates(false);

            // When
            final CleaningResult result = clean(table(List.of("value"),
                    new Object[]{5}, new Object[]{5}, new Object[]{5}));

            // Then
            assertThat(result.table().getColumns()).containsExactly("value");
            assertThat(result.report().outliersDetected()).isZero();
        }
    }

    @Test
    @DisplayName("Should skip every step that is switched off")
    void shouldSkipDisabledSteps() {
        // Given
        config.setRemoveDuplicates(false);
        config.setHandleNulls(false);
        config.setNormalizeNames(false);
        config.setInferTypes(false);
        final Table input = table(List.of("Some Name"), new Object[]{"1"}, new Object[]{"1"}, new Object[]{null});

        // When
        final CleaningResult result = clean(input);

        // Then
        assertThat(result.table()).isEqualTo(input);
        assertThat(result.report().render()).doesNotContain("✓");
    }
}
