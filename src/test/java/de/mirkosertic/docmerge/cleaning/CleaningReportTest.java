package de.mirkosertic.docmerge.cleaning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CleaningReport rendering")
class CleaningReportTest {

    @Test
    @DisplayName("Should render every section that has content")
    void shouldRenderAllSections() {
        // Given
        final CleaningReport report = CleaningReport.builder(new CleaningReport.TableShape(10, 4))
                .duplicatesRemoved(2)
                .nullsFilled("age", 3)
                .columnDropped("notes")
                .typeConverted("amount", "object → float64")
                .columnRenamed("First Name", "first_name")
                .outliersDetected(1)
                .build(new CleaningReport.TableShape(8, 3));

        // When
        final String rendered = report.render();

        // Then
        final String rule = "=".repeat(60);
        assertThat(rendered).isEqualTo(String.join("\n",
                rule,
                "Data Cleaning Report",
                rule,
                "Shape: (10, 4) → (8, 3)",
                "",
                "✓ Removed 2 duplicate rows",
                "✓ Filled nulls in 1 columns:",
                "  - age: 3 values",
                "✓ Dropped 1 columns:",
                "  - notes",
                "✓ Converted data types in 1 columns:",
                "  - amount: object → float64",
                "✓ Renamed 1 columns",
                "✓ Detected 1 outliers",
                rule));
        assertThat(report.toString()).isEqualTo(rendered);
    }

    @Test
    @DisplayName("Should render only the frame for a pass that changed nothing")
    void shouldRenderEmptyReport() {
        // Given
        final CleaningReport report = CleaningReport.builder(new CleaningReport.TableShape(2, 2))
                .build(new CleaningReport.TableShape(2, 2));

        // When / Then
        assertThat(report.render().split("\n")).hasSize(6);
        assertThat(report.render()).contains("Shape: (2, 2) → (2, 2)");
    }

    @Test
    @DisplayName("Should not be affected by later builder changes")
    void shouldCopyCollections() {
        // Given
        final CleaningReport.Builder builder = CleaningReport.builder(new CleaningReport.TableShape(1, 1));
        final CleaningReport report = builder.build(new CleaningReport.TableShape(1, 1));

        // When
        builder.columnDropped("late");

        // Then
        assertThat(report.columnsDropped()).isEmpty();
    }
}
