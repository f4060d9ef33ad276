package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentMetrics and DocumentMetadata Tests")
class DocumentMetricsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should count whitespace separated words")
    void shouldCountWords() {
        assertThat(DocumentMetrics.countWords("")).isZero();
        assertThat(DocumentMetrics.countWords("   \n\t ")).isZero();
        assertThat(DocumentMetrics.countWords(" one  two\nthree\tfour ")).isEqualTo(4);
    }

    @Test
    @DisplayName("Should count lines by newlines")
    void shouldCountLines() {
        assertThat(DocumentMetrics.countLines("")).isEqualTo(1);
        assertThat(DocumentMetrics.countLines("a\nb")).isEqualTo(2);
        assertThat(DocumentMetrics.countLines("a\nb\n")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should describe a table")
    void shouldDescribeTable() {
        // Given
        final Table table = Table.of(List.of("name", "score"), List.of(
                Arrays.asList("a", 1L),
                Arrays.asList("b", 2L)));

        // When
        final DocumentMetrics metrics = DocumentMetrics.forTable(table);

        // Then
        assertThat(metrics.rowCount()).isEqualTo(2);
        assertThat(metrics.columnCount()).isEqualTo(2);
        assertThat(metrics.getInt(DocumentMetrics.NUMERIC_COLUMNS)).hasValue(1);
        assertThat(metrics.getInt(DocumentMetrics.TEXT_COLUMNS)).hasValue(1);
        assertThat(metrics.has(DocumentMetrics.PAGE_COUNT)).isFalse();
        assertThat(metrics.getInt(DocumentMetrics.PAGE_COUNT)).isEmpty();
    }

    @Test
    @DisplayName("Should round file sizes to two decimals of a megabyte")
    void shouldRoundMegabytes() {
        assertThat(DocumentMetadata.toMegabytes(0)).isZero();
        assertThat(DocumentMetadata.toMegabytes(1024L * 1024L)).isEqualTo(1.0);
        assertThat(DocumentMetadata.toMegabytes(1_572_864L)).isEqualTo(1.5);
        assertThat(DocumentMetadata.toMegabytes(5_000L)).isEqualTo(0.0);
        assertThat(DocumentMetadata.toMegabytes(6_000L)).isEqualTo(0.01);
    }

    @Test
    @DisplayName("Should read file level metadata")
    void shouldReadMetadata() throws IOException {
        // Given
        final Path file = tempDir.resolve("people.csv");
        TestDocumentGenerator.createCsvFile(file);

        // When
        final DocumentMetadata metadata = DocumentMetadata.of(file, DocumentFormat.CSV, Map.of("encoding", "UTF-8"));

        // Then
        assertThat(metadata.fileName()).isEqualTo("people.csv");
        assertThat(metadata.filePath()).isEqualTo(file.toAbsolutePath().toString());
        assertThat(metadata.fileSize()).isEqualTo(Files.size(file));
        assertThat(metadata.format()).isEqualTo(DocumentFormat.CSV);
        assertThat(metadata.extras()).containsEntry("encoding", "UTF-8");
        assertThat(metadata.parsedAt()).isNotNull();
    }
}
