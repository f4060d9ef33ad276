package de.mirkosertic.docmerge;

import de.mirkosertic.docmerge.config.ApplicationConfig;
import de.mirkosertic.docmerge.parser.DocumentContent;
import de.mirkosertic.docmerge.parser.DocumentFormat;
import de.mirkosertic.docmerge.parser.DocumentMetadata;
import de.mirkosertic.docmerge.parser.DocumentMetrics;
import de.mirkosertic.docmerge.parser.ParsedDocument;
import de.mirkosertic.docmerge.parser.ParserFactory;
import de.mirkosertic.docmerge.parser.TestDocumentGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentMergerApplication Tests")
class DocumentMergerApplicationTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream buffer;
    private Path defaultOutput;
    private DocumentMergerApplication application;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        defaultOutput = tempDir.resolve("out").resolve("default.xlsx");
        final String yaml = "docmerge:\n  merge:\n    output-path: '" + defaultOutput.toString().replace("'", "''") + "'\n";
        final ApplicationConfig config = ApplicationConfig.fromYaml(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        application = new DocumentMergerApplication(config, new ParserFactory(),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private Path csv(final String name) throws IOException {
        final Path file = tempDir.resolve(name);
        TestDocumentGenerator.createCsvFile(file);
        return file;
    }

    @Nested
    @DisplayName("merge command")
    class MergeTests {

        @Test
        @DisplayName("Should write the workbook to the given output")
        void shouldMergeToExplicitOutput() throws IOException {
            // Given
            final Path input = csv("people.csv");
            final Path target = tempDir.resolve("explicit.xlsx");

            // When
            final int exitCode = application.run(new String[]{"merge", "--output", target.toString(), input.toString()});

            // Then
            assertThat(exitCode).isEqualTo(DocumentMergerApplication.EXIT_OK);
            assertThat(target).isRegularFile();
            assertThat(output()).contains("Merged 1 of 1 files into " + target.toAbsolutePath());
        }

        @Test
        @DisplayName("Should fall back to the configured output path")
        void shouldUseConfiguredOutput() throws IOException {
            // Given
            final Path input = csv("people.csv");

            // When
            final int exitCode = application.run(new String[]{"merge", input.toString()});

            // Then
            assertThat(exitCode).isEqualTo(DocumentMergerApplication.EXIT_OK);
            assertThat(defaultOutput).isRegularFile();
        }

        @Test
        @DisplayName("Should print a cleaning report per table with --clean")
        void shouldPrintCleaningReports() throws IOException {
            // Given
            final Path first = csv("first.csv");
            final Path second = csv("second.csv");

            // When
            final int exitCode = application.run(new String[]{
                    "merge", "--clean", first.toString(), second.toString(), "--output",
                    tempDir.resolve("clean.xlsx").toString()});

            // Then
            assertThat(exitCode).isEqualTo(DocumentMergerApplication.EXIT_OK);
            assertThat(output().split("Data Cleaning Report", -1)).hasSize(3);
            assertThat(output()).contains("Merged 2 of 2 files");
        }

        @Test
        @DisplayName("Should succeed when only some inputs can be parsed")
        void shouldToleratePartialFailures() throws IOException {
            // Given
            final Path input = csv("people.csv");

            // When
            final int exitCode = application.run(new String[]{
                    "merge", input.toString(), tempDir.resolve("missing.csv").toString()});

            // Then
            assertThat(exitCode).isEqualTo(DocumentMergerApplication.EXIT_OK);
            assertThat(output()).contains("Merged 1 of 2 files");
        }

        @Test
        @DisplayName("Should fail when no input can be parsed")
        void shouldFailWhenNothingParsed() {
            // When
            final int exitCode = application.run(new String[]{
                    "merge", tempDir.resolve("missing.csv").toString()});

            // Then
            assertThat(exitCode).isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
            assertThat(defaultOutput).doesNotExist();
        }

        @Test
        @DisplayName("Should reject invalid arguments")
        void shouldRejectInvalidArguments() throws IOException {
            // Given
            final String input = csv("people.csv").toString();

            // When / Then
            assertThat(application.run(new String[]{"merge"})).isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
            assertThat(application.run(new String[]{"merge", input, "--output"}))
                    .isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
            assertThat(application.run(new String[]{"merge", "--force", input}))
                    .isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
            assertThat(defaultOutput).doesNotExist();
        }
    }

    @Nested
    @DisplayName("inspect command")
    class InspectTests {

        @Test
        @DisplayName("Should print a JSON summary of the document")
        void shouldPrintSummary() throws IOException {
            // Given
            final Path input = csv("people.csv");

            // When
            final int exitCode = application.run(new String[]{"inspect", input.toString()});

            // Then
            assertThat(exitCode).isEqualTo(DocumentMergerApplication.EXIT_OK);
            assertThat(output())
                    .contains("\"file_name\" : \"people.csv\"")
                    .contains("\"format\" : \"csv\"")
                    .contains("\"row_count\" : 3")
                    .contains("\"encoding\"");
        }

        @Test
        @DisplayName("Should fail for unreadable documents")
        void shouldFailForUnsupportedFile() throws IOException {
            // Given
            final Path notes = tempDir.resolve("notes.txt");
            Files.writeString(notes, "plain text");

            // When / Then
            assertThat(application.run(new String[]{"inspect", notes.toString()}))
                    .isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
            assertThat(application.run(new String[]{"inspect"}))
                    .isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
            assertThat(output()).isEmpty();
        }

        @Test
        @DisplayName("Should cut long text previews")
        void shouldTruncatePreview() {
            // Given
            final LocalDateTime now = LocalDateTime.of(2024, 3, 1, 8, 0);
            final DocumentMetadata metadata = new DocumentMetadata("long.pdf", "/tmp/long.pdf", DocumentFormat.PDF,
                    10, 0.0, now, now, "application/pdf", Map.of("page_count", "1"));
            final ParsedDocument document = new ParsedDocument(metadata,
                    new DocumentContent("x".repeat(600), List.of(), Map.of("pages", 1)),
                    DocumentMetrics.builder().put(DocumentMetrics.PAGE_COUNT, 1).build());

            // When
            final Map<String, Object> summary = DocumentMergerApplication.summarize(document);

            // Then
            assertThat((String) summary.get("text_preview"))
                    .hasSize(DocumentMergerApplication.TEXT_PREVIEW_LENGTH + 3)
                    .endsWith("...");
            @SuppressWarnings("unchecked")
            final Map<String, Object> meta = (Map<String, Object>) summary.get("metadata");
            assertThat(meta)
                    .containsEntry("format", "pdf")
                    .containsEntry("modified_at", "2024-03-01T08:00")
                    .containsEntry("page_count", "1");
            assertThat(summary).containsKeys("metrics", "structure", "tables");
        }
    }

    @Test
    @DisplayName("Should reject missing and unknown commands")
    void shouldRejectUnknownCommands() {
        assertThat(application.run(new String[0])).isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
        assertThat(application.run(new String[]{"split", "a.csv"})).isEqualTo(DocumentMergerApplication.EXIT_FAILURE);
    }
}
