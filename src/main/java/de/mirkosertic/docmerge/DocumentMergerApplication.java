package de.mirkosertic.docmerge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.docmerge.cleaning.CleaningReport;
import de.mirkosertic.docmerge.config.ApplicationConfig;
import de.mirkosertic.docmerge.config.LoggingConfigurator;
import de.mirkosertic.docmerge.merge.ExcelMerger;
import de.mirkosertic.docmerge.parser.DocumentMetadata;
import de.mirkosertic.docmerge.parser.ParsedDocument;
import de.mirkosertic.docmerge.parser.ParserFactory;
import de.mirkosertic.docmerge.table.Table;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 *   merge [--clean] [--output &lt;file.xlsx&gt;] &lt;file&gt;...
 *   inspect &lt;file&gt;
 * </pre>
 */
public class DocumentMergerApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocumentMergerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int TEXT_PREVIEW_LENGTH = 500;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  merge [--clean] [--output <file.xlsx>] <file>...",
            "  inspect <file>");

    private final ApplicationConfig config;
    private final ParserFactory parserFactory;
    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public DocumentMergerApplication(final ApplicationConfig config, final ParserFactory parserFactory,
                                     final PrintStream out) {
        this.config = config;
        this.parserFactory = parserFactory;
        this.out = out;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Run one command.
     *
     * @return process exit code
     */
    public int run(final String[] args) {
        if (args.length == 0) {
            return usage("No command given");
        }
        final List<String> rest = List.of(args).subList(1, args.length);
        return switch (args[0]) {
            case "merge" -> merge(rest);
            case "inspect" -> inspect(rest);
            default -> usage("Unknown command: " + args[0]);
        };
    }

    private int merge(final List<String> args) {
        boolean clean = config.isAutoClean();
        String output = config.getOutputPath();
        final List<Path> files = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            final String arg = args.get(i);
            if ("--clean".equals(arg)) {
                clean = true;
            } else if ("--output".equals(arg)) {
                if (i + 1 >= args.size()) {
                    return usage("--output requires a file name");
                }
                output = args.get(++i);
            } else if (arg.startsWith("--")) {
                return usage("Unknown option: " + arg);
            } else {
                files.add(Paths.get(arg));
            }
        }
        if (files.isEmpty()) {
            return usage("No input files given");
        }

        final ExcelMerger merger = new ExcelMerger(parserFactory, clean, config.getCleaningConfig());
        final int added = merger.addFiles(files);
        if (added == 0) {
            logger.error("None of the {} input files could be processed", files.size());
            return EXIT_FAILURE;
        }

        final Path outputPath = Paths.get(output);
        if (!merger.mergeToExcel(outputPath)) {
            return EXIT_FAILURE;
        }

        for (final CleaningReport report : merger.getLastCleaningReports()) {
            out.println(report.render());
        }
        out.println("Merged " + added + " of " + files.size() + " files into " + outputPath.toAbsolutePath());
        return EXIT_OK;
    }

    private int inspect(final List<String> args) {
        if (args.size() != 1) {
            return usage("inspect expects exactly one file");
        }
        final Path file = Paths.get(args.get(0));
        try {
            final ParsedDocument document = parserFactory.parse(file);
            out.println(objectMapper.writeValueAsString(summarize(document)));
            return EXIT_OK;
        } catch (final JsonProcessingException e) {
            logger.error("Could not render summary of {}", file, e);
            return EXIT_FAILURE;
        } catch (final IOException | RuntimeException e) {
            logger.error("Could not parse {}: {}", file, e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    /**
     * JSON friendly view of a parsed document. Date values are rendered as ISO strings.
     */
    static Map<String, Object> summarize(final ParsedDocument document) {
        final DocumentMetadata metadata = document.metadata();

        final Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("file_name", metadata.fileName());
        meta.put("file_path", metadata.filePath());
        meta.put("format", metadata.format().tag());
        meta.put("file_size", metadata.fileSize());
        meta.put("file_size_mb", metadata.fileSizeMb());
        meta.put("modified_at", metadata.modifiedAt().toString());
        meta.put("parsed_at", metadata.parsedAt().toString());
        meta.put("mime_type", metadata.mimeType());
        meta.putAll(metadata.extras());

        final List<Map<String, Object>> tables = new ArrayList<>();
        for (final Table table : document.content().tables()) {
            final Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("name", table.getName());
            summary.put("rows", table.rowCount());
            summary.put("columns", table.getColumns());
            summary.put("data_types", table.dataTypes());
            tables.add(summary);
        }

        final Map<String, Object> result = new LinkedHashMap<>();
        result.put("metadata", meta);
        result.put("metrics", document.metrics().values());
        result.put("structure", document.content().structure());
        result.put("tables", tables);
        result.put("text_preview", preview(document.content().text()));
        return result;
    }

    private static String preview(final String text) {
        return text.length() > TEXT_PREVIEW_LENGTH ? text.substring(0, TEXT_PREVIEW_LENGTH) + "..." : text;
    }

    private int usage(final @Nullable String problem) {
        if (problem != null) {
            System.err.println(problem);
        }
        System.err.println(USAGE);
        return EXIT_FAILURE;
    }

    public static void main(final String[] args) {
        int exitCode;
        try {
            // Logging first, file logging is switched on by a system property to avoid logging during config load
            LoggingConfigurator.configure(Boolean.getBoolean("docmerge.logging.file"));

            final ApplicationConfig config = ApplicationConfig.load();
            if (config.isFileLoggingEnabled()) {
                LoggingConfigurator.configure(true);
            }

            exitCode = new DocumentMergerApplication(config, new ParserFactory(), System.out).run(args);
        } catch (final Exception e) {
            System.err.println("Document merger failed: " + e.getMessage());
            e.printStackTrace(System.err);
            exitCode = EXIT_FAILURE;
        }
        System.exit(exitCode);
    }
}
