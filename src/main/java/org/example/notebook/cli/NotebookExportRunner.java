package org.example.notebook.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.example.notebook.kindle.BlockScanner.BlockMarkers;
import org.example.notebook.kindle.KindleNotebookParser;
import org.example.notebook.kindle.NotebookMarkdownRenderer;
import org.example.notebook.model.KindleNotebook;
import org.example.notebook.service.NotebookExportException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

public class NotebookExportRunner {

    private static final String HELP_FLAG = "--help";
    private static final String INPUT_FLAG = "--input";
    private static final String OUTPUT_FLAG = "--output";
    private static final String FORMAT_FLAG = "--format";

    private static final Set<String> SUPPORTED_OPTIONS = Set.of(HELP_FLAG, INPUT_FLAG, OUTPUT_FLAG, FORMAT_FLAG);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        ParsedArgs parsed;
        try {
            parsed = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Argument error: " + e.getMessage());
            printUsage(err);
            return 1;
        }

        if (parsed.flags().contains(HELP_FLAG)) {
            printUsage(out);
            return 0;
        }

        for (String option : parsed.allOptions()) {
            if (!SUPPORTED_OPTIONS.contains(option)) {
                err.println("Unsupported option: " + option);
                printUsage(err);
                return 1;
            }
        }

        Optional<String> input = parsed.optionValue(INPUT_FLAG);
        if (input.isEmpty() || input.get().isBlank()) {
            err.println("Missing required option: " + INPUT_FLAG);
            printUsage(err);
            return 1;
        }

        String formatRaw = parsed.optionValue(FORMAT_FLAG).orElse(OutputFormat.MARKDOWN.value());
        Optional<OutputFormat> format = OutputFormat.fromValue(formatRaw);
        if (format.isEmpty()) {
            err.println("Unsupported format: " + formatRaw + " (supported: markdown, json).");
            return 1;
        }

        Properties properties = loadProperties(err);
        BlockMarkers markers = resolveMarkers(properties);
        KindleNotebookParser parser = new KindleNotebookParser(markers);

        try {
            String html = readInput(Path.of(input.get()));
            KindleNotebook notebook = parser.parse(html);
            String rendered = format.get() == OutputFormat.JSON
                    ? toJson(notebook)
                    : new NotebookMarkdownRenderer().render(notebook);

            Optional<String> output = parsed.optionValue(OUTPUT_FLAG);
            if (output.isPresent()) {
                writeOutput(Path.of(output.get()), rendered);
                out.println("Wrote " + notebook.highlights().size() + " highlights from '"
                        + notebook.title() + "' to " + output.get());
            } else {
                out.println(rendered);
            }
            return 0;
        } catch (NotebookExportException e) {
            err.println("Notebook export failed: " + e.getMessage());
            return 1;
        }
    }

    private static String readInput(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new NotebookExportException("Input file not found: " + path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NotebookExportException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static void writeOutput(Path path, String content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NotebookExportException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    private static String toJson(KindleNotebook notebook) {
        try {
            return OBJECT_MAPPER.writeValueAsString(notebook);
        } catch (JsonProcessingException e) {
            throw new NotebookExportException("Failed to serialize notebook: " + e.getMessage(), e);
        }
    }

    private static BlockMarkers resolveMarkers(Properties properties) {
        String headingClass = properties.getProperty("notebook.parser.heading-class", BlockMarkers.DEFAULT.headingClass());
        String bodyClass = properties.getProperty("notebook.parser.body-class", BlockMarkers.DEFAULT.bodyClass());
        if (headingClass.isBlank() || bodyClass.isBlank()) {
            return BlockMarkers.DEFAULT;
        }
        return new BlockMarkers(headingClass, bodyClass);
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  NotebookExportRunner --input <notebook.html> [--output <path>] [--format markdown|json]");
        out.println("");
        out.println("Notes:");
        out.println("  Without --output the report is printed to stdout.");
        out.println("  The input file is read as UTF-8.");
    }

    private static Properties loadProperties(PrintStream err) {
        Properties properties = new Properties();
        try (InputStream input = NotebookExportRunner.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            err.println("Failed to load application.properties from classpath: " + e.getMessage());
        }
        return properties;
    }

    private static ParsedArgs parseArgs(String[] args) {
        if (args == null || args.length == 0) {
            return new ParsedArgs(Map.of(), Set.of(), Set.of());
        }

        Map<String, String> values = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        Set<String> allOptions = new LinkedHashSet<>();

        List<String> tokens = Arrays.asList(args);
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (!token.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected positional argument: " + token);
            }

            String option = token;
            String value = null;
            int equalsIndex = token.indexOf('=');
            if (equalsIndex > 0) {
                option = token.substring(0, equalsIndex);
                value = token.substring(equalsIndex + 1);
            } else if (i + 1 < tokens.size() && !tokens.get(i + 1).startsWith("--")) {
                value = tokens.get(i + 1);
                i++;
            }

            allOptions.add(option);
            if (value == null) {
                flags.add(option);
            } else {
                values.put(option, value);
            }
        }

        return new ParsedArgs(values, flags, allOptions);
    }

    record ParsedArgs(Map<String, String> values, Set<String> flags, Set<String> allOptions) {

        Optional<String> optionValue(String key) {
            return Optional.ofNullable(values.get(key));
        }
    }

    enum OutputFormat {
        MARKDOWN("markdown"),
        JSON("json");

        private final String value;

        OutputFormat(String value) {
            this.value = value;
        }

        String value() {
            return value;
        }

        static Optional<OutputFormat> fromValue(String raw) {
            if (raw == null || raw.isBlank()) {
                return Optional.empty();
            }
            for (OutputFormat format : values()) {
                if (format.value.equalsIgnoreCase(raw.trim())) {
                    return Optional.of(format);
                }
            }
            return Optional.empty();
        }
    }
}
