package info.isaksson.erland.paramdup.report;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes run reports.
 *
 * <p>Output is pretty-printed with two-space indentation and ends with a newline. The report
 * is normalized before it is rendered, so two runs over the same tree give identical files.</p>
 */
public final class ReportJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ReportJson() {}

    /** Parses a report previously produced by {@link #write} or {@link #toJsonString}. */
    public static DuplicationReport readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, DuplicationReport.class);
    }

    /**
     * Writes the normalized report to {@code path}, creating missing parent directories.
     * An existing file is replaced.
     */
    public static void write(DuplicationReport report, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, toJsonString(report), StandardCharsets.UTF_8);
    }

    public static String toJsonString(DuplicationReport report) throws IOException {
        if (report == null) throw new IllegalArgumentException("report is null");
        return MAPPER.writer(PRETTY).writeValueAsString(ReportNormalizer.normalize(report)) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        // Map keys sorted; field order comes from @JsonPropertyOrder on the model classes.
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
