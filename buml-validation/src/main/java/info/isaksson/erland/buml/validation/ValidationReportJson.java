package info.isaksson.erland.buml.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON form of a {@link ValidationReport}: model name, error and warning counts, then the issues.
 *
 * <p>The report fixes the order of issues and of context keys, so equal reports render to equal
 * text. Lines end in {@code \n} on every platform and the document ends with a newline.</p>
 */
public final class ValidationReportJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader READER = MAPPER.readerFor(ValidationReport.class);
    private static final ObjectWriter WRITER = MAPPER.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter().withLinefeed("\n"))
            .withArrayIndenter(new DefaultIndenter().withLinefeed("\n")));

    private ValidationReportJson() {}

    public static String toJson(ValidationReport report) throws JsonProcessingException {
        Objects.requireNonNull(report, "report must not be null");
        return WRITER.writeValueAsString(report) + "\n";
    }

    public static ValidationReport fromJson(String json) throws JsonProcessingException {
        Objects.requireNonNull(json, "json must not be null");
        return READER.readValue(json);
    }

    /** Writes {@link #toJson} as UTF-8, replacing {@code path}. */
    public static void write(ValidationReport report, Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
    }
}
