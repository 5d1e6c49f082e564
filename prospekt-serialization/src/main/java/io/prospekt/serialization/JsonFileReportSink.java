package io.prospekt.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prospekt.core.report.Report;
import io.prospekt.core.report.ReportSink;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// {@link ReportSink} writing each report as a pretty-printed JSON file.
///
/// Files are named `{Display_Name}_{yyyyMMdd_HHmmss}.json` inside the reports directory,
/// which is created on first write.
public final class JsonFileReportSink implements ReportSink {

    private static final Logger logger = Logger.getLogger(JsonFileReportSink.class.getName());

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern UNSAFE = Pattern.compile("[\\\\/:*?\"<>|\\s]");

    private final Path reportsDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JsonFileReportSink(Path reportsDir) {
        this(reportsDir, Clock.systemDefaultZone());
    }

    public JsonFileReportSink(Path reportsDir, Clock clock) {
        this.reportsDir = Objects.requireNonNull(reportsDir, "reportsDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = ReportSerializer.createMapper();
    }

    @Override
    public void archive(Report report) {
        write(report);
    }

    /// Writes the report and returns the created file.
    ///
    /// @param report finished report, not null
    /// @return path of the written file, never null
    /// @throws UncheckedIOException if the directory or file could not be written
    public Path write(Report report) {
        Objects.requireNonNull(report, "report must not be null");
        Path target = reportsDir.resolve(fileNameFor(report));
        try {
            Files.createDirectories(reportsDir);
            mapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + target, e);
        }
        logger.info("Report saved to " + target);
        return target;
    }

    /// Returns the file name a report would be written under at the current clock time.
    String fileNameFor(Report report) {
        String name = UNSAFE.matcher(report.subject().displayName()).replaceAll("_");
        return name + "_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".json";
    }

    /// Returns the reports directory.
    public Path getReportsDir() {
        return reportsDir;
    }
}
