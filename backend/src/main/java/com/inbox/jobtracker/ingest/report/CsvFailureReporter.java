package com.inbox.jobtracker.ingest.report;

import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.model.FailureEntry;
import com.inbox.jobtracker.ingest.model.FailureReport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes failures to {@code <output-dir>/<file-name>}, replacing the previous run's file.
 * Every value is quoted; quotes inside values become apostrophes and line breaks become spaces.
 */
@Service
public class CsvFailureReporter implements FailureReporter {
    private static final Logger log = LoggerFactory.getLogger(CsvFailureReporter.class);
    static final String HEADER = "Date,Email,Subject,Body,Reason";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final CSVFormat ROW_FORMAT = CSVFormat.DEFAULT.builder()
        .setQuoteMode(QuoteMode.ALL)
        .setRecordSeparator("\n")
        .build();

    private final TrackerProperties properties;

    public CsvFailureReporter(TrackerProperties properties) {
        this.properties = properties;
    }

    @Override
    public FailureReport report(List<FailureEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            log.info("All job emails parsed and written successfully.");
            return FailureReport.nothingToReport();
        }

        Path dir = Paths.get(properties.getReport().getOutputDir());
        Path path = dir.resolve(properties.getReport().getFileName());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create failure report directory {}: {}", dir, e.getMessage(), e);
            return new FailureReport(0, path, "cannot create directory: " + e.getMessage());
        }

        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, ROW_FORMAT)) {
            writer.write(HEADER);
            writer.write("\n");
            for (FailureEntry entry : entries) {
                printer.printRecord(
                    formatDate(entry.receivedAt()),
                    sanitize(entry.sender()),
                    sanitize(entry.subject()),
                    sanitize(entry.normalizedBody()),
                    sanitize(entry.reason())
                );
            }
        } catch (IOException e) {
            log.error("Failed to write failure report {}: {}", path, e.getMessage(), e);
            return new FailureReport(0, path, e.getMessage());
        }

        log.info("Wrote {} failed job emails to {}", entries.size(), path);
        return new FailureReport(entries.size(), path, null);
    }

    private String formatDate(Instant instant) {
        if (instant == null) {
            return "";
        }
        return DATE_FORMAT.format(instant.atZone(properties.getReport().getZone()));
    }

    static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value
            .replace('"', '\'')
            .replace("\r\n", " ")
            .replace('\r', ' ')
            .replace('\n', ' ');
    }
}
