package com.msst.core.report;

import com.msst.core.model.TestRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes formatted run results to {@code <outputDir>/results.<ext>}.
 */
@Service
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    /**
     * @return the file written
     * @throws ReportWriteException when the directory or file cannot be written
     */
    public Path write(TestRun run, OutputFormat format, Path outputDir) {
        Path file = outputDir.resolve("results" + format.extension());
        writeString(file, ResultFormatters.forFormat(format).format(run));
        log.info("Wrote {} results to {}", run.results().size(), file);
        return file;
    }

    /** Writes the JSON structured record to an exact path (child → orchestrator channel). */
    public Path writeStructured(TestRun run, Path file) {
        writeString(file, new JsonResultFormatter().format(run));
        return file;
    }

    static void writeString(Path file, String content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException("Cannot write " + file + ": " + e.getMessage(), e);
        }
    }
}
