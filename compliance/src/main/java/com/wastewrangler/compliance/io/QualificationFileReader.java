package com.wastewrangler.compliance.io;

import com.wastewrangler.compliance.model.QualificationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads technician qualification files.
 *
 * Records take two lines: a line ending in "&lt;first&gt; &lt;last&gt;" (anything
 * before the last two words is ignored) followed by a line holding the truck
 * type code. Lines pair up by position, so a blank line inside the file
 * spoils the record it lands in and shifts every record after it. Blank
 * lines at the end of the file are ignored.
 */
@Component
public class QualificationFileReader {

    private static final Logger log = LoggerFactory.getLogger(QualificationFileReader.class);

    public List<QualificationRecord> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<QualificationRecord> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }

        List<QualificationRecord> records = new ArrayList<>();
        for (int i = 0; i + 1 < lines.size(); i += 2) {
            String nameLine = lines.get(i);
            String code = lines.get(i + 1).trim();
            String[] words = nameLine.trim().split("\\s+");
            if (words.length < 2) {
                log.warn("Skipping qualification at line {} with unreadable name line '{}'", i + 1, nameLine);
            } else if (code.isEmpty()) {
                log.warn("Skipping qualification at line {} for '{}' without a truck type", i + 1, nameLine.trim());
            } else {
                records.add(new QualificationRecord(words[words.length - 2], words[words.length - 1], code));
            }
        }
        if (lines.size() % 2 == 1) {
            log.warn("Dropping trailing name line without a truck type: '{}'", lines.get(lines.size() - 1));
        }
        return records;
    }
}
