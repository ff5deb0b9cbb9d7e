package com.example.catalog.sink;

import com.example.catalog.extract.ProductRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes one JSON object per line into a fixed output directory.
 */
public class JsonLinesSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesSink.class);

    private final Path directory;
    private final ObjectWriter writer;

    public JsonLinesSink(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.writer = objectMapper.writerFor(ProductRecord.class);
    }

    @Override
    public Path write(String name, List<ProductRecord> records) throws IOException {
        Path dir = directory.toAbsolutePath().normalize();
        Files.createDirectories(dir);
        Path out = dir.resolve(name);

        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (ProductRecord record : records) {
                w.write(writer.writeValueAsString(record));
                w.write('\n');
            }
        }

        log.info("Wrote {} record(s) to {}", records.size(), out);
        return out;
    }
}
