package com.example.catalog.sink;

import com.example.catalog.extract.ProductRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists the records of one run as a single artifact.
 */
public interface RecordSink {

    /**
     * Writes all records, replacing any earlier artifact with the same name.
     *
     * @return where the records went
     */
    Path write(String name, List<ProductRecord> records) throws IOException;
}
