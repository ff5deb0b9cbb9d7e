package com.example.catalog.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of one finished run.
 */
public record HarvestReport(int seeds,
                            int categoryPages,
                            int productPages,
                            int records,
                            List<UnitFailure> failures,
                            Path output) {

    public HarvestReport {
        failures = List.copyOf(failures);
    }
}
