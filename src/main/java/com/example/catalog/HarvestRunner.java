package com.example.catalog;

import com.example.catalog.config.HarvestProperties;
import com.example.catalog.pipeline.CatalogPipeline;
import com.example.catalog.pipeline.HarvestReport;
import com.example.catalog.pipeline.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one harvest when the application starts.
 *
 * Default: full crawl from the configured seeds.
 * With {@code --product-urls=<file>} (one URL per line): extraction only,
 * written to {@code --output-file} or the configured file name.
 */
@Component
@ConditionalOnProperty(prefix = "harvest", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class HarvestRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(HarvestRunner.class);

    private final CatalogPipeline pipeline;
    private final HarvestProperties props;

    public HarvestRunner(CatalogPipeline pipeline, HarvestProperties props) {
        this.pipeline = pipeline;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        HarvestReport report;
        if (args.containsOption("product-urls")) {
            Path urlFile = Paths.get(args.getOptionValues("product-urls").get(0));
            String outputFile = args.containsOption("output-file")
                    ? args.getOptionValues("output-file").get(0)
                    : props.getOutput().getFile();
            report = pipeline.harvestProducts(readUrls(urlFile), outputFile);
        } else {
            List<String> seeds = props.getSeeds();
            if (seeds == null || seeds.isEmpty()) {
                throw new IllegalStateException("harvest.seeds is empty; nothing to crawl");
            }
            try {
                report = pipeline.run(seeds);
            } catch (PipelineException e) {
                log.error("Harvest aborted in {} stage, nothing written: {}", e.getStage(), e.getMessage());
                throw e;
            }
        }

        log.info("Harvest finished: {} seed(s), {} category page(s), {} product page(s), {} record(s) -> {}",
                report.seeds(), report.categoryPages(), report.productPages(), report.records(), report.output());
        if (!report.failures().isEmpty()) {
            log.warn("{} unit(s) were dropped", report.failures().size());
        }
    }

    /**
     * One URL per line; blank lines and repeats are skipped.
     */
    static List<String> readUrls(Path file) throws IOException {
        try (var lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.map(String::trim)
                    .filter(s -> !s.isBlank())
                    .distinct()
                    .collect(Collectors.toList());
        }
    }
}
