package com.example.catalog.pipeline;

import com.example.catalog.browser.PageSessionFactory;
import com.example.catalog.browser.WorkerSessions;
import com.example.catalog.discovery.CategoryDiscoveryTask;
import com.example.catalog.discovery.ProductDiscoveryTask;
import com.example.catalog.extract.ProductExtractionTask;
import com.example.catalog.extract.ProductRecord;
import com.example.catalog.sink.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Crawls the whole catalog:
 *
 * seed URLs -> category pages -> product pages -> product records -> sink.
 *
 * Each stage fans its task out over every input, waits for all units, then
 * flattens the per-input results in input order before handing them on.
 */
public class CatalogPipeline {

    private static final Logger log = LoggerFactory.getLogger(CatalogPipeline.class);

    static final String STAGE_CATEGORIES = "category discovery";
    static final String STAGE_PRODUCTS = "product discovery";
    static final String STAGE_EXTRACTION = "extraction";

    private final FanOut fanOut;
    private final CategoryDiscoveryTask categoryTask;
    private final ProductDiscoveryTask productTask;
    private final ProductExtractionTask extractionTask;
    private final RecordSink sink;
    private final PageSessionFactory sessions;
    private final Options options;

    /**
     * @param maxCategoryPages truncate stage-2 input, 0 for no limit
     * @param maxProductPages  truncate stage-3 input, 0 for no limit
     * @param shareSessions    lend one session per worker to extraction units
     */
    public record Options(FailurePolicy failurePolicy,
                          int maxCategoryPages,
                          int maxProductPages,
                          boolean shareSessions,
                          String outputFile) {
    }

    public CatalogPipeline(FanOut fanOut,
                           CategoryDiscoveryTask categoryTask,
                           ProductDiscoveryTask productTask,
                           ProductExtractionTask extractionTask,
                           RecordSink sink,
                           PageSessionFactory sessions,
                           Options options) {
        this.fanOut = fanOut;
        this.categoryTask = categoryTask;
        this.productTask = productTask;
        this.extractionTask = extractionTask;
        this.sink = sink;
        this.sessions = sessions;
        this.options = options;
    }

    public HarvestReport run(List<String> seeds) throws IOException {
        List<UnitFailure> failures = new ArrayList<>();

        log.info("Discovering categories from {} seed page(s)", seeds.size());
        List<UnitOutcome<String, List<String>>> categoryOutcomes = fanOut.map(seeds, categoryTask::findCategoryPages);
        List<List<String>> categoryLists = settle(STAGE_CATEGORIES, categoryOutcomes, failures);
        List<String> categoryPages = limit(FanOut.flatten(categoryLists), options.maxCategoryPages());
        log.info("Found {} product listing page(s)", categoryPages.size());

        List<UnitOutcome<String, List<String>>> productOutcomes = fanOut.map(categoryPages, productTask::findProductPages);
        List<List<String>> productLists = settle(STAGE_PRODUCTS, productOutcomes, failures);
        List<String> productPages = limit(FanOut.flatten(productLists), options.maxProductPages());
        log.info("Found {} product page(s)", productPages.size());

        List<ProductRecord> records = extractAll(productPages, failures);
        Path output = sink.write(options.outputFile(), records);

        return new HarvestReport(seeds.size(), categoryPages.size(), productPages.size(),
                records.size(), failures, output);
    }

    /**
     * Extraction only, for a product URL list gathered elsewhere.
     */
    public HarvestReport harvestProducts(List<String> productPages, String outputFile) throws IOException {
        log.info("Attempting to extract product info from {} page(s)", productPages.size());
        List<UnitFailure> failures = new ArrayList<>();
        List<ProductRecord> records = extractAll(productPages, failures);
        Path output = sink.write(outputFile, records);
        return new HarvestReport(0, 0, productPages.size(), records.size(), failures, output);
    }

    private List<ProductRecord> extractAll(List<String> productPages, List<UnitFailure> failures) {
        if (!options.shareSessions()) {
            List<UnitOutcome<String, ProductRecord>> outcomes =
                    fanOut.map(productPages, url -> extractionTask.extract(url));
            return settle(STAGE_EXTRACTION, outcomes, failures);
        }
        // this stage owns the shared sessions; units only borrow them
        try (WorkerSessions shared = new WorkerSessions(sessions)) {
            List<UnitOutcome<String, ProductRecord>> outcomes =
                    fanOut.map(productPages, url -> extractionTask.extract(url, shared::current));
            return settle(STAGE_EXTRACTION, outcomes, failures);
        }
    }

    private <I, O> List<O> settle(String stage, List<UnitOutcome<I, O>> outcomes, List<UnitFailure> failures) {
        List<O> values = new ArrayList<>(outcomes.size());
        List<UnitFailure> stageFailures = new ArrayList<>();
        for (UnitOutcome<I, O> outcome : outcomes) {
            if (outcome.isSuccess()) {
                values.add(outcome.value());
            } else {
                stageFailures.add(UnitFailure.of(stage, outcome));
            }
        }

        if (stageFailures.isEmpty()) {
            return values;
        }
        if (options.failurePolicy() == FailurePolicy.ABORT) {
            throw new PipelineException(stage, stageFailures);
        }
        for (UnitFailure failure : stageFailures) {
            log.warn("Dropping {} unit {}: {}", stage, failure.input(), failure.message());
        }
        failures.addAll(stageFailures);
        return values;
    }

    private static <T> List<T> limit(List<T> items, int max) {
        if (max <= 0 || items.size() <= max) {
            return items;
        }
        return new ArrayList<>(items.subList(0, max));
    }
}
