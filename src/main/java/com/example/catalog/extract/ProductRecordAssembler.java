package com.example.catalog.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects per-field results for one page and turns them into a record, or
 * into an {@link ExtractionException} when any mandatory field failed.
 */
public class ProductRecordAssembler {

    private static final Logger log = LoggerFactory.getLogger(ProductRecordAssembler.class);

    private final String storeUrl;
    private final List<FieldResult<?>> results = new ArrayList<>();

    private FieldResult<NameAndQuantity> name;
    private FieldResult<Double> price;
    private FieldResult<List<String>> images = FieldResult.present("images", List.of());
    private FieldResult<String> barcode = FieldResult.absent("barcode", "not read");
    private FieldResult<String> details = FieldResult.absent("details", "not read");
    private FieldResult<List<String>> labels = FieldResult.present("labels", List.of());

    public ProductRecordAssembler(String storeUrl) {
        this.storeUrl = storeUrl;
    }

    public ProductRecordAssembler name(FieldResult<NameAndQuantity> name) {
        this.name = track(name);
        return this;
    }

    public ProductRecordAssembler price(FieldResult<Double> price) {
        this.price = track(price);
        return this;
    }

    public ProductRecordAssembler images(FieldResult<List<String>> images) {
        this.images = track(images);
        return this;
    }

    public ProductRecordAssembler barcode(FieldResult<String> barcode) {
        this.barcode = track(barcode);
        return this;
    }

    public ProductRecordAssembler details(FieldResult<String> details) {
        this.details = track(details);
        return this;
    }

    public ProductRecordAssembler labels(FieldResult<List<String>> labels) {
        this.labels = track(labels);
        return this;
    }

    public ProductRecord assemble() {
        List<FieldResult<?>> failures = new ArrayList<>();
        requirePresent("name", name, failures);
        requirePresent("price", price, failures);
        for (FieldResult<?> result : results) {
            if (result.isFailed()) {
                failures.add(result);
            } else if (result.status() == FieldResult.Status.ABSENT) {
                log.debug("{}: {}", storeUrl, result);
            }
        }
        if (!failures.isEmpty()) {
            throw new ExtractionException(storeUrl, failures);
        }

        NameAndQuantity nq = name.valueOrNull();
        return new ProductRecord(
                nq.name(),
                nq.quantity(),
                price.valueOrNull(),
                orEmpty(images.valueOrNull()),
                barcode.valueOrNull(),
                orEmpty(labels.valueOrNull()),
                storeUrl,
                details.valueOrNull()
        );
    }

    // FAILED results are already collected from the tracked list
    private static void requirePresent(String field, FieldResult<?> result, List<FieldResult<?>> failures) {
        if (result == null) {
            failures.add(FieldResult.failed(field, "not read"));
        } else if (result.status() == FieldResult.Status.ABSENT) {
            failures.add(FieldResult.failed(field, "missing: " + result.reason()));
        }
    }

    private <T> FieldResult<T> track(FieldResult<T> result) {
        results.add(result);
        return result;
    }

    private static List<String> orEmpty(List<String> list) {
        return list == null ? List.of() : list;
    }
}
