package com.example.catalog.extract;

import com.example.catalog.browser.PageSession;
import com.example.catalog.browser.PageSessionFactory;
import com.example.catalog.config.HarvestProperties;
import com.example.catalog.task.RateLimiterRegistry;
import com.example.catalog.task.TaskInvoker;
import com.example.catalog.task.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Scrapes one product page into a {@link ProductRecord}.
 *
 * Field policy:
 * <ul>
 *   <li>name, sku, price: mandatory; a page that lacks them fails the task,
 *       and a price that does not parse fails it too</li>
 *   <li>barcode: null unless the sku ends in a valid EAN-13</li>
 *   <li>details: optional, read with a short timeout, null when missing</li>
 *   <li>images, labels: whatever is on the page, in page order</li>
 * </ul>
 *
 * The session argument is excluded from the fingerprint, so a product is
 * cached the same way whether or not the caller lends a session.
 */
public class ProductExtractionTask {

    private static final Logger log = LoggerFactory.getLogger(ProductExtractionTask.class);

    public static final TaskSpec SPEC = TaskSpec.of("extract-product-info/v1", "session");

    private final TaskInvoker invoker;
    private final RateLimiterRegistry limiters;
    private final String resource;
    private final PageSessionFactory sessions;
    private final HarvestProperties.Selectors selectors;
    private final Duration detailsTimeout;

    public ProductExtractionTask(TaskInvoker invoker,
                                 RateLimiterRegistry limiters,
                                 String resource,
                                 PageSessionFactory sessions,
                                 HarvestProperties.Selectors selectors,
                                 Duration detailsTimeout) {
        this.invoker = invoker;
        this.limiters = limiters;
        this.resource = resource;
        this.sessions = sessions;
        this.selectors = selectors;
        this.detailsTimeout = detailsTimeout;
    }

    /**
     * Extracts on a session of its own, closed before returning.
     */
    public ProductRecord extract(String url) {
        return invoker.invoke(SPEC, Map.of("on_url", url), () -> {
            try (PageSession page = sessions.open()) {
                return scrape(url, page);
            }
        });
    }

    /**
     * Extracts on a caller-owned session, fetched only when the page is really
     * scraped. The session is left open.
     */
    public ProductRecord extract(String url, Supplier<? extends PageSession> session) {
        Objects.requireNonNull(session, "session");
        return invoker.invoke(SPEC, Map.of("on_url", url, "session", session), () -> scrape(url, session.get()));
    }

    ProductRecord scrape(String url, PageSession page) {
        limiters.acquire(resource);
        log.info("Extracting product data from: {}", url);
        page.navigate(url);

        ProductRecordAssembler record = new ProductRecordAssembler(url);

        String rawName = page.text(selectors.getProductName()).strip();
        record.name(FieldResult.present("name", ProductTextParser.splitNameAndQuantity(rawName)));

        List<String> images = page.attributes(selectors.getProductImage(), "src").stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        record.images(FieldResult.present("images", images));

        String sku = page.text(selectors.getProductSku());
        record.barcode(Ean13.fromSku(sku)
                .map(code -> FieldResult.present("barcode", code))
                .orElseGet(() -> FieldResult.absent("barcode", "no valid EAN-13 in sku '" + sku.strip() + "'")));

        record.details(readDetails(page));
        record.price(readPrice(page));

        List<String> labels = ProductTextParser.cleanLabels(page.attributes(selectors.getProductLabel(), "alt"));
        record.labels(FieldResult.present("labels", labels));

        return record.assemble();
    }

    private FieldResult<String> readDetails(PageSession page) {
        Optional<String> details = page.text(selectors.getProductDetails(), detailsTimeout);
        return details
                .map(text -> FieldResult.present("details", ProductTextParser.collapseWhitespace(text)))
                .orElseGet(() -> FieldResult.absent("details", "not shown within " + detailsTimeout.toMillis() + " ms"));
    }

    private FieldResult<Double> readPrice(PageSession page) {
        String text = page.text(selectors.getProductPrice());
        OptionalDouble price = ProductTextParser.parsePrice(text);
        if (price.isEmpty()) {
            return FieldResult.failed("price", "unparseable '" + text.strip() + "'");
        }
        return FieldResult.present("price", price.getAsDouble());
    }
}
