package com.example.catalog.discovery;

import com.example.catalog.browser.PageSession;
import com.example.catalog.browser.PageSessionFactory;
import com.example.catalog.stabilize.GrowingCollection;
import com.example.catalog.stabilize.StabilizationDetector;
import com.example.catalog.stabilize.StabilizationResult;
import com.example.catalog.task.RateLimiterRegistry;
import com.example.catalog.task.TaskInvoker;
import com.example.catalog.task.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Collects product page links from an infinite-scroll category listing.
 *
 * The listing only renders more items as the page is scrolled, so the task
 * scrolls until {@link StabilizationDetector} reports that the item count has
 * stopped growing (or its time budget is used up) and then reads whatever is
 * loaded.
 */
public class ProductDiscoveryTask {

    private static final Logger log = LoggerFactory.getLogger(ProductDiscoveryTask.class);

    public static final TaskSpec SPEC = TaskSpec.of("find-product-pages/v1");

    private final TaskInvoker invoker;
    private final RateLimiterRegistry limiters;
    private final String resource;
    private final PageSessionFactory sessions;
    private final StabilizationDetector detector;
    private final String itemSelector;
    private final int scrollDelta;
    private final Duration initialDelay;

    public ProductDiscoveryTask(TaskInvoker invoker,
                                RateLimiterRegistry limiters,
                                String resource,
                                PageSessionFactory sessions,
                                StabilizationDetector detector,
                                String itemSelector,
                                int scrollDelta,
                                Duration initialDelay) {
        this.invoker = invoker;
        this.limiters = limiters;
        this.resource = resource;
        this.sessions = sessions;
        this.detector = detector;
        this.itemSelector = itemSelector;
        this.scrollDelta = scrollDelta;
        this.initialDelay = initialDelay;
    }

    public List<String> findProductPages(String categoryUrl) {
        return invoker.invoke(SPEC, Map.of("on_url", categoryUrl), () -> discover(categoryUrl));
    }

    private List<String> discover(String categoryUrl) {
        limiters.acquire(resource);
        try (PageSession page = sessions.open()) {
            page.navigate(categoryUrl);
            log.info("Scraping product links from: {}", categoryUrl);

            // let the first batch of items render
            page.waitFor(initialDelay);

            StabilizationResult<List<String>> result = detector.awaitStable(new ScrolledListing(page));
            log.info("{}: {} product link(s) ({})", categoryUrl, result.collection().size(),
                    result.plateaued() ? "stable" : "time budget reached");
            return result.collection();
        }
    }

    private final class ScrolledListing implements GrowingCollection<List<String>> {

        private final PageSession page;

        ScrolledListing(PageSession page) {
            this.page = page;
        }

        @Override
        public void grow() {
            page.scroll(scrollDelta);
        }

        @Override
        public int size() {
            return page.count(itemSelector);
        }

        @Override
        public List<String> realize() {
            return List.copyOf(Hrefs.resolveAll(page.currentUrl(), page.attributes(itemSelector, "href")));
        }
    }
}
