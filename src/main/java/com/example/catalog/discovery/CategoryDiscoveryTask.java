package com.example.catalog.discovery;

import com.example.catalog.browser.PageSession;
import com.example.catalog.browser.PageSessionFactory;
import com.example.catalog.task.RateLimiterRegistry;
import com.example.catalog.task.TaskInvoker;
import com.example.catalog.task.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Finds the category listing pages linked from a navigation (seed) page.
 */
public class CategoryDiscoveryTask {

    private static final Logger log = LoggerFactory.getLogger(CategoryDiscoveryTask.class);

    public static final TaskSpec SPEC = TaskSpec.of("find-category-pages/v1");

    private final TaskInvoker invoker;
    private final RateLimiterRegistry limiters;
    private final String resource;
    private final PageSessionFactory sessions;
    private final String carouselSelector;
    private final String linkSelector;
    private final Duration settleDelay;

    public CategoryDiscoveryTask(TaskInvoker invoker,
                                 RateLimiterRegistry limiters,
                                 String resource,
                                 PageSessionFactory sessions,
                                 String carouselSelector,
                                 String linkSelector,
                                 Duration settleDelay) {
        this.invoker = invoker;
        this.limiters = limiters;
        this.resource = resource;
        this.sessions = sessions;
        this.carouselSelector = carouselSelector;
        this.linkSelector = linkSelector;
        this.settleDelay = settleDelay;
    }

    public List<String> findCategoryPages(String seedUrl) {
        return invoker.invoke(SPEC, Map.of("on_url", seedUrl), () -> discover(seedUrl));
    }

    private List<String> discover(String seedUrl) {
        limiters.acquire(resource);
        try (PageSession page = sessions.open()) {
            page.navigate(seedUrl);
            log.info("Finding category pages on: {}", seedUrl);

            page.waitForSelector(carouselSelector);
            // carousels keep filling in after the container shows up
            page.waitFor(settleDelay);

            List<String> links = Hrefs.resolveAll(page.currentUrl(), page.attributes(linkSelector, "href"));
            log.info("Found {} category page(s) on {}", links.size(), seedUrl);
            return List.copyOf(links);
        }
    }
}
