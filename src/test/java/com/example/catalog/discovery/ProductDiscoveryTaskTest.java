package com.example.catalog.discovery;

import com.example.catalog.browser.FakePageSession;
import com.example.catalog.stabilize.StabilizationDetector;
import com.example.catalog.stabilize.StabilizationSettings;
import com.example.catalog.task.RateLimiterRegistry;
import com.example.catalog.task.TestTasks;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class ProductDiscoveryTaskTest {

    private static final String CATEGORY = "https://shop.test/en/fresh-food/milk";
    private static final String ITEM = ".item";

    private final StabilizationDetector detector =
            new StabilizationDetector(StabilizationSettings.defaults(), duration -> { });
    private final RateLimiterRegistry limiters = Mockito.spy(TestTasks.limiters());

    @Test
    public void scrollsUntilListingStopsGrowing() {
        // every scroll loads 5 more items, up to 20
        FakePageSession page = new FakePageSession();
        page.withCount(ITEM, () -> Math.min(20, 5 + 5 * page.getScrolls()))
                .withAttributes(ITEM, "href", () -> {
                    List<String> hrefs = new ArrayList<>();
                    for (int i = 0; i < page.count(ITEM); i++) {
                        hrefs.add("/en/p/" + i);
                    }
                    return hrefs;
                });

        ProductDiscoveryTask task = new ProductDiscoveryTask(TestTasks.invoker(), limiters,
                TestTasks.RESOURCE, () -> page, detector, ITEM, 300, Duration.ofSeconds(3));

        List<String> products = task.findProductPages(CATEGORY);

        Assertions.assertEquals(20, products.size());
        Assertions.assertEquals("https://shop.test/en/p/0", products.get(0));
        Assertions.assertEquals("https://shop.test/en/p/19", products.get(19));
        Assertions.assertEquals(List.of(Duration.ofSeconds(3)), page.getWaits());
        Assertions.assertTrue(page.getScrolls() >= 3);
        Assertions.assertTrue(page.isClosed());
        // scrolling the same page takes no further permits
        Mockito.verify(limiters, Mockito.times(1)).acquire(TestTasks.RESOURCE);
    }

    @Test
    public void emptyListingYieldsNoProducts() {
        FakePageSession page = new FakePageSession();
        ProductDiscoveryTask task = new ProductDiscoveryTask(TestTasks.invoker(), limiters,
                TestTasks.RESOURCE, () -> page, detector, ITEM, 300, Duration.ZERO);

        Assertions.assertTrue(task.findProductPages(CATEGORY).isEmpty());
        Assertions.assertTrue(page.isClosed());
    }

    @Test
    public void cachedListingTakesNoPermit() {
        List<FakePageSession> opened = new ArrayList<>();
        ProductDiscoveryTask task = new ProductDiscoveryTask(TestTasks.invoker(), limiters, TestTasks.RESOURCE,
                () -> {
                    FakePageSession page = new FakePageSession()
                            .withCount(ITEM, () -> 1)
                            .withAttributes(ITEM, "href", List.of("/en/p/milk"));
                    opened.add(page);
                    return page;
                }, detector, ITEM, 300, Duration.ZERO);

        List<String> first = task.findProductPages(CATEGORY);
        List<String> second = task.findProductPages(CATEGORY);

        Assertions.assertEquals(List.of("https://shop.test/en/p/milk"), first);
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(1, opened.size());
        Mockito.verify(limiters, Mockito.times(1)).acquire(TestTasks.RESOURCE);
    }
}
