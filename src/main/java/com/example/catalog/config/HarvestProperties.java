package com.example.catalog.config;

import com.example.catalog.pipeline.FailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Harvest settings bound from the "harvest" section of application.yml.
 *
 * Defaults mirror the values the crawler has been tuned with against
 * tops.co.th, so a config file only needs the seed list.
 */
@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {

    private List<String> seeds = new ArrayList<>();
    private boolean runOnStartup = true;

    private final Output output = new Output();
    private final RateLimit rateLimit = new RateLimit();
    private final Cache cache = new Cache();
    private final Retry retry = new Retry();
    private final Stabilization stabilization = new Stabilization();
    private final Pipeline pipeline = new Pipeline();
    private final Extraction extraction = new Extraction();
    private final Browser browser = new Browser();
    private final Selectors selectors = new Selectors();

    public List<String> getSeeds() { return seeds; }
    public void setSeeds(List<String> seeds) { this.seeds = seeds; }

    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

    public Output getOutput() { return output; }
    public RateLimit getRateLimit() { return rateLimit; }
    public Cache getCache() { return cache; }
    public Retry getRetry() { return retry; }
    public Stabilization getStabilization() { return stabilization; }
    public Pipeline getPipeline() { return pipeline; }
    public Extraction getExtraction() { return extraction; }
    public Browser getBrowser() { return browser; }
    public Selectors getSelectors() { return selectors; }

    public static class Output {
        private String directory = "data";
        private String file = "products.jsonl";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    public static class RateLimit {
        private String name = "tops_website";
        private int permits = 1;
        private Duration window = Duration.ofSeconds(1);

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getPermits() { return permits; }
        public void setPermits(int permits) { this.permits = permits; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    public static class Cache {
        private Duration ttl = Duration.ofDays(1);
        private long maximumSize = 100_000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long maximumSize) { this.maximumSize = maximumSize; }
    }

    public static class Retry {
        // first attempt + one retry
        private int maxAttempts = 2;
        private Duration wait = Duration.ofSeconds(1);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getWait() { return wait; }
        public void setWait(Duration wait) { this.wait = wait; }
    }

    public static class Stabilization {
        private int ringSize = 3;
        private int growStepsPerRound = 3;
        private int scrollDelta = 300;
        private Duration initialDelay = Duration.ofMillis(3_000);
        private Duration stepDelay = Duration.ofMillis(500);
        private Duration settleDelay = Duration.ofMillis(2_000);
        private Duration maxWait = Duration.ofMinutes(5);

        public int getRingSize() { return ringSize; }
        public void setRingSize(int ringSize) { this.ringSize = ringSize; }

        public int getGrowStepsPerRound() { return growStepsPerRound; }
        public void setGrowStepsPerRound(int growStepsPerRound) { this.growStepsPerRound = growStepsPerRound; }

        public int getScrollDelta() { return scrollDelta; }
        public void setScrollDelta(int scrollDelta) { this.scrollDelta = scrollDelta; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public Duration getStepDelay() { return stepDelay; }
        public void setStepDelay(Duration stepDelay) { this.stepDelay = stepDelay; }

        public Duration getSettleDelay() { return settleDelay; }
        public void setSettleDelay(Duration settleDelay) { this.settleDelay = settleDelay; }

        public Duration getMaxWait() { return maxWait; }
        public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }
    }

    public static class Pipeline {
        private int workers = 4;
        private FailurePolicy failurePolicy = FailurePolicy.ABORT;
        private Duration categorySettleDelay = Duration.ofMillis(5_000);
        // 0 = no limit
        private int maxCategoryPages = 0;
        private int maxProductPages = 0;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public FailurePolicy getFailurePolicy() { return failurePolicy; }
        public void setFailurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }

        public Duration getCategorySettleDelay() { return categorySettleDelay; }
        public void setCategorySettleDelay(Duration categorySettleDelay) { this.categorySettleDelay = categorySettleDelay; }

        public int getMaxCategoryPages() { return maxCategoryPages; }
        public void setMaxCategoryPages(int maxCategoryPages) { this.maxCategoryPages = maxCategoryPages; }

        public int getMaxProductPages() { return maxProductPages; }
        public void setMaxProductPages(int maxProductPages) { this.maxProductPages = maxProductPages; }
    }

    public static class Extraction {
        private Duration detailsTimeout = Duration.ofMillis(100);
        private boolean shareSessions = false;

        public Duration getDetailsTimeout() { return detailsTimeout; }
        public void setDetailsTimeout(Duration detailsTimeout) { this.detailsTimeout = detailsTimeout; }

        public boolean isShareSessions() { return shareSessions; }
        public void setShareSessions(boolean shareSessions) { this.shareSessions = shareSessions; }
    }

    public static class Browser {
        private boolean headless = true;
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private String locale = "en-US";

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }

        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }

        public String getLocale() { return locale; }
        public void setLocale(String locale) { this.locale = locale; }
    }

    /**
     * CSS selectors for the three page types the crawler visits.
     */
    public static class Selectors {
        private String categoryCarousel = "div .plp-carousels div .plp-carousel";
        private String categoryLink = ".plp-carousel__link";
        private String productItem = ".product-item-inner-wrap";
        private String productName = ".product-Details-name .product-tile__name";
        private String productImage = ".img-zoom-container img";
        private String productSku = ".product-Details-sku";
        private String productDetails = ".accordion-item-product-details .accordion-body";
        private String productPrice = ".product-Details-current-price";
        private String productLabel = ".product-Details-common-description img:not(.product-Details-ui.image)";

        public String getCategoryCarousel() { return categoryCarousel; }
        public void setCategoryCarousel(String categoryCarousel) { this.categoryCarousel = categoryCarousel; }

        public String getCategoryLink() { return categoryLink; }
        public void setCategoryLink(String categoryLink) { this.categoryLink = categoryLink; }

        public String getProductItem() { return productItem; }
        public void setProductItem(String productItem) { this.productItem = productItem; }

        public String getProductName() { return productName; }
        public void setProductName(String productName) { this.productName = productName; }

        public String getProductImage() { return productImage; }
        public void setProductImage(String productImage) { this.productImage = productImage; }

        public String getProductSku() { return productSku; }
        public void setProductSku(String productSku) { this.productSku = productSku; }

        public String getProductDetails() { return productDetails; }
        public void setProductDetails(String productDetails) { this.productDetails = productDetails; }

        public String getProductPrice() { return productPrice; }
        public void setProductPrice(String productPrice) { this.productPrice = productPrice; }

        public String getProductLabel() { return productLabel; }
        public void setProductLabel(String productLabel) { this.productLabel = productLabel; }
    }
}
