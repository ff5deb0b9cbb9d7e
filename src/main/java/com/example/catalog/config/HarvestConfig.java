package com.example.catalog.config;

import com.example.catalog.browser.PageSessionFactory;
import com.example.catalog.browser.PlaywrightSessionFactory;
import com.example.catalog.discovery.CategoryDiscoveryTask;
import com.example.catalog.discovery.ProductDiscoveryTask;
import com.example.catalog.extract.ProductExtractionTask;
import com.example.catalog.pipeline.CatalogPipeline;
import com.example.catalog.pipeline.FanOut;
import com.example.catalog.sink.JsonLinesSink;
import com.example.catalog.sink.RecordSink;
import com.example.catalog.stabilize.Sleeper;
import com.example.catalog.stabilize.StabilizationDetector;
import com.example.catalog.stabilize.StabilizationSettings;
import com.example.catalog.task.Fingerprinter;
import com.example.catalog.task.RateLimitPolicy;
import com.example.catalog.task.RateLimiterRegistry;
import com.example.catalog.task.TaskCache;
import com.example.catalog.task.TaskInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Spring configuration that wires the crawler components as beans.
 */
@Configuration
@EnableConfigurationProperties(HarvestProperties.class)
public class HarvestConfig {

    @Bean
    public PageSessionFactory pageSessionFactory(HarvestProperties props) {
        HarvestProperties.Browser browser = props.getBrowser();
        return new PlaywrightSessionFactory(browser.isHeadless(), browser.getDefaultTimeout(), browser.getLocale());
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry(HarvestProperties props) {
        HarvestProperties.RateLimit rateLimit = props.getRateLimit();
        return new RateLimiterRegistry()
                .register(rateLimit.getName(), new RateLimitPolicy(rateLimit.getPermits(), rateLimit.getWindow()));
    }

    @Bean
    public TaskInvoker taskInvoker(HarvestProperties props) {
        HarvestProperties.Retry retry = props.getRetry();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .waitDuration(retry.getWait())
                .build();
        TaskCache cache = new TaskCache(props.getCache().getTtl(), props.getCache().getMaximumSize());
        return new TaskInvoker(cache, new Fingerprinter(), retryConfig);
    }

    @Bean
    public StabilizationDetector stabilizationDetector(HarvestProperties props) {
        HarvestProperties.Stabilization s = props.getStabilization();
        StabilizationSettings settings = new StabilizationSettings(
                s.getRingSize(), s.getGrowStepsPerRound(), s.getStepDelay(), s.getSettleDelay(), s.getMaxWait());
        return new StabilizationDetector(settings, Sleeper.threadSleep());
    }

    @Bean
    public CategoryDiscoveryTask categoryDiscoveryTask(HarvestProperties props,
                                                       TaskInvoker invoker,
                                                       RateLimiterRegistry limiters,
                                                       PageSessionFactory sessions) {
        return new CategoryDiscoveryTask(invoker, limiters, props.getRateLimit().getName(), sessions,
                props.getSelectors().getCategoryCarousel(),
                props.getSelectors().getCategoryLink(),
                props.getPipeline().getCategorySettleDelay());
    }

    @Bean
    public ProductDiscoveryTask productDiscoveryTask(HarvestProperties props,
                                                     TaskInvoker invoker,
                                                     RateLimiterRegistry limiters,
                                                     PageSessionFactory sessions,
                                                     StabilizationDetector detector) {
        return new ProductDiscoveryTask(invoker, limiters, props.getRateLimit().getName(), sessions, detector,
                props.getSelectors().getProductItem(),
                props.getStabilization().getScrollDelta(),
                props.getStabilization().getInitialDelay());
    }

    @Bean
    public ProductExtractionTask productExtractionTask(HarvestProperties props,
                                                       TaskInvoker invoker,
                                                       RateLimiterRegistry limiters,
                                                       PageSessionFactory sessions) {
        return new ProductExtractionTask(invoker, limiters, props.getRateLimit().getName(), sessions,
                props.getSelectors(), props.getExtraction().getDetailsTimeout());
    }

    @Bean
    public RecordSink recordSink(HarvestProperties props) {
        return new JsonLinesSink(Paths.get(props.getOutput().getDirectory()), new ObjectMapper());
    }

    @Bean
    public FanOut fanOut(HarvestProperties props) {
        return new FanOut(props.getPipeline().getWorkers());
    }

    @Bean
    public CatalogPipeline catalogPipeline(HarvestProperties props,
                                           FanOut fanOut,
                                           CategoryDiscoveryTask categoryTask,
                                           ProductDiscoveryTask productTask,
                                           ProductExtractionTask extractionTask,
                                           RecordSink sink,
                                           PageSessionFactory sessions) {
        CatalogPipeline.Options options = new CatalogPipeline.Options(
                props.getPipeline().getFailurePolicy(),
                props.getPipeline().getMaxCategoryPages(),
                props.getPipeline().getMaxProductPages(),
                props.getExtraction().isShareSessions(),
                props.getOutput().getFile());
        return new CatalogPipeline(fanOut, categoryTask, productTask, extractionTask, sink, sessions, options);
    }
}
