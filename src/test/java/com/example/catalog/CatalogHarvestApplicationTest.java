package com.example.catalog;

import com.example.catalog.config.HarvestProperties;
import com.example.catalog.pipeline.CatalogPipeline;
import com.example.catalog.pipeline.FailurePolicy;
import com.example.catalog.task.RateLimiterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

@SpringBootTest(properties = {
        "harvest.run-on-startup=false",
        "harvest.pipeline.failure-policy=SKIP",
        "harvest.pipeline.workers=2"
})
public class CatalogHarvestApplicationTest {

    @Autowired
    private HarvestProperties props;

    @Autowired
    private RateLimiterRegistry limiters;

    @Autowired
    private ApplicationContext context;

    @Test
    public void bindsHarvestSettings() {
        Assertions.assertEquals(12, props.getSeeds().size());
        Assertions.assertEquals(FailurePolicy.SKIP, props.getPipeline().getFailurePolicy());
        Assertions.assertEquals(2, props.getPipeline().getWorkers());
        Assertions.assertEquals(Duration.ofDays(1), props.getCache().getTtl());
        Assertions.assertEquals(Duration.ofMinutes(5), props.getStabilization().getMaxWait());
        Assertions.assertEquals(Duration.ofMillis(100), props.getExtraction().getDetailsTimeout());
        Assertions.assertTrue(limiters.contains(props.getRateLimit().getName()));
    }

    @Test
    public void wiresPipelineWithoutStartingARun() {
        Assertions.assertNotNull(context.getBean(CatalogPipeline.class));
        Assertions.assertTrue(context.getBeansOfType(HarvestRunner.class).isEmpty());
    }
}
