package com.postq.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostQPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(PostQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultPostqProperties() {
        contextRunner.run(context -> {
            PostQProperties properties = context.getBean(PostQProperties.class);
            assertTrue(properties.getScheduler().isEnabled());
            assertEquals(5, properties.getScheduler().getPollIntervalInSeconds());
            assertEquals(25, properties.getScheduler().getBatchSize());
            assertTrue(properties.getScheduler().getJobConcurrency() >= 2);
            assertEquals("10m", properties.getScheduler().getLeaseDuration());
            assertEquals("30s", properties.getScheduler().getShutdownGracePeriod());
            assertEquals(10, properties.getScheduler().getMaxConsecutiveStoreFailures());
            assertEquals("30d", properties.getScheduler().getDeleteDeliveriesAfter());
            assertEquals(4, properties.getDelivery().getConcurrency());
            assertEquals(3, properties.getDelivery().getMaxAttempts());
            assertEquals(1000, properties.getDelivery().getInitialBackoffMs());
            assertEquals(2.0, properties.getDelivery().getBackoffMultiplier());
            assertEquals(350, properties.getDelivery().getMinDelayBetweenSendsMs());
            assertEquals(10, properties.getDelivery().getMaxImagesPerMessage());
            assertEquals("America/Los_Angeles", properties.getDefaults().getTimeZone());
            assertFalse(properties.getDatabase().isSkipCreate());
            assertTrue(properties.getDatabase().isFailOnMigrationError());
        });
    }

    @Test
    void shouldMapCustomPostqProperties() {
        contextRunner
                .withPropertyValues(
                        "postq.scheduler.enabled=false",
                        "postq.scheduler.poll-interval-in-seconds=1",
                        "postq.scheduler.batch-size=5",
                        "postq.scheduler.job-concurrency=8",
                        "postq.scheduler.lease-duration=PT2M",
                        "postq.scheduler.delete-deliveries-after=7d",
                        "postq.delivery.concurrency=1",
                        "postq.delivery.max-attempts=5",
                        "postq.delivery.min-delay-between-sends-ms=0",
                        "postq.defaults.time-zone=Europe/Berlin",
                        "postq.database.skip-create=true",
                        "postq.database.fail-on-migration-error=false")
                .run(context -> {
                    PostQProperties properties = context.getBean(PostQProperties.class);
                    assertFalse(properties.getScheduler().isEnabled());
                    assertEquals(1, properties.getScheduler().getPollIntervalInSeconds());
                    assertEquals(5, properties.getScheduler().getBatchSize());
                    assertEquals(8, properties.getScheduler().getJobConcurrency());
                    assertEquals("PT2M", properties.getScheduler().getLeaseDuration());
                    assertEquals("7d", properties.getScheduler().getDeleteDeliveriesAfter());
                    assertEquals(1, properties.getDelivery().getConcurrency());
                    assertEquals(5, properties.getDelivery().getMaxAttempts());
                    assertEquals(0, properties.getDelivery().getMinDelayBetweenSendsMs());
                    assertEquals("Europe/Berlin", properties.getDefaults().getTimeZone());
                    assertTrue(properties.getDatabase().isSkipCreate());
                    assertFalse(properties.getDatabase().isFailOnMigrationError());
                });
    }
}
