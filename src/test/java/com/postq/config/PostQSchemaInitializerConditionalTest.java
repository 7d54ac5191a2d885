package com.postq.config;

import com.postq.PostQSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class PostQSchemaInitializerConditionalTest {

    @Configuration
    @EnableConfigurationProperties(PostQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("postq.database.fail-on-migration-error=false")
            .withUserConfiguration(Config.class, PostQSchemaInitializer.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(PostQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("postq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(PostQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldFailStartupOnMigrationErrorsByDefault() {
        contextRunner.withPropertyValues("postq.database.fail-on-migration-error=true")
                .run(context -> assertTrue(context.getStartupFailure() != null));
    }
}
