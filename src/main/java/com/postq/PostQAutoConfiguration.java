package com.postq;

import com.postq.config.PostQProperties;
import com.postq.internal.ExitingFatalErrorHandler;
import com.postq.internal.FatalErrorHandler;
import com.postq.internal.PostQMetrics;
import com.postq.internal.UnconfiguredMessageTransport;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@AutoConfiguration(
        beforeName = "org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration",
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage(basePackages = "com.postq")
@ComponentScan("com.postq")
@EnableScheduling
@EnableConfigurationProperties(PostQProperties.class)
public class PostQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MessageTransport.class)
    public MessageTransport postqMessageTransport() {
        return new UnconfiguredMessageTransport();
    }

    @Bean
    @ConditionalOnMissingBean(FatalErrorHandler.class)
    public FatalErrorHandler postqFatalErrorHandler(ApplicationContext applicationContext) {
        return new ExitingFatalErrorHandler(applicationContext);
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public PostQMetrics postqMetrics(ScheduledMessageRepository messageRepository, MeterRegistry meterRegistry) {
        return new PostQMetrics(messageRepository, meterRegistry);
    }
}
