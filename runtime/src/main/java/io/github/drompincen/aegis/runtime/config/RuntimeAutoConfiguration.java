package io.github.drompincen.aegis.runtime.config;

import io.github.drompincen.aegis.runtime.monitor.DecisionObserver;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registered through {@code AutoConfiguration.imports}, so it is evaluated after
 * the application's own configuration and the NOOP observer only exists when
 * the application defines none.
 */
@AutoConfiguration
@EnableConfigurationProperties(ApprovalProperties.class)
public class RuntimeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    DecisionObserver decisionObserver() {
        return DecisionObserver.NOOP;
    }
}
