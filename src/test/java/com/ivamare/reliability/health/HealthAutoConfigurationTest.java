package com.ivamare.reliability.health;

import com.ivamare.reliability.ReliabilityAutoConfiguration;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ReliabilityAutoConfiguration.class, HealthAutoConfiguration.class))
        .withUserConfiguration(MockJdbcConfig.class);

    @Test
    @DisplayName("should create health indicators when enabled")
    void shouldCreateHealthIndicatorsWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CircuitBreakerHealthIndicator.class);
            assertThat(context).hasSingleBean(AuditLedgerHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should not create health indicators when disabled")
    void shouldNotCreateHealthIndicatorsWhenDisabled() {
        contextRunner
            .withPropertyValues("reliability.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(CircuitBreakerHealthIndicator.class);
                assertThat(context).doesNotHaveBean(AuditLedgerHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create indicators without the core beans")
    void shouldNotCreateIndicatorsWithoutCoreBeans() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HealthAutoConfiguration.class))
            .run(context -> {
                assertThat(context).doesNotHaveBean(CircuitBreakerHealthIndicator.class);
                assertThat(context).doesNotHaveBean(AuditLedgerHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create duplicate health indicator if one exists")
    void shouldNotCreateDuplicateHealthIndicator() {
        contextRunner
            .withUserConfiguration(CustomHealthIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(CircuitBreakerHealthIndicator.class);
                assertThat(context.getBean(CircuitBreakerHealthIndicator.class))
                    .isSameAs(CustomHealthIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class MockJdbcConfig {
        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }
    }

    @Configuration
    static class CustomHealthIndicatorConfig {
        static final CircuitBreakerHealthIndicator CUSTOM_INDICATOR =
            new CircuitBreakerHealthIndicator(mock(CircuitBreakerRegistry.class));

        @Bean
        public CircuitBreakerHealthIndicator circuitBreakerHealthIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
