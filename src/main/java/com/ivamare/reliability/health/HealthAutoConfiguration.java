package com.ivamare.reliability.health;

import com.ivamare.reliability.ReliabilityAutoConfiguration;
import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for reliability health indicators.
 */
@AutoConfiguration(after = ReliabilityAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "reliability", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(CircuitBreakerHealthIndicator.class)
    @ConditionalOnBean(CircuitBreakerRegistry.class)
    public CircuitBreakerHealthIndicator circuitBreakerHealthIndicator(CircuitBreakerRegistry registry) {
        return new CircuitBreakerHealthIndicator(registry);
    }

    @Bean
    @ConditionalOnMissingBean(AuditLedgerHealthIndicator.class)
    @ConditionalOnBean(AuditLedger.class)
    public AuditLedgerHealthIndicator auditLedgerHealthIndicator(AuditLedger auditLedger) {
        return new AuditLedgerHealthIndicator(auditLedger);
    }
}
