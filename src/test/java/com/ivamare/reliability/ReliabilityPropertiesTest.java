package com.ivamare.reliability;

import com.ivamare.reliability.batching.BatchingSettings;
import com.ivamare.reliability.breaker.CircuitBreakerConfig;
import com.ivamare.reliability.job.JobSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReliabilityProperties")
class ReliabilityPropertiesTest {

    @Test
    @DisplayName("should have default values")
    void shouldHaveDefaultValues() {
        ReliabilityProperties properties = new ReliabilityProperties();

        assertTrue(properties.isEnabled());
        assertNotNull(properties.getBreaker());
        assertNotNull(properties.getAudit());
        assertNotNull(properties.getBatching());
        assertNotNull(properties.getJob());
        assertNotNull(properties.getMetrics());
        assertTrue(properties.getBreaker().isLoadOnStart());
        assertFalse(properties.getMetrics().isAutoStart());
        assertFalse(properties.getMetrics().isPersistSamples());
        assertEquals(1000, properties.getMetrics().getAlertCapacity());
        assertNull(properties.getAudit().getSigningKey());
    }

    @Test
    @DisplayName("should map defaults onto the component settings")
    void shouldMapDefaultsToSettings() {
        ReliabilityProperties properties = new ReliabilityProperties();

        assertEquals(CircuitBreakerConfig.defaults(), properties.getBreaker().toConfig());
        assertEquals(BatchingSettings.defaults(), properties.getBatching().toSettings());
        assertEquals(JobSettings.defaults(), properties.getJob().toSettings());
    }

    @Test
    @DisplayName("should set enabled property")
    void shouldSetEnabledProperty() {
        ReliabilityProperties properties = new ReliabilityProperties();
        properties.setEnabled(false);

        assertFalse(properties.isEnabled());
    }

    @Test
    @DisplayName("should set breaker properties")
    void shouldSetBreakerProperties() {
        ReliabilityProperties.BreakerProperties breaker = new ReliabilityProperties.BreakerProperties();
        breaker.setFailureThreshold(2);
        breaker.setRecoveryTimeout(Duration.ofSeconds(15));
        breaker.setSuccessThreshold(1);

        CircuitBreakerConfig config = breaker.toConfig();

        assertEquals(2, config.failureThreshold());
        assertEquals(Duration.ofSeconds(15), config.recoveryTimeout());
        assertEquals(1, config.successThreshold());
    }

    @Test
    @DisplayName("should set batching properties")
    void shouldSetBatchingProperties() {
        ReliabilityProperties properties = new ReliabilityProperties();
        properties.getBatching().setMaxFinancialBatchValue(new BigDecimal("250000"));
        properties.getBatching().setAbortErrorRatio(0.2);

        BatchingSettings settings = properties.getBatching().toSettings();

        assertEquals(new BigDecimal("250000"), settings.maxFinancialBatchValue());
        assertEquals(0.2, settings.abortErrorRatio());
    }

    @Test
    @DisplayName("should set prediction weights")
    void shouldSetPredictionWeights() {
        ReliabilityProperties properties = new ReliabilityProperties();
        properties.getJob().getPrediction().setNetworkWeight(40);
        properties.getJob().getPrediction().setRiskFloor(10);

        JobSettings settings = properties.getJob().toSettings();

        assertEquals(40, settings.prediction().networkWeight());
        assertEquals(10, settings.prediction().riskFloor());
    }
}
