package com.document.verification.cdi;

import com.document.verification.api.AsyncVerifier;
import com.document.verification.api.VerificationEngine;
import com.document.verification.api.VerificationOptions;
import com.document.verification.metrics.MetricsService;
import com.document.verification.metrics.MicrometerMetricsService;
import com.document.verification.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VerificationProducerTest {

    private VerificationProducer producer;

    @Mock
    private Instance<MeterRegistry> meterRegistry;

    @BeforeEach
    void setUp() {
        producer = new VerificationProducer();
        producer.fieldParallelism = 2;
        producer.parallelThreshold = 8;
        producer.asyncTimeoutMs = 5_000;
        producer.maxBatchSize = 50;
        producer.metricsEnabled = true;
        producer.meterRegistry = meterRegistry;
    }

    @Test
    @DisplayName("Should build options from config properties")
    void testOptions() {
        VerificationOptions options = producer.verificationOptions();

        assertEquals(2, options.getFieldParallelism());
        assertEquals(8, options.getParallelThreshold());
        assertEquals(5_000, options.getAsyncTimeoutMs());
        assertEquals(50, options.getMaxBatchSize());
    }

    @Test
    @DisplayName("Should use Micrometer when a registry is available")
    void testMicrometerMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        when(meterRegistry.isResolvable()).thenReturn(true);
        when(meterRegistry.get()).thenReturn(registry);

        MetricsService metrics = producer.metricsService();

        assertInstanceOf(MicrometerMetricsService.class, metrics);
        assertNotNull(registry.find("verification.duration").timer());
    }

    @Test
    @DisplayName("Should fall back to no-op metrics without a registry")
    void testNoRegistry() {
        when(meterRegistry.isResolvable()).thenReturn(false);

        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("Should use no-op metrics when disabled")
    void testMetricsDisabled() {
        producer.metricsEnabled = false;

        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        verifyNoInteractions(meterRegistry);
    }

    @Test
    @DisplayName("Produced engine and async verifier work end to end")
    void testEngineWiring() throws Exception {
        VerificationEngine engine = producer.verificationEngine(producer.verificationOptions(), new NoOpMetricsService());
        AsyncVerifier async = producer.asyncVerifier(engine);
        try {
            assertEquals(2, engine.getOptions().getFieldParallelism());
            assertEquals(1, engine.verify(Map.of("a", "x"), Map.of("a", "x")).matchedFields());
        } finally {
            producer.closeAsyncVerifier(async);
            producer.closeEngine(engine);
        }
    }
}
