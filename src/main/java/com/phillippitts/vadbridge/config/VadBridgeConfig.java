package com.phillippitts.vadbridge.config;

import com.phillippitts.vadbridge.service.boundary.DefaultVadBridge;
import com.phillippitts.vadbridge.service.boundary.UnsupportedPlatformVadBridge;
import com.phillippitts.vadbridge.service.boundary.VadBridge;
import com.phillippitts.vadbridge.service.dispatch.DispatchBridge;
import com.phillippitts.vadbridge.service.dispatch.DispatchMetrics;
import com.phillippitts.vadbridge.service.engine.EnergyModelLoader;
import com.phillippitts.vadbridge.service.engine.FrameVadEngine;
import com.phillippitts.vadbridge.service.engine.SpeechProbabilityModelLoader;
import com.phillippitts.vadbridge.service.engine.VadEngineFactory;
import com.phillippitts.vadbridge.service.event.PayloadLedger;
import com.phillippitts.vadbridge.service.host.JvmHostRuntime;
import com.phillippitts.vadbridge.service.host.ThreadAttachmentManager;
import com.phillippitts.vadbridge.service.registry.SessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the bridge's singleton graph.
 *
 * <p>Process-wide entry points are resolved once here: the host runtime is bootstrapped as the
 * bean's init method, before any session exists. {@code vad.bridge.enabled=false} replaces the
 * bridge with {@link UnsupportedPlatformVadBridge}.
 */
@Configuration
public class VadBridgeConfig {

    @Bean(initMethod = "bootstrap", destroyMethod = "shutdown")
    public JvmHostRuntime hostRuntime() {
        return new JvmHostRuntime();
    }

    @Bean
    public ThreadAttachmentManager threadAttachmentManager(JvmHostRuntime hostRuntime) {
        return new ThreadAttachmentManager(hostRuntime);
    }

    @Bean
    public PayloadLedger payloadLedger() {
        return new PayloadLedger();
    }

    @Bean(destroyMethod = "close")
    public SessionRegistry sessionRegistry(VadBridgeProperties properties) {
        return new SessionRegistry(properties.getMaxSessions());
    }

    @Bean
    public DispatchMetrics dispatchMetrics(MeterRegistry meterRegistry,
                                           PayloadLedger payloadLedger,
                                           SessionRegistry sessionRegistry) {
        return new DispatchMetrics(meterRegistry, payloadLedger, sessionRegistry);
    }

    @Bean
    public DispatchBridge dispatchBridge(ThreadAttachmentManager threadAttachmentManager,
                                         PayloadLedger payloadLedger,
                                         DispatchMetrics dispatchMetrics) {
        return new DispatchBridge(threadAttachmentManager, payloadLedger, dispatchMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechProbabilityModelLoader speechProbabilityModelLoader(VadBridgeProperties properties) {
        return new EnergyModelLoader(properties.getEnergyThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    public VadEngineFactory vadEngineFactory(SpeechProbabilityModelLoader modelLoader) {
        return () -> new FrameVadEngine(modelLoader);
    }

    @Bean
    @ConditionalOnProperty(name = "vad.bridge.enabled", havingValue = "true", matchIfMissing = true)
    public VadBridge vadBridge(SessionRegistry sessionRegistry,
                               ThreadAttachmentManager threadAttachmentManager,
                               DispatchBridge dispatchBridge,
                               VadEngineFactory vadEngineFactory,
                               ApplicationEventPublisher publisher,
                               VadBridgeProperties properties) {
        return new DefaultVadBridge(sessionRegistry, threadAttachmentManager, dispatchBridge,
                vadEngineFactory, publisher, properties.getDefaultModelPath());
    }

    @Bean
    @ConditionalOnProperty(name = "vad.bridge.enabled", havingValue = "false")
    public VadBridge unsupportedPlatformVadBridge() {
        return new UnsupportedPlatformVadBridge();
    }
}
