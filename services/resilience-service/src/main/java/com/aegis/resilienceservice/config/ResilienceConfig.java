package com.aegis.resilienceservice.config;

import com.aegis.observability.AlertHandler;
import com.aegis.resilience.ResilienceContext;
import com.aegis.resilience.ResilienceMetrics;
import com.aegis.resilience.service.ServiceLifecycleManager;
import com.aegis.resilience.service.ServiceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link ResilienceContext} from {@link ResilienceProperties}.
 *
 * <p>Applications may contribute a {@link ServiceRegistry}, a {@link ServiceLifecycleManager},
 * a {@link Clock} and any number of {@link AlertHandler} beans; each is optional. The context is
 * shut down with the application context.
 */
@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public ResilienceMetrics resilienceMetrics(MeterRegistry meterRegistry) {
        return new ResilienceMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "shutdown")
    public ResilienceContext resilienceContext(
            ResilienceProperties properties,
            ResilienceMetrics metrics,
            ObjectProvider<ServiceRegistry> serviceRegistry,
            ObjectProvider<ServiceLifecycleManager> lifecycleManager,
            ObjectProvider<Clock> clock,
            ObjectProvider<AlertHandler> alertHandlers) {
        ResilienceProperties.Monitor monitor = properties.monitor();
        ResilienceContext.Builder builder =
                ResilienceContext.builder()
                        .circuitBreaker(properties.circuitBreaker().toConfig())
                        .thresholds(monitor.thresholds().toThresholds())
                        .systemCheckInterval(monitor.systemCheckInterval())
                        .degradationInterval(monitor.degradationInterval())
                        .cacheDirectory(properties.cacheDirectoryPath())
                        .metrics(metrics)
                        .clock(clock.getIfAvailable(Clock::systemUTC))
                        .serviceRegistry(serviceRegistry.getIfAvailable(ServiceRegistry::empty))
                        .lifecycleManager(lifecycleManager.getIfAvailable());
        alertHandlers.orderedStream().forEach(builder::alertHandler);
        ResilienceContext context = builder.build();

        try {
            register(context, properties);
        } catch (RuntimeException e) {
            context.shutdown();
            throw e;
        }
        if (monitor.autoStart()) {
            context.start();
            log.info("Resilience monitoring started for {} service(s)", properties.services().size());
        } else {
            log.info("Resilience monitoring auto-start disabled");
        }
        return context;
    }

    private static void register(ResilienceContext context, ResilienceProperties properties) {
        for (ResilienceProperties.ServiceDefinition service : properties.services()) {
            var check = service.toHealthCheck();
            if (check.isPresent()) {
                context.registerService(service.name(), service.classification(), check.get());
            } else {
                context.registerService(service.name(), service.classification());
            }
        }
        properties.features()
                .forEach(
                        (feature, required) ->
                                context.degradationController()
                                        .registerFeatureDependency(feature, required));
    }
}
