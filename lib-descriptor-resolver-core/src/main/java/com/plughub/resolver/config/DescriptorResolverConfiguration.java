/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.plughub.resolver.config;

import com.plughub.resolver.aggregation.DescriptorAggregator;
import com.plughub.resolver.aggregation.ExtensionPoint;
import com.plughub.resolver.aggregation.ExtensionPointRegistry;
import com.plughub.resolver.aggregation.ProviderLocator;
import com.plughub.resolver.engine.DescriptorResolver;
import com.plughub.resolver.manifest.ManifestRegistrar;
import com.plughub.resolver.manifest.ManifestStore;
import com.plughub.resolver.observability.CompositeResolutionEvents;
import com.plughub.resolver.observability.ResolutionEvents;
import com.plughub.resolver.observability.ResolutionLoggerEvents;
import com.plughub.resolver.observability.ResolutionMicrometerEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.List;
import java.util.stream.Collectors;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Spring configuration that wires descriptor resolution.
 * Users typically activate it via {@link com.plughub.resolver.annotations.EnableDescriptorResolver}.
 */
@Configuration
@EnableConfigurationProperties(DescriptorResolverProperties.class)
public class DescriptorResolverConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DescriptorResolverConfiguration.class);

    @Bean
    public ResolutionLoggerEvents resolutionLoggerEvents() {
        return new ResolutionLoggerEvents();
    }

    /**
     * Fans out to every other {@link ResolutionEvents} bean: the logger, Micrometer when present,
     * and any sink an application or starter declares.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(CompositeResolutionEvents.class)
    public CompositeResolutionEvents resolutionEventsComposite(ObjectProvider<ResolutionEvents> sinks) {
        List<ResolutionEvents> delegates = sinks.orderedStream()
                .filter(e -> !(e instanceof CompositeResolutionEvents))
                .collect(Collectors.toList());
        log.info(json(
                "resolver_event", "events_configured",
                "sinks", delegates.stream().map(e -> e.getClass().getSimpleName()).collect(Collectors.joining(","))
        ));
        return new CompositeResolutionEvents(delegates);
    }

    @Bean
    public DescriptorResolver descriptorResolver(ResolutionEvents events, DescriptorResolverProperties properties) {
        log.info(json(
                "resolver_event", "resolver_configured",
                "cycle_policy", properties.getCyclePolicy()
        ));
        return new DescriptorResolver(events, properties.getCyclePolicy());
    }

    @Bean
    public ExtensionPointRegistry extensionPointRegistry(ObjectProvider<ExtensionPoint<?, ?>> extensionPoints) {
        List<ExtensionPoint<?, ?>> points = extensionPoints.orderedStream().collect(Collectors.toList());
        log.info(json(
                "resolver_event", "extension_points_registered",
                "count", points.size(),
                "names", points.stream().map(ExtensionPoint::name).collect(Collectors.joining(","))
        ));
        return new ExtensionPointRegistry(points);
    }

    @Bean
    @ConditionalOnMissingBean(ProviderLocator.class)
    public ProviderLocator providerLocator(ApplicationContext applicationContext) {
        return new ApplicationContextProviderLocator(applicationContext);
    }

    /**
     * Manifest filtering uses a {@link ManifestRegistrar} bean when one exists, otherwise one built over the
     * {@link ManifestStore} bean. Both are looked up when the aggregator is created, so stores declared by
     * the application or by a starter are seen regardless of registration order.
     */
    @Bean
    public DescriptorAggregator descriptorAggregator(ExtensionPointRegistry registry,
                                                     DescriptorResolver resolver,
                                                     ProviderLocator locator,
                                                     ObjectProvider<ManifestRegistrar> registrars,
                                                     ObjectProvider<ManifestStore> stores,
                                                     ResolutionEvents events,
                                                     DescriptorResolverProperties properties) {
        ManifestRegistrar registrar = registrars.getIfAvailable(() -> {
            ManifestStore store = stores.getIfAvailable();
            return store == null ? null : new ManifestRegistrar(store, properties.getManifest().isDefaultEnabled());
        });
        boolean filtering = properties.getManifest().isFilterEnabled();
        if (filtering && registrar == null) {
            log.warn(json(
                    "resolver_event", "manifest_filter_inactive",
                    "reason", "no_manifest_store"
            ));
        }
        return new DescriptorAggregator(registry, resolver, locator, registrar, filtering, events);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnProperty(prefix = "plughub.resolver.observability", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    static class MicrometerAutoConfig {
        @Bean
        public ResolutionMicrometerEvents resolutionMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new ResolutionMicrometerEvents(registry);
        }
    }
}
