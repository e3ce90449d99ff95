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

package com.plughub.resolver.inmemory;

import com.plughub.resolver.config.DescriptorResolverConfiguration;
import com.plughub.resolver.config.DescriptorResolverProperties;
import com.plughub.resolver.manifest.ManifestRegistrar;
import com.plughub.resolver.manifest.ManifestStore;
import com.plughub.resolver.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Auto-configuration for the in-memory descriptor resolver.
 * <p>
 * Wires the core resolver components and adds:
 * - {@link InMemoryResolutionEvents}: bounded diagnostic history, picked up by the composite events bean
 * - {@link InMemoryManifestStore}: a manifest that lives as long as the application context
 * - {@link ManifestRegistrar} over whichever {@link ManifestStore} is present
 * <p>
 * Suitable for development, tests and hosts that keep descriptor enablement elsewhere.
 */
@AutoConfiguration
@EnableConfigurationProperties(InMemoryResolverProperties.class)
@Import(DescriptorResolverConfiguration.class)
public class InMemoryResolverAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResolverAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(InMemoryResolutionEvents.class)
    @ConditionalOnProperty(prefix = "plughub.resolver.inmemory.events", name = "enabled", havingValue = "true", matchIfMissing = true)
    public InMemoryResolutionEvents inMemoryResolutionEvents(InMemoryResolverProperties properties) {
        log.info(JsonUtils.json(
                "event", "creating_inmemory_resolution_events",
                "component", "descriptor_resolver",
                "log_details", properties.getEvents().isLogDetails(),
                "max_events_in_memory", properties.getEvents().getMaxEventsInMemory()
        ));
        return new InMemoryResolutionEvents(properties.getEvents());
    }

    @Bean
    @ConditionalOnMissingBean(ManifestStore.class)
    @ConditionalOnProperty(prefix = "plughub.resolver.inmemory.manifest", name = "enabled", havingValue = "true", matchIfMissing = true)
    public InMemoryManifestStore inMemoryManifestStore() {
        log.info(JsonUtils.json(
                "event", "creating_inmemory_manifest_store",
                "component", "descriptor_resolver",
                "implementation", "InMemoryManifestStore"
        ));
        return new InMemoryManifestStore();
    }

    @Bean
    @ConditionalOnBean(ManifestStore.class)
    @ConditionalOnMissingBean(ManifestRegistrar.class)
    public ManifestRegistrar manifestRegistrar(ManifestStore store, DescriptorResolverProperties properties) {
        return new ManifestRegistrar(store, properties.getManifest().isDefaultEnabled());
    }
}
