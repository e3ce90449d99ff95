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

import com.plughub.resolver.aggregation.DescriptorAggregator;
import com.plughub.resolver.aggregation.ExtensionPoint;
import com.plughub.resolver.engine.DescriptorResolver;
import com.plughub.resolver.manifest.DescriptorManifest;
import com.plughub.resolver.manifest.ManifestRegistrar;
import com.plughub.resolver.manifest.ManifestStore;
import com.plughub.resolver.model.DescriptorReference;
import com.plughub.resolver.model.PluginDescriptor;
import com.plughub.resolver.observability.CompositeResolutionEvents;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that the in-memory auto-configuration creates the expected beans and that they take part in resolution.
 */
class InMemoryResolverAutoConfigurationTest {

    public interface MenuProvider {
        List<PluginDescriptor> menuItems();
    }

    private static final UUID PLUGIN = UUID.randomUUID();
    private static final UUID FILE_MENU = UUID.randomUUID();
    private static final UUID BROKEN_MENU = UUID.randomUUID();

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(InMemoryResolverAutoConfiguration.class));

    @Test
    void shouldCreateInMemoryBeans() {
        this.contextRunner.run(context -> {
            assertThat(context).hasSingleBean(InMemoryResolutionEvents.class);
            assertThat(context).hasSingleBean(InMemoryManifestStore.class);
            assertThat(context).hasSingleBean(ManifestRegistrar.class);
            assertThat(context).hasSingleBean(DescriptorResolver.class);
            assertThat(context.getBean(CompositeResolutionEvents.class).delegates())
                    .hasAtLeastOneElementOfType(InMemoryResolutionEvents.class);
        });
    }

    @Test
    void shouldRespectEventsEnabledProperty() {
        this.contextRunner
                .withPropertyValues("plughub.resolver.inmemory.events.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(InMemoryResolutionEvents.class));
    }

    @Test
    void shouldRespectManifestEnabledProperty() {
        this.contextRunner
                .withPropertyValues("plughub.resolver.inmemory.manifest.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ManifestStore.class);
                    assertThat(context).doesNotHaveBean(ManifestRegistrar.class);
                });
    }

    @Test
    void shouldBackOffWhenApplicationProvidesManifestStore() {
        ManifestStore custom = new InMemoryManifestStore(new DescriptorManifest());
        this.contextRunner
                .withBean("customManifestStore", ManifestStore.class, () -> custom)
                .run(context -> {
                    assertThat(context).getBean(ManifestStore.class).isSameAs(custom);
                    assertThat(context).hasSingleBean(ManifestRegistrar.class);
                });
    }

    @Test
    void shouldConfigurePropertiesCorrectly() {
        this.contextRunner
                .withPropertyValues(
                        "plughub.resolver.inmemory.events.log-details=false",
                        "plughub.resolver.inmemory.events.max-events-in-memory=5"
                )
                .run(context -> {
                    InMemoryResolverProperties properties = context.getBean(InMemoryResolverProperties.class);
                    assertThat(properties.getEvents().isLogDetails()).isFalse();
                    assertThat(properties.getEvents().getMaxEventsInMemory()).isEqualTo(5);
                    assertThat(properties.getManifest().isEnabled()).isTrue();
                });
    }

    @Test
    void shouldRecordDiagnosticsAndFilterByManifest() {
        this.contextRunner
                .withBean("menuExtensionPoint", ExtensionPoint.class,
                        () -> ExtensionPoint.forward("menu", MenuProvider.class, MenuProvider::menuItems))
                .withBean("menuProvider", MenuProvider.class, () -> () -> List.of(
                        new PluginDescriptor(PLUGIN, FILE_MENU, "1.0.0"),
                        PluginDescriptor.builder(PLUGIN, BROKEN_MENU, "1.0.0")
                                .dependsOn(DescriptorReference.anyVersion(PLUGIN, UUID.randomUUID()))
                                .build()))
                .withPropertyValues("plughub.resolver.manifest.filter-enabled=true",
                        "plughub.resolver.manifest.default-enabled=true")
                .run(context -> {
                    DescriptorAggregator aggregator = context.getBean(DescriptorAggregator.class);
                    InMemoryResolutionEvents events = context.getBean(InMemoryResolutionEvents.class);

                    List<PluginDescriptor> menu = aggregator.resolveAndOrder(MenuProvider.class);
                    assertThat(menu).extracting(PluginDescriptor::descriptorId).containsExactly(FILE_MENU);
                    assertThat(events.getRecentEvents("MISSING_DEPENDENCY"))
                            .singleElement()
                            .satisfies(e -> assertThat(e.getDescriptorId()).isEqualTo(BROKEN_MENU));

                    context.getBean(ManifestRegistrar.class).setDisabled(FILE_MENU);
                    assertThat(aggregator.resolveAndOrder(MenuProvider.class)).isEmpty();
                    assertThat(events.getRecentEvents("DISABLED")).hasSize(1);
                    assertThat(context.getBean(InMemoryManifestStore.class).getSaveCount()).isEqualTo(2);
                });
    }
}
