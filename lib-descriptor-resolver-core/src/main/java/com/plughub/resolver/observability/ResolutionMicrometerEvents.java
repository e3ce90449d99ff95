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

package com.plughub.resolver.observability;

import com.plughub.resolver.model.DescriptorReference;
import com.plughub.resolver.model.PluginDescriptor;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.List;

/**
 * Micrometer-based implementation of ResolutionEvents that counts exclusions per reason and records
 * the size of each resolved batch.
 */
public class ResolutionMicrometerEvents implements ResolutionEvents {
    private final MeterRegistry registry;

    public ResolutionMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onDuplicateDescriptor(String extensionPoint, PluginDescriptor duplicate, PluginDescriptor kept) {
        excluded(extensionPoint, "duplicate");
    }

    @Override
    public void onDependencyUnsatisfied(String extensionPoint, PluginDescriptor descriptor, DescriptorReference dependency, PluginDescriptor found) {
        excluded(extensionPoint, found == null ? "missing_dependency" : "version_mismatch");
    }

    @Override
    public void onConflict(String extensionPoint, PluginDescriptor descriptor, DescriptorReference conflict, PluginDescriptor other) {
        excluded(extensionPoint, "conflict");
    }

    @Override
    public void onDescriptorDisabled(String extensionPoint, PluginDescriptor descriptor) {
        excluded(extensionPoint, "disabled");
    }

    @Override
    public void onCycleBroken(String extensionPoint, PluginDescriptor released, List<? extends PluginDescriptor> cycle) {
        registry.counter("plughub.resolver.cycle.broken", Tags.of(Tag.of("extension_point", extensionPoint))).increment();
    }

    @Override
    public void onResolutionCompleted(String extensionPoint, List<? extends PluginDescriptor> resolved, int excludedCount) {
        Tags tags = Tags.of(Tag.of("extension_point", extensionPoint));
        registry.counter("plughub.resolver.runs", tags).increment();
        DistributionSummary.builder("plughub.resolver.resolved")
                .baseUnit("descriptors")
                .tags(tags)
                .register(registry)
                .record(resolved.size());
    }

    private void excluded(String extensionPoint, String reason) {
        registry.counter("plughub.resolver.excluded",
                Tags.of(Tag.of("extension_point", extensionPoint), Tag.of("reason", reason))).increment();
    }
}
