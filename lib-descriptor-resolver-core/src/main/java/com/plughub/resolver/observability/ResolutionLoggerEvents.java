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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Default {@link ResolutionEvents} implementation that emits JSON key/value logs via SLF4J.
 * Exclusions are logged at WARN so that no descriptor disappears from a batch without a trace.
 */
public class ResolutionLoggerEvents implements ResolutionEvents {
    private static final Logger log = LoggerFactory.getLogger(ResolutionLoggerEvents.class);

    @Override
    public void onResolutionStarted(String extensionPoint, int descriptorCount) {
        log.debug(json(
                "resolver_event", "started",
                "extension_point", extensionPoint,
                "descriptors", descriptorCount
        ));
    }

    @Override
    public void onDuplicateDescriptor(String extensionPoint, PluginDescriptor duplicate, PluginDescriptor kept) {
        log.warn(json(
                "resolver_event", "duplicate_descriptor",
                "extension_point", extensionPoint,
                "descriptor", duplicate,
                "plugin", duplicate.pluginId(),
                "version", duplicate.version(),
                "kept_plugin", kept.pluginId(),
                "kept_version", kept.version()
        ));
    }

    @Override
    public void onDependencyUnsatisfied(String extensionPoint, PluginDescriptor descriptor, DescriptorReference dependency, PluginDescriptor found) {
        log.warn(json(
                "resolver_event", "dependency_unsatisfied",
                "extension_point", extensionPoint,
                "descriptor", descriptor,
                "dependency", dependency,
                "window", dependency.window(),
                "found", found == null ? "missing" : found.version()
        ));
    }

    @Override
    public void onConflict(String extensionPoint, PluginDescriptor descriptor, DescriptorReference conflict, PluginDescriptor other) {
        log.warn(json(
                "resolver_event", "conflict",
                "extension_point", extensionPoint,
                "descriptor", descriptor,
                "conflicts_with", conflict,
                "window", conflict.window(),
                "found", other.version()
        ));
    }

    @Override
    public void onDescriptorDisabled(String extensionPoint, PluginDescriptor descriptor) {
        log.info(json(
                "resolver_event", "descriptor_disabled",
                "extension_point", extensionPoint,
                "descriptor", descriptor,
                "plugin", descriptor.pluginId()
        ));
    }

    @Override
    public void onCycleBroken(String extensionPoint, PluginDescriptor released, List<? extends PluginDescriptor> cycle) {
        log.warn(json(
                "resolver_event", "cycle_broken",
                "extension_point", extensionPoint,
                "released", released,
                "cycle", cycle
        ));
    }

    @Override
    public void onResolutionCompleted(String extensionPoint, List<? extends PluginDescriptor> resolved, int excludedCount) {
        log.info(json(
                "resolver_event", "completed",
                "extension_point", extensionPoint,
                "resolved", resolved.size(),
                "excluded", excludedCount
        ));
        if (log.isDebugEnabled()) {
            log.debug(json(
                    "resolver_event", "order",
                    "extension_point", extensionPoint,
                    "order", resolved
            ));
        }
    }
}
