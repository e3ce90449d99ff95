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

package com.plughub.resolver.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity and relation constraints of one plugin-contributed capability.
 * <p>
 * Every extension point (dock panels, service injectors, configuration schemas, ...) subclasses this type
 * and adds its own payload; the resolver only looks at the fields declared here:
 * <ul>
 *   <li>{@code dependsOn}: targets that must be present and inside the version window, otherwise this descriptor is excluded</li>
 *   <li>{@code conflictsWith}: if any target is present, this descriptor (not the target) is excluded</li>
 *   <li>{@code loadBefore}: targets that must be ordered after this descriptor</li>
 *   <li>{@code loadAfter}: targets that must be ordered before this descriptor</li>
 * </ul>
 * Instances are immutable; relation lists are copied on construction.
 */
public class PluginDescriptor {
    private final UUID pluginId;
    private final UUID descriptorId;
    private final String version;
    private final List<DescriptorReference> loadBefore;
    private final List<DescriptorReference> loadAfter;
    private final List<DescriptorReference> dependsOn;
    private final List<DescriptorReference> conflictsWith;

    public PluginDescriptor(UUID pluginId, UUID descriptorId, String version) {
        this(pluginId, descriptorId, version, null, null, null, null);
    }

    public PluginDescriptor(UUID pluginId,
                            UUID descriptorId,
                            String version,
                            List<DescriptorReference> loadBefore,
                            List<DescriptorReference> loadAfter,
                            List<DescriptorReference> dependsOn,
                            List<DescriptorReference> conflictsWith) {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.descriptorId = Objects.requireNonNull(descriptorId, "descriptorId");
        this.version = Objects.requireNonNull(version, "version");
        this.loadBefore = copy(loadBefore);
        this.loadAfter = copy(loadAfter);
        this.dependsOn = copy(dependsOn);
        this.conflictsWith = copy(conflictsWith);
    }

    /** Copies identity and relations from {@code template}; lets extension-point subclasses reuse {@link DescriptorBuilder}. */
    protected PluginDescriptor(PluginDescriptor template) {
        this(template.pluginId, template.descriptorId, template.version,
                template.loadBefore, template.loadAfter, template.dependsOn, template.conflictsWith);
    }

    public static DescriptorBuilder builder(UUID pluginId, UUID descriptorId, String version) {
        return new DescriptorBuilder(pluginId, descriptorId, version);
    }

    public UUID pluginId() { return pluginId; }
    public UUID descriptorId() { return descriptorId; }
    public String version() { return version; }
    public List<DescriptorReference> loadBefore() { return loadBefore; }
    public List<DescriptorReference> loadAfter() { return loadAfter; }
    public List<DescriptorReference> dependsOn() { return dependsOn; }
    public List<DescriptorReference> conflictsWith() { return conflictsWith; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{plugin=" + pluginId + ", descriptor=" + descriptorId + ", version=" + version + "}";
    }

    private static List<DescriptorReference> copy(List<DescriptorReference> refs) {
        if (refs == null || refs.isEmpty()) return List.of();
        for (DescriptorReference r : refs) {
            Objects.requireNonNull(r, "relation list must not contain null references");
        }
        return List.copyOf(refs);
    }
}
