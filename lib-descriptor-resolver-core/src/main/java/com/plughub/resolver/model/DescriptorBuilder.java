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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Fluent builder for {@link PluginDescriptor}. Extension-point subclasses typically build the base descriptor
 * here and hand it to their copy constructor.
 */
public class DescriptorBuilder {
    private final UUID pluginId;
    private final UUID descriptorId;
    private final String version;
    private final List<DescriptorReference> loadBefore = new ArrayList<>();
    private final List<DescriptorReference> loadAfter = new ArrayList<>();
    private final List<DescriptorReference> dependsOn = new ArrayList<>();
    private final List<DescriptorReference> conflictsWith = new ArrayList<>();

    DescriptorBuilder(UUID pluginId, UUID descriptorId, String version) {
        this.pluginId = pluginId;
        this.descriptorId = descriptorId;
        this.version = version;
    }

    public DescriptorBuilder loadBefore(DescriptorReference... refs) {
        if (refs != null) this.loadBefore.addAll(Arrays.asList(refs));
        return this;
    }

    public DescriptorBuilder loadAfter(DescriptorReference... refs) {
        if (refs != null) this.loadAfter.addAll(Arrays.asList(refs));
        return this;
    }

    public DescriptorBuilder dependsOn(DescriptorReference... refs) {
        if (refs != null) this.dependsOn.addAll(Arrays.asList(refs));
        return this;
    }

    public DescriptorBuilder conflictsWith(DescriptorReference... refs) {
        if (refs != null) this.conflictsWith.addAll(Arrays.asList(refs));
        return this;
    }

    public PluginDescriptor build() {
        return new PluginDescriptor(pluginId, descriptorId, version, loadBefore, loadAfter, dependsOn, conflictsWith);
    }
}
