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

package com.plughub.resolver.engine;

import com.plughub.resolver.model.PluginDescriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown under {@link CyclePolicy#FAIL} when load-order hints admit no total order.
 */
public class DescriptorCycleException extends IllegalStateException {
    private final String extensionPoint;
    private final List<PluginDescriptor> cycle;

    public DescriptorCycleException(String extensionPoint, List<? extends PluginDescriptor> cycle) {
        super("Cycle detected in load order of extension point '" + extensionPoint + "': "
                + cycle.stream().map(d -> String.valueOf(d.descriptorId())).collect(Collectors.joining(" -> ")));
        this.extensionPoint = extensionPoint;
        this.cycle = List.copyOf(cycle);
    }

    public String extensionPoint() { return extensionPoint; }
    public List<PluginDescriptor> cycle() { return cycle; }
}
