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

/**
 * Records that {@code released} was emitted before all of its predecessors because it sat on an
 * ordering cycle. {@code cycle} lists the cycle members in input order.
 */
public final class CycleBreak {
    private final PluginDescriptor released;
    private final List<PluginDescriptor> cycle;

    public CycleBreak(PluginDescriptor released, List<? extends PluginDescriptor> cycle) {
        this.released = released;
        this.cycle = List.copyOf(cycle);
    }

    public PluginDescriptor released() { return released; }
    public List<PluginDescriptor> cycle() { return cycle; }
}
