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

import java.util.List;

/**
 * Diagnostic side-channel of descriptor resolution. Excluded descriptors are absent from the resolver's
 * return value; the reason is reported here.
 * Provide your own Spring bean of this type to export diagnostics elsewhere.
 * A default logger-based implementation is provided: {@link ResolutionLoggerEvents}.
 *
 * Notes:
 * - onDependencyUnsatisfied receives a null {@code found} when the target is missing from the batch.
 */
public interface ResolutionEvents {
    default void onResolutionStarted(String extensionPoint, int descriptorCount) {}
    default void onDuplicateDescriptor(String extensionPoint, PluginDescriptor duplicate, PluginDescriptor kept) {}
    default void onDependencyUnsatisfied(String extensionPoint, PluginDescriptor descriptor, DescriptorReference dependency, PluginDescriptor found) {}
    default void onConflict(String extensionPoint, PluginDescriptor descriptor, DescriptorReference conflict, PluginDescriptor other) {}
    /** Invoked for descriptors filtered out by the manifest before resolution. */
    default void onDescriptorDisabled(String extensionPoint, PluginDescriptor descriptor) {}
    /** Invoked when an ordering cycle is broken by releasing {@code released} ahead of its predecessors. */
    default void onCycleBroken(String extensionPoint, PluginDescriptor released, List<? extends PluginDescriptor> cycle) {}
    default void onResolutionCompleted(String extensionPoint, List<? extends PluginDescriptor> resolved, int excludedCount) {}
}
