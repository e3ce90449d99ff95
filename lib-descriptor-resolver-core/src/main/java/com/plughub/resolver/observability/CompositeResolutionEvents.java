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
import com.plughub.resolver.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Fans out every callback to a list of delegates, in list order.
 * A delegate that throws is logged and skipped; the remaining delegates still receive the callback
 * and the exception never reaches the resolver.
 */
public class CompositeResolutionEvents implements ResolutionEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeResolutionEvents.class);

    private final List<ResolutionEvents> delegates;

    public CompositeResolutionEvents(List<ResolutionEvents> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    public List<ResolutionEvents> delegates() {
        return delegates;
    }

    @Override
    public void onResolutionStarted(String extensionPoint, int descriptorCount) {
        dispatch("onResolutionStarted", extensionPoint, d -> d.onResolutionStarted(extensionPoint, descriptorCount));
    }

    @Override
    public void onDuplicateDescriptor(String extensionPoint, PluginDescriptor duplicate, PluginDescriptor kept) {
        dispatch("onDuplicateDescriptor", extensionPoint, d -> d.onDuplicateDescriptor(extensionPoint, duplicate, kept));
    }

    @Override
    public void onDependencyUnsatisfied(String extensionPoint, PluginDescriptor descriptor, DescriptorReference dependency, PluginDescriptor found) {
        dispatch("onDependencyUnsatisfied", extensionPoint, d -> d.onDependencyUnsatisfied(extensionPoint, descriptor, dependency, found));
    }

    @Override
    public void onConflict(String extensionPoint, PluginDescriptor descriptor, DescriptorReference conflict, PluginDescriptor other) {
        dispatch("onConflict", extensionPoint, d -> d.onConflict(extensionPoint, descriptor, conflict, other));
    }

    @Override
    public void onDescriptorDisabled(String extensionPoint, PluginDescriptor descriptor) {
        dispatch("onDescriptorDisabled", extensionPoint, d -> d.onDescriptorDisabled(extensionPoint, descriptor));
    }

    @Override
    public void onCycleBroken(String extensionPoint, PluginDescriptor released, List<? extends PluginDescriptor> cycle) {
        dispatch("onCycleBroken", extensionPoint, d -> d.onCycleBroken(extensionPoint, released, cycle));
    }

    @Override
    public void onResolutionCompleted(String extensionPoint, List<? extends PluginDescriptor> resolved, int excludedCount) {
        dispatch("onResolutionCompleted", extensionPoint, d -> d.onResolutionCompleted(extensionPoint, resolved, excludedCount));
    }

    private void dispatch(String callback, String extensionPoint, Consumer<ResolutionEvents> call) {
        for (ResolutionEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn(json(
                        "resolver_event", "events_sink_failed",
                        "extension_point", extensionPoint,
                        "sink", d.getClass().getName(),
                        "callback", callback,
                        "error_type", e.getClass().getSimpleName(),
                        "error_message", JsonUtils.truncate(e.getMessage(), 500)
                ), e);
            }
        }
    }
}
