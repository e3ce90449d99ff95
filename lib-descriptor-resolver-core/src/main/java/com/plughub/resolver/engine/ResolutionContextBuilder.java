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
import com.plughub.resolver.observability.ResolutionEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Snapshots the input batch, deduplicates it by descriptor id (first occurrence wins), indexes the
 * survivors and seeds one graph node per survivor.
 */
public class ResolutionContextBuilder {
    private static final Logger log = LoggerFactory.getLogger(ResolutionContextBuilder.class);

    private final ResolutionEvents events;

    public ResolutionContextBuilder(ResolutionEvents events) {
        this.events = Objects.requireNonNull(events, "events");
    }

    public <D extends PluginDescriptor> ResolutionContext<D> build(String extensionPoint, Collection<? extends D> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        List<D> snapshot = new ArrayList<>(descriptors);
        ResolutionContext<D> context = new ResolutionContext<>(extensionPoint);

        int position = 0;
        for (D descriptor : snapshot) {
            if (descriptor == null) {
                log.warn(json(
                        "resolver_event", "null_descriptor_skipped",
                        "extension_point", extensionPoint,
                        "position", position
                ));
            } else if (context.containsId(descriptor.descriptorId())) {
                D kept = context.indexed(descriptor.descriptorId());
                context.markDuplicate(descriptor, kept);
                events.onDuplicateDescriptor(extensionPoint, descriptor, kept);
            } else {
                context.add(descriptor);
            }
            position++;
        }
        return context;
    }
}
