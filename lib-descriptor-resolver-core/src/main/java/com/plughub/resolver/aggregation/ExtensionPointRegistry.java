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

package com.plughub.resolver.aggregation;

import com.plughub.resolver.model.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Static table of the extension points the host knows, keyed by provider interface.
 * Registration normally happens once at startup; lookups are safe from any thread afterwards.
 */
public class ExtensionPointRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExtensionPointRegistry.class);

    private final Map<Class<?>, ExtensionPoint<?, ?>> points = new LinkedHashMap<>();

    public ExtensionPointRegistry() {
    }

    public ExtensionPointRegistry(Collection<? extends ExtensionPoint<?, ?>> extensionPoints) {
        extensionPoints.forEach(this::register);
    }

    public synchronized void register(ExtensionPoint<?, ?> extensionPoint) {
        Class<?> type = extensionPoint.providerType();
        if (points.containsKey(type)) {
            throw new IllegalStateException("Duplicate extension point for provider type " + type.getName()
                    + ": '" + points.get(type).name() + "' and '" + extensionPoint.name() + "'");
        }
        points.put(type, extensionPoint);
        log.debug(json(
                "resolver_event", "extension_point_registered",
                "extension_point", extensionPoint.name(),
                "provider_type", type.getName(),
                "direction", extensionPoint.direction()
        ));
    }

    @SuppressWarnings("unchecked")
    public synchronized <P> ExtensionPoint<P, ? extends PluginDescriptor> get(Class<P> providerType) {
        ExtensionPoint<?, ?> point = points.get(providerType);
        if (point == null) {
            throw new IllegalArgumentException("No extension point registered for provider type "
                    + (providerType == null ? "null" : providerType.getName()));
        }
        return (ExtensionPoint<P, ? extends PluginDescriptor>) point;
    }

    public synchronized boolean contains(Class<?> providerType) {
        return points.containsKey(providerType);
    }

    public synchronized List<ExtensionPoint<?, ?>> all() {
        return Collections.unmodifiableList(new ArrayList<>(points.values()));
    }
}
