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

import com.plughub.resolver.engine.DescriptorResolver;
import com.plughub.resolver.manifest.ManifestRegistrar;
import com.plughub.resolver.model.PluginDescriptor;
import com.plughub.resolver.observability.ResolutionEvents;
import com.plughub.resolver.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Collects descriptors for one extension point from all of its providers, resolves them as a single batch
 * and hands back the order the consumer expects.
 * <p>
 * A provider that returns {@code null} contributes nothing. A provider whose accessor throws is logged
 * and skipped; the remaining providers still resolve. When a {@link ManifestRegistrar} is configured with
 * filtering on, newly seen descriptors are registered and disabled ones are dropped before resolution.
 */
public class DescriptorAggregator {
    private static final Logger log = LoggerFactory.getLogger(DescriptorAggregator.class);

    private final ExtensionPointRegistry registry;
    private final DescriptorResolver resolver;
    private final ProviderLocator locator;
    private final ManifestRegistrar manifest;
    private final boolean manifestFiltering;
    private final ResolutionEvents events;

    public DescriptorAggregator(ExtensionPointRegistry registry, DescriptorResolver resolver, ProviderLocator locator,
                                ResolutionEvents events) {
        this(registry, resolver, locator, null, false, events);
    }

    public DescriptorAggregator(ExtensionPointRegistry registry,
                                DescriptorResolver resolver,
                                ProviderLocator locator,
                                ManifestRegistrar manifest,
                                boolean manifestFiltering,
                                ResolutionEvents events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.locator = locator;
        this.manifest = manifest;
        this.manifestFiltering = manifestFiltering && manifest != null;
        this.events = Objects.requireNonNull(events, "events");
    }

    public ExtensionPointRegistry registry() {
        return registry;
    }

    /** The manifest used for filtering, if any. */
    public Optional<ManifestRegistrar> manifestRegistrar() {
        return Optional.ofNullable(manifest);
    }

    public boolean isManifestFiltering() {
        return manifestFiltering;
    }

    /** Resolves the descriptors of every provider the {@link ProviderLocator} finds for {@code providerType}. */
    public <P> List<PluginDescriptor> resolveAndOrder(Class<P> providerType) {
        if (locator == null) {
            throw new IllegalStateException("No ProviderLocator configured; pass the providers explicitly");
        }
        return resolveAndOrder(providerType, locator.providersOf(providerType));
    }

    public <P> List<PluginDescriptor> resolveAndOrder(Class<P> providerType, Collection<? extends P> providers) {
        ExtensionPoint<P, ? extends PluginDescriptor> point = registry.get(providerType);
        return List.copyOf(resolveAndOrder(point, providers));
    }

    /** Typed variant for callers holding the {@link ExtensionPoint} itself. */
    public <P, D extends PluginDescriptor> List<D> resolveAndOrder(ExtensionPoint<P, D> point, Collection<? extends P> providers) {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(providers, "providers");

        List<D> collected = collect(point, providers);
        if (manifestFiltering) {
            collected = filterDisabled(point.name(), collected);
        }

        List<D> ordered = resolver.resolve(point.name(), collected);
        if (point.direction() == SortDirection.REVERSE) {
            List<D> reversed = new ArrayList<>(ordered);
            Collections.reverse(reversed);
            ordered = Collections.unmodifiableList(reversed);
        }
        log.debug(json(
                "resolver_event", "aggregated",
                "extension_point", point.name(),
                "providers", providers.size(),
                "collected", collected.size(),
                "resolved", ordered.size(),
                "direction", point.direction()
        ));
        return ordered;
    }

    private <P, D extends PluginDescriptor> List<D> collect(ExtensionPoint<P, D> point, Collection<? extends P> providers) {
        List<D> collected = new ArrayList<>();
        for (P provider : providers) {
            if (provider == null) continue;
            Collection<? extends D> contributed;
            try {
                contributed = point.accessor().apply(provider);
            } catch (RuntimeException e) {
                log.warn(json(
                        "resolver_event", "provider_failed",
                        "extension_point", point.name(),
                        "provider", provider.getClass().getName(),
                        "error_type", e.getClass().getSimpleName(),
                        "error_message", JsonUtils.truncate(e.getMessage(), 500)
                ), e);
                continue;
            }
            if (contributed == null) {
                log.debug(json(
                        "resolver_event", "provider_empty",
                        "extension_point", point.name(),
                        "provider", provider.getClass().getName()
                ));
                continue;
            }
            collected.addAll(contributed);
        }
        return collected;
    }

    private <D extends PluginDescriptor> List<D> filterDisabled(String extensionPoint, List<D> collected) {
        manifest.registerDiscovered(collected);
        List<D> enabled = manifest.filterEnabled(collected);
        if (enabled.size() == collected.size()) return collected;

        Set<UUID> kept = new HashSet<>();
        for (D d : enabled) kept.add(d.descriptorId());
        for (D d : collected) {
            if (d != null && !kept.contains(d.descriptorId())) {
                events.onDescriptorDisabled(extensionPoint, d);
            }
        }
        return enabled;
    }
}
