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

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;

/**
 * Declares how descriptors of one kind are obtained from plugins.
 * <p>
 * {@code providerType} is the interface a plugin implements to contribute descriptors; {@code accessor}
 * reads them from one provider instance. Dependency injection registration, for example, consumes its order
 * back to front and is declared with {@link #reverse(String, Class, Function)}.
 *
 * @param <P> provider interface
 * @param <D> descriptor type produced by the provider
 */
public final class ExtensionPoint<P, D extends PluginDescriptor> {
    private final String name;
    private final Class<P> providerType;
    private final Function<? super P, ? extends Collection<? extends D>> accessor;
    private final SortDirection direction;

    public ExtensionPoint(String name,
                          Class<P> providerType,
                          Function<? super P, ? extends Collection<? extends D>> accessor,
                          SortDirection direction) {
        this.name = Objects.requireNonNull(name, "name");
        this.providerType = Objects.requireNonNull(providerType, "providerType");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public static <P, D extends PluginDescriptor> ExtensionPoint<P, D> forward(String name, Class<P> providerType,
                                                                             Function<? super P, ? extends Collection<? extends D>> accessor) {
        return new ExtensionPoint<>(name, providerType, accessor, SortDirection.FORWARD);
    }

    public static <P, D extends PluginDescriptor> ExtensionPoint<P, D> reverse(String name, Class<P> providerType,
                                                                             Function<? super P, ? extends Collection<? extends D>> accessor) {
        return new ExtensionPoint<>(name, providerType, accessor, SortDirection.REVERSE);
    }

    public String name() { return name; }
    public Class<P> providerType() { return providerType; }
    public Function<? super P, ? extends Collection<? extends D>> accessor() { return accessor; }
    public SortDirection direction() { return direction; }

    @Override
    public String toString() {
        return "ExtensionPoint{" + name + ", " + providerType.getName() + ", " + direction + "}";
    }
}
