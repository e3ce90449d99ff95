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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtensionPointRegistryTest {

    interface StyleProvider {
        List<PluginDescriptor> styles();
    }

    @Test
    void registersAndLooksUpByProviderType() {
        ExtensionPoint<StyleProvider, PluginDescriptor> styles = ExtensionPoint.forward("styles", StyleProvider.class, StyleProvider::styles);
        ExtensionPointRegistry registry = new ExtensionPointRegistry(List.of(styles));

        assertThat(registry.get(StyleProvider.class)).isSameAs(styles);
        assertThat(registry.contains(StyleProvider.class)).isTrue();
        assertThat(registry.all()).containsExactly(styles);
        assertThat(styles.direction()).isEqualTo(SortDirection.FORWARD);
    }

    @Test
    void duplicateRegistrationFails() {
        ExtensionPointRegistry registry = new ExtensionPointRegistry();
        registry.register(ExtensionPoint.forward("styles", StyleProvider.class, StyleProvider::styles));

        assertThatThrownBy(() -> registry.register(ExtensionPoint.reverse("styles-again", StyleProvider.class, StyleProvider::styles)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Duplicate extension point");
    }

    @Test
    void unknownTypeFails() {
        assertThatThrownBy(() -> new ExtensionPointRegistry().get(StyleProvider.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
