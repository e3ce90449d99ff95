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

package com.plughub.resolver;

import com.plughub.resolver.model.DescriptorBuilder;
import com.plughub.resolver.model.DescriptorReference;
import com.plughub.resolver.model.PluginDescriptor;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/** Readable fixtures: descriptors are named by letter and get stable name-based ids. */
public final class TestDescriptors {
    public static final UUID PLUGIN = UUID.fromString("6f1c2a3e-9d7b-4c1a-8e2f-0a1b2c3d4e5f");

    private TestDescriptors() {}

    public static UUID id(String name) {
        return UUID.nameUUIDFromBytes(("descriptor:" + name).getBytes(StandardCharsets.UTF_8));
    }

    public static DescriptorBuilder descriptor(String name) {
        return descriptor(name, "1.0.0");
    }

    public static DescriptorBuilder descriptor(String name, String version) {
        return PluginDescriptor.builder(PLUGIN, id(name), version);
    }

    public static DescriptorReference ref(String name) {
        return DescriptorReference.anyVersion(PLUGIN, id(name));
    }

    public static DescriptorReference ref(String name, String min, String max) {
        return DescriptorReference.of(PLUGIN, id(name), min, max);
    }

    /** Maps resolved descriptors back to their fixture letters, for compact assertions. */
    public static List<String> names(List<? extends PluginDescriptor> descriptors) {
        return descriptors.stream().map(TestDescriptors::nameOf).collect(Collectors.toList());
    }

    private static String nameOf(PluginDescriptor d) {
        for (char c = 'A'; c <= 'Z'; c++) {
            if (id(String.valueOf(c)).equals(d.descriptorId())) return String.valueOf(c);
        }
        return d.descriptorId().toString();
    }
}
