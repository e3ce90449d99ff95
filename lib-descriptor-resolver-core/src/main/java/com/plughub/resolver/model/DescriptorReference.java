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

package com.plughub.resolver.model;

import com.plughub.resolver.version.SemanticVersion;
import com.plughub.resolver.version.VersionRangeMatcher;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Points from one descriptor to another identity ({@code pluginId}, {@code descriptorId}) together with
 * an inclusive version window. Used by all four relation lists of {@link PluginDescriptor}.
 */
public final class DescriptorReference {
    private final UUID pluginId;
    private final UUID descriptorId;
    private final String minVersion;
    private final String maxVersion;

    public DescriptorReference(UUID pluginId, UUID descriptorId, String minVersion, String maxVersion) {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.descriptorId = Objects.requireNonNull(descriptorId, "descriptorId");
        this.minVersion = minVersion;
        this.maxVersion = maxVersion;
    }

    public static DescriptorReference of(UUID pluginId, UUID descriptorId, String minVersion, String maxVersion) {
        return new DescriptorReference(pluginId, descriptorId, minVersion, maxVersion);
    }

    /** Reference to any version of the target. */
    public static DescriptorReference anyVersion(UUID pluginId, UUID descriptorId) {
        return new DescriptorReference(pluginId, descriptorId, null, null);
    }

    /** Reference to the given descriptor's identity, accepting any version. */
    public static DescriptorReference to(PluginDescriptor target) {
        return anyVersion(target.pluginId(), target.descriptorId());
    }

    public UUID pluginId() { return pluginId; }
    public UUID descriptorId() { return descriptorId; }
    public String minVersion() { return minVersion; }
    public String maxVersion() { return maxVersion; }

    public boolean matches(UUID pluginId, UUID descriptorId, String version) {
        return VersionRangeMatcher.matches(this, pluginId, descriptorId, version);
    }

    public boolean matches(PluginDescriptor candidate) {
        return candidate != null && matches(candidate.pluginId(), candidate.descriptorId(), candidate.version());
    }

    /** Human readable window, e.g. {@code [1.0.0, 2.0.0]} or {@code [*, 2.0.0]}. */
    public String window() {
        return "[" + (isBlank(minVersion) ? "*" : minVersion) + ", " + (isBlank(maxVersion) ? "*" : maxVersion) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DescriptorReference)) return false;
        DescriptorReference other = (DescriptorReference) o;
        return pluginId.equals(other.pluginId)
                && descriptorId.equals(other.descriptorId)
                && sameBound(minVersion, other.minVersion)
                && sameBound(maxVersion, other.maxVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pluginId, descriptorId, normalized(minVersion), normalized(maxVersion));
    }

    @Override
    public String toString() {
        return "DescriptorReference{" + pluginId + "/" + descriptorId + " " + window() + "}";
    }

    private static boolean sameBound(String a, String b) {
        return Objects.equals(normalized(a), normalized(b));
    }

    // equal versions must hash equally, so "1.0" and "1.0.0" both normalize to the parsed form
    private static Object normalized(String bound) {
        if (isBlank(bound)) return null;
        Optional<SemanticVersion> v = SemanticVersion.tryParse(bound);
        return v.isPresent() ? v.get() : bound.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
