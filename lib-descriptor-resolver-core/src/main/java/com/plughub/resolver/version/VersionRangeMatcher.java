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

package com.plughub.resolver.version;

import com.plughub.resolver.model.DescriptorReference;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a candidate identity and version fall inside a reference's inclusive
 * {@code [minVersion, maxVersion]} window. A blank bound leaves that side of the window open.
 * A candidate version or a non-blank bound that does not parse never matches.
 */
public final class VersionRangeMatcher {
    private VersionRangeMatcher() {}

    public static boolean matches(DescriptorReference ref, UUID pluginId, UUID descriptorId, String version) {
        if (ref == null || !sameTarget(ref, pluginId, descriptorId)) {
            return false;
        }
        Optional<SemanticVersion> candidate = SemanticVersion.tryParse(version);
        if (candidate.isEmpty() || !boundParses(ref.minVersion()) || !boundParses(ref.maxVersion())) {
            return false;
        }
        SemanticVersion v = candidate.get();
        if (!isOpen(ref.minVersion()) && v.compareTo(SemanticVersion.parse(ref.minVersion())) < 0) {
            return false;
        }
        return isOpen(ref.maxVersion()) || v.compareTo(SemanticVersion.parse(ref.maxVersion())) <= 0;
    }

    /** True when the identity matches and the version parses to something below the window's lower bound. */
    public static boolean isBelowRange(DescriptorReference ref, UUID pluginId, UUID descriptorId, String version) {
        if (ref == null || !sameTarget(ref, pluginId, descriptorId) || isOpen(ref.minVersion())) return false;
        Optional<SemanticVersion> v = SemanticVersion.tryParse(version);
        Optional<SemanticVersion> min = SemanticVersion.tryParse(ref.minVersion());
        return v.isPresent() && min.isPresent() && v.get().compareTo(min.get()) < 0;
    }

    /** True when the identity matches and the version parses to something above the window's upper bound. */
    public static boolean isAboveRange(DescriptorReference ref, UUID pluginId, UUID descriptorId, String version) {
        if (ref == null || !sameTarget(ref, pluginId, descriptorId) || isOpen(ref.maxVersion())) return false;
        Optional<SemanticVersion> v = SemanticVersion.tryParse(version);
        Optional<SemanticVersion> max = SemanticVersion.tryParse(ref.maxVersion());
        return v.isPresent() && max.isPresent() && v.get().compareTo(max.get()) > 0;
    }

    private static boolean sameTarget(DescriptorReference ref, UUID pluginId, UUID descriptorId) {
        return ref.pluginId().equals(pluginId) && ref.descriptorId().equals(descriptorId);
    }

    private static boolean isOpen(String bound) {
        return bound == null || bound.isBlank();
    }

    private static boolean boundParses(String bound) {
        return isOpen(bound) || SemanticVersion.tryParse(bound).isPresent();
    }
}
