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
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionRangeMatcherTest {

    private static final UUID PLUGIN = UUID.randomUUID();
    private static final UUID DESCRIPTOR = UUID.randomUUID();

    private static DescriptorReference window(String min, String max) {
        return DescriptorReference.of(PLUGIN, DESCRIPTOR, min, max);
    }

    @Test
    void windowIsInclusiveOnBothEnds() {
        DescriptorReference ref = window("1.0.0", "2.0.0");
        assertTrue(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "1.0.0"));
        assertTrue(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "1.5.3"));
        assertTrue(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "2.0.0"));
        assertFalse(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "0.9.9"));
        assertFalse(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "2.0.1"));
    }

    @Test
    void blankBoundsLeaveWindowOpen() {
        assertTrue(VersionRangeMatcher.matches(window(null, null), PLUGIN, DESCRIPTOR, "0.0.1"));
        assertTrue(VersionRangeMatcher.matches(window("", "2.0.0"), PLUGIN, DESCRIPTOR, "0.1.0"));
        assertTrue(VersionRangeMatcher.matches(window("1.0.0", " "), PLUGIN, DESCRIPTOR, "99.0.0"));
        assertFalse(VersionRangeMatcher.matches(window("1.0.0", null), PLUGIN, DESCRIPTOR, "0.9.0"));
    }

    @Test
    void preReleaseOfLowerBoundIsBelowIt() {
        DescriptorReference ref = window("1.0.0", "2.0.0");
        assertFalse(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "1.0.0-beta"));
        assertTrue(VersionRangeMatcher.matches(ref, PLUGIN, DESCRIPTOR, "2.0.0-rc.1"));
        assertTrue(VersionRangeMatcher.isBelowRange(ref, PLUGIN, DESCRIPTOR, "1.0.0-beta"));
    }

    @Test
    void unparsableVersionsNeverMatch() {
        assertFalse(VersionRangeMatcher.matches(window(null, null), PLUGIN, DESCRIPTOR, "latest"));
        assertFalse(VersionRangeMatcher.matches(window("one", null), PLUGIN, DESCRIPTOR, "1.0.0"));
        assertFalse(VersionRangeMatcher.matches(window(null, "2.x"), PLUGIN, DESCRIPTOR, "1.0.0"));
        assertFalse(VersionRangeMatcher.matches(window(null, null), PLUGIN, DESCRIPTOR, null));
    }

    @Test
    void identityMustMatch() {
        DescriptorReference ref = window(null, null);
        assertFalse(VersionRangeMatcher.matches(ref, UUID.randomUUID(), DESCRIPTOR, "1.0.0"));
        assertFalse(VersionRangeMatcher.matches(ref, PLUGIN, UUID.randomUUID(), "1.0.0"));
        assertFalse(VersionRangeMatcher.matches(null, PLUGIN, DESCRIPTOR, "1.0.0"));
    }

    @Test
    void reportsWhichSideOfWindowVersionFallsOn() {
        DescriptorReference ref = window("1.0.0", "2.0.0");
        assertTrue(VersionRangeMatcher.isBelowRange(ref, PLUGIN, DESCRIPTOR, "0.5.0"));
        assertFalse(VersionRangeMatcher.isAboveRange(ref, PLUGIN, DESCRIPTOR, "0.5.0"));
        assertTrue(VersionRangeMatcher.isAboveRange(ref, PLUGIN, DESCRIPTOR, "3.0.0"));
        assertFalse(VersionRangeMatcher.isBelowRange(ref, PLUGIN, DESCRIPTOR, "1.5.0"));
        assertFalse(VersionRangeMatcher.isAboveRange(window("1.0.0", null), PLUGIN, DESCRIPTOR, "9.0.0"));
    }
}
