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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed semantic version: {@code MAJOR[.MINOR[.PATCH]][-PRERELEASE][+BUILD]}.
 * <p>
 * Missing minor/patch components are treated as zero so that {@code "1.2"} equals {@code "1.2.0"}.
 * Precedence follows semver 2.0.0: numeric core first, then a version with a pre-release tag sorts
 * before the same core without one, pre-release identifiers compare left to right (numeric identifiers
 * numerically and below alphanumeric ones). Build metadata never affects precedence or equality.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private final long major;
    private final long minor;
    private final long patch;
    private final List<String> preRelease;
    private final String build;

    private SemanticVersion(long major, long minor, long patch, List<String> preRelease, String build) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.preRelease = preRelease;
        this.build = build;
    }

    /**
     * Parses a version string.
     *
     * @throws IllegalArgumentException if the text is not a valid version
     */
    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        String s = text.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Version must not be blank");
        }

        String build = "";
        int plus = s.indexOf('+');
        if (plus >= 0) {
            build = s.substring(plus + 1);
            s = s.substring(0, plus);
            if (build.isEmpty() || !validIdentifiers(build, false)) {
                throw new IllegalArgumentException("Invalid build metadata in version '" + text + "'");
            }
        }

        List<String> pre = List.of();
        int dash = s.indexOf('-');
        if (dash >= 0) {
            String preText = s.substring(dash + 1);
            s = s.substring(0, dash);
            if (preText.isEmpty() || !validIdentifiers(preText, true)) {
                throw new IllegalArgumentException("Invalid pre-release in version '" + text + "'");
            }
            pre = Collections.unmodifiableList(new ArrayList<>(List.of(preText.split("\\.", -1))));
        }

        String[] core = s.split("\\.", -1);
        if (core.length > 3) {
            throw new IllegalArgumentException("Too many numeric components in version '" + text + "'");
        }
        long[] parts = new long[3];
        for (int i = 0; i < core.length; i++) {
            parts[i] = parseNumeric(core[i], text);
        }
        return new SemanticVersion(parts[0], parts[1], parts[2], pre, build);
    }

    /** Lenient variant of {@link #parse(String)}: empty when the text is null or malformed. */
    public static Optional<SemanticVersion> tryParse(String text) {
        if (text == null) return Optional.empty();
        try {
            return Optional.of(parse(text));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static long parseNumeric(String part, String original) {
        if (part.isEmpty() || !isDigits(part)) {
            throw new IllegalArgumentException("Invalid numeric component '" + part + "' in version '" + original + "'");
        }
        if (part.length() > 1 && part.charAt(0) == '0') {
            throw new IllegalArgumentException("Leading zero in numeric component '" + part + "' of version '" + original + "'");
        }
        try {
            return Long.parseLong(part);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Numeric component out of range in version '" + original + "'", e);
        }
    }

    private static boolean validIdentifiers(String dotted, boolean rejectNumericLeadingZero) {
        for (String id : dotted.split("\\.", -1)) {
            if (id.isEmpty()) return false;
            for (int i = 0; i < id.length(); i++) {
                char c = id.charAt(i);
                boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '-';
                if (!ok) return false;
            }
            if (rejectNumericLeadingZero && isDigits(id) && id.length() > 1 && id.charAt(0) == '0') return false;
        }
        return true;
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return !s.isEmpty();
    }

    public long major() { return major; }
    public long minor() { return minor; }
    public long patch() { return patch; }
    public List<String> preRelease() { return preRelease; }
    public String build() { return build; }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int c = Long.compare(major, other.major);
        if (c != 0) return c;
        c = Long.compare(minor, other.minor);
        if (c != 0) return c;
        c = Long.compare(patch, other.patch);
        if (c != 0) return c;
        return comparePreRelease(preRelease, other.preRelease);
    }

    private static int comparePreRelease(List<String> a, List<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0;
        if (a.isEmpty()) return 1;
        if (b.isEmpty()) return -1;
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            String x = a.get(i);
            String y = b.get(i);
            boolean xNum = isDigits(x);
            boolean yNum = isDigits(y);
            int c;
            if (xNum && yNum) {
                c = x.length() != y.length() ? Integer.compare(x.length(), y.length()) : x.compareTo(y);
            } else if (xNum) {
                c = -1;
            } else if (yNum) {
                c = 1;
            } else {
                c = x.compareTo(y);
            }
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticVersion)) return false;
        return compareTo((SemanticVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(major).append('.').append(minor).append('.').append(patch);
        if (!preRelease.isEmpty()) sb.append('-').append(String.join(".", preRelease));
        if (!build.isEmpty()) sb.append('+').append(build);
        return sb.toString();
    }
}
