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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemanticVersionTest {

    @Test
    void missingComponentsDefaultToZero() {
        SemanticVersion v = SemanticVersion.parse("2");
        assertThat(v.major()).isEqualTo(2);
        assertThat(v.minor()).isZero();
        assertThat(v.patch()).isZero();
        assertThat(SemanticVersion.parse("1.4")).isEqualByComparingTo(SemanticVersion.parse("1.4.0"));
    }

    @Test
    void comparesNumericallyNotLexically() {
        assertThat(SemanticVersion.parse("1.10.0")).isGreaterThan(SemanticVersion.parse("1.9.0"));
        assertThat(SemanticVersion.parse("10.0.0")).isGreaterThan(SemanticVersion.parse("9.99.99"));
    }

    @Test
    void preReleaseSortsBeforeRelease() {
        assertThat(SemanticVersion.parse("1.0.0-alpha")).isLessThan(SemanticVersion.parse("1.0.0"));
        assertThat(SemanticVersion.parse("1.0.0-alpha")).isLessThan(SemanticVersion.parse("1.0.0-alpha.1"));
        assertThat(SemanticVersion.parse("1.0.0-alpha.1")).isLessThan(SemanticVersion.parse("1.0.0-alpha.beta"));
        assertThat(SemanticVersion.parse("1.0.0-beta.2")).isLessThan(SemanticVersion.parse("1.0.0-beta.11"));
        assertThat(SemanticVersion.parse("1.0.0-rc.1").isPreRelease()).isTrue();
        assertThat(SemanticVersion.parse("1.0.0-rc.1").preRelease()).isEqualTo(List.of("rc", "1"));
    }

    @Test
    void buildMetadataIsIgnoredForPrecedence() {
        SemanticVersion a = SemanticVersion.parse("1.2.3+build.7");
        SemanticVersion b = SemanticVersion.parse("1.2.3");
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.build()).isEqualTo("build.7");
        assertThat(a.toString()).isEqualTo("1.2.3+build.7");
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> SemanticVersion.parse(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse("v1.0.0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse("1.0.0.0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse("01.0.0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse("1..0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse("1.0.0-")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SemanticVersion.parse("1.0.0-01")).isInstanceOf(IllegalArgumentException.class);
        assertThat(SemanticVersion.tryParse("not-a-version")).isEmpty();
        assertThat(SemanticVersion.tryParse(null)).isEmpty();
    }
}
