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

package com.plughub.resolver.config;

import com.plughub.resolver.engine.CyclePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Configuration properties for descriptor resolution.
 * <p>
 * Example configuration:
 * <pre>
 * plughub.resolver.cycle-policy=FAIL
 * plughub.resolver.manifest.filter-enabled=true
 * plughub.resolver.manifest.default-enabled=false
 * plughub.resolver.observability.metrics-enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "plughub.resolver")
public class DescriptorResolverProperties {

    /**
     * What to do when load-order hints form a cycle.
     */
    private CyclePolicy cyclePolicy = CyclePolicy.BREAK_BY_INPUT_ORDER;

    @NestedConfigurationProperty
    private Manifest manifest = new Manifest();

    @NestedConfigurationProperty
    private Observability observability = new Observability();

    public CyclePolicy getCyclePolicy() {
        return cyclePolicy;
    }

    public void setCyclePolicy(CyclePolicy cyclePolicy) {
        this.cyclePolicy = cyclePolicy;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public void setManifest(Manifest manifest) {
        this.manifest = manifest;
    }

    public Observability getObservability() {
        return observability;
    }

    public void setObservability(Observability observability) {
        this.observability = observability;
    }

    public static class Manifest {
        /**
         * Drop descriptors disabled in the manifest before resolving an extension point.
         */
        private boolean filterEnabled = false;

        /**
         * Enabled state given to descriptors the manifest sees for the first time.
         */
        private boolean defaultEnabled = false;

        public boolean isFilterEnabled() {
            return filterEnabled;
        }

        public void setFilterEnabled(boolean filterEnabled) {
            this.filterEnabled = filterEnabled;
        }

        public boolean isDefaultEnabled() {
            return defaultEnabled;
        }

        public void setDefaultEnabled(boolean defaultEnabled) {
            this.defaultEnabled = defaultEnabled;
        }
    }

    public static class Observability {
        /**
         * Publish resolution counters when a MeterRegistry is available.
         */
        private boolean metricsEnabled = true;

        public boolean isMetricsEnabled() {
            return metricsEnabled;
        }

        public void setMetricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
        }
    }
}
