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

package com.plughub.resolver.inmemory;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the in-memory descriptor resolver starter.
 * <p>
 * Everything here lives in the JVM only: a bounded diagnostic history and a manifest that is lost on restart.
 */
@ConfigurationProperties(prefix = "plughub.resolver.inmemory")
public class InMemoryResolverProperties {

    private EventsProperties events = new EventsProperties();
    private ManifestProperties manifest = new ManifestProperties();

    public EventsProperties getEvents() {
        return events;
    }

    public void setEvents(EventsProperties events) {
        this.events = events;
    }

    public ManifestProperties getManifest() {
        return manifest;
    }

    public void setManifest(ManifestProperties manifest) {
        this.manifest = manifest;
    }

    /**
     * Properties for the in-memory diagnostic history.
     */
    public static class EventsProperties {

        /**
         * Whether resolution diagnostics are recorded in memory.
         */
        private boolean enabled = true;

        /**
         * Whether to log each recorded diagnostic with its details.
         */
        private boolean logDetails = true;

        /**
         * Maximum number of diagnostics kept; the oldest are dropped first.
         */
        private int maxEventsInMemory = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogDetails() {
            return logDetails;
        }

        public void setLogDetails(boolean logDetails) {
            this.logDetails = logDetails;
        }

        public int getMaxEventsInMemory() {
            return maxEventsInMemory;
        }

        public void setMaxEventsInMemory(int maxEventsInMemory) {
            this.maxEventsInMemory = maxEventsInMemory;
        }
    }

    /**
     * Properties for the in-memory manifest store.
     */
    public static class ManifestProperties {

        /**
         * Whether to provide an in-memory ManifestStore when the application defines none.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
