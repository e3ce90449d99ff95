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

import com.plughub.resolver.model.DescriptorReference;
import com.plughub.resolver.model.PluginDescriptor;
import com.plughub.resolver.observability.ResolutionEvents;
import com.plughub.resolver.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ResolutionEvents that keeps a limited history of resolution diagnostics
 * for debugging and for assertions in tests.
 * The history never holds more than {@code maxEventsInMemory} entries, also under concurrent resolutions.
 */
public class InMemoryResolutionEvents implements ResolutionEvents {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResolutionEvents.class);

    private final InMemoryResolverProperties.EventsProperties config;
    private final Deque<ResolutionEvent> eventHistory = new ArrayDeque<>();
    private final AtomicInteger eventCounter = new AtomicInteger(0);

    public InMemoryResolutionEvents(InMemoryResolverProperties.EventsProperties config) {
        this.config = config;
        log.info(JsonUtils.json(
                "event", "inmemory_resolution_events_initialized",
                "component", "InMemoryResolutionEvents",
                "max_events_in_memory", config.getMaxEventsInMemory()
        ));
    }

    @Override
    public void onResolutionStarted(String extensionPoint, int descriptorCount) {
        record("RESOLUTION_STARTED", extensionPoint, null, "descriptors=" + descriptorCount);
    }

    @Override
    public void onDuplicateDescriptor(String extensionPoint, PluginDescriptor duplicate, PluginDescriptor kept) {
        record("DUPLICATE_DESCRIPTOR", extensionPoint, duplicate.descriptorId(),
                "plugin=" + duplicate.pluginId() + ", kept_plugin=" + kept.pluginId());
    }

    @Override
    public void onDependencyUnsatisfied(String extensionPoint, PluginDescriptor descriptor, DescriptorReference dependency, PluginDescriptor found) {
        record(found == null ? "MISSING_DEPENDENCY" : "VERSION_MISMATCH", extensionPoint, descriptor.descriptorId(),
                "dependency=" + dependency.descriptorId() + " " + dependency.window()
                        + (found == null ? "" : ", found=" + found.version()));
    }

    @Override
    public void onConflict(String extensionPoint, PluginDescriptor descriptor, DescriptorReference conflict, PluginDescriptor other) {
        record("CONFLICT", extensionPoint, descriptor.descriptorId(),
                "conflicts_with=" + other.descriptorId() + "@" + other.version());
    }

    @Override
    public void onDescriptorDisabled(String extensionPoint, PluginDescriptor descriptor) {
        record("DISABLED", extensionPoint, descriptor.descriptorId(), "plugin=" + descriptor.pluginId());
    }

    @Override
    public void onCycleBroken(String extensionPoint, PluginDescriptor released, List<? extends PluginDescriptor> cycle) {
        record("CYCLE_BROKEN", extensionPoint, released.descriptorId(),
                "cycle=" + cycle.stream().map(d -> String.valueOf(d.descriptorId())).collect(Collectors.joining(",")));
    }

    @Override
    public void onResolutionCompleted(String extensionPoint, List<? extends PluginDescriptor> resolved, int excludedCount) {
        record("RESOLUTION_COMPLETED", extensionPoint, null,
                "resolved=" + resolved.size() + ", excluded=" + excludedCount);
    }

    private void record(String eventType, String extensionPoint, UUID descriptorId, String details) {
        if (!config.isEnabled()) return;

        if (config.isLogDetails()) {
            log.info(JsonUtils.json(
                    "resolver_event", eventType.toLowerCase(),
                    "extension_point", extensionPoint,
                    "descriptor", descriptorId,
                    "details", details
            ));
        }
        synchronized (eventHistory) {
            while (eventHistory.size() >= Math.max(1, config.getMaxEventsInMemory())) {
                eventHistory.pollFirst();
            }
            eventHistory.offerLast(new ResolutionEvent(eventCounter.incrementAndGet(), Instant.now(),
                    eventType, extensionPoint, descriptorId, details));
        }
    }

    /**
     * Returns a snapshot of recent resolution events, oldest first.
     */
    public List<ResolutionEvent> getRecentEvents() {
        synchronized (eventHistory) {
            return List.copyOf(eventHistory);
        }
    }

    public List<ResolutionEvent> getRecentEvents(String eventType) {
        return getRecentEvents().stream().filter(e -> e.getEventType().equals(eventType)).collect(Collectors.toList());
    }

    /**
     * Returns the total number of events recorded, including ones already dropped from the history.
     */
    public int getTotalEventCount() {
        return eventCounter.get();
    }

    public void clearHistory() {
        synchronized (eventHistory) {
            eventHistory.clear();
        }
        log.info(JsonUtils.json(
                "event", "resolution_event_history_cleared",
                "component", "InMemoryResolutionEvents"
        ));
    }

    public static class ResolutionEvent {
        private final long id;
        private final Instant timestamp;
        private final String eventType;
        private final String extensionPoint;
        private final UUID descriptorId;
        private final String details;

        public ResolutionEvent(long id, Instant timestamp, String eventType, String extensionPoint,
                               UUID descriptorId, String details) {
            this.id = id;
            this.timestamp = timestamp;
            this.eventType = eventType;
            this.extensionPoint = extensionPoint;
            this.descriptorId = descriptorId;
            this.details = details;
        }

        public long getId() { return id; }
        public Instant getTimestamp() { return timestamp; }
        public String getEventType() { return eventType; }
        public String getExtensionPoint() { return extensionPoint; }
        public UUID getDescriptorId() { return descriptorId; }
        public String getDetails() { return details; }

        @Override
        public String toString() {
            return String.format("ResolutionEvent{id=%d, timestamp=%s, type=%s, extensionPoint=%s, descriptor=%s, details=%s}",
                    id, timestamp, eventType, extensionPoint, descriptorId, details);
        }
    }
}
