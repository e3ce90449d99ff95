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

package com.plughub.resolver.engine;

import com.plughub.resolver.model.DescriptorReference;
import com.plughub.resolver.model.PluginDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * State of a single resolution run: the deduplicated descriptors in input order, the identity index,
 * the ordering graph and the exclusion sets.
 * <p>
 * Graph edges point from a descriptor to the descriptors that must be ordered after it. Nodes are keyed by
 * descriptor id, which deduplication makes unique.
 * <p>
 * A context is created per call and never shared, so it carries no synchronization.
 */
public class ResolutionContext<D extends PluginDescriptor> {
    private final String extensionPoint;
    private final List<D> descriptors = new ArrayList<>();
    // HashMap on purpose: the evaluator distinguishes "no key" from "key with no value"
    final Map<UUID, D> index = new HashMap<>();
    private final Map<UUID, Integer> inputOrder = new HashMap<>();
    private final Map<UUID, Set<UUID>> graph = new LinkedHashMap<>();

    private final List<D> duplicates = new ArrayList<>();
    private final Map<UUID, D> dependencyDisabled = new LinkedHashMap<>();
    private final Map<UUID, D> conflictDisabled = new LinkedHashMap<>();
    private final List<Exclusion> exclusions = new ArrayList<>();
    private final List<CycleBreak> cycleBreaks = new ArrayList<>();
    private List<D> sorted = List.of();

    ResolutionContext(String extensionPoint) {
        this.extensionPoint = extensionPoint;
    }

    public String extensionPoint() {
        return extensionPoint;
    }

    // --- building ---

    void add(D descriptor) {
        UUID id = descriptor.descriptorId();
        inputOrder.put(id, descriptors.size());
        descriptors.add(descriptor);
        index.put(id, descriptor);
        graph.put(id, new LinkedHashSet<>());
    }

    void markDuplicate(D duplicate, D kept) {
        duplicates.add(duplicate);
        exclusions.add(new Exclusion(duplicate, ExclusionReason.DUPLICATE_ID, null, kept));
    }

    // --- lookups ---

    /** Deduplicated descriptors, in input order. */
    public List<D> descriptors() {
        return Collections.unmodifiableList(descriptors);
    }

    public boolean containsId(UUID descriptorId) {
        return index.containsKey(descriptorId);
    }

    /** Raw index access; may return null only if the index is corrupt. */
    D indexed(UUID descriptorId) {
        return index.get(descriptorId);
    }

    int inputIndex(UUID descriptorId) {
        Integer i = inputOrder.get(descriptorId);
        if (i == null) {
            throw new ResolutionIntegrityException("No input position recorded for descriptor " + descriptorId);
        }
        return i;
    }

    // --- graph ---

    /** Records that {@code first} must be ordered before {@code then}. */
    void addEdge(D first, D then) {
        Set<UUID> successors = graph.get(first.descriptorId());
        if (successors != null && graph.containsKey(then.descriptorId())) {
            successors.add(then.descriptorId());
        }
    }

    void removeNode(UUID descriptorId) {
        graph.remove(descriptorId);
        for (Set<UUID> successors : graph.values()) {
            successors.remove(descriptorId);
        }
    }

    /** Descriptors still present in the graph, in input order. */
    public List<D> nodes() {
        List<D> out = new ArrayList<>(graph.size());
        for (D d : descriptors) {
            if (graph.containsKey(d.descriptorId())) out.add(d);
        }
        return out;
    }

    /** Descriptors that must be ordered after {@code descriptor}; empty when it is not a node. */
    public Set<UUID> successors(UUID descriptorId) {
        Set<UUID> s = graph.get(descriptorId);
        return s == null ? Set.of() : Collections.unmodifiableSet(s);
    }

    // --- exclusions ---

    void markDependencyDisabled(D descriptor, ExclusionReason reason, DescriptorReference dependency, PluginDescriptor found) {
        dependencyDisabled.putIfAbsent(descriptor.descriptorId(), descriptor);
        exclusions.add(new Exclusion(descriptor, reason, dependency, found));
    }

    void markConflictDisabled(D descriptor, DescriptorReference conflict, PluginDescriptor other) {
        conflictDisabled.putIfAbsent(descriptor.descriptorId(), descriptor);
        exclusions.add(new Exclusion(descriptor, ExclusionReason.CONFLICT, conflict, other));
    }

    public boolean isExcluded(UUID descriptorId) {
        return dependencyDisabled.containsKey(descriptorId) || conflictDisabled.containsKey(descriptorId);
    }

    public List<D> duplicates() {
        return Collections.unmodifiableList(duplicates);
    }

    public Collection<D> dependencyDisabled() {
        return Collections.unmodifiableCollection(dependencyDisabled.values());
    }

    public Collection<D> conflictDisabled() {
        return Collections.unmodifiableCollection(conflictDisabled.values());
    }

    /** Every excluded descriptor once: duplicates first, then constraint failures in input order. */
    public List<D> excluded() {
        List<D> out = new ArrayList<>(duplicates);
        for (D d : descriptors) {
            if (isExcluded(d.descriptorId())) out.add(d);
        }
        return out;
    }

    /** All recorded unmet constraints, in the order they were detected. */
    public List<Exclusion> exclusions() {
        return Collections.unmodifiableList(exclusions);
    }

    // --- sorting ---

    void recordCycleBreak(CycleBreak cycleBreak) {
        cycleBreaks.add(cycleBreak);
    }

    public List<CycleBreak> cycleBreaks() {
        return Collections.unmodifiableList(cycleBreaks);
    }

    void setSorted(List<D> sorted) {
        this.sorted = List.copyOf(sorted);
    }

    /** The final order; empty until the sorter has run. */
    public List<D> sorted() {
        return sorted;
    }
}
