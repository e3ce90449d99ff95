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

import com.plughub.resolver.model.PluginDescriptor;
import com.plughub.resolver.observability.ResolutionEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Kahn-style topological sort over the pruned graph of a {@link ResolutionContext}.
 * <p>
 * Among all descriptors whose predecessors are already emitted, the one that came first in the input is
 * emitted next, so equal inputs always produce the same order and unconstrained descriptors keep input order.
 * When nothing is ready but descriptors remain, the hints form a cycle: under
 * {@link CyclePolicy#BREAK_BY_INPUT_ORDER} the earliest descriptor on that cycle is released and sorting
 * continues; under {@link CyclePolicy#FAIL} a {@link DescriptorCycleException} is thrown.
 */
public class DeterministicTopologicalSorter {
    private static final Logger log = LoggerFactory.getLogger(DeterministicTopologicalSorter.class);

    private final ResolutionEvents events;
    private final CyclePolicy cyclePolicy;

    public DeterministicTopologicalSorter(ResolutionEvents events, CyclePolicy cyclePolicy) {
        this.events = Objects.requireNonNull(events, "events");
        this.cyclePolicy = Objects.requireNonNull(cyclePolicy, "cyclePolicy");
    }

    public CyclePolicy cyclePolicy() {
        return cyclePolicy;
    }

    public <D extends PluginDescriptor> List<D> sort(ResolutionContext<D> context) {
        List<D> nodes = context.nodes();
        Map<UUID, D> byId = new HashMap<>();
        Map<UUID, Integer> indegree = new HashMap<>();
        Map<UUID, List<UUID>> predecessors = new HashMap<>();
        for (D d : nodes) {
            byId.put(d.descriptorId(), d);
            indegree.put(d.descriptorId(), 0);
            predecessors.put(d.descriptorId(), new ArrayList<>());
        }
        for (D d : nodes) {
            for (UUID next : context.successors(d.descriptorId())) {
                indegree.merge(next, 1, Integer::sum);
                predecessors.get(next).add(d.descriptorId());
            }
        }

        Comparator<UUID> byInput = Comparator.comparingInt(context::inputIndex);
        PriorityQueue<UUID> ready = new PriorityQueue<>(byInput);
        for (D d : nodes) {
            if (indegree.get(d.descriptorId()) == 0) ready.add(d.descriptorId());
        }

        List<D> sorted = new ArrayList<>(nodes.size());
        Set<UUID> emitted = new HashSet<>();
        while (sorted.size() < nodes.size()) {
            if (ready.isEmpty()) {
                List<UUID> cycle = findCycle(context, nodes, emitted, predecessors);
                List<D> members = cycle.stream().map(byId::get).collect(Collectors.toList());
                if (cyclePolicy == CyclePolicy.FAIL) {
                    log.error(json(
                            "resolver_event", "cycle_detected",
                            "extension_point", context.extensionPoint(),
                            "cycle", cycle
                    ));
                    throw new DescriptorCycleException(context.extensionPoint(), members);
                }
                D released = members.get(0);
                context.recordCycleBreak(new CycleBreak(released, members));
                events.onCycleBroken(context.extensionPoint(), released, members);
                ready.add(released.descriptorId());
            }

            UUID id = ready.poll();
            emitted.add(id);
            sorted.add(byId.get(id));
            for (UUID next : context.successors(id)) {
                if (emitted.contains(next)) continue;
                int remaining = indegree.merge(next, -1, Integer::sum);
                if (remaining == 0) ready.add(next);
            }
        }
        context.setSorted(sorted);
        return sorted;
    }

    /**
     * Walks predecessors from the earliest remaining descriptor until a node repeats; every remaining node has
     * at least one remaining predecessor, so the walk always closes a cycle. Returns the cycle in input order.
     */
    private static <D extends PluginDescriptor> List<UUID> findCycle(ResolutionContext<D> context,
                                                                     List<D> nodes,
                                                                     Set<UUID> emitted,
                                                                     Map<UUID, List<UUID>> predecessors) {
        UUID current = null;
        for (D d : nodes) {
            if (!emitted.contains(d.descriptorId())) {
                current = d.descriptorId();
                break;
            }
        }
        LinkedHashSet<UUID> path = new LinkedHashSet<>();
        while (current != null && path.add(current)) {
            UUID earliest = null;
            for (UUID p : predecessors.get(current)) {
                if (emitted.contains(p)) continue;
                if (earliest == null || context.inputIndex(p) < context.inputIndex(earliest)) earliest = p;
            }
            current = earliest;
        }
        if (current == null) {
            throw new ResolutionIntegrityException("No ready descriptor and no cycle in extension point '"
                    + context.extensionPoint() + "'");
        }

        List<UUID> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (UUID id : path) {
            if (id.equals(current)) inCycle = true;
            if (inCycle) cycle.add(id);
        }
        cycle.sort(Comparator.comparingInt(context::inputIndex));
        return cycle;
    }
}
