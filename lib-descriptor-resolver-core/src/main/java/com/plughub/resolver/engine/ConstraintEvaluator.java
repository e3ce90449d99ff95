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
import com.plughub.resolver.observability.ResolutionEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Classifies every descriptor of a context against its relation lists, adds load-order edges and prunes
 * excluded descriptors from the graph.
 * <p>
 * Rules:
 * - dependsOn: all references must resolve to a present descriptor inside the version window (AND semantics).
 *   Only presence and version are checked; a dependency that is itself excluded still satisfies the reference.
 * - conflictsWith: the first other descriptor matching any conflict reference excludes the declaring
 *   descriptor only. The target is unaffected unless it declares the conflict as well.
 * - loadBefore / loadAfter: add an edge when the target is present, matches and is not excluded.
 *   Self references are ignored.
 * None of the data problems above throw; only a corrupt identity index does.
 */
public class ConstraintEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConstraintEvaluator.class);

    private final ResolutionEvents events;

    public ConstraintEvaluator(ResolutionEvents events) {
        this.events = Objects.requireNonNull(events, "events");
    }

    public <D extends PluginDescriptor> void evaluate(ResolutionContext<D> context) {
        List<D> descriptors = context.descriptors();
        for (D descriptor : descriptors) {
            processDependencies(descriptor, context);
            processConflicts(descriptor, context);
            processLoadBefore(descriptor, context);
            processLoadAfter(descriptor, context);
        }
        removeInvalidDescriptors(context);
    }

    private <D extends PluginDescriptor> void processDependencies(D descriptor, ResolutionContext<D> context) {
        for (DescriptorReference dep : descriptor.dependsOn()) {
            D found = lookup(context, dep, descriptor, "dependsOn");
            if (found == null) {
                context.markDependencyDisabled(descriptor, ExclusionReason.MISSING_DEPENDENCY, dep, null);
                events.onDependencyUnsatisfied(context.extensionPoint(), descriptor, dep, null);
            } else if (!dep.matches(found)) {
                context.markDependencyDisabled(descriptor, ExclusionReason.VERSION_MISMATCH, dep, found);
                events.onDependencyUnsatisfied(context.extensionPoint(), descriptor, dep, found);
            }
        }
    }

    private <D extends PluginDescriptor> void processConflicts(D descriptor, ResolutionContext<D> context) {
        if (descriptor.conflictsWith().isEmpty()) return;

        for (D other : context.nodes()) {
            if (other == descriptor) continue;
            for (DescriptorReference conflict : descriptor.conflictsWith()) {
                if (conflict.matches(other)) {
                    context.markConflictDisabled(descriptor, conflict, other);
                    events.onConflict(context.extensionPoint(), descriptor, conflict, other);
                    return;
                }
            }
        }
    }

    private <D extends PluginDescriptor> void processLoadBefore(D descriptor, ResolutionContext<D> context) {
        for (DescriptorReference before : descriptor.loadBefore()) {
            D target = orderingTarget(context, before, descriptor, "loadBefore");
            if (target != null) {
                context.addEdge(descriptor, target);
                log.debug(json(
                        "resolver_event", "edge",
                        "extension_point", context.extensionPoint(),
                        "first", descriptor,
                        "then", target
                ));
            }
        }
    }

    private <D extends PluginDescriptor> void processLoadAfter(D descriptor, ResolutionContext<D> context) {
        for (DescriptorReference after : descriptor.loadAfter()) {
            D target = orderingTarget(context, after, descriptor, "loadAfter");
            if (target != null) {
                context.addEdge(target, descriptor);
                log.debug(json(
                        "resolver_event", "edge",
                        "extension_point", context.extensionPoint(),
                        "first", target,
                        "then", descriptor
                ));
            }
        }
    }

    private <D extends PluginDescriptor> D orderingTarget(ResolutionContext<D> context, DescriptorReference ref, D descriptor, String relation) {
        D target = lookup(context, ref, descriptor, relation);
        if (target == null || target == descriptor) return null;
        if (!ref.matches(target) || context.isExcluded(target.descriptorId())) return null;
        return target;
    }

    private static <D extends PluginDescriptor> void removeInvalidDescriptors(ResolutionContext<D> context) {
        List<UUID> invalid = new ArrayList<>();
        for (D d : context.descriptors()) {
            if (context.isExcluded(d.descriptorId())) invalid.add(d.descriptorId());
        }
        for (UUID id : invalid) {
            context.removeNode(id);
        }
    }

    private <D extends PluginDescriptor> D lookup(ResolutionContext<D> context, DescriptorReference ref, D owner, String relation) {
        if (!context.containsId(ref.descriptorId())) {
            return null;
        }
        D found = context.indexed(ref.descriptorId());
        if (found == null) {
            log.error(json(
                    "resolver_event", "index_integrity_violation",
                    "extension_point", context.extensionPoint(),
                    "descriptor", owner,
                    "relation", relation,
                    "target", ref
            ));
            throw new ResolutionIntegrityException("Descriptor lookup returned null for " + ref.descriptorId()
                    + " despite the index containing it (" + relation + " of " + owner.descriptorId() + ")");
        }
        return found;
    }
}
