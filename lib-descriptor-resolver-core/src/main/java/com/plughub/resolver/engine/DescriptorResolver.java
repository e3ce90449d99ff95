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
import com.plughub.resolver.observability.ResolutionLoggerEvents;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of descriptor resolution: deduplicate, evaluate constraints, prune, sort.
 * <p>
 * The resolver holds no per-call state; each call builds its own {@link ResolutionContext}, so one instance
 * can serve any number of threads and extension points. Excluded descriptors are simply absent from the
 * result; the reasons go to {@link ResolutionEvents} and to {@link ResolutionContext#exclusions()}.
 */
public class DescriptorResolver {
    public static final String DEFAULT_EXTENSION_POINT = "default";

    private final ResolutionEvents events;
    private final ResolutionContextBuilder contextBuilder;
    private final ConstraintEvaluator evaluator;
    private final DeterministicTopologicalSorter sorter;

    public DescriptorResolver() {
        this(new ResolutionLoggerEvents(), CyclePolicy.BREAK_BY_INPUT_ORDER);
    }

    public DescriptorResolver(ResolutionEvents events, CyclePolicy cyclePolicy) {
        this.events = Objects.requireNonNull(events, "events");
        this.contextBuilder = new ResolutionContextBuilder(events);
        this.evaluator = new ConstraintEvaluator(events);
        this.sorter = new DeterministicTopologicalSorter(events, cyclePolicy);
    }

    public CyclePolicy cyclePolicy() {
        return sorter.cyclePolicy();
    }

    public <D extends PluginDescriptor> List<D> resolve(Collection<? extends D> descriptors) {
        return resolve(DEFAULT_EXTENSION_POINT, descriptors);
    }

    /**
     * Returns the surviving descriptors in a deterministic, dependency-valid, conflict-free order.
     *
     * @param extensionPoint label used in diagnostics only
     * @throws NullPointerException if {@code descriptors} is null
     * @throws ResolutionIntegrityException if internal state is found inconsistent
     * @throws DescriptorCycleException if ordering hints cycle and the policy is {@link CyclePolicy#FAIL}
     */
    public <D extends PluginDescriptor> List<D> resolve(String extensionPoint, Collection<? extends D> descriptors) {
        ResolutionContext<D> context = resolveContext(extensionPoint, descriptors);
        return context.sorted();
    }

    public <D extends PluginDescriptor> ResolutionContext<D> resolveContext(Collection<? extends D> descriptors) {
        return resolveContext(DEFAULT_EXTENSION_POINT, descriptors);
    }

    /** Like {@link #resolve(String, Collection)} but returns the whole context, exclusions included. */
    public <D extends PluginDescriptor> ResolutionContext<D> resolveContext(String extensionPoint, Collection<? extends D> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        String label = extensionPoint == null || extensionPoint.isBlank() ? DEFAULT_EXTENSION_POINT : extensionPoint;

        events.onResolutionStarted(label, descriptors.size());
        ResolutionContext<D> context = contextBuilder.build(label, descriptors);
        evaluator.evaluate(context);
        List<D> sorted = sorter.sort(context);
        events.onResolutionCompleted(label, sorted, context.excluded().size());
        return context;
    }
}
