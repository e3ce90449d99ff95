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
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.plughub.resolver.TestDescriptors.descriptor;
import static com.plughub.resolver.TestDescriptors.names;
import static com.plughub.resolver.TestDescriptors.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DeterministicTopologicalSorterTest {

    private final ResolutionEvents events = mock(ResolutionEvents.class);

    private ResolutionContext<PluginDescriptor> prepared(PluginDescriptor... descriptors) {
        ResolutionContext<PluginDescriptor> ctx = new ResolutionContextBuilder(events).build("ep", List.of(descriptors));
        new ConstraintEvaluator(events).evaluate(ctx);
        return ctx;
    }

    @Test
    void readyDescriptorsAreEmittedInInputOrder() {
        // D must follow A; B and C are free
        PluginDescriptor d = descriptor("D").loadAfter(ref("A")).build();
        PluginDescriptor c = descriptor("C").build();
        PluginDescriptor a = descriptor("A").build();
        PluginDescriptor b = descriptor("B").build();

        ResolutionContext<PluginDescriptor> ctx = prepared(d, c, a, b);
        List<PluginDescriptor> sorted = new DeterministicTopologicalSorter(events, CyclePolicy.BREAK_BY_INPUT_ORDER).sort(ctx);

        assertThat(names(sorted)).containsExactly("C", "A", "D", "B");
        assertThat(ctx.sorted()).isEqualTo(sorted);
    }

    @Test
    void diamondOrdersEveryEdge() {
        PluginDescriptor top = descriptor("A").loadBefore(ref("B"), ref("C")).build();
        PluginDescriptor left = descriptor("B").loadBefore(ref("D")).build();
        PluginDescriptor right = descriptor("C").loadBefore(ref("D")).build();
        PluginDescriptor bottom = descriptor("D").build();

        List<PluginDescriptor> sorted = new DeterministicTopologicalSorter(events, CyclePolicy.BREAK_BY_INPUT_ORDER)
                .sort(prepared(bottom, right, left, top));

        assertThat(names(sorted)).containsExactly("A", "C", "B", "D");
    }

    @Test
    void breaksThreeNodeCycleAtEarliestMember() {
        PluginDescriptor a = descriptor("A").loadBefore(ref("B")).build();
        PluginDescriptor b = descriptor("B").loadBefore(ref("C")).build();
        PluginDescriptor c = descriptor("C").loadBefore(ref("A")).build();
        PluginDescriptor tail = descriptor("T").loadAfter(ref("C")).build();

        ResolutionContext<PluginDescriptor> ctx = prepared(tail, c, b, a);
        List<PluginDescriptor> sorted = new DeterministicTopologicalSorter(events, CyclePolicy.BREAK_BY_INPUT_ORDER).sort(ctx);

        // C is the earliest cycle member in the input
        assertThat(names(sorted)).containsExactly("C", "T", "A", "B");
        assertThat(ctx.cycleBreaks()).singleElement().satisfies(br -> {
            assertThat(br.released()).isSameAs(c);
            assertThat(br.cycle()).containsExactly(c, b, a);
        });
        verify(events).onCycleBroken("ep", c, List.of(c, b, a));
    }

    @Test
    void failPolicyNamesRemainingCycle() {
        PluginDescriptor free = descriptor("F").build();
        PluginDescriptor a = descriptor("A").loadAfter(ref("B")).build();
        PluginDescriptor b = descriptor("B").loadAfter(ref("A")).build();

        ResolutionContext<PluginDescriptor> ctx = prepared(free, a, b);

        assertThatThrownBy(() -> new DeterministicTopologicalSorter(events, CyclePolicy.FAIL).sort(ctx))
                .isInstanceOfSatisfying(DescriptorCycleException.class,
                        ex -> assertThat(ex.cycle()).containsExactly(a, b));
    }
}
