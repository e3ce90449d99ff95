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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.plughub.resolver.TestDescriptors.descriptor;
import static com.plughub.resolver.TestDescriptors.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ResolutionContextBuilderTest {

    @Test
    void indexesDescriptorsAndSeedsOneNodeEach() {
        ResolutionEvents events = mock(ResolutionEvents.class);
        PluginDescriptor a = descriptor("A").build();
        PluginDescriptor b = descriptor("B").build();

        ResolutionContext<PluginDescriptor> ctx = new ResolutionContextBuilder(events).build("ep", List.of(a, b));

        assertThat(ctx.extensionPoint()).isEqualTo("ep");
        assertThat(ctx.descriptors()).containsExactly(a, b);
        assertThat(ctx.nodes()).containsExactly(a, b);
        assertThat(ctx.containsId(id("A"))).isTrue();
        assertThat(ctx.successors(id("A"))).isEmpty();
        assertThat(ctx.inputIndex(id("B"))).isEqualTo(1);
        verifyNoInteractions(events);
    }

    @Test
    void duplicatesKeepFirstAndAreReported() {
        ResolutionEvents events = mock(ResolutionEvents.class);
        PluginDescriptor first = descriptor("A", "1.0.0").build();
        PluginDescriptor second = descriptor("A", "1.1.0").build();

        ResolutionContext<PluginDescriptor> ctx = new ResolutionContextBuilder(events).build("ep", List.of(first, second));

        assertThat(ctx.descriptors()).containsExactly(first);
        assertThat(ctx.duplicates()).containsExactly(second);
        assertThat(ctx.excluded()).containsExactly(second);
        verify(events).onDuplicateDescriptor("ep", second, first);
    }

    @Test
    void snapshotsInputSoLaterChangesDoNotLeakIn() {
        List<PluginDescriptor> input = new ArrayList<>(List.of(descriptor("A").build()));
        ResolutionContext<PluginDescriptor> ctx = new ResolutionContextBuilder(new ResolutionEvents() {}).build("ep", input);

        input.add(descriptor("B").build());

        assertThat(ctx.descriptors()).hasSize(1);
    }

    @Test
    void skipsNullElements() {
        PluginDescriptor a = descriptor("A").build();
        ResolutionContext<PluginDescriptor> ctx = new ResolutionContextBuilder(new ResolutionEvents() {})
                .build("ep", Arrays.asList(null, a));

        assertThat(ctx.descriptors()).containsExactly(a);
        assertThat(ctx.inputIndex(id("A"))).isZero();
    }
}
