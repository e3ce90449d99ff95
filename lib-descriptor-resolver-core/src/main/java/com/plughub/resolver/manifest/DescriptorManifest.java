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

package com.plughub.resolver.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Ordered list of descriptor load states as persisted by a {@link ManifestStore}. */
public class DescriptorManifest {
    private List<DescriptorLoadState> descriptorStates = new ArrayList<>();

    public DescriptorManifest() {
    }

    public DescriptorManifest(List<DescriptorLoadState> descriptorStates) {
        setDescriptorStates(descriptorStates);
    }

    public List<DescriptorLoadState> getDescriptorStates() {
        return descriptorStates;
    }

    public void setDescriptorStates(List<DescriptorLoadState> descriptorStates) {
        this.descriptorStates = descriptorStates == null ? new ArrayList<>() : new ArrayList<>(descriptorStates);
    }

    public Optional<DescriptorLoadState> find(UUID descriptorId) {
        for (DescriptorLoadState state : descriptorStates) {
            if (state != null && descriptorId.equals(state.getDescriptorId())) return Optional.of(state);
        }
        return Optional.empty();
    }

    /** Deep copy, so callers can mutate without touching the stored instance. */
    public DescriptorManifest copy() {
        List<DescriptorLoadState> states = new ArrayList<>(descriptorStates.size());
        for (DescriptorLoadState s : descriptorStates) {
            if (s == null) continue;
            states.add(new DescriptorLoadState(s.getPluginId(), s.getDescriptorId(), s.isEnabled(), s.isSystem()));
        }
        return new DescriptorManifest(states);
    }
}
