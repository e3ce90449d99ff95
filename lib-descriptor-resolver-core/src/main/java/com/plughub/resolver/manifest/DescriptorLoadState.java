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

import java.util.Objects;
import java.util.UUID;

/**
 * Persisted enablement of one descriptor. System entries belong to the host and cannot be disabled.
 * Mutable so that stores can bind it with Jackson or a properties binder.
 */
public class DescriptorLoadState {
    private UUID pluginId;
    private UUID descriptorId;
    private boolean enabled;
    private boolean system;

    public DescriptorLoadState() {
    }

    public DescriptorLoadState(UUID pluginId, UUID descriptorId, boolean enabled, boolean system) {
        this.pluginId = pluginId;
        this.descriptorId = descriptorId;
        this.enabled = enabled;
        this.system = system;
    }

    public UUID getPluginId() { return pluginId; }
    public void setPluginId(UUID pluginId) { this.pluginId = pluginId; }
    public UUID getDescriptorId() { return descriptorId; }
    public void setDescriptorId(UUID descriptorId) { this.descriptorId = descriptorId; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isSystem() { return system; }
    public void setSystem(boolean system) { this.system = system; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DescriptorLoadState)) return false;
        DescriptorLoadState that = (DescriptorLoadState) o;
        return enabled == that.enabled && system == that.system
                && Objects.equals(pluginId, that.pluginId)
                && Objects.equals(descriptorId, that.descriptorId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pluginId, descriptorId, enabled, system);
    }

    @Override
    public String toString() {
        return "DescriptorLoadState{" + pluginId + "/" + descriptorId + ", enabled=" + enabled + ", system=" + system + "}";
    }
}
