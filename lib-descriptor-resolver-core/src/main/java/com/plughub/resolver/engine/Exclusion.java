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

/**
 * One unmet constraint recorded during resolution. A descriptor may collect several of these
 * (e.g. two missing dependencies) but is excluded once.
 */
public final class Exclusion {
    private final PluginDescriptor descriptor;
    private final ExclusionReason reason;
    private final DescriptorReference constraint;
    private final PluginDescriptor counterpart;

    public Exclusion(PluginDescriptor descriptor, ExclusionReason reason, DescriptorReference constraint, PluginDescriptor counterpart) {
        this.descriptor = descriptor;
        this.reason = reason;
        this.constraint = constraint;
        this.counterpart = counterpart;
    }

    public PluginDescriptor descriptor() { return descriptor; }
    public ExclusionReason reason() { return reason; }
    /** The reference that failed; null for {@link ExclusionReason#DUPLICATE_ID}. */
    public DescriptorReference constraint() { return constraint; }
    /** The other party (kept duplicate, mismatched or excluded dependency, conflicting descriptor); null when missing. */
    public PluginDescriptor counterpart() { return counterpart; }

    @Override
    public String toString() {
        return "Exclusion{" + reason + " " + descriptor.descriptorId()
                + (constraint != null ? " via " + constraint : "") + "}";
    }
}
