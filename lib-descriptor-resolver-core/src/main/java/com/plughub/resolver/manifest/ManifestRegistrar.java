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

import com.plughub.resolver.model.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.plughub.resolver.util.JsonUtils.json;

/**
 * Keeps the persisted descriptor manifest in line with the descriptors actually discovered, and answers
 * which of them the user has enabled.
 * <p>
 * The store is only written when an operation changed something.
 */
public class ManifestRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ManifestRegistrar.class);

    private final ManifestStore store;
    private final boolean defaultEnabled;

    public ManifestRegistrar(ManifestStore store, boolean defaultEnabled) {
        this.store = Objects.requireNonNull(store, "store");
        this.defaultEnabled = defaultEnabled;
    }

    public boolean isDefaultEnabled() {
        return defaultEnabled;
    }

    /**
     * Adds entries for newly discovered descriptors and drops entries that are neither discovered nor enabled.
     * Enabled entries for descriptors that are gone are kept, so a plugin removed temporarily comes back
     * with its state intact.
     */
    public synchronized void synchronize(Collection<? extends PluginDescriptor> discovered) {
        DescriptorManifest manifest = loadManifest();
        log.info(json(
                "resolver_event", "manifest_synchronize",
                "entries", manifest.getDescriptorStates().size(),
                "discovered", discovered.size()
        ));

        boolean added = addMissing(manifest, discovered);
        boolean removed = removeStale(manifest, discovered);
        if (added || removed) {
            store.save(manifest);
            log.info(json(
                    "resolver_event", "manifest_saved",
                    "entries", manifest.getDescriptorStates().size()
            ));
        }
    }

    /** Adds entries for descriptors the manifest has not seen yet; never removes anything. */
    public synchronized void registerDiscovered(Collection<? extends PluginDescriptor> discovered) {
        DescriptorManifest manifest = loadManifest();
        if (addMissing(manifest, discovered)) {
            store.save(manifest);
        }
    }

    public synchronized boolean isEnabled(UUID descriptorId) {
        return loadManifest().find(descriptorId).map(DescriptorLoadState::isEnabled).orElse(false);
    }

    public void setEnabled(UUID descriptorId) {
        setEnableState(descriptorId, true);
    }

    public void setDisabled(UUID descriptorId) {
        setEnableState(descriptorId, false);
    }

    /** Descriptors whose manifest entry is enabled, in input order. Unknown descriptors are dropped. */
    public synchronized <D extends PluginDescriptor> List<D> filterEnabled(Collection<? extends D> descriptors) {
        DescriptorManifest manifest = loadManifest();
        Set<UUID> enabled = new HashSet<>();
        for (DescriptorLoadState state : manifest.getDescriptorStates()) {
            if (state != null && state.isEnabled()) enabled.add(state.getDescriptorId());
        }
        List<D> out = new ArrayList<>(descriptors.size());
        for (D d : descriptors) {
            if (d != null && enabled.contains(d.descriptorId())) out.add(d);
        }
        return out;
    }

    private synchronized void setEnableState(UUID descriptorId, boolean enabled) {
        DescriptorManifest manifest = loadManifest();
        Optional<DescriptorLoadState> found = manifest.find(descriptorId);
        if (found.isEmpty()) {
            log.warn(json(
                    "resolver_event", "manifest_entry_missing",
                    "descriptor", descriptorId,
                    "enabled", enabled
            ));
            return;
        }
        DescriptorLoadState state = found.get();
        if (!enabled && state.isSystem()) {
            log.warn(json(
                    "resolver_event", "manifest_system_entry",
                    "descriptor", descriptorId,
                    "action", "disable_refused"
            ));
            return;
        }
        if (state.isEnabled() == enabled) {
            log.info(json(
                    "resolver_event", "manifest_unchanged",
                    "descriptor", descriptorId,
                    "enabled", enabled
            ));
            return;
        }
        state.setEnabled(enabled);
        store.save(manifest);
        log.info(json(
                "resolver_event", "manifest_state_changed",
                "plugin", state.getPluginId(),
                "descriptor", descriptorId,
                "enabled", enabled
        ));
    }

    private DescriptorManifest loadManifest() {
        DescriptorManifest manifest = store.load();
        if (manifest == null) {
            throw new IllegalStateException("Manifest store returned no manifest");
        }
        return manifest;
    }

    private boolean addMissing(DescriptorManifest manifest, Collection<? extends PluginDescriptor> discovered) {
        boolean changed = false;
        for (PluginDescriptor d : discovered) {
            if (d == null || manifest.find(d.descriptorId()).isPresent()) continue;
            manifest.getDescriptorStates().add(new DescriptorLoadState(d.pluginId(), d.descriptorId(), defaultEnabled, false));
            changed = true;
            log.info(json(
                    "resolver_event", "manifest_entry_added",
                    "plugin", d.pluginId(),
                    "descriptor", d,
                    "enabled", defaultEnabled
            ));
        }
        return changed;
    }

    private static boolean removeStale(DescriptorManifest manifest, Collection<? extends PluginDescriptor> discovered) {
        Set<UUID> ids = new HashSet<>();
        for (PluginDescriptor d : discovered) {
            if (d != null) ids.add(d.descriptorId());
        }
        boolean changed = false;
        Iterator<DescriptorLoadState> it = manifest.getDescriptorStates().iterator();
        while (it.hasNext()) {
            DescriptorLoadState state = it.next();
            if (state == null || (!ids.contains(state.getDescriptorId()) && !state.isEnabled())) {
                it.remove();
                changed = true;
                if (state != null) {
                    log.info(json(
                            "resolver_event", "manifest_entry_removed",
                            "plugin", state.getPluginId(),
                            "descriptor", state.getDescriptorId()
                    ));
                }
            }
        }
        return changed;
    }
}
