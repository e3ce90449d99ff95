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

package com.plughub.resolver.inmemory;

import com.plughub.resolver.manifest.DescriptorManifest;
import com.plughub.resolver.manifest.ManifestStore;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ManifestStore} that keeps the manifest in memory. Loads and saves work on copies, so a caller
 * mutating a loaded manifest changes nothing until it saves.
 */
public class InMemoryManifestStore implements ManifestStore {
    private DescriptorManifest manifest;
    private final AtomicInteger saves = new AtomicInteger();

    public InMemoryManifestStore() {
        this(new DescriptorManifest());
    }

    public InMemoryManifestStore(DescriptorManifest initial) {
        this.manifest = initial.copy();
    }

    @Override
    public synchronized DescriptorManifest load() {
        return manifest.copy();
    }

    @Override
    public synchronized void save(DescriptorManifest manifest) {
        this.manifest = manifest.copy();
        saves.incrementAndGet();
    }

    /** Number of times {@link #save(DescriptorManifest)} was called. */
    public int getSaveCount() {
        return saves.get();
    }
}
