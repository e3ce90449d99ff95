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

/**
 * Why a descriptor was left out of the resolved sequence.
 */
public enum ExclusionReason {
    /** Another descriptor with the same descriptor id appeared earlier in the input. */
    DUPLICATE_ID,
    /** A {@code dependsOn} target is not part of the batch. */
    MISSING_DEPENDENCY,
    /** A {@code dependsOn} target exists but its version is outside the window. */
    VERSION_MISMATCH,
    /** The descriptor declared a conflict with another descriptor of the batch. */
    CONFLICT
}
