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

package com.plughub.resolver.annotations;

import com.plughub.resolver.config.DescriptorResolverConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables descriptor resolution components in a Spring application.
 * <p>
 * Imports {@link com.plughub.resolver.config.DescriptorResolverConfiguration} that wires:
 * - {@code DescriptorResolver}: the resolution engine, with the configured cycle policy
 * - {@code ResolutionEvents}: logger-based diagnostics (override by declaring your own bean)
 * - {@code ExtensionPointRegistry}: every {@code ExtensionPoint} bean in the context
 * - {@code DescriptorAggregator}: collects, filters and resolves descriptors per extension point
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(DescriptorResolverConfiguration.class)
public @interface EnableDescriptorResolver {
}
