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

package com.plughub.resolver.config;

import com.plughub.resolver.aggregation.ProviderLocator;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Finds providers among the beans of an {@link ApplicationContext}, in bean registration order. */
public class ApplicationContextProviderLocator implements ProviderLocator {
    private final ApplicationContext applicationContext;

    public ApplicationContextProviderLocator(ApplicationContext applicationContext) {
        this.applicationContext = Objects.requireNonNull(applicationContext, "applicationContext");
    }

    @Override
    public <P> List<P> providersOf(Class<P> providerType) {
        return new ArrayList<>(applicationContext.getBeansOfType(providerType).values());
    }
}
