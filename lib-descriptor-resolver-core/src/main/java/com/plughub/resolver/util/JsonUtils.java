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

package com.plughub.resolver.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plughub.resolver.model.DescriptorReference;
import com.plughub.resolver.model.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds single-line JSON log payloads from key/value pairs using a shared Jackson {@link ObjectMapper}.
 * Key order is preserved so diagnostics read the same way on every run.
 * <p>
 * Values are rendered as follows:
 * <ul>
 *   <li>{@code null} becomes {@code ""}</li>
 *   <li>numbers and booleans stay JSON numbers and booleans</li>
 *   <li>a {@link PluginDescriptor} or {@link DescriptorReference} becomes its descriptor id</li>
 *   <li>a collection becomes a JSON array of its rendered elements</li>
 *   <li>anything else (ids, enums, versions) becomes its {@code toString()}</li>
 * </ul>
 */
public final class JsonUtils {
    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {
    }

    /**
     * Creates a JSON object string from key-value pairs.
     *
     * @param keyValuePairs varargs of key-value pairs (key1, value1, key2, value2, ...); keys must be strings
     * @return JSON string representation of the pairs
     * @throws IllegalArgumentException if the number of arguments is odd or a key is not a string
     */
    public static String json(Object... keyValuePairs) {
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must be provided in pairs (even number of arguments)");
        }

        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            if (!(keyValuePairs[i] instanceof String)) {
                throw new IllegalArgumentException("Key at position " + i + " is not a string: " + keyValuePairs[i]);
            }
            map.put((String) keyValuePairs[i], render(keyValuePairs[i + 1]));
        }

        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.error("Failed to create JSON from key-value pairs", e);
            return "{}";
        }
    }

    private static Object render(Object value) {
        if (value == null) return "";
        if (value instanceof Number || value instanceof Boolean) return value;
        if (value instanceof PluginDescriptor) return String.valueOf(((PluginDescriptor) value).descriptorId());
        if (value instanceof DescriptorReference) return String.valueOf(((DescriptorReference) value).descriptorId());
        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                out.add(render(element));
            }
            return out;
        }
        return value.toString();
    }

    /** Truncates {@code s} to at most {@code max} characters; null becomes "". */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
