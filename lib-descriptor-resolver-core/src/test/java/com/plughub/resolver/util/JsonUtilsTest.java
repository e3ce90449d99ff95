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

import com.plughub.resolver.engine.CyclePolicy;
import com.plughub.resolver.model.PluginDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.plughub.resolver.TestDescriptors.descriptor;
import static com.plughub.resolver.TestDescriptors.id;
import static com.plughub.resolver.TestDescriptors.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonUtilsTest {

    @Test
    void keepsKeyOrderAndEscapesValues() {
        assertEquals("{\"b\":\"1\",\"a\":\"say \\\"hi\\\"\",\"c\":\"\"}",
                JsonUtils.json("b", "1", "a", "say \"hi\"", "c", null));
    }

    @Test
    void rendersDomainValues() {
        PluginDescriptor a = descriptor("A").build();
        PluginDescriptor b = descriptor("B").build();

        String out = JsonUtils.json(
                "descriptor", a,
                "dependency", ref("C"),
                "id", id("D"),
                "count", 3,
                "enabled", true,
                "policy", CyclePolicy.FAIL,
                "order", List.of(a, b));

        assertEquals("{\"descriptor\":\"" + id("A") + "\","
                + "\"dependency\":\"" + id("C") + "\","
                + "\"id\":\"" + id("D") + "\","
                + "\"count\":3,"
                + "\"enabled\":true,"
                + "\"policy\":\"FAIL\","
                + "\"order\":[\"" + id("A") + "\",\"" + id("B") + "\"]}", out);
    }

    @Test
    void oddArgumentCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.json("a"));
    }

    @Test
    void nonStringKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.json(1, "a"));
    }

    @Test
    void truncateCapsLength() {
        assertEquals("abc", JsonUtils.truncate("abcdef", 3));
        assertEquals("ab", JsonUtils.truncate("ab", 3));
        assertEquals("", JsonUtils.truncate(null, 3));
    }
}
