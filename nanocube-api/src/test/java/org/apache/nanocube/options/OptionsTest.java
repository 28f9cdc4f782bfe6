/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.nanocube.options;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.apache.nanocube.options.ConfigOptions.key;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options}. */
class OptionsTest {

    private enum Mode {
        FAST,
        SORTED_ARRAY
    }

    private static final ConfigOption<Boolean> FLAG =
            key("flag").booleanType().defaultValue(true).withDescription("A flag.");

    private static final ConfigOption<Long> LIMIT =
            key("limit").longType().defaultValue(100L).withDescription("A limit.");

    private static final ConfigOption<Mode> MODE =
            key("mode").enumType(Mode.class).defaultValue(Mode.FAST).withDescription("A mode.");

    private static final ConfigOption<String> NAME = key("name").stringType().noDefaultValue();

    @Test
    void testDefaultValues() {
        Options options = new Options();
        assertThat(options.get(FLAG)).isTrue();
        assertThat(options.get(LIMIT)).isEqualTo(100L);
        assertThat(options.get(MODE)).isEqualTo(Mode.FAST);
        assertThat(options.get(NAME)).isNull();
        assertThat(options.contains(FLAG)).isFalse();
    }

    @Test
    void testParseFromStrings() {
        Map<String, String> map = new HashMap<>();
        map.put("flag", "FALSE");
        map.put("limit", " 42 ");
        map.put("mode", "sorted-array");
        Options options = Options.fromMap(map);

        assertThat(options.get(FLAG)).isFalse();
        assertThat(options.get(LIMIT)).isEqualTo(42L);
        assertThat(options.get(MODE)).isEqualTo(Mode.SORTED_ARRAY);
    }

    @Test
    void testTypedSetRoundTripsThroughStrings() {
        Options options = new Options();
        options.set(MODE, Mode.SORTED_ARRAY);
        options.set(LIMIT, -1L);

        assertThat(options.get("mode")).isEqualTo("sorted-array");
        assertThat(options.get(MODE)).isEqualTo(Mode.SORTED_ARRAY);
        assertThat(options.get(LIMIT)).isEqualTo(-1L);
        assertThat(options.toMap()).containsEntry("limit", "-1");
    }

    @Test
    void testInvalidValueNamesTheKey() {
        Options options = new Options();
        options.setString("limit", "lots");

        assertThatThrownBy(() -> options.get(LIMIT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'lots'")
                .hasMessageContaining("'limit'");

        options.setString("mode", "slow");
        assertThatThrownBy(() -> options.get(MODE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'mode'");
    }

    @Test
    void testRemove() {
        Options options = new Options();
        options.set(FLAG, false);
        options.remove(FLAG);
        assertThat(options.get(FLAG)).isTrue();
        assertThat(options.keySet()).isEmpty();
    }
}
