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

package org.apache.nanocube.query;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link QuerySignature} and {@link Query}. */
class QuerySignatureTest {

    @Test
    void testFilterOrderAndDuplicatesAreIgnored() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("customer", Arrays.asList("B", "A", "B"));
        first.put("product", Collections.singletonList("P1"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("product", Collections.singletonList("P1"));
        second.put("customer", Arrays.asList("A", "B"));

        QuerySignature a = signature(Aggregation.SUM, first);
        QuerySignature b = signature(Aggregation.SUM, second);
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.filters().keySet()).containsExactly("customer", "product");
        assertThat(a.filters().get("customer")).containsExactly("A", "B");

        assertThat(signature(Aggregation.MEAN, first)).isNotEqualTo(a);
    }

    @Test
    void testNullMemberSortsFirst() {
        Map<String, Object> filters = new HashMap<>();
        filters.put("region", Arrays.asList("west", null, "east"));
        assertThat(signature(Aggregation.SUM, filters).filters().get("region"))
                .containsExactly(null, "east", "west");
    }

    @Test
    void testMeasureOrderIsKept() {
        QuerySignature a =
                QuerySignature.of(
                        Aggregation.SUM, Arrays.asList("units", "price"), Collections.emptyMap());
        QuerySignature b =
                QuerySignature.of(
                        Aggregation.SUM, Arrays.asList("price", "units"), Collections.emptyMap());
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void testQueryBuilder() {
        Query query =
                Query.builder()
                        .measures("sales")
                        .filter("customer", "A")
                        .filterAny("product", "P1", "P2")
                        .filter("customer", "B")
                        .build();

        assertThat(query.aggregation()).isEqualTo(Aggregation.SUM);
        assertThat(query.filters().get("customer")).isEqualTo(FilterValue.of("B"));
        assertThat(query.filters().get("product").isSingle()).isFalse();
        assertThat(query.filters().get("product").members()).containsExactly("P1", "P2");

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("customer", "B");
        filters.put("product", new Object[] {"P1", "P2"});
        assertThat(Query.of(Collections.singletonList("sales"), filters, Aggregation.SUM))
                .isEqualTo(query);
    }

    private static QuerySignature signature(Aggregation aggregation, Map<String, Object> filters) {
        Map<String, Collection<?>> members = new LinkedHashMap<>();
        filters.forEach((k, v) -> members.put(k, (Collection<?>) v));
        return QuerySignature.of(aggregation, Collections.singletonList("sales"), members);
    }
}
