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

package org.apache.nanocube.io;

import org.apache.nanocube.CubeOptions;
import org.apache.nanocube.CubeTestUtils;
import org.apache.nanocube.NanoCube;
import org.apache.nanocube.compression.BlockCompressionType;
import org.apache.nanocube.data.InMemoryTable;
import org.apache.nanocube.index.IndexingMethod;
import org.apache.nanocube.query.Aggregation;
import org.apache.nanocube.schema.Dimension;
import org.apache.nanocube.schema.Measure;
import org.apache.nanocube.types.DataTypes;
import org.apache.nanocube.utils.JsonSerdeUtil;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link CubeFileFormat}. */
class CubeFileFormatTest {

    @TempDir Path tempDir;

    static Stream<Arguments> methodsAndCompressions() {
        List<Arguments> arguments = new ArrayList<>();
        for (IndexingMethod method : IndexingMethod.values()) {
            for (String compression : Arrays.asList("none", "zstd", "lz4")) {
                arguments.add(Arguments.of(method, compression));
            }
        }
        return arguments.stream();
    }

    @ParameterizedTest
    @MethodSource("methodsAndCompressions")
    void testSaveAndLoad(IndexingMethod method, String compression) throws IOException {
        NanoCube cube =
                NanoCube.builder(CubeTestUtils.randomTable(3, 1_500))
                        .indexingMethod(method)
                        .option(CubeOptions.FILE_COMPRESSION, compression)
                        .build();
        Path file = tempDir.resolve("cube.nc");
        cube.save(file);

        // indexing method comes from the file, not from the load options
        NanoCube loaded = NanoCube.load(file);
        assertThat(loaded.indexingMethod()).isEqualTo(method);
        assertSameCube(loaded, cube);

        assertThat(
                        loaded.get(
                                        Arrays.asList("units", "price"),
                                        Collections.singletonMap("customer", "B"),
                                        Aggregation.MEAN)
                                .asList())
                .isEqualTo(
                        cube.get(
                                        Arrays.asList("units", "price"),
                                        Collections.singletonMap("customer", "B"),
                                        Aggregation.MEAN)
                                .asList());
    }

    @Test
    void testAllMemberTypes() throws IOException {
        LocalDateTime noon = LocalDateTime.of(2024, 3, 1, 12, 0, 0, 500_000_000);
        InMemoryTable table =
                InMemoryTable.builder()
                        .field("flag", DataTypes.BOOLEAN())
                        .field("year", DataTypes.SMALLINT())
                        .field("ratio", DataTypes.DOUBLE())
                        .field("day", DataTypes.DATE())
                        .field("at", DataTypes.TIMESTAMP())
                        .field("name", DataTypes.CHAR())
                        .field("amount", DataTypes.BIGINT())
                        .addRow(true, 2023, 0.5, LocalDate.of(2023, 1, 1), noon, "x", 1L)
                        .addRow(false, 2024, Double.NaN, LocalDate.of(2024, 1, 1), noon, "y", 2L)
                        .addRow(null, 2024, -0.25, null, null, null, 4L)
                        .build();
        NanoCube cube =
                NanoCube.builder(table)
                        .dimensions("flag", "year", "ratio", "day", "at", "name")
                        .option(CubeOptions.FILE_COMPRESSION, "none")
                        .build();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        cube.save(out);
        NanoCube loaded =
                NanoCube.load(new ByteArrayInputStream(out.toByteArray()), CubeOptions.defaults());

        assertSameCube(loaded, cube);
        assertThat(loaded.dimension("ratio").members()).containsExactly(-0.25, 0.5, Double.NaN);
        assertThat(loaded.get("amount", Collections.singletonMap("ratio", Double.NaN)).asLong())
                .isEqualTo(2L);
        assertThat(loaded.get("amount", Collections.singletonMap("at", noon)).asLong())
                .isEqualTo(3L);
        assertThat(loaded.get("amount", Collections.singletonMap("flag", null)).asLong())
                .isEqualTo(4L);
        assertThat(loaded.dimension("year").type()).isEqualTo(DataTypes.SMALLINT());
    }

    @Test
    void testCompressionIsRecordedInHeader() throws IOException {
        byte[] bytes = save("lz4");
        assertThat(bytes[13]).isEqualTo((byte) BlockCompressionType.LZ4.persistentId());
        assertThat(ByteBuffer.wrap(bytes).getLong()).isEqualTo(CubeFileFormat.MAGIC);
    }

    @Test
    void testBadMagic() throws IOException {
        byte[] bytes = save("zstd");
        bytes[0] ^= 0x7F;
        assertCorrupted(bytes, "not a cube file");
    }

    @Test
    void testUnsupportedVersion() throws IOException {
        byte[] bytes = save("zstd");
        ByteBuffer.wrap(bytes).putInt(8, 2);
        assertCorrupted(bytes, "'version' is 2");
    }

    @Test
    void testUnknownIds() throws IOException {
        byte[] bytes = save("zstd");
        bytes[12] = 9;
        assertCorrupted(bytes, "indexing method");

        bytes = save("zstd");
        bytes[13] = 9;
        assertCorrupted(bytes, "compression");
    }

    @Test
    void testTruncatedFile() throws IOException {
        byte[] bytes = save("zstd");
        assertCorrupted(Arrays.copyOf(bytes, 10), "Truncated file header");
        assertCorrupted(Arrays.copyOf(bytes, bytes.length - 3), "Truncated file");
    }

    @Test
    void testCorruptedBlob() throws IOException {
        byte[] bytes = save("lz4");
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        int blobCount = buffer.getInt(14);
        int offset = 18;
        for (int i = 0; i < blobCount - 1; i++) {
            offset += 4 + buffer.getInt(offset);
        }
        // original length in the compression header of the last blob
        buffer.putInt(offset + 4 + 4, -5);
        assertCorrupted(bytes, "failed to decompress");
    }

    @Test
    void testWrongMeasureLength() throws IOException {
        CubeFileMeta meta =
                new CubeFileMeta(
                        1,
                        2,
                        IndexingMethod.ROARING.name(),
                        BlockCompressionType.NONE.name(),
                        Collections.emptyList(),
                        Collections.singletonList(new MeasureMeta("units", "INT64", 1)));
        byte[] bytes =
                file(
                        IndexingMethod.ROARING,
                        BlockCompressionType.NONE,
                        JsonSerdeUtil.toJsonBytes(meta),
                        new byte[8]);
        assertCorrupted(bytes, "has 8 bytes, expected 16");
    }

    @Test
    void testMetadataMustMatchHeader() throws IOException {
        CubeFileMeta meta =
                new CubeFileMeta(
                        1,
                        1,
                        IndexingMethod.SORTED_ARRAY.name(),
                        BlockCompressionType.NONE.name(),
                        Collections.emptyList(),
                        Collections.singletonList(new MeasureMeta("units", "INT64", 1)));
        byte[] bytes =
                file(
                        IndexingMethod.ROARING,
                        BlockCompressionType.NONE,
                        JsonSerdeUtil.toJsonBytes(meta),
                        new byte[8]);
        assertCorrupted(bytes, "does not match header");
    }

    @Test
    void testRowSetsMustCoverAllRows() throws IOException {
        IndexingMethod method = IndexingMethod.SORTED_ARRAY;
        DimensionMeta dimension =
                new DimensionMeta(
                        "customer",
                        "STRING",
                        Collections.singletonList(new MemberMeta("A", 1)),
                        null);
        CubeFileMeta meta =
                new CubeFileMeta(
                        1,
                        3,
                        method.name(),
                        BlockCompressionType.NONE.name(),
                        Collections.singletonList(dimension),
                        Collections.emptyList());
        byte[] rows =
                method.backend().serialize(method.backend().fromSorted(new int[] {0, 2}, 2));
        byte[] bytes =
                file(method, BlockCompressionType.NONE, JsonSerdeUtil.toJsonBytes(meta), rows);
        assertCorrupted(bytes, "covers 2 rows but the cube has 3");
    }

    @Test
    void testRowIdBeyondSignedRangeIsRejected() throws IOException {
        IndexingMethod method = IndexingMethod.ROARING;
        DimensionMeta dimension =
                new DimensionMeta(
                        "customer",
                        "STRING",
                        Collections.singletonList(new MemberMeta("A", 1)),
                        null);
        byte[] rows = method.backend().serialize(method.backend().fromSorted(new int[] {0, -1}, 2));
        byte[] bytes =
                file(
                        method,
                        BlockCompressionType.NONE,
                        JsonSerdeUtil.toJsonBytes(twoRowMeta(method, dimension)),
                        rows);

        assertCorrupted(bytes, "holds row id 4294967295 outside [0, 2)");
        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        assertThatThrownBy(() -> NanoCube.load(in, CubeOptions.defaults()))
                .isInstanceOf(CubeFormatException.class);
    }

    @ParameterizedTest
    @EnumSource(IndexingMethod.class)
    void testOverlappingMembersAreRejected(IndexingMethod method) throws IOException {
        DimensionMeta dimension =
                new DimensionMeta(
                        "customer",
                        "STRING",
                        Arrays.asList(new MemberMeta("A", 1), new MemberMeta("B", 2)),
                        null);
        byte[] first = method.backend().serialize(method.backend().fromSorted(new int[] {0}, 1));
        byte[] second = method.backend().serialize(method.backend().fromSorted(new int[] {0}, 1));
        byte[] bytes =
                file(
                        method,
                        BlockCompressionType.NONE,
                        JsonSerdeUtil.toJsonBytes(twoRowMeta(method, dimension)),
                        first,
                        second);

        assertCorrupted(bytes, "assigns row 0 to a second member of 'customer'");
    }

    @ParameterizedTest
    @EnumSource(IndexingMethod.class)
    void testNullRowsMustNotOverlapMembers(IndexingMethod method) throws IOException {
        DimensionMeta dimension =
                new DimensionMeta(
                        "customer",
                        "STRING",
                        Collections.singletonList(new MemberMeta("A", 1)),
                        2);
        byte[] member = method.backend().serialize(method.backend().fromSorted(new int[] {1}, 1));
        byte[] nulls = method.backend().serialize(method.backend().fromSorted(new int[] {1}, 1));
        byte[] bytes =
                file(
                        method,
                        BlockCompressionType.NONE,
                        JsonSerdeUtil.toJsonBytes(twoRowMeta(method, dimension)),
                        member,
                        nulls);

        assertCorrupted(bytes, "assigns row 1 to a second member of 'customer'");
    }

    @Test
    void testUnreferencedBlob() throws IOException {
        CubeFileMeta meta =
                new CubeFileMeta(
                        1,
                        0,
                        IndexingMethod.ROARING.name(),
                        BlockCompressionType.NONE.name(),
                        Collections.emptyList(),
                        Collections.emptyList());
        byte[] bytes =
                file(
                        IndexingMethod.ROARING,
                        BlockCompressionType.NONE,
                        JsonSerdeUtil.toJsonBytes(meta),
                        new byte[3]);
        assertCorrupted(bytes, "references 0 blobs but the file has 1");
    }

    @Test
    void testLoadMissingFile() {
        assertThatThrownBy(() -> NanoCube.load(tempDir.resolve("missing.nc")))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(CubeFormatException.class);
    }

    private static void assertSameCube(NanoCube actual, NanoCube expected) {
        assertThat(actual.rowCount()).isEqualTo(expected.rowCount());
        assertThat(actual.dimensionNames()).isEqualTo(expected.dimensionNames());
        assertThat(actual.measureNames()).isEqualTo(expected.measureNames());
        for (Dimension dimension : expected.dimensions()) {
            Dimension restored = actual.dimension(dimension.name());
            assertThat(restored.type()).isEqualTo(dimension.type());
            assertThat(restored.members()).isEqualTo(dimension.members());
            assertThat(restored.hasNullMember()).isEqualTo(dimension.hasNullMember());
            for (Object member : dimension.members()) {
                assertThat(restored.rowsFor(member).toArray())
                        .isEqualTo(dimension.rowsFor(member).toArray());
            }
            assertThat(restored.rowsFor(null).toArray())
                    .isEqualTo(dimension.rowsFor(null).toArray());
        }
        for (Measure measure : expected.measures()) {
            assertThat(actual.measure(measure.name())).isEqualTo(measure);
        }
    }

    private byte[] save(String compression) throws IOException {
        NanoCube cube =
                NanoCube.builder(CubeTestUtils.salesTable())
                        .option(CubeOptions.FILE_COMPRESSION, compression)
                        .build();
        Path file = tempDir.resolve("sales-" + compression + ".nc");
        cube.save(file);
        return Files.readAllBytes(file);
    }

    private static CubeFileMeta twoRowMeta(IndexingMethod method, DimensionMeta dimension) {
        return new CubeFileMeta(
                1,
                2,
                method.name(),
                BlockCompressionType.NONE.name(),
                Collections.singletonList(dimension),
                Collections.emptyList());
    }

    private static byte[] file(
            IndexingMethod method, BlockCompressionType compression, byte[]... blobs)
            throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeLong(CubeFileFormat.MAGIC);
        out.writeInt(CubeFileFormat.Version.V_1.version());
        out.writeByte(method.persistentId());
        out.writeByte(compression.persistentId());
        out.writeInt(blobs.length);
        for (byte[] blob : blobs) {
            out.writeInt(blob.length);
            out.write(blob);
        }
        out.flush();
        return bytes.toByteArray();
    }

    private static void assertCorrupted(byte[] bytes, String message) {
        assertThatThrownBy(() -> CubeFileFormat.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(CubeFormatException.class)
                .hasMessageContaining(message);
    }
}
