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

import org.apache.nanocube.compression.BlockCompressionFactory;
import org.apache.nanocube.compression.BlockCompressionType;
import org.apache.nanocube.compression.BufferDecompressionException;
import org.apache.nanocube.compression.CompressOptions;
import org.apache.nanocube.compression.CompressorUtils;
import org.apache.nanocube.index.IndexingMethod;
import org.apache.nanocube.index.MemberIndex;
import org.apache.nanocube.index.RowSet;
import org.apache.nanocube.index.RowSetBackend;
import org.apache.nanocube.schema.Dimension;
import org.apache.nanocube.schema.Measure;
import org.apache.nanocube.schema.MeasureType;
import org.apache.nanocube.types.DataType;
import org.apache.nanocube.types.DataTypes;
import org.apache.nanocube.utils.JsonSerdeUtil;

import javax.annotation.Nullable;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 立方体文件格式。
 *
 * <pre>
 * 文件格式(大端序):
 *
 *   _____________________________________
 *  | magic                  (8 bytes long) |
 *  | version                (4 bytes int)  |
 *  | indexing method id     (1 byte)       |
 *  | compression id         (1 byte)       |
 *  | blob count             (4 bytes int)  |
 *  |_____________________________________|
 *  | blob 0 length | blob 0 bytes          |  JSON 元数据,不压缩
 *  | blob 1 length | blob 1 bytes          |  成员行集合,块压缩
 *  | ...                                   |
 *  | blob n length | blob n bytes          |  度量向量(小端序),块压缩
 *  |_____________________________________|
 * </pre>
 *
 * <p>成员行集合使用索引方式自身的序列化格式:Roaring 位图的可移植格式,或升序行号的差分 Varint 编码。
 * 压缩方式为 {@code none} 时数据块直接保存原始字节,否则每个数据块以 8 字节的压缩头开始。
 */
public final class CubeFileFormat {

    static final long MAGIC = 7_236_843_955_162_419_005L;

    static final int METADATA_BLOB = 0;

    enum Version {
        V_1(1);

        private final int version;

        Version(int version) {
            this.version = version;
        }

        public int version() {
            return version;
        }
    }

    // ------------------------------------------------------------------------
    //  Write
    // ------------------------------------------------------------------------

    /**
     * 把立方体写入输出流。方法返回时数据已经刷新,但不会关闭输出流。
     *
     * @return 写入的数据块个数
     */
    public static int write(CubeContents contents, CompressOptions compression, OutputStream out)
            throws IOException {
        BlockCompressionFactory factory = BlockCompressionFactory.create(compression);
        BlockCompressionType compressionType =
                factory == null ? BlockCompressionType.NONE : factory.getCompressionType();
        RowSetBackend backend = contents.indexingMethod().backend();

        List<byte[]> blobs = new ArrayList<>();
        // reserve the metadata slot, it is filled once every blob index is known
        blobs.add(null);

        List<DimensionMeta> dimensionMetas = new ArrayList<>(contents.dimensions().size());
        for (Dimension dimension : contents.dimensions()) {
            MemberValueCodec codec = MemberValueCodec.forType(dimension.type());
            MemberIndex index = dimension.index();
            List<MemberMeta> members = new ArrayList<>(index.memberCount());
            for (Map.Entry<Object, RowSet> entry : index.entries().entrySet()) {
                members.add(new MemberMeta(codec.encode(entry.getKey()), blobs.size()));
                blobs.add(compress(factory, backend.serialize(entry.getValue())));
            }
            Integer nullBlob = null;
            if (index.hasNullMember()) {
                nullBlob = blobs.size();
                blobs.add(compress(factory, backend.serialize(index.nullRows())));
            }
            dimensionMetas.add(
                    new DimensionMeta(
                            dimension.name(), dimension.type().asSQLString(), members, nullBlob));
        }

        List<MeasureMeta> measureMetas = new ArrayList<>(contents.measures().size());
        for (Measure measure : contents.measures()) {
            measureMetas.add(new MeasureMeta(measure.name(), measure.type().name(), blobs.size()));
            blobs.add(compress(factory, encodeMeasure(measure)));
        }

        CubeFileMeta meta =
                new CubeFileMeta(
                        Version.V_1.version(),
                        contents.rowCount(),
                        contents.indexingMethod().name(),
                        compressionType.name(),
                        dimensionMetas,
                        measureMetas);
        blobs.set(METADATA_BLOB, JsonSerdeUtil.toJsonBytes(meta));

        DataOutputStream dataOutputStream = new DataOutputStream(out);
        dataOutputStream.writeLong(MAGIC);
        dataOutputStream.writeInt(Version.V_1.version());
        dataOutputStream.writeByte(contents.indexingMethod().persistentId());
        dataOutputStream.writeByte(compressionType.persistentId());
        dataOutputStream.writeInt(blobs.size());
        for (byte[] blob : blobs) {
            dataOutputStream.writeInt(blob.length);
            dataOutputStream.write(blob);
        }
        dataOutputStream.flush();
        return blobs.size();
    }

    private static byte[] compress(@Nullable BlockCompressionFactory factory, byte[] raw) {
        return factory == null ? raw : CompressorUtils.compress(factory, raw);
    }

    private static byte[] encodeMeasure(Measure measure) {
        ByteBuffer buffer =
                ByteBuffer.allocate(measure.size() * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        if (measure.type() == MeasureType.INT64) {
            buffer.asLongBuffer().put(measure.longValues());
        } else {
            buffer.asDoubleBuffer().put(measure.doubleValues());
        }
        return buffer.array();
    }

    // ------------------------------------------------------------------------
    //  Read
    // ------------------------------------------------------------------------

    /**
     * 从输入流读取立方体,不会关闭输入流。
     *
     * @throws CubeFormatException 文件损坏、被截断或版本不兼容时抛出
     */
    public static CubeContents read(InputStream in) throws IOException {
        DataInputStream dataInputStream = new DataInputStream(in);
        Header header = readHeader(dataInputStream);
        List<byte[]> blobs = readBlobs(dataInputStream, header.blobCount);
        return new Reader(header, blobs).read();
    }

    private static Header readHeader(DataInputStream in) throws IOException {
        try {
            long magic = in.readLong();
            if (magic != MAGIC) {
                throw new CubeFormatException(
                        String.format("Header field 'magic' is %s, not a cube file.", magic));
            }
            int version = in.readInt();
            if (version != Version.V_1.version()) {
                throw new CubeFormatException(
                        String.format("Header field 'version' is %s, unsupported.", version));
            }
            int methodId = in.readUnsignedByte();
            IndexingMethod method;
            try {
                method = IndexingMethod.fromPersistentId(methodId);
            } catch (IllegalArgumentException e) {
                throw new CubeFormatException(
                        String.format(
                                "Header field 'indexing method' has unknown id %s.", methodId),
                        e);
            }
            int compressionId = in.readUnsignedByte();
            BlockCompressionType compression;
            try {
                compression = BlockCompressionType.getCompressionTypeByPersistentId(compressionId);
            } catch (IllegalArgumentException e) {
                throw new CubeFormatException(
                        String.format(
                                "Header field 'compression' has unknown id %s.", compressionId),
                        e);
            }
            int blobCount = in.readInt();
            if (blobCount < 1) {
                throw new CubeFormatException(
                        String.format("Header field 'blob count' is %s.", blobCount));
            }
            return new Header(method, compression, blobCount);
        } catch (EOFException e) {
            throw new CubeFormatException("Truncated file header.", e);
        }
    }

    private static List<byte[]> readBlobs(DataInputStream in, int blobCount) throws IOException {
        List<byte[]> blobs = new ArrayList<>();
        for (int i = 0; i < blobCount; i++) {
            int length;
            try {
                length = in.readInt();
            } catch (EOFException e) {
                throw new CubeFormatException(
                        String.format("Truncated file, length of blob %s is missing.", i), e);
            }
            if (length < 0) {
                throw new CubeFormatException(
                        String.format("Blob %s has negative length %s.", i, length));
            }
            // readNBytes grows its buffer while reading, a corrupt length cannot exhaust memory
            byte[] blob = in.readNBytes(length);
            if (blob.length != length) {
                throw new CubeFormatException(
                        String.format(
                                "Truncated file, blob %s has %s of %s bytes.",
                                i, blob.length, length));
            }
            blobs.add(blob);
        }
        return blobs;
    }

    private static final class Header {

        private final IndexingMethod indexingMethod;
        private final BlockCompressionType compression;
        private final int blobCount;

        private Header(
                IndexingMethod indexingMethod, BlockCompressionType compression, int blobCount) {
            this.indexingMethod = indexingMethod;
            this.compression = compression;
            this.blobCount = blobCount;
        }
    }

    /** 按元数据把数据块还原为维度和度量。 */
    private static final class Reader {

        private final Header header;
        private final List<byte[]> blobs;
        @Nullable private final BlockCompressionFactory factory;
        private final RowSetBackend backend;
        private final Set<Integer> referencedBlobs = new HashSet<>();

        private Reader(Header header, List<byte[]> blobs) {
            this.header = header;
            this.blobs = blobs;
            this.factory = BlockCompressionFactory.create(header.compression);
            this.backend = header.indexingMethod.backend();
        }

        private CubeContents read() throws IOException {
            CubeFileMeta meta = readMeta();
            int rowCount = meta.rowCount();

            List<Dimension> dimensions = new ArrayList<>(meta.dimensions().size());
            Set<String> names = new HashSet<>();
            for (DimensionMeta dimensionMeta : meta.dimensions()) {
                checkName(names, dimensionMeta.name());
                dimensions.add(readDimension(dimensionMeta, dimensions.size(), rowCount));
            }

            List<Measure> measures = new ArrayList<>(meta.measures().size());
            for (MeasureMeta measureMeta : meta.measures()) {
                checkName(names, measureMeta.name());
                measures.add(readMeasure(measureMeta, rowCount));
            }

            if (referencedBlobs.size() != blobs.size() - 1) {
                throw new CubeFormatException(
                        String.format(
                                "Metadata references %s blobs but the file has %s.",
                                referencedBlobs.size(), blobs.size() - 1));
            }
            return new CubeContents(rowCount, header.indexingMethod, dimensions, measures);
        }

        private CubeFileMeta readMeta() throws IOException {
            CubeFileMeta meta;
            try {
                meta = JsonSerdeUtil.fromJson(blobs.get(METADATA_BLOB), CubeFileMeta.class);
            } catch (IOException e) {
                throw new CubeFormatException("Blob 0 does not hold valid metadata.", e);
            }
            if (meta.formatVersion() != Version.V_1.version()) {
                throw new CubeFormatException(
                        String.format(
                                "Metadata version %s does not match header version %s.",
                                meta.formatVersion(), Version.V_1.version()));
            }
            if (meta.rowCount() < 0) {
                throw new CubeFormatException("Metadata has negative row count.");
            }
            if (!header.indexingMethod.name().equals(meta.indexingMethod())) {
                throw new CubeFormatException(
                        String.format(
                                "Metadata indexing method %s does not match header %s.",
                                meta.indexingMethod(), header.indexingMethod));
            }
            if (!header.compression.name().equals(meta.compression())) {
                throw new CubeFormatException(
                        String.format(
                                "Metadata compression %s does not match header %s.",
                                meta.compression(), header.compression));
            }
            if (meta.dimensions() == null || meta.measures() == null) {
                throw new CubeFormatException("Metadata is missing dimensions or measures.");
            }
            return meta;
        }

        private Dimension readDimension(DimensionMeta meta, int ordinal, int rowCount)
                throws IOException {
            DataType type;
            MemberValueCodec codec;
            try {
                type = DataTypes.parse(meta.type());
                codec = MemberValueCodec.forType(type);
            } catch (RuntimeException e) {
                throw new CubeFormatException(
                        String.format(
                                "Dimension '%s' has unsupported type '%s'.",
                                meta.name(), meta.type()),
                        e);
            }

            if (meta.members() == null) {
                throw new CubeFormatException(
                        String.format("Dimension '%s' is missing its members.", meta.name()));
            }
            Map<Object, RowSet> members = new HashMap<>();
            boolean[] seen = new boolean[rowCount];
            long covered = 0;
            for (MemberMeta memberMeta : meta.members()) {
                Object member;
                try {
                    member = codec.decode(memberMeta.value());
                } catch (RuntimeException e) {
                    throw new CubeFormatException(
                            String.format(
                                    "Dimension '%s' has invalid member '%s'.",
                                    meta.name(), memberMeta.value()),
                            e);
                }
                RowSet rows = readRowSet(meta.name(), memberMeta.blob(), seen);
                if (members.put(member, rows) != null) {
                    throw new CubeFormatException(
                            String.format(
                                    "Dimension '%s' has duplicate member '%s'.",
                                    meta.name(), memberMeta.value()));
                }
                covered += rows.cardinality();
            }

            RowSet nullRows = null;
            if (meta.nullBlob() != null) {
                nullRows = readRowSet(meta.name(), meta.nullBlob(), seen);
                covered += nullRows.cardinality();
            }
            if (covered != rowCount) {
                throw new CubeFormatException(
                        String.format(
                                "Dimension '%s' covers %s rows but the cube has %s.",
                                meta.name(), covered, rowCount));
            }
            return new Dimension(
                    meta.name(), ordinal, type, MemberIndex.of(type, backend, members, nullRows));
        }

        /**
         * 读取一个行集合,并把其中的行号登记到 {@code seen}。
         *
         * <p>行号必须落在 {@code [0, seen.length)} 内,且不能已被同一维度的其他成员占用。Roaring 中大于
         * {@link Integer#MAX_VALUE} 的元素在这里表现为负数,同样会被拒绝。
         */
        private RowSet readRowSet(String dimension, int blob, boolean[] seen)
                throws IOException {
            byte[] bytes = blobBytes(blob);
            RowSet rows;
            try {
                rows = backend.deserialize(bytes);
            } catch (IOException | RuntimeException e) {
                throw new CubeFormatException(
                        String.format("Blob %s does not hold a valid row set.", blob), e);
            }
            for (int rowId : rows.toArray()) {
                if (rowId < 0 || rowId >= seen.length) {
                    throw new CubeFormatException(
                            String.format(
                                    "Blob %s holds row id %s outside [0, %s).",
                                    blob, Integer.toUnsignedString(rowId), seen.length));
                }
                if (seen[rowId]) {
                    throw new CubeFormatException(
                            String.format(
                                    "Blob %s assigns row %s to a second member of '%s'.",
                                    blob, rowId, dimension));
                }
                seen[rowId] = true;
            }
            return rows;
        }

        private Measure readMeasure(MeasureMeta meta, int rowCount) throws IOException {
            MeasureType type;
            try {
                type = MeasureType.valueOf(meta.type());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new CubeFormatException(
                        String.format(
                                "Measure '%s' has unknown type '%s'.", meta.name(), meta.type()),
                        e);
            }
            byte[] bytes = blobBytes(meta.blob());
            if (bytes.length != (long) rowCount * Long.BYTES) {
                throw new CubeFormatException(
                        String.format(
                                "Blob %s of measure '%s' has %s bytes, expected %s.",
                                meta.blob(), meta.name(), bytes.length, (long) rowCount * 8));
            }
            ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            if (type == MeasureType.INT64) {
                long[] values = new long[rowCount];
                buffer.asLongBuffer().get(values);
                return Measure.ofLongs(meta.name(), values);
            }
            double[] values = new double[rowCount];
            buffer.asDoubleBuffer().get(values);
            return Measure.ofDoubles(meta.name(), values);
        }

        private byte[] blobBytes(int blob) throws IOException {
            if (blob <= METADATA_BLOB || blob >= blobs.size()) {
                throw new CubeFormatException(
                        String.format(
                                "Metadata references blob %s, the file has blobs 1 to %s.",
                                blob, blobs.size() - 1));
            }
            if (!referencedBlobs.add(blob)) {
                throw new CubeFormatException(
                        String.format("Blob %s is referenced more than once.", blob));
            }
            byte[] raw = blobs.get(blob);
            if (factory == null) {
                return raw;
            }
            try {
                return CompressorUtils.decompress(factory, raw);
            } catch (BufferDecompressionException e) {
                throw new CubeFormatException(
                        String.format("Blob %s failed to decompress.", blob), e);
            }
        }

        private static void checkName(Set<String> names, String name) throws CubeFormatException {
            if (name == null || !names.add(name)) {
                throw new CubeFormatException(
                        String.format("Metadata has missing or duplicate column name '%s'.", name));
            }
        }
    }

    private CubeFileFormat() {}
}
