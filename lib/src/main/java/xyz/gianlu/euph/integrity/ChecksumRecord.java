/*
 * Copyright 2022 devgianlu
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

package xyz.gianlu.euph.integrity;

import org.jetbrains.annotations.NotNull;
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.chunk.ChunkType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;

/**
 * The CHKS payload: {@code aggregate u32, covered u32, crc[covered] u32, recordCrc u32}, little-endian.
 * The aggregate is the CRC32 of all covered payloads concatenated in write order, {@code recordCrc} protects the
 * record itself. Records made of the first two fields only are accepted for reading.
 *
 * @author devgianlu
 */
public final class ChecksumRecord {
    public static final int LEGACY_SIZE = 8;
    public final long aggregate;
    public final int covered;
    /**
     * {@code null} for legacy records.
     */
    public final long[] chunkCrcs;

    private ChecksumRecord(long aggregate, int covered, long[] chunkCrcs) {
        this.aggregate = aggregate;
        this.covered = covered;
        this.chunkCrcs = chunkCrcs;
    }

    /**
     * Computes the record for the given chunks, CHKS chunks are skipped.
     */
    @NotNull
    public static ChecksumRecord compute(@NotNull List<Chunk> chunks) {
        CRC32 aggregate = new CRC32();
        long[] crcs = new long[chunks.size()];
        int count = 0;
        for (Chunk chunk : chunks) {
            if (chunk.is(ChunkType.CHKS)) continue;

            aggregate.update(chunk.payload, 0, chunk.payload.length);
            crcs[count++] = chunk.crc32();
        }

        return new ChecksumRecord(aggregate.getValue(), count, Arrays.copyOf(crcs, count));
    }

    /**
     * @throws FormatException If the record is too short, has an inconsistent size or its own CRC doesn't match
     */
    @NotNull
    public static ChecksumRecord parse(byte[] payload) throws FormatException {
        if (payload.length < LEGACY_SIZE)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "CHKS is only " + payload.length + " bytes");

        ByteBuffer buf = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long aggregate = buf.getInt() & 0xFFFFFFFFL;
        long covered = buf.getInt() & 0xFFFFFFFFL;
        if (payload.length == LEGACY_SIZE)
            return new ChecksumRecord(aggregate, (int) Math.min(covered, Integer.MAX_VALUE), null);

        if (LEGACY_SIZE + covered * 4 + 4 != payload.length)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, String.format("CHKS declares %d chunks in %d bytes", covered, payload.length));

        CRC32 crc = new CRC32();
        crc.update(payload, 0, payload.length - 4);
        long recordCrc = buf.getInt(payload.length - 4) & 0xFFFFFFFFL;
        if (crc.getValue() != recordCrc)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "CHKS record checksum mismatch");

        long[] crcs = new long[(int) covered];
        for (int i = 0; i < crcs.length; i++)
            crcs[i] = buf.getInt() & 0xFFFFFFFFL;

        return new ChecksumRecord(aggregate, (int) covered, crcs);
    }

    public boolean isLegacy() {
        return chunkCrcs == null;
    }

    @NotNull
    public byte[] toBytes() {
        if (chunkCrcs == null) throw new IllegalStateException("Legacy records can't be written!");

        ByteBuffer buf = ByteBuffer.allocate(LEGACY_SIZE + chunkCrcs.length * 4 + 4).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt((int) aggregate);
        buf.putInt(covered);
        for (long crc : chunkCrcs) buf.putInt((int) crc);

        CRC32 crc = new CRC32();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    @Override
    public String toString() {
        return "ChecksumRecord{aggregate=" + Long.toHexString(aggregate) + ", covered=" + covered + ", legacy=" + isLegacy() + '}';
    }
}
