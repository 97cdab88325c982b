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

import org.junit.jupiter.api.Test;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.common.Utils;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
public class IntegrityValidatorTest {

    private static List<Chunk> chunks() {
        List<Chunk> chunks = new ArrayList<>();
        chunks.add(new Chunk("HEAD", new byte[]{1, 2, 3, 4}));
        chunks.add(new Chunk("META", "{\"title\":\"x\"}".getBytes()));
        chunks.add(new Chunk("AUDI", new byte[]{10, 11, 12}));
        chunks.add(new Chunk("AUDI", new byte[]{13, 14}));
        chunks.add(new Chunk("AIDE", new byte[]{99}));
        return chunks;
    }

    private static List<Chunk> withRecord(List<Chunk> chunks) {
        List<Chunk> list = new ArrayList<>(chunks);
        list.add(new Chunk("CHKS", ChecksumRecord.compute(chunks).toBytes()));
        return list;
    }

    private static List<Chunk> replace(List<Chunk> chunks, int index, byte[] payload) {
        List<Chunk> list = new ArrayList<>(chunks);
        list.set(index, new Chunk(list.get(index).type, payload));
        return list;
    }

    @Test
    public void testNoRecord() {
        IntegrityReport report = IntegrityValidator.validate(chunks());
        assertFalse(report.verified);
        assertTrue(report.checksumMatch);
        assertTrue(report.corruptedChunks.isEmpty());
        assertEquals(IntegrityReport.unverified(), report);
    }

    @Test
    public void testIntact() {
        IntegrityReport report = IntegrityValidator.validate(withRecord(chunks()));
        assertTrue(report.verified);
        assertTrue(report.checksumMatch);
        assertTrue(report.corruptedChunks.isEmpty());
        assertFalse(report.hasWarnings());
    }

    @Test
    public void testRecordLayout() {
        List<Chunk> chunks = chunks();
        byte[] record = ChecksumRecord.compute(chunks).toBytes();
        assertEquals(8 + 5 * 4 + 4, record.length);

        ByteBuffer buf = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        List<byte[]> payloads = new ArrayList<>();
        for (Chunk chunk : chunks) payloads.add(chunk.payload);
        assertEquals(Utils.crc32(payloads), buf.getInt(0) & 0xFFFFFFFFL);
        assertEquals(5, buf.getInt(4));
        assertEquals(chunks.get(1).crc32(), buf.getInt(12) & 0xFFFFFFFFL);
        assertEquals(Utils.crc32(Arrays.copyOf(record, record.length - 4)), buf.getInt(record.length - 4) & 0xFFFFFFFFL);
    }

    @Test
    public void testCorruptedChunk() {
        List<Chunk> chunks = withRecord(chunks());
        List<Chunk> damaged = replace(chunks, 4, new byte[]{98});

        IntegrityReport report = IntegrityValidator.validate(damaged);
        assertTrue(report.verified);
        assertFalse(report.checksumMatch);
        assertEquals(Collections.singletonList("AIDE"), report.corruptedChunks);
        assertEquals(Collections.singletonList(4), report.corruptedIndices);
        assertTrue(report.isCorrupted("AIDE"));
        assertFalse(report.isCorrupted("AUDI"));
    }

    @Test
    public void testSameTypeTwice() {
        List<Chunk> chunks = withRecord(chunks());
        List<Chunk> damaged = replace(replace(chunks, 2, new byte[]{0, 0, 0}), 3, new byte[]{0, 0});

        IntegrityReport report = IntegrityValidator.validate(damaged);
        assertEquals(Arrays.asList("AUDI", "AUDI"), report.corruptedChunks);
        assertEquals(Arrays.asList(2, 3), report.corruptedIndices);
    }

    @Test
    public void testDamagedRecord() {
        List<Chunk> chunks = withRecord(chunks());
        byte[] record = chunks.get(5).payload.clone();

        record[10] ^= 0x01;
        IntegrityReport report = IntegrityValidator.validate(replace(chunks, 5, record));
        assertTrue(report.verified);
        assertFalse(report.checksumMatch);
        assertEquals(Collections.singletonList("CHKS"), report.corruptedChunks);
        assertEquals(IntegrityWarning.Kind.DAMAGED_RECORD, report.warnings.get(0).kind);

        report = IntegrityValidator.validate(replace(chunks, 5, new byte[]{1, 2, 3}));
        assertEquals(Collections.singletonList("CHKS"), report.corruptedChunks);

        report = IntegrityValidator.validate(replace(chunks, 5, Arrays.copyOf(chunks.get(5).payload, 20)));
        assertEquals(Collections.singletonList("CHKS"), report.corruptedChunks);
    }

    @Test
    public void testTamperedAggregate() {
        List<Chunk> chunks = chunks();
        ByteBuffer record = ByteBuffer.wrap(ChecksumRecord.compute(chunks).toBytes()).order(ByteOrder.LITTLE_ENDIAN);
        record.putInt(0, record.getInt(0) + 1);
        record.putInt(record.capacity() - 4, (int) Utils.crc32(Arrays.copyOf(record.array(), record.capacity() - 4)));

        List<Chunk> list = new ArrayList<>(chunks);
        list.add(new Chunk("CHKS", record.array()));
        IntegrityReport report = IntegrityValidator.validate(list);
        assertFalse(report.checksumMatch);
        assertEquals(Collections.singletonList("CHKS"), report.corruptedChunks);
        assertEquals(Collections.singletonList(5), report.corruptedIndices);
    }

    @Test
    public void testLegacyRecord() {
        List<Chunk> chunks = chunks();
        ChecksumRecord computed = ChecksumRecord.compute(chunks);
        ByteBuffer legacy = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
        legacy.putInt((int) computed.aggregate).putInt(computed.covered);

        List<Chunk> list = new ArrayList<>(chunks);
        list.add(new Chunk("CHKS", legacy.array()));
        IntegrityReport report = IntegrityValidator.validate(list);
        assertTrue(report.verified);
        assertTrue(report.checksumMatch);

        report = IntegrityValidator.validate(replace(list, 1, "{}".getBytes()));
        assertFalse(report.checksumMatch);
        assertEquals(Arrays.asList("HEAD", "META", "AUDI", "AUDI", "AIDE"), report.corruptedChunks);
        assertTrue(report.warnings.stream().anyMatch(w -> w.kind == IntegrityWarning.Kind.NO_CHUNK_TABLE));
    }

    @Test
    public void testChunkAfterRecord() {
        List<Chunk> list = withRecord(chunks());
        list.add(new Chunk("XTRA", new byte[]{1}));

        IntegrityReport report = IntegrityValidator.validate(list);
        assertTrue(report.checksumMatch);
        assertEquals(1, report.warnings.size());
        assertEquals(IntegrityWarning.Kind.UNCOVERED_CHUNK, report.warnings.get(0).kind);
        assertEquals("XTRA", report.warnings.get(0).chunkType);
        assertEquals(6, report.warnings.get(0).chunkIndex);
    }

    @Test
    public void testRemovedChunk() {
        List<Chunk> list = withRecord(chunks());
        list.remove(4);

        IntegrityReport report = IntegrityValidator.validate(list);
        assertFalse(report.checksumMatch);
        assertTrue(report.warnings.stream().anyMatch(w -> w.kind == IntegrityWarning.Kind.CHUNK_COUNT_MISMATCH));
    }

    @Test
    public void testIncrementalCheck() {
        List<Chunk> chunks = chunks();
        List<ChunkDigest> digests = new ArrayList<>();
        List<byte[]> payloads = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            digests.add(ChunkDigest.of(chunks.get(i), i));
            payloads.add(chunks.get(i).payload);
        }

        IntegrityReport report = IntegrityValidator.check(digests, Utils.crc32(payloads), ChecksumRecord.compute(chunks).toBytes(), 5);
        assertEquals(IntegrityValidator.validate(withRecord(chunks)), report);
    }
}
