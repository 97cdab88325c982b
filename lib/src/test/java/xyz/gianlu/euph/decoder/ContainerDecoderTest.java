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

package xyz.gianlu.euph.decoder;

import org.junit.jupiter.api.Test;
import xyz.gianlu.euph.*;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.chunk.ChunkType;
import xyz.gianlu.euph.config.DecodingOptions;
import xyz.gianlu.euph.config.EncodingOptions;
import xyz.gianlu.euph.encoder.ContainerEncoder;
import xyz.gianlu.euph.integrity.ChecksumRecord;
import xyz.gianlu.euph.integrity.IntegrityValidator;
import xyz.gianlu.euph.integrity.IntegrityWarning;
import xyz.gianlu.euph.metadata.Metadata;
import xyz.gianlu.euph.profile.CompressionProfile;
import xyz.gianlu.euph.profile.backend.JdkZlibBackend;
import xyz.gianlu.euph.profile.backend.OkioZlibBackend;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
public class ContainerDecoderTest {
    private static final float INT16_STEP = 1f / 32767;
    private final ContainerEncoder encoder = new ContainerEncoder(new JdkZlibBackend());
    private final ContainerDecoder decoder = new ContainerDecoder(new JdkZlibBackend());

    /**
     * @return The offset of the payload of the first chunk of the given type
     */
    private static int payloadOffset(byte[] container, String type) throws FormatException, UnsupportedVersionException {
        for (ContainerInfo.Entry entry : ContainerDecoder.probe(container).entries)
            if (entry.type.equals(type))
                return entry.offset + 8;

        throw new IllegalArgumentException(type);
    }

    /**
     * @return The offset of the last payload byte of the first chunk of the given type
     */
    private static int payloadEnd(byte[] container, String type) throws FormatException, UnsupportedVersionException {
        for (ContainerInfo.Entry entry : ContainerDecoder.probe(container).entries)
            if (entry.type.equals(type))
                return entry.offset + 8 + entry.size - 1;

        throw new IllegalArgumentException(type);
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++)
                if (data[i + j] != pattern[j]) continue outer;

            return i;
        }

        return -1;
    }

    private static List<Chunk> withoutRecord(List<Chunk> chunks) {
        List<Chunk> list = new ArrayList<>();
        for (Chunk chunk : chunks)
            if (!chunk.is(ChunkType.CHKS))
                list.add(new Chunk(chunk.type, chunk.payload));

        return list;
    }

    @Test
    public void testScenarioSilence() throws EuphException {
        Metadata metadata = TestAudio.metadata(1, 44100, 44100, CompressionProfile.LOSSLESS).build();
        float[][] pcm = new float[1][44100];
        byte[] container = encoder.encode(pcm, metadata);

        DecodedContainer decoded = decoder.decode(container);
        assertEquals(1, decoded.channelCount());
        assertEquals(44100, decoded.frameCount());
        for (float sample : decoded.pcm[0]) assertEquals(0, sample);

        assertEquals(44100, decoded.metadata.sampleRate);
        assertEquals(1.0, decoded.metadata.duration);
        assertEquals(CompressionProfile.LOSSLESS, decoded.metadata.encodingProfile);
        assertEquals("Hello", decoded.metadata.title);
        assertTrue(decoded.integrity.verified);
        assertTrue(decoded.integrity.checksumMatch);
        assertTrue(decoded.integrity.corruptedChunks.isEmpty());
        assertNull(decoded.compatibilityNote);
        assertEquals(Version.FORMAT_MAJOR, decoded.major);
    }

    @Test
    public void testScenarioSine() throws EuphException {
        float[][] pcm = TestAudio.sine(2, 24000, 440, 48000);
        Metadata metadata = TestAudio.metadata(2, 48000, 24000, CompressionProfile.BALANCED).build();
        byte[] container = encoder.encode(pcm, metadata);

        DecodedContainer decoded = decoder.decode(container);
        assertEquals(2, decoded.pcm.length);
        assertEquals(24000, decoded.pcm[0].length);
        assertEquals(24000, decoded.pcm[1].length);
        assertTrue(TestAudio.maxError(pcm, decoded.pcm) <= INT16_STEP);
        assertEquals(metadata, decoded.metadata);
        assertTrue(decoded.integrity.checksumMatch);
    }

    @Test
    public void testRoundTripEveryProfile() throws EuphException {
        float[][] pcm = TestAudio.noise(3, 2000, 11);
        for (CompressionProfile profile : CompressionProfile.values()) {
            for (int level = 0; level <= 9; level++) {
                Metadata metadata = TestAudio.enhanced(3, 8000, 2000, profile);
                EncodingOptions options = new EncodingOptions.Builder().setCompressionLevel(level).setChunkSize(1000).build();
                DecodedContainer decoded = decoder.decode(encoder.encode(pcm, metadata, options, null));

                float bound = 1f / ((1 << (profile.quantizationBits(level) - 1)) - 1);
                assertTrue(TestAudio.maxError(pcm, decoded.pcm) <= bound, profile + " at level " + level);
                assertEquals(metadata, decoded.metadata);
                assertArrayEquals(metadata.enhancementData.spatialData, decoded.aiData);
                assertEquals(metadata.enhancementData.dspSettings, decoded.dspSettings);
            }
        }
    }

    @Test
    public void testBackendsInteroperate() throws EuphException {
        float[][] pcm = TestAudio.sine(2, 5000, 1000, 44100);
        Metadata metadata = TestAudio.metadata(2, 44100, 5000, CompressionProfile.BALANCED).build();

        byte[] fromOkio = new ContainerEncoder(new OkioZlibBackend()).encode(pcm, metadata);
        byte[] fromJdk = encoder.encode(pcm, metadata);
        assertArrayEquals(decoder.decode(fromOkio).pcm, new ContainerDecoder(new OkioZlibBackend()).decode(fromJdk).pcm);
    }

    @Test
    public void testIdempotent() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(2, 3000, 440, 44100), TestAudio.enhanced(2, 44100, 3000, CompressionProfile.COMPACT));
        container[payloadOffset(container, "AIDE") + 5] ^= 0x10;

        DecodedContainer first = decoder.decode(container);
        DecodedContainer second = decoder.decode(container);
        assertEquals(first.metadata, second.metadata);
        assertEquals(first.integrity, second.integrity);
        assertArrayEquals(first.pcm, second.pcm);
    }

    @Test
    public void testCorruptedAide() throws EuphException {
        float[][] pcm = TestAudio.sine(2, 3000, 440, 44100);
        Metadata metadata = TestAudio.enhanced(2, 44100, 3000, CompressionProfile.BALANCED);
        byte[] container = encoder.encode(pcm, metadata);
        DecodedContainer intact = decoder.decode(container);

        container[payloadOffset(container, "AIDE") + 100] ^= 0x01;
        DecodedContainer decoded = decoder.decode(container);
        assertTrue(decoded.integrity.verified);
        assertFalse(decoded.integrity.checksumMatch);
        assertEquals(Collections.singletonList("AIDE"), decoded.integrity.corruptedChunks);
        assertArrayEquals(intact.pcm, decoded.pcm);
        assertEquals("Hello", decoded.metadata.title);
        assertFalse(Arrays.equals(metadata.enhancementData.spatialData, decoded.aiData));
    }

    @Test
    public void testCorruptedMetaString() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 1000, 440, 8000), TestAudio.metadata(1, 8000, 1000, CompressionProfile.BALANCED).build());
        int title = indexOf(container, "Hello".getBytes(StandardCharsets.UTF_8));
        container[title + 1] = 'a';

        DecodedContainer decoded = decoder.decode(container);
        assertEquals("Hallo", decoded.metadata.title);
        assertFalse(decoded.integrity.checksumMatch);
        assertEquals(Collections.singletonList("META"), decoded.integrity.corruptedChunks);
    }

    @Test
    public void testUnparsableMeta() throws EuphException {
        Metadata metadata = TestAudio.metadata(1, 8000, 1000, CompressionProfile.BALANCED).build();
        float[][] pcm = TestAudio.sine(1, 1000, 440, 8000);

        byte[] container = encoder.encode(pcm, metadata);
        int end = payloadEnd(container, "META");
        assertEquals((byte) '}', container[end]);
        container[end] = ']';

        DecodedContainer decoded = decoder.decode(container);
        assertNull(decoded.metadata.title);
        assertEquals(8000, decoded.metadata.sampleRate);
        assertEquals(Collections.singletonList("META"), decoded.integrity.corruptedChunks);
        assertEquals(1000, decoded.frameCount());

        byte[] unchecked = encoder.encode(pcm, metadata, new EncodingOptions.Builder().setEnableIntegrityCheck(false).build(), null);
        unchecked[payloadEnd(unchecked, "META")] = ']';
        FormatException ex = assertThrows(FormatException.class, () -> decoder.decode(unchecked));
        assertEquals(FormatException.Reason.MALFORMED_PAYLOAD, ex.reason());
    }

    @Test
    public void testCorruptedRawAudio() throws EuphException {
        float[][] pcm = TestAudio.sine(1, 1000, 440, 8000);
        Metadata metadata = TestAudio.metadata(1, 8000, 1000, CompressionProfile.LOSSLESS).build();
        byte[] container = encoder.encode(pcm, metadata, new EncodingOptions.Builder().setCompressionLevel(0).build(), null);
        container[payloadOffset(container, "AUDI") + 201] ^= 0x40;

        DecodedContainer decoded = decoder.decode(container);
        assertEquals(Collections.singletonList("AUDI"), decoded.integrity.corruptedChunks);
        assertEquals(1000, decoded.frameCount());
        assertTrue(Math.abs(decoded.pcm[0][100] - pcm[0][100]) > 0.1);
        assertEquals(pcm[0][101], decoded.pcm[0][101], INT16_STEP);
    }

    @Test
    public void testCorruptedDeflatedAudio() throws EuphException {
        byte[] container = encoder.encode(TestAudio.noise(1, 3000, 12), TestAudio.metadata(1, 8000, 3000, CompressionProfile.BALANCED).build());
        container[payloadOffset(container, "AUDI") + 500] ^= 0x55;

        CorruptedContainerException ex = assertThrows(CorruptedContainerException.class, () -> decoder.decode(container));
        assertEquals(FormatException.Reason.CORRUPTED_CONTAINER, ex.reason());
        assertEquals(Collections.singletonList("AUDI"), ex.integrity().corruptedChunks);
    }

    @Test
    public void testReservedHeaderByte() throws EuphException {
        float[][] pcm = TestAudio.sine(2, 1000, 440, 8000);
        byte[] container = encoder.encode(pcm, TestAudio.metadata(2, 8000, 1000, CompressionProfile.BALANCED).build());
        container[payloadOffset(container, "HEAD") + 15] = 0x7F;
        container[payloadOffset(container, "HEAD") + 25] = 0x01;

        DecodedContainer decoded = decoder.decode(container);
        assertEquals(Collections.singletonList("HEAD"), decoded.integrity.corruptedChunks);
        assertTrue(TestAudio.maxError(pcm, decoded.pcm) <= INT16_STEP);
    }

    @Test
    public void testTruncation() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 50, 440, 8000), TestAudio.enhanced(1, 8000, 50, CompressionProfile.BALANCED));
        for (int length = 0; length < container.length; length++) {
            byte[] truncated = Arrays.copyOf(container, length);
            FormatException ex = assertThrows(FormatException.class, () -> decoder.decode(truncated), "length " + length);
            if (length < 10) assertEquals(FormatException.Reason.TRUNCATED_HEADER, ex.reason());
            else assertEquals(FormatException.Reason.TRUNCATED_CHUNK, ex.reason());
        }
    }

    @Test
    public void testTrailingBytesIgnored() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 50, 440, 8000), TestAudio.metadata(1, 8000, 50, CompressionProfile.BALANCED).build());
        DecodedContainer decoded = decoder.decode(Arrays.copyOf(container, container.length + 17));
        assertTrue(decoded.integrity.checksumMatch);
        assertEquals(50, decoded.frameCount());
    }

    @Test
    public void testBadMagic() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 50, 440, 8000), TestAudio.metadata(1, 8000, 50, CompressionProfile.BALANCED).build());
        container[2] = 'X';
        FormatException ex = assertThrows(FormatException.class, () -> decoder.decode(container));
        assertEquals(FormatException.Reason.BAD_MAGIC, ex.reason());
        assertEquals("bad magic", ex.getMessage());
    }

    @Test
    public void testForwardCompatibility() throws EuphException {
        float[][] pcm = TestAudio.sine(2, 2000, 440, 44100);
        Metadata metadata = TestAudio.enhanced(2, 44100, 2000, CompressionProfile.BALANCED);
        byte[] container = encoder.encode(pcm, metadata);
        DecodedContainer original = decoder.decode(container);

        List<Chunk> chunks = withoutRecord(original.chunks);
        chunks.add(2, new Chunk("XTRA", TestAudio.randomBytes(64, 13)));
        chunks.add(new Chunk("CHKS", ChecksumRecord.compute(chunks).toBytes()));
        DecodedContainer extended = decoder.decode(ContainerEncoder.assemble(chunks));

        assertEquals(original.metadata, extended.metadata);
        assertArrayEquals(original.pcm, extended.pcm);
        assertArrayEquals(original.aiData, extended.aiData);
        assertTrue(extended.integrity.checksumMatch);
        assertEquals("XTRA", extended.chunks.get(2).type);
        assertEquals(original.chunks.size() + 1, extended.chunks.size());
    }

    @Test
    public void testChunkAfterRecord() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 100, 440, 8000), TestAudio.metadata(1, 8000, 100, CompressionProfile.BALANCED).build());
        List<Chunk> chunks = new ArrayList<>(decoder.decode(container).chunks);
        chunks.add(new Chunk("XTRA", new byte[]{1, 2, 3}));

        DecodedContainer decoded = decoder.decode(ContainerEncoder.assemble(chunks));
        assertTrue(decoded.integrity.checksumMatch);
        assertEquals(IntegrityWarning.Kind.UNCOVERED_CHUNK, decoded.integrity.warnings.get(0).kind);
    }

    @Test
    public void testVersionGate() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 100, 440, 8000), TestAudio.metadata(1, 8000, 100, CompressionProfile.BALANCED).build());

        byte[] newer = Arrays.copyOf(container, 12);
        newer[4] = 3;
        ByteBuffer.wrap(newer).order(ByteOrder.LITTLE_ENDIAN).putInt(6, 1000);
        UnsupportedVersionException ex = assertThrows(UnsupportedVersionException.class, () -> decoder.decode(newer));
        assertEquals(3, ex.fileMajor());

        assertThrows(UnsupportedVersionException.class, () -> ContainerDecoder.probe(newer));
        assertThrows(UnsupportedVersionException.class, () -> ContainerDecoder.verify(newer));

        byte[] older = container.clone();
        older[4] = 1;
        DecodedContainer fromOlder = decoder.decode(older);
        assertEquals(1, fromOlder.major);
        assertNotNull(fromOlder.compatibilityNote);
        assertEquals(100, fromOlder.frameCount());
        assertEquals("Hello", fromOlder.metadata.title);
        assertEquals(1, ContainerDecoder.probe(older).major);
        assertTrue(ContainerDecoder.verify(older).checksumMatch);

        byte[] minor = container.clone();
        minor[5] = 4;
        DecodedContainer decoded = decoder.decode(minor);
        assertNotNull(decoded.compatibilityNote);
        assertEquals(4, decoded.minor);
        assertEquals(100, decoded.frameCount());
    }

    @Test
    public void testMissingRequiredChunks() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 100, 440, 8000), TestAudio.metadata(1, 8000, 100, CompressionProfile.BALANCED).build(),
                new EncodingOptions.Builder().setEnableIntegrityCheck(false).build(), null);
        List<Chunk> chunks = decoder.decode(container).chunks;

        for (String missing : new String[]{"HEAD", "META", "AUDI"}) {
            List<Chunk> list = new ArrayList<>();
            for (Chunk chunk : chunks)
                if (!chunk.type.equals(missing))
                    list.add(chunk);

            FormatException ex = assertThrows(FormatException.class, () -> decoder.decode(ContainerEncoder.assemble(list)));
            assertEquals(FormatException.Reason.MISSING_REQUIRED_CHUNK, ex.reason());
            assertTrue(ex.getMessage().contains(missing));
        }
    }

    @Test
    public void testAiDataIsDetached() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 100, 440, 8000), TestAudio.enhanced(1, 8000, 100, CompressionProfile.BALANCED));
        DecodedContainer decoded = decoder.decode(container);

        Chunk aide = null;
        for (Chunk chunk : decoded.chunks)
            if (chunk.is(ChunkType.AIDE))
                aide = chunk;

        assertNotNull(aide);
        long crc = aide.crc32();
        byte[] original = aide.payload.clone();

        decoded.aiData[0] ^= 0x7F;
        assertArrayEquals(original, aide.payload);
        assertEquals(crc, aide.crc32());
        assertTrue(IntegrityValidator.validate(decoded.chunks).checksumMatch);
    }

    @Test
    public void testDecodingOptions() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(1, 100, 440, 8000), TestAudio.enhanced(1, 8000, 100, CompressionProfile.BALANCED));
        container[payloadOffset(container, "AIDE")] ^= 0x01;

        DecodingOptions options = new DecodingOptions.Builder()
                .setValidateIntegrity(false)
                .setLoadAIData(false)
                .setLoadDSPSettings(false)
                .build();

        DecodedContainer decoded = decoder.decode(container, options);
        assertFalse(decoded.integrity.verified);
        assertTrue(decoded.integrity.checksumMatch);
        assertNull(decoded.aiData);
        assertNull(decoded.dspSettings);
        assertTrue(decoded.metadata.enhancementData.aiProcessed);
        assertEquals("ambient", decoded.metadata.enhancementData.genreDetection);
    }

    @Test
    public void testProbe() throws EuphException {
        byte[] container = encoder.encode(TestAudio.sine(2, 1000, 440, 8000), TestAudio.metadata(2, 8000, 1000, CompressionProfile.COMPACT).build());

        // Garbage audio would fail a full decode, probing doesn't look at it
        byte[] damaged = container.clone();
        Arrays.fill(damaged, payloadOffset(container, "AUDI"), payloadOffset(container, "AUDI") + 100, (byte) 0);

        ContainerInfo info = ContainerDecoder.probe(damaged);
        assertEquals(2, info.major);
        assertEquals(4, info.chunkCount);
        assertTrue(info.hasRequiredChunks());
        assertTrue(info.has(ChunkType.CHKS));
        assertFalse(info.has(ChunkType.AIDE));
        assertNotNull(info.metadata);
        assertEquals("Some Artist", info.metadata.artist);
        assertEquals(CompressionProfile.COMPACT, info.header.profile);

        assertFalse(ContainerDecoder.verify(damaged).checksumMatch);
        assertTrue(ContainerDecoder.verify(container).checksumMatch);
    }
}
