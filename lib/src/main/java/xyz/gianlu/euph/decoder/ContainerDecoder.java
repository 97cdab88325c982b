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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.UnsupportedVersionException;
import xyz.gianlu.euph.Version;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.chunk.ChunkCodec;
import xyz.gianlu.euph.chunk.ChunkType;
import xyz.gianlu.euph.chunk.Preamble;
import xyz.gianlu.euph.common.Utils;
import xyz.gianlu.euph.config.DecodingOptions;
import xyz.gianlu.euph.integrity.IntegrityReport;
import xyz.gianlu.euph.integrity.IntegrityValidator;
import xyz.gianlu.euph.metadata.HeaderInfo;
import xyz.gianlu.euph.metadata.Metadata;
import xyz.gianlu.euph.metadata.MetadataJson;
import xyz.gianlu.euph.profile.Frames;
import xyz.gianlu.euph.profile.backend.Backends;
import xyz.gianlu.euph.profile.backend.CompressionBackend;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes a whole container held in memory.
 * <p>
 * Structural problems (bad magic, truncation, missing chunks, unsupported version) abort decoding. Checksum
 * mismatches don't: the audio and metadata are returned anyway together with an {@link IntegrityReport}.
 *
 * @author devgianlu
 */
public final class ContainerDecoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContainerDecoder.class);
    private final CompressionBackend backend;

    public ContainerDecoder() {
        this(null);
    }

    public ContainerDecoder(@Nullable CompressionBackend backend) {
        this.backend = backend == null ? Backends.probe() : backend;
    }

    /**
     * Reads the preamble and checks the version.
     *
     * @return The compatibility note, if any
     */
    @Nullable
    private static String readVersion(@NotNull Preamble preamble) throws UnsupportedVersionException {
        String note = Version.checkCompatibility(preamble.major, preamble.minor);
        if (note != null) LOGGER.warn(note);
        return note;
    }

    @NotNull
    private static List<Chunk> readChunks(byte[] data, @NotNull Preamble preamble) throws FormatException {
        List<Chunk> chunks = new ArrayList<>((int) Math.min(preamble.chunkCount, 16));
        int offset = Preamble.SIZE;
        for (long i = 0; i < preamble.chunkCount; i++) {
            Chunk chunk = ChunkCodec.readChunk(data, offset);
            LOGGER.trace("Read chunk #{}: {}", i, chunk);
            chunks.add(chunk);
            offset = chunk.nextOffset();
        }

        if (offset < data.length)
            LOGGER.debug("Ignoring {} bytes after the last chunk.", data.length - offset);

        return chunks;
    }

    @Nullable
    private static Chunk first(@NotNull List<Chunk> chunks, @NotNull ChunkType type) {
        for (Chunk chunk : chunks)
            if (chunk.is(type))
                return chunk;

        return null;
    }

    @NotNull
    private static FormatException corruptedOr(@NotNull FormatException ex, @NotNull IntegrityReport integrity) {
        if (integrity.checksumMatch) return ex;
        else return new CorruptedContainerException(integrity, ex);
    }

    @NotNull
    public DecodedContainer decode(byte[] data) throws FormatException, UnsupportedVersionException {
        return decode(data, DecodingOptions.DEFAULT);
    }

    /**
     * @throws FormatException             If the container is structurally invalid
     * @throws CorruptedContainerException If the audio can't be reconstructed from a container that failed integrity validation
     * @throws UnsupportedVersionException If the container has a newer major version
     */
    @NotNull
    public DecodedContainer decode(byte[] data, @NotNull DecodingOptions options) throws FormatException, UnsupportedVersionException {
        Preamble preamble = Preamble.read(data, 0);
        String note = readVersion(preamble);
        List<Chunk> chunks = readChunks(data, preamble);

        Chunk head = first(chunks, ChunkType.HEAD);
        Chunk meta = first(chunks, ChunkType.META);
        List<byte[]> audio = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (chunk.is(ChunkType.AUDI)) audio.add(chunk.payload);
            else if (chunk.knownType() == null) LOGGER.debug("Ignoring unknown chunk {}.", chunk);
        }

        if (head == null) throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "HEAD");
        if (meta == null) throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "META");
        if (audio.isEmpty()) throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "AUDI");

        IntegrityReport integrity = options.validateIntegrity ? IntegrityValidator.validate(chunks) : IntegrityReport.unverified();

        HeaderInfo header;
        try {
            header = HeaderInfo.parse(head.payload);
        } catch (FormatException ex) {
            throw corruptedOr(ex, integrity);
        }

        JsonObject metaJson = null;
        try {
            metaJson = MetadataJson.read(meta.payload);
        } catch (FormatException ex) {
            if (!integrity.isCorrupted(ChunkType.META)) throw ex;
            LOGGER.warn("Dropping corrupted META chunk: {}", ex.getMessage());
        }

        byte[] aiData = null;
        if (options.loadAIData) {
            Chunk aide = first(chunks, ChunkType.AIDE);
            if (aide != null) aiData = aide.payload.clone();
        }

        JsonElement dspSettings = null;
        Chunk dsps = options.loadDSPSettings ? first(chunks, ChunkType.DSPS) : null;
        if (dsps != null) {
            try {
                dspSettings = MetadataJson.parse(dsps.payload, "DSPS");
            } catch (FormatException ex) {
                if (!integrity.isCorrupted(ChunkType.DSPS)) throw ex;
                LOGGER.warn("Dropping corrupted DSPS chunk: {}", ex.getMessage());
            }
        }

        float[] samples;
        try {
            samples = header.profile.decompress(Utils.concat(audio), header.compressionLevel, header.expectedSamples(), backend);
            if (samples.length % header.channelCount != 0)
                throw new FormatException(FormatException.Reason.AUDIO_LENGTH_MISMATCH, String.format("%d samples aren't a multiple of %d channels", samples.length, header.channelCount));
        } catch (IOException ex) {
            throw corruptedOr(new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "audio can't be inflated", ex), integrity);
        } catch (FormatException ex) {
            throw corruptedOr(ex, integrity);
        }

        float[][] pcm = Frames.deinterleave(samples, header.channelCount);
        Metadata metadata = MetadataJson.assemble(header, metaJson, aiData, dspSettings);
        LOGGER.debug("Decoded {} frames of {} channels from {} chunks, integrity: {}", pcm[0].length, header.channelCount, chunks.size(), integrity);

        return new DecodedContainer(metadata, pcm, aiData, dspSettings, integrity, header,
                Collections.unmodifiableList(chunks), preamble.major, preamble.minor, note);
    }

    /**
     * Checks the chunks against the checksum record without decoding anything.
     *
     * @throws FormatException             If the container is structurally invalid
     * @throws UnsupportedVersionException If the container has a newer major version
     */
    @NotNull
    public static IntegrityReport verify(byte[] data) throws FormatException, UnsupportedVersionException {
        Preamble preamble = Preamble.read(data, 0);
        readVersion(preamble);
        return IntegrityValidator.validate(readChunks(data, preamble));
    }

    /**
     * Reads the container structure, HEAD and META without touching the audio.
     *
     * @throws FormatException             If the container is structurally invalid
     * @throws UnsupportedVersionException If the container has a newer major version
     */
    @NotNull
    public static ContainerInfo probe(byte[] data) throws FormatException, UnsupportedVersionException {
        Preamble preamble = Preamble.read(data, 0);
        readVersion(preamble);

        List<ContainerInfo.Entry> entries = new ArrayList<>((int) Math.min(preamble.chunkCount, 16));
        HeaderInfo header = null;
        JsonObject meta = null;
        int offset = Preamble.SIZE;
        for (long i = 0; i < preamble.chunkCount; i++) {
            int size = ChunkCodec.checkBounds(data, offset);
            String type = ChunkCodec.readTag(data, offset);
            entries.add(new ContainerInfo.Entry(type, size, offset));

            if (ChunkType.HEAD.is(type) && header == null) {
                try {
                    header = HeaderInfo.parse(ChunkCodec.readChunk(data, offset).payload);
                } catch (FormatException ex) {
                    LOGGER.debug("Unreadable HEAD chunk: {}", ex.getMessage());
                }
            } else if (ChunkType.META.is(type) && meta == null) {
                try {
                    meta = MetadataJson.read(ChunkCodec.readChunk(data, offset).payload);
                } catch (FormatException ex) {
                    LOGGER.debug("Unreadable META chunk: {}", ex.getMessage());
                }
            }

            offset += ChunkCodec.HEADER_SIZE + size;
        }

        Metadata metadata = header == null || meta == null ? null : MetadataJson.assemble(header, meta, null, null);
        return new ContainerInfo(preamble.major, preamble.minor, preamble.chunkCount, data.length,
                Collections.unmodifiableList(entries), header, metadata);
    }
}
