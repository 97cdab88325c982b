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

package xyz.gianlu.euph.stream;

import com.google.gson.JsonObject;
import okio.Buffer;
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
import xyz.gianlu.euph.config.DecodingOptions;
import xyz.gianlu.euph.integrity.ChunkDigest;
import xyz.gianlu.euph.integrity.IntegrityReport;
import xyz.gianlu.euph.integrity.IntegrityValidator;
import xyz.gianlu.euph.metadata.HeaderInfo;
import xyz.gianlu.euph.metadata.MetadataJson;
import xyz.gianlu.euph.profile.SampleReader;
import xyz.gianlu.euph.profile.backend.Backends;
import xyz.gianlu.euph.profile.backend.CompressionBackend;
import xyz.gianlu.euph.profile.backend.InflateSession;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Decodes a container as it arrives, one chunk per {@link #next()} call. The source is only read when an event
 * is requested and only as much as needed to complete the next chunk.
 * <p>
 * Not thread safe. A checksum record can only cover the chunks that came before it.
 *
 * @author devgianlu
 */
public final class StreamingDecoder implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingDecoder.class);
    private final SegmentSource source;
    private final DecodingOptions options;
    private final CompressionBackend backend;
    private final Buffer buffer = new Buffer();
    private final CRC32 aggregate = new CRC32();
    private final List<ChunkDigest> digests = new ArrayList<>();
    private Preamble preamble = null;
    private String compatibilityNote = null;
    private int chunksRead = 0;
    private boolean busy = false;
    private boolean closed = false;
    private boolean ended = false;
    private boolean seenMeta = false;
    private boolean seenAudio = false;
    private HeaderInfo header = null;
    private SampleReader reader = null;
    private InflateSession inflater = null;
    private long expectedBytes = 0;
    private long decodedBytes = 0;

    public StreamingDecoder(@NotNull SegmentSource source) {
        this(source, DecodingOptions.DEFAULT);
    }

    public StreamingDecoder(@NotNull SegmentSource source, @NotNull DecodingOptions options) {
        this.source = source;
        this.options = options;
        this.backend = options.backend == null ? Backends.probe() : options.backend;
    }

    public boolean hasNext() throws IOException, FormatException, UnsupportedVersionException {
        enter();
        try {
            if (ended) return false;

            readPreamble();
            if (chunksRead < preamble.chunkCount) return true;

            finish();
            return false;
        } finally {
            busy = false;
        }
    }

    /**
     * @return The next event or {@code null} if all the declared chunks have been read
     * @throws FormatException             If the data is malformed or ends before the last chunk
     * @throws UnsupportedVersionException If the container has a newer major version
     * @throws IOException                 If the source fails or the decoder has been closed
     * @throws IllegalStateException       If called while another call is in progress
     */
    @Nullable
    public StreamEvent next() throws IOException, FormatException, UnsupportedVersionException {
        enter();
        try {
            if (ended) return null;

            readPreamble();
            if (chunksRead == preamble.chunkCount) {
                finish();
                return null;
            }

            return readChunk();
        } finally {
            busy = false;
        }
    }

    private void enter() throws IOException {
        if (closed) throw new IOException("Decoder is closed!");
        if (busy) throw new IllegalStateException("Reentrant call!");
        busy = true;
    }

    /**
     * Pulls segments until at least {@code count} bytes are buffered.
     *
     * @return Whether enough data is available
     */
    private boolean fill(long count) throws IOException {
        while (buffer.size() < count) {
            byte[] segment = source.nextSegment();
            if (segment == null) return false;
            buffer.write(segment);
        }

        return true;
    }

    private void readPreamble() throws IOException, FormatException, UnsupportedVersionException {
        if (preamble != null) return;

        if (!fill(Preamble.SIZE))
            throw new FormatException(FormatException.Reason.TRUNCATED_HEADER, String.format("%d bytes available", buffer.size()));

        preamble = Preamble.read(buffer.readByteArray(Preamble.SIZE), 0);
        compatibilityNote = Version.checkCompatibility(preamble.major, preamble.minor);
        if (compatibilityNote != null) LOGGER.warn(compatibilityNote);
        LOGGER.trace("Streaming {}", preamble);
    }

    @NotNull
    private StreamEvent readChunk() throws IOException, FormatException {
        if (!fill(ChunkCodec.HEADER_SIZE))
            throw new FormatException(FormatException.Reason.TRUNCATED_CHUNK, String.format("chunk #%d header, %d bytes available", chunksRead, buffer.size()));

        long size = (buffer.getByte(4) & 0xFFL) | (buffer.getByte(5) & 0xFFL) << 8 | (buffer.getByte(6) & 0xFFL) << 16 | (buffer.getByte(7) & 0xFFL) << 24;
        if (size > ChunkCodec.MAX_PAYLOAD_SIZE)
            throw new FormatException(FormatException.Reason.TRUNCATED_CHUNK, String.format("chunk #%d declares %d bytes", chunksRead, size));

        if (!fill(ChunkCodec.HEADER_SIZE + size))
            throw new FormatException(FormatException.Reason.TRUNCATED_CHUNK, String.format("chunk #%d declares %d bytes, only %d available", chunksRead, size, buffer.size() - ChunkCodec.HEADER_SIZE));

        Chunk chunk = ChunkCodec.readChunk(buffer.readByteArray(ChunkCodec.HEADER_SIZE + size), 0);
        int index = chunksRead++;
        LOGGER.trace("Streamed chunk #{}: {}", index, chunk);

        if (!chunk.is(ChunkType.CHKS)) {
            aggregate.update(chunk.payload, 0, chunk.payload.length);
            digests.add(ChunkDigest.of(chunk, index));
        }

        Object payload = handle(chunk, index);
        return new StreamEvent(chunk.type, index, payload, progress());
    }

    @NotNull
    private Object handle(@NotNull Chunk chunk, int index) throws FormatException {
        ChunkType type = chunk.knownType();
        if (type == null) {
            LOGGER.debug("Passing through unknown chunk {}.", chunk);
            return chunk.payload;
        }

        switch (type) {
            case HEAD:
                HeaderInfo parsed = HeaderInfo.parse(chunk.payload);
                if (header == null) startAudio(parsed);
                else LOGGER.debug("Ignoring duplicate HEAD chunk #{}.", index);
                return parsed;
            case META:
                seenMeta = true;
                JsonObject json = MetadataJson.read(chunk.payload);
                if (header != null) return MetadataJson.assemble(header, json, null, null);

                // Format fields come from HEAD, don't make them up
                LOGGER.debug("META chunk #{} precedes HEAD, passing the raw descriptive fields.", index);
                return json;
            case AUDI:
                seenAudio = true;
                return decodeAudio(chunk.payload);
            case AIDE:
                return chunk.payload;
            case DSPS:
                return MetadataJson.parse(chunk.payload, "DSPS");
            case CHKS:
                if (!options.validateIntegrity) return IntegrityReport.unverified();
                return IntegrityValidator.check(digests, aggregate.getValue(), chunk.payload, index);
            default:
                throw new IllegalStateException(String.valueOf(type));
        }
    }

    private void startAudio(@NotNull HeaderInfo header) {
        this.header = header;
        this.expectedBytes = header.expectedAudioBytes();
        this.reader = SampleReader.create(header.profile, header.compressionLevel, header.expectedSamples());
        if (header.profile.isZlibWrapped(header.compressionLevel))
            this.inflater = backend.openInflater();

        LOGGER.debug("Streaming audio: {}, expecting {} bytes.", header, expectedBytes);
    }

    @NotNull
    private float[] decodeAudio(byte[] payload) throws FormatException {
        if (header == null)
            throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "HEAD must come before AUDI");

        byte[] data;
        if (inflater == null) {
            data = payload;
        } else {
            try {
                data = inflater.feed(payload, 0, payload.length);
            } catch (IOException ex) {
                throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "audio can't be inflated", ex);
            }
        }

        decodedBytes += data.length;
        return reader.read(data, 0, data.length);
    }

    /**
     * @return Share of the audio decoded so far, from 0 to 100. Always 0 before HEAD has been read.
     */
    public double progress() {
        if (header == null) return 0;
        if (expectedBytes <= 0) return 100;
        return Math.min(100, decodedBytes * 100.0 / expectedBytes);
    }

    private void finish() throws FormatException {
        ended = true;

        if (header == null) throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "HEAD");
        if (!seenMeta) throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "META");
        if (!seenAudio) throw new FormatException(FormatException.Reason.MISSING_REQUIRED_CHUNK, "AUDI");

        if (inflater != null) {
            try {
                inflater.finish();
            } catch (IOException ex) {
                throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "audio can't be inflated", ex);
            } finally {
                inflater.close();
            }
        }

        reader.finish();
        LOGGER.debug("Streamed {} chunks, {} audio bytes.", chunksRead, decodedBytes);
    }

    /**
     * @return The HEAD chunk, if it has been read
     */
    @Nullable
    public HeaderInfo header() {
        return header;
    }

    @Nullable
    public String compatibilityNote() {
        return compatibilityNote;
    }

    @Override
    public void close() throws IOException {
        if (closed) return;

        closed = true;
        buffer.clear();
        if (inflater != null) inflater.close();
        source.close();
    }
}
