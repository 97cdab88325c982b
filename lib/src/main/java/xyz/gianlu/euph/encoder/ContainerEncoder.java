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

package xyz.gianlu.euph.encoder;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.euph.EncodingException;
import xyz.gianlu.euph.Version;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.chunk.ChunkCodec;
import xyz.gianlu.euph.chunk.ChunkType;
import xyz.gianlu.euph.chunk.Preamble;
import xyz.gianlu.euph.config.EncodingOptions;
import xyz.gianlu.euph.integrity.ChecksumRecord;
import xyz.gianlu.euph.metadata.EnhancementData;
import xyz.gianlu.euph.metadata.HeaderInfo;
import xyz.gianlu.euph.metadata.Metadata;
import xyz.gianlu.euph.metadata.MetadataJson;
import xyz.gianlu.euph.profile.CompressionProfile;
import xyz.gianlu.euph.profile.Frames;
import xyz.gianlu.euph.profile.backend.Backends;
import xyz.gianlu.euph.profile.backend.CompressionBackend;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds a container out of PCM samples and metadata. Chunks are written in this order:
 * HEAD, META, AUDI (one or more), AIDE, DSPS, CHKS. The last three are optional.
 *
 * @author devgianlu
 */
public final class ContainerEncoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContainerEncoder.class);
    private static final long MAX_U32 = 0xFFFFFFFFL;
    private final CompressionBackend backend;

    public ContainerEncoder() {
        this(null);
    }

    /**
     * @param backend The backend to use when the options don't specify one, if {@code null} one is probed
     */
    public ContainerEncoder(@Nullable CompressionBackend backend) {
        this.backend = backend == null ? Backends.probe() : backend;
    }

    /**
     * Frames the given chunks into a container with the current format version.
     */
    @NotNull
    public static byte[] assemble(@NotNull List<Chunk> chunks) {
        return assemble(Version.FORMAT_MAJOR, Version.FORMAT_MINOR, chunks);
    }

    @NotNull
    public static byte[] assemble(int major, int minor, @NotNull List<Chunk> chunks) {
        long size = Preamble.SIZE;
        for (Chunk chunk : chunks) size += chunk.encodedSize();
        if (size > Integer.MAX_VALUE - 8)
            throw new IllegalArgumentException("Container too large: " + size);

        ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
        new Preamble(major, minor, chunks.size()).write(buffer);
        for (Chunk chunk : chunks) ChunkCodec.writeChunk(buffer, chunk.type, chunk.payload);
        return buffer.array();
    }

    @NotNull
    private static CompressionProfile profileFor(@NotNull Metadata metadata, @NotNull EncodingOptions options) {
        if (options.profile != null) return options.profile;
        else if (metadata.encodingProfile != null) return metadata.encodingProfile;
        else return CompressionProfile.BALANCED;
    }

    /**
     * @return An upper bound of the size of the container {@link #encode(float[][], Metadata, EncodingOptions, ProgressListener)} would produce
     */
    public static long estimateSize(long frames, @NotNull Metadata metadata, @NotNull EncodingOptions options) {
        CompressionProfile profile = profileFor(metadata, options);
        long audio = profile.payloadSize(options.compressionLevel, frames * metadata.channelCount);
        if (profile.isZlibWrapped(options.compressionLevel))
            audio += (audio >> 8) + 64;

        long audioChunks = Math.max(1, (audio + options.chunkSize - 1) / options.chunkSize);
        long size = Preamble.SIZE;
        size += ChunkCodec.HEADER_SIZE + HeaderInfo.SIZE;
        size += ChunkCodec.HEADER_SIZE + MetadataJson.write(metadata).length;
        size += audioChunks * ChunkCodec.HEADER_SIZE + audio;

        long chunks = 2 + audioChunks;
        EnhancementData enhancement = metadata.enhancementData;
        if (enhancement != null) {
            if (options.includeAIData && enhancement.hasSpatialData()) {
                size += ChunkCodec.HEADER_SIZE + enhancement.spatialData.length;
                chunks++;
            }

            if (options.includeDSPSettings && enhancement.hasDspSettings()) {
                size += ChunkCodec.HEADER_SIZE + enhancement.dspSettings.toString().getBytes(StandardCharsets.UTF_8).length;
                chunks++;
            }
        }

        if (options.enableIntegrityCheck)
            size += ChunkCodec.HEADER_SIZE + ChecksumRecord.LEGACY_SIZE + chunks * 4 + 4;

        return size;
    }

    private static void checkInput(float[][] pcm, @NotNull Metadata metadata) throws EncodingException {
        if (pcm == null || pcm.length == 0)
            throw new EncodingException("No audio channels");

        for (float[] channel : pcm)
            if (channel == null)
                throw new EncodingException("Missing audio channel");

        int frames = pcm[0].length;
        if (frames == 0)
            throw new EncodingException("No audio frames");

        for (int i = 1; i < pcm.length; i++)
            if (pcm[i].length != frames)
                throw new EncodingException(String.format("Channel %d has %d frames, channel 0 has %d", i, pcm[i].length, frames));

        if (pcm.length != metadata.channelCount)
            throw new EncodingException(String.format("Got %d channels, metadata declares %d", pcm.length, metadata.channelCount));
    }

    private static void checkMetadata(@NotNull Metadata metadata) throws EncodingException {
        if (Double.isNaN(metadata.duration) || metadata.duration < 0)
            throw new EncodingException("Invalid duration: " + metadata.duration);
        if (Math.round(metadata.duration * 1000) > MAX_U32)
            throw new EncodingException("Duration too long: " + metadata.duration);
        if (metadata.sampleRate <= 0)
            throw new EncodingException("Invalid sample rate: " + metadata.sampleRate);
        if (metadata.channelCount <= 0 || metadata.channelCount > 0xFFFF)
            throw new EncodingException("Invalid channel count: " + metadata.channelCount);
        if (metadata.bitDepth < 0 || metadata.bitDepth > 0xFFFF)
            throw new EncodingException("Invalid bit depth: " + metadata.bitDepth);
    }

    @NotNull
    public byte[] encode(float[][] pcm, @NotNull Metadata metadata) throws EncodingException {
        return encode(pcm, metadata, EncodingOptions.DEFAULT, null);
    }

    /**
     * @param pcm One array per channel, all of the same length, samples in [-1, 1]
     * @throws EncodingException If the input is invalid or the container would be too large
     */
    @NotNull
    public byte[] encode(float[][] pcm, @NotNull Metadata metadata, @NotNull EncodingOptions options, @Nullable ProgressListener listener) throws EncodingException {
        checkInput(pcm, metadata);
        return encodeInternal(Frames.interleave(pcm), pcm[0].length, metadata, options, listener);
    }

    /**
     * @param samples Frame-interleaved samples for {@code metadata.channelCount} channels
     * @throws EncodingException If the input is invalid or the container would be too large
     */
    @NotNull
    public byte[] encodeInterleaved(float[] samples, @NotNull Metadata metadata, @NotNull EncodingOptions options, @Nullable ProgressListener listener) throws EncodingException {
        if (samples == null || samples.length == 0)
            throw new EncodingException("No audio frames");
        if (metadata.channelCount <= 0 || samples.length % metadata.channelCount != 0)
            throw new EncodingException(String.format("%d samples aren't a whole number of %d channel frames", samples.length, metadata.channelCount));

        return encodeInternal(samples, samples.length / metadata.channelCount, metadata, options, listener);
    }

    @NotNull
    private byte[] encodeInternal(float[] interleaved, long frames, @NotNull Metadata metadata, @NotNull EncodingOptions options, @Nullable ProgressListener listener) throws EncodingException {
        checkMetadata(metadata);

        CompressionProfile profile = profileFor(metadata, options);
        CompressionBackend backend = options.backend == null ? this.backend : options.backend;
        Progress progress = new Progress(listener);
        List<Chunk> chunks = new ArrayList<>();

        HeaderInfo header = HeaderInfo.of(metadata, profile, options.compressionLevel, frames);
        chunks.add(new Chunk(ChunkType.HEAD.tag(), header.toBytes()));
        progress.report(EncodingStage.HEADER, 10);

        chunks.add(new Chunk(ChunkType.META.tag(), MetadataJson.write(metadata)));
        progress.report(EncodingStage.METADATA, 20);

        progress.report(EncodingStage.AUDIO_COMPRESS, 30);
        byte[] audio;
        try {
            audio = profile.compress(interleaved, options.compressionLevel, backend);
        } catch (IOException ex) {
            throw new EncodingException("Failed compressing audio", ex);
        }

        int audioChunks = 0;
        int offset = 0;
        do {
            int end = (int) Math.min(audio.length, (long) offset + options.chunkSize);
            chunks.add(new Chunk(ChunkType.AUDI.tag(), Arrays.copyOfRange(audio, offset, end)));
            audioChunks++;
            offset = end;
        } while (offset < audio.length);
        progress.report(EncodingStage.AUDIO_COMPRESS, 60);

        EnhancementData enhancement = metadata.enhancementData;
        if (enhancement != null && options.includeAIData && enhancement.hasSpatialData()) {
            chunks.add(new Chunk(ChunkType.AIDE.tag(), enhancement.spatialData.clone()));
            progress.report(EncodingStage.AI_DATA, 70);
        }

        if (enhancement != null && options.includeDSPSettings && enhancement.hasDspSettings()) {
            chunks.add(new Chunk(ChunkType.DSPS.tag(), enhancement.dspSettings.toString().getBytes(StandardCharsets.UTF_8)));
            progress.report(EncodingStage.DSP_DATA, 80);
        }

        if (options.enableIntegrityCheck) {
            chunks.add(new Chunk(ChunkType.CHKS.tag(), ChecksumRecord.compute(chunks).toBytes()));
            progress.report(EncodingStage.CHECKSUM, 90);
        }

        byte[] container;
        try {
            container = assemble(chunks);
        } catch (IllegalArgumentException ex) {
            throw new EncodingException("Encoded container is too large", ex);
        }

        progress.report(EncodingStage.FINALIZE, 100);
        LOGGER.debug("Encoded {} frames of {} channels with {} level {} ({} backend) into {} bytes, {} audio chunks.",
                frames, metadata.channelCount, profile, options.compressionLevel, backend.name(), container.length, audioChunks);
        return container;
    }

    private static final class Progress {
        private final ProgressListener listener;

        Progress(@Nullable ProgressListener listener) {
            this.listener = listener;
        }

        void report(@NotNull EncodingStage stage, int percent) {
            LOGGER.trace("Encoding stage {}, {}%", stage, percent);
            if (listener != null) listener.onProgress(stage, percent);
        }
    }
}
