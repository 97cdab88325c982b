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

package xyz.gianlu.euph;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.chunk.Preamble;
import xyz.gianlu.euph.config.DecodingOptions;
import xyz.gianlu.euph.config.EncodingOptions;
import xyz.gianlu.euph.decoder.ContainerDecoder;
import xyz.gianlu.euph.decoder.ContainerInfo;
import xyz.gianlu.euph.decoder.DecodedContainer;
import xyz.gianlu.euph.encoder.ContainerEncoder;
import xyz.gianlu.euph.encoder.ProgressListener;
import xyz.gianlu.euph.integrity.IntegrityReport;
import xyz.gianlu.euph.metadata.Metadata;
import xyz.gianlu.euph.profile.backend.Backends;
import xyz.gianlu.euph.profile.backend.CompressionBackend;
import xyz.gianlu.euph.stream.SegmentSource;
import xyz.gianlu.euph.stream.StreamingDecoder;

import java.util.Locale;

/**
 * Entry point for reading and writing EUPH containers. Instances hold no mutable state and can be shared.
 *
 * @author devgianlu
 */
public final class EuphCodec {
    public static final String EXTENSION = ".euph";
    private final CompressionBackend backend;
    private final ContainerEncoder encoder;
    private final ContainerDecoder decoder;

    public EuphCodec() {
        this(null);
    }

    public EuphCodec(@Nullable CompressionBackend backend) {
        this.backend = backend == null ? Backends.probe() : backend;
        this.encoder = new ContainerEncoder(this.backend);
        this.decoder = new ContainerDecoder(this.backend);
    }

    /**
     * @return Whether the data is long enough to hold a preamble and starts with the magic
     */
    public static boolean isEuph(byte[] data) {
        return data != null && data.length >= Preamble.SIZE && Preamble.hasMagic(data, 0);
    }

    public static boolean hasEuphExtension(@NotNull String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    @Contract(pure = true)
    @NotNull
    public static String withEuphExtension(@NotNull String fileName) {
        if (hasEuphExtension(fileName)) return fileName;

        int dot = fileName.lastIndexOf('.');
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dot > slash + 1) return fileName.substring(0, dot) + EXTENSION;
        else return fileName + EXTENSION;
    }

    @NotNull
    public CompressionBackend backend() {
        return backend;
    }

    @NotNull
    public byte[] encode(float[][] pcm, @NotNull Metadata metadata) throws EncodingException {
        return encoder.encode(pcm, metadata);
    }

    @NotNull
    public byte[] encode(float[][] pcm, @NotNull Metadata metadata, @NotNull EncodingOptions options, @Nullable ProgressListener listener) throws EncodingException {
        return encoder.encode(pcm, metadata, options, listener);
    }

    @NotNull
    public DecodedContainer decode(byte[] data) throws FormatException, UnsupportedVersionException {
        return decoder.decode(data);
    }

    @NotNull
    public DecodedContainer decode(byte[] data, @NotNull DecodingOptions options) throws FormatException, UnsupportedVersionException {
        return decoder.decode(data, options);
    }

    @NotNull
    public ContainerInfo probe(byte[] data) throws FormatException, UnsupportedVersionException {
        return ContainerDecoder.probe(data);
    }

    @NotNull
    public IntegrityReport verify(byte[] data) throws FormatException, UnsupportedVersionException {
        return ContainerDecoder.verify(data);
    }

    public long estimateSize(long frames, @NotNull Metadata metadata, @NotNull EncodingOptions options) {
        return ContainerEncoder.estimateSize(frames, metadata, options);
    }

    /**
     * The returned decoder uses this codec's backend unless the options specify one.
     */
    @NotNull
    public StreamingDecoder stream(@NotNull SegmentSource source, @NotNull DecodingOptions options) {
        if (options.backend == null)
            options = new DecodingOptions.Builder()
                    .setValidateIntegrity(options.validateIntegrity)
                    .setLoadAIData(options.loadAIData)
                    .setLoadDSPSettings(options.loadDSPSettings)
                    .setBackend(backend)
                    .build();

        return new StreamingDecoder(source, options);
    }

    @NotNull
    public StreamingDecoder stream(@NotNull SegmentSource source) {
        return stream(source, DecodingOptions.DEFAULT);
    }
}
