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

package xyz.gianlu.euph.profile;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.profile.backend.CompressionBackend;

import java.io.IOException;

/**
 * Strategies that turn float PCM into the AUDI payload and back. A payload is fully described by the profile
 * and the compression level recorded in the HEAD chunk.
 *
 * @author devgianlu
 */
public enum CompressionProfile {
    /**
     * 16 bit quantization, stored as is at level 0 and zlib-wrapped otherwise.
     */
    LOSSLESS(0, "lossless"),
    /**
     * 16 bit quantization, always zlib-wrapped.
     */
    BALANCED(1, "balanced"),
    /**
     * Quantization depth shrinks from 16 to 8 bits as the level grows, samples are bit-packed.
     */
    COMPACT(2, "compact");

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 9;
    private static final Logger LOGGER = LoggerFactory.getLogger(CompressionProfile.class);
    public final int id;
    private final String profileName;

    CompressionProfile(int id, @NotNull String profileName) {
        this.id = id;
        this.profileName = profileName;
    }

    @Nullable
    public static CompressionProfile fromId(int id) {
        for (CompressionProfile profile : values())
            if (profile.id == id)
                return profile;

        return null;
    }

    @NotNull
    public static CompressionProfile fromName(@NotNull String name) {
        for (CompressionProfile profile : values())
            if (profile.profileName.equalsIgnoreCase(name))
                return profile;

        throw new IllegalArgumentException("Unknown profile: " + name);
    }

    public static void checkLevel(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL)
            throw new IllegalArgumentException("Compression level must be between 0 and 9: " + level);
    }

    @NotNull
    public String profileName() {
        return profileName;
    }

    public int quantizationBits(int level) {
        checkLevel(level);
        if (this == COMPACT) return 16 - level * 8 / 9;
        else return 16;
    }

    public boolean isZlibWrapped(int level) {
        checkLevel(level);
        switch (this) {
            case LOSSLESS:
                return level > 0;
            case BALANCED:
                return true;
            case COMPACT:
                return false;
            default:
                throw new IllegalStateException(String.valueOf(this));
        }
    }

    /**
     * @return The size of the quantized stream before the optional zlib wrapping
     */
    public long payloadSize(int level, long sampleCount) {
        return (sampleCount * quantizationBits(level) + 7) / 8;
    }

    @NotNull
    public byte[] compress(float[] interleaved, int level, @NotNull CompressionBackend backend) throws IOException {
        byte[] quantized = this == COMPACT ? Quantizer.pack(interleaved, quantizationBits(level)) : Quantizer.toInt16(interleaved);
        if (!isZlibWrapped(level)) return quantized;

        byte[] deflated = backend.deflate(quantized, level);
        LOGGER.trace("Deflated audio with {}, level: {}, {} -> {} bytes", backend.name(), level, quantized.length, deflated.length);
        return deflated;
    }

    /**
     * Exact inverse of {@link #compress(float[], int, CompressionBackend)}.
     *
     * @param expectedSamples The number of interleaved samples in the payload, or {@code -1} if unknown
     * @throws IOException     If the zlib stream is damaged
     * @throws FormatException If the payload doesn't contain a whole number of samples
     */
    @NotNull
    public float[] decompress(byte[] payload, int level, long expectedSamples, @NotNull CompressionBackend backend) throws IOException, FormatException {
        byte[] quantized = isZlibWrapped(level) ? backend.inflate(payload) : payload;

        SampleReader reader = SampleReader.create(this, level, expectedSamples);
        float[] samples = reader.read(quantized, 0, quantized.length);
        reader.finish();
        return samples;
    }

    @Override
    public String toString() {
        return profileName;
    }
}
