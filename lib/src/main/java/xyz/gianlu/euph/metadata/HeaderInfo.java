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

package xyz.gianlu.euph.metadata;

import org.jetbrains.annotations.NotNull;
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.profile.CompressionProfile;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The HEAD chunk: a fixed 32 bytes little-endian struct.
 * <pre>
 *  0 sampleRate       u32
 *  4 channelCount     u16
 *  6 bitDepth         u16
 *  8 durationMs       u32
 * 12 profile          u8
 * 13 compressionLevel u8
 * 14 quantizationBits u8
 * 15 reserved         u8
 * 16 frameCount       u32
 * 20 reserved         12 bytes
 * </pre>
 * Older writers only emitted the first 14 bytes, missing fields are derived.
 *
 * @author devgianlu
 */
public final class HeaderInfo {
    public static final int SIZE = 32;
    public static final int MIN_SIZE = 14;
    public final int sampleRate;
    public final int channelCount;
    public final int bitDepth;
    public final long durationMs;
    public final CompressionProfile profile;
    public final int compressionLevel;
    public final int quantizationBits;
    /**
     * {@code 0} if the writer didn't record it.
     */
    public final long frameCount;

    public HeaderInfo(int sampleRate, int channelCount, int bitDepth, long durationMs, @NotNull CompressionProfile profile, int compressionLevel, long frameCount) {
        this.sampleRate = sampleRate;
        this.channelCount = channelCount;
        this.bitDepth = bitDepth;
        this.durationMs = durationMs;
        this.profile = profile;
        this.compressionLevel = compressionLevel;
        this.quantizationBits = profile.quantizationBits(compressionLevel);
        this.frameCount = frameCount;
    }

    @NotNull
    public static HeaderInfo of(@NotNull Metadata metadata, @NotNull CompressionProfile profile, int compressionLevel, long frameCount) {
        return new HeaderInfo(metadata.sampleRate, metadata.channelCount, metadata.bitDepth,
                Math.round(metadata.duration * 1000), profile, compressionLevel, frameCount);
    }

    @NotNull
    public static HeaderInfo parse(byte[] payload) throws FormatException {
        if (payload.length < MIN_SIZE)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, String.format("HEAD is %d bytes, at least %d required", payload.length, MIN_SIZE));

        ByteBuffer buf = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long sampleRate = buf.getInt() & 0xFFFFFFFFL;
        int channelCount = buf.getShort() & 0xFFFF;
        int bitDepth = buf.getShort() & 0xFFFF;
        long durationMs = buf.getInt() & 0xFFFFFFFFL;
        int profileId = buf.get() & 0xFF;
        int level = buf.get() & 0xFF;

        if (sampleRate == 0 || sampleRate > Integer.MAX_VALUE)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "invalid sample rate: " + sampleRate);
        if (channelCount == 0)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "zero channels");

        CompressionProfile profile = CompressionProfile.fromId(profileId);
        if (profile == null)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "unknown profile: " + profileId);
        if (level > CompressionProfile.MAX_LEVEL)
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "invalid compression level: " + level);

        if (payload.length > 14) {
            int bits = payload[14] & 0xFF;
            if (bits != 0 && bits != profile.quantizationBits(level))
                throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, String.format("%s at level %d doesn't use %d bits", profile, level, bits));
        }

        long frameCount = 0;
        if (payload.length >= 20) frameCount = buf.getInt(16) & 0xFFFFFFFFL;

        return new HeaderInfo((int) sampleRate, channelCount, bitDepth, durationMs, profile, level, frameCount);
    }

    @NotNull
    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(sampleRate);
        buf.putShort((short) channelCount);
        buf.putShort((short) bitDepth);
        buf.putInt((int) durationMs);
        buf.put((byte) profile.id);
        buf.put((byte) compressionLevel);
        buf.put((byte) quantizationBits);
        buf.put((byte) 0);
        buf.putInt((int) frameCount);
        return buf.array();
    }

    /**
     * @return The number of frames, estimated from the duration if it wasn't recorded
     */
    public long frames() {
        if (frameCount > 0) return frameCount;
        else return Math.round(durationMs * (double) sampleRate / 1000);
    }

    /**
     * @return The exact number of interleaved samples, or {@code -1} if the frame count wasn't recorded
     */
    public long expectedSamples() {
        if (frameCount > 0) return frameCount * channelCount;
        else return -1;
    }

    /**
     * @return The size of the audio stream after inflation, possibly estimated
     */
    public long expectedAudioBytes() {
        return profile.payloadSize(compressionLevel, frames() * channelCount);
    }

    public double durationSeconds() {
        return durationMs / 1000.0;
    }

    @Override
    public String toString() {
        return "HeaderInfo{sampleRate=" + sampleRate + ", channelCount=" + channelCount + ", bitDepth=" + bitDepth
                + ", durationMs=" + durationMs + ", profile=" + profile + ", compressionLevel=" + compressionLevel
                + ", quantizationBits=" + quantizationBits + ", frameCount=" + frameCount + '}';
    }
}
