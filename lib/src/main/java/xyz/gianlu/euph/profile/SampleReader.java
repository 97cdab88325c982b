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
import xyz.gianlu.euph.FormatException;

import java.util.Arrays;

/**
 * Turns a quantized (already inflated) sample stream back into floats. Input can be fed in slices of any size,
 * samples split across two slices are carried over.
 *
 * @author devgianlu
 */
public abstract class SampleReader {
    protected final int maxValue;
    private final long expectedSamples;
    private long produced = 0;

    private SampleReader(int bits, long expectedSamples) {
        this.maxValue = Quantizer.maxValue(bits);
        this.expectedSamples = expectedSamples;
    }

    /**
     * @param expectedSamples Total number of samples in the stream, or {@code -1} if unknown
     */
    @NotNull
    public static SampleReader create(@NotNull CompressionProfile profile, int level, long expectedSamples) {
        if (profile == CompressionProfile.COMPACT)
            return new Packed(profile.quantizationBits(level), expectedSamples);
        else
            return new Int16(expectedSamples);
    }

    @NotNull
    public final float[] read(byte[] data, int off, int len) throws FormatException {
        float[] out = new float[maxSamples(len)];
        int count = readInternal(data, off, len, out);
        produced += count;
        if (expectedSamples != -1 && produced > expectedSamples)
            throw new FormatException(FormatException.Reason.AUDIO_LENGTH_MISMATCH, String.format("expected %d samples, got at least %d", expectedSamples, produced));

        return count == out.length ? out : Arrays.copyOf(out, count);
    }

    /**
     * Checks that the stream ended on a sample boundary with the expected number of samples.
     */
    public final void finish() throws FormatException {
        if (hasPartialSample())
            throw new FormatException(FormatException.Reason.AUDIO_LENGTH_MISMATCH, "stream ends in the middle of a sample");

        if (expectedSamples != -1 && produced != expectedSamples)
            throw new FormatException(FormatException.Reason.AUDIO_LENGTH_MISMATCH, String.format("expected %d samples, got %d", expectedSamples, produced));
    }

    public final long produced() {
        return produced;
    }

    protected abstract int maxSamples(int len);

    protected abstract int readInternal(byte[] data, int off, int len, float[] out);

    protected abstract boolean hasPartialSample();

    private static final class Int16 extends SampleReader {
        private int carry = -1;

        Int16(long expectedSamples) {
            super(16, expectedSamples);
        }

        @Override
        protected int maxSamples(int len) {
            return (len + (carry == -1 ? 0 : 1)) / 2;
        }

        @Override
        protected int readInternal(byte[] data, int off, int len, float[] out) {
            int count = 0;
            for (int i = off; i < off + len; i++) {
                int b = data[i] & 0xFF;
                if (carry == -1) {
                    carry = b;
                } else {
                    short s = (short) (carry | (b << 8));
                    out[count++] = Quantizer.dequantize(s, maxValue);
                    carry = -1;
                }
            }

            return count;
        }

        @Override
        protected boolean hasPartialSample() {
            return carry != -1;
        }
    }

    /**
     * Padding after the last sample is always shorter than a byte, so decoding greedily never yields extra samples.
     */
    private static final class Packed extends SampleReader {
        private final int bits;
        private final long mask;
        private long acc = 0;
        private int accBits = 0;

        Packed(int bits, long expectedSamples) {
            super(bits, expectedSamples);
            this.bits = bits;
            this.mask = (1L << bits) - 1;
        }

        @Override
        protected int maxSamples(int len) {
            return (int) (((long) len * 8 + accBits) / bits);
        }

        @Override
        protected int readInternal(byte[] data, int off, int len, float[] out) {
            int count = 0;
            for (int i = off; i < off + len; i++) {
                acc = (acc << 8) | (data[i] & 0xFF);
                accBits += 8;

                if (accBits >= bits) {
                    accBits -= bits;
                    int raw = (int) ((acc >>> accBits) & mask);
                    acc &= (1L << accBits) - 1;
                    out[count++] = Quantizer.dequantize((raw << (32 - bits)) >> (32 - bits), maxValue);
                }
            }

            return count;
        }

        @Override
        protected boolean hasPartialSample() {
            return accBits >= 8;
        }
    }
}
