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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * @author devgianlu
 */
final class Quantizer {

    private Quantizer() {
    }

    static int maxValue(int bits) {
        return (1 << (bits - 1)) - 1;
    }

    static int quantize(float sample, int maxValue) {
        if (Float.isNaN(sample)) return 0;
        if (sample > 1) sample = 1;
        else if (sample < -1) sample = -1;

        return Math.round(sample * maxValue);
    }

    static float dequantize(int value, int maxValue) {
        float val = value / (float) maxValue;
        if (val < -1) return -1;
        return val;
    }

    /**
     * @return Little-endian signed 16 bit samples
     */
    @NotNull
    static byte[] toInt16(float[] samples) {
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        int max = maxValue(16);
        for (float sample : samples) buffer.putShort((short) quantize(sample, max));
        return buffer.array();
    }

    /**
     * @return Two's complement samples of {@code bits} bits each, packed MSB first, last byte zero-padded
     */
    @NotNull
    static byte[] pack(float[] samples, int bits) {
        byte[] out = new byte[(int) (((long) samples.length * bits + 7) / 8)];
        int max = maxValue(bits);
        long mask = (1L << bits) - 1;

        long acc = 0;
        int accBits = 0;
        int pos = 0;
        for (float sample : samples) {
            acc = (acc << bits) | (quantize(sample, max) & mask);
            accBits += bits;

            while (accBits >= 8) {
                accBits -= 8;
                out[pos++] = (byte) (acc >>> accBits);
            }

            acc &= (1L << accBits) - 1;
        }

        if (accBits > 0) out[pos] = (byte) (acc << (8 - accBits));
        return out;
    }
}
