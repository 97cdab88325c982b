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

/**
 * Converts between per-channel sample arrays and frame-interleaved ones ({@code L0 R0 L1 R1 ...}).
 *
 * @author devgianlu
 */
public final class Frames {

    private Frames() {
    }

    /**
     * @throws IllegalArgumentException If there are no channels or they have different lengths
     */
    @NotNull
    public static float[] interleave(float[][] channels) {
        if (channels.length == 0) throw new IllegalArgumentException("No channels!");

        int frames = channels[0].length;
        for (float[] channel : channels)
            if (channel.length != frames)
                throw new IllegalArgumentException(String.format("Channel lengths differ: %d != %d", channel.length, frames));

        float[] out = new float[frames * channels.length];
        for (int i = 0; i < frames; i++)
            for (int c = 0; c < channels.length; c++)
                out[i * channels.length + c] = channels[c][i];

        return out;
    }

    /**
     * @throws IllegalArgumentException If the samples don't form a whole number of frames
     */
    @NotNull
    public static float[][] deinterleave(float[] samples, int channelCount) {
        if (channelCount <= 0) throw new IllegalArgumentException("Invalid channel count: " + channelCount);
        if (samples.length % channelCount != 0)
            throw new IllegalArgumentException(String.format("%d samples aren't a multiple of %d channels", samples.length, channelCount));

        int frames = samples.length / channelCount;
        float[][] out = new float[channelCount][frames];
        for (int i = 0; i < frames; i++)
            for (int c = 0; c < channelCount; c++)
                out[c][i] = samples[i * channelCount + c];

        return out;
    }
}
