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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.integrity.IntegrityReport;
import xyz.gianlu.euph.metadata.HeaderInfo;
import xyz.gianlu.euph.metadata.Metadata;

import java.util.List;

/**
 * @author devgianlu
 */
public final class DecodedContainer {
    public final Metadata metadata;
    /**
     * One array per channel.
     */
    public final float[][] pcm;
    public final byte[] aiData;
    public final JsonElement dspSettings;
    public final IntegrityReport integrity;
    public final HeaderInfo header;
    /**
     * Every chunk in the container, unknown ones included.
     */
    public final List<Chunk> chunks;
    public final int major;
    public final int minor;
    /**
     * Set when the container has a different minor version.
     */
    public final String compatibilityNote;

    DecodedContainer(@NotNull Metadata metadata, float[][] pcm, byte @Nullable [] aiData, @Nullable JsonElement dspSettings,
                     @NotNull IntegrityReport integrity, @NotNull HeaderInfo header, @NotNull List<Chunk> chunks,
                     int major, int minor, @Nullable String compatibilityNote) {
        this.metadata = metadata;
        this.pcm = pcm;
        this.aiData = aiData;
        this.dspSettings = dspSettings;
        this.integrity = integrity;
        this.header = header;
        this.chunks = chunks;
        this.major = major;
        this.minor = minor;
        this.compatibilityNote = compatibilityNote;
    }

    public int channelCount() {
        return pcm.length;
    }

    public int frameCount() {
        return pcm.length == 0 ? 0 : pcm[0].length;
    }

    @Override
    public String toString() {
        return "DecodedContainer{version=" + major + "." + minor + ", metadata=" + metadata + ", frames=" + frameCount()
                + ", chunks=" + chunks.size() + ", integrity=" + integrity + '}';
    }
}
