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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.chunk.ChunkType;

/**
 * A chunk as it comes out of the {@link StreamingDecoder}. The payload type depends on the chunk:
 * <ul>
 *     <li>HEAD: {@link xyz.gianlu.euph.metadata.HeaderInfo}</li>
 *     <li>META: {@link xyz.gianlu.euph.metadata.Metadata}, or the raw {@link com.google.gson.JsonObject} if HEAD hasn't been read yet</li>
 *     <li>AUDI: {@code float[]}, the interleaved samples decoded from this chunk</li>
 *     <li>AIDE: {@code byte[]}</li>
 *     <li>DSPS: {@link com.google.gson.JsonElement}</li>
 *     <li>CHKS: {@link xyz.gianlu.euph.integrity.IntegrityReport}</li>
 *     <li>anything else: {@code byte[]}, the raw payload</li>
 * </ul>
 *
 * @author devgianlu
 */
public final class StreamEvent {
    public final String chunkType;
    public final int chunkIndex;
    public final Object payload;
    /**
     * Share of the audio decoded so far, from 0 to 100.
     */
    public final double progressPercent;

    StreamEvent(@NotNull String chunkType, int chunkIndex, @NotNull Object payload, double progressPercent) {
        this.chunkType = chunkType;
        this.chunkIndex = chunkIndex;
        this.payload = payload;
        this.progressPercent = progressPercent;
    }

    @Nullable
    public ChunkType knownType() {
        return ChunkType.parse(chunkType);
    }

    public boolean is(@NotNull ChunkType type) {
        return type.is(chunkType);
    }

    /**
     * @throws ClassCastException If the payload isn't of the given type
     */
    @NotNull
    public <T> T payloadAs(@NotNull Class<T> clazz) {
        return clazz.cast(payload);
    }

    @Override
    public String toString() {
        return "StreamEvent{chunkType='" + chunkType + "', chunkIndex=" + chunkIndex + ", progressPercent=" + progressPercent + '}';
    }
}
