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

package xyz.gianlu.euph.chunk;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.common.Utils;

/**
 * One type-tagged block of a container.
 *
 * @author devgianlu
 */
public final class Chunk {
    public final String type;
    public final byte[] payload;
    /**
     * Position of the chunk header inside the container, {@code -1} for chunks that have not been read from a buffer.
     */
    public final int offset;
    private volatile long crc32 = -1;

    public Chunk(@NotNull String type, byte[] payload) {
        this(type, payload, -1);
    }

    Chunk(@NotNull String type, byte[] payload, int offset) {
        this.type = type;
        this.payload = payload;
        this.offset = offset;
    }

    public int size() {
        return payload.length;
    }

    /**
     * @return The number of bytes this chunk takes in a container, header included
     */
    public int encodedSize() {
        return ChunkCodec.HEADER_SIZE + payload.length;
    }

    public int nextOffset() {
        if (offset == -1) throw new IllegalStateException("Chunk wasn't read from a buffer!");
        return offset + encodedSize();
    }

    @Nullable
    public ChunkType knownType() {
        return ChunkType.parse(type);
    }

    public boolean is(@NotNull ChunkType type) {
        return type.is(this.type);
    }

    public long crc32() {
        if (crc32 == -1) crc32 = Utils.crc32(payload);
        return crc32;
    }

    @Override
    public String toString() {
        return "Chunk{type='" + type + "', size=" + payload.length + ", offset=" + offset + '}';
    }
}
