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

package xyz.gianlu.euph.integrity;

import org.jetbrains.annotations.NotNull;
import xyz.gianlu.euph.chunk.Chunk;

/**
 * What integrity validation needs to remember about a chunk once its payload is gone.
 *
 * @author devgianlu
 */
public final class ChunkDigest {
    public final String type;
    /**
     * Position of the chunk in the container.
     */
    public final int index;
    public final long crc32;

    public ChunkDigest(@NotNull String type, int index, long crc32) {
        this.type = type;
        this.index = index;
        this.crc32 = crc32;
    }

    @NotNull
    public static ChunkDigest of(@NotNull Chunk chunk, int index) {
        return new ChunkDigest(chunk.type, index, chunk.crc32());
    }

    @Override
    public String toString() {
        return "ChunkDigest{type='" + type + "', index=" + index + ", crc32=" + Long.toHexString(crc32) + '}';
    }
}
