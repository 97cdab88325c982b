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
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A non-fatal integrity problem. These are only reported, callers decide whether to act on them.
 *
 * @author devgianlu
 */
public final class IntegrityWarning {
    public final Kind kind;
    public final String chunkType;
    /**
     * Position of the chunk in the container, {@code -1} if the warning isn't about a specific chunk.
     */
    public final int chunkIndex;
    public final String message;

    public IntegrityWarning(@NotNull Kind kind, @Nullable String chunkType, int chunkIndex, @NotNull String message) {
        this.kind = kind;
        this.chunkType = chunkType;
        this.chunkIndex = chunkIndex;
        this.message = message;
    }

    @NotNull
    static IntegrityWarning general(@NotNull Kind kind, @NotNull String message) {
        return new IntegrityWarning(kind, null, -1, message);
    }

    @NotNull
    static IntegrityWarning forChunk(@NotNull Kind kind, @NotNull ChunkDigest chunk, @NotNull String message) {
        return new IntegrityWarning(kind, chunk.type, chunk.index, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegrityWarning that = (IntegrityWarning) o;
        return chunkIndex == that.chunkIndex && kind == that.kind && Objects.equals(chunkType, that.chunkType) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, chunkType, chunkIndex, message);
    }

    @Override
    public String toString() {
        if (chunkType == null) return kind + ": " + message;
        else return kind + " (" + chunkType + " #" + chunkIndex + "): " + message;
    }

    public enum Kind {
        /**
         * The aggregate checksum doesn't match the chunks.
         */
        CHECKSUM_MISMATCH,
        /**
         * A single chunk doesn't match its recorded checksum.
         */
        CHUNK_MISMATCH,
        /**
         * The CHKS chunk itself is unreadable.
         */
        DAMAGED_RECORD,
        /**
         * The record has no per-chunk table, every covered chunk is suspect.
         */
        NO_CHUNK_TABLE,
        CHUNK_COUNT_MISMATCH,
        /**
         * A chunk written after the record, its content can't be verified.
         */
        UNCOVERED_CHUNK,
        MULTIPLE_RECORDS
    }
}
