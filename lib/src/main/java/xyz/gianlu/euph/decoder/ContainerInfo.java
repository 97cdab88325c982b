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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.chunk.ChunkType;
import xyz.gianlu.euph.metadata.HeaderInfo;
import xyz.gianlu.euph.metadata.Metadata;

import java.util.List;

/**
 * The structure of a container, read without decoding the audio.
 *
 * @author devgianlu
 */
public final class ContainerInfo {
    public final int major;
    public final int minor;
    public final long chunkCount;
    public final int totalSize;
    public final List<Entry> entries;
    /**
     * {@code null} if the HEAD chunk is missing or unreadable.
     */
    public final HeaderInfo header;
    /**
     * {@code null} if HEAD or META are missing or unreadable.
     */
    public final Metadata metadata;

    ContainerInfo(int major, int minor, long chunkCount, int totalSize, @NotNull List<Entry> entries, @Nullable HeaderInfo header, @Nullable Metadata metadata) {
        this.major = major;
        this.minor = minor;
        this.chunkCount = chunkCount;
        this.totalSize = totalSize;
        this.entries = entries;
        this.header = header;
        this.metadata = metadata;
    }

    public boolean has(@NotNull ChunkType type) {
        for (Entry entry : entries)
            if (type.is(entry.type))
                return true;

        return false;
    }

    public boolean hasRequiredChunks() {
        for (ChunkType type : ChunkType.values())
            if (type.isRequired() && !has(type))
                return false;

        return true;
    }

    /**
     * @return The total size of the AUDI payloads
     */
    public long audioSize() {
        long size = 0;
        for (Entry entry : entries)
            if (ChunkType.AUDI.is(entry.type))
                size += entry.size;

        return size;
    }

    @Override
    public String toString() {
        return "ContainerInfo{version=" + major + "." + minor + ", chunkCount=" + chunkCount + ", totalSize=" + totalSize
                + ", entries=" + entries + ", header=" + header + '}';
    }

    public static final class Entry {
        public final String type;
        public final int size;
        public final int offset;

        Entry(@NotNull String type, int size, int offset) {
            this.type = type;
            this.size = size;
            this.offset = offset;
        }

        @Override
        public String toString() {
            return type + "(" + size + " bytes at " + offset + ")";
        }
    }
}
