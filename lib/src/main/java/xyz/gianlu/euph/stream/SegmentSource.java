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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Iterator;

/**
 * A sequence of byte segments of arbitrary size. Segment boundaries mean nothing.
 *
 * @author devgianlu
 */
public interface SegmentSource extends Closeable {

    @NotNull
    static SegmentSource fromStream(@NotNull InputStream in, int segmentSize) {
        if (segmentSize <= 0) throw new IllegalArgumentException("Invalid segment size: " + segmentSize);

        return new SegmentSource() {
            private final byte[] buffer = new byte[segmentSize];

            @Override
            public byte @Nullable [] nextSegment() throws IOException {
                int read = in.read(buffer);
                if (read == -1) return null;
                else return Arrays.copyOf(buffer, read);
            }

            @Override
            public void close() throws IOException {
                in.close();
            }
        };
    }

    @NotNull
    static SegmentSource fromIterator(@NotNull Iterator<byte[]> iterator) {
        return () -> iterator.hasNext() ? iterator.next() : null;
    }

    /**
     * Splits {@code data} in segments of {@code segmentSize} bytes, the last one can be shorter.
     */
    @NotNull
    static SegmentSource of(byte[] data, int segmentSize) {
        if (segmentSize <= 0) throw new IllegalArgumentException("Invalid segment size: " + segmentSize);

        return new SegmentSource() {
            private int offset = 0;

            @Override
            public byte @Nullable [] nextSegment() {
                if (offset >= data.length) return null;

                int end = Math.min(data.length, offset + segmentSize);
                byte[] segment = Arrays.copyOfRange(data, offset, end);
                offset = end;
                return segment;
            }
        };
    }

    /**
     * @return The next segment, possibly empty, or {@code null} if there are no more
     */
    byte @Nullable [] nextSegment() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
