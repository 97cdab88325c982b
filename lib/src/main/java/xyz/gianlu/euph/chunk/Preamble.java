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
import xyz.gianlu.euph.FormatException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * The fixed 10 bytes every container starts with: magic, version and chunk count.
 *
 * @author devgianlu
 */
public final class Preamble {
    public static final byte[] MAGIC = "EUPH".getBytes(StandardCharsets.US_ASCII);
    public static final int SIZE = 10;
    public final int major;
    public final int minor;
    public final long chunkCount;

    public Preamble(int major, int minor, long chunkCount) {
        this.major = major;
        this.minor = minor;
        this.chunkCount = chunkCount;
    }

    public static boolean hasMagic(byte[] buffer, int offset) {
        if (buffer.length - offset < MAGIC.length) return false;

        for (int i = 0; i < MAGIC.length; i++)
            if (buffer[offset + i] != MAGIC[i])
                return false;

        return true;
    }

    /**
     * Parses the preamble, the version is not checked here.
     *
     * @throws FormatException If fewer than {@link #SIZE} bytes are available or the magic doesn't match
     */
    @NotNull
    public static Preamble read(byte[] buffer, int offset) throws FormatException {
        if (buffer.length - offset < SIZE)
            throw new FormatException(FormatException.Reason.TRUNCATED_HEADER, String.format("%d bytes available", Math.max(0, buffer.length - offset)));

        if (!hasMagic(buffer, offset))
            throw new FormatException(FormatException.Reason.BAD_MAGIC);

        ByteBuffer buf = ByteBuffer.wrap(buffer, offset + MAGIC.length, SIZE - MAGIC.length).order(ByteOrder.LITTLE_ENDIAN);
        int major = buf.get() & 0xFF;
        int minor = buf.get() & 0xFF;
        long chunkCount = buf.getInt() & 0xFFFFFFFFL;
        return new Preamble(major, minor, chunkCount);
    }

    public void write(@NotNull ByteBuffer out) {
        if (out.order() != ByteOrder.LITTLE_ENDIAN) throw new IllegalArgumentException("Buffer must be little-endian!");

        out.put(MAGIC);
        out.put((byte) major);
        out.put((byte) minor);
        out.putInt((int) chunkCount);
    }

    @Override
    public String toString() {
        return "Preamble{version=" + major + "." + minor + ", chunkCount=" + chunkCount + '}';
    }
}
