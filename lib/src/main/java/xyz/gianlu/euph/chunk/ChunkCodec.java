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
import java.util.Arrays;

/**
 * Frames a single chunk as {@code tag[4] + uint32 LE size + payload}. The payload is never touched.
 *
 * @author devgianlu
 */
public final class ChunkCodec {
    public static final int TAG_LENGTH = 4;
    public static final int HEADER_SIZE = TAG_LENGTH + 4;
    /**
     * Largest payload a Java array can hold together with its chunk header.
     */
    public static final long MAX_PAYLOAD_SIZE = Integer.MAX_VALUE - 8 - HEADER_SIZE;

    private ChunkCodec() {
    }

    @NotNull
    public static byte[] writeChunk(@NotNull String type, byte[] payload) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        writeChunk(buffer, type, payload);
        return buffer.array();
    }

    /**
     * Writes the chunk at the current position of {@code out}, which must be little-endian.
     */
    public static void writeChunk(@NotNull ByteBuffer out, @NotNull String type, byte[] payload) {
        if (out.order() != ByteOrder.LITTLE_ENDIAN) throw new IllegalArgumentException("Buffer must be little-endian!");

        out.put(tagBytes(type));
        out.putInt(payload.length);
        out.put(payload);
    }

    @NotNull
    public static byte[] tagBytes(@NotNull String type) {
        if (type.isEmpty() || type.length() > TAG_LENGTH)
            throw new IllegalArgumentException("Chunk tag must be 1 to 4 characters: " + type);

        byte[] tag = new byte[TAG_LENGTH];
        for (int i = 0; i < type.length(); i++) {
            char c = type.charAt(i);
            if (c < 0x20 || c > 0x7E) throw new IllegalArgumentException("Chunk tag must be printable ASCII: " + type);
            tag[i] = (byte) c;
        }

        return tag;
    }

    /**
     * Reads the chunk starting at {@code offset}, the payload is copied out of {@code buffer}.
     *
     * @throws FormatException If the header or the declared payload exceed the buffer
     */
    @NotNull
    public static Chunk readChunk(byte[] buffer, int offset) throws FormatException {
        int size = checkBounds(buffer, offset);
        String type = readTag(buffer, offset);
        byte[] payload = Arrays.copyOfRange(buffer, offset + HEADER_SIZE, offset + HEADER_SIZE + size);
        return new Chunk(type, payload, offset);
    }

    /**
     * Validates that a whole chunk starting at {@code offset} fits in {@code buffer}.
     *
     * @return The payload size
     * @throws FormatException If the chunk is truncated
     */
    public static int checkBounds(byte[] buffer, int offset) throws FormatException {
        if (offset < 0 || offset > buffer.length)
            throw new IllegalArgumentException(String.format("offset: %d, buffer: %d", offset, buffer.length));

        if (buffer.length - offset < HEADER_SIZE)
            throw new FormatException(FormatException.Reason.TRUNCATED_CHUNK, String.format("header at %d, buffer: %d", offset, buffer.length));

        long size = readSize(buffer, offset);
        if ((long) offset + HEADER_SIZE + size > buffer.length)
            throw new FormatException(FormatException.Reason.TRUNCATED_CHUNK, String.format("'%s' at %d declares %d bytes, only %d left",
                    readTag(buffer, offset), offset, size, buffer.length - offset - HEADER_SIZE));

        return (int) size;
    }

    /**
     * @return The tag of the chunk starting at {@code offset}, trailing NULs removed
     */
    @NotNull
    public static String readTag(byte[] buffer, int offset) {
        int end = TAG_LENGTH;
        while (end > 0 && buffer[offset + end - 1] == 0) end--;
        return new String(buffer, offset, end, StandardCharsets.ISO_8859_1);
    }

    /**
     * @return The unsigned payload size of the chunk starting at {@code offset}
     */
    public static long readSize(byte[] buffer, int offset) {
        return ByteBuffer.wrap(buffer, offset + TAG_LENGTH, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xFFFFFFFFL;
    }
}
