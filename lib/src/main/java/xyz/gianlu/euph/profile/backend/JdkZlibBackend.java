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

package xyz.gianlu.euph.profile.backend;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * @author devgianlu
 */
public final class JdkZlibBackend implements CompressionBackend {

    @Override
    public @NotNull String name() {
        return "jdk";
    }

    @Override
    public byte @NotNull [] deflate(byte[] data, int level) {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(data);
            deflater.finish();

            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 64);
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                out.write(buffer, 0, count);
            }

            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    public byte @NotNull [] inflate(byte[] data) throws IOException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);

            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 3);
            byte[] buffer = new byte[8192];
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count > 0) {
                    out.write(buffer, 0, count);
                } else if (inflater.needsDictionary()) {
                    throw new IOException("Preset dictionaries aren't supported!");
                } else if (inflater.needsInput()) {
                    throw new IOException("Truncated zlib stream, read " + inflater.getBytesRead() + " bytes");
                }
            }

            if (inflater.getRemaining() > 0)
                throw new IOException(String.format("%d bytes after the end of the zlib stream", inflater.getRemaining()));

            return out.toByteArray();
        } catch (DataFormatException ex) {
            throw new IOException("Invalid zlib stream at byte " + inflater.getBytesRead(), ex);
        } finally {
            inflater.end();
        }
    }

    @Override
    public String toString() {
        return "JdkZlibBackend";
    }
}
