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

import okio.Buffer;
import okio.DeflaterSink;
import okio.InflaterSource;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Streams through okio {@link Buffer}s instead of intermediate arrays. Preferred when okio is on the class path.
 *
 * @author devgianlu
 */
public final class OkioZlibBackend implements CompressionBackend {

    @Override
    public @NotNull String name() {
        return "okio";
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("okio.InflaterSource");
            Class.forName("okio.DeflaterSink");
            return true;
        } catch (ClassNotFoundException | LinkageError ex) {
            return false;
        }
    }

    @Override
    public byte @NotNull [] deflate(byte[] data, int level) throws IOException {
        Buffer sink = new Buffer();
        try (DeflaterSink deflater = new DeflaterSink(sink, new Deflater(level))) {
            Buffer source = new Buffer().write(data);
            deflater.write(source, source.size());
        }

        return sink.readByteArray();
    }

    @Override
    public byte @NotNull [] inflate(byte[] data) throws IOException {
        Buffer source = new Buffer().write(data);
        Buffer out = new Buffer();
        try (InflaterSource inflater = new InflaterSource(source, new Inflater())) {
            while (inflater.read(out, 8192) != -1) ;
        }

        if (source.size() > 0)
            throw new IOException(String.format("%d bytes after the end of the zlib stream", source.size()));

        return out.readByteArray();
    }

    @Override
    public String toString() {
        return "OkioZlibBackend";
    }
}
