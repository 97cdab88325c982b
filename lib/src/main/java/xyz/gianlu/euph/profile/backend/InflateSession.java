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
import java.io.Closeable;
import java.io.IOException;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Incremental zlib inflation for data arriving in pieces.
 *
 * @author devgianlu
 */
public class InflateSession implements Closeable {
    private final Inflater inflater = new Inflater();
    private final byte[] buffer = new byte[8192];
    private boolean closed = false;

    /**
     * @return Whatever could be inflated with the data received so far, possibly empty
     * @throws IOException If the data is not a valid zlib stream or arrives after the end of the stream
     */
    @NotNull
    public byte[] feed(byte[] data, int off, int len) throws IOException {
        if (closed) throw new IOException("Inflater is closed!");
        if (len == 0) return new byte[0];
        if (inflater.finished())
            throw new IOException(String.format("%d bytes after the end of the zlib stream", len));

        inflater.setInput(data, off, len);
        ByteArrayOutputStream out = new ByteArrayOutputStream(len * 2);
        try {
            // Output can still be pending once all the input has been consumed
            while (true) {
                int count = inflater.inflate(buffer);
                if (count > 0) {
                    out.write(buffer, 0, count);
                } else if (inflater.finished()) {
                    if (inflater.getRemaining() > 0)
                        throw new IOException(String.format("%d bytes after the end of the zlib stream", inflater.getRemaining()));

                    break;
                } else if (inflater.needsDictionary()) {
                    throw new IOException("Preset dictionaries aren't supported!");
                } else if (inflater.needsInput()) {
                    break;
                }
            }
        } catch (DataFormatException ex) {
            throw new IOException("Invalid zlib stream at byte " + inflater.getBytesRead(), ex);
        }

        return out.toByteArray();
    }

    public boolean finished() {
        return inflater.finished();
    }

    /**
     * @throws IOException If the zlib stream didn't reach its end
     */
    public void finish() throws IOException {
        if (!inflater.finished())
            throw new IOException("Truncated zlib stream, read " + inflater.getBytesRead() + " bytes");
    }

    @Override
    public void close() {
        if (closed) return;

        closed = true;
        inflater.end();
    }
}
