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

import java.io.IOException;

/**
 * A zlib implementation. Every backend must read and write standard zlib streams (RFC 1950) so that containers
 * produced with one backend can be read with any other.
 *
 * @author devgianlu
 */
public interface CompressionBackend {

    @NotNull
    String name();

    /**
     * Whether the libraries this backend relies on can be used in the current runtime.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * @param level The zlib level, 0 to 9. Level 0 emits stored blocks.
     */
    @NotNull
    byte[] deflate(byte[] data, int level) throws IOException;

    /**
     * Inflates a complete zlib stream.
     *
     * @throws IOException If the stream is damaged, truncated or followed by extra bytes
     */
    @NotNull
    byte[] inflate(byte[] data) throws IOException;

    /**
     * Opens an inflater that accepts the compressed stream in slices.
     */
    @NotNull
    default InflateSession openInflater() {
        return new InflateSession();
    }
}
