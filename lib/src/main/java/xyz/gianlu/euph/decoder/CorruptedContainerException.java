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
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.integrity.IntegrityReport;

/**
 * Thrown when the audio can't be reconstructed and integrity validation already flagged the container as damaged.
 *
 * @author devgianlu
 */
public class CorruptedContainerException extends FormatException {
    private final IntegrityReport integrity;

    public CorruptedContainerException(@NotNull IntegrityReport integrity, @NotNull FormatException cause) {
        super(Reason.CORRUPTED_CONTAINER, String.format("%s (corrupted chunks: %s)", cause.getMessage(), integrity.corruptedChunks), cause);
        this.integrity = integrity;
    }

    @NotNull
    public IntegrityReport integrity() {
        return integrity;
    }
}
