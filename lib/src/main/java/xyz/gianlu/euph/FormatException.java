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

package xyz.gianlu.euph;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The input is not a structurally valid EUPH container. Decoding stops as soon as one of these is raised.
 *
 * @author devgianlu
 */
public class FormatException extends EuphException {
    private final Reason reason;

    public FormatException(@NotNull Reason reason) {
        super(reason.text);
        this.reason = reason;
    }

    public FormatException(@NotNull Reason reason, @NotNull String detail) {
        super(reason.text + ": " + detail);
        this.reason = reason;
    }

    public FormatException(@NotNull Reason reason, @NotNull String detail, @Nullable Throwable cause) {
        super(reason.text + ": " + detail, cause);
        this.reason = reason;
    }

    @NotNull
    public Reason reason() {
        return reason;
    }

    public enum Reason {
        BAD_MAGIC("bad magic"),
        TRUNCATED_HEADER("truncated header"),
        TRUNCATED_CHUNK("truncated chunk"),
        MISSING_REQUIRED_CHUNK("missing required chunk"),
        MALFORMED_PAYLOAD("malformed payload"),
        AUDIO_LENGTH_MISMATCH("audio length mismatch"),
        CORRUPTED_CONTAINER("corrupted container");

        private final String text;

        Reason(@NotNull String text) {
            this.text = text;
        }

        @NotNull
        public String text() {
            return text;
        }
    }
}
