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
import org.jetbrains.annotations.Nullable;

/**
 * Chunk tags understood by this version of the library. Any other tag is carried along untouched.
 *
 * @author devgianlu
 */
public enum ChunkType {
    HEAD(true),
    META(true),
    AUDI(true),
    AIDE(false),
    DSPS(false),
    CHKS(false);

    private final boolean required;

    ChunkType(boolean required) {
        this.required = required;
    }

    @Nullable
    public static ChunkType parse(@NotNull String tag) {
        for (ChunkType type : values())
            if (type.name().equals(tag))
                return type;

        return null;
    }

    @NotNull
    public String tag() {
        return name();
    }

    public boolean isRequired() {
        return required;
    }

    public boolean is(@NotNull String tag) {
        return name().equals(tag);
    }
}
