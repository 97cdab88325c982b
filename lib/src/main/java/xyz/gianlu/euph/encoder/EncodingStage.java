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

package xyz.gianlu.euph.encoder;

import org.jetbrains.annotations.NotNull;

/**
 * @author devgianlu
 */
public enum EncodingStage {
    HEADER("header"),
    METADATA("metadata"),
    AUDIO_COMPRESS("audio-compress"),
    AI_DATA("ai-data"),
    DSP_DATA("dsp-data"),
    CHECKSUM("checksum"),
    FINALIZE("finalize");

    private final String stageName;

    EncodingStage(@NotNull String stageName) {
        this.stageName = stageName;
    }

    @NotNull
    public String stageName() {
        return stageName;
    }

    @Override
    public String toString() {
        return stageName;
    }
}
