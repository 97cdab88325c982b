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

package xyz.gianlu.euph.config;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.profile.CompressionProfile;
import xyz.gianlu.euph.profile.backend.CompressionBackend;

/**
 * @author devgianlu
 */
public final class EncodingOptions {
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;
    public static final EncodingOptions DEFAULT = new Builder().build();

    /**
     * If {@code null} the profile of the metadata is used.
     */
    public final CompressionProfile profile;
    public final int compressionLevel;
    /**
     * Maximum size of an AUDI chunk payload.
     */
    public final int chunkSize;
    public final boolean includeAIData;
    public final boolean includeDSPSettings;
    public final boolean enableIntegrityCheck;
    /**
     * If {@code null} the backend is picked with {@link xyz.gianlu.euph.profile.backend.Backends#probe()}.
     */
    public final CompressionBackend backend;

    private EncodingOptions(CompressionProfile profile, int compressionLevel, int chunkSize, boolean includeAIData,
                            boolean includeDSPSettings, boolean enableIntegrityCheck, CompressionBackend backend) {
        this.profile = profile;
        this.compressionLevel = compressionLevel;
        this.chunkSize = chunkSize;
        this.includeAIData = includeAIData;
        this.includeDSPSettings = includeDSPSettings;
        this.enableIntegrityCheck = enableIntegrityCheck;
        this.backend = backend;
    }

    @Override
    public String toString() {
        return "EncodingOptions{profile=" + profile + ", compressionLevel=" + compressionLevel + ", chunkSize=" + chunkSize
                + ", includeAIData=" + includeAIData + ", includeDSPSettings=" + includeDSPSettings
                + ", enableIntegrityCheck=" + enableIntegrityCheck + ", backend=" + (backend == null ? null : backend.name()) + '}';
    }

    public final static class Builder {
        private CompressionProfile profile = null;
        private int compressionLevel = 6;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private boolean includeAIData = true;
        private boolean includeDSPSettings = true;
        private boolean enableIntegrityCheck = true;
        private CompressionBackend backend = null;

        public Builder() {
        }

        public Builder setProfile(@Nullable CompressionProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder setCompressionLevel(int compressionLevel) {
            CompressionProfile.checkLevel(compressionLevel);
            this.compressionLevel = compressionLevel;
            return this;
        }

        public Builder setChunkSize(int chunkSize) {
            if (chunkSize <= 0) throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder setIncludeAIData(boolean includeAIData) {
            this.includeAIData = includeAIData;
            return this;
        }

        public Builder setIncludeDSPSettings(boolean includeDSPSettings) {
            this.includeDSPSettings = includeDSPSettings;
            return this;
        }

        public Builder setEnableIntegrityCheck(boolean enableIntegrityCheck) {
            this.enableIntegrityCheck = enableIntegrityCheck;
            return this;
        }

        public Builder setBackend(@Nullable CompressionBackend backend) {
            this.backend = backend;
            return this;
        }

        @Contract(value = " -> new", pure = true)
        public @NotNull EncodingOptions build() {
            return new EncodingOptions(profile, compressionLevel, chunkSize, includeAIData, includeDSPSettings, enableIntegrityCheck, backend);
        }
    }
}
