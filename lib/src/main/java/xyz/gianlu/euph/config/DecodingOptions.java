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
import xyz.gianlu.euph.profile.backend.CompressionBackend;

/**
 * @author devgianlu
 */
public final class DecodingOptions {
    public static final DecodingOptions DEFAULT = new Builder().build();
    public final boolean validateIntegrity;
    /**
     * Whether the AIDE chunk is returned.
     */
    public final boolean loadAIData;
    /**
     * Whether the DSPS chunk is parsed and returned.
     */
    public final boolean loadDSPSettings;
    public final CompressionBackend backend;

    private DecodingOptions(boolean validateIntegrity, boolean loadAIData, boolean loadDSPSettings, CompressionBackend backend) {
        this.validateIntegrity = validateIntegrity;
        this.loadAIData = loadAIData;
        this.loadDSPSettings = loadDSPSettings;
        this.backend = backend;
    }

    @Override
    public String toString() {
        return "DecodingOptions{validateIntegrity=" + validateIntegrity + ", loadAIData=" + loadAIData
                + ", loadDSPSettings=" + loadDSPSettings + ", backend=" + (backend == null ? null : backend.name()) + '}';
    }

    public final static class Builder {
        private boolean validateIntegrity = true;
        private boolean loadAIData = true;
        private boolean loadDSPSettings = true;
        private CompressionBackend backend = null;

        public Builder() {
        }

        public Builder setValidateIntegrity(boolean validateIntegrity) {
            this.validateIntegrity = validateIntegrity;
            return this;
        }

        public Builder setLoadAIData(boolean loadAIData) {
            this.loadAIData = loadAIData;
            return this;
        }

        public Builder setLoadDSPSettings(boolean loadDSPSettings) {
            this.loadDSPSettings = loadDSPSettings;
            return this;
        }

        public Builder setBackend(@Nullable CompressionBackend backend) {
            this.backend = backend;
            return this;
        }

        @Contract(value = " -> new", pure = true)
        public @NotNull DecodingOptions build() {
            return new DecodingOptions(validateIntegrity, loadAIData, loadDSPSettings, backend);
        }
    }
}
