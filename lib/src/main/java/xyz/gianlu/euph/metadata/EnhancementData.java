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

package xyz.gianlu.euph.metadata;

import com.google.gson.JsonElement;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * Side-channel data carried along with the audio. The blobs are opaque, they're stored and returned untouched.
 *
 * @author devgianlu
 */
public final class EnhancementData {
    public final boolean aiProcessed;
    public final String genreDetection;
    /**
     * Stored in the AIDE chunk.
     */
    public final byte[] spatialData;
    /**
     * Stored in the DSPS chunk.
     */
    public final JsonElement dspSettings;

    public EnhancementData(boolean aiProcessed, @Nullable String genreDetection, byte @Nullable [] spatialData, @Nullable JsonElement dspSettings) {
        this.aiProcessed = aiProcessed;
        this.genreDetection = genreDetection;
        this.spatialData = spatialData;
        this.dspSettings = dspSettings;
    }

    public boolean hasSpatialData() {
        return spatialData != null;
    }

    public boolean hasDspSettings() {
        return dspSettings != null && !dspSettings.isJsonNull();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnhancementData that = (EnhancementData) o;
        return aiProcessed == that.aiProcessed && Objects.equals(genreDetection, that.genreDetection)
                && Arrays.equals(spatialData, that.spatialData) && Objects.equals(dspSettings, that.dspSettings);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(aiProcessed, genreDetection, dspSettings);
        result = 31 * result + Arrays.hashCode(spatialData);
        return result;
    }

    @Override
    public String toString() {
        return "EnhancementData{aiProcessed=" + aiProcessed + ", genreDetection='" + genreDetection
                + "', spatialData=" + (spatialData == null ? "null" : spatialData.length + " bytes")
                + ", dspSettings=" + dspSettings + '}';
    }
}
