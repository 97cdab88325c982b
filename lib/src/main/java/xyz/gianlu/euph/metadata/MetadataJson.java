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
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.common.Utils;

import java.nio.charset.StandardCharsets;

/**
 * Reads and writes the META chunk. Only descriptive fields and the small enhancement flags go in there, blobs have
 * their own chunks.
 *
 * @author devgianlu
 */
public final class MetadataJson {

    private MetadataJson() {
    }

    @NotNull
    public static JsonObject toJson(@NotNull Metadata metadata) {
        JsonObject obj = new JsonObject();
        if (metadata.title != null) obj.addProperty("title", metadata.title);
        if (metadata.artist != null) obj.addProperty("artist", metadata.artist);
        if (metadata.album != null) obj.addProperty("album", metadata.album);
        if (metadata.genre != null) obj.addProperty("genre", metadata.genre);
        if (metadata.year != null) obj.addProperty("year", metadata.year);
        if (metadata.trackNumber != null) obj.addProperty("trackNumber", metadata.trackNumber);

        EnhancementData enhancement = metadata.enhancementData;
        if (enhancement != null) {
            obj.addProperty("aiProcessed", enhancement.aiProcessed);
            if (enhancement.genreDetection != null) obj.addProperty("genreDetection", enhancement.genreDetection);
        }

        return obj;
    }

    @NotNull
    public static byte[] write(@NotNull Metadata metadata) {
        return toJson(metadata).toString().getBytes(StandardCharsets.UTF_8);
    }

    @NotNull
    public static JsonObject read(byte[] payload) throws FormatException {
        JsonElement elm = parse(payload, "META");
        if (!elm.isJsonObject())
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, "META isn't a JSON object");

        return elm.getAsJsonObject();
    }

    /**
     * @param tag The chunk the payload comes from, for the error message
     */
    @NotNull
    public static JsonElement parse(byte[] payload, @NotNull String tag) throws FormatException {
        try {
            return JsonParser.parseString(new String(payload, StandardCharsets.UTF_8));
        } catch (JsonParseException ex) {
            throw new FormatException(FormatException.Reason.MALFORMED_PAYLOAD, tag + " isn't valid JSON", ex);
        }
    }

    /**
     * Copies the descriptive fields of {@code meta} into {@code builder}.
     */
    private static void applyTo(@NotNull JsonObject meta, @NotNull Metadata.Builder builder) {
        builder.setTitle(Utils.optString(meta, "title", null))
                .setArtist(Utils.optString(meta, "artist", null))
                .setAlbum(Utils.optString(meta, "album", null))
                .setGenre(Utils.optString(meta, "genre", null))
                .setYear(Utils.optInteger(meta, "year"))
                .setTrackNumber(Utils.optInteger(meta, "trackNumber"));
    }

    /**
     * Builds the full metadata record out of the pieces scattered across HEAD, META, AIDE and DSPS.
     */
    @NotNull
    public static Metadata assemble(@NotNull HeaderInfo header, @Nullable JsonObject meta, byte @Nullable [] spatialData, @Nullable JsonElement dspSettings) {
        Metadata.Builder builder = new Metadata.Builder()
                .setDuration(header.durationSeconds())
                .setSampleRate(header.sampleRate)
                .setChannelCount(header.channelCount)
                .setBitDepth(header.bitDepth)
                .setEncodingProfile(header.profile);

        Boolean aiProcessed = null;
        String genreDetection = null;
        if (meta != null) {
            applyTo(meta, builder);
            aiProcessed = Utils.optBoolean(meta, "aiProcessed");
            genreDetection = Utils.optString(meta, "genreDetection", null);
        }

        if (aiProcessed != null || genreDetection != null || spatialData != null || dspSettings != null)
            builder.setEnhancementData(new EnhancementData(aiProcessed != null && aiProcessed, genreDetection, spatialData, dspSettings));

        return builder.build();
    }
}
