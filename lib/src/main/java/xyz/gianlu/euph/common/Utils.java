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

package xyz.gianlu.euph.common;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.zip.CRC32;

/**
 * @author Gianlu
 */
public final class Utils {
    private Utils() {
    }

    @NotNull
    public static String crcToHex(long crc) {
        return String.format("%08X", crc & 0xFFFFFFFFL);
    }

    public static long crc32(byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data, 0, data.length);
        return crc.getValue();
    }

    /**
     * @return The CRC32 of all the given buffers as if they were concatenated
     */
    public static long crc32(@NotNull List<byte[]> data) {
        CRC32 crc = new CRC32();
        for (byte[] b : data) crc.update(b, 0, b.length);
        return crc.getValue();
    }

    @NotNull
    public static byte[] concat(@NotNull List<byte[]> parts) {
        int size = 0;
        for (byte[] part : parts) size += part.length;

        byte[] result = new byte[size];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }

        return result;
    }

    @Contract("_, _, !null -> !null")
    public static String optString(@NotNull JsonObject obj, @NotNull String key, @Nullable String fallback) {
        JsonPrimitive prim = optPrimitive(obj, key);
        if (prim == null || !prim.isString()) return fallback;
        return prim.getAsString();
    }

    @Nullable
    public static Integer optInteger(@NotNull JsonObject obj, @NotNull String key) {
        JsonPrimitive prim = optPrimitive(obj, key);
        if (prim == null || !prim.isNumber()) return null;
        return prim.getAsInt();
    }

    @Nullable
    public static Boolean optBoolean(@NotNull JsonObject obj, @NotNull String key) {
        JsonPrimitive prim = optPrimitive(obj, key);
        if (prim == null || !prim.isBoolean()) return null;
        return prim.getAsBoolean();
    }

    @Nullable
    private static JsonPrimitive optPrimitive(@NotNull JsonObject obj, @NotNull String key) {
        JsonElement elm = obj.get(key);
        if (elm == null || !elm.isJsonPrimitive()) return null;
        return elm.getAsJsonPrimitive();
    }
}
