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

import com.electronwill.nightconfig.core.CommentedConfig;
import com.electronwill.nightconfig.core.Config;
import com.electronwill.nightconfig.core.io.ParsingException;
import com.electronwill.nightconfig.toml.TomlParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.euph.profile.CompressionProfile;
import xyz.gianlu.euph.profile.backend.Backends;
import xyz.gianlu.euph.profile.backend.CompressionBackend;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;

/**
 * Encoder and decoder options read from TOML. Whatever the file doesn't specify is taken from the bundled
 * {@code default.toml}, single keys can be overridden with {@code --section.key=value} arguments.
 *
 * @author devgianlu
 */
public final class CodecConfiguration {
    private static final Logger LOGGER = LoggerFactory.getLogger(CodecConfiguration.class);
    private final Config config;

    private CodecConfiguration(@NotNull Config config) {
        this.config = config;
    }

    @NotNull
    public static CodecConfiguration defaults() {
        try (InputStream in = streamDefaultConfig()) {
            return new CodecConfiguration(new TomlParser().parse(in));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed reading default configuration!", ex);
        }
    }

    @NotNull
    public static CodecConfiguration load(@NotNull File file) throws IOException {
        try (InputStream in = new FileInputStream(file)) {
            return parse(in);
        }
    }

    /**
     * @throws IOException If the stream isn't valid TOML
     */
    @NotNull
    public static CodecConfiguration parse(@NotNull InputStream in) throws IOException {
        CommentedConfig config;
        try {
            config = new TomlParser().parse(in);
        } catch (ParsingException ex) {
            throw new IOException("Invalid configuration", ex);
        }

        Config defaults = defaults().config;
        checkUnknownKeys(defaults, config, "");
        checkMissingKeys(defaults, config, "");
        return new CodecConfiguration(config);
    }

    @NotNull
    private static InputStream streamDefaultConfig() {
        InputStream defaultConfig = CodecConfiguration.class.getClassLoader().getResourceAsStream("default.toml");
        if (defaultConfig == null) throw new IllegalStateException("Missing default.toml!");
        return defaultConfig;
    }

    private static void checkMissingKeys(@NotNull Config defaultConfig, @NotNull Config config, @NotNull String prefix) {
        for (Config.Entry entry : defaultConfig.entrySet()) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Config) {
                checkMissingKeys(entry.getValue(), config, key + ".");
            } else if (!config.contains(key)) {
                LOGGER.trace("Using default for missing entry: " + key);
                config.set(key, entry.getValue());
            }
        }
    }

    private static void checkUnknownKeys(@NotNull Config defaultConfig, @NotNull Config config, @NotNull String prefix) {
        for (Config.Entry entry : new ArrayList<>(config.entrySet())) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Config) {
                checkUnknownKeys(defaultConfig, entry.getValue(), key + ".");
            } else if (!defaultConfig.contains(key)) {
                LOGGER.warn("Unknown configuration entry: " + key);
            }
        }
    }

    @NotNull
    private static Object convertFromString(@NotNull String value) {
        if ("true".equals(value) || "false".equals(value)) {
            return Boolean.parseBoolean(value);
        } else {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                return value;
            }
        }
    }

    /**
     * @param overrides Arguments in the form {@code --encoder.compressionLevel=9}, anything else is ignored
     */
    @NotNull
    public CodecConfiguration withOverrides(@Nullable String... overrides) {
        Config copy = Config.inMemory();
        copyInto(config, copy, "");

        if (overrides != null) {
            for (String str : overrides) {
                if (str == null) continue;

                int eq = str.indexOf('=');
                if (str.startsWith("--") && eq > 2) {
                    String key = str.substring(2, eq);
                    if (!config.contains(key)) {
                        LOGGER.warn("Unknown configuration entry: " + key);
                        continue;
                    }

                    copy.set(key, convertFromString(str.substring(eq + 1)));
                } else {
                    LOGGER.warn("Invalid command line argument: " + str);
                }
            }
        }

        return new CodecConfiguration(copy);
    }

    private static void copyInto(@NotNull Config source, @NotNull Config target, @NotNull String prefix) {
        for (Config.Entry entry : source.entrySet()) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Config) copyInto(entry.getValue(), target, key + ".");
            else target.set(key, entry.getValue());
        }
    }

    @Nullable
    private CompressionBackend backend(@NotNull String key) {
        String name = config.get(key);
        if (name == null || name.isEmpty()) return null;

        for (CompressionBackend backend : Backends.available())
            if (backend.name().equalsIgnoreCase(name))
                return backend;

        throw new IllegalArgumentException("Unknown or unavailable backend: " + name);
    }

    @Nullable
    private CompressionProfile profile() {
        String name = config.get("encoder.profile");
        if (name == null || name.isEmpty()) return null;
        else return CompressionProfile.fromName(name);
    }

    private int getInt(@NotNull String key) {
        Object raw = config.get(key);
        if (raw instanceof Number) return ((Number) raw).intValue();
        else if (raw instanceof String) return Integer.parseInt((String) raw);
        else throw new IllegalArgumentException(String.format("%s is not a valid integer: %s", key, raw));
    }

    private boolean getBoolean(@NotNull String key) {
        Object raw = config.get(key);
        if (raw instanceof Boolean) return (Boolean) raw;
        else if (raw instanceof String) return Boolean.parseBoolean((String) raw);
        else throw new IllegalArgumentException(String.format("%s is not a valid boolean: %s", key, raw));
    }

    /**
     * @throws IllegalArgumentException If an option has an invalid value
     */
    @NotNull
    public EncodingOptions encodingOptions() {
        return new EncodingOptions.Builder()
                .setProfile(profile())
                .setCompressionLevel(getInt("encoder.compressionLevel"))
                .setChunkSize(getInt("encoder.chunkSize"))
                .setIncludeAIData(getBoolean("encoder.includeAIData"))
                .setIncludeDSPSettings(getBoolean("encoder.includeDSPSettings"))
                .setEnableIntegrityCheck(getBoolean("encoder.enableIntegrityCheck"))
                .setBackend(backend("encoder.backend"))
                .build();
    }

    /**
     * @throws IllegalArgumentException If an option has an invalid value
     */
    @NotNull
    public DecodingOptions decodingOptions() {
        return new DecodingOptions.Builder()
                .setValidateIntegrity(getBoolean("decoder.validateIntegrity"))
                .setLoadAIData(getBoolean("decoder.loadAIData"))
                .setLoadDSPSettings(getBoolean("decoder.loadDSPSettings"))
                .setBackend(backend("decoder.backend"))
                .build();
    }
}
