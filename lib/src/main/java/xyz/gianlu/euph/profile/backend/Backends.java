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

package xyz.gianlu.euph.profile.backend;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry of {@link CompressionBackend}s, in order of preference. The JDK backend is the fallback when nothing
 * else can be loaded.
 *
 * @author devgianlu
 */
public final class Backends {
    private static final List<Class<? extends CompressionBackend>> backends = new ArrayList<>(5);
    private static final Logger LOGGER = LoggerFactory.getLogger(Backends.class);

    static {
        registerBackend(OkioZlibBackend.class);
        registerBackend(JdkZlibBackend.class);
    }

    private Backends() {
    }

    /**
     * @return The first registered backend that can be instantiated and reports itself available
     */
    @NotNull
    public static CompressionBackend probe() {
        List<Class<? extends CompressionBackend>> candidates;
        synchronized (backends) {
            candidates = new ArrayList<>(backends);
        }

        for (Class<? extends CompressionBackend> clazz : candidates) {
            CompressionBackend backend = instantiate(clazz);
            if (backend != null && backend.isAvailable()) {
                LOGGER.debug("Using {} compression backend.", backend.name());
                return backend;
            }
        }

        LOGGER.warn("No registered backend is available, falling back to the JDK one.");
        return new JdkZlibBackend();
    }

    /**
     * @return All the registered backends that are usable, in order of preference
     */
    @NotNull
    public static List<CompressionBackend> available() {
        List<Class<? extends CompressionBackend>> candidates;
        synchronized (backends) {
            candidates = new ArrayList<>(backends);
        }

        List<CompressionBackend> list = new ArrayList<>(candidates.size());
        for (Class<? extends CompressionBackend> clazz : candidates) {
            CompressionBackend backend = instantiate(clazz);
            if (backend != null && backend.isAvailable()) list.add(backend);
        }

        return list;
    }

    @Nullable
    private static CompressionBackend instantiate(@NotNull Class<? extends CompressionBackend> clazz) {
        try {
            return clazz.getConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError ex) {
            LOGGER.debug("Failed initializing backend {}.", clazz.getName(), ex);
            return null;
        }
    }

    public static void registerBackend(int index, @NotNull Class<? extends CompressionBackend> clazz) {
        synchronized (backends) {
            backends.add(index, clazz);
        }
    }

    public static void registerBackend(@NotNull Class<? extends CompressionBackend> clazz) {
        synchronized (backends) {
            backends.add(clazz);
        }
    }

    public static void unregisterBackend(@NotNull Class<? extends CompressionBackend> clazz) {
        synchronized (backends) {
            backends.remove(clazz);
        }
    }
}
