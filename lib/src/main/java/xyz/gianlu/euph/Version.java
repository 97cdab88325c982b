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
 * @author Gianlu
 */
public final class Version {
    /**
     * Container layout version written by this library. Files with a newer major cannot be read.
     */
    public static final int FORMAT_MAJOR = 2;
    public static final int FORMAT_MINOR = 0;

    private Version() {
    }

    @NotNull
    public static String formatVersionString() {
        return FORMAT_MAJOR + "." + FORMAT_MINOR;
    }

    /**
     * Checks whether a container written with the given version can be read.
     *
     * @return A compatibility note if the container is older or only the minor version differs, {@code null} if the versions match exactly
     * @throws UnsupportedVersionException If the major version is newer than {@link #FORMAT_MAJOR}
     */
    @Nullable
    public static String checkCompatibility(int major, int minor) throws UnsupportedVersionException {
        if (major > FORMAT_MAJOR)
            throw new UnsupportedVersionException(major, minor);

        if (major < FORMAT_MAJOR)
            return String.format("Container version %d.%d is older than %s, decoding it as %s", major, minor, formatVersionString(), formatVersionString());

        if (minor != FORMAT_MINOR)
            return String.format("Container version %d.%d differs from %s, unknown additions will be ignored", major, minor, formatVersionString());

        return null;
    }
}
