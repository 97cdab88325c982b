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

/**
 * @author devgianlu
 */
public class UnsupportedVersionException extends EuphException {
    private final int fileMajor;
    private final int fileMinor;

    public UnsupportedVersionException(int fileMajor, int fileMinor) {
        super(String.format("Unsupported container version %d.%d, this decoder reads up to %d.x", fileMajor, fileMinor, Version.FORMAT_MAJOR));
        this.fileMajor = fileMajor;
        this.fileMinor = fileMinor;
    }

    public int fileMajor() {
        return fileMajor;
    }

    public int fileMinor() {
        return fileMinor;
    }
}
