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

package xyz.gianlu.euph.integrity;

import org.jetbrains.annotations.NotNull;
import xyz.gianlu.euph.chunk.ChunkType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of integrity validation.
 *
 * @author devgianlu
 */
public final class IntegrityReport {
    private static final IntegrityReport UNVERIFIED = new IntegrityReport(false, true, Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    /**
     * Whether a CHKS record was found and checked.
     */
    public final boolean verified;
    /**
     * {@code false} only if a check was done and it failed.
     */
    public final boolean checksumMatch;
    /**
     * Types of the chunks that failed validation, one entry per chunk.
     */
    public final List<String> corruptedChunks;
    public final List<Integer> corruptedIndices;
    public final List<IntegrityWarning> warnings;

    private IntegrityReport(boolean verified, boolean checksumMatch, List<String> corruptedChunks, List<Integer> corruptedIndices, List<IntegrityWarning> warnings) {
        this.verified = verified;
        this.checksumMatch = checksumMatch;
        this.corruptedChunks = corruptedChunks;
        this.corruptedIndices = corruptedIndices;
        this.warnings = warnings;
    }

    /**
     * @return The report for a container without a CHKS chunk or when validation was skipped
     */
    @NotNull
    public static IntegrityReport unverified() {
        return UNVERIFIED;
    }

    public boolean isCorrupted(@NotNull String type) {
        return corruptedChunks.contains(type);
    }

    public boolean isCorrupted(@NotNull ChunkType type) {
        return isCorrupted(type.tag());
    }

    public boolean isCorruptedAt(int index) {
        return corruptedIndices.contains(index);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegrityReport that = (IntegrityReport) o;
        return verified == that.verified && checksumMatch == that.checksumMatch && corruptedChunks.equals(that.corruptedChunks)
                && corruptedIndices.equals(that.corruptedIndices) && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verified, checksumMatch, corruptedChunks, corruptedIndices, warnings);
    }

    @Override
    public String toString() {
        return "IntegrityReport{verified=" + verified + ", checksumMatch=" + checksumMatch + ", corruptedChunks=" + corruptedChunks
                + ", corruptedIndices=" + corruptedIndices + ", warnings=" + warnings + '}';
    }

    static final class Builder {
        private final List<String> corruptedChunks = new ArrayList<>();
        private final List<Integer> corruptedIndices = new ArrayList<>();
        private final List<IntegrityWarning> warnings = new ArrayList<>();
        private boolean checksumMatch = true;

        Builder() {
        }

        Builder mismatch() {
            checksumMatch = false;
            return this;
        }

        Builder corrupted(@NotNull String type, int index) {
            if (!corruptedIndices.contains(index)) {
                corruptedChunks.add(type);
                corruptedIndices.add(index);
            }

            checksumMatch = false;
            return this;
        }

        Builder warn(@NotNull IntegrityWarning warning) {
            warnings.add(warning);
            return this;
        }

        @NotNull
        IntegrityReport build() {
            return new IntegrityReport(true, checksumMatch, Collections.unmodifiableList(new ArrayList<>(corruptedChunks)),
                    Collections.unmodifiableList(new ArrayList<>(corruptedIndices)), Collections.unmodifiableList(new ArrayList<>(warnings)));
        }
    }
}
