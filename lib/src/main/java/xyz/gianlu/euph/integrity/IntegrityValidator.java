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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.euph.FormatException;
import xyz.gianlu.euph.chunk.Chunk;
import xyz.gianlu.euph.chunk.ChunkType;
import xyz.gianlu.euph.common.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks chunks against the CHKS record. The record covers every non-CHKS chunk written before it.
 * Problems never throw, they end up in the {@link IntegrityReport}.
 *
 * @author devgianlu
 */
public final class IntegrityValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(IntegrityValidator.class);

    private IntegrityValidator() {
    }

    @NotNull
    public static IntegrityReport validate(@NotNull List<Chunk> chunks) {
        int recordIndex = -1;
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).is(ChunkType.CHKS)) {
                recordIndex = i;
                break;
            }
        }

        if (recordIndex == -1) {
            LOGGER.debug("No checksum record, integrity not verified.");
            return IntegrityReport.unverified();
        }

        List<byte[]> payloads = new ArrayList<>(recordIndex);
        List<ChunkDigest> covered = new ArrayList<>(recordIndex);
        for (int i = 0; i < recordIndex; i++) {
            Chunk chunk = chunks.get(i);
            payloads.add(chunk.payload);
            covered.add(ChunkDigest.of(chunk, i));
        }

        IntegrityReport.Builder builder = checkInternal(covered, Utils.crc32(payloads), chunks.get(recordIndex).payload, recordIndex);
        for (int i = recordIndex + 1; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            if (chunk.is(ChunkType.CHKS))
                builder.warn(new IntegrityWarning(IntegrityWarning.Kind.MULTIPLE_RECORDS, chunk.type, i, "Only the first checksum record is used"));
            else
                builder.warn(new IntegrityWarning(IntegrityWarning.Kind.UNCOVERED_CHUNK, chunk.type, i, "Chunk comes after the checksum record"));
        }

        return report(builder);
    }

    /**
     * Validates a record against chunks seen so far, for callers that don't keep the payloads around.
     *
     * @param covered     The non-CHKS chunks that came before the record, in order
     * @param aggregate   The CRC32 of their payloads concatenated
     * @param record      The CHKS payload
     * @param recordIndex Position of the CHKS chunk in the container
     */
    @NotNull
    public static IntegrityReport check(@NotNull List<ChunkDigest> covered, long aggregate, byte[] record, int recordIndex) {
        return report(checkInternal(covered, aggregate, record, recordIndex));
    }

    @NotNull
    private static IntegrityReport report(@NotNull IntegrityReport.Builder builder) {
        IntegrityReport report = builder.build();
        if (report.checksumMatch)
            LOGGER.debug("Integrity verified.");
        else
            LOGGER.warn("Integrity check failed, corrupted chunks: {}", report.corruptedChunks);

        for (IntegrityWarning warning : report.warnings)
            LOGGER.trace("Integrity warning: {}", warning);

        return report;
    }

    @NotNull
    private static IntegrityReport.Builder checkInternal(@NotNull List<ChunkDigest> covered, long aggregate, byte[] payload, int recordIndex) {
        IntegrityReport.Builder builder = new IntegrityReport.Builder();

        ChecksumRecord record;
        try {
            record = ChecksumRecord.parse(payload);
        } catch (FormatException ex) {
            return builder.corrupted(ChunkType.CHKS.tag(), recordIndex)
                    .warn(new IntegrityWarning(IntegrityWarning.Kind.DAMAGED_RECORD, ChunkType.CHKS.tag(), recordIndex, ex.getMessage()));
        }

        boolean countMatches = record.covered == covered.size();
        if (countMatches && record.aggregate == aggregate)
            return builder;

        builder.mismatch().warn(IntegrityWarning.general(IntegrityWarning.Kind.CHECKSUM_MISMATCH,
                String.format("Recorded %s, computed %s", Utils.crcToHex(record.aggregate), Utils.crcToHex(aggregate))));

        if (!countMatches)
            builder.warn(IntegrityWarning.general(IntegrityWarning.Kind.CHUNK_COUNT_MISMATCH,
                    String.format("Record covers %d chunks, found %d", record.covered, covered.size())));

        if (record.isLegacy()) {
            builder.warn(IntegrityWarning.general(IntegrityWarning.Kind.NO_CHUNK_TABLE, "Every covered chunk is suspect"));
            for (ChunkDigest chunk : covered)
                builder.corrupted(chunk.type, chunk.index);

            return builder;
        }

        boolean found = false;
        for (int i = 0; i < covered.size(); i++) {
            ChunkDigest chunk = covered.get(i);
            if (i >= record.chunkCrcs.length) {
                builder.corrupted(chunk.type, chunk.index)
                        .warn(IntegrityWarning.forChunk(IntegrityWarning.Kind.CHUNK_MISMATCH, chunk, "Chunk isn't in the record"));
                found = true;
            } else if (record.chunkCrcs[i] != chunk.crc32) {
                builder.corrupted(chunk.type, chunk.index)
                        .warn(IntegrityWarning.forChunk(IntegrityWarning.Kind.CHUNK_MISMATCH, chunk,
                                String.format("Recorded %s, computed %s", Utils.crcToHex(record.chunkCrcs[i]), Utils.crcToHex(chunk.crc32))));
                found = true;
            }
        }

        // Every chunk matches its own checksum, so the record is the one that's wrong
        if (!found) builder.corrupted(ChunkType.CHKS.tag(), recordIndex);

        return builder;
    }
}
