package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.marc.MarcCodec;
import com.catalog.reconciliation.core.model.BibRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the record groups of a {@link DedupeResult} through a {@link MarcCodec}.
 */
public class BatchSerializer {
    private static final Logger log = LoggerFactory.getLogger(BatchSerializer.class);

    private final MarcCodec codec;

    public BatchSerializer(MarcCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec is required");
    }

    /**
     * Serializes every non-empty group; empty groups are left out of the map.
     */
    public Map<OutputBatch, byte[]> serialize(DedupeResult result) throws IOException {
        Map<OutputBatch, byte[]> out = new EnumMap<>(OutputBatch.class);
        putIfNotEmpty(out, OutputBatch.DUP, result.attach());
        putIfNotEmpty(out, OutputBatch.NEW, result.newRecords());
        putIfNotEmpty(out, OutputBatch.DEDUPED, result.deduped());
        return out;
    }

    public void write(List<BibRecord> records, OutputStream out) throws IOException {
        for (BibRecord record : records) {
            codec.write(record.getMarcRecord(), out);
        }
        out.flush();
    }

    private void putIfNotEmpty(Map<OutputBatch, byte[]> out, OutputBatch batch, List<BibRecord> records)
            throws IOException {
        if (records.isEmpty()) {
            return;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        write(records, buffer);
        out.put(batch, buffer.toByteArray());
        log.debug("batch.serialized output={} records={} bytes={}", batch, records.size(), buffer.size());
    }
}
