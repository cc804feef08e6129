package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.marc.MarcCodec;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.model.LibrarySystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.catalog.reconciliation.batch.BatchFixtures.bplRecord;
import static org.junit.jupiter.api.Assertions.*;

class BatchSerializerTest {

    /**
     * Writes each record's first item barcode followed by a record terminator.
     */
    private static final class BarcodeCodec implements MarcCodec {
        @Override
        public List<MarcRecord> read(InputStream input, LibrarySystem library) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void write(MarcRecord record, OutputStream output) throws IOException {
            String barcode = record.getFields("960").get(0).getFirst("i");
            output.write((barcode + "\u001d").getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("Should serialize only non-empty output groups")
    void serializesGroups() throws IOException {
        DedupeResult result = new DedupeResult(
                List.of(bplRecord("on1", "a1")),
                List.of(bplRecord("on2", "n1"), bplRecord("on2", "n2")),
                List.of(bplRecord("on2", "n1")));

        Map<OutputBatch, byte[]> out = new BatchSerializer(new BarcodeCodec()).serialize(result);

        assertEquals("a1\u001d", new String(out.get(OutputBatch.DUP), StandardCharsets.UTF_8));
        assertEquals("n1\u001dn2\u001d", new String(out.get(OutputBatch.NEW), StandardCharsets.UTF_8));
        assertEquals("n1\u001d", new String(out.get(OutputBatch.DEDUPED), StandardCharsets.UTF_8));

        Map<OutputBatch, byte[]> attachOnly = new BatchSerializer(new BarcodeCodec())
                .serialize(new DedupeResult(List.of(bplRecord("on1", "a1")), List.of(), List.of()));
        assertEquals(List.of(OutputBatch.DUP), List.copyOf(attachOnly.keySet()));
    }
}
