package com.catalog.reconciliation.core.marc;

import com.catalog.reconciliation.core.model.LibrarySystem;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * Port to the binary MARC reader/writer. Implementations live outside this library.
 */
public interface MarcCodec {

    /**
     * Reads every record in a binary MARC stream.
     *
     * @param library hint for library-specific local fields
     */
    List<MarcRecord> read(InputStream input, LibrarySystem library) throws IOException;

    /**
     * Writes one record in binary MARC form.
     */
    void write(MarcRecord record, OutputStream output) throws IOException;
}
