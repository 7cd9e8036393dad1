package io.spiketrains.buffer.spi;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Serializes a {@link SpikeTable} to and from one external format.
 *
 * <p>Implementations are stateless and registered by content type and file extension.
 */
public interface SpikeTableCodec {

    /**
     * Content type handled by this codec, e.g. {@code text/csv}.
     */
    String contentType();

    /**
     * File extension without the dot, e.g. {@code csv}, used to pick this codec for an export file.
     */
    String fileExtension();

    /**
     * Writes every row of {@code table}. Does not close {@code out}.
     */
    void write(SpikeTable table, OutputStream out) throws IOException;

    /**
     * Reads a table previously written by {@link #write}. Does not close {@code in}.
     *
     * @param units units label for the returned table
     */
    SpikeTable read(InputStream in, String units) throws IOException;
}
