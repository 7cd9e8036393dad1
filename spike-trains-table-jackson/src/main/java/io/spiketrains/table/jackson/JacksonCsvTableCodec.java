package io.spiketrains.table.jackson;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.spiketrains.buffer.spi.SpikeTable;
import io.spiketrains.buffer.spi.SpikeTableCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@code text/csv} codec for {@link SpikeTable}.
 *
 * <p>Format: space separated, header row {@code timestamps population node_ids}, one spike per row.
 */
public final class JacksonCsvTableCodec implements SpikeTableCodec {

    public static final String CONTENT_TYPE = "text/csv";
    public static final String FILE_EXTENSION = "csv";
    public static final char SEPARATOR = ' ';

    private final CsvMapper mapper;
    private final CsvSchema schema;

    public JacksonCsvTableCodec() {
        this(CsvMapper.builder()
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                .build());
    }

    /**
     * @param mapper mapper to use; it should not auto-close streams
     */
    public JacksonCsvTableCodec(CsvMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.schema = mapper.schemaFor(CsvSpikeRow.class)
                .withColumnSeparator(SEPARATOR)
                .withHeader();
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public String fileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public void write(SpikeTable table, OutputStream out) throws IOException {
        Objects.requireNonNull(table, "table");
        try (SequenceWriter writer = mapper.writer(schema).writeValues(out)) {
            for (int i = 0; i < table.size(); i++) {
                writer.write(new CsvSpikeRow(table.timestamp(i), table.population(i), table.nodeId(i)));
            }
        }
    }

    @Override
    public SpikeTable read(InputStream in, String units) throws IOException {
        SpikeTable.Builder table = SpikeTable.builder(units);
        try (MappingIterator<CsvSpikeRow> rows = mapper.readerFor(CsvSpikeRow.class).with(schema).readValues(in)) {
            while (rows.hasNextValue()) {
                CsvSpikeRow row = rows.nextValue();
                table.add(row.timestamp, row.population, row.nodeId);
            }
        }
        return table.build();
    }
}
