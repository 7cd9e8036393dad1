package io.spiketrains.table.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.spiketrains.buffer.spi.SpikeTable;
import io.spiketrains.buffer.spi.SpikeTableCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@code application/json} codec for {@link SpikeTable}.
 *
 * <p>Format: {@code [{"timestamp":0.5,"population":"v1","node_id":7}, ...]}. Written and read with the
 * streaming API, so tables are never held twice in memory.
 */
public final class JacksonJsonTableCodec implements SpikeTableCodec {

    public static final String CONTENT_TYPE = "application/json";
    public static final String FILE_EXTENSION = "json";

    private static final String TIMESTAMP = "timestamp";
    private static final String POPULATION = "population";
    private static final String NODE_ID = "node_id";

    private final ObjectMapper mapper;

    public JacksonJsonTableCodec() {
        this(JsonMapper.builder(new JsonFactory())
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                .build());
    }

    public JacksonJsonTableCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
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
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
            gen.writeStartArray();
            for (int i = 0; i < table.size(); i++) {
                gen.writeStartObject();
                gen.writeNumberField(TIMESTAMP, table.timestamp(i));
                gen.writeStringField(POPULATION, table.population(i));
                gen.writeNumberField(NODE_ID, table.nodeId(i));
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
    }

    @Override
    public SpikeTable read(InputStream in, String units) throws IOException {
        SpikeTable.Builder table = SpikeTable.builder(units);
        try (JsonParser parser = mapper.getFactory().createParser(in)) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new IOException("expected a JSON array of spikes");
            }
            while (parser.nextToken() == JsonToken.START_OBJECT) {
                JsonNode spike = mapper.readTree(parser);
                table.add(requireField(spike, TIMESTAMP).asDouble(),
                        requireField(spike, POPULATION).asText(),
                        requireField(spike, NODE_ID).asLong());
            }
            if (parser.currentToken() != JsonToken.END_ARRAY) {
                throw new IOException("expected spike objects inside the JSON array, got " + parser.currentToken());
            }
        }
        return table.build();
    }

    private static JsonNode requireField(JsonNode spike, String name) throws IOException {
        JsonNode value = spike.get(name);
        if (value == null || value.isNull()) {
            throw new IOException("spike object is missing '" + name + "': " + spike);
        }
        return value;
    }
}
