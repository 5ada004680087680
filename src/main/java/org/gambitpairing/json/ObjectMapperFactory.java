package org.gambitpairing.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Builds the mappers used for player snapshots, pairing results and comparison reports.
 *
 * <p>Map entries are written in key order, so two runs over the same seeds produce the
 * same report bytes. A JSON {@code null} for a primitive field (a game's white score,
 * a rating) is rejected rather than read as zero.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {}

    public static ObjectMapper create() {
        return configure(new ObjectMapper());
    }

    /** Indented variant for report files. */
    public static ObjectMapper createPretty() {
        return configure(new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModules(new GuavaModule(), new Jdk8Module())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
