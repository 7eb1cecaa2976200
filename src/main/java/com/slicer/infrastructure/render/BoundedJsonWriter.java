package com.slicer.infrastructure.render;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.slicer.engine.MapRepresentable;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Depth-first JSON encoder that bounds every sequence it writes.
 *
 * Iterables, iterators, streams and arrays are written as JSON arrays of at
 * most {@code recordLimit} elements; the source is never asked for more. Maps
 * and {@link MapRepresentable} values become objects. Anything else is handed
 * to the generator's codec.
 */
public class BoundedJsonWriter {

    private static final String INDENT = "    ";

    private final JsonGenerator generator;
    private final int recordLimit;

    public BoundedJsonWriter(JsonGenerator generator, int recordLimit, boolean prettyPrint) {
        this.generator = generator;
        this.recordLimit = recordLimit;
        if (prettyPrint) {
            DefaultIndenter indenter = new DefaultIndenter(INDENT, "\n");
            DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withObjectIndenter(indenter);
            printer.indentArraysWith(indenter);
            generator.setPrettyPrinter(printer);
        }
    }

    public void write(Object value) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof MapRepresentable) {
            writeMap(((MapRepresentable) value).toMap());
        } else if (value instanceof Map) {
            writeMap((Map<?, ?>) value);
        } else if (value instanceof Iterable) {
            writeSequence(((Iterable<?>) value).iterator());
        } else if (value instanceof Iterator) {
            writeSequence((Iterator<?>) value);
        } else if (value instanceof Stream) {
            try (Stream<?> stream = (Stream<?>) value) {
                writeSequence(stream.iterator());
            }
        } else if (value.getClass().isArray() && !(value instanceof byte[])) {
            writeArray(value);
        } else {
            generator.writeObject(value);
        }
    }

    public void flush() throws IOException {
        generator.flush();
    }

    private void writeMap(Map<?, ?> map) throws IOException {
        generator.writeStartObject();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            generator.writeFieldName(String.valueOf(entry.getKey()));
            write(entry.getValue());
        }
        generator.writeEndObject();
    }

    private void writeSequence(Iterator<?> iterator) throws IOException {
        generator.writeStartArray();
        int written = 0;
        while (written < recordLimit && iterator.hasNext()) {
            write(iterator.next());
            written++;
        }
        generator.writeEndArray();
    }

    private void writeArray(Object array) throws IOException {
        int length = Math.min(Array.getLength(array), recordLimit);
        generator.writeStartArray();
        for (int i = 0; i < length; i++) {
            write(Array.get(array, i));
        }
        generator.writeEndArray();
    }
}
