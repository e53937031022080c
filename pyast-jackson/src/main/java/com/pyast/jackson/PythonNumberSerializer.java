package com.pyast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes number literal values the way Python spells them.
 * Floats keep their decimal point even when integral, and the non-finite values, which JSON
 * cannot express, are written as the strings {@code inf}, {@code -inf} and {@code nan}.
 */
public class PythonNumberSerializer extends JsonSerializer<Object> {
    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isNaN()) {
                gen.writeString("nan");
            } else if (d.isInfinite()) {
                gen.writeString(d > 0 ? "inf" : "-inf");
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof Number n) {
            gen.writeNumber(n.doubleValue());
        } else if (value instanceof String text) {
            gen.writeString(text);
        } else {
            gen.writeObject(value);
        }
    }
}
