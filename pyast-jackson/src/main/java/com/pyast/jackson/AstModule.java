package com.pyast.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonAppend;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.introspect.AnnotatedClass;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.VirtualBeanPropertyWriter;
import com.fasterxml.jackson.databind.util.Annotations;
import com.pyast.ast.BlockRef;
import com.pyast.ast.InternedString;
import com.pyast.ast.Node;
import com.pyast.ast.Num;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Jackson module that configures serialization for the syntax tree records.
 *
 * This module handles:
 * - A leading "type" property holding the node kind
 * - A "loc" object in place of lineno/colOffset
 * - Interned identifiers and block references as scalars
 * - A single "n" value for number literals
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.pyast", "pyast-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins are registered per record; annotations on the sealed interfaces are not
        // reliably inherited by every implementation.
        for (Class<?> nodeClass : nodeRecords()) {
            context.setMixInAnnotations(nodeClass, nodeClass == Num.class ? NumMixin.class : NodeMixin.class);
        }
        context.setMixInAnnotations(InternedString.class, InternedStringMixin.class);
        context.setMixInAnnotations(BlockRef.class, BlockRefMixin.class);
    }

    /**
     * All concrete node records, found by walking the permitted subclasses of {@link Node}.
     */
    static Set<Class<?>> nodeRecords() {
        Set<Class<?>> records = new LinkedHashSet<>();
        collectRecords(Node.class, records);
        return records;
    }

    private static void collectRecords(Class<?> type, Set<Class<?>> records) {
        if (type.isRecord()) {
            records.add(type);
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            return;
        }
        for (Class<?> subclass : permitted) {
            collectRecords(subclass, records);
        }
    }

    // ==================== Serialization Mixins ====================

    @JsonAppend(prepend = true, props = {
        @JsonAppend.Prop(value = TypeWriter.class, name = "type"),
        @JsonAppend.Prop(value = LocWriter.class, name = "loc")
    })
    @JsonIgnoreProperties({"lineno", "colOffset", "stringPool"})
    private abstract static class NodeMixin {
    }

    // nInt/nFloat/nLong collapse into "n"; which one is meaningful depends on numType
    @JsonAppend(prepend = true, props = {
        @JsonAppend.Prop(value = TypeWriter.class, name = "type"),
        @JsonAppend.Prop(value = LocWriter.class, name = "loc"),
        @JsonAppend.Prop(value = NumValueWriter.class, name = "n")
    })
    @JsonIgnoreProperties({"lineno", "colOffset", "nInt", "nFloat", "nLong"})
    private abstract static class NumMixin {
    }

    private abstract static class InternedStringMixin {
        @JsonValue
        abstract String s();
    }

    private abstract static class BlockRefMixin {
        @JsonValue
        abstract int index();
    }

    // ==================== Virtual Properties ====================

    static final class TypeWriter extends VirtualBeanPropertyWriter {

        TypeWriter() {
        }

        private TypeWriter(BeanPropertyDefinition propDef, Annotations annotations, JavaType type) {
            super(propDef, annotations, type);
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            return ((Node) bean).kind().name();
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new TypeWriter(propDef, declaringClass.getAnnotations(), type);
        }
    }

    static final class LocWriter extends VirtualBeanPropertyWriter {

        LocWriter() {
        }

        private LocWriter(BeanPropertyDefinition propDef, Annotations annotations, JavaType type) {
            super(propDef, annotations, type);
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            Node node = (Node) bean;
            return new SourceLocation(node.lineno(), node.colOffset());
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new LocWriter(propDef, declaringClass.getAnnotations(), type);
        }
    }

    static final class NumValueWriter extends VirtualBeanPropertyWriter {

        NumValueWriter() {
        }

        private NumValueWriter(BeanPropertyDefinition propDef, Annotations annotations, JavaType type) {
            super(propDef, annotations, type);
            assignSerializer(new PythonNumberSerializer());
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            Num num = (Num) bean;
            return switch (num.numType()) {
                case INT -> num.nInt();
                case LONG -> longLiteralValue(num.nLong());
                case FLOAT, COMPLEX -> num.nFloat();
            };
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new NumValueWriter(propDef, declaringClass.getAnnotations(), type);
        }

        /**
         * Reads a long literal with Python's base prefixes: {@code 0x} hex, {@code 0o} or a bare
         * leading zero octal, {@code 0b} binary, decimal otherwise. Text that is not a literal in
         * its base is returned unchanged and written as a string.
         */
        static Object longLiteralValue(String literal) {
            boolean negative = literal.startsWith("-");
            String digits = negative ? literal.substring(1) : literal;
            int radix = 10;
            if (digits.length() > 1 && digits.charAt(0) == '0') {
                switch (Character.toLowerCase(digits.charAt(1))) {
                    case 'x' -> {
                        radix = 16;
                        digits = digits.substring(2);
                    }
                    case 'o' -> {
                        radix = 8;
                        digits = digits.substring(2);
                    }
                    case 'b' -> {
                        radix = 2;
                        digits = digits.substring(2);
                    }
                    default -> {
                        radix = 8;
                        digits = digits.substring(1);
                    }
                }
            }
            if (digits.isEmpty()) {
                return literal;
            }
            for (int i = 0; i < digits.length(); i++) {
                if (Character.digit(digits.charAt(i), radix) < 0) {
                    return literal;
                }
            }
            BigInteger value = new BigInteger(digits, radix);
            return negative ? value.negate() : value;
        }
    }

    /**
     * Position written under "loc".
     */
    record SourceLocation(int line, int column) {
    }
}
