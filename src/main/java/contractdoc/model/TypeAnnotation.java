// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.Locale;

/**
 * An inferred type, attached to expression nodes and to bound identifiers.
 * <p>
 * Type annotations are plain data. References to model types are by name and are resolved against a
 * {@link SymbolTable} by whoever needs the referenced entity.
 */
public sealed interface TypeAnnotation {
    /**
     * Returns a user-readable rendering of this type, as used in error messages and on documentation pages.
     */
    String describe();

    /**
     * Returns this type with one enclosing {@link OptionalType} removed, if there is one.
     */
    default TypeAnnotation beneathOptional() {
        return (this instanceof OptionalType optional) ? optional.value() : this;
    }

    enum PrimitiveKind {
        BOOL,
        INT,
        FLOAT,
        STR,
        BYTEARRAY;

        /**
         * Retrieves the name of this primitive as written in contract expressions.
         */
        public String sourceName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    record Primitive(PrimitiveKind primitiveKind) implements TypeAnnotation {
        @Override
        public String describe() {
            return primitiveKind.sourceName();
        }
    }

    /**
     * A class or an enumeration of the model.
     */
    record OurType(String name) implements TypeAnnotation {
        @Override
        public String describe() {
            return name;
        }
    }

    record OptionalType(TypeAnnotation value) implements TypeAnnotation {
        @Override
        public String describe() {
            return "Optional[" + value.describe() + ']';
        }
    }

    record ListType(TypeAnnotation items) implements TypeAnnotation {
        @Override
        public String describe() {
            return "List[" + items.describe() + ']';
        }
    }

    /**
     * The signature of a verification function.
     */
    record VerificationType(String functionName) implements TypeAnnotation {
        @Override
        public String describe() {
            return "verification function " + functionName;
        }
    }

    /**
     * A built-in function, such as {@code len} or {@code match}.
     */
    record BuiltinType(String functionName) implements TypeAnnotation {
        @Override
        public String describe() {
            return "built-in function " + functionName;
        }
    }

    static TypeAnnotation bool() {
        return new Primitive(PrimitiveKind.BOOL);
    }

    static TypeAnnotation integer() {
        return new Primitive(PrimitiveKind.INT);
    }

    static TypeAnnotation string() {
        return new Primitive(PrimitiveKind.STR);
    }

    static TypeAnnotation our(final String name) {
        return new OurType(name);
    }

    static TypeAnnotation optional(final TypeAnnotation value) {
        return new OptionalType(value);
    }

    static TypeAnnotation list(final TypeAnnotation items) {
        return new ListType(items);
    }
}
