// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A symbol table backed by maps, built once from lists of entities.
 * <p>
 * Classes, enumerations and constrained primitives share one namespace, since all of them are referred to as
 * model types; so do constants and verification functions, which both appear as bare names in contracts.
 */
public final class SimpleSymbolTable implements SymbolTable {
    private SimpleSymbolTable(final Builder builder) {
        classes = Map.copyOf(builder.classes);
        enumerations = Map.copyOf(builder.enumerations);
        primitives = Map.copyOf(builder.primitives);
        constants = Map.copyOf(builder.constants);
        functions = Map.copyOf(builder.functions);
        classList = List.copyOf(builder.classes.values());
        enumerationList = List.copyOf(builder.enumerations.values());
        primitiveList = List.copyOf(builder.primitives.values());
        constantList = List.copyOf(builder.constants.values());
        functionList = List.copyOf(builder.functions.values());
    }

    /**
     * Returns a new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public @Nullable ClassType findClass(final String name) {
        return classes.get(name);
    }

    @Override
    public @Nullable Enumeration findEnumeration(final String name) {
        return enumerations.get(name);
    }

    @Override
    public @Nullable ConstrainedPrimitive findConstrainedPrimitive(final String name) {
        return primitives.get(name);
    }

    @Override
    public @Nullable GlobalConstant findConstant(final String name) {
        return constants.get(name);
    }

    @Override
    public @Nullable VerificationFunction findVerificationFunction(final String name) {
        return functions.get(name);
    }

    @Override
    public List<ClassType> classes() {
        return classList;
    }

    @Override
    public List<Enumeration> enumerations() {
        return enumerationList;
    }

    @Override
    public List<ConstrainedPrimitive> constrainedPrimitives() {
        return primitiveList;
    }

    @Override
    public List<GlobalConstant> constants() {
        return constantList;
    }

    @Override
    public List<VerificationFunction> verificationFunctions() {
        return functionList;
    }

    private final Map<String, ClassType> classes;
    private final Map<String, Enumeration> enumerations;
    private final Map<String, ConstrainedPrimitive> primitives;
    private final Map<String, GlobalConstant> constants;
    private final Map<String, VerificationFunction> functions;
    private final List<ClassType> classList;
    private final List<Enumeration> enumerationList;
    private final List<ConstrainedPrimitive> primitiveList;
    private final List<GlobalConstant> constantList;
    private final List<VerificationFunction> functionList;

    /**
     * Collects the entities of a symbol table.
     * <p>
     * Every {@code add} method throws {@link IllegalArgumentException} if the name is already taken in its
     * namespace.
     */
    public static final class Builder {
        private Builder() {
        }

        public Builder add(final ClassType classType) {
            checkTypeName(classType.name());
            classes.put(classType.name(), classType);
            return this;
        }

        public Builder add(final Enumeration enumeration) {
            checkTypeName(enumeration.name());
            enumerations.put(enumeration.name(), enumeration);
            return this;
        }

        public Builder add(final ConstrainedPrimitive primitive) {
            checkTypeName(primitive.name());
            primitives.put(primitive.name(), primitive);
            return this;
        }

        public Builder add(final GlobalConstant constant) {
            checkGlobalName(constant.name());
            constants.put(constant.name(), constant);
            return this;
        }

        public Builder add(final VerificationFunction function) {
            checkGlobalName(function.name());
            functions.put(function.name(), function);
            return this;
        }

        public SimpleSymbolTable build() {
            return new SimpleSymbolTable(this);
        }

        private void checkTypeName(final String name) {
            if (classes.containsKey(name) || enumerations.containsKey(name) || primitives.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate model type name: " + name);
            }
        }

        private void checkGlobalName(final String name) {
            if (constants.containsKey(name) || functions.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate global name: " + name);
            }
        }

        private final LinkedHashMap<String, ClassType> classes = new LinkedHashMap<>();
        private final LinkedHashMap<String, Enumeration> enumerations = new LinkedHashMap<>();
        private final LinkedHashMap<String, ConstrainedPrimitive> primitives = new LinkedHashMap<>();
        private final LinkedHashMap<String, GlobalConstant> constants = new LinkedHashMap<>();
        private final LinkedHashMap<String, VerificationFunction> functions = new LinkedHashMap<>();
    }
}
