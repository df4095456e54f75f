package org.bindforge.library;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of all types and functions of one described library.
 * <p>
 * Filled once by a loader and read-only afterwards, so a populated library may
 * be shared freely between analysis threads.
 */
public class Library {

    private final String namespace;
    private final List<Type> types = new ArrayList<>();
    private final Map<String, TypeId> typesByName = new HashMap<>();
    private final Map<Fundamental, TypeId> fundamentals = new EnumMap<>(Fundamental.class);
    private final List<Function> functions = new ArrayList<>();

    /**
     * Creates a library with all fundamentals registered.
     * @param namespace The namespace of the library, e.g. {@code "Gtk"}.
     */
    public Library(String namespace) {
        this.namespace = namespace;
        for (Fundamental fundamental : Fundamental.values()) {
            fundamentals.put(fundamental, addType(new Type.FundamentalType(fundamental)));
        }
    }

    public String namespace() {
        return namespace;
    }

    /**
     * Registers a type under its {@link Type#name()}. A later type with the same name
     * replaces the name binding, the earlier id stays valid.
     * @param type The type to register.
     * @return The id of the registered type.
     */
    public TypeId addType(Type type) {
        TypeId id = new TypeId(types.size());
        types.add(type);
        typesByName.put(type.name(), id);
        return id;
    }

    /**
     * @param id A type id issued by this library.
     * @return The type definition.
     * @throws IllegalArgumentException if the id was not issued by this library.
     */
    public Type type(TypeId id) {
        if (id == null || id.value() < 0 || id.value() >= types.size()) {
            throw new IllegalArgumentException("Unknown type id " + id + " in library " + namespace);
        }
        return types.get(id.value());
    }

    public Optional<TypeId> findType(String name) {
        return Optional.ofNullable(typesByName.get(name));
    }

    public TypeId fundamental(Fundamental fundamental) {
        return fundamentals.get(fundamental);
    }

    public void addFunction(Function function) {
        functions.add(function);
    }

    public List<Function> functions() {
        return Collections.unmodifiableList(functions);
    }

    public int typeCount() {
        return types.size();
    }
}
