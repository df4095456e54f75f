package org.bindforge.env;

import org.bindforge.config.GeneratorConfig;
import org.bindforge.library.Library;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;

/**
 * The read-only environment every analysis step is given: the library being
 * bound and the generator configuration.
 *
 * @param library The described library.
 * @param config The generator configuration.
 */
public record Env(Library library, GeneratorConfig config) {

    public Type type(TypeId id) {
        return library.type(id);
    }

    /**
     * Follows alias chains to the first non-alias type.
     * @param id The type to resolve.
     * @return The id of the aliased type, or {@code id} itself if it is not an alias.
     */
    public TypeId resolveAlias(TypeId id) {
        TypeId current = id;
        // A malformed description could declare a cycle; the type count bounds the chain.
        for (int hops = 0; hops <= library.typeCount(); hops++) {
            if (!(library.type(current) instanceof Type.AliasType alias)) {
                return current;
            }
            current = alias.target();
        }
        return current;
    }

    public String mainSysCrateName() {
        return config.sysCrateName();
    }
}
