package org.bindforge.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bindforge.diagnostics.DiagnosticsEngine;
import org.bindforge.library.Fundamental;
import org.bindforge.library.Function;
import org.bindforge.library.Library;
import org.bindforge.library.Parameter;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.ParameterScope;
import org.bindforge.library.Transfer;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a library description in JSON form.
 * <pre>
 * {
 *   "namespace": "Foo",
 *   "types": [ { "kind": "class", "name": "Widget", "c-type": "FooWidget", "final": false } ],
 *   "functions": [ { "name": "show", "c-identifier": "foo_widget_show", "owner": "Widget",
 *                    "parameters": [ { "name": "widget", "type": "Widget", "instance": true } ],
 *                    "return": { "name": "", "type": "none" } } ]
 * }
 * </pre>
 * Types are referenced by name and may be declared in any order. A reference to
 * an undeclared type is reported as a warning and bound to the {@code unsupported}
 * fundamental.
 */
public class LibraryReader {

    private static final Logger LOG = LoggerFactory.getLogger(LibraryReader.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final DiagnosticsEngine diagnostics;

    public LibraryReader(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Library read(Path path) throws LibraryLoadException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new LibraryLoadException("Cannot read library description " + path + ": " + e.getMessage(), e);
        }
    }

    public Library read(InputStream in) throws LibraryLoadException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new LibraryLoadException("Malformed library description: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LibraryLoadException("Cannot read library description: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new LibraryLoadException("Library description must be a JSON object");
        }

        Library library = new Library(requiredText(root, "namespace", "library"));
        Map<String, TypeId> declared = reserveTypeIds(library, root.path("types"));
        TypeResolver resolver = new TypeResolver(library, declared);

        for (JsonNode node : root.path("types")) {
            library.addType(readType(node, resolver));
        }
        for (JsonNode node : root.path("functions")) {
            library.addFunction(readFunction(node, resolver));
        }
        LOG.debug("Read library {} with {} types and {} functions",
                library.namespace(), library.typeCount(), library.functions().size());
        return library;
    }

    /**
     * Types are added in declaration order after the fundamentals, so their ids are
     * known before any of them is built and forward references resolve.
     */
    private Map<String, TypeId> reserveTypeIds(Library library, JsonNode types) throws LibraryLoadException {
        Map<String, TypeId> declared = new HashMap<>();
        int next = library.typeCount();
        for (JsonNode node : types) {
            declared.put(requiredText(node, "name", "type"), new TypeId(next++));
        }
        return declared;
    }

    private Type readType(JsonNode node, TypeResolver resolver) throws LibraryLoadException {
        String name = requiredText(node, "name", "type");
        String kind = requiredText(node, "kind", name);
        String cType = node.path("c-type").asText(name);
        return switch (kind) {
            case "alias" -> new Type.AliasType(name, cType, resolver.resolve(node.path("target").asText(), name));
            case "enumeration" -> new Type.EnumerationType(name, cType);
            case "bitfield" -> new Type.BitfieldType(name, cType);
            case "record" -> new Type.RecordType(name, cType,
                    node.path("disguised").asBoolean(false), node.path("refcounted").asBoolean(false));
            case "union" -> new Type.UnionType(name, cType);
            case "class" -> new Type.ClassType(name, cType, node.path("final").asBoolean(false));
            case "interface" -> new Type.InterfaceType(name, cType);
            case "c-array" -> new Type.CArrayType(name, resolver.element(node, name));
            case "fixed-array" -> new Type.FixedArrayType(name, resolver.element(node, name),
                    node.path("size").asInt(0));
            case "array" -> new Type.ArrayType(name, resolver.element(node, name));
            case "ptr-array" -> new Type.PtrArrayType(name, resolver.element(node, name));
            case "list" -> new Type.ListType(name, resolver.element(node, name));
            case "slist" -> new Type.SListType(name, resolver.element(node, name));
            case "hash-table" -> new Type.HashTableType(name,
                    resolver.resolve(node.path("key").asText(), name),
                    resolver.resolve(node.path("value").asText(), name));
            case "callback" -> new Type.CallbackType(name, cType);
            case "custom" -> new Type.CustomType(name, node.path("borrowed").asBoolean(false));
            default -> throw new LibraryLoadException("Unknown kind '" + kind + "' of type " + name);
        };
    }

    private Function readFunction(JsonNode node, TypeResolver resolver) throws LibraryLoadException {
        String name = requiredText(node, "name", "function");
        String cIdentifier = node.path("c-identifier").asText(name);
        TypeId owner = node.hasNonNull("owner") ? resolver.resolve(node.get("owner").asText(), cIdentifier) : null;

        List<Parameter> parameters = new ArrayList<>();
        for (JsonNode par : node.path("parameters")) {
            parameters.add(readParameter(par, resolver, cIdentifier, false));
        }
        Parameter ret = node.hasNonNull("return")
                ? readParameter(node.get("return"), resolver, cIdentifier, true)
                : null;
        return new Function(name, cIdentifier, owner, parameters, ret,
                node.path("throws").asBoolean(false), node.path("deprecated").asBoolean(false));
    }

    private Parameter readParameter(JsonNode node, TypeResolver resolver, String function, boolean isReturn)
            throws LibraryLoadException {
        String name = isReturn ? node.path("name").asText("") : requiredText(node, "name", function);
        TypeId typ = resolver.resolve(requiredText(node, "type", function + "." + name), function);
        ParameterDirection direction = isReturn
                ? ParameterDirection.RETURN
                : parseEnum(ParameterDirection.class, node.path("direction").asText("in"), function);
        return Parameter.builder(name, typ)
                .cType(node.path("c-type").asText(""))
                .direction(direction)
                .nullable(node.path("nullable").asBoolean(false))
                .allowNone(node.path("allow-none").asBoolean(false))
                .transfer(parseEnum(Transfer.class, node.path("transfer").asText("none"), function))
                .callerAllocates(node.path("caller-allocates").asBoolean(false))
                .scope(parseEnum(ParameterScope.class, node.path("scope").asText("call"), function))
                .arrayLength(optionalIndex(node, "array-length"))
                .closure(optionalIndex(node, "closure"))
                .destroy(optionalIndex(node, "destroy"))
                .error(node.path("error").asBoolean(false))
                .instanceParameter(node.path("instance").asBoolean(false))
                .build();
    }

    private static Integer optionalIndex(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String subject)
            throws LibraryLoadException {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new LibraryLoadException("Invalid " + type.getSimpleName() + " '" + value + "' in " + subject, e);
        }
    }

    private static String requiredText(JsonNode node, String field, String subject) throws LibraryLoadException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new LibraryLoadException("Missing '" + field + "' in " + subject);
        }
        return value.asText();
    }

    private final class TypeResolver {
        private final Library library;
        private final Map<String, TypeId> declared;

        TypeResolver(Library library, Map<String, TypeId> declared) {
            this.library = library;
            this.declared = declared;
        }

        TypeId resolve(String name, String subject) {
            TypeId id = declared.get(name);
            if (id != null) {
                return id;
            }
            return library.findType(name).orElseGet(() -> {
                diagnostics.reportWarning("Unknown type '" + name + "', treated as unsupported.", subject);
                return library.fundamental(Fundamental.UNSUPPORTED);
            });
        }

        TypeId element(JsonNode node, String subject) {
            return resolve(node.path("element").asText(), subject);
        }
    }
}
