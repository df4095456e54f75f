package org.bindforge.naming;

import java.util.Set;

/**
 * Identifier helpers for generated target-language code.
 */
public final class NameUtil {

    private static final Set<String> KEYWORDS = Set.of(
            "abstract", "alignof", "as", "async", "await", "become", "box", "break", "const",
            "continue", "crate", "do", "dyn", "else", "enum", "extern", "false", "final", "fn",
            "for", "if", "impl", "in", "let", "loop", "macro", "match", "mod", "move", "mut",
            "offsetof", "override", "priv", "proc", "pub", "pure", "ref", "return", "Self",
            "self", "sizeof", "static", "struct", "super", "trait", "true", "try", "type",
            "typeof", "unsafe", "unsized", "use", "virtual", "where", "while", "yield");

    private NameUtil() {}

    /**
     * Appends an underscore to reserved words so they can be used as identifiers.
     * @param name The identifier.
     * @return {@code name}, or {@code name + "_"} if it is a keyword.
     */
    public static String mangleKeywords(String name) {
        return KEYWORDS.contains(name) ? name + "_" : name;
    }
}
