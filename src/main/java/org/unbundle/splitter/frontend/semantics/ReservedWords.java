package org.unbundle.splitter.frontend.semantics;

import java.util.Set;

/**
 * JavaScript words that cannot be used as binding names.
 */
public final class ReservedWords {

    private static final Set<String> RESERVED = Set.of(
            // ES keywords
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "export", "extends", "finally", "for", "function", "if", "import", "in",
            "instanceof", "new", "return", "super", "switch", "this", "throw", "try", "typeof",
            "var", "void", "while", "with", "yield",
            // strict mode and module code
            "await", "enum", "implements", "interface", "let", "package", "private", "protected",
            "public", "static", "arguments", "eval",
            // literals
            "null", "true", "false",
            // ES3 future reserved words
            "abstract", "boolean", "byte", "char", "double", "final", "float", "goto", "int", "long",
            "native", "short", "synchronized", "throws", "transient", "volatile");

    private ReservedWords() {}

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /**
     * Returns a usable binding name for the given external name, prefixing reserved words with {@code _}.
     */
    public static String toBindingName(String name) {
        return isReserved(name) ? "_" + name : name;
    }
}
