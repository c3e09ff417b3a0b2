package org.unbundle.splitter.frontend.classify;

/**
 * The shape of a bundled module, decided once before any rewriting.
 */
public enum ModuleKind {
    /** Assigns {@code module.exports} more than once, or to an object literal. */
    COMMON_JS("CJS"),
    /** Everything else; exports are resynthesized as native {@code export} syntax. */
    ESM("ESM");

    private final String label;

    ModuleKind(String label) {
        this.label = label;
    }

    /**
     * The short label used in output headers.
     */
    public String label() {
        return label;
    }

    public boolean isCommonJs() {
        return this == COMMON_JS;
    }
}
