package org.unbundle.splitter.frontend.module;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The chunk-wide parameter-name contract of module factories.
 *
 * <p>Webpack names the factory parameters {@code (module, exports, require)} consistently
 * within a chunk, e.g. {@code function(e, t, n)}. The first factory that declares a position
 * fixes its name; every later factory must use the same name at that position. Positions are
 * only fixed when the whole parameter list is accepted, so a rejected factory leaves the contract
 * untouched.</p>
 *
 * <p>Instances are owned by a single chunk; they are never shared.</p>
 */
public final class ModuleFunctionParams {

    /** The maximum number of factory parameters. */
    public static final int MAX_PARAMS = 3;

    private static final int MODULE = 0;
    private static final int EXPORTS = 1;
    private static final int REQUIRE = 2;

    private final String[] names = new String[MAX_PARAMS];

    /**
     * Checks a factory's parameter names against the contract and fixes any new positions.
     *
     * @param paramNames The factory parameter names, at most {@link #MAX_PARAMS}.
     * @return Empty if accepted, otherwise the first conflicting name.
     */
    public Optional<String> accept(List<String> paramNames) {
        if (paramNames.size() > MAX_PARAMS) {
            throw new IllegalArgumentException("Too many parameters: " + paramNames.size());
        }
        for (int i = 0; i < paramNames.size(); i++) {
            if (names[i] != null && !names[i].equals(paramNames.get(i))) {
                return Optional.of(paramNames.get(i));
            }
        }
        for (int i = 0; i < paramNames.size(); i++) {
            if (names[i] == null) {
                names[i] = paramNames.get(i);
            }
        }
        return Optional.empty();
    }

    /** The name bound to the module object, if fixed. */
    public Optional<String> module() {
        return Optional.ofNullable(names[MODULE]);
    }

    /** The name bound to the exports object, if fixed. */
    public Optional<String> exports() {
        return Optional.ofNullable(names[EXPORTS]);
    }

    /** The name bound to the require function, if fixed. */
    public Optional<String> require() {
        return Optional.ofNullable(names[REQUIRE]);
    }

    @Override
    public String toString() {
        return Arrays.toString(names);
    }
}
