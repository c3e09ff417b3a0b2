package org.unbundle.splitter.frontend.module;

import com.google.javascript.rhino.Node;
import org.unbundle.splitter.api.ModuleId;

/**
 * A module-map entry that passed validation and is ready to be rewritten.
 *
 * @param id      The resolved module identity.
 * @param rawKey  The key as written in the bundle.
 * @param factory The module factory {@code FUNCTION} node.
 * @param body    The factory's {@code BLOCK} body.
 */
public record ModuleDescriptor(ModuleId id, String rawKey, Node factory, Node body) {
}
