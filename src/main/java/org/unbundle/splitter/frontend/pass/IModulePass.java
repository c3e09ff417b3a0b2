package org.unbundle.splitter.frontend.pass;

/**
 * One rewriting step applied to a lifted module tree.
 * Passes run in registration order, each on the output of the previous one.
 */
public interface IModulePass {

    /**
     * Rewrites the module in place.
     *
     * @param context The module being rewritten.
     */
    void run(ModuleContext context);

    /**
     * Whether this pass has anything to do for the given module.
     */
    default boolean isEnabled(ModuleContext context) {
        return true;
    }
}
