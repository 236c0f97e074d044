package com.raditha.rlint.semantic;

/**
 * Outcome of resolving a reference against the scope chain.
 */
public enum Resolution {
    /** The name matched a binding of an enclosing scope. */
    BOUND,
    /** No binding matched but the name is an allowed global. */
    GLOBAL,
    /** Neither a binding nor a global. */
    UNRESOLVED
}
