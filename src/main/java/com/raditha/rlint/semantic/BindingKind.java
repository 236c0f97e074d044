package com.raditha.rlint.semantic;

/**
 * How a binding was introduced.
 */
public enum BindingKind {
    /** Target of {@code <-}, {@code =}, {@code :=} or {@code ->}. */
    ASSIGNMENT,
    /** A formal parameter of a function definition. */
    PARAMETER,
    /** The variable of a {@code for} loop. */
    LOOP_VARIABLE,
    /** A name first created in the file scope by {@code <<-} or {@code ->>}. */
    SUPER_ASSIGNMENT
}
