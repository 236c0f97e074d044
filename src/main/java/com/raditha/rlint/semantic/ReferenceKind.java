package com.raditha.rlint.semantic;

public enum ReferenceKind {
    READ,
    WRITE
}
