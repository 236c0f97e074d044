package com.raditha.rlint.model;

public enum FixSafety {
    SAFE,
    UNSAFE
}
