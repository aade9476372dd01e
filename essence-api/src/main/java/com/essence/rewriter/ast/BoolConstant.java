/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

public record BoolConstant(boolean value) implements Atom {

    public static final BoolConstant TRUE = new BoolConstant(true);
    public static final BoolConstant FALSE = new BoolConstant(false);

    public static BoolConstant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
