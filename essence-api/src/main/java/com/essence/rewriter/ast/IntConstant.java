/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

public record IntConstant(int value) implements Atom {

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
