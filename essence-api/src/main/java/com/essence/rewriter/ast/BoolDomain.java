/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

public enum BoolDomain implements Domain {
    INSTANCE;

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    public String toString() {
        return "bool";
    }
}
