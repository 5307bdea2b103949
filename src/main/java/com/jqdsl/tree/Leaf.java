package com.jqdsl.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public final class Leaf extends Tree {
    public Leaf(String name, ImmutableList<Object> value) {
        this(name, value, null);
    }

    public Leaf(String name, ImmutableList<Object> value, String source) {
        super(name, value, source);
    }

    @Override
    public ImmutableList<Tree> children() {
        return Lists.immutable.empty();
    }
}
