package com.jqdsl.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A section that owns an ordered list of children and may carry values of its own.
 */
public final class Branch extends Tree {
    private final ImmutableList<Tree> children;

    Branch(String name, ImmutableList<Object> value, ImmutableList<Tree> children, boolean linkParents,
           String source) {
        super(name, value, source);
        this.children = children;
        if (linkParents) {
            for (Tree child : children) {
                child.attachTo(this);
            }
        }
    }

    // Claims the children; only for nodes built fresh by TreeBuilder.
    static Branch of(String name, ImmutableList<Tree> children) {
        return new Branch(name, Lists.immutable.empty(), children, true, null);
    }

    /**
     * A branch that groups existing nodes without claiming them: the children keep their
     * current parent.
     */
    public static Branch detached(String name, ImmutableList<Object> value, ImmutableList<Tree> children) {
        return detached(name, value, children, null);
    }

    public static Branch detached(String name, ImmutableList<Object> value, ImmutableList<Tree> children,
                                  String source) {
        return new Branch(name, value, children, false, source);
    }

    @Override
    public ImmutableList<Tree> children() {
        return children;
    }
}
