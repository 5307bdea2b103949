package com.jqdsl.tree;

import com.jqdsl.output.TreeFormatter;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * A node of a document tree. Nodes are immutable once their owning {@link Branch} is built; the
 * only late-bound state is the back-reference to that branch, which the branch sets on its
 * children during construction.
 */
public abstract sealed class Tree permits Branch, Leaf {
    private final String name;
    private final ImmutableList<Object> value;
    private final String source;
    private Branch parent;

    Tree(String name, ImmutableList<Object> value, String source) {
        // Names repeat heavily across documents of the same kind
        this.name = name != null ? name.intern() : null;
        this.value = value;
        this.source = source;
    }

    public String name() {
        return name;
    }

    public ImmutableList<Object> value() {
        return value;
    }

    public Branch parent() {
        return parent;
    }

    public abstract ImmutableList<Tree> children();

    public String source() {
        Tree current = this;
        while (current != null) {
            if (current.source != null) {
                return current.source;
            }
            current = current.parent;
        }
        return null;
    }

    void attachTo(Branch owner) {
        this.parent = owner;
    }

    @Override
    public String toString() {
        return new TreeFormatter().format(this);
    }
}
