package com.jqdsl.query;

import com.jqdsl.tree.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

/**
 * Dotted paths describing where nodes sit: {@code spec.containers["app-name"].image}.
 * Nodes without a name add nothing to a path.
 */
final class Crumbs {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Crumbs() {
    }

    static ImmutableList<String> up(Iterable<Tree> nodes) {
        MutableList<String> paths = Lists.mutable.empty();
        for (Tree node : nodes) {
            MutableList<String> names = Lists.mutable.empty();
            for (Tree current = node; current != null; current = current.parent()) {
                if (current.name() != null) {
                    names.add(current.name());
                }
            }
            StringBuilder path = new StringBuilder();
            for (String name : names.asReversed()) {
                append(path, name);
            }
            paths.add(path.toString());
        }
        return paths.distinct().toSortedList().toImmutable();
    }

    static ImmutableList<String> down(Iterable<Tree> nodes) {
        MutableList<String> paths = Lists.mutable.empty();
        for (Tree node : nodes) {
            if (node.children().isEmpty()) {
                paths.add("");
            } else {
                descend(node, new StringBuilder(), paths);
            }
        }
        return paths.distinct().toSortedList().toImmutable();
    }

    private static void descend(Tree node, StringBuilder prefix, MutableList<String> paths) {
        for (Tree child : node.children()) {
            int mark = prefix.length();
            if (child.name() != null) {
                append(prefix, child.name());
            }
            if (child.children().isEmpty()) {
                paths.add(prefix.toString());
            } else {
                descend(child, prefix, paths);
            }
            prefix.setLength(mark);
        }
    }

    static void append(StringBuilder path, String name) {
        if (IDENTIFIER.matcher(name).matches()) {
            if (path.length() > 0) {
                path.append('.');
            }
            path.append(name);
        } else {
            path.append("[\"").append(name.replace("\\", "\\\\").replace("\"", "\\\"")).append("\"]");
        }
    }
}
