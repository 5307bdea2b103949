package com.jqdsl.query;

import com.jqdsl.tree.Scalars;
import com.jqdsl.tree.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes what a left node list has that a right node list lacks.
 *
 * <p>Nodes are paired by name and value. A left node whose key never occurs on the right is reported
 * whole. Otherwise its children are diffed against the children of every right node with the same key;
 * an empty diff means the node is matched, else the leftovers of the smallest diff (first one on ties)
 * are reported. Child order is irrelevant.
 */
final class StructuralDiff {
    private StructuralDiff() {
    }

    private record Key(String name, ImmutableList<Object> value) {
        static Key of(Tree node) {
            return new Key(node.name(), node.value().collect(Scalars::key));
        }
    }

    static ImmutableList<Tree> diff(ListIterable<Tree> left, ListIterable<Tree> right) {
        Map<Key, MutableList<Tree>> leftGroups = group(left);
        Map<Key, MutableList<Tree>> rightGroups = group(right);

        MutableList<Tree> leftovers = Lists.mutable.empty();
        for (Map.Entry<Key, MutableList<Tree>> entry : leftGroups.entrySet()) {
            MutableList<Tree> candidates = rightGroups.get(entry.getKey());
            if (candidates == null) {
                leftovers.addAll(entry.getValue());
                continue;
            }
            for (Tree node : entry.getValue()) {
                leftovers.addAll(closest(node, candidates).castToList());
            }
        }
        return leftovers.toImmutable();
    }

    private static ImmutableList<Tree> closest(Tree node, MutableList<Tree> candidates) {
        ImmutableList<Tree> best = null;
        for (Tree candidate : candidates) {
            ImmutableList<Tree> remaining = diff(node.children(), candidate.children());
            if (remaining.isEmpty()) {
                return remaining;
            }
            if (best == null || remaining.size() < best.size()) {
                best = remaining;
            }
        }
        return best;
    }

    private static Map<Key, MutableList<Tree>> group(ListIterable<Tree> nodes) {
        Map<Key, MutableList<Tree>> groups = new LinkedHashMap<>();
        for (Tree node : nodes) {
            groups.computeIfAbsent(Key.of(node), k -> Lists.mutable.empty()).add(node);
        }
        return groups;
    }
}
