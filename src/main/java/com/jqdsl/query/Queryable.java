package com.jqdsl.query;

import com.jqdsl.bool.Bool;
import com.jqdsl.output.TreeFormatter;
import com.jqdsl.tree.Branch;
import com.jqdsl.tree.Leaf;
import com.jqdsl.tree.Scalars;
import com.jqdsl.tree.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An ordered set of tree nodes and the operations that narrow or reshape it.
 *
 * <p>Every operation returns a new {@code Queryable}; only {@link #extend} changes the receiver, and
 * only by replacing its node list. A node whose evaluation fails is left out of the result rather
 * than failing the whole operation.
 */
public class Queryable implements Iterable<Queryable> {
    private static final Logger LOG = LoggerFactory.getLogger(Queryable.class);

    private ImmutableList<Tree> nodes;

    public Queryable(ImmutableList<Tree> nodes) {
        this.nodes = nodes;
    }

    public static Queryable of(Tree... nodes) {
        return new Queryable(Lists.immutable.with(nodes));
    }

    public static Queryable of(Iterable<? extends Tree> nodes) {
        return new Queryable(Lists.immutable.withAll(nodes));
    }

    public static Queryable empty() {
        return new Queryable(Lists.immutable.empty());
    }

    public ImmutableList<Tree> nodes() {
        return nodes;
    }

    // Selection

    public Queryable get(Object query) {
        return new Queryable(descend(Query.desugar(query), nodes));
    }

    // Negative indexes count from the end.
    public Queryable get(int index) {
        int size = nodes.size();
        int position = index < 0 ? size + index : index;
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for " + size + " nodes");
        }
        return of(nodes.get(position));
    }

    public Queryable slice(int from, int to) {
        int size = nodes.size();
        int start = clamp(from < 0 ? size + from : from, size);
        int end = clamp(to < 0 ? size + to : to, size);
        MutableList<Tree> result = Lists.mutable.empty();
        for (int i = start; i < end; i++) {
            result.add(nodes.get(i));
        }
        return new Queryable(result.toImmutable());
    }

    public Queryable children() {
        return get(Query.ALL);
    }

    public Queryable branches() {
        return new Queryable(nodes.flatCollect(Tree::children).select(c -> c instanceof Branch));
    }

    public Queryable leaves() {
        return new Queryable(nodes.flatCollect(Tree::children).select(c -> c instanceof Leaf));
    }

    public ImmutableList<String> keys() {
        return nodes.flatCollect(Tree::children)
                .collect(Tree::name)
                .distinct()
                .toSortedList(Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                .toImmutable();
    }

    /**
     * Searches the whole subtree of every current node. The first query is tried against every
     * descendant (and the node itself) as a parent; each further query descends one level from the
     * previous matches.
     */
    public Queryable find(Object... queries) {
        ImmutableList<Predicate<Tree>> predicates = Lists.immutable.with(queries).collect(Query::desugar);
        MutableList<Tree> results = Lists.mutable.empty();
        for (Tree node : nodes) {
            ImmutableList<Tree> current = flatten(node);
            for (Predicate<Tree> predicate : predicates) {
                if (current.notEmpty()) {
                    current = descend(predicate, current);
                }
            }
            results.addAll(current.castToList());
        }
        return new Queryable(results.toImmutable());
    }

    public Queryable where(Predicate<Queryable> test) {
        MutableList<Tree> results = Lists.mutable.empty();
        for (Tree node : nodes) {
            try {
                if (test.test(of(node))) {
                    results.add(node);
                }
            } catch (RuntimeException e) {
                debug("where", node, e);
            }
        }
        return new Queryable(results.toImmutable());
    }

    // Tested against the raw child list, see Query.q.
    public Queryable where(Bool test) {
        Predicate<Object> compiled = test.compile();
        return new Queryable(nodes.select(node -> compiled.test(node.children())));
    }

    public Queryable upto(Object query) {
        Predicate<Tree> predicate = Query.desugar(query);
        MutableList<Tree> results = Lists.mutable.empty();
        for (Tree node : nodes) {
            Tree ancestor = node.parent();
            while (ancestor != null && !predicate.test(ancestor)) {
                ancestor = ancestor.parent();
            }
            if (ancestor != null) {
                results.add(ancestor);
            }
        }
        return new Queryable(results.distinct().toImmutable());
    }

    public Queryable parents() {
        return new Queryable(nodes.<Tree>collect(Tree::parent).reject(Objects::isNull).distinct());
    }

    // Strict ancestors only: a node without a parent contributes nothing.
    public Queryable roots() {
        MutableList<Tree> results = Lists.mutable.empty();
        for (Tree node : nodes) {
            Tree ancestor = node.parent();
            if (ancestor == null) {
                continue;
            }
            while (ancestor.parent() != null) {
                ancestor = ancestor.parent();
            }
            results.add(ancestor);
        }
        return new Queryable(results.distinct().toImmutable());
    }

    // Reshaping

    public Queryable orderBy(Function<Queryable, ?> selector) {
        return orderBy(selector, false);
    }

    /**
     * Stable sort by the sorted values of what {@code selector} returns for each node: a
     * {@code Queryable} or a list of them, compared in order.
     */
    public Queryable orderBy(Function<Queryable, ?> selector, boolean reverse) {
        MutableList<Pair<Tree, List<List<Object>>>> keyed = Lists.mutable.empty();
        for (Tree node : nodes) {
            try {
                List<List<Object>> key = Lists.mutable.empty();
                for (Queryable part : parts(selector.apply(of(node)))) {
                    key.add(part.values().castToList());
                }
                keyed.add(Tuples.pair(node, key));
            } catch (RuntimeException e) {
                debug("order_by", node, e);
            }
        }
        Comparator<Pair<Tree, List<List<Object>>>> byKey =
                (a, b) -> compareLists(a.getTwo(), b.getTwo(), Queryable::compareValues);
        if (reverse) {
            byKey = byKey.reversed();
        }
        return new Queryable(keyed.toSortedList(byKey).collect(Pair::getOne).toImmutable());
    }

    /**
     * Builds one record per node from what {@code selector} returns for it: a {@code Queryable}, a
     * {@code Map} from output name to {@code Queryable}, or a list mixing the two. Map entries rename
     * the nodes they hold. Nodes without a name, such as the records of an earlier select, are
     * replaced by their children. Each record is a detached branch without a name.
     */
    public Queryable select(Function<Queryable, ?> selector) {
        MutableList<Tree> results = Lists.mutable.empty();
        for (Tree node : nodes) {
            try {
                MutableList<Tree> pieces = Lists.mutable.empty();
                for (Object entry : entries(selector.apply(of(node)))) {
                    if (entry instanceof Map<?, ?> named) {
                        for (Map.Entry<?, ?> e : named.entrySet()) {
                            gather(String.valueOf(e.getKey()), (Queryable) e.getValue(), pieces);
                        }
                    } else {
                        gather(null, (Queryable) entry, pieces);
                    }
                }
                if (pieces.notEmpty()) {
                    results.add(Branch.detached(null, Lists.immutable.empty(), pieces.toImmutable()));
                }
            } catch (RuntimeException e) {
                debug("select", node, e);
            }
        }
        return new Queryable(results.toImmutable());
    }

    public ImmutableList<String> crumbs() {
        return crumbs(false);
    }

    public ImmutableList<String> crumbs(boolean down) {
        return down ? Crumbs.down(nodes) : Crumbs.up(nodes);
    }

    // Values

    public Object value() {
        for (Tree node : nodes) {
            if (node.value().notEmpty()) {
                return node.value().getFirst();
            }
        }
        throw new EmptyResultException("No values among " + nodes.size() + " nodes");
    }

    public ImmutableList<Object> values() {
        return nodes.flatCollect(Tree::value).toSortedList(Scalars.ORDER).toImmutable();
    }

    public ImmutableList<Object> uniqueValues() {
        return nodes.flatCollect(Tree::value).distinct().toSortedList(Scalars.ORDER).toImmutable();
    }

    public ImmutableList<Pair<Object, Integer>> mostCommon() {
        return mostCommon(-1);
    }

    // Ties keep first-seen order; a negative limit means all.
    public ImmutableList<Pair<Object, Integer>> mostCommon(int limit) {
        Map<Object, Object> firstSeen = new LinkedHashMap<>();
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Tree node : nodes) {
            for (Object value : node.value()) {
                Object key = Scalars.key(value);
                firstSeen.putIfAbsent(key, value);
                counts.merge(key, 1, Integer::sum);
            }
        }
        MutableList<Pair<Object, Integer>> ranked = Lists.mutable.empty();
        counts.forEach((key, count) -> ranked.add(Tuples.pair(firstSeen.get(key), count)));
        ranked.sortThis((a, b) -> Integer.compare(b.getTwo(), a.getTwo()));
        return (limit < 0 ? ranked : ranked.subList(0, Math.min(limit, ranked.size()))).toImmutable();
    }

    public ImmutableList<String> sources() {
        return nodes.collect(Tree::source)
                .reject(Objects::isNull)
                .distinct()
                .toSortedList()
                .toImmutable();
    }

    // Combining

    public Queryable plus(Queryable other) {
        return new Queryable(nodes.newWithAll(other.nodes));
    }

    // The one operation that changes the receiver.
    public Queryable extend(Queryable other) {
        nodes = nodes.newWithAll(other.nodes);
        return this;
    }

    /**
     * What these nodes have that {@code other}'s lack, as the children of a single detached branch
     * without a name.
     */
    public Queryable minus(Queryable other) {
        ImmutableList<Tree> leftovers = StructuralDiff.diff(nodes, other.nodes);
        return of(Branch.detached(null, Lists.immutable.empty(), leftovers));
    }

    // Result consumption

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean notEmpty() {
        return nodes.notEmpty();
    }

    @Override
    public Iterator<Queryable> iterator() {
        return nodes.<Queryable>collect(node -> of(node)).iterator();
    }

    @Override
    public String toString() {
        return new TreeFormatter().format(nodes);
    }

    private static ImmutableList<Tree> descend(Predicate<Tree> predicate, ImmutableList<Tree> parents) {
        MutableList<Tree> results = Lists.mutable.empty();
        for (Tree parent : parents) {
            for (Tree child : parent.children()) {
                if (predicate.test(child)) {
                    results.add(child);
                }
            }
        }
        return results.toImmutable();
    }

    private static ImmutableList<Tree> flatten(Tree node) {
        MutableList<Tree> results = Lists.mutable.empty();
        flatten(node, results);
        return results.toImmutable();
    }

    private static void flatten(Tree node, MutableList<Tree> results) {
        results.add(node);
        for (Tree child : node.children()) {
            flatten(child, results);
        }
    }

    private static void gather(String rename, Queryable part, MutableList<Tree> pieces) {
        for (Tree node : part.nodes) {
            if (node.name() == null) {
                pieces.addAll(node.children().castToList());
            } else if (rename == null) {
                pieces.add(node);
            } else if (node instanceof Branch) {
                pieces.add(Branch.detached(rename, node.value(), node.children(), node.source()));
            } else {
                pieces.add(new Leaf(rename, node.value(), node.source()));
            }
        }
    }

    private static Iterable<?> entries(Object selected) {
        if (selected instanceof Iterable<?> list && !(selected instanceof Queryable)) {
            return list;
        }
        if (selected instanceof Object[] array) {
            return Lists.immutable.with(array);
        }
        return Lists.immutable.with(selected);
    }

    private static Iterable<Queryable> parts(Object selected) {
        MutableList<Queryable> parts = Lists.mutable.empty();
        for (Object entry : entries(selected)) {
            parts.add((Queryable) entry);
        }
        return parts;
    }

    private static int compareValues(List<Object> left, List<Object> right) {
        return compareLists(left, right, Scalars.ORDER);
    }

    private static <T> int compareLists(List<T> left, List<T> right, Comparator<? super T> order) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int result = order.compare(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int clamp(int position, int size) {
        return Math.max(0, Math.min(position, size));
    }

    private static void debug(String operation, Tree node, RuntimeException e) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} skipped node {}: {}", operation, node.name(), e.toString());
        }
    }
}
