package com.jqdsl.query;

import com.jqdsl.bool.Bool;
import com.jqdsl.tree.Scalars;
import com.jqdsl.tree.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Turns terse query values into node predicates.
 *
 * <p>A query is {@link #ALL} (or {@code null}), a {@link Bool}, a {@link Predicate}, a scalar compared
 * by equality, or a {@link Tuple} of a name query followed by value queries. Plain queries test a
 * node's name. A tuple matches when the name query matches and any of its value queries matches; a
 * value query matches when any element of the node's value does.
 */
public final class Query {
    private static final Logger LOG = LoggerFactory.getLogger(Query.class);

    // To match a literal null, use eq(null).
    public static final Object ALL = Wildcard.INSTANCE;

    private Query() {
    }

    public record Tuple(Object name, ImmutableList<Object> values) {
        public Tuple {
            if (values.isEmpty()) {
                throw new IllegalArgumentException("A query tuple needs at least one value query");
            }
        }
    }

    public static Tuple of(Object name, Object... values) {
        return new Tuple(name, Lists.immutable.with(values));
    }

    public static Predicate<Tree> desugar(Object raw) {
        if (!(raw instanceof Tuple tuple)) {
            return desugarName(raw);
        }

        ImmutableList<Predicate<Tree>> valuePredicates = tuple.values().collect(Query::desugarValue);
        Predicate<Tree> anyValue = node -> valuePredicates.anySatisfy(p -> p.test(node));
        if (isWildcard(tuple.name())) {
            return anyValue;
        }
        Predicate<Tree> namePredicate = desugarName(tuple.name());
        return node -> namePredicate.test(node) && anyValue.test(node);
    }

    /**
     * A {@link Bool} for {@link Queryable#where(Bool)}: true when any child of the tested node
     * matches the query.
     */
    public static Bool q(Object name) {
        return children(desugar(name), String.valueOf(name));
    }

    public static Bool q(Object name, Object value) {
        return children(desugar(of(name, value)), name + "=" + value);
    }

    private static Bool children(Predicate<Tree> predicate, String label) {
        return Bool.pred("q(" + label + ")", nodes -> {
            for (Object node : (Iterable<?>) nodes) {
                if (predicate.test((Tree) node)) {
                    return true;
                }
            }
            return false;
        });
    }

    private static Predicate<Tree> desugarName(Object query) {
        if (isWildcard(query)) {
            return node -> true;
        }
        if (query instanceof Bool bool) {
            Predicate<Object> compiled = bool.compile();
            return node -> compiled.test(node.name());
        }
        if (query instanceof Predicate<?> function) {
            Predicate<Object> safe = guard(function);
            return node -> safe.test(node.name());
        }
        return node -> Scalars.equal(node.name(), query);
    }

    private static Predicate<Tree> desugarValue(Object query) {
        if (isWildcard(query)) {
            return node -> true;
        }
        if (query instanceof Bool bool) {
            Predicate<Object> compiled = bool.compile();
            return node -> node.value().anySatisfy(compiled::test);
        }
        if (query instanceof Predicate<?> function) {
            Predicate<Object> safe = guard(function);
            return node -> node.value().anySatisfy(safe::test);
        }
        return node -> node.value().anySatisfy(v -> Scalars.equal(v, query));
    }

    @SuppressWarnings("unchecked")
    private static Predicate<Object> guard(Predicate<?> function) {
        Predicate<Object> unchecked = (Predicate<Object>) function;
        return value -> {
            try {
                return unchecked.test(value);
            } catch (RuntimeException e) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Query function failed on {}: {}", value, e.toString());
                }
                return false;
            }
        };
    }

    private static boolean isWildcard(Object query) {
        return query == null || query == ALL;
    }

    private enum Wildcard {
        INSTANCE;

        @Override
        public String toString() {
            return "ALL";
        }
    }
}
