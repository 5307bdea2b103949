package com.jqdsl.bool;

import com.jqdsl.tree.Scalars;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Ready-made predicates. Each is bound to its right-hand operand and tested against the runtime
 * value as the left-hand operand, so {@code lt(3)} holds for values less than 3.
 */
public final class Predicates {
    private Predicates() {
    }

    public static Bool lt(Object rhs) {
        return Bool.pred("lt(" + rhs + ")", value -> Scalars.compare(value, rhs) < 0);
    }

    public static Bool le(Object rhs) {
        return Bool.pred("le(" + rhs + ")", value -> Scalars.compare(value, rhs) <= 0);
    }

    public static Bool eq(Object rhs) {
        return Bool.pred("eq(" + rhs + ")", value -> Scalars.equal(value, rhs));
    }

    public static Bool ge(Object rhs) {
        return Bool.pred("ge(" + rhs + ")", value -> Scalars.compare(value, rhs) >= 0);
    }

    public static Bool gt(Object rhs) {
        return Bool.pred("gt(" + rhs + ")", value -> Scalars.compare(value, rhs) > 0);
    }

    public static Bool isin(Collection<?> candidates) {
        ImmutableList<Object> items = Lists.immutable.withAll(candidates);
        return Bool.pred("isin(" + items + ")", value -> items.anySatisfy(item -> Scalars.equal(value, item)));
    }

    public static Bool isin(Object... candidates) {
        return isin(Lists.immutable.with(candidates).castToList());
    }

    public static Bool contains(Object needle) {
        return Bool.pred("contains(" + needle + ")", value -> {
            if (value instanceof String haystack) {
                return haystack.contains((String) needle);
            }
            if (value instanceof Collection<?> haystack) {
                return haystack.stream().anyMatch(item -> Scalars.equal(item, needle));
            }
            throw new IllegalArgumentException("Not a container: " + value);
        });
    }

    public static Bool search(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return Bool.pred("search(" + regex + ")", value -> pattern.matcher((CharSequence) value).find());
    }

    public static Bool matches(String regex) {
        return search(regex);
    }

    public static Bool startswith(String prefix) {
        return Bool.pred("startswith(" + prefix + ")", value -> ((String) value).startsWith(prefix));
    }

    public static Bool endswith(String suffix) {
        return Bool.pred("endswith(" + suffix + ")", value -> ((String) value).endsWith(suffix));
    }
}
