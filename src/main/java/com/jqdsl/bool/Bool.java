package com.jqdsl.bool;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A boolean expression that can be evaluated against many values.
 *
 * <p>Expressions compose with {@link #and}, {@link #or} and {@link #not}. {@code And} and {@code Or}
 * evaluate left to right and stop at the first deciding operand. A {@link Predicate} whose function
 * throws evaluates to {@code false}; the failure never reaches the enclosing expression.
 */
public sealed interface Bool {
    Bool TRUE = new Literal(true);
    Bool FALSE = new Literal(false);

    boolean evaluate(Object value);

    java.util.function.Predicate<Object> compile();

    default Bool and(Bool other) {
        return new And(Lists.immutable.with(this, other));
    }

    default Bool or(Bool other) {
        return new Or(Lists.immutable.with(this, other));
    }

    default Bool not() {
        return new Not(this);
    }

    static Bool pred(java.util.function.Predicate<Object> function) {
        return new Predicate("pred", function);
    }

    static Bool pred(String label, java.util.function.Predicate<Object> function) {
        return new Predicate(label, function);
    }

    static Bool all(Bool... predicates) {
        return new And(Lists.immutable.with(predicates));
    }

    static Bool any(Bool... predicates) {
        return new Or(Lists.immutable.with(predicates));
    }

    record Literal(boolean value) implements Bool {
        @Override
        public boolean evaluate(Object ignored) {
            return value;
        }

        @Override
        public java.util.function.Predicate<Object> compile() {
            boolean result = value;
            return ignored -> result;
        }

        @Override
        public String toString() {
            return value ? "TRUE" : "FALSE";
        }
    }

    record And(ImmutableList<Bool> predicates) implements Bool {
        @Override
        public boolean evaluate(Object value) {
            for (Bool predicate : predicates) {
                if (!predicate.evaluate(value)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        @SuppressWarnings("unchecked")
        public java.util.function.Predicate<Object> compile() {
            java.util.function.Predicate<Object>[] compiled = predicates.collect(Bool::compile)
                    .toArray(new java.util.function.Predicate[0]);
            return value -> {
                for (java.util.function.Predicate<Object> predicate : compiled) {
                    if (!predicate.test(value)) {
                        return false;
                    }
                }
                return true;
            };
        }

        @Override
        public String toString() {
            return predicates.makeString("(", " & ", ")");
        }
    }

    record Or(ImmutableList<Bool> predicates) implements Bool {
        @Override
        public boolean evaluate(Object value) {
            for (Bool predicate : predicates) {
                if (predicate.evaluate(value)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        @SuppressWarnings("unchecked")
        public java.util.function.Predicate<Object> compile() {
            java.util.function.Predicate<Object>[] compiled = predicates.collect(Bool::compile)
                    .toArray(new java.util.function.Predicate[0]);
            return value -> {
                for (java.util.function.Predicate<Object> predicate : compiled) {
                    if (predicate.test(value)) {
                        return true;
                    }
                }
                return false;
            };
        }

        @Override
        public String toString() {
            return predicates.makeString("(", " | ", ")");
        }
    }

    record Not(Bool predicate) implements Bool {
        @Override
        public boolean evaluate(Object value) {
            return !predicate.evaluate(value);
        }

        @Override
        public java.util.function.Predicate<Object> compile() {
            return predicate.compile().negate();
        }

        @Override
        public String toString() {
            return "~" + predicate;
        }
    }

    /** Calls a function to decide; any exception it throws counts as {@code false}. */
    record Predicate(String label, java.util.function.Predicate<Object> function) implements Bool {
        private static final Logger LOG = LoggerFactory.getLogger(Bool.class);

        @Override
        public boolean evaluate(Object value) {
            try {
                return function.test(value);
            } catch (RuntimeException e) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} failed on {}: {}", label, value, e.toString());
                }
                return false;
            }
        }

        @Override
        public java.util.function.Predicate<Object> compile() {
            return this::evaluate;
        }

        @Override
        public String toString() {
            return label;
        }
    }
}
