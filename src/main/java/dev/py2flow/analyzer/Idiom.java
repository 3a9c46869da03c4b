package dev.py2flow.analyzer;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the idiom table.
 *
 * @param name      idiom name, used in debug logging
 * @param tag       the operation tag the idiom produces ({@link OperationTag#BIND} when it produces none)
 * @param matcher   decides whether the idiom applies at a chain position
 * @param extractor builds the operations; only called after {@code matcher} accepted the site
 */
public record Idiom(String name, OperationTag tag, Predicate<IdiomSite> matcher, Function<IdiomSite, Match> extractor) {

    public Idiom {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * What an idiom recognized.
     *
     * @param operations operations in execution order
     * @param consumed   number of chain links used, at least one
     * @param result     the value the consumed links evaluate to
     */
    public record Match(List<Operation> operations, int consumed, Value result) {

        public Match {
            operations = List.copyOf(operations);
            if (consumed < 1) {
                throw new IllegalArgumentException("An idiom must consume at least one link");
            }
        }

        /** A single operation whose only output is a dataframe. */
        public static Match frame(Operation operation, int consumed) {
            return new Match(List.of(operation), consumed, Value.frame(operation.outputs().get(0)));
        }

        /** Several chained operations; the last one's output is the result. */
        public static Match frames(List<Operation> operations, int consumed) {
            Operation last = operations.get(operations.size() - 1);
            return new Match(operations, consumed, Value.frame(last.outputs().get(0)));
        }

        /** Links that do not change what the receiver denotes. */
        public static Match passthrough(IdiomSite site, int consumed) {
            return new Match(List.of(), consumed, site.receiver());
        }
    }

    /**
     * What part of a chain evaluates to.
     *
     * @param variable the variable (or temporary) holding it; null for values with no name
     * @param kind     binding kind
     * @param detail   estimator class or similar detail
     */
    public record Value(String variable, SymbolTable.Kind kind, String detail) {

        public static Value frame(String variable) {
            return new Value(variable, SymbolTable.Kind.DATAFRAME, null);
        }

        public static Value none() {
            return new Value(null, SymbolTable.Kind.OTHER, null);
        }

        public boolean isFrame() {
            return kind == SymbolTable.Kind.DATAFRAME && variable != null;
        }
    }
}
