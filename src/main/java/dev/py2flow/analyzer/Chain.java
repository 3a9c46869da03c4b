package dev.py2flow.analyzer;

import dev.py2flow.python.PyExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An expression unwound into its root variable and the ordered links applied
 * to it, e.g. {@code df.dropna().groupby("k")["v"].sum()} becomes root
 * {@code df} with links dropna(), groupby(), ["v"], sum().
 *
 * <p>A call of a plain function ({@code train_test_split(...)}) has no root
 * and starts with a {@link Link.FunctionCall} link. {@code base} is the
 * innermost expression the links apply to.</p>
 */
record Chain(String root, PyExpr base, List<Link> links) {

    Chain {
        links = List.copyOf(links);
    }

    sealed interface Link {

        PyExpr node();

        /** {@code .name(...)} */
        record MethodCall(String name, PyExpr.Call node) implements Link {}

        /** {@code name(...)} at the start of a chain. */
        record FunctionCall(String name, PyExpr.Call node) implements Link {}

        /** {@code .name} without a call */
        record AttributeAccess(String name, PyExpr.Attribute node) implements Link {}

        /** {@code [index]} */
        record Index(PyExpr index, PyExpr.Subscript node) implements Link {}
    }

    static Chain of(PyExpr expr) {
        List<Link> links = new ArrayList<>();
        PyExpr current = expr;
        String root = null;
        while (true) {
            if (current instanceof PyExpr.Call call && call.func() instanceof PyExpr.Attribute attribute) {
                links.add(new Link.MethodCall(attribute.attr(), call));
                current = attribute.value();
            } else if (current instanceof PyExpr.Call call && call.func() instanceof PyExpr.Name name) {
                links.add(new Link.FunctionCall(name.id(), call));
                break;
            } else if (current instanceof PyExpr.Attribute attribute) {
                links.add(new Link.AttributeAccess(attribute.attr(), attribute));
                current = attribute.value();
            } else if (current instanceof PyExpr.Subscript subscript) {
                links.add(new Link.Index(subscript.index(), subscript));
                current = subscript.value();
            } else {
                if (current instanceof PyExpr.Name name) {
                    root = name.id();
                }
                break;
            }
        }
        Collections.reverse(links);
        return new Chain(root, current, links);
    }

    boolean isEmpty() {
        return links.isEmpty();
    }

    int size() {
        return links.size();
    }

    Link link(int index) {
        return links.get(index);
    }
}
