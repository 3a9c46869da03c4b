package dev.py2flow.model;

import java.util.List;

/**
 * One transformation in a lineage chain: {@code recipe} turned {@code from}
 * into {@code to}.
 */
public record LineageHop(String recipe, String description, List<FieldRef> from, FieldRef to) {

    public LineageHop {
        from = List.copyOf(from);
    }
}
