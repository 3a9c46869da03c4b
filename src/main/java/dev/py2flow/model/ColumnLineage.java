package dev.py2flow.model;

import java.util.List;

/**
 * Backward trace of one field.
 *
 * <p>When {@code resolved} is false the chain stops at the recipe that could
 * not be traced through and {@code unresolvedReason} says why.</p>
 *
 * @param target           the traced field
 * @param chain            transformations ordered from the origins to the target
 * @param origins          fields of datasets without a producer that feed the target
 * @param resolved         whether every branch reached an origin
 * @param unresolvedReason reason for an incomplete trace, or null
 */
public record ColumnLineage(
    FieldRef target,
    List<LineageHop> chain,
    List<FieldRef> origins,
    boolean resolved,
    String unresolvedReason
) {

    public ColumnLineage {
        chain = List.copyOf(chain);
        origins = List.copyOf(origins);
    }

    public String describe() {
        var sb = new StringBuilder();
        sb.append("Lineage of ").append(target).append('\n');
        for (FieldRef origin : origins) {
            sb.append("  origin: ").append(origin).append('\n');
        }
        for (LineageHop hop : chain) {
            sb.append("  ").append(hop.recipe()).append(": ").append(hop.description())
                .append(" -> ").append(hop.to()).append('\n');
        }
        if (!resolved) {
            sb.append("  unresolved: ").append(unresolvedReason).append('\n');
        }
        return sb.toString();
    }
}
