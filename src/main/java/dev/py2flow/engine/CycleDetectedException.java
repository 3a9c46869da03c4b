package dev.py2flow.engine;

import dev.py2flow.Py2FlowException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An operation needs an acyclic flow and the flow has at least one cycle.
 */
public class CycleDetectedException extends Py2FlowException {

    private static final long serialVersionUID = 1L;

    private final transient List<List<FlowEdge>> cycles;

    public CycleDetectedException(List<List<FlowEdge>> cycles) {
        super("Flow contains %d cycle(s): %s".formatted(cycles.size(), describe(cycles)), "CYCLE_DETECTED");
        this.cycles = cycles.stream().map(List::copyOf).toList();
    }

    /** Each cycle as the edges of a closed walk. */
    public List<List<FlowEdge>> getCycles() {
        return cycles;
    }

    static String describe(List<List<FlowEdge>> cycles) {
        return cycles.stream().map(CycleDetectedException::describeCycle).collect(Collectors.joining("; "));
    }

    private static String describeCycle(List<FlowEdge> cycle) {
        if (cycle.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder(cycle.get(0).from().name());
        for (FlowEdge edge : cycle) {
            sb.append(" -> ").append(edge.to().name());
        }
        return sb.toString();
    }
}
