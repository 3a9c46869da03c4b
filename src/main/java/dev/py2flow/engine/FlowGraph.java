package dev.py2flow.engine;

import dev.py2flow.model.Dataset;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Read-only graph view of a flow: ordering, cycles, connectivity and
 * neighbourhood queries.
 *
 * <p>The view snapshots the flow when created; build a new one after the flow
 * changes.</p>
 */
public final class FlowGraph {

    private enum Colour { WHITE, GREY, BLACK }

    private final Flow flow;
    private final Map<String, List<Recipe>> producers = new HashMap<>();
    private final Map<String, List<Recipe>> consumers = new HashMap<>();

    public FlowGraph(Flow flow) {
        this.flow = flow;
        for (Recipe recipe : flow.recipes()) {
            for (String output : recipe.outputs()) {
                producers.computeIfAbsent(output, k -> new ArrayList<>()).add(recipe);
            }
            for (String input : new LinkedHashSet<>(recipe.inputs())) {
                consumers.computeIfAbsent(input, k -> new ArrayList<>()).add(recipe);
            }
        }
    }

    // ---- neighbourhood ----

    /** The recipe producing a dataset (the first one, if a malformed flow has several). */
    public Optional<Recipe> producer(String dataset) {
        List<Recipe> list = producers.get(dataset);
        return list == null ? Optional.empty() : Optional.of(list.get(0));
    }

    public List<Recipe> producers(String dataset) {
        return Collections.unmodifiableList(producers.getOrDefault(dataset, List.of()));
    }

    /** Recipes reading a dataset, in creation order. */
    public List<Recipe> consumers(String dataset) {
        return Collections.unmodifiableList(consumers.getOrDefault(dataset, List.of()));
    }

    /** Datasets without a producer. */
    public List<Dataset> roots() {
        return flow.datasets().stream().filter(d -> !producers.containsKey(d.name())).toList();
    }

    /** Datasets without a consumer. */
    public List<Dataset> leaves() {
        return flow.datasets().stream().filter(d -> !consumers.containsKey(d.name())).toList();
    }

    /** Every recipe the given recipe transitively depends on, in creation order. */
    public List<Recipe> upstream(String recipeName) {
        Recipe start = requireRecipe(recipeName);
        Set<String> seen = new HashSet<>();
        var queue = new ArrayDeque<Recipe>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Recipe current = queue.poll();
            for (String input : current.inputs()) {
                for (Recipe producer : producers(input)) {
                    if (seen.add(producer.name())) {
                        queue.add(producer);
                    }
                }
            }
        }
        seen.remove(recipeName);
        return inCreationOrder(seen);
    }

    /** Every recipe that transitively depends on the given recipe, in creation order. */
    public List<Recipe> downstream(String recipeName) {
        Recipe start = requireRecipe(recipeName);
        Set<String> seen = new HashSet<>();
        var queue = new ArrayDeque<Recipe>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Recipe current = queue.poll();
            for (String output : current.outputs()) {
                for (Recipe consumer : consumers(output)) {
                    if (seen.add(consumer.name())) {
                        queue.add(consumer);
                    }
                }
            }
        }
        seen.remove(recipeName);
        return inCreationOrder(seen);
    }

    /**
     * Shortest directed path between two datasets, as alternating dataset and
     * recipe names. Empty when {@code to} is not reachable.
     */
    public List<String> path(String from, String to) {
        requireDataset(from);
        requireDataset(to);
        if (from.equals(to)) {
            return List.of(from);
        }
        Map<String, String> parents = new HashMap<>();
        Map<String, String> via = new HashMap<>();
        var queue = new ArrayDeque<String>();
        queue.add(from);
        parents.put(from, null);
        while (!queue.isEmpty()) {
            String dataset = queue.poll();
            for (Recipe recipe : consumers(dataset)) {
                for (String output : recipe.outputs()) {
                    if (!parents.containsKey(output)) {
                        parents.put(output, dataset);
                        via.put(output, recipe.name());
                        if (output.equals(to)) {
                            return unwind(parents, via, to);
                        }
                        queue.add(output);
                    }
                }
            }
        }
        return List.of();
    }

    private static List<String> unwind(Map<String, String> parents, Map<String, String> via, String to) {
        var path = new ArrayList<String>();
        String current = to;
        while (current != null) {
            path.add(current);
            if (via.containsKey(current)) {
                path.add(via.get(current));
            }
            current = parents.get(current);
        }
        Collections.reverse(path);
        return path;
    }

    // ---- ordering ----

    /**
     * Recipes in dependency order; ties are broken by creation order.
     *
     * @throws CycleDetectedException when the recipes cannot all be ordered
     */
    public List<Recipe> topologicalSort() {
        Map<String, Set<String>> dependents = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (Recipe recipe : flow.recipes()) {
            Set<String> dependencies = new HashSet<>();
            for (String input : recipe.inputs()) {
                producers(input).forEach(p -> dependencies.add(p.name()));
            }
            inDegree.put(recipe.name(), dependencies.size());
            for (String dependency : dependencies) {
                dependents.computeIfAbsent(dependency, k -> new HashSet<>()).add(recipe.name());
            }
        }
        var ready = new PriorityQueue<Recipe>(Comparator.comparingInt(r -> flow.recipePosition(r.name())));
        flow.recipes().stream().filter(r -> inDegree.get(r.name()) == 0).forEach(ready::add);
        var ordered = new ArrayList<Recipe>();
        while (!ready.isEmpty()) {
            Recipe recipe = ready.poll();
            ordered.add(recipe);
            for (String dependent : dependents.getOrDefault(recipe.name(), Set.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(requireRecipe(dependent));
                }
            }
        }
        if (ordered.size() < flow.recipes().size()) {
            throw new CycleDetectedException(detectCycles());
        }
        return ordered;
    }

    /**
     * Every cycle closed by a DFS back edge, as the list of edges of the
     * closed walk. Empty iff the flow is acyclic.
     */
    public List<List<FlowEdge>> detectCycles() {
        Map<FlowNode, Colour> colours = new HashMap<>();
        List<List<FlowEdge>> cycles = new ArrayList<>();
        var stack = new ArrayList<FlowEdge>();
        for (FlowNode node : nodes()) {
            if (colours.getOrDefault(node, Colour.WHITE) == Colour.WHITE) {
                visit(node, colours, stack, cycles);
            }
        }
        return cycles;
    }

    public boolean hasCycles() {
        return !detectCycles().isEmpty();
    }

    private void visit(FlowNode node, Map<FlowNode, Colour> colours, List<FlowEdge> stack,
                       List<List<FlowEdge>> cycles) {
        colours.put(node, Colour.GREY);
        for (FlowNode next : successors(node)) {
            var edge = new FlowEdge(node, next);
            Colour colour = colours.getOrDefault(next, Colour.WHITE);
            if (colour == Colour.WHITE) {
                stack.add(edge);
                visit(next, colours, stack, cycles);
                stack.remove(stack.size() - 1);
            } else if (colour == Colour.GREY) {
                // next is on the DFS path: the cycle runs from the edge leaving next down to node
                var cycle = new ArrayList<FlowEdge>(stack.subList(indexLeaving(stack, next), stack.size()));
                cycle.add(edge);
                cycles.add(List.copyOf(cycle));
            }
        }
        colours.put(node, Colour.BLACK);
    }

    private static int indexLeaving(List<FlowEdge> path, FlowNode node) {
        for (int i = 0; i < path.size(); i++) {
            if (path.get(i).from().equals(node)) {
                return i;
            }
        }
        return path.size();
    }

    private List<FlowNode> nodes() {
        var nodes = new ArrayList<FlowNode>();
        flow.datasets().forEach(d -> nodes.add(FlowNode.dataset(d.name())));
        flow.recipes().forEach(r -> nodes.add(FlowNode.recipe(r.name())));
        return nodes;
    }

    private List<FlowNode> successors(FlowNode node) {
        if (node.isDataset()) {
            return consumers(node.name()).stream().map(r -> FlowNode.recipe(r.name())).toList();
        }
        return requireRecipe(node.name()).outputs().stream().distinct().map(FlowNode::dataset).toList();
    }

    // ---- connectivity ----

    /**
     * Connected components of the undirected graph, ordered by their earliest
     * member in creation order.
     */
    public List<FlowComponent> findDisconnectedSubgraphs() {
        Map<FlowNode, Set<FlowNode>> neighbours = new LinkedHashMap<>();
        for (FlowNode node : nodes()) {
            neighbours.put(node, new LinkedHashSet<>());
        }
        for (Recipe recipe : flow.recipes()) {
            FlowNode recipeNode = FlowNode.recipe(recipe.name());
            List<String> touched = new ArrayList<>(recipe.inputs());
            touched.addAll(recipe.outputs());
            for (String dataset : touched) {
                FlowNode datasetNode = FlowNode.dataset(dataset);
                if (neighbours.containsKey(datasetNode)) {
                    neighbours.get(recipeNode).add(datasetNode);
                    neighbours.get(datasetNode).add(recipeNode);
                }
            }
        }
        Set<FlowNode> seen = new HashSet<>();
        var components = new ArrayList<FlowComponent>();
        for (FlowNode start : neighbours.keySet()) {
            if (!seen.add(start)) {
                continue;
            }
            Set<String> datasets = new HashSet<>();
            Set<String> recipes = new HashSet<>();
            var queue = new ArrayDeque<FlowNode>();
            queue.add(start);
            while (!queue.isEmpty()) {
                FlowNode node = queue.poll();
                (node.isDataset() ? datasets : recipes).add(node.name());
                for (FlowNode next : neighbours.get(node)) {
                    if (seen.add(next)) {
                        queue.add(next);
                    }
                }
            }
            components.add(new FlowComponent(
                flow.datasets().stream().map(Dataset::name).filter(datasets::contains).toList(),
                flow.recipes().stream().map(Recipe::name).filter(recipes::contains).toList()));
        }
        components.sort(Comparator.comparingInt(this::earliest));
        return components;
    }

    private int earliest(FlowComponent component) {
        if (!component.datasets().isEmpty()) {
            return flow.datasetPosition(component.datasets().get(0));
        }
        return flow.datasets().size() + flow.recipePosition(component.recipes().get(0));
    }

    public boolean isConnected() {
        return findDisconnectedSubgraphs().size() <= 1;
    }

    // ---- helpers ----

    private Recipe requireRecipe(String name) {
        return flow.recipe(name).orElseThrow(() -> new IllegalArgumentException("Unknown recipe: " + name));
    }

    private void requireDataset(String name) {
        if (flow.dataset(name).isEmpty()) {
            throw new IllegalArgumentException("Unknown dataset: " + name);
        }
    }

    private List<Recipe> inCreationOrder(Set<String> names) {
        return flow.recipes().stream().filter(r -> names.contains(r.name())).toList();
    }
}
