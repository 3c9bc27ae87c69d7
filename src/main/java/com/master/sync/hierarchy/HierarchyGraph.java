package com.master.sync.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed acyclic graph of organizational units, edge {@code parent -> child}.
 * Nodes live in an arena keyed by org code; parent and child adjacency is kept in index maps
 * in node insertion order, which is also the tie-break order of every topological sort.
 *
 * <p>Instances are built once with {@link #build(Collection)} and are read-only afterward.</p>
 */
public final class HierarchyGraph {
    private static final Logger log = LoggerFactory.getLogger(HierarchyGraph.class);

    private final Map<String, OrgNode> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> parents = new HashMap<>();
    private final Map<String, Set<String>> children = new HashMap<>();
    private final Map<String, Integer> insertionOrder = new HashMap<>();

    private HierarchyGraph() {
    }

    /**
     * Builds the graph: one node per record and one edge per present parent code.
     * A record repeating a code overwrites the node's name and rank. A parent code with no
     * record of its own becomes a placeholder node without name or rank.
     *
     * @throws CyclicHierarchyException if the parent relation contains a cycle
     */
    public static HierarchyGraph build(Collection<OrgRecord> records) {
        HierarchyGraph graph = new HierarchyGraph();
        for (OrgRecord record : records) {
            graph.putNode(new OrgNode(record.code(), record.name(), record.rank(), false));
            if (record.parentCode() != null) {
                if (!graph.nodes.containsKey(record.parentCode())) {
                    graph.putNode(OrgNode.placeholder(record.parentCode()));
                }
                graph.addEdge(record.parentCode(), record.code());
            }
        }

        List<String> placeholders = graph.nodes.values().stream()
                .filter(OrgNode::placeholder)
                .map(OrgNode::code)
                .toList();
        if (!placeholders.isEmpty()) {
            log.warn("org.graph.unknownParents codes={}", placeholders);
        }

        List<String> order = graph.topologicalOrder(graph.nodes.keySet());
        if (order.size() != graph.nodes.size()) {
            Set<String> cyclic = new LinkedHashSet<>(graph.nodes.keySet());
            cyclic.removeAll(order);
            throw new CyclicHierarchyException("Organization hierarchy contains a cycle involving " + cyclic);
        }
        log.info("org.graph.built nodes={} roots={}", graph.nodes.size(), graph.roots().size());
        return graph;
    }

    public boolean contains(String code) {
        return nodes.containsKey(code);
    }

    /**
     * Returns the node for a code, or null if absent.
     */
    public OrgNode node(String code) {
        return nodes.get(code);
    }

    public int size() {
        return nodes.size();
    }

    public Collection<OrgNode> nodes() {
        return nodes.values();
    }

    /**
     * Ancestors of {@code code}, root first, excluding {@code code} itself.
     * An unknown code is logged and yields an empty list.
     */
    public List<String> ancestorsTopological(String code) {
        if (!nodes.containsKey(code)) {
            log.error("org.graph.unknownCode code={}", code);
            return List.of();
        }
        Set<String> ancestors = collect(code, parents);
        return topologicalOrder(ancestors);
    }

    /**
     * All units below {@code code}, in topological order. An unknown code is logged and
     * yields an empty list.
     */
    public List<String> descendants(String code) {
        if (!nodes.containsKey(code)) {
            log.error("org.graph.unknownCode code={}", code);
            return List.of();
        }
        return topologicalOrder(collect(code, children));
    }

    /**
     * Units without a parent, in insertion order.
     */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String code : nodes.keySet()) {
            if (parents.getOrDefault(code, Set.of()).isEmpty()) {
                roots.add(code);
            }
        }
        return roots;
    }

    private void putNode(OrgNode node) {
        insertionOrder.putIfAbsent(node.code(), insertionOrder.size());
        nodes.put(node.code(), node);
    }

    private void addEdge(String parent, String child) {
        children.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
        parents.computeIfAbsent(child, k -> new LinkedHashSet<>()).add(parent);
    }

    private static Set<String> collect(String start, Map<String, Set<String>> adjacency) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            for (String next : adjacency.getOrDefault(stack.pop(), Set.of())) {
                if (!next.equals(start) && seen.add(next)) {
                    stack.push(next);
                }
            }
        }
        return seen;
    }

    /**
     * Kahn's algorithm over the subgraph induced by {@code subset}. The result is shorter
     * than the subset when the subgraph contains a cycle.
     */
    private List<String> topologicalOrder(Collection<String> subset) {
        List<String> ordered = new ArrayList<>(subset);
        ordered.sort((a, b) -> Integer.compare(insertionOrder.get(a), insertionOrder.get(b)));
        Set<String> members = new LinkedHashSet<>(ordered);

        Map<String, Integer> inDegree = new HashMap<>();
        for (String code : ordered) {
            int degree = 0;
            for (String parent : parents.getOrDefault(code, Set.of())) {
                if (members.contains(parent)) {
                    degree++;
                }
            }
            inDegree.put(code, degree);
        }

        Deque<String> queue = new ArrayDeque<>();
        for (String code : ordered) {
            if (inDegree.get(code) == 0) {
                queue.add(code);
            }
        }

        List<String> result = new ArrayList<>(ordered.size());
        while (!queue.isEmpty()) {
            String code = queue.poll();
            result.add(code);
            for (String child : children.getOrDefault(code, Set.of())) {
                if (members.contains(child) && inDegree.merge(child, -1, Integer::sum) == 0) {
                    queue.add(child);
                }
            }
        }
        return result;
    }
}
