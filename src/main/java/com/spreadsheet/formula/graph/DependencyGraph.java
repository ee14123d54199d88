package com.spreadsheet.formula.graph;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.parser.ast.Formula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Directed graph of formula dependencies between cells:
 * - forward adjacency: cell -> the cells its formula reads (its precedents)
 * - reverse adjacency: cell -> the cells whose formulas read it (its dependents)
 * The graph is kept acyclic: an edit that would close a cycle is rolled back.
 * Not thread-safe; the owning engine serializes access.
 */
public class DependencyGraph {

    private static final Logger log = LogManager.getLogger(DependencyGraph.class);

    private final Map<Coordinate, Set<Coordinate>> precedents = new HashMap<>();
    private final Map<Coordinate, Set<Coordinate>> dependents = new HashMap<>();

    /**
     * Replaces the precedents of a cell with those read by its new formula.
     */
    public void setFormula(Coordinate cell, Formula formula) {
        setPrecedents(cell, formula.getPrecedents());
    }

    /**
     * Replaces all precedent edges of 'cell' with the given set, then checks for a cycle.
     * On a cycle the previous edges are put back and the cycle is reported.
     *
     * @throws CircularReferenceException naming the cycle, starting and ending at 'cell'
     */
    public void setPrecedents(Coordinate cell, Collection<Coordinate> newPrecedents) {
        Set<Coordinate> previous = new HashSet<>(precedents.getOrDefault(cell, Collections.emptySet()));

        replaceEdges(cell, newPrecedents);

        List<Coordinate> cycle = findCycleThrough(cell);
        if (cycle != null) {
            replaceEdges(cell, previous);
            log.debug("Rejected edges of {}: cycle {}", cell, cycle);
            throw new CircularReferenceException(cycle);
        }
    }

    /**
     * Drops every precedent edge of 'cell', e.g. when it no longer holds a formula.
     */
    public void removeFormula(Coordinate cell) {
        replaceEdges(cell, Collections.emptySet());
    }

    public void clear() {
        precedents.clear();
        dependents.clear();
    }

    /**
     * Every cell that transitively depends on 'cell', found by walking the reverse edges.
     * The cell itself is not included.
     */
    public NavigableSet<Coordinate> affectedBy(Coordinate cell) {
        NavigableSet<Coordinate> affected = new TreeSet<>();
        Deque<Coordinate> queue = new ArrayDeque<>();
        queue.add(cell);
        while (!queue.isEmpty()) {
            Coordinate current = queue.poll();
            for (Coordinate dependent : dependentsOf(current)) {
                if (!dependent.equals(cell) && affected.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return affected;
    }

    public Set<Coordinate> precedentsOf(Coordinate cell) {
        return Collections.unmodifiableSet(precedents.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<Coordinate> dependentsOf(Coordinate cell) {
        return Collections.unmodifiableSet(dependents.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Copy of the forward adjacency (cell -> precedents), row-major.
     */
    public SortedMap<Coordinate, SortedSet<Coordinate>> forwardView() {
        return copyOf(precedents);
    }

    /**
     * Copy of the reverse adjacency (cell -> dependents), row-major.
     */
    public SortedMap<Coordinate, SortedSet<Coordinate>> reverseView() {
        return copyOf(dependents);
    }

    /**
     * True if some chain of precedent edges leads back to where it started.
     * The graph maintains itself acyclic, so this only serves as a check.
     */
    public boolean hasCycle() {
        for (Coordinate cell : precedents.keySet()) {
            if (findCycleThrough(cell) != null) {
                return true;
            }
        }
        return false;
    }

    private void replaceEdges(Coordinate cell, Collection<Coordinate> newPrecedents) {
        Set<Coordinate> old = precedents.remove(cell);
        if (old != null) {
            // Remove 'cell' from the reverse adjacency of any cells it used to read
            for (Coordinate target : old) {
                Set<Coordinate> readers = dependents.get(target);
                if (readers != null) {
                    readers.remove(cell);
                    if (readers.isEmpty()) {
                        dependents.remove(target);
                    }
                }
            }
        }
        if (newPrecedents.isEmpty()) {
            return;
        }
        precedents.put(cell, new HashSet<>(newPrecedents));
        for (Coordinate target : newPrecedents) {
            dependents.computeIfAbsent(target, k -> new HashSet<>()).add(cell);
        }
    }

    /**
     * Depth-first search from 'start' along precedent edges.
     * Returns the path start -> ... -> start if one exists, else null.
     * Iterative so that long formula chains can't overflow the stack.
     */
    private List<Coordinate> findCycleThrough(Coordinate start) {
        Deque<Coordinate> path = new ArrayDeque<>();
        Deque<Iterator<Coordinate>> pending = new ArrayDeque<>();
        Set<Coordinate> visited = new HashSet<>();

        path.push(start);
        pending.push(sortedPrecedents(start).iterator());
        visited.add(start);

        while (!pending.isEmpty()) {
            Iterator<Coordinate> it = pending.peek();
            if (!it.hasNext()) {
                pending.pop();
                path.pop();
                continue;
            }
            Coordinate next = it.next();
            if (next.equals(start)) {
                List<Coordinate> cycle = new ArrayList<>(path);
                Collections.reverse(cycle);
                cycle.add(start);
                return cycle;
            }
            if (visited.add(next) && precedents.containsKey(next)) {
                path.push(next);
                pending.push(sortedPrecedents(next).iterator());
            }
        }
        return null;
    }

    private Collection<Coordinate> sortedPrecedents(Coordinate cell) {
        return new TreeSet<>(precedents.getOrDefault(cell, Collections.emptySet()));
    }

    private static SortedMap<Coordinate, SortedSet<Coordinate>> copyOf(Map<Coordinate, Set<Coordinate>> adjacency) {
        SortedMap<Coordinate, SortedSet<Coordinate>> copy = new TreeMap<>();
        for (Map.Entry<Coordinate, Set<Coordinate>> entry : adjacency.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
        }
        return Collections.unmodifiableSortedMap(copy);
    }
}
