package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.functions.FunctionLibrary;
import com.spreadsheet.formula.graph.DependencyGraph;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.models.Sheet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Orders and re-evaluates formula cells after a change.
 * <p>
 * The order is topological over the dependency graph restricted to the cells being
 * recalculated (Kahn's algorithm), so every cell is evaluated after all of its
 * precedents in the same pass and each cell is visited once. Among cells that are
 * ready at the same time the lowest row-major coordinate goes first.
 */
public class RecalculationScheduler {

    private static final Logger log = LogManager.getLogger(RecalculationScheduler.class);

    private final DependencyGraph graph;
    private final FunctionLibrary functions;

    public RecalculationScheduler(DependencyGraph graph, FunctionLibrary functions) {
        this.graph = graph;
        this.functions = functions;
    }

    /**
     * Topological order of the given cells.
     *
     * @throws IllegalStateException if the cells contain a cycle, which the graph never allows
     */
    public List<Coordinate> order(Collection<Coordinate> cells) {
        Set<Coordinate> scope = new HashSet<>(cells);

        // 1. In-degree counts only precedents that are recalculated too
        Map<Coordinate, Integer> inDegree = new HashMap<>();
        for (Coordinate cell : scope) {
            int degree = 0;
            for (Coordinate precedent : graph.precedentsOf(cell)) {
                if (scope.contains(precedent)) {
                    degree++;
                }
            }
            inDegree.put(cell, degree);
        }

        // 2. Start with the cells that wait on nothing
        PriorityQueue<Coordinate> ready = new PriorityQueue<>();
        for (Map.Entry<Coordinate, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        // 3. Release dependents as their last precedent is placed
        List<Coordinate> order = new ArrayList<>(scope.size());
        while (!ready.isEmpty()) {
            Coordinate current = ready.poll();
            order.add(current);
            for (Coordinate dependent : graph.dependentsOf(current)) {
                Integer remaining = inDegree.get(dependent);
                if (remaining == null) {
                    continue;
                }
                inDegree.put(dependent, remaining - 1);
                if (remaining - 1 == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != scope.size()) {
            throw new IllegalStateException("Cycle detected! Ordered " + order.size() + " of " + scope.size());
        }
        return order;
    }

    /**
     * Re-evaluates the formula cells among 'affected' in topological order.
     * Cells without a formula are placed in the order but keep their value.
     *
     * @return the evaluation order
     */
    public List<Coordinate> recalculate(Sheet sheet, Collection<Coordinate> affected) {
        List<Coordinate> order = order(affected);
        int evaluated = 0;
        for (Coordinate coordinate : order) {
            Cell cell = sheet.getCell(coordinate);
            if (cell != null && cell.hasFormula()) {
                // Precedents earlier in the order already hold their new values
                cell.setComputedValue(functions.evaluate(cell.getFormula(), sheet));
                evaluated++;
            }
        }
        log.debug("Recalculated {} formula cells out of {} affected", evaluated, order.size());
        return order;
    }

    /**
     * Re-evaluates every formula cell of the sheet.
     */
    public List<Coordinate> recalculateAll(Sheet sheet) {
        List<Coordinate> formulaCells = new ArrayList<>();
        for (Cell cell : sheet.getCells()) {
            if (cell.hasFormula()) {
                formulaCells.add(cell.getCoordinate());
            }
        }
        return recalculate(sheet, formulaCells);
    }
}
