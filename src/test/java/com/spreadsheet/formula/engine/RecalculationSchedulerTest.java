package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.functions.FunctionLibrary;
import com.spreadsheet.formula.graph.DependencyGraph;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.models.SheetBounds;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.parser.ast.Formula;
import com.spreadsheet.formula.references.ReferenceResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class RecalculationSchedulerTest {

    private final SheetBounds bounds = new SheetBounds(26, 100);
    private final ReferenceResolver resolver = new ReferenceResolver(bounds);
    private final FormulaParser parser = new FormulaParser(resolver);

    private DependencyGraph graph;
    private RecalculationScheduler scheduler;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
        scheduler = new RecalculationScheduler(graph, new FunctionLibrary());
        sheet = new Sheet(bounds);
    }

    private Coordinate at(String address) {
        return resolver.parseAddress(address);
    }

    private void literal(String address, String value) {
        Cell cell = new Cell(at(address), value);
        cell.setComputedValue(value);
        sheet.putCell(cell);
    }

    private void formula(String address, String source) {
        Formula formula = parser.parse(source);
        Cell cell = new Cell(at(address), "=" + source);
        cell.setFormula(formula);
        sheet.putCell(cell);
        graph.setFormula(at(address), formula);
    }

    /**
     * Every cell comes after its precedents, even when its coordinate sorts first.
     */
    @Test
    void testPrecedentsComeFirst() {
        formula("A1", "B2");
        formula("B2", "C3");
        formula("C3", "D4");
        List<Coordinate> order = scheduler.order(Set.of(at("A1"), at("B2"), at("C3"), at("D4")));
        assertEquals(Arrays.asList(at("D4"), at("C3"), at("B2"), at("A1")), order);
    }

    /**
     * Independent cells are ordered row-major.
     */
    @Test
    void testTiesBrokenRowMajor() {
        formula("B1", "A5");
        formula("A2", "A5");
        formula("C1", "A5");
        List<Coordinate> order = scheduler.order(Set.of(at("A5"), at("C1"), at("A2"), at("B1")));
        assertEquals(Arrays.asList(at("A5"), at("B1"), at("C1"), at("A2")), order);
    }

    /**
     * Precedents outside the scope don't hold anything back.
     */
    @Test
    void testOrderIgnoresPrecedentsOutsideScope() {
        formula("B1", "SUM(A1, A2)");
        formula("C1", "B1");
        assertEquals(Arrays.asList(at("B1"), at("C1")), scheduler.order(Set.of(at("C1"), at("B1"))));
    }

    /**
     * A chain declared in reverse still settles in one pass.
     */
    @Test
    void testSinglePassRecalculation() {
        literal("A1", "1");
        formula("D1", "SUM(C1, 1)");
        formula("C1", "SUM(B1, 1)");
        formula("B1", "SUM(A1, 1)");

        scheduler.recalculateAll(sheet);
        assertEquals("4", sheet.valueAt(at("D1")));

        literal("A1", "10");
        Set<Coordinate> affected = new TreeSet<>(graph.affectedBy(at("A1")));
        affected.add(at("A1"));
        List<Coordinate> order = scheduler.recalculate(sheet, affected);
        assertEquals(Arrays.asList(at("A1"), at("B1"), at("C1"), at("D1")), order);
        assertEquals("11", sheet.valueAt(at("B1")));
        assertEquals("13", sheet.valueAt(at("D1")));
    }

    @Test
    void testDiamond() {
        literal("A1", "2");
        formula("B1", "SUM(A1, A1)");
        formula("B2", "MAX(A1, 5)");
        formula("C1", "SUM(B1, B2, A1)");
        scheduler.recalculateAll(sheet);
        assertEquals("11", sheet.valueAt(at("C1")));

        literal("A1", "7");
        scheduler.recalculateAll(sheet);
        assertEquals("28", sheet.valueAt(at("C1")));
    }

    @Test
    void testEmptyScope() {
        assertTrue(scheduler.order(Set.of()).isEmpty());
        assertTrue(scheduler.recalculateAll(sheet).isEmpty());
    }
}
