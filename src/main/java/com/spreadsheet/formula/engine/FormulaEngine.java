package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.FormulaSyntaxException;
import com.spreadsheet.formula.exceptions.MalformedReferenceException;
import com.spreadsheet.formula.exceptions.VersionNotFoundException;
import com.spreadsheet.formula.functions.FunctionLibrary;
import com.spreadsheet.formula.graph.DependencyGraph;
import com.spreadsheet.formula.models.*;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.parser.ast.Formula;
import com.spreadsheet.formula.references.ReferenceResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Formula engine of a single sheet. Owns the cells, the dependency graph and the history.
 * <p>
 * Every edit runs to completion before the call returns: parse, graph update,
 * recalculation of the affected cells, history commit. Callers never see a
 * partially recalculated sheet. Not thread-safe: concurrent callers must serialize
 * their calls (see {@code SheetService}).
 */
public class FormulaEngine {

    private static final Logger log = LogManager.getLogger(FormulaEngine.class);

    static final String NEW_SHEET = "New sheet";
    static final String CELL_EDIT = "Cell edit";
    static final String CELL_CLEARED = "Cell cleared";
    static final String SHEET_LOADED = "Sheet loaded";
    static final String VERSION_RESTORED = "Restored from version history";

    private final Sheet sheet;
    private final ReferenceResolver resolver;
    private final FormulaParser parser;
    private final DependencyGraph graph = new DependencyGraph();
    private final RecalculationScheduler scheduler;
    private final HistoryLog history;

    public FormulaEngine(SheetBounds bounds) {
        this(bounds, 0);
    }

    /**
     * @param historyLimit how many versions to keep; 0 keeps all of them
     */
    public FormulaEngine(SheetBounds bounds, int historyLimit) {
        this.sheet = new Sheet(bounds);
        this.resolver = new ReferenceResolver(bounds);
        this.parser = new FormulaParser(resolver);
        this.scheduler = new RecalculationScheduler(graph, new FunctionLibrary());
        this.history = new HistoryLog(historyLimit);
        history.commit(SheetSnapshot.of(sheet), NEW_SHEET);
    }

    public SheetBounds getBounds() {
        return sheet.getBounds();
    }

    public ReferenceResolver getResolver() {
        return resolver;
    }

    /**
     * Sets a cell's raw input (a literal, a formula starting with '=', or "" to clear it)
     * with these steps:
     * 1) Parse a formula; on a syntax error mark the cell and stop.
     * 2) Replace the cell's dependency edges; on a cycle restore the cell, mark it and stop.
     * 3) Recalculate the cell and everything that depends on it, in topological order.
     * 4) Commit a history entry.
     *
     * @throws MalformedReferenceException if the coordinate is outside the sheet
     */
    public EditResult applyEdit(Coordinate coordinate, String rawInput) {
        String input = rawInput == null ? "" : rawInput;
        return edit(coordinate, input, input.isEmpty() ? CELL_CLEARED : CELL_EDIT);
    }

    public EditResult clearCell(Coordinate coordinate) {
        return edit(coordinate, "", CELL_CLEARED);
    }

    private EditResult edit(Coordinate coordinate, String input, String description) {
        requireInBounds(coordinate);
        Cell existing = sheet.getCell(coordinate);

        if (Cell.isFormulaInput(input)) {
            Formula formula;
            try {
                formula = parser.parseInput(input);
            } catch (FormulaSyntaxException e) {
                return rejectSyntax(coordinate, input, existing, e);
            }
            try {
                graph.setFormula(coordinate, formula);
            } catch (CircularReferenceException e) {
                // The graph has already put the old edges back
                return rejectCycle(coordinate, existing, e);
            }
            Cell cell = existing != null ? existing : new Cell(coordinate, input);
            cell.setRawInput(input);
            cell.setFormula(formula);
            sheet.putCell(cell);
        } else {
            graph.removeFormula(coordinate);
            if (input.isEmpty()) {
                sheet.removeCell(coordinate);
            } else {
                Cell cell = existing != null ? existing : new Cell(coordinate, input);
                cell.setRawInput(input);
                cell.setFormula(null);
                cell.setComputedValue(input);
                sheet.putCell(cell);
            }
        }

        NavigableSet<Coordinate> affected = graph.affectedBy(coordinate);
        affected.add(coordinate);
        scheduler.recalculate(sheet, affected);

        HistoryEntry entry = history.commit(SheetSnapshot.of(sheet), description);
        log.debug("{} {} recalculated {} cells, version {}", description, coordinate, affected.size(), entry.getSequence());

        Map<Coordinate, CellValue> updated = new LinkedHashMap<>();
        for (Coordinate c : affected) {
            updated.put(c, cellValue(c));
        }
        return new EditResult(Collections.unmodifiableMap(updated), entry.getSequence(), true);
    }

    /**
     * The cell keeps its last value and loses its formula and edges; no other cell changes.
     */
    private EditResult rejectSyntax(Coordinate coordinate, String input, Cell existing, FormulaSyntaxException e) {
        log.debug("Syntax error in {}: {}", coordinate, e.getMessage());
        Cell cell = existing != null ? existing : new Cell(coordinate, input);
        graph.removeFormula(coordinate);
        cell.setRawInput(input);
        cell.setFormula(null);
        cell.setErrorState(ErrorCode.FORMULA_SYNTAX_ERROR);
        sheet.putCell(cell);
        return rejected(coordinate, cell);
    }

    /**
     * The cell keeps its previous input, formula and value, only the error is recorded.
     */
    private EditResult rejectCycle(Coordinate coordinate, Cell existing, CircularReferenceException e) {
        log.warn("Rejected edit of {}: {}", coordinate, e.getMessage());
        Cell cell = existing != null ? existing : new Cell(coordinate, "");
        cell.setErrorState(ErrorCode.CIRCULAR_REFERENCE);
        sheet.putCell(cell);
        return rejected(coordinate, cell);
    }

    private EditResult rejected(Coordinate coordinate, Cell cell) {
        long token = history.current().map(HistoryEntry::getSequence).orElse(0L);
        return new EditResult(Collections.singletonMap(coordinate, cell.toCellValue()), token, false);
    }

    /**
     * Replaces the whole sheet, rebuilds the graph and recalculates every formula.
     * Coordinates are checked before anything changes.
     *
     * @throws MalformedReferenceException if any coordinate is outside the sheet
     */
    public LoadResult loadSheet(Map<Coordinate, String> rawInputs) {
        return load(rawInputs, SHEET_LOADED);
    }

    private LoadResult load(Map<Coordinate, String> rawInputs, String description) {
        for (Coordinate coordinate : rawInputs.keySet()) {
            requireInBounds(coordinate);
        }
        rebuild(rawInputs);
        return commitLoad(description);
    }

    private LoadResult commitLoad(String description) {
        List<CellError> errors = errors();
        HistoryEntry entry = history.commit(SheetSnapshot.of(sheet), description);
        log.debug("{}: {} cells, {} errors, version {}", description, sheet.getCells().size(), errors.size(), entry.getSequence());
        return new LoadResult(values(), errors);
    }

    private void rebuild(Map<Coordinate, String> rawInputs) {
        sheet.clear();
        graph.clear();

        // 1) Create every cell, parsing formulas
        for (Map.Entry<Coordinate, String> entry : new TreeMap<>(rawInputs).entrySet()) {
            String input = entry.getValue();
            if (input == null || input.isEmpty()) {
                continue;
            }
            Cell cell = new Cell(entry.getKey(), input);
            if (cell.isFormulaInput()) {
                try {
                    cell.setFormula(parser.parseInput(input));
                } catch (FormulaSyntaxException e) {
                    log.debug("Syntax error in {}: {}", entry.getKey(), e.getMessage());
                    cell.setErrorState(ErrorCode.FORMULA_SYNTAX_ERROR);
                }
            } else {
                cell.setComputedValue(input);
            }
            sheet.putCell(cell);
        }

        // 2) Install edges row-major; the formula that would close a cycle is dropped
        for (Cell cell : sheet.getCells()) {
            if (!cell.hasFormula()) {
                continue;
            }
            try {
                graph.setFormula(cell.getCoordinate(), cell.getFormula());
            } catch (CircularReferenceException e) {
                log.warn("Rejected formula of {} while loading: {}", cell.getCoordinate(), e.getMessage());
                cell.setFormula(null);
                cell.setErrorState(ErrorCode.CIRCULAR_REFERENCE);
            }
        }

        // 3) Everything is affected
        scheduler.recalculateAll(sheet);
    }

    /**
     * Puts the sheet back into the exact state a snapshot recorded: the raw inputs
     * rebuild formulas and edges, then every recorded value and error flag is
     * written back. A formula that no longer parses keeps the last good value it had,
     * and an empty cell flagged by a rejected edit is recreated.
     */
    private void restore(SheetSnapshot snapshot) {
        rebuild(snapshot.getRawInputs());
        for (Map.Entry<Coordinate, CellValue> entry : snapshot.getCells().entrySet()) {
            Cell cell = sheet.getCell(entry.getKey());
            if (cell == null) {
                cell = new Cell(entry.getKey(), "");
                sheet.putCell(cell);
            }
            cell.setComputedValue(entry.getValue().getValue());
            cell.setErrorState(entry.getValue().getError());
        }
    }

    // Cells in an error state, row-major
    private List<CellError> errors() {
        List<CellError> errors = new ArrayList<>();
        for (Cell cell : sheet.getCells()) {
            if (cell.getErrorState() != null) {
                errors.add(new CellError(cell.getCoordinate(), cell.getErrorState()));
            }
        }
        return errors;
    }

    /**
     * Moves one version back and applies it. Empty at the oldest version.
     */
    public Optional<HistoryEntry> undo() {
        Optional<HistoryEntry> entry = history.undo();
        entry.ifPresent(this::apply);
        return entry;
    }

    /**
     * Moves one version forward and applies it. Empty at the newest version.
     */
    public Optional<HistoryEntry> redo() {
        Optional<HistoryEntry> entry = history.redo();
        entry.ifPresent(this::apply);
        return entry;
    }

    private void apply(HistoryEntry entry) {
        log.debug("Moved to version {} ({})", entry.getSequence(), entry.getDescription());
        restore(entry.getSnapshot());
    }

    /**
     * Loads an earlier version as a new edit, so the restore itself can be undone.
     *
     * @throws VersionNotFoundException if the version is not in the history
     */
    public LoadResult restoreVersion(long sequence) {
        HistoryEntry entry = history.find(sequence)
                .orElseThrow(() -> new VersionNotFoundException("Version not found: " + sequence));
        restore(entry.getSnapshot());
        return commitLoad(VERSION_RESTORED);
    }

    public List<HistoryEntry> history() {
        return history.entries();
    }

    public Optional<HistoryEntry> currentVersion() {
        return history.current();
    }

    /**
     * The value shown in a cell: its error token while in error, otherwise its computed value.
     */
    public String getValue(Coordinate coordinate) {
        requireInBounds(coordinate);
        Cell cell = sheet.getCell(coordinate);
        return cell == null ? "" : cell.getShownValue();
    }

    /**
     * The formula text (with its leading '=') if the cell's input is a formula.
     */
    public Optional<String> getFormula(Coordinate coordinate) {
        requireInBounds(coordinate);
        Cell cell = sheet.getCell(coordinate);
        if (cell == null || !cell.isFormulaInput()) {
            return Optional.empty();
        }
        return Optional.of(cell.getRawInput());
    }

    public CellValue cellValue(Coordinate coordinate) {
        requireInBounds(coordinate);
        Cell cell = sheet.getCell(coordinate);
        return cell == null ? new CellValue("", null) : cell.toCellValue();
    }

    public String getRawInput(Coordinate coordinate) {
        requireInBounds(coordinate);
        Cell cell = sheet.getCell(coordinate);
        return cell == null ? "" : cell.getRawInput();
    }

    /**
     * Shown value of every present cell, row-major.
     */
    public Map<Coordinate, String> values() {
        Map<Coordinate, String> values = new LinkedHashMap<>();
        for (Cell cell : sheet.getCells()) {
            values.put(cell.getCoordinate(), cell.getShownValue());
        }
        return values;
    }

    public SortedMap<Coordinate, SortedSet<Coordinate>> forwardDependencies() {
        return graph.forwardView();
    }

    public SortedMap<Coordinate, SortedSet<Coordinate>> reverseDependencies() {
        return graph.reverseView();
    }

    // Package-private for tests that check graph invariants
    DependencyGraph graph() {
        return graph;
    }

    private void requireInBounds(Coordinate coordinate) {
        if (coordinate == null) {
            throw new MalformedReferenceException(null, "Missing coordinate");
        }
        if (!sheet.getBounds().contains(coordinate)) {
            throw new MalformedReferenceException(coordinate.toString(),
                    "Coordinate " + coordinate + " is outside the " + sheet.getBounds() + " sheet");
        }
    }
}
