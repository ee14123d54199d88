package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.SheetProperties;
import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.exceptions.MalformedReferenceException;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.models.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Hosts one formula engine per sheet and translates between
 * A1-style addresses and the engine's coordinates.
 * Each sheet has its own read/write lock: edits, loads and history moves are
 * applied one at a time, reads never see a half-finished recalculation.
 */
@Service
public class SheetService {

    private static final Logger log = LogManager.getLogger(SheetService.class);

    // All sheets live here in memory; persistence is out of scope
    private final Map<Long, ManagedSheet> sheets = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);
    private final SheetProperties properties;

    public SheetService(SheetProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an empty sheet and returns its ID.
     */
    public long createSheet() {
        long id = idGenerator.getAndIncrement();
        FormulaEngine engine = new FormulaEngine(properties.toBounds(), properties.getHistoryLimit());
        sheets.put(id, new ManagedSheet(engine));
        log.info("Created sheet {} ({})", id, engine.getBounds());
        return id;
    }

    /**
     * Creates a sheet pre-filled with the given raw inputs. An invalid address
     * fails the whole call and no sheet is left behind.
     */
    public long createSheet(Map<String, String> cells) {
        long id = createSheet();
        if (cells != null && !cells.isEmpty()) {
            try {
                loadSheet(id, cells);
            } catch (RuntimeException e) {
                sheets.remove(id);
                throw e;
            }
        }
        return id;
    }

    /**
     * Sets a cell's raw input and returns the recalculated cells.
     * A formula error is reported in the response, not thrown.
     */
    public EditResponse setCellValue(long sheetId, String address, String rawInput) {
        return write(sheetId, engine -> toResponse(engine.applyEdit(engine.getResolver().parseAddress(address), rawInput)));
    }

    public EditResponse clearCell(long sheetId, String address) {
        return write(sheetId, engine -> toResponse(engine.clearCell(engine.getResolver().parseAddress(address))));
    }

    /**
     * Replaces the whole sheet with the given raw inputs.
     * Two addresses naming the same cell (e.g. "a1" and "A1") fail the whole call.
     */
    public LoadResponse loadSheet(long sheetId, Map<String, String> cells) {
        return write(sheetId, engine -> {
            Map<Coordinate, String> inputs = new HashMap<>();
            for (Map.Entry<String, String> entry : cells.entrySet()) {
                Coordinate coordinate = engine.getResolver().parseAddress(entry.getKey());
                if (inputs.containsKey(coordinate)) {
                    throw new MalformedReferenceException(entry.getKey(),
                            "Duplicate address " + entry.getKey() + " for cell " + coordinate);
                }
                inputs.put(coordinate, entry.getValue());
            }
            return toResponse(engine.loadSheet(inputs));
        });
    }

    /**
     * Returns address -> shown value for every non-empty cell, row-major.
     */
    public Map<String, String> getSheetData(long sheetId) {
        return read(sheetId, engine -> byAddress(engine.values()));
    }

    public CellDetails getCell(long sheetId, String address) {
        return read(sheetId, engine -> {
            Coordinate coordinate = engine.getResolver().parseAddress(address);
            CellValue value = engine.cellValue(coordinate);
            return new CellDetails(coordinate.toString(),
                    engine.getRawInput(coordinate),
                    engine.getFormula(coordinate).orElse(null),
                    engine.getValue(coordinate),
                    value.getError());
        });
    }

    /**
     * Steps one version back; empty when there is nothing to undo.
     */
    public Optional<Map<String, String>> undo(long sheetId) {
        return write(sheetId, engine -> engine.undo().map(entry -> byAddress(engine.values())));
    }

    public Optional<Map<String, String>> redo(long sheetId) {
        return write(sheetId, engine -> engine.redo().map(entry -> byAddress(engine.values())));
    }

    /**
     * Version list, newest first.
     */
    public List<VersionSummary> getHistory(long sheetId) {
        return read(sheetId, engine -> {
            long current = engine.currentVersion().map(HistoryEntry::getSequence).orElse(-1L);
            List<VersionSummary> versions = new ArrayList<>();
            for (HistoryEntry entry : engine.history()) {
                versions.add(new VersionSummary(entry.getSequence(), entry.getTimestamp(),
                        entry.getDescription(), entry.getSequence() == current));
            }
            Collections.reverse(versions);
            return versions;
        });
    }

    public LoadResponse restoreVersion(long sheetId, long sequence) {
        return write(sheetId, engine -> {
            LoadResponse response = toResponse(engine.restoreVersion(sequence));
            log.info("Sheet {} restored to version {}", sheetId, sequence);
            return response;
        });
    }

    /**
     * For each formula cell => the cells it reads.
     */
    public Map<String, List<String>> getForwardDependencies(long sheetId) {
        return read(sheetId, engine -> adjacency(engine.forwardDependencies()));
    }

    /**
     * For each referenced cell => the formula cells that read it.
     */
    public Map<String, List<String>> getReverseDependencies(long sheetId) {
        return read(sheetId, engine -> adjacency(engine.reverseDependencies()));
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private ManagedSheet getSheet(long sheetId) {
        ManagedSheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    private <T> T write(long sheetId, Function<FormulaEngine, T> action) {
        ManagedSheet sheet = getSheet(sheetId);
        return sheet.locked(sheet.lock.writeLock(), () -> action.apply(sheet.engine));
    }

    private <T> T read(long sheetId, Function<FormulaEngine, T> action) {
        ManagedSheet sheet = getSheet(sheetId);
        return sheet.locked(sheet.lock.readLock(), () -> action.apply(sheet.engine));
    }

    private static EditResponse toResponse(EditResult result) {
        Map<String, CellValue> updated = new LinkedHashMap<>();
        for (Map.Entry<Coordinate, CellValue> entry : result.getUpdatedCells().entrySet()) {
            updated.put(entry.getKey().toString(), entry.getValue());
        }
        return new EditResponse(updated, result.getHistoryToken(), result.isAccepted());
    }

    private static LoadResponse toResponse(LoadResult result) {
        Map<String, ErrorCode> errors = new LinkedHashMap<>();
        for (CellError error : result.getErrors()) {
            errors.put(error.getCoordinate().toString(), error.getCode());
        }
        return new LoadResponse(byAddress(result.getValues()), errors);
    }

    private static Map<String, String> byAddress(Map<Coordinate, String> values) {
        Map<String, String> data = new LinkedHashMap<>();
        for (Map.Entry<Coordinate, String> entry : values.entrySet()) {
            data.put(entry.getKey().toString(), entry.getValue());
        }
        return data;
    }

    private static Map<String, List<String>> adjacency(SortedMap<Coordinate, SortedSet<Coordinate>> graph) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<Coordinate, SortedSet<Coordinate>> entry : graph.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (Coordinate target : entry.getValue()) {
                targets.add(target.toString());
            }
            result.put(entry.getKey().toString(), targets);
        }
        return result;
    }

    /**
     * An engine plus the lock that serializes access to it.
     */
    private static final class ManagedSheet {
        private final FormulaEngine engine;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        ManagedSheet(FormulaEngine engine) {
            this.engine = engine;
        }

        <T> T locked(Lock which, Supplier<T> action) {
            which.lock();
            try {
                return action.get();
            } finally {
                which.unlock();
            }
        }
    }
}
