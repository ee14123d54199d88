package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.CellDetails;
import com.spreadsheet.formula.models.EditResponse;
import com.spreadsheet.formula.models.LoadResponse;
import com.spreadsheet.formula.models.VersionSummary;
import com.spreadsheet.formula.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path. Cells are addressed A1-style, e.g. /sheet/1/cell/B3.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body of raw inputs, e.g. { "A1": "1", "A2": "=SUM(A1:A1)" }.
     * Creates a new Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, String> cells) {
        long sheetId = sheetService.createSheet(cells);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}
     * Replaces every cell with the given raw inputs and recalculates the sheet.
     */
    @PutMapping("/{sheetId}")
    public ResponseEntity<LoadResponse> loadSheet(@PathVariable long sheetId,
                                                  @RequestBody Map<String, String> cells) {
        return ResponseEntity.ok(sheetService.loadSheet(sheetId, cells));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the shown value of every non-empty cell: { "A1": "1", "A2": "1", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw input (literal, or formula starting with '='); an empty body clears the cell.
     * Formula errors come back in the response with 200, so the client can show them on the cell.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<EditResponse> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawInput
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, address, rawInput));
    }

    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<EditResponse> clearCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.clearCell(sheetId, address));
    }

    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellDetails> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, address));
    }

    /**
     * POST /sheet/{sheetId}/undo
     * Returns the sheet's values after stepping back, or 204 if there is nothing to undo.
     */
    @PostMapping("/{sheetId}/undo")
    public ResponseEntity<Map<String, String>> undo(@PathVariable long sheetId) {
        return sheetService.undo(sheetId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{sheetId}/redo")
    public ResponseEntity<Map<String, String>> redo(@PathVariable long sheetId) {
        return sheetService.redo(sheetId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * GET /sheet/{sheetId}/history
     * Version list, newest first.
     */
    @GetMapping("/{sheetId}/history")
    public ResponseEntity<List<VersionSummary>> getHistory(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getHistory(sheetId));
    }

    @PostMapping("/{sheetId}/history/{sequence}/restore")
    public ResponseEntity<LoadResponse> restoreVersion(@PathVariable long sheetId, @PathVariable long sequence) {
        return ResponseEntity.ok(sheetService.restoreVersion(sheetId, sequence));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * Returns the forward dependency graph of the sheet,
     * i.e., for each formula cell => the cells it reads.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * Returns the reverse dependency graph of the sheet,
     * i.e., for each referenced cell => the formula cells that read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
