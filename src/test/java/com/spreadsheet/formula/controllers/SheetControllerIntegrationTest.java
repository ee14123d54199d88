package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.FormulaEngineApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 * The "test" profile shrinks sheets to columns A..J and rows 1..50.
 */
@SpringBootTest(
        classes = FormulaEngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port + "/sheet";
    }

    private long createSheet() {
        ResponseEntity<Long> createResponse = restTemplate.postForEntity(baseUrl, null, Long.class);
        assertEquals(HttpStatus.OK, createResponse.getStatusCode());
        Long sheetId = createResponse.getBody();
        assertNotNull(sheetId);
        return sheetId;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> putCell(long sheetId, String address, String rawInput) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        ResponseEntity<Map> response = restTemplate.exchange(baseUrl + "/" + sheetId + "/cell/" + address,
                HttpMethod.PUT, new HttpEntity<>(rawInput, headers), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getSheet(long sheetId) {
        return restTemplate.getForEntity(baseUrl + "/" + sheetId, Map.class).getBody();
    }

    /**
     * Tests creating a sheet, setting cells,
     * then trying an address outside the sheet that should fail.
     */
    @Test
    void testCreateSheetAndSetCells() {
        long sheetId = createSheet();

        putCell(sheetId, "A10", "hello");
        putCell(sheetId, "A1", "2");
        Map<String, Object> edit = putCell(sheetId, "B1", "=SUM(A1, 3)");
        assertEquals(Boolean.TRUE, edit.get("accepted"));

        // Column K is outside a 10-column sheet
        HttpClientErrorException error = assertThrows(HttpClientErrorException.class, () ->
                putCell(sheetId, "K1", "1"));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());

        Map<String, Object> data = getSheet(sheetId);
        assertEquals("hello", data.get("A10"));
        assertEquals("5", data.get("B1"));
        assertFalse(data.containsKey("K1"));
    }

    @Test
    void testCreateWithInitialCells() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"A1\": \"1\", \"A2\": \"2\", \"A3\": \"=AVERAGE(A1:A2)\"}";
        Long sheetId = restTemplate.postForEntity(baseUrl, new HttpEntity<>(body, headers), Long.class).getBody();
        assertNotNull(sheetId);

        assertEquals("1.5", getSheet(sheetId).get("A3"));
    }

    @Test
    void testUnknownSheetIsNotFound() {
        HttpClientErrorException error = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(baseUrl + "/987654", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetForwardDependencyGraph() {
        long sheetId = createSheet();

        // B1 -> C2, A1 -> B1
        putCell(sheetId, "B1", "=C2");
        putCell(sheetId, "A1", "=B1");

        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/forwardDependencies", Map.class);
        Map<String, List<String>> forwardGraph = response.getBody();
        assertNotNull(forwardGraph);

        assertEquals(Collections.singletonList("C2"), forwardGraph.get("B1"));
        assertEquals(Collections.singletonList("B1"), forwardGraph.get("A1"));
        assertFalse(forwardGraph.containsKey("C2"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetReverseDependencyGraph() {
        long sheetId = createSheet();

        // B10 -> A10, C10 -> B10
        putCell(sheetId, "B10", "=A10");
        putCell(sheetId, "C10", "=B10");

        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/reverseDependencies", Map.class);
        Map<String, List<String>> reverseGraph = response.getBody();
        assertNotNull(reverseGraph);

        assertEquals(Collections.singletonList("B10"), reverseGraph.get("A10"));
        assertEquals(Collections.singletonList("C10"), reverseGraph.get("B10"));
        assertFalse(reverseGraph.containsKey("C10"));
    }

    /**
     * Verifies partial re-evaluation:
     * C1 = MAX(A1:B1). Changing A1 re-updates C1.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testPartialReEvaluationIntegration() {
        long sheetId = createSheet();

        putCell(sheetId, "A1", "4");
        putCell(sheetId, "B1", "1");
        putCell(sheetId, "C1", "=MAX(A1:B1)");
        assertEquals("4", getSheet(sheetId).get("C1"));

        Map<String, Object> edit = putCell(sheetId, "A1", "-3");
        Map<String, Map<String, Object>> updated = (Map<String, Map<String, Object>>) edit.get("updatedCells");
        assertEquals("1", updated.get("C1").get("value"));
        assertEquals("1", getSheet(sheetId).get("C1"));
    }

    /**
     * Single-cell cycle: A10 = A10 is stored as an error on the cell, with 200.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testSingleCellCycleIntegration() {
        long sheetId = createSheet();
        putCell(sheetId, "A10", "hello");

        Map<String, Object> edit = putCell(sheetId, "A10", "=A10");
        assertEquals(Boolean.FALSE, edit.get("accepted"));
        Map<String, Map<String, Object>> updated = (Map<String, Map<String, Object>>) edit.get("updatedCells");
        assertEquals("CircularReference", updated.get("A10").get("error"));
        assertEquals("hello", updated.get("A10").get("value"));

        Map<String, Object> cell = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/cell/A10", Map.class).getBody();
        assertNotNull(cell);
        assertEquals("hello", cell.get("rawInput"));
        assertEquals("#CYCLE!", cell.get("value"));
    }

    @Test
    void testClearCell() {
        long sheetId = createSheet();
        putCell(sheetId, "A1", "7");
        restTemplate.delete(baseUrl + "/" + sheetId + "/cell/A1");
        assertTrue(getSheet(sheetId).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUndoRedoAndHistory() {
        long sheetId = createSheet();
        putCell(sheetId, "A1", "1");

        ResponseEntity<Map> undo = restTemplate.postForEntity(baseUrl + "/" + sheetId + "/undo", null, Map.class);
        assertEquals(HttpStatus.OK, undo.getStatusCode());
        assertTrue(undo.getBody().isEmpty());

        // Nothing left to undo
        ResponseEntity<Map> again = restTemplate.postForEntity(baseUrl + "/" + sheetId + "/undo", null, Map.class);
        assertEquals(HttpStatus.NO_CONTENT, again.getStatusCode());

        ResponseEntity<Map> redo = restTemplate.postForEntity(baseUrl + "/" + sheetId + "/redo", null, Map.class);
        assertEquals("1", redo.getBody().get("A1"));

        ResponseEntity<List> history = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/history", List.class);
        List<Map<String, Object>> versions = history.getBody();
        assertNotNull(versions);
        assertEquals(2, versions.size());
        assertEquals("Cell edit", versions.get(0).get("description"));
        assertEquals(Boolean.TRUE, versions.get(0).get("current"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLoadAndRestore() {
        long sheetId = createSheet();
        putCell(sheetId, "A1", "old");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"B2\": \"=COUNT(\", \"C3\": \"=SUM(A1:A2)\"}";
        ResponseEntity<Map> load = restTemplate.exchange(baseUrl + "/" + sheetId, HttpMethod.PUT,
                new HttpEntity<>(body, headers), Map.class);
        Map<String, Object> errors = (Map<String, Object>) load.getBody().get("errors");
        assertEquals("FormulaSyntaxError", errors.get("B2"));
        assertFalse(getSheet(sheetId).containsKey("A1"));

        // Version 2 is the "A1 = old" edit
        restTemplate.postForEntity(baseUrl + "/" + sheetId + "/history/2/restore", null, Map.class);
        assertEquals("old", getSheet(sheetId).get("A1"));

        HttpClientErrorException error = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(baseUrl + "/" + sheetId + "/history/99/restore", null, Map.class));
        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }
}
