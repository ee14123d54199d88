package com.spreadsheet.formula.references;

import com.spreadsheet.formula.exceptions.MalformedReferenceException;
import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.models.SheetBounds;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between A1-style address tokens and zero-based coordinates.
 * Columns are bijective base-26 letters (A = 0, Z = 25, AA = 26), rows are 1-based in text.
 */
public class ReferenceResolver {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Za-z]+)([0-9]+)$");

    // Longer column or row strings can't be inside any sheet we would accept
    private static final int MAX_COLUMN_LETTERS = 6;
    private static final int MAX_ROW_DIGITS = 9;

    private final SheetBounds bounds;

    public ReferenceResolver(SheetBounds bounds) {
        this.bounds = bounds;
    }

    public SheetBounds getBounds() {
        return bounds;
    }

    /**
     * Parses "B3" into (1, 2). Letters are case-insensitive.
     *
     * @throws MalformedReferenceException on any other shape, on row 0, or outside the sheet
     */
    public Coordinate parseAddress(String token) {
        if (token == null) {
            throw new MalformedReferenceException(null, "Missing cell address");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(token);
        if (!matcher.matches()) {
            throw new MalformedReferenceException(token, "Not a cell address: '" + token + "'");
        }
        String letters = matcher.group(1);
        String digits = matcher.group(2);
        if (letters.length() > MAX_COLUMN_LETTERS) {
            throw new MalformedReferenceException(token, "Column out of range in '" + token + "'");
        }
        if (digits.length() > MAX_ROW_DIGITS) {
            throw new MalformedReferenceException(token, "Row out of range in '" + token + "'");
        }

        int column = parseColumn(letters);
        int row = Integer.parseInt(digits) - 1;
        if (row < 0) {
            throw new MalformedReferenceException(token, "Rows start at 1 in '" + token + "'");
        }
        if (column >= bounds.getColumns()) {
            throw new MalformedReferenceException(token, "Column out of range in '" + token + "'");
        }
        if (row >= bounds.getRows()) {
            throw new MalformedReferenceException(token, "Row out of range in '" + token + "'");
        }
        return new Coordinate(column, row);
    }

    /**
     * Parses "A1:B5" into every coordinate of the bounding rectangle,
     * row-major from the top-left corner, whatever the order of the two endpoints.
     */
    public List<Coordinate> parseRange(String token) {
        if (token == null) {
            throw new MalformedReferenceException(null, "Missing range");
        }
        String[] endpoints = token.split(":", -1);
        if (endpoints.length != 2) {
            throw new MalformedReferenceException(token, "Not a range: '" + token + "'");
        }
        Coordinate first = parseAddress(endpoints[0]);
        Coordinate second = parseAddress(endpoints[1]);
        return expand(first, second);
    }

    /**
     * Lists the cells of the rectangle spanned by two corners, row-major.
     */
    public static List<Coordinate> expand(Coordinate first, Coordinate second) {
        int top = Math.min(first.getRow(), second.getRow());
        int bottom = Math.max(first.getRow(), second.getRow());
        int left = Math.min(first.getColumn(), second.getColumn());
        int right = Math.max(first.getColumn(), second.getColumn());

        List<Coordinate> cells = new ArrayList<>((bottom - top + 1) * (right - left + 1));
        for (int row = top; row <= bottom; row++) {
            for (int column = left; column <= right; column++) {
                cells.add(new Coordinate(column, row));
            }
        }
        return cells;
    }

    /**
     * Inverse of {@link #parseAddress(String)}.
     */
    public static String formatAddress(Coordinate coordinate) {
        return formatColumn(coordinate.getColumn()) + (coordinate.getRow() + 1);
    }

    public static String formatColumn(int column) {
        StringBuilder sb = new StringBuilder();
        int n = column + 1;
        while (n > 0) {
            sb.append((char) ('A' + (n - 1) % 26));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26. Case-insensitive; the caller checks the letters.
     */
    public static int parseColumn(String letters) {
        int n = 0;
        for (int i = 0; i < letters.length(); i++) {
            n = n * 26 + (Character.toUpperCase(letters.charAt(i)) - 'A' + 1);
        }
        return n - 1;
    }
}
