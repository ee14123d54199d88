package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.models.Coordinate;

import java.util.List;

/**
 * Thrown when a formula would close a dependency cycle (e.g., a cell
 * referencing itself, or a multi-cell loop).
 * The members list the cycle in dependency order, starting and ending at the edited cell.
 */
public class CircularReferenceException extends RuntimeException {
    private final List<Coordinate> members;

    public CircularReferenceException(List<Coordinate> members) {
        super("Cycle detected: " + describe(members));
        this.members = List.copyOf(members);
    }

    public List<Coordinate> getMembers() {
        return members;
    }

    private static String describe(List<Coordinate> members) {
        StringBuilder sb = new StringBuilder();
        for (Coordinate member : members) {
            if (sb.length() > 0) {
                sb.append(" -> ");
            }
            sb.append(member);
        }
        return sb.toString();
    }
}
