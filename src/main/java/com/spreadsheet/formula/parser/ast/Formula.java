package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.Coordinate;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * A parsed formula: its source text (without the leading '='), the expression tree,
 * and every cell the tree reads. Range operands contribute each covered cell, and
 * both branches of an IF count, whichever one is currently selected.
 */
public final class Formula {
    private final String source;
    private final Expression root;
    private final NavigableSet<Coordinate> precedents;

    public Formula(String source, Expression root, Iterable<Coordinate> precedents) {
        this.source = source;
        this.root = root;
        TreeSet<Coordinate> copy = new TreeSet<>();
        precedents.forEach(copy::add);
        this.precedents = Collections.unmodifiableNavigableSet(copy);
    }

    public String getSource() {
        return source;
    }

    public Expression getRoot() {
        return root;
    }

    public NavigableSet<Coordinate> getPrecedents() {
        return precedents;
    }

    @Override
    public String toString() {
        return "=" + root;
    }
}
