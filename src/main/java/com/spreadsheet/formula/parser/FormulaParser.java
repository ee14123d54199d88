package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaSyntaxException;
import com.spreadsheet.formula.exceptions.MalformedReferenceException;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.parser.ast.*;
import com.spreadsheet.formula.references.ReferenceResolver;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the formula language:
 * <pre>
 * formula   := expr END
 * expr      := call | literal | reference
 * call      := AGGREGATE '(' argument (',' argument)* ')'
 *            | 'IF' '(' condition ',' expr ',' expr ')'
 * argument  := range | expr
 * condition := operand OPERATOR operand
 * operand   := reference | literal
 * </pre>
 * Every reference met on the way, including each cell of a range, is recorded as a precedent.
 */
public class FormulaParser {

    private static final Pattern ADDRESS_SHAPE = Pattern.compile("^[A-Za-z]+[0-9]+$");

    private final ReferenceResolver resolver;

    public FormulaParser(ReferenceResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Parses a cell's raw input, which must start with the formula marker.
     */
    public Formula parseInput(String rawInput) {
        if (!Cell.isFormulaInput(rawInput)) {
            throw new IllegalArgumentException("Not a formula: '" + rawInput + "'");
        }
        return parse(rawInput.substring(Cell.FORMULA_MARKER.length()));
    }

    /**
     * Parses formula text with the leading marker already stripped.
     * Positions in reported errors are relative to this text.
     */
    public Formula parse(String source) {
        Cursor cursor = new Cursor(source, FormulaTokenizer.tokenize(source));
        if (cursor.peek().is(TokenType.END)) {
            throw new FormulaSyntaxException("Empty formula", source, 0);
        }
        Expression root = parseExpression(cursor);
        Token trailing = cursor.peek();
        if (trailing.is(TokenType.RIGHT_PAREN)) {
            throw new FormulaSyntaxException("Unbalanced parentheses", ")", trailing.position);
        }
        if (!trailing.is(TokenType.END)) {
            throw new FormulaSyntaxException("Unexpected input", source.substring(trailing.position), trailing.position);
        }
        return new Formula(source, root, cursor.precedents);
    }

    private Expression parseExpression(Cursor cursor) {
        Token token = cursor.peek();
        switch (token.type) {
            case NUMBER:
                cursor.next();
                return new NumberLiteral(Double.parseDouble(token.text), token.text);
            case STRING:
                cursor.next();
                return new TextLiteral(token.text);
            case WORD:
                if (cursor.peekAhead(1).is(TokenType.LEFT_PAREN)) {
                    return parseCall(cursor);
                }
                if (cursor.peekAhead(1).is(TokenType.COLON)) {
                    throw new FormulaSyntaxException("Range not allowed here", token.text, token.position);
                }
                return parseReference(cursor);
            case END:
                throw new FormulaSyntaxException("Unexpected end of formula", "", token.position);
            default:
                throw new FormulaSyntaxException("Unexpected token", token.text, token.position);
        }
    }

    private Expression parseCall(Cursor cursor) {
        Token nameToken = cursor.next();
        FunctionName name = FunctionName.fromName(nameToken.text);
        if (name == null) {
            throw new FormulaSyntaxException("Unknown function", nameToken.text, nameToken.position);
        }
        cursor.expect(TokenType.LEFT_PAREN, "Expected '('");

        if (name == FunctionName.IF) {
            Condition condition = parseCondition(cursor);
            expectArgumentSeparator(cursor, nameToken);
            Expression whenTrue = parseExpression(cursor);
            expectArgumentSeparator(cursor, nameToken);
            Expression whenFalse = parseExpression(cursor);
            if (cursor.peek().is(TokenType.COMMA)) {
                throw arityError(nameToken, cursor.peek());
            }
            expectClosingParen(cursor, nameToken);
            return new IfCall(condition, whenTrue, whenFalse);
        }

        if (cursor.peek().is(TokenType.RIGHT_PAREN)) {
            throw new FormulaSyntaxException(name + " needs at least one argument",
                    nameToken.text + "()", nameToken.position);
        }
        List<Expression> arguments = new ArrayList<>();
        arguments.add(parseArgument(cursor));
        while (cursor.peek().is(TokenType.COMMA)) {
            cursor.next();
            arguments.add(parseArgument(cursor));
        }
        expectClosingParen(cursor, nameToken);
        return new FunctionCall(name, arguments);
    }

    private Expression parseArgument(Cursor cursor) {
        if (cursor.peek().is(TokenType.WORD) && cursor.peekAhead(1).is(TokenType.COLON)) {
            return parseRange(cursor);
        }
        return parseExpression(cursor);
    }

    private Condition parseCondition(Cursor cursor) {
        Expression left = parseOperand(cursor);
        Token opToken = cursor.peek();
        if (!opToken.is(TokenType.OPERATOR)) {
            throw new FormulaSyntaxException("Expected comparison operator", opToken.text, opToken.position);
        }
        ComparisonOperator operator = ComparisonOperator.fromSymbol(opToken.text);
        if (operator == null) {
            throw new FormulaSyntaxException("Unknown comparison operator", opToken.text, opToken.position);
        }
        cursor.next();
        Expression right = parseOperand(cursor);
        return new Condition(left, operator, right);
    }

    private Expression parseOperand(Cursor cursor) {
        Token token = cursor.peek();
        if (token.is(TokenType.WORD) && !cursor.peekAhead(1).is(TokenType.LEFT_PAREN)
                && !cursor.peekAhead(1).is(TokenType.COLON)) {
            return parseReference(cursor);
        }
        if (token.is(TokenType.NUMBER) || token.is(TokenType.STRING)) {
            return parseExpression(cursor);
        }
        throw new FormulaSyntaxException("Expected a reference or literal", token.text, token.position);
    }

    private CellReference parseReference(Cursor cursor) {
        Token token = cursor.next();
        Coordinate coordinate = resolve(token);
        cursor.precedents.add(coordinate);
        return new CellReference(coordinate);
    }

    private RangeReference parseRange(Cursor cursor) {
        Token startToken = cursor.next();
        cursor.expect(TokenType.COLON, "Expected ':'");
        Token endToken = cursor.peek();
        if (!endToken.is(TokenType.WORD)) {
            throw new FormulaSyntaxException("Incomplete range", startToken.text + ":", startToken.position);
        }
        cursor.next();
        Coordinate start = resolve(startToken);
        Coordinate end = resolve(endToken);
        List<Coordinate> cells = ReferenceResolver.expand(start, end);
        cursor.precedents.addAll(cells);
        return new RangeReference(start, end, cells);
    }

    private Coordinate resolve(Token token) {
        if (!ADDRESS_SHAPE.matcher(token.text).matches()) {
            throw new FormulaSyntaxException("Unknown name", token.text, token.position);
        }
        try {
            return resolver.parseAddress(token.text);
        } catch (MalformedReferenceException e) {
            throw new FormulaSyntaxException("Malformed reference", token.text, token.position, e);
        }
    }

    private void expectArgumentSeparator(Cursor cursor, Token nameToken) {
        if (!cursor.peek().is(TokenType.COMMA)) {
            throw arityError(nameToken, cursor.peek());
        }
        cursor.next();
    }

    private void expectClosingParen(Cursor cursor, Token nameToken) {
        Token token = cursor.peek();
        if (token.is(TokenType.END)) {
            throw new FormulaSyntaxException("Unbalanced parentheses: missing ')'",
                    cursor.source.substring(nameToken.position), nameToken.position);
        }
        if (!token.is(TokenType.RIGHT_PAREN)) {
            throw new FormulaSyntaxException("Expected ')'", token.text, token.position);
        }
        cursor.next();
    }

    private static FormulaSyntaxException arityError(Token nameToken, Token at) {
        if (at.is(TokenType.END)) {
            return new FormulaSyntaxException("Unbalanced parentheses: missing ')'", nameToken.text, nameToken.position);
        }
        return new FormulaSyntaxException("IF takes exactly 3 arguments", at.text, at.position);
    }

    /**
     * Read position over the token list plus the precedents collected so far.
     */
    private static final class Cursor {
        private final String source;
        private final List<Token> tokens;
        private final Set<Coordinate> precedents = new LinkedHashSet<>();
        private int index;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token peekAhead(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        Token next() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.END)) {
                index++;
            }
            return token;
        }

        Token expect(TokenType type, String message) {
            Token token = peek();
            if (!token.is(type)) {
                throw new FormulaSyntaxException(message, token.text, token.position);
            }
            return next();
        }
    }
}
