package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaSyntaxException;
import com.spreadsheet.formula.exceptions.MalformedReferenceException;
import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.models.SheetBounds;
import com.spreadsheet.formula.parser.ast.*;
import com.spreadsheet.formula.references.ReferenceResolver;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser(new ReferenceResolver(new SheetBounds(26, 100)));

    @Test
    void testSumOfRange() {
        Formula formula = parser.parse("SUM(A1:A3)");
        FunctionCall call = assertInstanceOf(FunctionCall.class, formula.getRoot());
        assertEquals(FunctionName.SUM, call.getName());
        RangeReference range = assertInstanceOf(RangeReference.class, call.getArguments().get(0));
        assertEquals(Coordinate.of(0, 0), range.getStart());
        assertEquals(Coordinate.of(0, 2), range.getEnd());
        assertEquals(List.of(Coordinate.of(0, 0), Coordinate.of(0, 1), Coordinate.of(0, 2)),
                List.copyOf(formula.getPrecedents()));
    }

    @Test
    void testKeywordsAndReferencesAreCaseInsensitive() {
        Formula formula = parser.parse("average(b2, c3:c4, 7)");
        FunctionCall call = assertInstanceOf(FunctionCall.class, formula.getRoot());
        assertEquals(FunctionName.AVERAGE, call.getName());
        assertEquals(3, call.getArguments().size());
        assertInstanceOf(CellReference.class, call.getArguments().get(0));
        assertInstanceOf(RangeReference.class, call.getArguments().get(1));
        NumberLiteral seven = assertInstanceOf(NumberLiteral.class, call.getArguments().get(2));
        assertEquals(7d, seven.getValue());
        assertEquals(3, formula.getPrecedents().size());
    }

    @Test
    void testParseInputStripsMarker() {
        Formula formula = parser.parseInput("=MAX(A1,B1)");
        assertEquals("MAX(A1,B1)", formula.getSource());
        assertThrows(IllegalArgumentException.class, () -> parser.parseInput("MAX(A1,B1)"));
    }

    @Test
    void testIfCall() {
        Formula formula = parser.parse("IF(A1 > 5, \"big\", 'small')");
        IfCall call = assertInstanceOf(IfCall.class, formula.getRoot());
        assertEquals(ComparisonOperator.GREATER, call.getCondition().getOperator());
        assertInstanceOf(CellReference.class, call.getCondition().getLeft());
        assertEquals("big", assertInstanceOf(TextLiteral.class, call.getWhenTrue()).getText());
        assertEquals("small", assertInstanceOf(TextLiteral.class, call.getWhenFalse()).getText());
    }

    /**
     * Both branches are precedents, not only the one currently selected.
     */
    @Test
    void testIfRegistersBothBranches() {
        Formula formula = parser.parse("IF(A1>=B1,C1,SUM(D1:D2))");
        assertEquals(5, formula.getPrecedents().size());
        assertTrue(formula.getPrecedents().contains(Coordinate.of(2, 0)));
        assertTrue(formula.getPrecedents().contains(Coordinate.of(3, 1)));
    }

    @Test
    void testAllComparisonOperators() {
        String[][] cases = {
                {">", "GREATER"}, {"<", "LESS"}, {">=", "GREATER_OR_EQUAL"}, {"<=", "LESS_OR_EQUAL"},
                {"=", "EQUAL"}, {"==", "EQUAL"}, {"!=", "NOT_EQUAL"}, {"<>", "NOT_EQUAL"}
        };
        for (String[] c : cases) {
            IfCall call = (IfCall) parser.parse("IF(A1" + c[0] + "2,1,0)").getRoot();
            assertEquals(ComparisonOperator.valueOf(c[1]), call.getCondition().getOperator(), c[0]);
        }
    }

    @Test
    void testLiteralsAndPlainReference() {
        assertEquals(-2.5, ((NumberLiteral) parser.parse("-2.5").getRoot()).getValue());
        assertEquals(1000d, ((NumberLiteral) parser.parse("1e3").getRoot()).getValue());
        assertEquals("hi there", ((TextLiteral) parser.parse("\"hi there\"").getRoot()).getText());
        Formula reference = parser.parse(" b7 ");
        assertEquals(Coordinate.of(1, 6), ((CellReference) reference.getRoot()).getCoordinate());
        assertEquals(1, reference.getPrecedents().size());
    }

    @Test
    void testNestedCall() {
        FunctionCall call = (FunctionCall) parser.parse("SUM(MAX(A1:A3),1)").getRoot();
        assertEquals(FunctionName.MAX, ((FunctionCall) call.getArguments().get(0)).getName());
    }

    @Test
    void testUnknownFunction() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parser.parse("SUMX(A1)"));
        assertEquals("SUMX", e.getOffendingText());
        assertEquals(0, e.getPosition());
    }

    @Test
    void testUnbalancedParentheses() {
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("SUM(A1:A3"));
        FormulaSyntaxException extra = assertThrows(FormulaSyntaxException.class, () -> parser.parse("SUM(A1))"));
        assertEquals(")", extra.getOffendingText());
        assertEquals(7, extra.getPosition());
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("IF(A1>1,2,3"));
    }

    @Test
    void testWrongArity() {
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("SUM()"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("IF(A1>1,2)"));
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parser.parse("IF(A1>1,2,3,4)"));
        assertEquals(",", e.getOffendingText());
    }

    @Test
    void testMalformedReferenceIsSyntaxError() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parser.parse("SUM(A1:A500)"));
        assertEquals("A500", e.getOffendingText());
        assertEquals(7, e.getPosition());
        assertInstanceOf(MalformedReferenceException.class, e.getCause());
    }

    @Test
    void testOtherSyntaxErrors() {
        List<String> bad = Arrays.asList(
                "",                 // nothing after '='
                "A1:A3",            // range outside an aggregate
                "IF(A1:A2>1,1,0)",  // range as a condition operand
                "IF(A1,1,0)",       // condition without operator
                "IF(A1!1,1,0)",     // unknown operator
                "IF(SUM(A1)>1,1,0)",// calls are not condition operands
                "foo",              // bare word
                "SUM(A1 A2)",       // missing comma
                "SUM(A1:5)",        // incomplete range
                "\"open",           // unterminated string
                "1 2",              // trailing input
                "SUM(A1)#");        // stray character
        for (String source : bad) {
            assertThrows(FormulaSyntaxException.class, () -> parser.parse(source), source);
        }
    }
}
