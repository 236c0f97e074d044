package com.raditha.rlint.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RParserTest {

    private static SyntaxNode firstExpression(String source) {
        SyntaxTree tree = RParser.parse(source);
        assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
        return tree.root().childNodes().get(0);
    }

    @Test
    void testFullTextRoundTrip() {
        String source = """
                # helpers
                f <- function(x, y = 2) {
                  if (x > y) x else y  # pick
                }

                for (i in seq_len(3)) print(f(i))
                """;
        SyntaxTree tree = RParser.parse(source);
        assertFalse(tree.hasErrors());
        assertEquals(source, tree.root().fullText());
    }

    @Test
    void testPrecedence() {
        SyntaxNode expression = firstExpression("a + b * c");
        assertEquals(RSyntaxKind.R_BINARY_EXPRESSION, expression.kind());
        assertEquals("a", RAst.binaryLeft(expression).orElseThrow().text());
        assertEquals("b * c", RAst.binaryRight(expression).orElseThrow().text());
    }

    @Test
    void testAssignmentIsRightAssociative() {
        SyntaxNode expression = firstExpression("x <- y <- 1");
        assertEquals("x", RAst.binaryLeft(expression).orElseThrow().text());
        assertEquals("y <- 1", RAst.binaryRight(expression).orElseThrow().text());
    }

    @Test
    void testNegationBindsLooserThanComparison() {
        SyntaxNode expression = firstExpression("!x == 1");
        assertEquals(RSyntaxKind.R_UNARY_EXPRESSION, expression.kind());
        assertEquals("x == 1", RAst.unaryArgument(expression).orElseThrow().text());
    }

    @Test
    void testCallArguments() {
        SyntaxNode call = firstExpression("grep(\"a\", x, value = TRUE)");
        assertEquals(RSyntaxKind.R_CALL, call.kind());
        assertEquals("grep", RAst.functionName(call));
        List<SyntaxNode> arguments = RAst.arguments(call);
        assertEquals(3, arguments.size());
        assertTrue(RAst.argumentName(arguments.get(0)).isEmpty());
        assertEquals("value", RAst.argumentName(arguments.get(2)).orElseThrow());
        assertEquals("TRUE", RAst.argumentValue(arguments.get(2)).orElseThrow().text());
    }

    @Test
    void testNamespacedCallName() {
        SyntaxNode call = firstExpression("purrr::map_int(x, length)");
        assertEquals("map_int", RAst.functionName(call));
    }

    @Test
    void testNewlineEndsExpressionOnlyOutsideParentheses() {
        SyntaxTree tree = RParser.parse("x <- 1\n-2\nf(a,\n  b)\n");
        assertFalse(tree.hasErrors());
        List<SyntaxNode> expressions = tree.root().childNodes();
        assertEquals(3, expressions.size());
        assertEquals(2, RAst.arguments(expressions.get(2)).size());
    }

    @Test
    void testIfElseInsideBraces() {
        SyntaxNode braced = firstExpression("{\n  if (a) 1\n  else 2\n}");
        SyntaxNode statement = braced.childNodes().get(0);
        assertEquals(RSyntaxKind.R_IF_STATEMENT, statement.kind());
        assertTrue(statement.findChild(RSyntaxKind.R_ELSE_CLAUSE).isPresent());
    }

    @Test
    void testWhileShape() {
        SyntaxNode loop = firstExpression("while (TRUE) { break }");
        assertEquals(RSyntaxKind.R_WHILE_STATEMENT, loop.kind());
        assertEquals(RSyntaxKind.R_TRUE_EXPRESSION, RAst.condition(loop).orElseThrow().kind());
        assertEquals(RSyntaxKind.R_BRACED_EXPRESSIONS, RAst.body(loop).orElseThrow().kind());
        assertTrue(RAst.isIfOrWhileCondition(RAst.condition(loop).orElseThrow()));
    }

    @Test
    void testFunctionParametersAndLambda() {
        SyntaxNode function = firstExpression("\\(x, n = 1) x + n");
        assertEquals(RSyntaxKind.R_FUNCTION_DEFINITION, function.kind());
        SyntaxNode parameters = function.findChild(RSyntaxKind.R_PARAMETERS).orElseThrow();
        assertEquals(2, parameters.childNodes().size());
        assertEquals("x + n", RAst.body(function).orElseThrow().text());
    }

    @Test
    void testSubsetAndExtract() {
        SyntaxNode subset = firstExpression("x[[\"a\"]]$b");
        assertEquals(RSyntaxKind.R_EXTRACT_EXPRESSION, subset.kind());
        assertEquals(RSyntaxKind.R_SUBSET2, subset.childNodes().get(0).kind());
    }

    @Test
    void testParentLinks() {
        SyntaxNode call = firstExpression("any(is.na(x))");
        SyntaxNode inner = call.descendants().stream()
                .filter(n -> n.kind() == RSyntaxKind.R_CALL && RAst.functionName(n).equals("is.na"))
                .findFirst()
                .orElseThrow();
        assertEquals(RSyntaxKind.R_ARGUMENT, inner.parent().kind());
        assertTrue(inner.ancestors().contains(call));
    }

    @Test
    void testTextRangeExcludesTrivia() {
        SyntaxTree tree = RParser.parse("  # note\n  x == NULL  \n");
        SyntaxNode binary = tree.root().childNodes().get(0);
        assertEquals("x == NULL", binary.text());
        assertEquals(tree.source().indexOf('x'), binary.textRange().start());
        assertTrue(binary.containsComments());
    }

    @Test
    void testSyntaxErrorsAreCollected() {
        SyntaxTree tree = RParser.parse("x <- (1 + \n");
        assertTrue(tree.hasErrors());
        ParseException e = assertThrows(ParseException.class, tree::requireValid);
        assertEquals(tree.errors(), e.getErrors());
        assertTrue(e.getMessage().startsWith("Syntax error at "));
    }

    @Test
    void testSiblingNavigation() {
        SyntaxNode root = RParser.parse("a\nb\nc\n").root();
        SyntaxNode middle = root.childNodes().get(1);
        assertEquals("a", ((SyntaxNode) middle.prevSibling()).text());
        assertEquals("c", ((SyntaxNode) middle.nextSibling()).text());
        assertNull(root.prevSibling());
    }

    @Test
    void testMissingSeparatorIsAnError() {
        assertTrue(RParser.parse("x y").hasErrors());
    }

    @Test
    void testEmptySource() {
        SyntaxTree tree = RParser.parse("");
        assertFalse(tree.hasErrors());
        assertTrue(tree.root().childNodes().isEmpty());
    }

    @Test
    void testLineIndexPositions() {
        LineIndex index = new LineIndex("a\nbc\n");
        assertEquals(new LineIndex.Position(1, 1), index.position(0));
        assertEquals(new LineIndex.Position(2, 2), index.position(3));
        assertEquals(3, index.lineCount());
    }
}
