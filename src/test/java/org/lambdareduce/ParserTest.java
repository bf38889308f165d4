package org.lambdareduce;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import org.lambdareduce.LambdaEval.App;
import org.lambdareduce.LambdaEval.Lam;
import org.lambdareduce.LambdaEval.Parser;
import org.lambdareduce.LambdaEval.SyntaxException;
import org.lambdareduce.LambdaEval.Term;
import org.lambdareduce.LambdaEval.Var;

public class ParserTest {

    private static Var v(char x) { return new Var(x); }
    private static Lam lam(char x, Term body) { return new Lam(v(x), body); }
    private static App app(Term f, Term a) { return new App(f, a); }

    @Test
    public void singleVariable() {
        assertEquals(v('x'), Parser.parse("x"));
    }

    @Test
    public void juxtapositionIsLeftAssociative() {
        assertEquals(app(app(v('x'), v('y')), v('z')), Parser.parse("xyz"));
    }

    @Test
    public void parenthesesGroupToTheRight() {
        assertEquals(app(v('x'), app(v('y'), v('z'))), Parser.parse("x(yz)"));
    }

    @Test
    public void lambdaBodyExtendsAsFarAsPossible() {
        assertEquals(lam('x', app(v('x'), v('y'))), Parser.parse("λx.xy"));
        assertEquals(lam('x', lam('y', v('x'))), Parser.parse("λx.λy.x"));
    }

    @Test
    public void lambdaAsFactorInsideChain() {
        assertEquals(app(v('x'), lam('y', app(v('y'), v('z')))), Parser.parse("xλy.yz"));
    }

    @Test
    public void backslashAndLambdaSymbolAreEquivalent() {
        assertEquals(Parser.parse("λx.x"), Parser.parse("\\x.x"));
        assertEquals(Parser.parse("(λf.λx.fx)"), Parser.parse("(\\f.\\x.fx)"));
    }

    @Test
    public void redexWithArgument() {
        assertEquals(app(lam('x', v('x')), v('y')), Parser.parse("((λx.x)y)"));
    }

    @Test
    public void whitespaceIsIgnoredEverywhere() {
        assertEquals(app(lam('x', v('x')), v('y')), Parser.parse("  ( λ x . x )\t y \n"));
        assertEquals(Parser.parse("xy"), Parser.parse("x y"));
    }

    @Test
    public void noBreakSpacesAreIgnored() {
        assertEquals(Parser.parse("xy"), Parser.parse("x\u00A0y\u2007\u202F"));
    }

    @Test
    public void lettersOutsideBasicPlaneAreVariables() {
        String mathX = new String(Character.toChars(0x1D465));
        Term t = Parser.parse("λ" + mathX + "." + mathX + "y");
        assertEquals(lam2(0x1D465, app(new Var(0x1D465), v('y'))), t);
        assertEquals("(λ" + mathX + ".(" + mathX + " y))", t.toString());
        assertEquals(t, Parser.parse(t.toString()));
    }

    private static Lam lam2(int x, Term body) { return new Lam(new Var(x), body); }

    @Test
    public void parsingIsDeterministic() {
        String text = "(λn.λf.λx.f(nfx))(λf.λx.fx)";
        assertEquals(Parser.parse(text), Parser.parse(text));
    }

    @Test
    public void printedFormParsesBackToSameTree() {
        String[] inputs = {
            "x", "xyz", "x(yz)", "λx.x", "(λx.x)y", "λx.λy.xy",
            "(λn.λf.λx.f(nfx))(λf.λx.fx)", "(λx.(xx))(λx.(xx))", "a(λb.b)c"
        };
        for (String in : inputs) {
            Term t = Parser.parse(in);
            assertEquals(in, t, Parser.parse(t.toString()));
        }
    }

    // ----- errors -----

    @Test
    public void unclosedParen() {
        expectError("(x", "Expected ')'", 2);
    }

    @Test
    public void dotInsideParens() {
        expectError("(x.y)", "Expected ')'", 2);
    }

    @Test
    public void lambdaWithoutVariable() {
        expectError("λ.x", "Expected a variable after lambda", 1);
        expectError("\\", "Expected a variable after lambda", 1);
    }

    @Test
    public void lambdaWithoutDot() {
        expectError("λx x", "Expected dot after lambda variable", 2);
    }

    @Test
    public void extraCharactersAfterExpression() {
        expectError("x y)", "Extra characters after valid expression", 2);
        expectError("x.y", "Extra characters after valid expression", 1);
    }

    @Test
    public void emptyInput() {
        expectError("", "Unexpected end of input", 0);
        expectError("   ", "Unexpected end of input", 0);
        expectError("λx.", "Unexpected end of input", 3);
    }

    @Test
    public void unexpectedCharacter() {
        expectError("x#", "Unexpected character: #", 1);
        expectError(")", "Unexpected character: )", 0);
        expectError("x" + new String(Character.toChars(0x1F600)), "Unexpected character: " + new String(Character.toChars(0x1F600)), 1);
    }

    private static void expectError(String input, String message, int position) {
        try {
            Term t = Parser.parse(input);
            fail("expected syntax error for '" + input + "', got " + t);
        } catch (SyntaxException e) {
            assertEquals(message, e.getMessage());
            assertEquals(position, e.getPosition());
        }
    }
}
