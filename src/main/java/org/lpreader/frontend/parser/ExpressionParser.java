package org.lpreader.frontend.parser;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.api.SourceInfo;
import org.lpreader.frontend.sections.TokenSlice;
import org.lpreader.frontend.semantics.SymbolTable;
import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;
import org.lpreader.model.Expression;
import org.lpreader.model.LinearTerm;
import org.lpreader.model.QuadraticTerm;

import java.util.ArrayList;
import java.util.List;

import static org.lpreader.frontend.token.TokenType.ASTERISK;
import static org.lpreader.frontend.token.TokenType.BRACKET_CLOSE;
import static org.lpreader.frontend.token.TokenType.BRACKET_OPEN;
import static org.lpreader.frontend.token.TokenType.CARET;
import static org.lpreader.frontend.token.TokenType.LABEL;
import static org.lpreader.frontend.token.TokenType.NUMBER;
import static org.lpreader.frontend.token.TokenType.SLASH;
import static org.lpreader.frontend.token.TokenType.VARIABLE;

/**
 * Parses the linear and quadratic expressions shared by the objective and constraints.
 * <p>
 * The grammar is resolved with local lookahead, longest pattern first:
 * <pre>
 *   Expression := [Label] Term*
 *   Term       := Const Var | Const | Var | '[' QuadAtom* ']' ['/' 2]
 *   QuadAtom   := [Const] Var '^' 2 | [Const] Var '*' Var
 * </pre>
 * The trailing {@code / 2} is mandatory in the objective and absent everywhere else.
 * Parsing stops at the first token no pattern accepts; the caller decides what it means.
 */
public class ExpressionParser {

    private final SymbolTable symbolTable;
    private final String sourceName;

    /**
     * @param symbolTable The table that variable references are resolved against.
     * @param sourceName The name of the input, for error reporting.
     */
    public ExpressionParser(SymbolTable symbolTable, String sourceName) {
        this.symbolTable = symbolTable;
        this.sourceName = sourceName;
    }

    /**
     * Parses one expression from the front of a slice.
     * @param slice The tokens to parse.
     * @param objective Whether this is the objective, which requires {@code / 2} after quadratic blocks.
     * @return The expression and the slice starting at the first unconsumed token.
     * @throws LpReadException if a quadratic block is malformed.
     */
    public ParseResult<Expression> parse(TokenSlice slice, boolean objective) throws LpReadException {
        String name = null;
        double offset = 0.0;
        List<LinearTerm> linearTerms = new ArrayList<>();
        List<QuadraticTerm> quadraticTerms = new ArrayList<>();

        TokenSlice rest = slice;
        if (rest.startsWith(LABEL)) {
            name = rest.first().name();
            rest = rest.advance(1);
        }

        while (!rest.isEmpty()) {
            if (rest.startsWith(NUMBER, VARIABLE)) {
                linearTerms.add(new LinearTerm(rest.peek(0).number(), handleOf(rest.peek(1))));
                rest = rest.advance(2);
            } else if (rest.startsWith(NUMBER)) {
                offset += rest.first().number();
                rest = rest.advance(1);
            } else if (rest.startsWith(VARIABLE)) {
                linearTerms.add(new LinearTerm(1.0, handleOf(rest.first())));
                rest = rest.advance(1);
            } else if (rest.startsWith(BRACKET_OPEN)) {
                rest = parseQuadraticBlock(rest.advance(1), objective, quadraticTerms);
            } else {
                break;
            }
        }
        return new ParseResult<>(new Expression(name, offset, linearTerms, quadraticTerms), rest);
    }

    /**
     * Creates the error for a token that no expression pattern accepts but that the caller
     * did not expect either.
     * @param token The offending token.
     * @param context What was being parsed, e.g. "constraint".
     * @return A malformed-expression error for operators, an unexpected-token error otherwise.
     */
    public LpReadException unexpectedToken(Token token, String context) {
        boolean operator = token.is(TokenType.ASTERISK) || token.is(TokenType.CARET)
                || token.is(TokenType.SLASH) || token.is(TokenType.BRACKET_CLOSE);
        LpErrorCode code = operator ? LpErrorCode.MALFORMED_EXPRESSION : LpErrorCode.UNEXPECTED_TOKEN;
        return new LpReadException(code, "Unexpected " + token + " in " + context, new SourceInfo(sourceName, token.line()));
    }

    private TokenSlice parseQuadraticBlock(TokenSlice slice, boolean objective, List<QuadraticTerm> terms) throws LpReadException {
        TokenSlice rest = slice;
        while (!rest.isEmpty() && !rest.startsWith(BRACKET_CLOSE)) {
            if (rest.startsWith(NUMBER, VARIABLE, CARET, NUMBER)) {
                int var = handleOf(rest.peek(1));
                requireSquare(rest.peek(3));
                terms.add(new QuadraticTerm(rest.peek(0).number(), var, var));
                rest = rest.advance(4);
            } else if (rest.startsWith(VARIABLE, CARET, NUMBER)) {
                int var = handleOf(rest.peek(0));
                requireSquare(rest.peek(2));
                terms.add(new QuadraticTerm(1.0, var, var));
                rest = rest.advance(3);
            } else if (rest.startsWith(NUMBER, VARIABLE, ASTERISK, VARIABLE)) {
                terms.add(new QuadraticTerm(rest.peek(0).number(), handleOf(rest.peek(1)), handleOf(rest.peek(3))));
                rest = rest.advance(4);
            } else if (rest.startsWith(VARIABLE, ASTERISK, VARIABLE)) {
                terms.add(new QuadraticTerm(1.0, handleOf(rest.peek(0)), handleOf(rest.peek(2))));
                rest = rest.advance(3);
            } else {
                break;
            }
        }

        if (rest.isEmpty()) {
            throw new LpReadException(LpErrorCode.UNEXPECTED_END_OF_SECTION,
                    "Quadratic block is not closed with ']'", new SourceInfo(sourceName, rest.line()));
        }
        if (!rest.startsWith(BRACKET_CLOSE)) {
            throw malformed("Unexpected " + rest.first() + " in quadratic block", rest.first());
        }
        if (!objective) {
            return rest.advance(1);
        }

        // In the objective a quadratic block always denotes half of its value: [ ... ] / 2
        if (!rest.startsWith(BRACKET_CLOSE, SLASH, NUMBER) || rest.peek(2).number() != 2.0) {
            throw malformed("Quadratic block in the objective must be followed by '/ 2'", rest.first());
        }
        return rest.advance(3);
    }

    private void requireSquare(Token exponent) throws LpReadException {
        if (exponent.number() != 2.0) {
            throw malformed("Only squares are supported, found exponent " + exponent.number(), exponent);
        }
    }

    private int handleOf(Token variable) {
        return symbolTable.resolveVariable(variable.name()).handle();
    }

    private LpReadException malformed(String message, Token at) {
        return new LpReadException(LpErrorCode.MALFORMED_EXPRESSION, message, new SourceInfo(sourceName, at.line()));
    }
}
