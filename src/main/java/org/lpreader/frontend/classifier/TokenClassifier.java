package org.lpreader.frontend.classifier;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.api.SourceInfo;
import org.lpreader.frontend.lexer.Lexer;
import org.lpreader.frontend.lexer.RawToken;
import org.lpreader.frontend.lexer.RawTokenType;
import org.lpreader.frontend.token.ComparisonType;
import org.lpreader.frontend.token.SectionKeyword;
import org.lpreader.frontend.token.Token;
import org.lpreader.frontend.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw tokens into semantic tokens.
 * <p>
 * The meaning of a raw token often depends on its neighbours: a string followed by a
 * colon is a label, "subject to" is one keyword, a minus in front of a number is part
 * of the constant. The classifier resolves these cases by inspecting the lexer's
 * lookahead window, first match wins.
 */
public class TokenClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(TokenClassifier.class);

    private final Lexer lexer;
    private final boolean failOnUnterminatedComment;
    private final List<Token> tokens = new ArrayList<>();

    /**
     * Creates a new classifier.
     * @param lexer The source of raw tokens.
     * @param failOnUnterminatedComment Whether a block comment running into the end of
     *                                  the input is an error rather than a warning.
     */
    public TokenClassifier(Lexer lexer, boolean failOnUnterminatedComment) {
        this.lexer = lexer;
        this.failOnUnterminatedComment = failOnUnterminatedComment;
    }

    /**
     * Classifies the entire raw token stream.
     * @return The semantic tokens in input order.
     * @throws LpReadException on the first raw token sequence without meaning.
     */
    public List<Token> classify() throws LpReadException {
        while (!raw(0).is(RawTokenType.END_OF_FILE)) {
            classifyNext();
        }
        return tokens;
    }

    private void classifyNext() throws LpReadException {
        RawToken current = raw(0);
        int line = current.line();

        if (current.is(RawTokenType.SLASH) && raw(1).is(RawTokenType.ASTERISK)) {
            skipBlockComment(line);
            return;
        }

        if (current.is(RawTokenType.STRING)) {
            classifyString(current);
            return;
        }

        if (current.is(RawTokenType.PLUS) || current.is(RawTokenType.MINUS)) {
            classifySign(current);
            return;
        }

        switch (current.type()) {
            case NUMBER -> {
                if (raw(1).is(RawTokenType.BRACKET_OPEN)) {
                    throw error(LpErrorCode.MALFORMED_EXPRESSION,
                            "A coefficient in front of '[' is not supported", line);
                }
                emit(Token.number(current.value(), line), 1);
            }
            case BRACKET_OPEN -> emit(Token.of(TokenType.BRACKET_OPEN, line), 1);
            case BRACKET_CLOSE -> emit(Token.of(TokenType.BRACKET_CLOSE, line), 1);
            case SLASH -> emit(Token.of(TokenType.SLASH, line), 1);
            case ASTERISK -> emit(Token.of(TokenType.ASTERISK, line), 1);
            case CARET -> emit(Token.of(TokenType.CARET, line), 1);
            case LESS -> {
                if (raw(1).is(RawTokenType.EQUAL)) {
                    emit(Token.comparison(ComparisonType.LESS_EQUAL, line), 2);
                } else {
                    emit(Token.comparison(ComparisonType.LESS, line), 1);
                }
            }
            case GREATER -> {
                if (raw(1).is(RawTokenType.EQUAL)) {
                    emit(Token.comparison(ComparisonType.GREATER_EQUAL, line), 2);
                } else {
                    emit(Token.comparison(ComparisonType.GREATER, line), 1);
                }
            }
            case EQUAL -> emit(Token.comparison(ComparisonType.EQUAL, line), 1);
            default -> throw error(LpErrorCode.UNKNOWN_TOKEN, "Unknown token '" + current.text() + "'", line);
        }
    }

    private void classifyString(RawToken current) throws LpReadException {
        int line = current.line();
        String text = current.text();

        // Hyphenated keywords such as "semi-continuous".
        if (raw(1).is(RawTokenType.MINUS) && raw(2).is(RawTokenType.STRING)) {
            Optional<SectionKeyword> keyword = Keywords.section(text + "-" + raw(2).text());
            if (keyword.isPresent()) {
                emit(Token.section(keyword.get(), line), 3);
                return;
            }
        }

        // Two-word keywords such as "subject to".
        if (raw(1).is(RawTokenType.STRING)) {
            Optional<SectionKeyword> keyword = Keywords.section(text + " " + raw(1).text());
            if (keyword.isPresent()) {
                emit(Token.section(keyword.get(), line), 2);
                return;
            }
        }

        Optional<SectionKeyword> keyword = Keywords.section(text);
        if (keyword.isPresent()) {
            emit(Token.section(keyword.get(), line), 1);
            return;
        }

        if (raw(1).is(RawTokenType.COLON) && raw(2).is(RawTokenType.COLON)) {
            emit(Token.sosType(parseSosType(text, line), line), 3);
            return;
        }

        if (raw(1).is(RawTokenType.COLON)) {
            emit(Token.label(text, line), 2);
            return;
        }

        if (Keywords.isFree(text)) {
            emit(Token.of(TokenType.FREE, line), 1);
            return;
        }

        if (Keywords.isInfinity(text)) {
            emit(Token.number(Double.POSITIVE_INFINITY, line), 1);
            return;
        }

        emit(Token.variable(text, line), 1);
    }

    private void classifySign(RawToken sign) throws LpReadException {
        int line = sign.line();
        boolean negative = sign.is(RawTokenType.MINUS);
        RawToken next = raw(1);

        if (next.is(RawTokenType.NUMBER)) {
            emit(Token.number(negative ? -next.value() : next.value(), line), 2);
            return;
        }
        if (next.is(RawTokenType.STRING) && Keywords.isInfinity(next.text())) {
            emit(Token.number(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY, line), 2);
            return;
        }
        if (next.is(RawTokenType.BRACKET_OPEN)) {
            if (negative) {
                throw error(LpErrorCode.MALFORMED_EXPRESSION, "A minus sign in front of '[' is not supported", line);
            }
            emit(Token.of(TokenType.BRACKET_OPEN, line), 2);
            return;
        }
        // A bare sign is the unit coefficient of whatever follows.
        emit(Token.number(negative ? -1.0 : 1.0, line), 1);
    }

    private int parseSosType(String text, int line) throws LpReadException {
        if (text.length() == 2 && (text.charAt(0) == 'S' || text.charAt(0) == 's')) {
            if (text.charAt(1) == '1') {
                return 1;
            }
            if (text.charAt(1) == '2') {
                return 2;
            }
        }
        throw error(LpErrorCode.MALFORMED_SOS_ENTRY, "Expected S1 or S2 in front of '::' but found '" + text + "'", line);
    }

    private void skipBlockComment(int startLine) throws LpReadException {
        lexer.advance(2);
        while (!(raw(0).is(RawTokenType.ASTERISK) && raw(1).is(RawTokenType.SLASH))) {
            if (raw(0).is(RawTokenType.END_OF_FILE)) {
                if (failOnUnterminatedComment) {
                    throw error(LpErrorCode.UNEXPECTED_END_OF_SECTION,
                            "Block comment is not terminated before the end of the input", startLine);
                }
                LOG.warn("Block comment starting at {}:{} is not terminated; ignoring the rest of the input",
                        lexer.getSourceName(), startLine);
                return;
            }
            lexer.advance(1);
        }
        lexer.advance(2);
    }

    private void emit(Token token, int rawTokensConsumed) throws LpReadException {
        tokens.add(token);
        lexer.advance(rawTokensConsumed);
    }

    private RawToken raw(int offset) {
        return lexer.peek(offset);
    }

    private LpReadException error(LpErrorCode code, String message, int line) {
        return new LpReadException(code, message, new SourceInfo(lexer.getSourceName(), line));
    }
}
