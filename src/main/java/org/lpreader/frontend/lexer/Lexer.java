package org.lpreader.frontend.lexer;

import org.lpreader.api.LpErrorCode;
import org.lpreader.api.LpReadException;
import org.lpreader.api.SourceInfo;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;

/**
 * The Lexer converts a line-oriented character stream into raw tokens.
 * <p>
 * Tokens are produced on demand into a fixed lookahead window of {@link #LOOKAHEAD}
 * slots. Callers inspect the window with {@link #peek(int)} and slide it with
 * {@link #advance(int)}. Once the input is exhausted the window fills with
 * {@link RawTokenType#END_OF_FILE} tokens.
 */
public class Lexer {

    /** The number of raw tokens that can be inspected without consuming them. */
    public static final int LOOKAHEAD = 5;

    // Characters that end a string run besides control characters. All of them are handled before a run is attempted.
    private static final String RUN_TERMINATORS = " \t\\:;+-<>=^/*[]";

    private final BufferedReader reader;
    private final String sourceName;
    private final RawToken[] window = new RawToken[LOOKAHEAD];
    private int windowPosition = 0;

    private String lineBuffer = "";
    private int linePosition = 0;
    private int lineNumber = 0;
    private boolean endOfInput = false;

    /**
     * Creates a new Lexer and fills the lookahead window.
     * @param reader The character source, read line by line.
     * @param sourceName The name of the input, for error reporting.
     * @throws LpReadException if the input cannot be read or starts with an invalid character.
     */
    public Lexer(BufferedReader reader, String sourceName) throws LpReadException {
        this.reader = reader;
        this.sourceName = sourceName;
        for (int i = 0; i < LOOKAHEAD; i++) {
            window[i] = nextToken();
        }
    }

    /**
     * Returns a token of the lookahead window without consuming it.
     * @param offset The distance from the current token, 0 to {@value #LOOKAHEAD} - 1.
     * @return The token at the given offset.
     */
    public RawToken peek(int offset) {
        if (offset < 0 || offset >= LOOKAHEAD) {
            throw new IllegalArgumentException("Lookahead offset out of range: " + offset);
        }
        return window[(windowPosition + offset) % LOOKAHEAD];
    }

    /**
     * @return The current token.
     */
    public RawToken peek() {
        return peek(0);
    }

    /**
     * Consumes tokens from the front of the window and refills it from the input.
     * @param howMany The number of tokens to consume, at least 1.
     * @throws LpReadException if the input cannot be read or contains an invalid character.
     */
    public void advance(int howMany) throws LpReadException {
        if (howMany < 1) {
            throw new IllegalArgumentException("Must advance by at least one token, got " + howMany);
        }
        while (howMany-- > 0) {
            window[windowPosition % LOOKAHEAD] = nextToken();
            windowPosition++;
        }
    }

    /**
     * @return The name of the input this lexer reads.
     */
    public String getSourceName() {
        return sourceName;
    }

    private RawToken nextToken() throws LpReadException {
        RawToken token = readNextToken();
        while (token == null) {
            token = readNextToken();
        }
        return token;
    }

    /**
     * Reads one token at the current position.
     * @return The token, or {@code null} if only whitespace or a comment was consumed.
     */
    private RawToken readNextToken() throws LpReadException {
        if (linePosition >= lineBuffer.length()) {
            if (!readLine()) {
                return new RawToken(RawTokenType.END_OF_FILE, "", 0.0, lineNumber);
            }
            if (lineBuffer.isEmpty()) {
                return null;
            }
        }

        char c = lineBuffer.charAt(linePosition);
        switch (c) {
            case '\\':
                // A comment goes until the end of the line.
                linePosition = lineBuffer.length();
                return null;
            case '[': return single(RawTokenType.BRACKET_OPEN, c);
            case ']': return single(RawTokenType.BRACKET_CLOSE, c);
            case '<': return single(RawTokenType.LESS, c);
            case '>': return single(RawTokenType.GREATER, c);
            case '=': return single(RawTokenType.EQUAL, c);
            case ':': return single(RawTokenType.COLON, c);
            case '+': return single(RawTokenType.PLUS, c);
            case '^': return single(RawTokenType.CARET, c);
            case '/': return single(RawTokenType.SLASH, c);
            case '*': return single(RawTokenType.ASTERISK, c);
            case '-': return single(RawTokenType.MINUS, c);
            case ' ', '\t':
                linePosition++;
                return null;
            case ';':
                linePosition = lineBuffer.length();
                return null;
            default:
                break;
        }

        if (Character.isISOControl(c)) {
            throw new LpReadException(LpErrorCode.UNEXPECTED_CHARACTER,
                    String.format("Unexpected control character U+%04X", (int) c), new SourceInfo(sourceName, lineNumber));
        }

        int numberEnd = scanNumber(linePosition);
        if (numberEnd > linePosition) {
            String text = lineBuffer.substring(linePosition, numberEnd);
            linePosition = numberEnd;
            return new RawToken(RawTokenType.NUMBER, text, Double.parseDouble(text), lineNumber);
        }

        int runEnd = linePosition;
        while (runEnd < lineBuffer.length() && isRunCharacter(lineBuffer.charAt(runEnd))) {
            runEnd++;
        }
        String text = lineBuffer.substring(linePosition, runEnd);
        linePosition = runEnd;
        return new RawToken(RawTokenType.STRING, text, 0.0, lineNumber);
    }

    private RawToken single(RawTokenType type, char c) {
        linePosition++;
        return new RawToken(type, String.valueOf(c), 0.0, lineNumber);
    }

    private boolean readLine() throws LpReadException {
        if (endOfInput) {
            return false;
        }
        String line;
        try {
            line = reader.readLine();
        } catch (CharacterCodingException e) {
            // The decoder works ahead of the reader, so the offending byte may sit a few lines further on.
            throw new LpReadException(LpErrorCode.UNEXPECTED_CHARACTER,
                    "Input is not valid UTF-8 at or after line " + (lineNumber + 1),
                    new SourceInfo(sourceName, lineNumber + 1), e);
        } catch (IOException e) {
            throw new LpReadException(LpErrorCode.IO_ERROR_READING_INPUT,
                    "Failed to read line " + (lineNumber + 1) + " of " + sourceName + ": " + e.getMessage(), e);
        }
        if (line == null) {
            endOfInput = true;
            lineBuffer = "";
            linePosition = 0;
            return false;
        }
        if (!line.isEmpty() && line.charAt(line.length() - 1) == '\r') {
            line = line.substring(0, line.length() - 1);
        }
        lineBuffer = line;
        linePosition = 0;
        lineNumber++;
        return true;
    }

    /**
     * Scans a decimal floating-point literal: digits, an optional fraction and an optional exponent.
     * @param start The position to scan from.
     * @return The position after the literal, or {@code start} if there is none.
     */
    private int scanNumber(int start) {
        int pos = start;
        boolean hasDigits = false;
        while (pos < lineBuffer.length() && isDigit(lineBuffer.charAt(pos))) {
            pos++;
            hasDigits = true;
        }
        if (pos < lineBuffer.length() && lineBuffer.charAt(pos) == '.') {
            int afterDot = pos + 1;
            while (afterDot < lineBuffer.length() && isDigit(lineBuffer.charAt(afterDot))) {
                afterDot++;
                hasDigits = true;
            }
            if (hasDigits) {
                pos = afterDot;
            }
        }
        if (!hasDigits) {
            return start;
        }
        if (pos < lineBuffer.length() && (lineBuffer.charAt(pos) == 'e' || lineBuffer.charAt(pos) == 'E')) {
            int exp = pos + 1;
            if (exp < lineBuffer.length() && (lineBuffer.charAt(exp) == '+' || lineBuffer.charAt(exp) == '-')) {
                exp++;
            }
            if (exp < lineBuffer.length() && isDigit(lineBuffer.charAt(exp))) {
                while (exp < lineBuffer.length() && isDigit(lineBuffer.charAt(exp))) {
                    exp++;
                }
                pos = exp;
            }
        }
        return pos;
    }

    private boolean isRunCharacter(char c) {
        return RUN_TERMINATORS.indexOf(c) < 0 && !Character.isISOControl(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
