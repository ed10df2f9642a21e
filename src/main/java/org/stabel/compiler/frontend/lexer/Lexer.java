package org.stabel.compiler.frontend.lexer;

import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.api.TranspilerErrorCode;
import org.stabel.compiler.diagnostics.CompilerLogger;
import org.stabel.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Scanning is a single left-to-right, maximal-munch pass. The first character outside the
 * grammar aborts the whole run; no partial token sequence is ever returned.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens in source order.
     * @throws TranspilationException on the first character outside the grammar
     *         or on an integer literal that does not fit an {@code int}.
     */
    public TokenSequence scanTokens() throws TranspilationException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        CompilerLogger.debug("Lexer: " + tokens.size() + " tokens in " + logicalFileName);
        return new TokenSequence(tokens);
    }

    private void scanToken() throws TranspilationException {
        char c = advance();
        switch (c) {
            case ' ':
                break;
            case '\n':
                line++;
                lineStart = current;
                break;
            default:
                if (isDigit(c)) {
                    integer();
                } else if (isAlpha(c)) {
                    identifier();
                } else if (Operator.fromSymbol(c).isPresent()) {
                    addToken(TokenType.OPERATOR, Operator.fromSymbol(c).get());
                } else {
                    throw error(TranspilerErrorCode.UNRECOGNIZED_CHARACTER,
                            "Unrecognized character: '" + printable(c) + "'");
                }
                break;
        }
    }

    /**
     * Scans a digit run. Values beyond {@link Integer#MAX_VALUE} are rejected because the
     * emitted stack holds C {@code int}s.
     */
    private void integer() throws TranspilationException {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            addToken(TokenType.INTEGER, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw error(TranspilerErrorCode.INTEGER_LITERAL_OUT_OF_RANGE,
                    "Integer literal out of range: " + text);
        }
    }

    private void identifier() {
        while (isAlpha(peek())) advance();
        addToken(TokenType.IDENTIFIER, source.substring(start, current));
    }

    private TranspilationException error(TranspilerErrorCode code, String message) {
        return diagnostics.error(code, message, logicalFileName, line, column());
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, column(), logicalFileName));
    }

    private int column() {
        return start - lineStart + 1;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static String printable(char c) {
        return switch (c) {
            case '\t' -> "\\t";
            case '\r' -> "\\r";
            default -> Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
        };
    }
}
