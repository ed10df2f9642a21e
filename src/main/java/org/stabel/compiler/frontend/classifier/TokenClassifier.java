package org.stabel.compiler.frontend.classifier;

import org.stabel.compiler.frontend.lexer.Operator;
import org.stabel.compiler.frontend.lexer.Token;
import org.stabel.compiler.frontend.lexer.TokenType;

import java.util.Optional;

/**
 * Answers what a single token is and what it carries.
 * <p>
 * All methods are pure functions of their arguments. The code generator calls them on the
 * current token as well as on its neighbors, so none of them may depend on position or state.
 */
public final class TokenClassifier {

    private TokenClassifier() {}

    /**
     * Returns the value of an integer token.
     * @param token An {@link TokenType#INTEGER} token.
     * @return The literal value.
     * @throws IllegalArgumentException if the token is not an integer.
     */
    public static int integerValue(Token token) {
        requireType(token, TokenType.INTEGER);
        if (token.value() instanceof Integer value) {
            return value;
        }
        return Integer.parseInt(token.text());
    }

    /**
     * Returns the name of an identifier token.
     * @param token An {@link TokenType#IDENTIFIER} token.
     * @return The identifier as written.
     * @throws IllegalArgumentException if the token is not an identifier.
     */
    public static String identifierName(Token token) {
        requireType(token, TokenType.IDENTIFIER);
        return token.text();
    }

    /**
     * Returns the operator of an operator token.
     * @param token Any token.
     * @return The operator, or empty if the token is not an operator or carries an unknown symbol.
     */
    public static Optional<Operator> operatorOf(Token token) {
        if (token.type() != TokenType.OPERATOR) {
            return Optional.empty();
        }
        if (token.value() instanceof Operator op) {
            return Optional.of(op);
        }
        if (token.text() == null || token.text().length() != 1) {
            return Optional.empty();
        }
        return Operator.fromSymbol(token.text().charAt(0));
    }

    /**
     * Returns the keyword an identifier token spells.
     * @param token Any token.
     * @return The keyword, or empty for non-identifiers and ordinary names.
     */
    public static Optional<Keyword> keywordOf(Token token) {
        if (token.type() != TokenType.IDENTIFIER) {
            return Optional.empty();
        }
        return Keyword.of(token.text());
    }

    public static boolean isIdentifier(Optional<Token> token) {
        return token.map(t -> t.type() == TokenType.IDENTIFIER).orElse(false);
    }

    public static boolean isKeyword(Optional<Token> token, Keyword keyword) {
        return token.flatMap(TokenClassifier::keywordOf).map(k -> k == keyword).orElse(false);
    }

    /**
     * Checks whether an optional neighbor is one of the given operators.
     * @param token A token or absent.
     * @param candidates The accepted operators.
     * @return {@code true} if the token is present and is one of {@code candidates}.
     */
    public static boolean isOperator(Optional<Token> token, Operator... candidates) {
        Optional<Operator> op = token.flatMap(TokenClassifier::operatorOf);
        if (op.isEmpty()) {
            return false;
        }
        for (Operator candidate : candidates) {
            if (op.get() == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Describes a token the way trace comments and the token listing show it,
     * e.g. {@code INT(5)}, {@code ID(echo)} or {@code OP(+)}.
     * @param token Any token.
     * @return A short description.
     */
    public static String describe(Token token) {
        return switch (token.type()) {
            case INTEGER -> "INT(" + token.text() + ")";
            case IDENTIFIER -> "ID(" + token.text() + ")";
            case OPERATOR -> "OP(" + token.text() + ")";
        };
    }

    private static void requireType(Token token, TokenType expected) {
        if (token.type() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " token but got " + describe(token));
        }
    }
}
