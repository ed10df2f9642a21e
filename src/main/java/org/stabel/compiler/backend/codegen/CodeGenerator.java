package org.stabel.compiler.backend.codegen;

import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.api.TranspilerErrorCode;
import org.stabel.compiler.api.TranspilerOptions;
import org.stabel.compiler.backend.emit.CodeBuffer;
import org.stabel.compiler.diagnostics.CompilerLogger;
import org.stabel.compiler.diagnostics.DiagnosticsEngine;
import org.stabel.compiler.frontend.classifier.Keyword;
import org.stabel.compiler.frontend.classifier.TokenClassifier;
import org.stabel.compiler.frontend.lexer.Operator;
import org.stabel.compiler.frontend.lexer.Token;
import org.stabel.compiler.frontend.lexer.TokenSequence;
import org.stabel.compiler.frontend.semantics.VariableRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Translates a token sequence into C statements against an explicit runtime stack.
 * <p>
 * The generator makes a single forward pass without building a tree. Context-sensitive
 * words are resolved by looking one token back or ahead. For an identifier the priority is:
 * keyword, then declared variable, then fresh declaration target (followed by {@code def}),
 * and anything else is an error.
 * <p>
 * An instance is good for one pass only.
 */
public class CodeGenerator {

    /** Scratch register holding the first value popped by a multi-operand statement. */
    static final String REGISTER_A = "__a__";
    /** Scratch register holding the second value popped by a multi-operand statement. */
    static final String REGISTER_B = "__b__";

    private static final String VARIABLE_PREFIX = "var_";

    private final TokenSequence tokens;
    private final VariableRegistry variables;
    private final DiagnosticsEngine diagnostics;
    private final TranspilerOptions options;
    private final CodeBuffer out;
    private final BlockTracker blocks;
    private final List<String> fileScopeSymbols = new ArrayList<>();

    /**
     * Creates a generator for one pass.
     * @param tokens The program's tokens.
     * @param variables The registry of declared variables, filled during the pass.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param options The code generation options.
     * @param out The buffer receiving the statements.
     */
    public CodeGenerator(TokenSequence tokens,
                         VariableRegistry variables,
                         DiagnosticsEngine diagnostics,
                         TranspilerOptions options,
                         CodeBuffer out) {
        this.tokens = tokens;
        this.variables = variables;
        this.diagnostics = diagnostics;
        this.options = options;
        this.out = out;
        this.blocks = new BlockTracker(options.blockChecking(), diagnostics);
    }

    /**
     * Emits the statements of every token in source order.
     * @throws TranspilationException on the first token that cannot be translated.
     */
    public void generate() throws TranspilationException {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.at(i).orElseThrow();
            CompilerLogger.trace(() -> "CodeGenerator: " + TokenClassifier.describe(token) + " at " + token.line() + ":" + token.column());

            if (options.traceComments()) {
                out.comment(TokenClassifier.describe(token));
            }

            switch (token.type()) {
                case INTEGER -> out.line("push(" + TokenClassifier.integerValue(token) + ");");
                case IDENTIFIER -> identifier(i, token);
                case OPERATOR -> operator(i, token);
            }

            if (i < tokens.size() - 1) {
                out.separator();
            }
        }
        blocks.finish();
    }

    /**
     * Returns the variables whose first declaration sits inside a conditional block. The
     * emitter declares them at file scope; they are assigned where the source declares them.
     * @return The C symbols in declaration order.
     */
    public List<String> getFileScopeSymbols() {
        return Collections.unmodifiableList(fileScopeSymbols);
    }

    /**
     * Maps a source variable name to its name in the generated code.
     * @param name The source name.
     * @return The C identifier.
     */
    public static String variableSymbol(String name) {
        return VARIABLE_PREFIX + name;
    }

    private void identifier(int index, Token token) throws TranspilationException {
        String name = TokenClassifier.identifierName(token);
        Optional<Keyword> keyword = Keyword.of(name);
        if (keyword.isPresent()) {
            keyword(index, token, keyword.get());
            return;
        }

        boolean declarationTarget = TokenClassifier.isKeyword(tokens.next(index), Keyword.DEF);
        if (variables.isDeclared(name)) {
            if (!declarationTarget) {
                out.line("push(" + variableSymbol(name) + ");");
            }
            return;
        }
        if (!declarationTarget) {
            throw error(TranspilerErrorCode.UNRECOGNIZED_IDENTIFIER, "Unrecognized identifier: " + name, token);
        }
        // the following def emits the declaration
    }

    private void keyword(int index, Token token, Keyword keyword) throws TranspilationException {
        switch (keyword) {
            case ECHO -> out.line("printf(\"%d\\n\", pop());");
            case PEEK -> {
                out.line(REGISTER_A + " = pop();");
                out.line("push(" + REGISTER_A + ");");
                out.line("printf(\"%d\\n\", " + REGISTER_A + ");");
            }
            case END -> {
                blocks.close(token);
                out.closeBlock();
            }
            case THEN -> {
                if (!TokenClassifier.isOperator(tokens.previous(index), Operator.EQUALS, Operator.ELSE)) {
                    throw error(TranspilerErrorCode.MISSING_EQUALITY_BEFORE_THEN,
                            "The word `then` must have an equal or not equal symbol", token);
                }
            }
            case DEF -> define(index, token);
        }
    }

    private void define(int index, Token token) throws TranspilationException {
        Optional<Token> target = tokens.previous(index);
        if (!TokenClassifier.isIdentifier(target)) {
            throw error(TranspilerErrorCode.MISSING_IDENTIFIER_BEFORE_DEF,
                    "The word `def` must have an identifier before it", token);
        }
        String name = TokenClassifier.identifierName(target.get());
        String symbol = variableSymbol(name);
        if (variables.declare(name)) {
            if (out.depth() == 0) {
                out.line("int " + symbol + " = pop();");
                return;
            }
            // first declared inside a block, so it must outlive the block
            fileScopeSymbols.add(symbol);
        }
        out.line(symbol + " = pop();");
    }

    private void operator(int index, Token token) throws TranspilationException {
        Optional<Operator> op = TokenClassifier.operatorOf(token);
        if (op.isEmpty()) {
            throw error(TranspilerErrorCode.UNRECOGNIZED_TOKEN,
                    "Unrecognized token: " + TokenClassifier.describe(token), token);
        }

        switch (op.get()) {
            case ADD, SUBTRACT, MULTIPLY, DIVIDE -> {
                out.line(REGISTER_A + " = pop();");
                out.line("push(pop() " + op.get().symbol() + " " + REGISTER_A + ");");
            }
            case SWAP -> {
                out.line(REGISTER_A + " = pop();");
                out.line(REGISTER_B + " = pop();");
                out.line("push(" + REGISTER_A + ");");
                out.line("push(" + REGISTER_B + ");");
            }
            case DUPLICATE -> {
                out.line(REGISTER_A + " = pop();");
                out.line("push(" + REGISTER_A + ");");
                out.line("push(" + REGISTER_A + ");");
            }
            case EQUALS -> {
                out.line(REGISTER_B + " = pop();");
                out.line(REGISTER_A + " = pop();");
                if (TokenClassifier.isKeyword(tokens.next(index), Keyword.THEN)) {
                    blocks.open(token);
                    out.openBlock("if (" + REGISTER_A + " == " + REGISTER_B + ") {");
                } else {
                    out.line("push(" + REGISTER_A + " == " + REGISTER_B + ");");
                }
            }
            case ELSE -> {
                blocks.elseBranch(token);
                out.elseBlock();
            }
        }
    }

    private TranspilationException error(TranspilerErrorCode code, String message, Token at) {
        return diagnostics.error(code, message, at.fileName(), at.line(), at.column());
    }
}
