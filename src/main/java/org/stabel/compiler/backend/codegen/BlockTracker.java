package org.stabel.compiler.backend.codegen;

import org.stabel.compiler.api.BlockChecking;
import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.api.TranspilerErrorCode;
import org.stabel.compiler.diagnostics.DiagnosticsEngine;
import org.stabel.compiler.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Keeps count of the conditional blocks opened by {@code = then} and closed by
 * {@code !} and {@code end}.
 * <p>
 * In {@link BlockChecking#STRICT} mode every imbalance aborts the transpilation. In
 * {@link BlockChecking#LENIENT} mode it is recorded as a warning diagnostic and the braces are emitted
 * as written, leaving the C compiler to reject them.
 */
class BlockTracker {

    private final BlockChecking mode;
    private final DiagnosticsEngine diagnostics;
    private final Deque<OpenBlock> open = new ArrayDeque<>();

    BlockTracker(BlockChecking mode, DiagnosticsEngine diagnostics) {
        this.mode = mode;
        this.diagnostics = diagnostics;
    }

    /**
     * Records a block opened by the given {@code =} token.
     */
    void open(Token opener) {
        open.push(new OpenBlock(opener));
    }

    /**
     * Records the switch of the innermost block to its else branch.
     */
    void elseBranch(Token at) throws TranspilationException {
        OpenBlock block = open.peek();
        if (block == null) {
            violation(TranspilerErrorCode.ELSE_WITHOUT_IF,
                    "The word `!` must follow an open `= then` block", at);
            return;
        }
        if (block.hasElse) {
            violation(TranspilerErrorCode.DUPLICATE_ELSE,
                    "The block opened at line " + block.opener.line() + " already has an else branch", at);
            return;
        }
        block.hasElse = true;
    }

    /**
     * Records the close of the innermost block.
     */
    void close(Token at) throws TranspilationException {
        if (open.isEmpty()) {
            violation(TranspilerErrorCode.UNMATCHED_BLOCK_CLOSE,
                    "The word `end` has no open block to close", at);
            return;
        }
        open.pop();
    }

    /**
     * Checks that no block is left open once all tokens are processed.
     */
    void finish() throws TranspilationException {
        if (open.isEmpty()) {
            return;
        }
        Token opener = open.peek().opener;
        violation(TranspilerErrorCode.UNCLOSED_BLOCK,
                open.size() + " block(s) not closed with `end`", opener);
    }

    int depth() {
        return open.size();
    }

    private void violation(TranspilerErrorCode code, String message, Token at) throws TranspilationException {
        if (mode == BlockChecking.STRICT) {
            throw diagnostics.error(code, message, at.fileName(), at.line(), at.column());
        }
        diagnostics.warning(code, message, at.fileName(), at.line(), at.column());
    }

    private static final class OpenBlock {
        private final Token opener;
        private boolean hasElse;

        private OpenBlock(Token opener) {
            this.opener = opener;
        }
    }
}
