package org.stabel.compiler.backend.emit;

/**
 * Append-only buffer for the statements generated from the token stream.
 * <p>
 * The buffer indents every line by the number of open blocks. It does not validate that
 * blocks are balanced; a close without an open block is written at the outermost level.
 */
public class CodeBuffer {

    /** One level of indentation in the generated code. */
    public static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private final int baseIndent;
    private int depth = 0;

    /**
     * Creates a buffer whose lines sit one level deep, i.e. inside the body of {@code main}.
     */
    public CodeBuffer() {
        this(1);
    }

    /**
     * Creates a buffer with a custom base indentation.
     * @param baseIndent The number of indentation levels applied to every line.
     */
    public CodeBuffer(int baseIndent) {
        this.baseIndent = Math.max(0, baseIndent);
    }

    /**
     * Appends one statement line at the current depth.
     * @param statement The statement text without indentation or line break.
     */
    public void line(String statement) {
        sb.append(INDENT.repeat(baseIndent + depth)).append(statement).append('\n');
    }

    /**
     * Appends a line comment at the current depth.
     * @param text The comment text.
     */
    public void comment(String text) {
        line("// " + text);
    }

    /**
     * Appends a block header such as <code>if (...) {</code> and indents the following lines.
     * @param header The header line, ending with an opening brace.
     */
    public void openBlock(String header) {
        line(header);
        depth++;
    }

    /**
     * Closes the innermost block.
     */
    public void closeBlock() {
        depth = Math.max(0, depth - 1);
        line("}");
    }

    /**
     * Closes the innermost block and opens its else branch at the same depth.
     */
    public void elseBlock() {
        int inner = depth;
        depth = Math.max(0, depth - 1);
        line("} else {");
        depth = inner;
    }

    /**
     * Appends the blank line that separates the statements of two consecutive tokens.
     */
    public void separator() {
        sb.append('\n');
    }

    /**
     * Returns the number of blocks currently open as seen by the indentation.
     * @return The current block depth.
     */
    public int depth() {
        return depth;
    }

    public boolean isEmpty() {
        return sb.length() == 0;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
