package org.stabel.compiler.backend.emit;

import org.stabel.compiler.api.TranspilerOptions;

import java.util.List;

/**
 * The final stage of the transpiler. It wraps the generated statements into a complete,
 * standalone C translation unit: a bounded integer array stack, guarded {@code push} and
 * {@code pop} primitives, two scratch registers and the {@code main} entry point.
 */
public class Emitter {

    private final TranspilerOptions options;

    /**
     * Creates an emitter.
     * @param options The options; the stack capacity becomes {@code MAX_SIZE}.
     */
    public Emitter(TranspilerOptions options) {
        this.options = options;
    }

    /**
     * Emits the complete program text.
     *
     * @param body The statements generated for the program's tokens.
     * @param fileScopeSymbols Variables declared as {@code int} globals, for names first defined inside a block.
     * @return The C source text.
     */
    public String emit(CodeBuffer body, List<String> fileScopeSymbols) {
        String i1 = CodeBuffer.INDENT;
        String i2 = i1.repeat(2);

        StringBuilder sb = new StringBuilder();
        sb.append("// Generated by stabel\n");
        sb.append("#include <stdio.h>\n");
        sb.append("#include <stdlib.h>\n");
        sb.append('\n');
        sb.append("#define MAX_SIZE ").append(options.stackCapacity()).append('\n');
        sb.append('\n');
        sb.append("int stack[MAX_SIZE];\n");
        sb.append("int top = -1;\n");
        sb.append("int __a__;\n");
        sb.append("int __b__;\n");
        for (String symbol : fileScopeSymbols) {
            sb.append("int ").append(symbol).append(";\n");
        }
        sb.append('\n');
        sb.append("void push(int item) {\n");
        sb.append(i1).append("if (top == MAX_SIZE - 1) {\n");
        sb.append(i2).append("printf(\"Stack Overflow\\n\");\n");
        sb.append(i2).append("exit(1);\n");
        sb.append(i1).append("}\n");
        sb.append(i1).append("stack[++top] = item;\n");
        sb.append("}\n");
        sb.append('\n');
        sb.append("int pop(void) {\n");
        sb.append(i1).append("if (top == -1) {\n");
        sb.append(i2).append("printf(\"Stack Underflow\\n\");\n");
        sb.append(i2).append("exit(1);\n");
        sb.append(i1).append("}\n");
        sb.append(i1).append("return stack[top--];\n");
        sb.append("}\n");
        sb.append('\n');
        sb.append("int main(void) {\n");
        sb.append(body);
        sb.append(i1).append("return 0;\n");
        sb.append("}\n");
        return sb.toString();
    }
}
