package org.stabel.test.utils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executes the body of a generated C program in-process.
 * <p>
 * Only the statement forms the transpiler emits are understood; anything else fails the
 * test with an {@link IllegalStateException}. Overflow and underflow behave like the emitted
 * {@code push}/{@code pop}: the message is printed and the run stops with exit code 1.
 */
public final class EmittedProgramRunner {

    private static final Pattern CAPACITY = Pattern.compile("#define MAX_SIZE (\\d+)");
    private static final Pattern PUSH = Pattern.compile("push\\((.+)\\);");
    private static final Pattern POP_INTO = Pattern.compile("(int )?(\\w+) = pop\\(\\);");
    private static final Pattern BINARY = Pattern.compile("pop\\(\\) ([-+*/]) __a__");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    /**
     * The observable behavior of one run.
     *
     * @param output The printed lines.
     * @param exitCode 0 on normal termination, 1 after a stack overflow or underflow.
     */
    public record Result(List<String> output, int exitCode) {}

    private final int capacity;
    private final List<String> statements;
    private final Map<Integer, Integer> jumpWhenFalse = new HashMap<>();
    private final Map<Integer, Integer> jumpOverElse = new HashMap<>();

    private final Deque<Integer> stack = new ArrayDeque<>();
    private final Map<String, Integer> variables = new HashMap<>();
    private final List<String> output = new ArrayList<>();
    private int a;
    private int b;

    private EmittedProgramRunner(String program) {
        Matcher m = CAPACITY.matcher(program);
        if (!m.find()) {
            throw new IllegalStateException("No MAX_SIZE in program");
        }
        this.capacity = Integer.parseInt(m.group(1));
        this.statements = mainBody(program);
        linkBlocks();
    }

    /**
     * Runs a generated program.
     * @param program The complete C text produced by the transpiler.
     * @return What the program printed and how it terminated.
     */
    public static Result run(String program) {
        return new EmittedProgramRunner(program).execute();
    }

    private static List<String> mainBody(String program) {
        int start = program.indexOf("int main(void) {\n");
        if (start < 0) {
            throw new IllegalStateException("No main function in program");
        }
        List<String> body = new ArrayList<>();
        for (String raw : program.substring(start).split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("//") || line.equals("int main(void) {")) {
                continue;
            }
            body.add(line);
        }
        // Drop the closing brace of main.
        body.remove(body.size() - 1);
        return body;
    }

    private void linkBlocks() {
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < statements.size(); i++) {
            String s = statements.get(i);
            if (s.startsWith("if (")) {
                open.push(i);
            } else if (s.equals("} else {")) {
                jumpWhenFalse.put(open.pop(), i + 1);
                open.push(i);
            } else if (s.equals("}")) {
                int opener = open.pop();
                if (statements.get(opener).startsWith("if (")) {
                    jumpWhenFalse.put(opener, i + 1);
                } else {
                    jumpOverElse.put(opener, i + 1);
                }
            }
        }
        if (!open.isEmpty()) {
            throw new IllegalStateException("Unbalanced blocks in program");
        }
    }

    private Result execute() {
        int pc = 0;
        try {
            while (pc < statements.size()) {
                String s = statements.get(pc);
                if (s.equals("return 0;")) {
                    return new Result(output, 0);
                } else if (s.equals("if (__a__ == __b__) {")) {
                    pc = a == b ? pc + 1 : jumpWhenFalse.get(pc);
                    continue;
                } else if (s.equals("} else {")) {
                    pc = jumpOverElse.get(pc);
                    continue;
                } else if (s.equals("}")) {
                    pc++;
                    continue;
                }
                step(s);
                pc++;
            }
        } catch (StackFault fault) {
            output.add(fault.getMessage());
            return new Result(output, 1);
        }
        return new Result(output, 0);
    }

    private void step(String s) {
        if (s.equals("printf(\"%d\\n\", pop());")) {
            output.add(String.valueOf(pop()));
            return;
        }
        if (s.equals("printf(\"%d\\n\", __a__);")) {
            output.add(String.valueOf(a));
            return;
        }
        Matcher popInto = POP_INTO.matcher(s);
        if (popInto.matches()) {
            assign(popInto.group(2), pop());
            return;
        }
        Matcher push = PUSH.matcher(s);
        if (push.matches()) {
            push(evaluate(push.group(1)));
            return;
        }
        throw new IllegalStateException("Unsupported statement: " + s);
    }

    private int evaluate(String expr) {
        if (INTEGER.matcher(expr).matches()) {
            return Integer.parseInt(expr);
        }
        if (expr.equals("__a__")) return a;
        if (expr.equals("__b__")) return b;
        if (expr.equals("__a__ == __b__")) return a == b ? 1 : 0;
        Matcher binary = BINARY.matcher(expr);
        if (binary.matches()) {
            int left = pop();
            return switch (binary.group(1)) {
                case "+" -> left + a;
                case "-" -> left - a;
                case "*" -> left * a;
                default -> left / a;
            };
        }
        Integer value = variables.get(expr);
        if (value == null) {
            throw new IllegalStateException("Unknown expression: " + expr);
        }
        return value;
    }

    private void assign(String target, int value) {
        switch (target) {
            case "__a__" -> a = value;
            case "__b__" -> b = value;
            default -> variables.put(target, value);
        }
    }

    private void push(int value) {
        if (stack.size() == capacity) {
            throw new StackFault("Stack Overflow");
        }
        stack.push(value);
    }

    private int pop() {
        if (stack.isEmpty()) {
            throw new StackFault("Stack Underflow");
        }
        return stack.pop();
    }

    private static final class StackFault extends RuntimeException {
        StackFault(String message) {
            super(message);
        }
    }
}
