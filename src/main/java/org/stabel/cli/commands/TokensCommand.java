package org.stabel.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.stabel.compiler.Transpiler;
import org.stabel.compiler.api.ITranspiler;
import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.frontend.classifier.TokenClassifier;
import org.stabel.compiler.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "tokens", description = "Lists the tokens of a Stabel program.")
public class TokensCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The Stabel source file.")
    private File file;

    @Option(names = "--json", description = "Print the tokens as a JSON array.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        final List<Token> tokens;
        try {
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            ITranspiler transpiler = new Transpiler();
            tokens = transpiler.tokenize(source, file.getPath());
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return TranspileCommand.EXIT_IO_ERROR;
        } catch (TranspilationException e) {
            err.println(e.getMessage());
            return TranspileCommand.EXIT_TRANSPILATION_FAILED;
        }

        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            List<Map<String, Object>> rows = tokens.stream()
                    .map(TokensCommand::toRow)
                    .collect(Collectors.toList());
            out.println(gson.toJson(rows));
        } else {
            tokens.forEach(t -> out.println(TokenClassifier.describe(t)));
        }
        out.flush();
        return 0;
    }

    private static Map<String, Object> toRow(Token token) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", token.type().name());
        row.put("text", token.text());
        row.put("line", token.line());
        row.put("column", token.column());
        return row;
    }
}
