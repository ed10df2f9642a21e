package org.stabel.cli.commands;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TokensCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new TokensCommand());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void listsOneTokenPerLine() throws IOException {
        Path file = Files.writeString(tempDir.resolve("p.stabel"), "5 x def\n+");

        int exitCode = execute("-f", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("INT(5)", "ID(x)", "ID(def)", "OP(+)");
    }

    @Test
    void printsJsonRows() throws IOException {
        Path file = Files.writeString(tempDir.resolve("p.stabel"), "5\n  echo");

        int exitCode = execute("-f", file.toString(), "--json");

        assertThat(exitCode).isZero();
        JsonArray rows = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(rows.size()).isEqualTo(2);
        JsonObject echo = rows.get(1).getAsJsonObject();
        assertThat(echo.get("type").getAsString()).isEqualTo("IDENTIFIER");
        assertThat(echo.get("text").getAsString()).isEqualTo("echo");
        assertThat(echo.get("line").getAsInt()).isEqualTo(2);
        assertThat(echo.get("column").getAsInt()).isEqualTo(3);
    }

    @Test
    void lexicalErrorExitsWithOne() throws IOException {
        Path file = Files.writeString(tempDir.resolve("p.stabel"), "1 #");

        assertThat(execute("-f", file.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Unrecognized character: '#'");
    }

    @Test
    void missingFileExitsWithTwo() {
        assertThat(execute("-f", tempDir.resolve("none.stabel").toString())).isEqualTo(2);
    }
}
