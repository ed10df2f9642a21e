package org.stabel.cli.toolchain;

import com.typesafe.config.ConfigFactory;
import org.stabel.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(LogWatchExtension.class)
@Tag("unit")
class NativeCompilerTest {

    @Test
    void commandPlacesFlagsBeforeTheInput() {
        NativeCompiler compiler = new NativeCompiler("cc", List.of("-O2", "-Wall"));

        List<String> command = compiler.command(Path.of("prog.c"), Path.of("prog.out"));

        assertThat(command).containsExactly("cc", "-O2", "-Wall", "prog.c", "-o", "prog.out");
    }

    @Test
    void readsToolchainBlock() {
        NativeCompiler compiler = NativeCompiler.fromConfig(ConfigFactory.parseString("compiler = clang"));

        assertThat(compiler.getCompiler()).isEqualTo("clang");
        assertThat(compiler.command(Path.of("a.c"), Path.of("a.out"))).containsExactly("clang", "a.c", "-o", "a.out");
    }

    @Test
    void rejectsBlankCompiler() {
        assertThatThrownBy(() -> new NativeCompiler(" ", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingExecutableFailsToStart(@TempDir Path dir) {
        NativeCompiler compiler = new NativeCompiler(dir.resolve("no-such-cc").toString(), List.of());

        assertThatThrownBy(() -> compiler.compile(dir.resolve("a.c"), dir.resolve("a.out")))
                .isInstanceOf(IOException.class);
    }
}
