package tbasic.io;

import tbasic.ir.IrPrinter;
import tbasic.ir.Module;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes a module as an LLVM textual IR file ({@code .ll}). */
public final class IrWriter {
    private IrWriter() {}

    public static void write(Path out, Module module) throws IOException {
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            w.write(IrPrinter.print(module));
        }
    }

    /** {@code prog.bas} becomes {@code prog.ll}; any other name just gets {@code .ll} appended. */
    public static Path defaultOutput(Path input) {
        String name = input.getFileName().toString().replaceFirst("\\.bas$", "");
        return input.resolveSibling(name + ".ll");
    }
}
