package tbasic.cli;

import tbasic.CompileException;
import tbasic.Compiler;
import tbasic.io.IrWriter;
import tbasic.ir.Module;

import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {
    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: tbasic <input.bas> [output.ll]");
            System.exit(2);
        }

        Path input = Path.of(args[0]);
        Path output = (args.length >= 2) ? Path.of(args[1]) : IrWriter.defaultOutput(input);
        String moduleName = input.getFileName().toString().replaceFirst("\\.bas$", "");

        // 1. Read
        String source = Files.readString(input);
        System.out.println("[1/4] Reading: " + input);

        Compiler compiler = new Compiler(moduleName);
        Module module;
        try {
            // 2. Lexer + parser
            var program = compiler.parse(source);
            System.out.println("[2/4] Parser: " + program.statements().size() + " statements");

            // 3. IR
            module = compiler.generate(program);
            System.out.println("[3/4] Codegen: " + module.functions().size() + " functions");
        } catch (CompileException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // 4. Write
        IrWriter.write(output, module);
        System.out.println("[4/4] Writing: " + output);

        int blocks = module.functions().stream().mapToInt(f -> f.blocks().size()).sum();
        int insns = module.functions().stream()
                .flatMap(f -> f.blocks().stream())
                .mapToInt(b -> b.instructions().size())
                .sum();
        long defined = module.functions().stream().filter(f -> !f.isDeclaration()).count();

        System.out.println("\nSuccess: " + output);
        System.out.println("  Functions:    " + defined + " defined, "
                + (module.functions().size() - defined) + " declared");
        System.out.println("  Blocks:       " + blocks);
        System.out.println("  Instructions: " + insns);
    }
}
