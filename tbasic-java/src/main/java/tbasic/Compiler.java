package tbasic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tbasic.ast.Program;
import tbasic.codegen.CodeGenerator;
import tbasic.ir.Module;
import tbasic.lexer.Lexer;
import tbasic.parser.Parser;

/**
 * Source text to IR module for one compilation unit. Any stage failure
 * surfaces as a {@link CompileException}.
 */
public final class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    private final String moduleName;

    public Compiler(String moduleName) {
        this.moduleName = moduleName;
    }

    public Program parse(String source) {
        Program program = new Parser(new Lexer(source)).parseProgram();
        logger.debug("Parsed {} top-level statements", program.statements().size());
        return program;
    }

    public Module generate(Program program) {
        return new CodeGenerator(moduleName).generate(program);
    }

    public Module compile(String source) {
        return generate(parse(source));
    }
}
