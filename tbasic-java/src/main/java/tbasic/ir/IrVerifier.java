package tbasic.ir;

import java.util.ArrayList;
import java.util.List;

/** Structural checks on a finished module. An empty result means well-formed. */
public final class IrVerifier {
    private IrVerifier() {}

    public static List<String> verify(Module module) {
        List<String> problems = new ArrayList<>();
        for (Function f : module.functions()) {
            if (f.isDeclaration()) continue;

            for (BasicBlock b : f.blocks()) {
                String where = "@" + f.name() + " %" + b.label();
                if (!b.isTerminated()) {
                    problems.add(where + ": missing terminator");
                    continue;
                }
                for (BasicBlock succ : b.successors()) {
                    if (succ.parent() != f) problems.add(where + ": branch to foreign block %" + succ.label());
                }
            }

            if (!f.predecessors(f.entryBlock()).isEmpty()) {
                problems.add("@" + f.name() + ": entry block has predecessors");
            }
        }
        return problems;
    }
}
