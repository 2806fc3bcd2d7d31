package tbasic.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A declaration when it has no blocks, a definition otherwise. Block labels
 * and value names share one namespace and are made unique on request.
 */
public final class Function {
    private final String name;
    private final FunctionType type;
    private final List<Argument> params;
    private final List<BasicBlock> blocks = new ArrayList<>();

    private final Set<String> usedNames = new HashSet<>();
    private final Map<String, Integer> nextSuffix = new HashMap<>();

    Function(String name, FunctionType type) {
        this.name = name;
        this.type = type;

        List<Argument> ps = new ArrayList<>();
        for (int i = 0; i < type.paramTypes().size(); i++) {
            ps.add(new Argument(uniqueName("arg" + i), type.paramTypes().get(i), i));
        }
        this.params = List.copyOf(ps);
    }

    public String name() { return name; }

    public FunctionType type() { return type; }

    public List<Argument> params() { return params; }

    public Argument param(int index) { return params.get(index); }

    public List<BasicBlock> blocks() { return Collections.unmodifiableList(blocks); }

    public boolean isDeclaration() { return blocks.isEmpty(); }

    public BasicBlock entryBlock() {
        if (blocks.isEmpty()) throw new IllegalStateException("Function has no body: " + name);
        return blocks.get(0);
    }

    public BasicBlock appendBlock(String hint) {
        BasicBlock b = new BasicBlock(uniqueName(hint), this);
        blocks.add(b);
        return b;
    }

    /** Blocks whose terminator can transfer control to {@code target}. */
    public List<BasicBlock> predecessors(BasicBlock target) {
        List<BasicBlock> preds = new ArrayList<>();
        for (BasicBlock b : blocks) {
            if (b.successors().contains(target)) preds.add(b);
        }
        return preds;
    }

    String uniqueName(String hint) {
        String base = (hint == null || hint.isEmpty()) ? "tmp" : hint;
        if (usedNames.add(base)) return base;

        int n = nextSuffix.getOrDefault(base, 1);
        while (!usedNames.add(base + n)) n++;
        nextSuffix.put(base, n + 1);
        return base + n;
    }

    @Override
    public String toString() {
        return "@" + name;
    }
}
