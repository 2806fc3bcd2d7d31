package tbasic.codegen;

import tbasic.ir.Instruction;

import java.util.HashMap;
import java.util.Map;

/**
 * Variable name to stack slot. The language has a single flat scope, so a
 * redefinition simply replaces the previous slot.
 */
public final class SymbolTable {
    private final Map<String, Instruction.Alloca> slots = new HashMap<>();

    public void define(String name, Instruction.Alloca slot) {
        slots.put(name, slot);
    }

    public Instruction.Alloca lookup(String name) {
        return slots.get(name);
    }
}
