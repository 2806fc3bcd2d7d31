package tbasic.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One compilation unit: global strings plus functions, in creation order. */
public final class Module {
    private final String name;
    private final List<GlobalString> globals = new ArrayList<>();
    private final Map<String, Function> functions = new LinkedHashMap<>();

    public Module(String name) {
        this.name = name;
    }

    public String name() { return name; }

    public List<GlobalString> globals() { return Collections.unmodifiableList(globals); }

    public Collection<Function> functions() { return Collections.unmodifiableCollection(functions.values()); }

    /** Returns null when no function of that name exists. */
    public Function function(String name) {
        return functions.get(name);
    }

    public Function addFunction(String name, FunctionType type) {
        if (functions.containsKey(name)) throw new IllegalStateException("Duplicate function: " + name);
        Function f = new Function(name, type);
        functions.put(name, f);
        return f;
    }

    public GlobalString addGlobalString(String hint, String text) {
        String unique = hint;
        int n = 1;
        while (hasGlobal(unique)) unique = hint + n++;
        GlobalString g = new GlobalString(unique, text);
        globals.add(g);
        return g;
    }

    private boolean hasGlobal(String name) {
        if (functions.containsKey(name)) return true;
        for (GlobalString g : globals) {
            if (g.name().equals(name)) return true;
        }
        return false;
    }
}
