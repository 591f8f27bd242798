package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A compilation unit: a set of functions and globals, and the arena that numbers every {@link Value} in them.
 */
public final class Module extends ExtHolder {
    private final String name;
    private final List<Value> values = new ArrayList<>();
    private final Map<String, Function> functions = new LinkedHashMap<>();
    private final Map<String, GlobalVariable> globals = new LinkedHashMap<>();

    public Module(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    int register(Value value) {
        values.add(value);
        return values.size() - 1;
    }

    /**
     * Get a value by its id.
     *
     * @param id The id.
     * @return The value.
     */
    public Value getValue(int id) {
        return values.get(id);
    }

    public Function newFunction(String name) {
        if (functions.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate function " + name);
        }
        Function func = new Function(this, name);
        functions.put(name, func);
        return func;
    }

    public @Nullable Function getFunction(String name) {
        return functions.get(name);
    }

    public Collection<Function> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public GlobalVariable newGlobal(String name) {
        if (globals.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate global " + name);
        }
        GlobalVariable global = new GlobalVariable(this, name);
        globals.put(name, global);
        return global;
    }

    public Collection<GlobalVariable> getGlobals() {
        return Collections.unmodifiableCollection(globals.values());
    }

    /**
     * Create a constant operand.
     *
     * @param text The literal text of the constant.
     * @return The constant.
     */
    public Constant constant(String text) {
        return new Constant(this, text);
    }

    @Override
    public String toString() {
        return "module " + name;
    }
}
