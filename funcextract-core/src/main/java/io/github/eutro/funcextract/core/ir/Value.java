package io.github.eutro.funcextract.core.ir;

import io.github.eutro.funcextract.core.ext.ExtHolder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Anything an instruction operand may reference.
 * <p>
 * Every value has an id, unique within its {@link Module}, assigned in creation order.
 * Values hash by their id, so iteration over hashed collections of values is the same
 * from run to run.
 */
public abstract class Value extends ExtHolder {
    private final int id;
    private final String name;
    private final List<Insn> users = new ArrayList<>();

    Value(Module module, String name) {
        this.name = name;
        this.id = module.register(this);
    }

    /**
     * Get the id of this value within its module.
     *
     * @return The id.
     */
    public int getId() {
        return id;
    }

    /**
     * Get the name of this value, which may be empty.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the instructions that use this value as an operand.
     * <p>
     * Only populated once the functions containing the users have been {@link Function#seal() sealed}.
     *
     * @return The users, in the order they were found.
     */
    public List<Insn> getUsers() {
        return Collections.unmodifiableList(users);
    }

    void addUser(Insn user) {
        users.add(user);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "%" + (name.isEmpty() ? String.valueOf(id) : name);
    }
}
