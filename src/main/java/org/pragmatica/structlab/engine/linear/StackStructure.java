package org.pragmatica.structlab.engine.linear;

import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;

import java.util.List;

/**
 * Array-backed stack. Element 0 is the bottom, the top is at {@code size() - 1}.
 */
public final class StackStructure extends ArrayBackedStructure {
    public static final String TYPE = "stack";

    private StackStructure(int capacity, int minimumCapacity) {
        super(capacity, minimumCapacity);
    }

    /**
     * New stack with {@code values} pushed in order, so the last value is on top.
     */
    public static StackStructure create(List<Integer> values, int capacity, int minimumCapacity) {
        var stack = new StackStructure(capacity, minimumCapacity);
        values.forEach(stack::push);
        return stack;
    }

    @Override
    public String type() {
        return TYPE;
    }

    public void push(int value) {
        insertAt(size(), value);
    }

    public Result<Integer> pop() {
        if (isEmpty()) {
            return emptyStack();
        }
        return Result.success(removeAt(size() - 1));
    }

    public Result<Integer> peek() {
        if (isEmpty()) {
            return emptyStack();
        }
        return get(size() - 1);
    }

    private static Result<Integer> emptyStack() {
        return new CommandError.NotFound("stack is empty").result();
    }
}
