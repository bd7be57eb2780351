package org.pragmatica.structlab.engine.linear;

import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.lang.Unit;

import java.util.List;

/**
 * Array-backed list.
 */
public final class ArrayListStructure extends ArrayBackedStructure implements IndexedList {
    public static final String TYPE = "array_list";

    private ArrayListStructure(int capacity, int minimumCapacity) {
        super(capacity, minimumCapacity);
    }

    /**
     * New list holding {@code values} in order; capacity grows past {@code capacity} if needed.
     */
    public static ArrayListStructure create(List<Integer> values, int capacity, int minimumCapacity) {
        var list = new ArrayListStructure(capacity, minimumCapacity);
        values.forEach(value -> list.insertAt(list.size(), value));
        return list;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Result<Unit> insert(int index, int value) {
        if (index < 0 || index > size()) {
            return CommandError.OutOfRange.index(index, size() + 1)
                                          .result();
        }
        insertAt(index, value);
        return Result.unitResult();
    }

    @Override
    public Result<Integer> delete(int index) {
        if (index < 0 || index >= size()) {
            return CommandError.OutOfRange.index(index, size())
                                          .result();
        }
        return Result.success(removeAt(index));
    }
}
