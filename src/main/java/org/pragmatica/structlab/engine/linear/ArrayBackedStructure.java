package org.pragmatica.structlab.engine.linear;

import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.snapshot.LinearSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Contiguous storage with explicit capacity. Capacity doubles when full and halves, never below
 * the floor, once fewer than a quarter of the slots are used after a removal.
 */
abstract sealed class ArrayBackedStructure implements LinearStructure permits ArrayListStructure, StackStructure {
    private final int minimumCapacity;
    private int[] elements;
    private int size;

    protected ArrayBackedStructure(int capacity, int minimumCapacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.minimumCapacity = minimumCapacity;
        this.elements = new int[capacity];
        this.size = 0;
    }

    @Override
    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    @Override
    public Result<Integer> get(int index) {
        if (index < 0 || index >= size) {
            return CommandError.OutOfRange.index(index, size)
                                          .result();
        }
        return Result.success(elements[index]);
    }

    @Override
    public Result<Integer> indexOf(int value) {
        for (int i = 0; i < size; i++) {
            if (elements[i] == value) {
                return Result.success(i);
            }
        }
        return new CommandError.NotFound("Value " + value + " not found in " + type()).result();
    }

    @Override
    public void clear() {
        elements = new int[elements.length];
        size = 0;
    }

    @Override
    public List<Integer> toList() {
        var list = new ArrayList<Integer>(size);
        for (int i = 0; i < size; i++) {
            list.add(elements[i]);
        }
        return list;
    }

    @Override
    public LinearSnapshot snapshot() {
        return new LinearSnapshot(type(), toList(), size, elements.length);
    }

    protected void insertAt(int index, int value) {
        if (size == elements.length) {
            resize(elements.length << 1);
        }
        System.arraycopy(elements, index, elements, index + 1, size - index);
        elements[index] = value;
        size++;
    }

    protected int removeAt(int index) {
        var removed = elements[index];
        System.arraycopy(elements, index + 1, elements, index, size - index - 1);
        size--;
        elements[size] = 0;
        shrinkIfSparse();
        return removed;
    }

    private void shrinkIfSparse() {
        var capacity = elements.length;
        if (size >= capacity / 4) {
            return;
        }
        var target = Math.max(capacity / 2, Math.min(minimumCapacity, capacity));
        if (target < capacity) {
            resize(target);
        }
    }

    private void resize(int newCapacity) {
        elements = Arrays.copyOf(elements, newCapacity);
    }
}
