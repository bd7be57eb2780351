package org.pragmatica.structlab.engine.linear;

import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.lang.Unit;
import org.pragmatica.structlab.snapshot.LinearSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Singly linked list. {@code size} always equals the number of nodes reachable from {@code head}.
 */
public final class LinkedListStructure implements IndexedList {
    public static final String TYPE = "linked_list";

    private static final class Node {
        final int value;
        Node next;

        Node(int value, Node next) {
            this.value = value;
            this.next = next;
        }
    }

    private Node head;
    private int size;

    private LinkedListStructure() {}

    public static LinkedListStructure create(List<Integer> values) {
        var list = new LinkedListStructure();
        values.forEach(list::append);
        return list;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Result<Unit> insert(int index, int value) {
        if (index < 0 || index > size) {
            return CommandError.OutOfRange.index(index, size + 1)
                                          .result();
        }
        if (index == 0) {
            head = new Node(value, head);
        } else {
            var previous = nodeAt(index - 1);
            previous.next = new Node(value, previous.next);
        }
        size++;
        return Result.unitResult();
    }

    @Override
    public Result<Integer> delete(int index) {
        if (index < 0 || index >= size) {
            return CommandError.OutOfRange.index(index, size)
                                          .result();
        }
        Node removed;
        if (index == 0) {
            removed = head;
            head = head.next;
        } else {
            var previous = nodeAt(index - 1);
            removed = previous.next;
            previous.next = removed.next;
        }
        size--;
        return Result.success(removed.value);
    }

    @Override
    public Result<Integer> get(int index) {
        if (index < 0 || index >= size) {
            return CommandError.OutOfRange.index(index, size)
                                          .result();
        }
        return Result.success(nodeAt(index).value);
    }

    @Override
    public Result<Integer> indexOf(int value) {
        var index = 0;
        for (var node = head; node != null; node = node.next) {
            if (node.value == value) {
                return Result.success(index);
            }
            index++;
        }
        return new CommandError.NotFound("Value " + value + " not found in " + TYPE).result();
    }

    @Override
    public void clear() {
        head = null;
        size = 0;
    }

    @Override
    public List<Integer> toList() {
        var values = new ArrayList<Integer>(size);
        for (var node = head; node != null; node = node.next) {
            values.add(node.value);
        }
        return values;
    }

    @Override
    public LinearSnapshot snapshot() {
        return new LinearSnapshot(TYPE, toList(), size, null);
    }

    private Node nodeAt(int index) {
        var node = head;
        for (int i = 0; i < index; i++) {
            node = node.next;
        }
        return node;
    }
}
