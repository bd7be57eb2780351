package org.pragmatica.structlab.engine.linear;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.error.CommandError;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkedListStructureTest {

    @Test
    void create_appendsInOrder() {
        var list = LinkedListStructure.create(List.of(3, 1, 2));

        assertEquals(List.of(3, 1, 2), list.toList());
        assertEquals(3, list.size());
    }

    @Test
    void insert_atHeadMiddleAndTail() {
        var list = LinkedListStructure.create(List.of(2, 4));

        list.insert(0, 1).unwrap();
        list.insert(2, 3).unwrap();
        list.insert(4, 5).unwrap();

        assertEquals(List.of(1, 2, 3, 4, 5), list.toList());
    }

    @Test
    void insert_outOfRange_leavesListUnchanged() {
        var list = LinkedListStructure.create(List.of(1));

        assertInstanceOf(CommandError.OutOfRange.class, list.insert(-1, 0).fold(c -> c, unit -> null));
        assertInstanceOf(CommandError.OutOfRange.class, list.insert(2, 0).fold(c -> c, unit -> null));
        assertEquals(List.of(1), list.toList());
    }

    @Test
    void delete_headAndInner() {
        var list = LinkedListStructure.create(List.of(1, 2, 3));

        assertEquals(1, list.delete(0).unwrap());
        assertEquals(3, list.delete(1).unwrap());
        assertEquals(List.of(2), list.toList());
    }

    @Test
    void indexOf_firstOccurrence() {
        var list = LinkedListStructure.create(List.of(7, 8, 7));

        assertEquals(0, list.indexOf(7).unwrap());
        assertInstanceOf(CommandError.NotFound.class, list.indexOf(9).fold(c -> c, index -> null));
    }

    @Test
    void snapshot_hasNoCapacity() {
        var snapshot = LinkedListStructure.create(List.of(1)).snapshot();

        assertEquals("linked_list", snapshot.type());
        assertNull(snapshot.capacity());
    }

    @Test
    void clear_emptiesList() {
        var list = LinkedListStructure.create(List.of(1, 2));

        list.clear();

        assertTrue(list.isEmpty());
        assertEquals(List.of(), list.toList());
        assertTrue(list.get(0).isFailure());
    }
}
