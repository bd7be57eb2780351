package org.pragmatica.structlab.dispatch;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.error.CommandError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScriptSequencerTest {

    @Test
    void split_separatesLinesAndSemicolons() {
        var commands = ScriptSequencer.split("""
            # comment
            create stack; push 1 to stack

            // another comment
              pop stack  ;
            """);

        assertEquals(List.of("create stack", "push 1 to stack", "pop stack"), commands);
    }

    @Test
    void split_keepsSemicolonsInsideQuotes() {
        var commands = ScriptSequencer.split("encode \"a;b\" using huffman; decode 01 using huffman");

        assertEquals(List.of("encode \"a;b\" using huffman", "decode 01 using huffman"), commands);
    }

    @Test
    void split_escapedQuoteDoesNotCloseString() {
        var commands = ScriptSequencer.split("encode \"a\\\";b\" using huffman");

        assertEquals(1, commands.size());
    }

    @Test
    void run_failuresDoNotStopScript() {
        var report = StructLab.sequencer().run("""
            create arraylist with 1,2
            delete at 5 from arraylist
            insert 3 in arraylist
            """);

        assertEquals(3, report.entries().size());
        assertEquals(2, report.succeeded());
        assertEquals(1, report.failed());
        assertFalse(report.allSucceeded());
        assertInstanceOf(CommandError.OutOfRange.class, report.entries().get(1).result().cause().orElseThrow());
        assertEquals("Inserted 3 at 2", report.entries().get(2).result().message());
    }

    @Test
    void run_completesBuildsAndListsReplayedCommands() {
        var report = StructLab.sequencer().run("build bst with 5,3,8; insert 4 in bst; search 4 in bst");

        assertTrue(report.allSucceeded());
        assertThat(report.entries()).extracting(ScriptReport.Entry::command)
                                    .containsExactly("build bst with 5,3,8", "insert 4 in bst", "search 4 in bst");
        assertEquals("Found 4 via 5 -> 3 -> 4", report.entries().get(2).result().message());
    }

    @Test
    void run_withoutAutoComplete_queuesBehindBuild() {
        var dispatcher = StructLab.builder()
                                  .autoCompleteBuilds(false)
                                  .build()
                                  .unwrap();

        var report = ScriptSequencer.create(dispatcher).run("build avl with 1,2,3\nsearch 2 in avl");

        assertEquals("queued: search runs after the build", report.entries().get(1).result().message());
        assertTrue(dispatcher.isBuilding());

        var finished = dispatcher.completeBuild().orElseThrow();
        assertEquals("Found 2 via 2", finished.replayed().get(0).result().message());
    }

    @Test
    void run_replayedEntries_carryTheirOwnCommandText() {
        var dispatcher = Dispatcher.create(EngineConfig.DEFAULT);
        dispatcher.submit("build bst with 5,3,8");
        dispatcher.submit("search 3 in bst");

        var report = ScriptSequencer.create(dispatcher).run("insert 4 in bst");

        var commands = report.entries().stream().map(ScriptReport.Entry::command).toList();
        assertEquals(List.of("insert 4 in bst", "(replayed) search 3 in bst", "(replayed) insert 4 in bst"),
                     commands);
        assertEquals("Found 3 via 5 -> 3", report.entries().get(1).result().message());
        assertFalse(dispatcher.isBuilding());
    }

    @Test
    void run_emptyScript_isEmptyReport() {
        var report = StructLab.sequencer().run("\n# nothing\n");

        assertTrue(report.entries().isEmpty());
        assertTrue(report.allSucceeded());
    }
}
