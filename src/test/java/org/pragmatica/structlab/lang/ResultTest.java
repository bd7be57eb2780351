package org.pragmatica.structlab.lang;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.error.CommandError;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void map_onSuccess_transformsValue() {
        var result = Result.success(20).map(value -> value + 1);

        assertTrue(result.isSuccess());
        assertEquals(21, result.unwrap());
    }

    @Test
    void map_onFailure_keepsCause() {
        Result<Integer> failed = new CommandError.NotFound("missing").result();

        var result = failed.map(value -> value + 1);

        assertTrue(result.isFailure());
        assertEquals("missing", result.fold(Cause::message, value -> "unexpected"));
    }

    @Test
    void flatMap_chainsFailures() {
        var result = Result.success(3)
                           .flatMap(value -> new CommandError.InvalidArgument("bad " + value).<String>result());

        assertTrue(result.isFailure());
        assertEquals("bad 3", result.fold(Cause::message, value -> value));
    }

    @Test
    void unwrap_onFailure_throws() {
        Result<Integer> failed = new CommandError.NotFound("gone").result();

        var error = assertThrows(IllegalStateException.class, failed::unwrap);
        assertTrue(error.getMessage().contains("gone"));
    }

    @Test
    void allOf_firstFailureWins() {
        var result = Result.allOf(List.of(Result.success(1),
                                          new CommandError.NotFound("first").<Integer>result(),
                                          new CommandError.NotFound("second").<Integer>result()));

        assertEquals("first", result.fold(Cause::message, values -> "unexpected"));
    }

    @Test
    void allOf_allSuccessful_collectsInOrder() {
        var result = Result.allOf(List.of(Result.success(1), Result.success(2), Result.success(3)));

        assertEquals(List.of(1, 2, 3), result.unwrap());
    }

    @Test
    void onSuccessAndOnFailure_runOnlyMatchingBranch() {
        var seen = new StringBuilder();

        Result.success("ok")
              .onSuccess(seen::append)
              .onFailure(cause -> seen.append("!"));
        new CommandError.NotFound("x").<String>result()
                                      .onSuccess(seen::append)
                                      .onFailure(cause -> seen.append("?"));

        assertEquals("ok?", seen.toString());
    }

    @Test
    void or_onFailure_returnsReplacement() {
        Result<Integer> failed = new CommandError.NotFound("x").result();

        assertEquals(7, failed.or(7));
        assertEquals(1, Result.success(1).or(7));
    }
}
