package com.hcltech.dawg.common.errorsor;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ErrorsOrTest {

    @Nested
    class ConstructionAndPredicates {
        @Test
        void liftCreatesValue() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(42);
            assertTrue(eo.isValue());
            assertFalse(eo.isError());
            assertEquals(Optional.of(42), eo.getValue());
            assertTrue(eo.getErrors().isEmpty());
        }

        @Test
        void errorCreatesError() {
            ErrorsOr<String> eo = ErrorsOr.error("boom");
            assertTrue(eo.isError());
            assertFalse(eo.isValue());
            assertEquals(List.of("boom"), eo.getErrors());
            assertEquals(Optional.empty(), eo.getValue());
        }

        @Test
        void errorsFactoryRejectsEmptyList() {
            assertThrows(IllegalArgumentException.class, () -> ErrorsOr.errors(List.of()));
        }

        @Test
        void liftRejectsNull() {
            assertThrows(NullPointerException.class, () -> ErrorsOr.lift(null));
        }

        @Test
        void exceptionErrorNamesClassAndMessage() {
            ErrorsOr<String> eo = ErrorsOr.error("Reading 'my' {words}", new IOException("gone"));
            assertEquals(List.of("Reading 'my' {words}: IOException: gone"), eo.getErrors());
        }
    }

    @Nested
    class ExtractorsAndDefaults {
        @Test
        void valueOrThrowOnErrorThrows() {
            ErrorsOr<String> eo = ErrorsOr.error("nope");
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::valueOrThrow);
            assertTrue(ex.getMessage().contains("nope"));
        }

        @Test
        void valueOrThrowOnValue() {
            assertEquals("ok", ErrorsOr.lift("ok").valueOrThrow());
        }
    }

    @Nested
    class Combinators {
        @Test
        void mapAndFlatMapSkipErrors() {
            ErrorsOr<Integer> err = ErrorsOr.error("bad");
            assertEquals(List.of("bad"), err.map(i -> i + 1).getErrors());
            assertEquals(List.of("bad"), err.flatMap(i -> ErrorsOr.lift(i + 1)).getErrors());
            assertEquals(3, ErrorsOr.lift(2).map(i -> i + 1).valueOrThrow());
            assertEquals(List.of("odd"), ErrorsOr.lift(3).flatMap(i -> i % 2 == 0 ? ErrorsOr.lift(i) : ErrorsOr.<Integer>error("odd")).getErrors());
        }

        @Test
        void foldPicksTheRightBranch() {
            assertEquals("v:1", ErrorsOr.lift(1).fold(v -> "v:" + v, e -> "e:" + e));
            assertEquals("e:[x]", ErrorsOr.<Integer>error("x").fold(v -> "v:" + v, e -> "e:" + e));
        }

        @Test
        void addPrefixOnlyTouchesErrors() {
            assertEquals(List.of("line 3: empty"), ErrorsOr.error("empty").addPrefixIfError("line 3: ").getErrors());
            assertEquals(ErrorsOr.lift("ok"), ErrorsOr.lift("ok").addPrefixIfError("line 3: "));
        }

        @Test
        void tryingCapturesExceptions() {
            ErrorsOr<String> eo = ErrorsOr.trying("Loading", () -> { throw new IOException("disk"); });
            assertEquals(List.of("Loading: IOException: disk"), eo.getErrors());
            assertEquals("fine", ErrorsOr.trying("Loading", () -> "fine").valueOrThrow());
        }

        @Test
        void mapTryCapturesExceptions() {
            ErrorsOr<Integer> eo = ErrorsOr.lift("x").mapTry("Parsing", Integer::parseInt);
            assertTrue(eo.isError());
            assertTrue(eo.getErrors().get(0).startsWith("Parsing: NumberFormatException"));
        }
    }
}
