package io.kwinctl.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ArgCursorTest {
    @Test
    void classifiesTokens() {
        var cursor = new ArgCursor(List.of("--class", "-ab", "term", "-"));
        assertEquals(Optional.of(Arg.longFlag("class")), cursor.next());
        assertEquals(Optional.of(Arg.shortFlag('a')), cursor.next());
        assertEquals(Optional.of(Arg.shortFlag('b')), cursor.next());
        assertEquals(Optional.of(Arg.value("term")), cursor.next());
        assertEquals(Optional.of(Arg.value("-")), cursor.next());
        assertEquals(Optional.empty(), cursor.next());
    }

    @Test
    void readsOptionValuesInlineOrFromTheNextToken() {
        var cursor = new ArgCursor(List.of("--pid=42", "--limit", "3"));
        assertTrue(cursor.next().orElseThrow().isLong("pid"));
        assertEquals("42", cursor.value("--pid"));
        assertTrue(cursor.next().orElseThrow().isLong("limit"));
        assertEquals("3", cursor.value("--limit"));
    }

    @Test
    void unconsumedInlineValueIsRejected() {
        var cursor = new ArgCursor(List.of("--all=yes", "term"));
        cursor.next();
        var ex = assertThrows(DirectiveException.class, cursor::next);
        assertEquals(DirectiveException.Kind.UNEXPECTED_VALUE, ex.kind());
    }

    @Test
    void missingOptionValueIsReported() {
        var cursor = new ArgCursor(List.of("--pid"));
        cursor.next();
        var ex = assertThrows(DirectiveException.class, () -> cursor.value("--pid"));
        assertEquals(DirectiveException.Kind.MISSING_ARGUMENT, ex.kind());
    }

    @Test
    void negativeNumbersAreValuesOnlyWhenAllowed() {
        var cursor = new ArgCursor(List.of("-12", "-50%", "-12"));
        assertEquals(Optional.of(Arg.value("-12")), cursor.nextAllowingNumbers());
        assertEquals(Optional.of(Arg.value("-50%")), cursor.nextAllowingNumbers());
        assertEquals(Optional.of(Arg.shortFlag('1')), cursor.next());
    }

    @Test
    void doubleDashEndsOptionsForTheCurrentDirective() {
        var cursor = new ArgCursor(List.of("--", "--class", "x", "--any"));
        assertEquals(Optional.of(Arg.value("--class")), cursor.next());
        assertEquals(Optional.of(Arg.value("x")), cursor.next());
        cursor.beginDirective();
        assertEquals(Optional.of(Arg.longFlag("any")), cursor.next());
    }

    @Test
    void peeksWithoutConsuming() {
        var cursor = new ArgCursor(List.of("12345", "100", "200"));
        cursor.next();
        assertEquals(Optional.of("100"), cursor.peek(0));
        assertEquals(Optional.of("200"), cursor.peek(1));
        assertEquals(Optional.empty(), cursor.peek(2));
        assertEquals(Optional.of(Arg.value("100")), cursor.next());
    }
}
