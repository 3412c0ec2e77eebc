package org.dxworks.flaredoc.converter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FragmentAssemblerTest {

    @Test
    void bracketAfterWordGetsSpace() {
        assertEquals("word [[a]]", FragmentAssembler.append("word", "[[a]]"));
    }

    @Test
    void bracketAfterParenthesisSpaceOrNewlineIsUntouched() {
        assertEquals("([x]", FragmentAssembler.append("(", "[x]"));
        assertEquals("a [x]", FragmentAssembler.append("a ", "[x]"));
        assertEquals("a\n[x]", FragmentAssembler.append("a\n", "[x]"));
    }

    @Test
    void bracketAtStartIsUntouched() {
        assertEquals("[x]", FragmentAssembler.append("", "[x]"));
    }

    @Test
    void blockDelimiterStartsOnFreshLine() {
        assertEquals("text\n====\nx", FragmentAssembler.append("text", "====\nx"));
        assertEquals("text\n|===", FragmentAssembler.append("text", "|==="));
        assertEquals("text\n!===", FragmentAssembler.append("text", "!==="));
        assertEquals("text\n----", FragmentAssembler.append("text", "----"));
        assertEquals("text\n////\nc\n////\n", FragmentAssembler.append("text", "////\nc\n////\n"));
    }

    @Test
    void blockDelimiterAfterNewlineIsUntouched() {
        assertEquals("text\n----", FragmentAssembler.append("text\n", "----"));
    }

    @Test
    void shortRunsAndMixedCharactersAreNotDelimiters() {
        assertEquals("a==", FragmentAssembler.append("a", "=="));
        assertEquals("a=-=", FragmentAssembler.append("a", "=-="));
        assertEquals("ab", FragmentAssembler.append("a", "b"));
    }
}
