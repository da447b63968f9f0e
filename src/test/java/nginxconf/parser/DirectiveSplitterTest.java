package nginxconf.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectiveSplitterTest {

    private final DirectiveSplitter splitter = new DirectiveSplitter();

    @Test
    void quotedSemicolonAndHashStayInFragment() {
        var split = splitter.split("alpha \"b;c#d\" gamma;");

        assertNull(split.getComment());
        assertEquals(List.of("alpha \"b;c#d\" gamma"), split.getFragments());
        assertFalse(split.isUnterminatedQuote());
    }

    @Test
    void trailingCommentIsExtracted() {
        var split = splitter.split("foo bar; # note");

        assertEquals("note", split.getComment());
        assertEquals("foo bar;", split.getDirectiveText());
        assertEquals(List.of("foo bar"), split.getFragments());
    }

    @Test
    void commentOnlyLineHasNoFragments() {
        var split = splitter.split("#   just a remark  ");

        assertTrue(split.isCommentOnly());
        assertEquals("just a remark", split.getComment());
        assertTrue(split.getFragments().isEmpty());
    }

    @Test
    void multipleDirectivesOnOneLine() {
        var split = splitter.split("a 1; b 2; c 3;");

        assertEquals(List.of("a 1", "b 2", "c 3"), split.getFragments());
    }

    @Test
    void emptyFragmentsAreDropped() {
        assertEquals(List.of("a 1", "b"), splitter.split("a 1;; ;b").getFragments());
        assertTrue(splitter.split(";").getFragments().isEmpty());
    }

    @Test
    void openingBraceEndsSplitting() {
        var split = splitter.split("server { listen 80; }");

        assertEquals(List.of("server {"), split.getFragments());
    }

    @Test
    void directivesBeforeOpeningBraceAreKept() {
        var split = splitter.split("set $a 1; location / {");

        assertEquals(List.of("set $a 1", "location / {"), split.getFragments());
    }

    @Test
    void quotedBraceDoesNotOpenBlock() {
        var split = splitter.split("return 200 '{\"ok\":true}';");

        assertEquals(List.of("return 200 '{\"ok\":true}'"), split.getFragments());
    }

    @Test
    void missingFinalSemicolonIsTolerated() {
        assertEquals(List.of("proxy_pass http://backend"), splitter.split("proxy_pass http://backend").getFragments());
    }

    @Test
    void otherQuoteCharacterIsLiteralInsideQuotes() {
        var split = splitter.split("add_header X \"it's; fine\"; # done");

        assertEquals("done", split.getComment());
        assertEquals(List.of("add_header X \"it's; fine\""), split.getFragments());
    }

    @Test
    void unterminatedQuoteConsumesRestOfLine() {
        var split = splitter.split("echo 'abc; def # ghi");

        assertNull(split.getComment());
        assertEquals(List.of("echo 'abc; def # ghi"), split.getFragments());
        assertTrue(split.isUnterminatedQuote());
    }
}
