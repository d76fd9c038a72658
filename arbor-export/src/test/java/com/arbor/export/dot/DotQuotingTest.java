package com.arbor.export.dot;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DotQuotingTest {

    @Test
    void quoteId_leavesIdentifiersAndNumeralsBare() {
        assertEquals("TP", DotQuoting.quoteId("TP"));
        assertEquals("_x1", DotQuoting.quoteId("_x1"));
        assertEquals(".25", DotQuoting.quoteId(".25"));
        assertEquals("-3.5", DotQuoting.quoteId("-3.5"));
    }

    @Test
    void quoteId_quotesKeywordsAndOtherText() {
        assertEquals("\"node\"", DotQuoting.quoteId("node"));
        assertEquals("\"Graph\"", DotQuoting.quoteId("Graph"));
        assertEquals("\"T'\"", DotQuoting.quoteId("T'"));
        assertEquals("\"\"", DotQuoting.quoteId(""));
    }

    @Test
    void quoteId_escapesQuotesAndTrailingBackslash() {
        assertEquals("\"say \\\"hi\\\"\"", DotQuoting.quoteId("say \"hi\""));
        assertEquals("\"a\\\\\"", DotQuoting.quoteId("a\\"));
    }

    @Test
    void quoteValue_passesHtmlLabels() {
        assertEquals("<<b>x</b>>", DotQuoting.quoteValue("<<b>x</b>>"));
        assertEquals("plain", DotQuoting.quoteValue("plain"));
    }
}
