package org.pragmatica.translator.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.translator.error.UnbalancedTagsException;
import org.pragmatica.translator.tree.Node;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.translator.tree.Node.placeholder;
import static org.pragmatica.translator.tree.Node.tag;
import static org.pragmatica.translator.tree.Node.text;
import static org.pragmatica.translator.tree.Node.voidTag;

class MessageParserTest {

    // === Plain text ===

    @Test
    void parse_emptyString_returnsEmptyList() {
        assertEquals(List.of(), MessageParser.parse(""));
        assertEquals(List.of(), MessageParser.parse(null));
    }

    @Test
    void parse_plainText_returnsSingleTextNode() {
        assertEquals(List.of(text("Just text, 100 > 99.")), MessageParser.parse("Just text, 100 > 99."));
    }

    // === Tags ===

    @Test
    void parse_balancedTag_buildsTagWithChildren() {
        var nodes = MessageParser.parse("a <b>c</b> d");

        assertEquals(3, nodes.size());
        assertEquals(List.of(text("a "), tag("b", text("c")), text(" d")), nodes);
    }

    @Test
    void parse_nestedTags_keepsChildOrder() {
        var nodes = MessageParser.parse("<a>x <b>y</b> z</a>");

        assertEquals(List.of(tag("a", text("x "), tag("b", text("y")), text(" z"))), nodes);
    }

    @Test
    void parse_emptyTag_hasNoChildren() {
        assertEquals(List.of(tag("a")), MessageParser.parse("<a></a>"));
    }

    @Test
    void parse_siblingTags_bothOnTopLevel() {
        var nodes = MessageParser.parse("<a>1</a><b>2</b>");

        assertEquals(List.of(tag("a", text("1")), tag("b", text("2"))), nodes);
    }

    @Test
    void parse_closingTagWithSpaces_isTrimmed() {
        assertEquals(List.of(tag("b", text("x"))), MessageParser.parse("<b>x</ b >"));
    }

    @Test
    void parse_openingTagWithSpace_throws() {
        assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("<b >x</b>"));
    }

    @Test
    void parse_voidTagWithSpace_keepsNameAsWritten() {
        assertEquals(List.of(voidTag("br ")), MessageParser.parse("<br />"));
    }

    @Test
    void parse_voidTag_createsVoidTag() {
        var nodes = MessageParser.parse("Line<br/>break");

        assertEquals(List.of(text("Line"), voidTag("br"), text("break")), nodes);
    }

    @Test
    void parse_voidTagInsideTag_isChild() {
        assertEquals(List.of(tag("p", text("a"), voidTag("br"), text("b"))), MessageParser.parse("<p>a<br/>b</p>"));
    }

    @Test
    void parse_emptyBraces_treatedAsVoidTagWithEmptyName() {
        assertEquals(List.of(text("a "), voidTag(""), text(" b")), MessageParser.parse("a <> b"));
    }

    // === Placeholders ===

    @Test
    void parse_placeholder_createsPlaceholderNode() {
        var nodes = MessageParser.parse("Hello %name%!");

        assertEquals(List.of(text("Hello "), placeholder("name"), text("!")), nodes);
    }

    @Test
    void parse_placeholderOnly_returnsPlaceholder() {
        assertEquals(List.of(placeholder("x")), MessageParser.parse("%x%"));
    }

    @Test
    void parse_placeholderInsideTag_isChild() {
        var nodes = MessageParser.parse("<b>%n% items</b>");

        assertEquals(List.of(tag("b", placeholder("n"), text(" items"))), nodes);
    }

    @Test
    void parse_escapedPercent_producesLiteralPercent() {
        assertEquals(List.of(text("100% done")), MessageParser.parse("100%% done"));
        assertEquals(List.of(text("a%b%c")), MessageParser.parse("a%%b%%c"));
    }

    @Test
    void parse_escapedPercentNextToPlaceholder_keepsBoth() {
        var nodes = MessageParser.parse("%value%%% complete");

        assertEquals(List.of(placeholder("value"), text("% complete")), nodes);
    }

    // === Recovery ===

    @Test
    void parse_unterminatedPlaceholder_becomesText() {
        assertEquals(List.of(text("50% off")), MessageParser.parse("50% off"));
    }

    @Test
    void parse_unterminatedTagAtEnd_becomesText() {
        assertEquals(List.of(text("a <b")), MessageParser.parse("a <b"));
    }

    @Test
    void parse_percentBeforeTag_swallowsTagAsText() {
        assertEquals(List.of(text("50% <b>off</b>")), MessageParser.parse("50% <b>off</b>"));
    }

    @Test
    void parse_strayOpenBrace_foldedBackIntoText() {
        var nodes = MessageParser.parse("a < b <i>c</i>");

        assertEquals(List.of(text("a < b "), tag("i", text("c"))), nodes);
    }

    @Test
    void parse_strayOpenBraceInsideTag_foldedIntoChildText() {
        var nodes = MessageParser.parse("<i>1 < 2</i>");

        assertEquals(List.of(tag("i", text("1 < 2"))), nodes);
    }

    // === Unbalanced tags ===

    @Test
    void parse_unclosedTag_throws() {
        var error = assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("<b>unclosed"));

        assertEquals("<b>unclosed", error.input());
        assertTrue(error.getMessage().contains("<b>unclosed"));
    }

    @Test
    void parse_closingTagWithoutOpener_throws() {
        assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("text</b>"));
    }

    @Test
    void parse_crossedTags_throws() {
        assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("<a><b>x</a></b>"));
    }

    @Test
    void parse_closingTagWithDifferentName_throws() {
        assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("<a>x</b>"));
    }

    @Test
    void parse_trailingUnclosedTag_throws() {
        assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("<a>x</a><b>"));
    }

    @Test
    void parse_tagNamesAreCaseSensitive() {
        assertThrows(UnbalancedTagsException.class, () -> MessageParser.parse("<B>x</b>"));
    }

    // === Result ===

    @Test
    void parse_result_isImmutable() {
        var nodes = MessageParser.parse("<a>x</a>");

        assertThrows(UnsupportedOperationException.class, () -> nodes.add(text("y")));
        var tag = (Node.Tag) nodes.get(0);
        assertThrows(UnsupportedOperationException.class, () -> tag.children().clear());
    }
}
