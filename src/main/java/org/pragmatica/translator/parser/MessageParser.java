package org.pragmatica.translator.parser;

import org.pragmatica.translator.error.UnbalancedTagsException;
import org.pragmatica.translator.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for message markup: text, {@code <tag>...</tag>}, {@code <void/>} and {@code %placeholder%}.
 *
 * <p>Example:
 * <pre>{@code
 * MessageParser.parse("String to <a>translate</a>");
 * // [Text("String to "), Tag("a", [Text("translate")])]
 * }</pre>
 *
 * <p>Malformed placeholders and unterminated tags degrade to plain text. The only failure is
 * {@link UnbalancedTagsException} for tags that are opened and never closed, or closed without an opener.
 */
public final class MessageParser {
    private static final Logger log = LoggerFactory.getLogger(MessageParser.class);

    private static final char TAG_OPEN_BRACE = '<';
    private static final char TAG_CLOSE_BRACE = '>';
    private static final char CLOSING_TAG_MARK = '/';
    private static final char PLACEHOLDER_MARK = '%';

    private static final int DEFAULT_BUFFER_CAPACITY = 32;

    private final String input;
    private final List<StackEntry> stack = new ArrayList<>();
    private final List<Node> result = new ArrayList<>();
    private final StringBuilder text = new StringBuilder(DEFAULT_BUFFER_CAPACITY);
    private final StringBuilder tag = new StringBuilder(DEFAULT_BUFFER_CAPACITY);
    private final StringBuilder placeholder = new StringBuilder(DEFAULT_BUFFER_CAPACITY);
    private int pos;
    // position of the last switch out of the TEXT state, used to restore text entered wrongly
    private int lastTextStateChange;

    private MessageParser(String input) {
        this.input = input;
    }

    /**
     * Parse a message into its node list. {@code null} and empty input give an empty list.
     *
     * @throws UnbalancedTagsException if the tags do not pair up
     */
    public static List<Node> parse(String input) {
        if (input == null || input.isEmpty()) {
            return List.of();
        }
        return new MessageParser(input).parseAll();
    }

    private List<Node> parseAll() {
        var state = ScanState.TEXT;
        for (pos = 0; pos < input.length(); pos++) {
            var c = input.charAt(pos);
            state = switch (state) {
                case TEXT -> onText(c);
                case TAG -> onTag(c);
                case PLACEHOLDER -> onPlaceholder(c);
            };
        }
        if (state != ScanState.TEXT) {
            // tag or placeholder never closed, keep it as text
            var rest = input.substring(lastTextStateChange);
            if (text.length() + rest.length() > 0) {
                result.add(Node.text(text + rest));
            }
        } else if (text.length() > 0) {
            result.add(Node.text(text.toString()));
        }
        if (!stack.isEmpty()) {
            throw unbalanced();
        }
        log.trace("Parsed {} top-level nodes from \"{}\"", result.size(), input);
        return List.copyOf(result);
    }

    private ScanState onText(char c) {
        if (c == TAG_OPEN_BRACE) {
            lastTextStateChange = pos;
            return ScanState.TAG;
        }
        if (c == PLACEHOLDER_MARK) {
            lastTextStateChange = pos;
            return ScanState.PLACEHOLDER;
        }
        text.append(c);
        return ScanState.TEXT;
    }

    private ScanState onPlaceholder(char c) {
        if (c != PLACEHOLDER_MARK) {
            placeholder.append(c);
            return ScanState.PLACEHOLDER;
        }
        // "%%" is an escaped percent sign
        if (pos - lastTextStateChange == 1) {
            text.append(PLACEHOLDER_MARK);
            return ScanState.TEXT;
        }
        flushText();
        append(Node.placeholder(placeholder.toString()));
        placeholder.setLength(0);
        return ScanState.TEXT;
    }

    private ScanState onTag(char c) {
        if (c == TAG_CLOSE_BRACE) {
            var name = tag.toString();
            tag.setLength(0);
            if (name.indexOf(CLOSING_TAG_MARK) == 0) {
                closeTag(name.substring(1).trim());
            } else if (name.isEmpty() || name.charAt(name.length() - 1) == CLOSING_TAG_MARK) {
                flushText();
                append(Node.voidTag(name.isEmpty() ? name : name.substring(0, name.length() - 1)));
            } else {
                flushText();
                stack.add(new StackEntry.OpenTag(name));
            }
            return ScanState.TEXT;
        }
        if (c == TAG_OPEN_BRACE) {
            // stray '<' before this one, what was read since is plain text
            text.append(input, lastTextStateChange, pos);
            lastTextStateChange = pos;
            tag.setLength(0);
            return ScanState.TAG;
        }
        tag.append(c);
        return ScanState.TAG;
    }

    private void closeTag(String name) {
        var children = new ArrayList<Node>();
        if (text.length() > 0) {
            children.add(Node.text(text.toString()));
            text.setLength(0);
        }
        while (!stack.isEmpty()) {
            var last = stack.remove(stack.size() - 1);
            if (last instanceof StackEntry.Child child) {
                children.add(0, child.node());
            } else if (last instanceof StackEntry.OpenTag open && open.name().equals(name)) {
                append(Node.tag(name, children));
                return;
            } else {
                throw unbalanced();
            }
            if (stack.isEmpty()) {
                throw unbalanced();
            }
        }
        // closing tag without any opener
        throw unbalanced();
    }

    private void flushText() {
        if (text.length() > 0) {
            append(Node.text(text.toString()));
            text.setLength(0);
        }
    }

    private void append(Node node) {
        if (stack.isEmpty()) {
            result.add(node);
        } else {
            stack.add(new StackEntry.Child(node));
        }
    }

    private UnbalancedTagsException unbalanced() {
        log.debug("Unbalanced tags in \"{}\" at position {}", input, pos);
        return new UnbalancedTagsException(input);
    }

    private enum ScanState {
        TEXT,
        TAG,
        PLACEHOLDER
    }

    /**
     * Stack content: either a pending open tag or a finished child of the innermost open tag.
     */
    private sealed interface StackEntry {
        record OpenTag(String name) implements StackEntry {}

        record Child(Node node) implements StackEntry {}
    }
}
