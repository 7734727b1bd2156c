package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.config.GrdProperties;
import com.braid.reasoning.exception.FlowchartSyntaxException;
import com.braid.reasoning.model.ArrowStyle;
import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.NodeShape;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser for a single flowchart statement.
 *
 * <pre>
 * statement := directive | chain [';']
 * chain     := node (link node)*
 * node      := ID [shape]
 * shape     := OPEN (label | '"' text '"') CLOSE
 * link      := arrow ['|' label '|'] | open-stroke label close-arrow
 * </pre>
 *
 * Every link, whatever its stroke, becomes a directed edge from its left node to its right node.
 * A chain {@code A --> B --> C} yields one edge per link.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowchartStatementParser {

    // Case-sensitive, as in Mermaid; "End" stays a valid node id
    private static final Set<String> DIRECTIVES = Set.of(
            "style", "classDef", "class", "linkStyle", "click", "subgraph", "end", "direction");

    private static final String QUOTE_ENTITY = "#quot;";

    private final GrdProperties properties;

    /**
     * Parse one statement.
     *
     * @throws FlowchartSyntaxException if the line matches no supported form
     */
    public ParsedStatement parse(StatementLine line) {
        Objects.requireNonNull(line, "line must not be null");

        if (ParsedStatement.END.equals(line.text())) {
            return ParsedStatement.loneEnd(line.lineNumber());
        }

        String directive = directiveKeyword(line.text());
        if (directive != null) {
            if (!properties.getParser().isIgnoreDirectives()) {
                throw new FlowchartSyntaxException(line.lineNumber(), line.text(),
                        "unsupported directive '" + directive + "'");
            }
            log.debug("Skipping '{}' directive on line {}", directive, line.lineNumber());
            return ParsedStatement.skipped(line.lineNumber(), directive);
        }

        Cursor cursor = new Cursor(line);
        List<NodeDeclaration> nodes = new ArrayList<>();
        List<FlowEdge> edges = new ArrayList<>();

        NodeDeclaration left = parseNode(cursor);
        nodes.add(left);

        while (!cursor.atStatementEnd()) {
            Link link = parseLink(cursor);
            cursor.skipWhitespace();
            NodeDeclaration right = parseNode(cursor);
            nodes.add(right);
            edges.add(new FlowEdge(left.id(), right.id(), link.label(), link.style(), link.arrowHead()));
            left = right;
        }

        return new ParsedStatement(line.lineNumber(), nodes, edges);
    }

    private String directiveKeyword(String text) {
        int space = text.indexOf(' ');
        String word = space == -1 ? text : text.substring(0, space);
        if (!DIRECTIVES.contains(word)) {
            return null;
        }
        if (space == -1) {
            // a lone "style" or "class" is a bare node
            return null;
        }
        char next = text.charAt(space + 1);
        // "class --> B" is an edge from a node that happens to be called class
        if (next == '-' || next == '=' || next == '.') {
            return null;
        }
        return word;
    }

    private NodeDeclaration parseNode(Cursor cursor) {
        int start = cursor.pos;
        while (!cursor.eof() && isIdChar(cursor.peek())) {
            cursor.pos++;
        }
        if (cursor.pos == start) {
            throw cursor.error("expected node id");
        }
        String id = cursor.text.substring(start, cursor.pos);

        int afterId = cursor.pos;
        cursor.skipWhitespace();
        NodeShape shape = matchShapeOpen(cursor);
        if (shape == null) {
            cursor.pos = afterId;
            return NodeDeclaration.bare(id);
        }
        return new NodeDeclaration(id, shape, parseShapeLabel(cursor, shape));
    }

    private NodeShape matchShapeOpen(Cursor cursor) {
        // NodeShape lists two-character openers first
        for (NodeShape shape : NodeShape.values()) {
            if (cursor.text.startsWith(shape.open(), cursor.pos)) {
                cursor.pos += shape.open().length();
                return shape;
            }
        }
        return null;
    }

    private String parseShapeLabel(Cursor cursor, NodeShape shape) {
        int contentStart = cursor.pos;
        cursor.skipWhitespace();

        String label;
        if (cursor.peek() == '"') {
            label = readQuoted(cursor);
            cursor.skipWhitespace();
            if (!cursor.text.startsWith(shape.close(), cursor.pos)) {
                throw cursor.error("expected '" + shape.close() + "' after quoted label");
            }
        } else {
            int close = findClose(cursor.text, contentStart, shape);
            if (close == -1) {
                cursor.pos = contentStart;
                throw cursor.error("unterminated '" + shape.open() + "'");
            }
            label = cursor.text.substring(contentStart, close).strip();
            cursor.pos = close;
        }
        cursor.pos += shape.close().length();

        if (label.isEmpty()) {
            throw cursor.error("empty node label");
        }
        return label;
    }

    /**
     * Index of the closing bracket. Single-character brackets nest so that
     * {@code (Compute (a+b))} closes at the last parenthesis.
     */
    private int findClose(String text, int from, NodeShape shape) {
        if (shape.open().length() > 1) {
            return text.indexOf(shape.close(), from);
        }
        char open = shape.open().charAt(0);
        char close = shape.close().charAt(0);
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    private Link parseLink(Cursor cursor) {
        char c = cursor.peek();
        if (c == '-' && cursor.peekAt(1) == '.') {
            return parseDottedLink(cursor);
        }
        if (c == '-' || c == '=') {
            ArrowStyle style = c == '-' ? ArrowStyle.SOLID : ArrowStyle.THICK;
            int run = cursor.countRun(c);
            if (run < 2) {
                throw cursor.error("expected arrow");
            }
            cursor.pos += run;
            if (cursor.peek() == '>') {
                cursor.pos++;
                return withPipeLabel(cursor, style, true);
            }
            if (run >= 3) {
                return withPipeLabel(cursor, style, false);
            }
            return parseInlineLabel(cursor, style);
        }
        throw cursor.error("expected arrow ('-->', '-.->', '==>') or end of statement");
    }

    private Link parseDottedLink(Cursor cursor) {
        cursor.pos++;
        cursor.pos += cursor.countRun('.');
        if (cursor.peek() == '-') {
            cursor.pos++;
            boolean head = consumeArrowHead(cursor);
            return withPipeLabel(cursor, ArrowStyle.DOTTED, head);
        }

        // -. text .->
        int end = cursor.text.indexOf(".-", cursor.pos);
        if (end == -1) {
            throw cursor.error("unterminated dotted link label");
        }
        String label = cursor.text.substring(cursor.pos, end).strip();
        if (label.isEmpty()) {
            throw cursor.error("empty edge label");
        }
        cursor.pos = end;
        cursor.pos += cursor.countRun('.');
        cursor.pos++;
        return new Link(ArrowStyle.DOTTED, consumeArrowHead(cursor), label);
    }

    /**
     * {@code -- text -->} and {@code == text ==>}; the opening stroke is already consumed.
     */
    private Link parseInlineLabel(Cursor cursor, ArrowStyle style) {
        String closing = String.valueOf(style.stroke()).repeat(2);
        int end = cursor.text.indexOf(closing, cursor.pos);
        if (end == -1) {
            throw cursor.error("unterminated edge label");
        }
        String label = cursor.text.substring(cursor.pos, end).strip();
        if (label.isEmpty()) {
            throw cursor.error("empty edge label");
        }
        cursor.pos = end;
        int run = cursor.countRun(style.stroke());
        cursor.pos += run;
        if (consumeArrowHead(cursor)) {
            return new Link(style, true, label);
        }
        if (run >= 3) {
            return new Link(style, false, label);
        }
        throw cursor.error("incomplete arrow after edge label");
    }

    private Link withPipeLabel(Cursor cursor, ArrowStyle style, boolean head) {
        int afterArrow = cursor.pos;
        cursor.skipWhitespace();
        if (cursor.peek() != '|') {
            cursor.pos = afterArrow;
            return new Link(style, head, null);
        }
        cursor.pos++;
        cursor.skipWhitespace();

        String label;
        if (cursor.peek() == '"') {
            label = readQuoted(cursor);
            cursor.skipWhitespace();
            if (cursor.peek() != '|') {
                throw cursor.error("expected '|' after quoted edge label");
            }
        } else {
            int end = cursor.text.indexOf('|', cursor.pos);
            if (end == -1) {
                throw cursor.error("unterminated edge label");
            }
            label = cursor.text.substring(cursor.pos, end).strip();
            cursor.pos = end;
        }
        cursor.pos++;

        if (label.isEmpty()) {
            throw cursor.error("empty edge label");
        }
        return new Link(style, head, label);
    }

    private boolean consumeArrowHead(Cursor cursor) {
        if (cursor.peek() == '>') {
            cursor.pos++;
            return true;
        }
        return false;
    }

    private String readQuoted(Cursor cursor) {
        int end = cursor.text.indexOf('"', cursor.pos + 1);
        if (end == -1) {
            throw cursor.error("unterminated quoted label");
        }
        String value = cursor.text.substring(cursor.pos + 1, end).replace(QUOTE_ENTITY, "\"").strip();
        cursor.pos = end + 1;
        return value;
    }

    private static boolean isIdChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private record Link(ArrowStyle style, boolean arrowHead, String label) {}

    /**
     * Read position within one statement.
     */
    private static final class Cursor {
        private final StatementLine line;
        private final String text;
        private int pos;

        Cursor(StatementLine line) {
            this.line = line;
            this.text = line.text();
        }

        boolean eof() {
            return pos >= text.length();
        }

        char peek() {
            return peekAt(0);
        }

        char peekAt(int offset) {
            int i = pos + offset;
            return i < text.length() ? text.charAt(i) : '\0';
        }

        int countRun(char c) {
            int i = pos;
            while (i < text.length() && text.charAt(i) == c) {
                i++;
            }
            return i - pos;
        }

        void skipWhitespace() {
            while (!eof() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        /**
         * True at end of input or at a trailing ';'.
         */
        boolean atStatementEnd() {
            skipWhitespace();
            if (peek() == ';') {
                pos++;
                skipWhitespace();
                if (!eof()) {
                    throw error("unexpected text after ';'");
                }
            }
            return eof();
        }

        FlowchartSyntaxException error(String reason) {
            return new FlowchartSyntaxException(line.lineNumber(), text,
                    reason + " at column " + (pos + 1));
        }
    }
}
