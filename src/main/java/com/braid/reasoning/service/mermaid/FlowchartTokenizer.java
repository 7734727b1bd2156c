package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.exception.FlowchartSyntaxException;
import com.braid.reasoning.model.FlowDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits flowchart source into statement lines.
 *
 * Blank lines and {@code %%} comment lines are dropped, and a line holding several statements
 * separated by {@code ;} yields one statement per piece, all with that line's number. The first
 * statement is consumed as the header when it reads {@code flowchart [dir]} or {@code graph [dir]};
 * otherwise the diagram is headerless, direction defaults to TD and the first statement is an
 * ordinary one.
 */
@Service
@Slf4j
public class FlowchartTokenizer {

    private static final String COMMENT_PREFIX = "%%";

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    // flowchart TD / graph LR / flowchart; direction token optional
    private static final Pattern HEADER = Pattern.compile("^(?:flowchart|graph)(?:\\s+(\\S+?))?\\s*;?$");

    private static final Set<String> OTHER_DIAGRAM_TYPES = Set.of(
            "sequencediagram", "classdiagram", "statediagram", "statediagram-v2", "erdiagram",
            "gantt", "pie", "journey", "gitgraph", "mindmap", "timeline", "quadrantchart",
            "requirementdiagram", "c4context", "c4container", "c4component");

    /**
     * Tokenize {@code source}, reading only as far as the header.
     *
     * @throws FlowchartSyntaxException if the header declares another diagram type or an unknown direction
     */
    public FlowchartSource tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");

        Iterator<StatementLine> it = new StatementIterator(source, 0);
        if (!it.hasNext()) {
            return new FlowchartSource(false, FlowDirection.TD, () -> new StatementIterator(source, 0));
        }

        StatementLine first = it.next();
        Matcher header = HEADER.matcher(first.text());
        if (!header.matches()) {
            String firstWord = first.text().split(" ", 2)[0].toLowerCase();
            if (OTHER_DIAGRAM_TYPES.contains(firstWord)) {
                throw new FlowchartSyntaxException(first.lineNumber(), first.text(),
                        "unsupported diagram type '" + firstWord + "', only flowcharts are supported");
            }
            log.debug("Headerless flowchart, first statement on line {}", first.lineNumber());
            return new FlowchartSource(false, FlowDirection.TD, () -> new StatementIterator(source, 0));
        }

        FlowDirection direction = FlowDirection.TD;
        if (header.group(1) != null) {
            direction = FlowDirection.fromString(header.group(1));
            if (direction == null) {
                throw new FlowchartSyntaxException(first.lineNumber(), first.text(),
                        "unknown direction '" + header.group(1) + "'");
            }
        }

        log.debug("Flowchart header on line {} with direction {}", first.lineNumber(), direction);
        return new FlowchartSource(true, direction, () -> new StatementIterator(source, 1));
    }

    /**
     * Normalize one statement; null when it carries nothing.
     */
    static String normalize(String rawLine) {
        String line = rawLine.strip();
        if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
            return null;
        }
        return WHITESPACE_RUN.matcher(line).replaceAll(" ");
    }

    /**
     * Split one raw line on {@code ;}. Separators inside brackets, double quotes or a
     * {@code |label|} do not count.
     */
    static List<String> splitStatements(String rawLine) {
        List<String> pieces = new ArrayList<>();
        int depth = 0;
        boolean inQuotes = false;
        boolean inPipeLabel = false;
        int start = 0;

        for (int i = 0; i < rawLine.length(); i++) {
            char c = rawLine.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (inQuotes) {
                continue;
            } else if (c == '[' || c == '(' || c == '{') {
                depth++;
            } else if ((c == ']' || c == ')' || c == '}') && depth > 0) {
                depth--;
            } else if (c == '|' && depth == 0) {
                inPipeLabel = !inPipeLabel;
            } else if (c == ';' && depth == 0 && !inPipeLabel) {
                pieces.add(rawLine.substring(start, i));
                start = i + 1;
            }
        }
        pieces.add(rawLine.substring(start));
        return pieces;
    }

    /**
     * Walks the source one line at a time, skipping the first {@code skipStatements} statements.
     */
    private static final class StatementIterator implements Iterator<StatementLine> {

        private final String source;
        private final Deque<StatementLine> pending = new ArrayDeque<>();
        private int toSkip;
        private int position;
        private int lineNumber;

        StatementIterator(String source, int skipStatements) {
            this.source = source;
            this.toSkip = skipStatements;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && position <= source.length()) {
                int newline = source.indexOf('\n', position);
                int end = newline == -1 ? source.length() : newline;
                String raw = source.substring(position, end);
                position = newline == -1 ? source.length() + 1 : newline + 1;
                lineNumber++;

                if (raw.strip().startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                for (String piece : splitStatements(raw)) {
                    String text = normalize(piece);
                    if (text == null) {
                        continue;
                    }
                    if (toSkip > 0) {
                        toSkip--;
                    } else {
                        pending.add(new StatementLine(lineNumber, text));
                    }
                }
            }
            return !pending.isEmpty();
        }

        @Override
        public StatementLine next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }
    }
}
