package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.FlowNode;
import com.braid.reasoning.model.GrdStructure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Renders a {@link GrdStructure} as canonical flowchart text.
 *
 * Output is the header, then every node in declaration order (bare nodes by id alone), then one
 * edge per line. Parsing the output yields an equal structure.
 */
@Service
@Slf4j
public class MermaidRenderer {

    private static final String INDENT = "    ";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Label characters that would end the shape or edge label early
    private static final Pattern NEEDS_QUOTES = Pattern.compile("[\\[\\](){}|\"]");

    public String render(GrdStructure structure) {
        StringBuilder out = new StringBuilder();
        out.append("flowchart ").append(structure.getDirection()).append('\n');

        for (FlowNode node : structure.getNodes().values()) {
            out.append(INDENT).append(renderNode(node)).append('\n');
        }
        for (FlowEdge edge : structure.getEdges()) {
            out.append(INDENT).append(renderEdge(edge)).append('\n');
        }

        log.debug("Rendered {} nodes and {} edges", structure.nodeCount(), structure.edgeCount());
        return out.toString();
    }

    /**
     * {@link #render} wrapped in a {@code ```mermaid} fence.
     */
    public String renderFenced(GrdStructure structure) {
        return CODE_BLOCK_START + render(structure) + CODE_BLOCK_END;
    }

    private String renderNode(FlowNode node) {
        if (!node.declared()) {
            return node.id();
        }
        return node.id() + node.shape().wrap(escapeLabel(node.label()));
    }

    private String renderEdge(FlowEdge edge) {
        StringBuilder out = new StringBuilder(edge.fromId())
                .append(' ')
                .append(edge.style().render(edge.arrowHead()));
        if (edge.label() != null) {
            out.append('|').append(escapeLabel(edge.label())).append('|');
        }
        return out.append(' ').append(edge.toId()).toString();
    }

    private String escapeLabel(String label) {
        if (!NEEDS_QUOTES.matcher(label).find()) {
            return label;
        }
        return '"' + label.replace("\"", "#quot;") + '"';
    }
}
