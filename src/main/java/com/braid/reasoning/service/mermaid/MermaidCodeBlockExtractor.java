package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.config.GrdProperties;
import com.braid.reasoning.exception.MermaidExtractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls flowchart source out of free text, typically markdown returned by a model.
 *
 * Lookup order:
 * 1. first fenced block (``` or ~~~) tagged {@code mermaid}, tag case-insensitive
 * 2. first untagged fenced block whose content starts with {@code flowchart}/{@code graph}
 *    (only when {@code grd.extractor.accept-untagged-fences} is on)
 * 3. unfenced text: everything from the first line starting with {@code flowchart}/{@code graph}
 *
 * Block content is returned exactly as written between the fence lines.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MermaidCodeBlockExtractor {

    private static final String MERMAID_TAG = "mermaid";

    // Opening fence: optional indent, ``` or ~~~, optional info string whose first word is the tag
    private static final Pattern FENCE_OPEN = Pattern.compile("^[ \\t]*(```|~~~)[ \\t]*([^\\s`~]*)(?:[ \\t]+[^`]*)?$");

    // A line that begins a flowchart definition
    private static final Pattern FLOWCHART_KEYWORD = Pattern.compile("^[ \\t]*(flowchart|graph)\\b", Pattern.MULTILINE);

    private final GrdProperties properties;

    /**
     * Extract flowchart source from {@code text}.
     *
     * @return the code, or empty when the text holds no diagram
     */
    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        List<FencedBlock> blocks = findFencedBlocks(text);

        for (FencedBlock block : blocks) {
            if (MERMAID_TAG.equalsIgnoreCase(block.tag())) {
                log.debug("Found mermaid-tagged {} block ({} chars)", block.fence(), block.content().length());
                return Optional.of(block.content());
            }
        }

        if (properties.getExtractor().isAcceptUntaggedFences()) {
            for (FencedBlock block : blocks) {
                if (block.tag().isEmpty() && startsWithFlowchartKeyword(block.content())) {
                    log.debug("Using untagged {} block as flowchart source", block.fence());
                    return Optional.of(block.content());
                }
            }
        }

        if (blocks.isEmpty()) {
            Matcher matcher = FLOWCHART_KEYWORD.matcher(text);
            if (matcher.find()) {
                log.debug("No fences; treating text from offset {} as flowchart source", matcher.start());
                return Optional.of(text.substring(matcher.start()).stripTrailing());
            }
        }

        log.debug("No flowchart found in {} chars of text", text.length());
        return Optional.empty();
    }

    /**
     * Same as {@link #extract(String)} but fails when nothing is found.
     *
     * @throws MermaidExtractionException when the text holds no diagram
     */
    public String require(String text) {
        return extract(text).orElseThrow(MermaidExtractionException::new);
    }

    private boolean startsWithFlowchartKeyword(String content) {
        Matcher matcher = FLOWCHART_KEYWORD.matcher(content);
        return matcher.find() && content.substring(0, matcher.start()).isBlank();
    }

    /**
     * Scan line by line for closed fenced blocks. Unclosed fences are ignored.
     */
    private List<FencedBlock> findFencedBlocks(String text) {
        List<FencedBlock> blocks = new ArrayList<>();

        String openFence = null;
        String openTag = null;
        int contentStart = -1;

        int lineStart = 0;
        while (lineStart <= text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline == -1 ? text.length() : newline;
            String line = text.substring(lineStart, lineEnd);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }

            if (openFence == null) {
                Matcher matcher = FENCE_OPEN.matcher(line);
                if (matcher.matches()) {
                    openFence = matcher.group(1);
                    openTag = matcher.group(2);
                    contentStart = newline == -1 ? text.length() : newline + 1;
                }
            } else if (line.strip().equals(openFence)) {
                int contentEnd = Math.max(contentStart, lineStart - 1);
                if (contentEnd > contentStart && text.charAt(contentEnd - 1) == '\r') {
                    contentEnd--;
                }
                blocks.add(new FencedBlock(openFence, openTag, text.substring(contentStart, contentEnd)));
                openFence = null;
                openTag = null;
            }

            if (newline == -1) {
                break;
            }
            lineStart = newline + 1;
        }

        return blocks;
    }

    private record FencedBlock(String fence, String tag, String content) {}
}
