package com.braid.reasoning.service.graph;

import com.braid.reasoning.config.GrdProperties;
import com.braid.reasoning.exception.FlowchartSyntaxException;
import com.braid.reasoning.model.FlowDirection;
import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.FlowNode;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.model.NodeShape;
import com.braid.reasoning.service.mermaid.FlowchartStatementParser;
import com.braid.reasoning.service.mermaid.FlowchartTokenizer;
import com.braid.reasoning.service.mermaid.NodeDeclaration;
import com.braid.reasoning.service.mermaid.ParsedStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrdGraphBuilderTest {

    private final FlowchartTokenizer tokenizer = new FlowchartTokenizer();
    private final GrdGraphBuilder builder = new GrdGraphBuilder(new FlowchartStatementParser(new GrdProperties()));

    @Test
    void buildsLinearDiagram() {
        GrdStructure structure = build("flowchart TD\n  A[Start] --> B[Calc]\n  B --> C[Answer]");

        assertThat(structure.getNodes().keySet()).containsExactly("A", "B", "C");
        assertThat(structure.node("B")).isEqualTo(FlowNode.declared("B", "Calc", NodeShape.RECTANGLE));
        assertThat(structure.getEdges()).containsExactly(FlowEdge.of("A", "B"), FlowEdge.of("B", "C"));
    }

    @Test
    void undeclaredEndpointsBecomeBareNodes() {
        GrdStructure structure = build("A --> B");

        assertThat(structure.node("B").label()).isEqualTo("B");
        assertThat(structure.node("B").declared()).isFalse();
    }

    @Test
    void laterAnnotationWinsButKeepsPosition() {
        GrdStructure structure = build("A[First] --> B\nB --> C\nA(Renamed)");

        assertThat(structure.getNodes().keySet()).containsExactly("A", "B", "C");
        assertThat(structure.node("A").label()).isEqualTo("Renamed");
        assertThat(structure.node("A").shape()).isEqualTo(NodeShape.ROUNDED);
    }

    @Test
    void bareMentionKeepsEarlierAnnotation() {
        GrdStructure structure = build("A{Decide}\nA --> B\nA");

        assertThat(structure.node("A")).isEqualTo(FlowNode.declared("A", "Decide", NodeShape.DIAMOND));
    }

    @Test
    void annotationOnLaterEdgeUpgradesBareNode() {
        GrdStructure structure = build("A --> B\nB[Calc] --> C");

        assertThat(structure.node("B").label()).isEqualTo("Calc");
        assertThat(structure.declarationIndex("B")).isEqualTo(1);
    }

    @Test
    void keepsParallelEdges() {
        GrdStructure structure = build("A --> B\nA --> B\nA -->|again| B");

        assertThat(structure.edgeCount()).isEqualTo(3);
        assertThat(structure.getEdges()).extracting(FlowEdge::label).containsExactly(null, null, "again");
    }

    @Test
    void emptySourceYieldsEmptyStructure() {
        assertThat(build("flowchart LR\n%% nothing yet").isEmpty()).isTrue();
    }

    @Test
    void stopsAtFirstSyntaxError() {
        assertThatThrownBy(() -> build("flowchart TD\nA --> B\n\nB -> C\nC --> ???"))
                .isInstanceOf(FlowchartSyntaxException.class)
                .satisfies(e -> assertThat(((FlowchartSyntaxException) e).getLineNumber()).isEqualTo(4));
    }

    @Test
    void endClosesOpenSubgraph() {
        GrdStructure structure = build("flowchart TD\nsubgraph Phase 1\nA --> B\nend\nB --> C");

        assertThat(structure.getNodes().keySet()).containsExactly("A", "B", "C");
    }

    @Test
    void endOutsideSubgraphIsNode() {
        GrdStructure structure = build("flowchart TD\nend\nA --> end");

        assertThat(structure.getNodes().keySet()).containsExactly("end", "A");
        assertThat(structure.startNodes()).containsExactly("A");
    }

    @Test
    void nestedSubgraphsEachNeedTheirOwnEnd() {
        GrdStructure structure = build("subgraph Outer\nsubgraph Inner\nA --> B\nend\nend\nend\nB --> end");

        assertThat(structure.getNodes().keySet()).containsExactly("A", "B", "end");
        assertThat(structure.edgeCount()).isEqualTo(2);
    }

    @Test
    void buildsFromParsedStatements() {
        List<ParsedStatement> statements = List.of(
                new ParsedStatement(1, List.of(NodeDeclaration.bare("X"), NodeDeclaration.bare("Y")),
                        List.of(FlowEdge.of("X", "Y"))),
                ParsedStatement.skipped(2, "style"));

        GrdStructure structure = builder.build(FlowDirection.RL, statements);

        assertThat(structure.getDirection()).isEqualTo(FlowDirection.RL);
        assertThat(structure.startNodes()).containsExactly("X");
    }

    private GrdStructure build(String source) {
        return builder.build(tokenizer.tokenize(source));
    }
}
