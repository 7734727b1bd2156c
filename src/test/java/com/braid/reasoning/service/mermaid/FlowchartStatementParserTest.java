package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.config.GrdProperties;
import com.braid.reasoning.exception.FlowchartSyntaxException;
import com.braid.reasoning.model.ArrowStyle;
import com.braid.reasoning.model.FlowEdge;
import com.braid.reasoning.model.NodeShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowchartStatementParserTest {

    private GrdProperties properties;
    private FlowchartStatementParser parser;

    @BeforeEach
    void setUp() {
        properties = new GrdProperties();
        parser = new FlowchartStatementParser(properties);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A[Start]|RECTANGLE|Start",
            "A(Think)|ROUNDED|Think",
            "A{Is it even?}|DIAMOND|Is it even?",
            "A([Begin])|STADIUM|Begin",
            "A[[Lookup]]|SUBROUTINE|Lookup",
            "A[(Facts)]|CYLINDER|Facts",
            "A((Hub))|CIRCLE|Hub",
            "A{{Prepare}}|HEXAGON|Prepare"
    })
    void parsesNodeShapes(String text, NodeShape shape, String label) {
        ParsedStatement statement = parse(text);

        assertThat(statement.nodes()).containsExactly(new NodeDeclaration("A", shape, label));
        assertThat(statement.edges()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A --> B|SOLID|true",
            "A-->B|SOLID|true",
            "A ---> B|SOLID|true",
            "A --- B|SOLID|false",
            "A -.-> B|DOTTED|true",
            "A -.- B|DOTTED|false",
            "A ==> B|THICK|true",
            "A === B|THICK|false"
    })
    void parsesArrowStyles(String text, ArrowStyle style, boolean arrowHead) {
        ParsedStatement statement = parse(text);

        assertThat(statement.edges()).containsExactly(new FlowEdge("A", "B", null, style, arrowHead));
    }

    @ParameterizedTest
    @CsvSource(delimiterString = " :: ", value = {
            "A -->|yes| B :: SOLID",
            "A -->| yes | B :: SOLID",
            "A -- yes --> B :: SOLID",
            "A -. yes .-> B :: DOTTED",
            "A == yes ==> B :: THICK",
            "A ==>|yes| B :: THICK"
    })
    void parsesEdgeLabels(String text, ArrowStyle style) {
        ParsedStatement statement = parse(text);

        assertThat(statement.edges()).containsExactly(new FlowEdge("A", "B", "yes", style, true));
    }

    @Test
    void parsesChainIntoOneEdgePerLink() {
        ParsedStatement statement = parse("A[Read] --> B{Check} -->|ok| C");

        assertThat(statement.nodes()).extracting(NodeDeclaration::id).containsExactly("A", "B", "C");
        assertThat(statement.nodes().get(1)).isEqualTo(new NodeDeclaration("B", NodeShape.DIAMOND, "Check"));
        assertThat(statement.edges()).containsExactly(
                FlowEdge.of("A", "B"),
                FlowEdge.of("B", "C", "ok"));
    }

    @Test
    void nestedParenthesesStayInLabel() {
        ParsedStatement statement = parse("S(Compute (a+b) * c) --> T");

        assertThat(statement.nodes().get(0).label()).isEqualTo("Compute (a+b) * c");
    }

    @Test
    void quotedLabelsMayContainBrackets() {
        ParsedStatement statement = parse("A[\"Is x [0] #quot;ok#quot;?\"] -->|\"a|b\"| B");

        assertThat(statement.nodes().get(0).label()).isEqualTo("Is x [0] \"ok\"?");
        assertThat(statement.edges().get(0).label()).isEqualTo("a|b");
    }

    @Test
    void bareNodeHasNoShape() {
        ParsedStatement statement = parse("Answer");

        assertThat(statement.nodes()).containsExactly(NodeDeclaration.bare("Answer"));
        assertThat(statement.nodes().get(0).annotated()).isFalse();
    }

    @Test
    void acceptsTrailingSemicolon() {
        assertThat(parse("A --> B;").edges()).hasSize(1);
        assertThat(parse("A[Only] ;").nodes()).hasSize(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "style A fill:#f9f,stroke:#333",
            "classDef done fill:#0f0",
            "class A,B done",
            "linkStyle 0 stroke:#f00",
            "click A callback",
            "subgraph Phase 1",
            "direction LR"
    })
    void skipsDirectives(String text) {
        ParsedStatement statement = parse(text);

        assertThat(statement.isDirective()).isTrue();
        assertThat(statement.isEmpty()).isTrue();
        assertThat(text).startsWith(statement.directive());
    }

    @Test
    void loneEndIsLeftForTheBuilderToResolve() {
        ParsedStatement statement = parse("end");

        assertThat(statement.directive()).isEqualTo("end");
        assertThat(statement.nodes()).containsExactly(NodeDeclaration.bare("end"));
        assertThat(statement.edges()).isEmpty();
    }

    @Test
    void rejectsDirectives_whenNotIgnored() {
        properties.getParser().setIgnoreDirectives(false);

        assertThatThrownBy(() -> parse("classDef done fill:#0f0"))
                .isInstanceOf(FlowchartSyntaxException.class)
                .hasMessageContaining("unsupported directive 'classDef'");
    }

    @Test
    void directiveWordsCanStillBeNodeIds() {
        assertThat(parse("End --> B").edges()).containsExactly(FlowEdge.of("End", "B"));
        assertThat(parse("class --> B").edges()).containsExactly(FlowEdge.of("class", "B"));
        assertThat(parse("style").nodes()).containsExactly(NodeDeclaration.bare("style"));
    }

    @Test
    void reportsLineAndColumnOfSyntaxErrors() {
        assertThatThrownBy(() -> parser.parse(new StatementLine(7, "A -> B")))
                .isInstanceOf(FlowchartSyntaxException.class)
                .satisfies(e -> {
                    FlowchartSyntaxException ex = (FlowchartSyntaxException) e;
                    assertThat(ex.getLineNumber()).isEqualTo(7);
                    assertThat(ex.getLine()).isEqualTo("A -> B");
                    assertThat(ex.getReason()).isEqualTo("expected arrow at column 3");
                    assertThat(ex.errorType()).isEqualTo("SyntaxError");
                });
    }

    @ParameterizedTest
    @CsvSource(delimiterString = " :: ", quoteCharacter = '"', value = {
            "A[Start --> B :: unterminated '['",
            "A[ ] --> B :: empty node label",
            "--> B :: expected node id",
            "A -->|yes B :: unterminated edge label",
            "A -->|| B :: empty edge label",
            "A -- yes B :: unterminated edge label",
            "A B :: expected arrow ('-->', '-.->', '==>') or end of statement",
            "A --> B; C :: unexpected text after ';'",
            "A -->|yes| :: expected node id"
    })
    void rejectsMalformedStatements(String text, String reason) {
        assertThatThrownBy(() -> parse(text))
                .isInstanceOf(FlowchartSyntaxException.class)
                .hasMessageContaining(reason);
    }

    private ParsedStatement parse(String text) {
        return parser.parse(new StatementLine(1, text));
    }
}
