package io.teleops.rca;

import io.teleops.config.TeleopsProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTableTest {

    private static BaselineRule.BaselineRuleBuilder validRule(String id) {
        return BaselineRule.builder()
                .id(id)
                .pattern("bgp")
                .hypothesis("unstable BGP session")
                .confidence(0.6)
                .evidence("flaps");
    }

    @Test
    @DisplayName("Built-in table covers every scenario and ends with the generic rule")
    void defaultsAreValid() {
        RuleTable table = RuleTable.defaults();

        assertThat(table.getVersion()).isEqualTo(RuleTable.DEFAULT_VERSION);
        assertThat(table.size()).isEqualTo(11);
        assertThat(table.fallbackRule().getId()).isEqualTo("network_degradation");
        assertThat(table.fallbackRule().getHypothesis())
                .isEqualTo("link congestion on core-router-1 causing packet loss");
        assertThat(table.fallbackRule().getConfidence()).isEqualTo(0.55);
    }

    @Test
    void rulesAreDefensivelyCopied() {
        List<BaselineRule> rules = new ArrayList<>(List.of(validRule("a").build()));
        RuleTable table = new RuleTable("v1", rules);

        rules.add(validRule("b").build());

        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void buildsFromConfiguredDefinitions() {
        TeleopsProperties.RuleDefinition definition = new TeleopsProperties.RuleDefinition();
        definition.setId("custom");
        definition.setPatterns(List.of("mpls"));
        definition.setHypothesis("route leak");
        definition.setConfidence(0.4);
        definition.setEvidence("mpls label errors");

        RuleTable table = RuleTable.fromDefinitions("configured", List.of(definition));

        assertThat(table.getVersion()).isEqualTo("configured");
        assertThat(table.fallbackRule().getPatterns()).containsExactly("mpls");
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void rejectsEmptyTable() {
            assertThatThrownBy(() -> new RuleTable("v1", List.of()))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("at least one rule");
            assertThatThrownBy(() -> RuleTable.fromDefinitions("v1", List.of()))
                    .isInstanceOf(InvalidRuleTableException.class);
        }

        @Test
        void rejectsRuleWithoutPatterns() {
            BaselineRule rule = validRule("a").clearPatterns().build();

            assertThatThrownBy(() -> new RuleTable("v1", List.of(rule)))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("no patterns");
        }

        @Test
        void rejectsBlankPattern() {
            BaselineRule rule = validRule("a").clearPatterns().pattern(" ").build();

            assertThatThrownBy(() -> new RuleTable("v1", List.of(rule)))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("blank pattern");
        }

        @Test
        void rejectsBlankHypothesis() {
            BaselineRule rule = validRule("a").hypothesis("  ").build();

            assertThatThrownBy(() -> new RuleTable("v1", List.of(rule)))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("blank hypothesis");
        }

        @Test
        void rejectsConfidenceOutsideUnitInterval() {
            assertThatThrownBy(() -> new RuleTable("v1", List.of(validRule("a").confidence(1.2).build())))
                    .isInstanceOf(InvalidRuleTableException.class);
            assertThatThrownBy(() -> new RuleTable("v1", List.of(validRule("a").confidence(-0.1).build())))
                    .isInstanceOf(InvalidRuleTableException.class);
            assertThatThrownBy(() -> new RuleTable("v1", List.of(validRule("a").confidence(Double.NaN).build())))
                    .isInstanceOf(InvalidRuleTableException.class);
        }

        @Test
        void rejectsBlankVersion() {
            assertThatThrownBy(() -> new RuleTable(null, List.of(validRule("a").build())))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("version");
            assertThatThrownBy(() -> new RuleTable(" ", List.of(validRule("a").build())))
                    .isInstanceOf(InvalidRuleTableException.class);
        }

        @Test
        void rejectsBlankEvidence() {
            assertThatThrownBy(() -> new RuleTable("v1", List.of(validRule("a").evidence(null).build())))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("blank evidence");
        }

        @Test
        void rejectsNullDefinition() {
            List<TeleopsProperties.RuleDefinition> definitions = new ArrayList<>();
            definitions.add(null);

            assertThatThrownBy(() -> RuleTable.fromDefinitions("v1", definitions))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("position 0");
        }

        @Test
        void rejectsDefinitionWithoutConfidence() {
            TeleopsProperties.RuleDefinition definition = new TeleopsProperties.RuleDefinition();
            definition.setId("custom");
            definition.setPatterns(List.of("mpls"));
            definition.setHypothesis("route leak");
            definition.setEvidence("label errors");

            assertThatThrownBy(() -> RuleTable.fromDefinitions("v1", List.of(definition)))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("no confidence");
        }

        @Test
        void rejectsDuplicateIds() {
            assertThatThrownBy(() -> new RuleTable("v1", List.of(validRule("a").build(), validRule("a").build())))
                    .isInstanceOf(InvalidRuleTableException.class)
                    .hasMessageContaining("Duplicate rule id: a");
        }
    }
}
