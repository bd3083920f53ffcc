package com.casebook.engine.compiler;

import com.casebook.engine.api.CaseCompilationListener;
import com.casebook.engine.api.ICaseCompiler.CaseFormat;
import com.casebook.engine.api.exceptions.CaseValidationException;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.FallacyKind;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.Requirement;
import com.casebook.engine.api.model.SecretTrigger;
import com.casebook.engine.api.model.Witness;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaseCompilerTest {

    private CaseCompiler compiler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        compiler = new CaseCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    private Path fixture() throws Exception {
        return Path.of(getClass().getResource("/cases/manor_library.yaml").toURI());
    }

    @Test
    @DisplayName("Should compile the YAML fixture into a complete case definition")
    void shouldCompileYamlFixture() throws Exception {
        CaseDefinition definition = compiler.compile(fixture());

        assertThat(definition.getCaseId()).isEqualTo("manor_library");
        assertThat(definition.getStartingLocationId()).isEqualTo("library");
        assertThat(definition.getInvestigationPointBudget()).isEqualTo(12);
        assertThat(definition.getMaxVerdictAttempts()).isEqualTo(10);
        assertThat(definition.getLocations()).extracting("id").containsExactly("library", "study");
        assertThat(definition.getAllEvidence()).extracting("id").containsExactly("e1", "e2", "e5", "e3", "e4");
        assertThat(definition.findEvidence("e5")).get()
                .satisfies(e -> {
                    assertThat(e.triggers()).containsExactly("look up", "examine ceiling");
                    assertThat(e.locationId()).isEqualTo("library");
                });
        assertThat(definition.findLocation("library").get().notPresent())
                .singleElement()
                .satisfies(np -> assertThat(np.responseId()).isEqualTo("library_fireplace_empty"));
    }

    @Test
    @DisplayName("Should build nested requirement trees from tagged objects")
    void shouldBuildRequirementTrees() throws Exception {
        CaseDefinition definition = compiler.compile(fixture());

        Hypothesis h3 = definition.findHypothesis("h3").orElseThrow();
        assertThat(h3.tier()).isEqualTo(Hypothesis.TIER_DEDUCED);
        assertThat(h3.requirement()).isEqualTo(Requirement.allOf(
                Requirement.evidence("e5"),
                new Requirement.ThresholdMet("investigationPointsSpent", 6)));

        Requirement h4 = definition.findHypothesis("h4").orElseThrow().requirement();
        assertThat(h4).isInstanceOf(Requirement.AnyOf.class);
        Requirement.AllOf inner = (Requirement.AllOf) ((Requirement.AnyOf) h4).children().get(1);
        Requirement.AnyOf innermost = (Requirement.AnyOf) inner.children().get(1);
        assertThat(((Requirement.ThresholdMet) innermost.children().get(1)).metric()).contains(Metric.EVIDENCE_COUNT);

        assertThat(definition.findHypothesis("h1").orElseThrow().requirement()).isNull();
    }

    @Test
    @DisplayName("Should compile solution tables with case-insensitive lookups")
    void shouldCompileSolutionTables() throws Exception {
        CaseDefinition definition = compiler.compile(fixture());

        var solution = definition.getSolution();
        assertThat(solution.culprit()).isEqualTo("gardener");
        assertThat(solution.keyEvidence()).containsExactly("e2", "e3");
        assertThat(solution.commonMistakeFor("BUTLER")).isPresent();
        assertThat(solution.commonMistakeFor("cook")).isEmpty();
        assertThat(solution.exampleFor(FallacyKind.CONFIRMATION_BIAS)).isPresent();
        assertThat(solution.isAuthorityFigure("Butler")).isTrue();
        assertThat(solution.presencePairingFor("butler").orElseThrow().distinguishingEvidence()).containsExactly("e3");
        assertThat(solution.counterArgumentKeywords()).contains("however");
        assertThat(definition.timelinePosition("t_body")).isGreaterThan(definition.timelinePosition("t_argument"));
    }

    @Test
    @DisplayName("Should parse witness secrets at load time")
    void shouldParseWitnessSecrets() throws Exception {
        CaseDefinition definition = compiler.compile(fixture());

        Witness butler = definition.findWitness("butler").orElseThrow();
        assertThat(butler.baseTrust()).isEqualTo(50);
        SecretTrigger trigger = butler.secrets().get(0).trigger();
        assertThat(trigger.groups()).hasSize(2);
        assertThat(trigger.groups().get(1).get(0).evidenceId()).isEqualTo("e2");

        Witness gardener = definition.findWitness("gardener").orElseThrow();
        assertThat(gardener.baseTrust()).isEqualTo(40);
    }

    @Test
    @DisplayName("Should accept JSON without a case wrapper and apply defaults")
    void shouldCompileUnwrappedJson() throws Exception {
        String json = """
                {
                  "id": "tiny",
                  "locations": [
                    {"id": "hall", "evidence": [{"id": "k1", "triggers": ["key"]}]}
                  ],
                  "hypotheses": [{"id": "h1"}],
                  "solution": {"culprit": "cook", "key_evidence": ["k1"]}
                }
                """;

        CaseDefinition definition = compiler.compile(json, CaseFormat.JSON);

        assertThat(definition.getStartingLocationId()).isEqualTo("hall");
        assertThat(definition.getInvestigationPointBudget()).isEqualTo(CaseDefinition.DEFAULT_INVESTIGATION_POINTS);
        assertThat(definition.getMaxVerdictAttempts()).isEqualTo(CaseDefinition.DEFAULT_MAX_ATTEMPTS);
        assertThat(definition.findHypothesis("h1").orElseThrow().isBase()).isTrue();
    }

    @Test
    @DisplayName("Should notify the listener of every stage in order")
    void shouldNotifyListener() throws Exception {
        List<String> events = new ArrayList<>();
        compiler.setCompilationListener(new CaseCompilationListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
                events.add("start:" + stageName + ":" + stageNumber + "/" + totalStages);
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
                events.add("done:" + stageName);
            }

            @Override
            public void onError(String stageName, Exception error) {
                events.add("error:" + stageName);
            }
        });

        compiler.compile(fixture());

        assertThat(events).containsExactly(
                "start:PARSING:1/4", "done:PARSING",
                "start:VALIDATION:2/4", "done:VALIDATION",
                "start:MODEL_BUILDING:3/4", "done:MODEL_BUILDING",
                "start:LINT:4/4", "done:LINT");
    }

    @Test
    @DisplayName("Should report the failing stage to the listener")
    void shouldReportFailingStage() throws Exception {
        List<String> errors = new ArrayList<>();
        compiler.setCompilationListener(new CaseCompilationListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
            }

            @Override
            public void onError(String stageName, Exception error) {
                errors.add(stageName);
            }
        });

        assertThatThrownBy(() -> compiler.compile("{\"id\": \"x\", \"locations\": []}", CaseFormat.JSON))
                .isInstanceOf(CaseValidationException.class);
        assertThat(errors).containsExactly("VALIDATION");
    }

    @Test
    @DisplayName("Should reject unsupported file extensions")
    void shouldRejectUnsupportedExtension() throws Exception {
        Path file = tempDir.resolve("case.txt");
        Files.writeString(file, "id: x");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CaseValidationException.class)
                .hasMessageContaining("Unsupported case file extension");
    }

    @Test
    @DisplayName("Should surface malformed YAML as an IOException")
    void shouldFailOnMalformedYaml() throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "case: [unclosed");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(java.io.IOException.class)
                .hasMessageContaining("Malformed YAML");
    }
}
