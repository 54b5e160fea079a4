package com.example.transformationhub.config;

import com.example.transformationhub.codegen.ExecutableUnit;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.service.TransformationRevisionService;
import com.example.transformationhub.support.UnitEvaluator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "transformations.examples.enabled=true",
        "spring.datasource.url=jdbc:h2:mem:transformations-examples;DB_CLOSE_DELAY=-1"
})
@ActiveProfiles("test")
@DisplayName("Example transformations")
class ExampleTransformationsLoaderIntegrationTest {

    private static final UUID ADD = UUID.fromString("0a1b2c3d-0000-4000-8000-000000000001");
    private static final UUID PASS_THROUGH = UUID.fromString("0a1b2c3d-0000-4000-8000-000000000002");
    private static final UUID ADD_TWICE = UUID.fromString("0a1b2c3d-0000-4000-8000-000000000003");

    @Autowired
    private TransformationRevisionService service;

    @Test
    @DisplayName("are imported as released revisions at startup")
    void importedAtStartup() {
        List<TransformationRevision> all = service.findAll(null, RevisionState.RELEASED);

        assertThat(all).extracting(TransformationRevision::id).contains(ADD, PASS_THROUGH, ADD_TWICE);
        assertThat(all).hasSizeGreaterThanOrEqualTo(ExampleTransformationsLoader.EXAMPLE_FILES.size());
        assertThat(service.usedBy(ADD)).containsExactly(ADD_TWICE);
    }

    @Test
    @DisplayName("the example workflow compiles to (x + y) + 1")
    void exampleWorkflowCompiles() {
        ExecutableUnit unit = service.compileForExecution(ADD_TWICE);
        UnitEvaluator evaluator = new UnitEvaluator()
                .component(ADD, in -> Map.of("sum", asInt(in.get("a")) + asInt(in.get("b"))))
                .component(PASS_THROUGH, in -> Map.of("output", in.get("input")));

        assertThat(unit.steps()).hasSize(3);
        assertThat(evaluator.evaluate(unit, Map.of("x", 3, "y", 4))).containsEntry("result", 8);
    }

    private static int asInt(Object value) {
        return Integer.parseInt(String.valueOf(value));
    }
}
