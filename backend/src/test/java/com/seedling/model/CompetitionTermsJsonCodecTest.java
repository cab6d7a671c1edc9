package com.seedling.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CompetitionTermsJsonCodecTest {

    @Test
    void prizeStructureKeepsDeclarationOrder() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("first", 0.5);
        json.put("second", 0.3);
        json.put("third", 0.2);

        Map<String, Double> places = CompetitionTermsJsonCodec.prizeStructure(json);

        assertEquals(List.of("first", "second", "third"), List.copyOf(places.keySet()));
        assertEquals(0.3, places.get("second"));
    }

    @Test
    void prizeStructureRejectsNegativeFraction() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("first", -0.1);

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> CompetitionTermsJsonCodec.prizeStructure(json)
        );

        assertEquals("Prize fraction for place 'first' must be non-negative", ex.getMessage());
    }

    @Test
    void rubricWeightsAcceptsFlatAndNestedForms() {
        ObjectNode flat = JsonNodeFactory.instance.objectNode();
        flat.put("innovation", 2);
        flat.putObject("feasibility").put("weight", 1.5);
        flat.putObject("clarity").put("description", "How clear is the pitch");

        ObjectNode nested = JsonNodeFactory.instance.objectNode();
        nested.set("criteria", flat.deepCopy());

        Map<String, Double> fromFlat = CompetitionTermsJsonCodec.rubricWeights(flat);
        Map<String, Double> fromNested = CompetitionTermsJsonCodec.rubricWeights(nested);

        assertEquals(Map.of("innovation", 2.0, "feasibility", 1.5, "clarity", 1.0), fromFlat);
        assertEquals(fromFlat, fromNested);
    }

    @Test
    void rubricWeightsHonorsFlatNumericWeightAndDefaultsOtherScalars() {
        ObjectNode rubric = JsonNodeFactory.instance.objectNode();
        rubric.put("traction", 3);
        rubric.put("team", "high");
        rubric.putNull("market");

        Map<String, Double> weights = CompetitionTermsJsonCodec.rubricWeights(rubric);

        assertEquals(3.0, weights.get("traction"));
        assertEquals(1.0, weights.get("team"));
        assertEquals(1.0, weights.get("market"));
    }

    @Test
    void rubricWeightsIsNullForNonObjectRubric() {
        assertNull(CompetitionTermsJsonCodec.rubricWeights(JsonNodeFactory.instance.arrayNode()));
        assertNull(CompetitionTermsJsonCodec.rubricWeights(null));
    }
}
