package com.homeostat.core.steps;

import com.homeostat.core.config.HomeostatProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ModelRoleClassifierTest {

    private final ModelRoleClassifier classifier = new ModelRoleClassifier(new HomeostatProperties());

    @ParameterizedTest
    @CsvSource({
            "'what time is it', standard",
            "'fix the bug in this function', coding",
            "'refactor the OrderService class', coding",
            "'explain why the build is slow', reasoning",
            "'compare the two trade-offs', reasoning"
    })
    void classifiesByWording(String message, String role) {
        assertEquals(role, classifier.classify(message));
    }

    @Test
    void longRequestsAreReasoningAndPlanned() {
        String longMessage = "please look at this ".repeat(30);

        assertEquals(ModelRoleClassifier.REASONING, classifier.classify(longMessage));
        assertTrue(classifier.needsPlanning(longMessage));
    }

    @Test
    void multiStepWordingNeedsPlanning() {
        assertTrue(classifier.needsPlanning("Do this step by step"));
        assertTrue(classifier.needsPlanning("1. read the file\n2. summarize it"));
        assertFalse(classifier.needsPlanning("hello"));
    }

    @Test
    void nullMessageIsStandard() {
        assertEquals(ModelRoleClassifier.STANDARD, classifier.classify(null));
        assertFalse(classifier.needsPlanning(null));
    }
}
