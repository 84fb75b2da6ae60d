package com.phillippitts.selfconsistency.service.prompt;

import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.testutil.TestRequests;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplatesTest {

    @Test
    void stepPromptCarriesQuestionPriorStepsAndPosition() {
        PromptRequest request = TestRequests.request(3, 3);
        List<ReasoningStep> prior = List.of(new ReasoningStep(1, "Recall geography", "France is in Europe"));

        String prompt = PromptTemplates.stepPrompt(request, 2, prior, null);

        assertThat(prompt)
                .contains("What is the capital of France?")
                .contains("Step 1: Recall geography")
                .contains("Conclusion: France is in Europe")
                .contains("step 2 of 3")
                .doesNotContain("final_answer");
    }

    @Test
    void finalStepAsksForAnswerAndConfidence() {
        String prompt = PromptTemplates.stepPrompt(TestRequests.request(3, 1), 1, List.of(), null);

        assertThat(prompt).contains("\"final_answer\"").contains("\"confidence\"");
    }

    @Test
    void retryAddsStricterInstruction() {
        String prompt = PromptTemplates.stepPrompt(TestRequests.request(3, 1), 1, List.of(), "no JSON object in response");

        assertThat(prompt).contains("could not be used (no JSON object in response)").contains("ONLY the JSON object");
    }

    @Test
    void callerSystemPromptIsKept() {
        PromptRequest request = new PromptRequest("Q", "Answer in French", null, 1, 1, ModelTier.FAST, 0.5);

        assertThat(PromptTemplates.stepSystemPrompt(request)).startsWith("Answer in French");
        assertThat(PromptTemplates.reflectionSystemPrompt(request)).startsWith("Answer in French");
    }

    @Test
    void reflectionPromptListsEverySolution() {
        String prompt = PromptTemplates.reflectionPrompt(TestRequests.request(2, 1),
                List.of(TestRequests.path(1, "Paris", 90), TestRequests.path(2, "Lyon", 40)),
                "Paris", "Generated 2 independent reasoning paths; agreement 1/2.");

        assertThat(prompt)
                .contains("Solution 1 (self-confidence 90%)")
                .contains("Final answer: Lyon")
                .contains("Majority answer: Paris")
                .contains("agreement 1/2")
                .contains("\"refined_answer\"");
    }
}
