package uk.gegc.qaloader.features.staging;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.qaloader.BaseIntegrationTest;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionRecord;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;
import uk.gegc.qaloader.features.question.domain.repository.QuestionRecordRepository;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.qaloader.features.ingestion.MarkdownFixtures.dcfBlock;
import static uk.gegc.qaloader.features.ingestion.MarkdownFixtures.document;

/**
 * Imports commit per record, so these tests run outside the test transaction and clean up themselves.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("Staging end to end")
class StagingIntegrationTest extends BaseIntegrationTest {

    private static final String BATCHES = "/api/v1/staging/batches";

    @Autowired
    private QuestionRecordRepository questionRecordRepository;

    @BeforeEach
    @AfterEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM staged_questions");
        jdbcTemplate.update("DELETE FROM upload_batches");
        clearStoredQuestions();
    }

    @Test
    @DisplayName("stage, review and import: only approved questions reach the store")
    void stageReviewImport() throws Exception {
        questionRecordRepository.saveAndFlush(stored("DCF-WACC-B-D-001", "What is WACC?"));

        MvcResult staged = mockMvc.perform(multipart(BATCHES)
                        .file(markdown(document(dcfBlock("What is WACC?"), dcfBlock("What is beta?"))))
                        .param("uploadedBy", "alice"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.batch.status").value("PENDING"))
                .andExpect(jsonPath("$.batch.totalQuestions").value(2))
                .andExpect(jsonPath("$.batch.duplicateCount").value(1))
                .andExpect(jsonPath("$.questions[0].status").value("DUPLICATE"))
                .andExpect(jsonPath("$.questions[0].duplicateOf").value("DCF-WACC-B-D-001"))
                .andExpect(jsonPath("$.questions[1].status").value("PENDING"))
                .andReturn();
        assertThat(storedQuestionCount()).isEqualTo(1);

        String body = staged.getResponse().getContentAsString();
        String batchId = JsonPath.read(body, "$.batch.id");
        List<String> questionIds = JsonPath.read(body, "$.questions[*].id");

        mockMvc.perform(post(BATCHES + "/{batchId}/review", batchId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(review(questionIds.get(0), "REJECT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REVIEWING"))
                .andExpect(jsonPath("$.rejectedCount").value(1))
                .andExpect(jsonPath("$.reviewedBy").value("dana"));
        mockMvc.perform(post(BATCHES + "/{batchId}/review", batchId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(review(questionIds.get(1), "APPROVE")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approvedCount").value(1));

        mockMvc.perform(post(BATCHES + "/{batchId}/import", batchId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAttempted").value(1))
                .andExpect(jsonPath("$.importedIds[0]").value("DCF-WACC-B-D-002"))
                .andExpect(jsonPath("$.batchStatus").value("COMPLETED"));

        assertThat(storedQuestionCount()).isEqualTo(2);
        QuestionRecord imported = questionRecordRepository.findById("DCF-WACC-B-D-002").orElseThrow();
        assertThat(imported.getQuestion()).isEqualTo("What is beta?");
        assertThat(imported.getUploadedBy()).isEqualTo("alice");

        mockMvc.perform(get(BATCHES + "/{batchId}", batchId).param("status", "IMPORTED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batch.importedCount").value(1))
                .andExpect(jsonPath("$.questions", hasSize(1)))
                .andExpect(jsonPath("$.questions[0].importedQuestionId").value("DCF-WACC-B-D-002"));

        mockMvc.perform(post(BATCHES + "/{batchId}/import", batchId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("COMPLETED"));
    }

    @Test
    @DisplayName("import: a batch with questions still awaiting review stays open")
    void import_leavesBatchOpenWhileReviewPending() throws Exception {
        MvcResult staged = mockMvc.perform(multipart(BATCHES)
                        .file(markdown(document(dcfBlock("What is WACC?"), dcfBlock("What is beta?")))))
                .andExpect(status().isCreated())
                .andReturn();
        String body = staged.getResponse().getContentAsString();
        String batchId = JsonPath.read(body, "$.batch.id");
        List<String> questionIds = JsonPath.read(body, "$.questions[*].id");

        mockMvc.perform(post(BATCHES + "/{batchId}/review", batchId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(review(questionIds.get(0), "APPROVE")))
                .andExpect(status().isOk());

        mockMvc.perform(post(BATCHES + "/{batchId}/import", batchId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.importedIds[0]").value("DCF-WACC-B-D-001"))
                .andExpect(jsonPath("$.batchStatus").value("REVIEWING"));

        mockMvc.perform(post(BATCHES + "/{batchId}/review", batchId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(review(questionIds.get(0), "REJECT")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"));
        assertThat(storedQuestionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("duplicates: a stored twin added after staging is flagged on re-check")
    void detectDuplicates_flagsNewTwin() throws Exception {
        MvcResult staged = mockMvc.perform(multipart(BATCHES).file(markdown(dcfBlock("What is WACC?"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.questions[0].status").value("PENDING"))
                .andReturn();
        String batchId = JsonPath.read(staged.getResponse().getContentAsString(), "$.batch.id");

        questionRecordRepository.saveAndFlush(stored("DCF-WACC-B-D-001", "What is WACC"));

        mockMvc.perform(post(BATCHES + "/{batchId}/duplicates", batchId).param("threshold", "0.9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batch.duplicateThreshold").value(0.9))
                .andExpect(jsonPath("$.batch.duplicateCount").value(1))
                .andExpect(jsonPath("$.questions[0].duplicateOf").value("DCF-WACC-B-D-001"));
    }

    @Test
    @DisplayName("cancel: a cancelled batch refuses further review")
    void cancel_closesBatch() throws Exception {
        MvcResult staged = mockMvc.perform(multipart(BATCHES).file(markdown(dcfBlock("What is WACC?"))))
                .andExpect(status().isCreated())
                .andReturn();
        String body = staged.getResponse().getContentAsString();
        String batchId = JsonPath.read(body, "$.batch.id");
        String questionId = JsonPath.read(body, "$.questions[0].id");

        mockMvc.perform(post(BATCHES + "/{batchId}/cancel", batchId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post(BATCHES + "/{batchId}/review", batchId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(review(questionId, "APPROVE")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Invalid Batch State"));

        mockMvc.perform(get(BATCHES).param("status", "CANCELLED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(batchId));
        assertThat(storedQuestionCount()).isZero();
    }

    private static String review(String questionId, String action) {
        return "{\"stagedQuestionIds\": [\"" + questionId + "\"], \"action\": \"" + action
                + "\", \"reviewedBy\": \"dana\"}";
    }

    private static MockMultipartFile markdown(String text) {
        return new MockMultipartFile("file", "questions.md", "text/markdown", text.getBytes(StandardCharsets.UTF_8));
    }

    private static QuestionRecord stored(String id, String question) {
        QuestionRecord record = new QuestionRecord();
        record.setQuestionId(id);
        record.setTopic("DCF");
        record.setSubtopic("WACC");
        record.setDifficulty(Difficulty.BASIC);
        record.setType(QuestionType.DEFINITION);
        record.setQuestion(question);
        record.setAnswer("Answer");
        return record;
    }
}
