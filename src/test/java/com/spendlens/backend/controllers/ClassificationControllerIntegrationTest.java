package com.spendlens.backend.controllers;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Full stack over H2 with no inference provider configured.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ClassificationControllerIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void classify_seededMerchant_isRuleMatch() throws Exception {
        String body = """
                {"transaction": {"transactionId": "T-100", "date": "2024-01-15",
                  "description": "UPI/SWIGGY/4455667788", "amount": 349.00}}
                """;

        mockMvc.perform(post("/api/classification/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.transactionId").value("T-100"))
                .andExpect(jsonPath("$.data.category").value("Food & Dining"))
                .andExpect(jsonPath("$.data.subcategory").value("Food Delivery"))
                .andExpect(jsonPath("$.data.method").value("rule"))
                .andExpect(jsonPath("$.data.needsReview").value(false));
    }

    @Test
    void classify_missingAmount_returnsBadRequest() throws Exception {
        String body = """
                {"transaction": {"transactionId": "T-101", "description": "SWIGGY"}}
                """;

        mockMvc.perform(post("/api/classification/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors[0]").value("transaction.amount: amount is required"));
    }

    @Test
    void classify_malformedJson_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/classification/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transaction\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void batch_rejectsBadRecordsAndClassifiesTheRest() throws Exception {
        String body = """
                {"transactions": [
                  {"transactionId": "B-1", "description": "UBER TRIP BLR", "amount": 220},
                  {"transactionId": "B-2", "description": "no amount here"},
                  {"transactionId": "B-1", "description": "ZOMATO ORDER", "amount": 410}
                ]}
                """;

        mockMvc.perform(post("/api/classification/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.results.length()").value(1))
                .andExpect(jsonPath("$.data.results[0].category").value("Transportation"))
                .andExpect(jsonPath("$.data.rejected.length()").value(2))
                .andExpect(jsonPath("$.data.rejected[1].reason").value("Duplicate transaction id"))
                .andExpect(jsonPath("$.message").value("1 classified, 2 rejected"));
    }

    @Test
    void sms_isParsedThenClassified() throws Exception {
        String body = """
                {"sms": "HDFC Bank: Rs.450.00 debited from A/c XX1234 on 15-Jan-24 to VPA ZOMATO@ICICI Ref No 456789",
                 "bank": "HDFC"}
                """;

        mockMvc.perform(post("/api/classification/sms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.transaction.description").value("ZOMATO"))
                .andExpect(jsonPath("$.data.transaction.date").value("2024-01-15"))
                .andExpect(jsonPath("$.data.classification.category").value("Food & Dining"));
    }

    @Test
    void correction_isLearnedAndListed() throws Exception {
        String correction = """
                {"transactionId": "C-1", "description": "KAAPI KOTTAI JAYANAGAR", "merchantName": "Kaapi Kottai",
                 "oldCategory": "Uncategorized", "newCategory": "Food & Dining", "newSubcategory": "Cafes & Coffee"}
                """;

        mockMvc.perform(post("/api/classification/corrections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(correction))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.correction.patternKey").value("kaapi kottai"))
                .andExpect(jsonPath("$.data.rule.source").value("learned"))
                .andExpect(jsonPath("$.data.result.method").value("manual"));

        mockMvc.perform(post("/api/classification/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"transaction": {"transactionId": "C-2",
                                  "description": "KAAPI KOTTAI BASAVANAGUDI", "amount": 120}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.method").value("rule"))
                .andExpect(jsonPath("$.data.subcategory").value("Cafes & Coffee"));

        mockMvc.perform(get("/api/classification/corrections").param("merchant", "Kaapi Kottai"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].newCategory").value("Food & Dining"));

        mockMvc.perform(get("/api/classification/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(greaterThan(50)))
                .andExpect(jsonPath("$.data[*].pattern").value(hasItem("kaapi kottai")));
    }

    @Test
    void correction_withoutNewCategory_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/classification/corrections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"ANYTHING\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("newCategory: newCategory is required"));
    }

    @Test
    void correction_withoutKey_returnsBadRequestFromService() throws Exception {
        mockMvc.perform(post("/api/classification/corrections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"### ///\", \"newCategory\": \"Shopping\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void customCategory_createdThenAppliedToClassification() throws Exception {
        String category = """
                {"name": "Wedding Fund", "tags": ["wedding", "one-time-event"],
                 "rules": [{"type": "KEYWORD", "value": "shaadi"},
                           {"type": "MERCHANT", "value": "WeddingWire", "priority": 2}]}
                """;

        mockMvc.perform(post("/api/classification/custom-categories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(category))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.name").value("Wedding Fund"))
                .andExpect(jsonPath("$.data.rules[1].priority").value(2));

        mockMvc.perform(post("/api/classification/custom-categories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(category))
                .andExpect(status().isBadRequest());

        String body = """
                {"transaction": {"transactionId": "T-300", "date": "2024-02-10",
                  "description": "UPI/SHAADI DECOR/4455667788", "amount": 15000}}
                """;

        mockMvc.perform(post("/api/classification/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.customCategory").value("Wedding Fund"))
                .andExpect(jsonPath("$.data.tags", hasItem("wedding")));

        mockMvc.perform(get("/api/classification/custom-categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].name", hasItem("Wedding Fund")));
    }

    @Test
    void customCategory_withoutRules_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/classification/custom-categories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Empty\", \"rules\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("rules: at least one rule is required"));
    }
}
