package com.tuorg.programservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tuorg.programservice.security.ApiKeyFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ProgramControllerTest {

    private static final String KEY = "test-key";
    private static final String VALID_BODY = "{\"goal\":\"hypertrophy\",\"durationWeeks\":8,\"sessionsPerWeek\":4,"
            + "\"experienceLevel\":\"intermediate\",\"equipmentAvailable\":[\"full_gym\"]}";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper mapper;

    @Test
    void pingNeedsNoKey() throws Exception {
        mvc.perform(get("/api/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("program-service"));
    }

    @Test
    void missingOrWrongKeyIsRejected() throws Exception {
        mvc.perform(post("/api/programs/generate").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/programs/anything").header(ApiKeyFilter.HEADER_NAME, "wrong"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void generatesThenFetchesProgram() throws Exception {
        MvcResult result = mvc.perform(post("/api/programs/generate")
                        .header(ApiKeyFilter.HEADER_NAME, KEY)
                        .header("X-USER-ID", "user-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.program.name").value("8-Week Hypertrophy Program"))
                .andExpect(jsonPath("$.program.goal").value("hypertrophy"))
                .andExpect(jsonPath("$.program.weeks.length()").value(8))
                .andExpect(jsonPath("$.generationMetadata.periodizationModel").value("undulating"))
                .andExpect(jsonPath("$.generationMetadata.validationPassed").value(true))
                .andExpect(jsonPath("$.generationMetadata.llmUsed").value(false))
                .andReturn();

        JsonNode body = mapper.readTree(result.getResponse().getContentAsString());
        String programId = body.at("/program/id").asText();
        assertThat(programId).isNotBlank();
        assertThat(body.at("/program/userId").asText()).isEqualTo("user-42");

        mvc.perform(get("/api/programs/" + programId).header(ApiKeyFilter.HEADER_NAME, KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(programId))
                .andExpect(jsonPath("$.weeks[0].workouts.length()").value(4));
    }

    @Test
    void missingUserHeaderIsBadRequest() throws Exception {
        mvc.perform(post("/api/programs/generate")
                        .header(ApiKeyFilter.HEADER_NAME, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing user"));
    }

    @Test
    void invalidBodiesAreBadRequests() throws Exception {
        mvc.perform(post("/api/programs/generate")
                        .header(ApiKeyFilter.HEADER_NAME, KEY)
                        .header("X-USER-ID", "u")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\":\"strength\",\"durationWeeks\":0,\"sessionsPerWeek\":3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request"));

        mvc.perform(post("/api/programs/generate")
                        .header(ApiKeyFilter.HEADER_NAME, KEY)
                        .header("X-USER-ID", "u")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\":\"bulking\",\"durationWeeks\":8,\"sessionsPerWeek\":3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Unknown goal: bulking"));

        mvc.perform(post("/api/programs/generate")
                        .header(ApiKeyFilter.HEADER_NAME, KEY)
                        .header("X-USER-ID", "u")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void unknownProgramIsNotFound() throws Exception {
        mvc.perform(get("/api/programs/does-not-exist").header(ApiKeyFilter.HEADER_NAME, KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Program not found"));
    }

    @Test
    void alternativesRespectEquipment() throws Exception {
        mvc.perform(get("/api/exercises/barbell-squat/alternatives")
                        .param("equipment", "dumbbells")
                        .param("limit", "3")
                        .header(ApiKeyFilter.HEADER_NAME, KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exerciseId").value("barbell-squat"))
                .andExpect(jsonPath("$.alternatives[0].id").value("goblet-squat"))
                .andExpect(jsonPath("$.alternatives[1].id").value("bodyweight-squat"));

        mvc.perform(get("/api/exercises/barbell-squat/alternatives").param("limit", "0")
                        .header(ApiKeyFilter.HEADER_NAME, KEY))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/exercises/nope/alternatives").header(ApiKeyFilter.HEADER_NAME, KEY))
                .andExpect(status().isNotFound());
    }
}
