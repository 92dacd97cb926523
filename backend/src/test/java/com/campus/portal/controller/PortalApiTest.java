package com.campus.portal.controller;

import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.User;
import com.campus.portal.support.Fixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PortalApiTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper json;
    @Autowired Fixtures fx;

    private User teacher;
    private Club club;

    @BeforeEach
    void setUp() {
        teacher = fx.teacher();
        club = fx.club(teacher);
    }

    @Test
    void selfRegisteredStudentJoinsAClubOnce() throws Exception {
        String email = "new-" + UUID.randomUUID().toString().substring(0, 8) + "@portal.test";
        var body = Map.of("email", email, "password", "long-enough-pw", "name", "New Student");
        String res = mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("STUDENT"))
                .andReturn().getResponse().getContentAsString();
        String token = json.readTree(res).get("token").asText();

        mvc.perform(post("/api/clubs/{id}/join", club.getId()).header("Authorization", "Bearer " + token))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("MEMBER"));

        mvc.perform(post("/api/clubs/{id}/join", club.getId()).header("Authorization", "Bearer " + token))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.reason").value("already-member"));

        mvc.perform(get("/api/clubs/{id}", club.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memberCount").value(1));
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        User s = fx.student();
        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of("email", s.getEmail(), "password", "nope-nope"))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void mutationsNeedAToken() throws Exception {
        mvc.perform(post("/api/clubs/{id}/join", club.getId()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void studentGetsADenialWithTheReason() throws Exception {
        String token = login(fx.student());
        var body = Map.of("name", "Rogue " + UUID.randomUUID(), "description", "Should never exist.",
                "category", "SOCIAL", "coordinatorId", teacher.getId());

        mvc.perform(post("/api/clubs")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(body)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("insufficient-role"))
                .andExpect(jsonPath("$.action").value("CREATE_CLUB"));
    }

    @Test
    void malformedPayloadFailsValidation() throws Exception {
        String token = login(teacher);
        mvc.perform(post("/api/events")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("validation-error"))
                .andExpect(jsonPath("$.fields.title").exists());
    }

    @Test
    void registrationThroughTheApiShowsUpInMyRegistrations() throws Exception {
        User s = fx.student();
        Event e = fx.event(club, teacher, 5);
        String token = login(s);

        mvc.perform(post("/api/events/{id}/register", e.getId()).header("Authorization", "Bearer " + token))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("REGISTERED"));

        mvc.perform(get("/api/users/me/registrations").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].eventId").value(e.getId()));

        mvc.perform(get("/api/events/{id}", e.getId()))
                .andExpect(jsonPath("$.availableSpots").value(4))
                .andExpect(jsonPath("$.registrationOpen").value(true));
    }

    @Test
    void authorizeEndpointReportsDecisions() throws Exception {
        String token = login(teacher);
        String res = mvc.perform(get("/api/authorize")
                        .param("action", "UPDATE_CLUB")
                        .param("clubId", club.getId().toString())
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertThat(json.readTree(res).get("allowed").asBoolean()).isTrue();

        mvc.perform(get("/api/authorize")
                        .param("action", "DELETE_CLUB")
                        .param("clubId", club.getId().toString())
                        .header("Authorization", "Bearer " + token))
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.reason").value("insufficient-role"));
    }

    private String login(User u) throws Exception {
        String res = mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of("email", u.getEmail(), "password", Fixtures.PASSWORD))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(u.getId()))
                .andExpect(jsonPath("$.role").value(u.getRole().name()))
                .andReturn().getResponse().getContentAsString();
        JsonNode node = json.readTree(res);
        return node.get("token").asText();
    }
}
