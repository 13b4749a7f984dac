package io.github.healprint.chat.api;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.healprint.chat.api.dto.ConversationDto;
import io.github.healprint.chat.api.dto.ConversationSummaryDto;
import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.api.dto.TurnResultDto;
import io.github.healprint.chat.model.AssessmentStage;
import io.github.healprint.chat.service.ConversationSessionEngine;
import io.github.healprint.chat.service.SessionResult;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.ws.rs.core.MediaType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ConversationsResourceTest {

    @InjectMock ConversationSessionEngine engine;

    @Test
    void createConversationReturnsCreatedWithSnakeCaseBody() {
        ConversationDto conversation = new ConversationDto();
        conversation.setConversationId("conv_u1_1740823200");
        conversation.setUserId("u1");
        conversation.setTitle("New Conversation");
        conversation.setCreatedAt(Instant.parse("2025-03-01T10:00:00Z"));
        conversation.setUpdatedAt(Instant.parse("2025-03-01T10:00:00Z"));
        when(engine.createConversation("u1", null)).thenReturn(SessionResult.ok(conversation));

        given().contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("user_id", "u1"))
                .when()
                .post("/v1/conversations")
                .then()
                .statusCode(201)
                .body("conversation_id", is("conv_u1_1740823200"))
                .body("assessment_stage", is("initial"))
                .body("needs_diagnosis", is(false));
    }

    @Test
    void appendTurnReturnsAssessmentState() {
        TurnResultDto turn = new TurnResultDto();
        turn.setConversationId("c1");
        turn.setResponse("How long have you had acne?");
        turn.setAssessmentStage(AssessmentStage.GATHERING_INFO);
        turn.setSymptomsCollected(Map.of("acne", SymptomEvidence.mentionedIn("skin_conditions")));
        when(engine.appendTurn("c1", "I have acne")).thenReturn(SessionResult.ok(turn));

        given().contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("message", "I have acne"))
                .when()
                .post("/v1/conversations/c1/turns")
                .then()
                .statusCode(200)
                .body("assessment_stage", is("gathering_info"))
                .body("symptoms_collected.acne.category", is("skin_conditions"))
                .body("error", nullValue());
    }

    @Test
    void listsUserConversations() {
        ConversationSummaryDto summary = new ConversationSummaryDto();
        summary.setConversationId("c1");
        summary.setMessageCount(2);
        when(engine.getUserConversations("u1")).thenReturn(SessionResult.ok(List.of(summary)));

        given().when()
                .get("/v1/users/u1/conversations")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].message_count", is(2));
    }

    @Test
    void mapsOutcomesToStatusCodes() {
        when(engine.getConversation("missing"))
                .thenReturn(SessionResult.notFound("Conversation missing not found"));
        when(engine.appendTurn("old", "hi")).thenReturn(SessionResult.closed("completed"));
        when(engine.analyzeConversation("empty"))
                .thenReturn(SessionResult.invalid("No symptoms collected for analysis"));
        when(engine.summarizeConversation("c1"))
                .thenReturn(SessionResult.unavailable("Conversation store is unavailable"));

        given().when()
                .get("/v1/conversations/missing")
                .then()
                .statusCode(404)
                .body("code", is("not_found"));
        given().contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("message", "hi"))
                .when()
                .post("/v1/conversations/old/turns")
                .then()
                .statusCode(409)
                .body("code", is("conversation_closed"));
        given().contentType(MediaType.APPLICATION_JSON)
                .when()
                .post("/v1/conversations/empty/analysis")
                .then()
                .statusCode(400)
                .body("details.message", equalTo("No symptoms collected for analysis"));
        given().when()
                .get("/v1/conversations/c1/summary")
                .then()
                .statusCode(503)
                .body("code", is("store_unavailable"));
    }

    @Test
    void deleteReturnsNoContent() {
        when(engine.deleteConversation("c1")).thenReturn(SessionResult.ok(true));

        given().when().delete("/v1/conversations/c1").then().statusCode(204);
        verify(engine).deleteConversation("c1");
    }

    @Test
    void healthReportsCacheMode() {
        given().when()
                .get("/v1/health")
                .then()
                .statusCode(200)
                .body("status", is("ok"))
                .body("cache", is("disabled"));
    }
}
