package com.deepansh.router.api;

import com.deepansh.router.core.Orchestrator;
import com.deepansh.router.core.RequestMetadata;
import com.deepansh.router.core.ResponseEnvelope;
import com.deepansh.router.core.RouteRequest;
import com.deepansh.router.exception.GlobalExceptionHandler;
import com.deepansh.router.exception.StorageUnavailableException;
import com.deepansh.router.model.Message;
import com.deepansh.router.responder.ResponderCapabilities;
import com.deepansh.router.responder.ResponderRegistration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RouterControllerTest {

    @Mock
    private Orchestrator orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RouterController(orchestrator, Runnable::run))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void route_returnsMetadataAndOutput() throws Exception {
        when(orchestrator.route(any())).thenReturn(
                ResponseEnvelope.ofMessage(metadata("math-agent", "Math Agent"), Message.assistantText("4")));

        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"What is 2+2?\",\"userId\":\"u1\",\"sessionId\":\"s1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("4"))
                .andExpect(jsonPath("$.streaming").value(false))
                .andExpect(jsonPath("$.metadata.agentId").value("math-agent"))
                .andExpect(jsonPath("$.metadata.errorType").doesNotExist());

        ArgumentCaptor<RouteRequest> sent = ArgumentCaptor.forClass(RouteRequest.class);
        verify(orchestrator).route(sent.capture());
        assertThat(sent.getValue().getUserId()).isEqualTo("u1");
        assertThat(sent.getValue().getSessionId()).isEqualTo("s1");
        assertThat(sent.getValue().getForcedSelection()).isNull();
    }

    @Test
    void route_streamingEnvelope_isJoinedIntoOutput() throws Exception {
        when(orchestrator.route(any())).thenReturn(
                ResponseEnvelope.ofStream(metadata("tech-agent", "Tech Agent"), Flux.just("TCP ", "is a protocol")));

        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"What is TCP?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("TCP is a protocol"))
                .andExpect(jsonPath("$.streaming").value(true));
    }

    @Test
    void route_missingIdsAndForcedResponder_areDefaulted() throws Exception {
        when(orchestrator.route(any())).thenReturn(
                ResponseEnvelope.ofMessage(metadata("math-agent", "Math Agent"), Message.assistantText("4")));

        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"2+2\",\"responderId\":\"math-agent\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<RouteRequest> sent = ArgumentCaptor.forClass(RouteRequest.class);
        verify(orchestrator).route(sent.capture());
        assertThat(sent.getValue().getUserId()).isEqualTo("default");
        assertThat(sent.getValue().getSessionId()).isNotBlank();
        assertThat(sent.getValue().getForcedSelection().responderId()).isEqualTo("math-agent");
        assertThat(sent.getValue().getForcedSelection().confidence()).isEqualTo(1.0);
    }

    @Test
    void route_blankInput_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("input: input must not be blank"));
    }

    @Test
    void route_confidenceOutOfRange_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"hi\",\"responderId\":\"math-agent\",\"confidence\":1.5}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void route_unknownForcedResponder_returns400() throws Exception {
        when(orchestrator.route(any())).thenThrow(new IllegalArgumentException("Unknown responder 'ghost'"));

        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"hi\",\"responderId\":\"ghost\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown responder 'ghost'"));
    }

    @Test
    void route_storageUnavailable_returns503() throws Exception {
        when(orchestrator.route(any())).thenThrow(new StorageUnavailableException("redis down", null));

        mockMvc.perform(post("/api/v1/router/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"hi\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("redis down"));
    }

    @Test
    void routeStream_sendsMetadataFragmentsAndDone() throws Exception {
        when(orchestrator.route(any())).thenReturn(
                ResponseEnvelope.ofStream(metadata("tech-agent", "Tech Agent"), Flux.just("TCP ", "is a protocol")));

        MvcResult result = mockMvc.perform(post("/api/v1/router/route/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"What is TCP?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:metadata").contains("\"agentId\":\"tech-agent\"");
        assertThat(body.indexOf("data:TCP ")).isLessThan(body.indexOf("data:is a protocol"));
        assertThat(body).contains("event:done");
    }

    @Test
    void agents_listsRegistrations() throws Exception {
        when(orchestrator.getResponders()).thenReturn(List.of(
                new ResponderRegistration("math-agent", "Math Agent", "Solves arithmetic",
                        ResponderCapabilities.PLAIN)));

        mockMvc.perform(get("/api/v1/router/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("math-agent"))
                .andExpect(jsonPath("$[0].capabilities.streaming").value(false));
    }

    @Test
    void health_returnsUp() throws Exception {
        mockMvc.perform(get("/api/v1/router/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    private static RequestMetadata metadata(String agentId, String agentName) {
        return RequestMetadata.builder()
                .userInput("input")
                .agentId(agentId)
                .agentName(agentName)
                .userId("u1")
                .sessionId("s1")
                .confidence(0.9)
                .build();
    }
}
