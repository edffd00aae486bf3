package com.deepansh.router.responder;

import com.deepansh.router.llm.LlmClient;
import com.deepansh.router.llm.LlmRequest;
import com.deepansh.router.llm.LlmResponse;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.ToolResultBlock;
import com.deepansh.router.model.ToolResultStatus;
import com.deepansh.router.model.ToolUseBlock;
import com.deepansh.router.tool.AgentTool;
import com.deepansh.router.tool.ToolDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SupervisorResponderTest {

    @Mock
    private LlmClient llmClient;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final List<ResponderRequest> memberRequests = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void process_sendMessages_asksEveryRecipientAndFeedsRepliesBack() {
        when(llmClient.chat(any())).thenReturn(
                reply(sendMessages(Map.of("recipient", "Flight Agent", "content", "Flights to Oslo?"),
                        Map.of("recipient", "Hotel Agent", "content", "Hotels in Oslo?"))),
                reply(Message.assistantText("Flight at 9am, hotel by the harbour.")));
        SupervisorResponder desk = supervisor(
                member("Flight Agent", false, in -> plain("Flight at 9am")),
                member("Hotel Agent", false, in -> plain("Hotel by the harbour")));

        Message answer = desk.process(request("Plan a trip to Oslo")).getMessage();

        assertThat(answer.getText()).isEqualTo("Flight at 9am, hotel by the harbour.");
        assertThat(memberRequests).extracting(ResponderRequest::getInputText)
                .containsExactlyInAnyOrder("Flights to Oslo?", "Hotels in Oslo?");
        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient, times(2)).chat(sent.capture());
        ToolResultBlock result = sent.getAllValues().get(1).getMessages().get(2).getToolResults().get(0);
        assertThat(result.status()).isEqualTo(ToolResultStatus.success);
        assertThat(result.payload()).isEqualTo("Flight Agent: Flight at 9amHotel Agent: Hotel by the harbour");
    }

    @Test
    void process_secondTurn_memberSeesItsHistoryAndLeadSeesAgentsMemory() {
        when(llmClient.chat(any())).thenReturn(
                reply(sendMessages(Map.of("recipient", "Flight Agent", "content", "Flights to Oslo?"))),
                reply(Message.assistantText("There is a flight at 9am.")),
                reply(sendMessages(Map.of("recipient", "flight-agent", "content", "Book it"))),
                reply(Message.assistantText("Booked.")));
        SupervisorResponder desk = supervisor(member("Flight Agent", false,
                in -> plain(in.equals("Book it") ? "Booked seat 12A" : "Flight at 9am")));

        desk.process(request("Any flights to Oslo?"));
        desk.process(request("Book it"));

        assertThat(memberRequests.get(0).getHistory()).isEmpty();
        assertThat(memberRequests.get(1).getHistory()).extracting(Message::getText)
                .containsExactly("Flights to Oslo?", "Flight at 9am");
        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient, times(4)).chat(sent.capture());
        assertThat(sent.getAllValues().get(0).getSystemPrompt())
                .contains("<agents_memory>\n\n</agents_memory>");
        assertThat(sent.getAllValues().get(2).getSystemPrompt())
                .contains("user:Flights to Oslo?\nassistant:[flight-agent] Flight at 9am\n");
        assertThat(desk.getTeamStore().loadRecent("u", "s", "flight-agent", 10)).hasSize(4);
    }

    @Test
    void process_unknownRecipient_isSkipped() {
        when(llmClient.chat(any())).thenReturn(
                reply(sendMessages(Map.of("recipient", "Car Agent", "content", "Rent a car"))),
                reply(Message.assistantText("I can't arrange cars.")));
        SupervisorResponder desk = supervisor(member("Flight Agent", false, in -> plain("unused")));

        desk.process(request("Rent a car"));

        assertThat(memberRequests).isEmpty();
        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient, times(2)).chat(sent.capture());
        assertThat(sent.getAllValues().get(1).getMessages().get(2).getToolResults())
                .extracting(ToolResultBlock::payload)
                .containsExactly("");
    }

    @Test
    void process_memberFails_leadReceivesErrorResult() {
        when(llmClient.chat(any())).thenReturn(
                reply(sendMessages(Map.of("recipient", "Flight Agent", "content", "Flights?"))),
                reply(Message.assistantText("Flight search is down right now.")));
        SupervisorResponder desk = supervisor(member("Flight Agent", false, in -> {
            throw new IllegalStateException("booking API offline");
        }));

        Message answer = desk.process(request("Flights?")).getMessage();

        assertThat(answer.getText()).isEqualTo("Flight search is down right now.");
        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient, times(2)).chat(sent.capture());
        ToolResultBlock result = sent.getAllValues().get(1).getMessages().get(2).getToolResults().get(0);
        assertThat(result.status()).isEqualTo(ToolResultStatus.error);
        assertThat(result.payload()).contains("booking API offline");
    }

    @Test
    void process_streamingMember_isJoinedIntoOneReply() {
        when(llmClient.chat(any())).thenReturn(
                reply(sendMessages(Map.of("recipient", "Tech Agent", "content", "What is TCP?"))),
                reply(Message.assistantText("TCP is a protocol")));
        SupervisorResponder desk = supervisor(
                member("Tech Agent", true, in -> ResponderOutput.of(Flux.just("TCP ", "is a ", "protocol"))));

        desk.process(request("Explain TCP"));

        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient, times(2)).chat(sent.capture());
        assertThat(sent.getAllValues().get(1).getMessages().get(2).getToolResults())
                .extracting(ToolResultBlock::payload)
                .containsExactly("Tech Agent: TCP is a protocol");
    }

    @Test
    void process_systemPromptListsTeamAndTools() {
        when(llmClient.chat(any())).thenReturn(reply(Message.assistantText("Hello!")));
        SupervisorResponder desk = supervisor(member("Flight Agent", false, in -> plain("unused")));

        desk.process(request("hi"));

        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient).chat(sent.capture());
        assertThat(sent.getValue().getSystemPrompt())
                .startsWith("You are a Travel Desk.\nPlans trips.")
                .contains("<agents>\nFlight Agent: Flight Agent for tests\n</agents>")
                .contains("send_messages:Send messages to multiple agents in parallel.");
        assertThat(sent.getValue().getTools()).extracting(ToolDefinition::getName)
                .containsExactly(SupervisorResponder.SEND_MESSAGES);
    }

    @Test
    void builder_noTeam_throws() {
        assertThatThrownBy(() -> SupervisorResponder.builder()
                .name("Travel Desk").llmClient(llmClient).executor(executor).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("team member");
    }

    @Test
    void builder_extraToolNamedSendMessages_throws() {
        AgentTool clash = mock(AgentTool.class);
        when(clash.getName()).thenReturn(SupervisorResponder.SEND_MESSAGES);

        assertThatThrownBy(() -> SupervisorResponder.builder()
                .name("Travel Desk")
                .llmClient(llmClient)
                .executor(executor)
                .teamMember(member("Flight Agent", false, in -> plain("unused")))
                .extraTool(clash)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("managed by the supervisor");
    }

    private SupervisorResponder supervisor(Responder... team) {
        return SupervisorResponder.builder()
                .name("Travel Desk")
                .description("Plans trips.")
                .llmClient(llmClient)
                .team(List.of(team))
                .executor(executor)
                .build();
    }

    private Responder member(String name, boolean streaming, Function<String, ResponderOutput> body) {
        return new AbstractResponder(name, name + " for tests",
                streaming ? ResponderCapabilities.streamingOnly() : ResponderCapabilities.PLAIN, true) {
            @Override
            protected ResponderOutput respond(ResponderRequest request) {
                memberRequests.add(request);
                return body.apply(request.getInputText());
            }
        };
    }

    @SafeVarargs
    private static Message sendMessages(Map<String, ?>... messages) {
        return Message.builder()
                .role(Message.Role.assistant)
                .block(new ToolUseBlock("call-1", SupervisorResponder.SEND_MESSAGES,
                        Map.of("messages", List.of(messages))))
                .build();
    }

    private static ResponderOutput plain(String text) {
        return ResponderOutput.of(Message.assistantText(text));
    }

    private static ResponderRequest request(String input) {
        return ResponderRequest.builder().inputText(input).userId("u").sessionId("s").build();
    }

    private static LlmResponse reply(Message message) {
        return LlmResponse.builder().message(message).stopReason("stop").build();
    }
}
