package com.buildhook.dispatcher.api;

import com.buildhook.dispatcher.dispatch.MessagePublisher;
import com.buildhook.dispatcher.event.MalformedMessageException;
import com.buildhook.dispatcher.model.InboxMessage;
import com.buildhook.dispatcher.model.Subscription;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MessageController.class)
class MessageControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean MessagePublisher publisher;

    @Test
    void publish_groupStatus_returns202WithMessageId() throws Exception {
        InboxMessage message = new InboxMessage(Subscription.GROUP_STATUS, "{}");
        UUID id = UUID.randomUUID();
        ReflectionTestUtils.setField(message, "id", id);
        when(publisher.publish(eq(Subscription.GROUP_STATUS), anyString())).thenReturn(Optional.of(message));

        mockMvc.perform(post("/messages/group-status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"taskGroupId":"tg1","schedulerId":"taskcluster-github"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.messageId").value(id.toString()))
                .andExpect(jsonPath("$.subscription").value("group-status"));
    }

    @Test
    void publish_otherScheduler_returns204() throws Exception {
        when(publisher.publish(eq(Subscription.TASK_STATUS), anyString())).thenReturn(Optional.empty());

        mockMvc.perform(post("/messages/task-status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":{\"schedulerId\":\"other\"}}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void publish_unknownSubscription_returns400() throws Exception {
        mockMvc.perform(post("/messages/issue-comment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(publisher);
    }

    @Test
    void publish_malformedBody_returns400() throws Exception {
        when(publisher.publish(any(), anyString()))
                .thenThrow(new MalformedMessageException("Message is not a JSON object"));

        mockMvc.perform(post("/messages/job")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1,2]"))
                .andExpect(status().isBadRequest());
    }
}
