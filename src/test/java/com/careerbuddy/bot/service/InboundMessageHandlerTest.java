package com.careerbuddy.bot.service;

import com.careerbuddy.bot.dto.InboundMessage;
import com.careerbuddy.bot.dto.ResponseDirective;
import com.careerbuddy.bot.exception.RenderingException;
import com.careerbuddy.bot.model.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import static com.careerbuddy.bot.constant.MessageTemplates.GENERIC_ERROR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InboundMessageHandlerTest {

    @Mock
    private ConversationService conversationService;

    private InboundMessageHandler handler;

    private final InboundMessage message = InboundMessage.builder().userId(42L).text("resume").messageId(3).build();

    @BeforeEach
    void setUp() {
        handler = new InboundMessageHandler(conversationService);
    }

    @Test
    @DisplayName("Should replay the turn once after an optimistic lock failure")
    void shouldRetryOnceOnLockFailure() {
        ResponseDirective ok = ResponseDirective.text("ok");
        when(conversationService.handleInbound(message))
                .thenThrow(new ObjectOptimisticLockingFailureException(Job.class, 7L))
                .thenReturn(ok);

        assertThat(handler.handle(message)).isSameAs(ok);
        verify(conversationService, times(2)).handleInbound(message);
    }

    @Test
    @DisplayName("Should give up with the generic error when the replay fails too")
    void shouldApologizeWhenRetryFails() {
        when(conversationService.handleInbound(message))
                .thenThrow(new ObjectOptimisticLockingFailureException(Job.class, 7L));

        assertThat(handler.handle(message).getText()).isEqualTo(GENERIC_ERROR);
        verify(conversationService, times(2)).handleInbound(message);
    }

    @Test
    @DisplayName("Should answer persistence failures with the generic error")
    void shouldApologizeOnPersistenceFailure() {
        when(conversationService.handleInbound(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(handler.handle(message).getText()).isEqualTo(GENERIC_ERROR);
        verify(conversationService, times(1)).handleInbound(message);
    }

    @Test
    @DisplayName("Should answer rendering failures with the generic error")
    void shouldApologizeOnRenderingFailure() {
        when(conversationService.handleInbound(any()))
                .thenThrow(new RenderingException("font missing", new IllegalStateException()));

        ResponseDirective directive = handler.handle(message);

        assertThat(directive.isDocument()).isFalse();
        assertThat(directive.getText()).isEqualTo(GENERIC_ERROR);
    }

    @Test
    @DisplayName("Should not propagate a failed delivery acknowledgement")
    void shouldLogFailedDeliveryAck() {
        doThrow(new DataAccessResourceFailureException("db down")).when(conversationService).markDelivered(7L);

        assertThatCode(() -> handler.markDelivered(7L)).doesNotThrowAnyException();
    }
}
