package com.careerbuddy.bot.service;

import com.careerbuddy.bot.exception.DuplicateMessageException;
import com.careerbuddy.bot.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdempotencyFilterTest {

    private final IdempotencyFilter filter = new IdempotencyFilter();

    private Job job(Integer lastMessageId) {
        return Job.builder().id(1L).lastMessageId(lastMessageId).build();
    }

    @Test
    @DisplayName("Should flag the stored message id as duplicate")
    void shouldDetectDuplicate() {
        assertThat(filter.isDuplicate(job(10), 10)).isTrue();
        assertThatThrownBy(() -> filter.verify(job(10), 10)).isInstanceOf(DuplicateMessageException.class);
    }

    @Test
    @DisplayName("Should accept any other message id")
    void shouldAcceptNewMessage() {
        assertThat(filter.isDuplicate(job(10), 11)).isFalse();
        assertThat(filter.isDuplicate(job(null), 11)).isFalse();
        assertThatCode(() -> filter.verify(job(10), 11)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should never treat a message without id as duplicate")
    void shouldIgnoreMissingId() {
        assertThat(filter.isDuplicate(job(null), null)).isFalse();
    }

    @Test
    @DisplayName("Should store the processed id")
    void shouldMarkProcessed() {
        Job job = job(10);

        filter.markProcessed(job, 11);
        assertThat(job.getLastMessageId()).isEqualTo(11);

        filter.markProcessed(job, null);
        assertThat(job.getLastMessageId()).isEqualTo(11);
    }
}
