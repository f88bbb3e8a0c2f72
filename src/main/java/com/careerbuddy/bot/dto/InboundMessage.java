package com.careerbuddy.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message from the chat gateway. Commands and free text share {@link #text}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    private Long userId;

    private String firstName;

    private String username;

    private String text;

    private Integer messageId;

    private AttachmentRef attachment;
}
