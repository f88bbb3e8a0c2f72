package com.careerbuddy.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a file the user sent. The content is only fetched by the step that needs it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentRef {

    private String fileId;

    private String fileName;

    private String mimeType;

    private Long fileSize;
}
