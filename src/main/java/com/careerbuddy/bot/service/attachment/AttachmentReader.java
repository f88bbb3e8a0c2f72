package com.careerbuddy.bot.service.attachment;

import com.careerbuddy.bot.dto.AttachmentRef;
import com.careerbuddy.bot.exception.ValidationException;

/**
 * Turns an uploaded file into plain text.
 */
public interface AttachmentReader {

    /**
     * @throws ValidationException when the file is too large, of an unsupported type, unreadable or empty
     */
    String readText(AttachmentRef attachment);
}
