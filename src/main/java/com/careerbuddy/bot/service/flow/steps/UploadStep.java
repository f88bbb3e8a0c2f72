package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.attachment.AttachmentReader;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

/**
 * First revamp step: the existing resume, either as a file or pasted into the chat.
 */
@Component
public class UploadStep implements StepHandler {

    private final AttachmentReader attachmentReader;

    @Autowired
    public UploadStep(AttachmentReader attachmentReader) {
        this.attachmentReader = attachmentReader;
    }

    @Override
    public Step step() {
        return Step.UPLOAD;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_UPLOAD);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        String text = ctx.hasAttachment()
                ? attachmentReader.readText(ctx.getAttachment())
                : (input == null ? "" : input.trim());

        if (text.length() < BotConstants.MIN_PASTED_RESUME_LENGTH) {
            throw new ValidationException(
                    String.format(ERR_UPLOAD_SHORT, BotConstants.MIN_PASTED_RESUME_LENGTH), EXAMPLE_UPLOAD);
        }
        ctx.getAnswers().setOriginalContent(text);
        ctx.getAnswers().setRevampedContent(null);
        return StepResult.advance();
    }
}
