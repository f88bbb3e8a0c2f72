package com.careerbuddy.bot.service.attachment;

import com.careerbuddy.bot.config.TelegramBotConfig;
import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.dto.AttachmentRef;
import com.careerbuddy.bot.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import static com.careerbuddy.bot.constant.MessageTemplates.ERR_UPLOAD_TOO_LARGE;
import static com.careerbuddy.bot.constant.MessageTemplates.ERR_UPLOAD_UNREADABLE;

/**
 * Downloads an uploaded file through the Bot API file endpoint and hands the bytes to the
 * {@link DocumentTextExtractor}.
 */
@Component
public class TelegramAttachmentReader implements AttachmentReader {

    private static final Logger log = LoggerFactory.getLogger(TelegramAttachmentReader.class);

    private final RestTemplate restTemplate;
    private final TelegramBotConfig botConfig;
    private final DocumentTextExtractor textExtractor;

    @Value("${telegram.api.url:https://api.telegram.org}")
    private String apiUrl;

    @Autowired
    public TelegramAttachmentReader(RestTemplate restTemplate,
                                    TelegramBotConfig botConfig,
                                    DocumentTextExtractor textExtractor) {
        this.restTemplate = restTemplate;
        this.botConfig = botConfig;
        this.textExtractor = textExtractor;
    }

    @Override
    public String readText(@NotNull AttachmentRef attachment) {
        if (attachment.getFileSize() != null && attachment.getFileSize() > BotConstants.MAX_ATTACHMENT_BYTES) {
            throw new ValidationException(ERR_UPLOAD_TOO_LARGE);
        }

        byte[] content = download(attachment);
        if (content != null && content.length > BotConstants.MAX_ATTACHMENT_BYTES) {
            throw new ValidationException(ERR_UPLOAD_TOO_LARGE);
        }
        return textExtractor.extractText(attachment.getFileName(), attachment.getMimeType(), content);
    }

    private byte[] download(AttachmentRef attachment) {
        try {
            JsonNode response = restTemplate.getForObject(
                    apiUrl + "/bot{token}/getFile?file_id={fileId}",
                    JsonNode.class, botConfig.getToken(), attachment.getFileId());

            String filePath = response == null ? null : response.path("result").path("file_path").asText(null);
            if (filePath == null || !response.path("ok").asBoolean(false)) {
                log.warn("Telegram returned no file path for {}", attachment.getFileName());
                throw new ValidationException(ERR_UPLOAD_UNREADABLE);
            }

            return restTemplate.getForObject(apiUrl + "/file/bot" + botConfig.getToken() + "/" + filePath, byte[].class);
        } catch (RestClientException e) {
            log.error("Download of {} failed: {}", attachment.getFileName(), e.getMessage());
            throw new ValidationException(ERR_UPLOAD_UNREADABLE);
        }
    }
}
