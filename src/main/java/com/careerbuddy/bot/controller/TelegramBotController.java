package com.careerbuddy.bot.controller;

import com.careerbuddy.bot.config.TelegramBotConfig;
import com.careerbuddy.bot.dto.AttachmentRef;
import com.careerbuddy.bot.dto.InboundMessage;
import com.careerbuddy.bot.dto.Menu;
import com.careerbuddy.bot.dto.ResponseDirective;
import com.careerbuddy.bot.keyboard.InlineKeyboardFactory;
import com.careerbuddy.bot.keyboard.MainMenuKeyboard;
import com.careerbuddy.bot.service.InboundMessageHandler;
import com.careerbuddy.bot.service.NotificationSender;
import com.careerbuddy.bot.service.render.RenderedDocument;
import com.careerbuddy.bot.util.MessageUtils;
import jakarta.annotation.PreDestroy;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.io.ByteArrayInputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.careerbuddy.bot.constant.MessageTemplates.GENERIC_ERROR;

@Component
public class TelegramBotController extends TelegramLongPollingBot implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotController.class);

    private final InboundMessageHandler messageHandler;
    private final TelegramBotConfig botConfig;
    private final ExecutorService executorService;

    @Autowired
    public TelegramBotController(InboundMessageHandler messageHandler, TelegramBotConfig botConfig) {
        super(botConfig.getToken());
        this.messageHandler = messageHandler;
        this.botConfig = botConfig;

        this.executorService = Executors.newFixedThreadPool(10);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down update workers");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String getBotUsername() {
        return botConfig.getUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        executorService.execute(() -> {
            try {
                if (update.hasMessage() && (update.getMessage().hasText() || update.getMessage().hasDocument())) {
                    processMessage(update.getMessage());
                } else if (update.hasCallbackQuery()) {
                    processCallbackQuery(update.getCallbackQuery());
                }
            } catch (Exception e) {
                log.error("Failed to process update {}: {}", update.getUpdateId(), e.getMessage(), e);
                sendErrorMessage(update);
            }
        });
    }

    @Override
    public void notify(@NotNull Long telegramId, @NotNull String text) {
        sendText(telegramId, text, Menu.NONE);
    }

    private void processMessage(@NotNull Message message) {
        InboundMessage.InboundMessageBuilder inbound = InboundMessage.builder()
                .userId(message.getFrom().getId())
                .firstName(message.getFrom().getFirstName())
                .username(message.getFrom().getUserName())
                .messageId(message.getMessageId());

        if (message.hasDocument()) {
            Document document = message.getDocument();
            inbound.text(message.getCaption())
                    .attachment(AttachmentRef.builder()
                            .fileId(document.getFileId())
                            .fileName(document.getFileName())
                            .mimeType(document.getMimeType())
                            .fileSize(document.getFileSize())
                            .build());
        } else {
            inbound.text(message.getText());
        }

        ResponseDirective directive = messageHandler.handle(inbound.build());
        send(message.getChatId(), directive);
    }

    /**
     * Button presses share the text channel. The callback id, unique per press, stands in for the
     * message id so a redelivered press is recognized as a duplicate.
     */
    private void processCallbackQuery(@NotNull CallbackQuery callbackQuery) {
        answerCallbackQuery(callbackQuery.getId());

        InboundMessage inbound = InboundMessage.builder()
                .userId(callbackQuery.getFrom().getId())
                .firstName(callbackQuery.getFrom().getFirstName())
                .username(callbackQuery.getFrom().getUserName())
                .text(callbackQuery.getData())
                .messageId(callbackQuery.getId().hashCode())
                .build();

        ResponseDirective directive = messageHandler.handle(inbound);
        send(callbackQuery.getMessage().getChatId(), directive);
    }

    private void send(@NotNull Long chatId, @NotNull ResponseDirective directive) {
        switch (directive.getType()) {
            case TEXT -> sendText(chatId, directive.getText(), directive.getMenu());
            case DOCUMENT -> sendDocument(chatId, directive);
            case NONE -> log.debug("Nothing to send to {}", chatId);
        }
    }

    private void sendText(@NotNull Long chatId, String text, @NotNull Menu menu) {
        if (text == null || text.isBlank()) {
            return;
        }

        String[] messageParts = MessageUtils.splitLongMessage(text);
        for (int i = 0; i < messageParts.length; i++) {
            boolean last = i == messageParts.length - 1;
            SendMessage message = createMessage(chatId.toString(), messageParts[i], last ? keyboardFor(menu) : null);
            try {
                execute(message);
            } catch (TelegramApiException e) {
                log.error("Failed to send message to {}: {}", chatId, e.getMessage(), e);
                return;
            }
        }
    }

    private void sendDocument(@NotNull Long chatId, @NotNull ResponseDirective directive) {
        RenderedDocument document = directive.getDocument();

        SendDocument sendDocument = new SendDocument();
        sendDocument.setChatId(chatId.toString());
        sendDocument.setDocument(new InputFile(new ByteArrayInputStream(document.getContent()), document.getFileName()));
        sendDocument.setCaption(directive.getText());
        sendDocument.setParseMode("HTML");
        sendDocument.setReplyMarkup(MainMenuKeyboard.create());

        try {
            execute(sendDocument);
        } catch (TelegramApiException e) {
            log.error("Failed to send document {} to {}: {}", document.getFileName(), chatId, e.getMessage(), e);
            return;
        }

        if (directive.getJobId() != null) {
            messageHandler.markDelivered(directive.getJobId());
        }
    }

    @NotNull
    private SendMessage createMessage(String chatId, String text, ReplyKeyboard replyMarkup) {
        SendMessage message = new SendMessage();
        message.setChatId(chatId);
        message.setText(text);
        message.setParseMode("HTML");
        message.setDisableWebPagePreview(true);

        if (replyMarkup != null) {
            message.setReplyMarkup(replyMarkup);
        }

        return message;
    }

    @NotNull
    private ReplyKeyboard keyboardFor(@NotNull Menu menu) {
        InlineKeyboardMarkup inline = InlineKeyboardFactory.forMenu(menu);
        return inline != null ? inline : MainMenuKeyboard.create();
    }

    private void answerCallbackQuery(String callbackQueryId) {
        AnswerCallbackQuery answerCallback = new AnswerCallbackQuery();
        answerCallback.setCallbackQueryId(callbackQueryId);

        try {
            execute(answerCallback);
        } catch (TelegramApiException e) {
            log.error("Failed to answer callback query: {}", e.getMessage(), e);
        }
    }

    private void sendErrorMessage(@NotNull Update update) {
        Long chatId;

        if (update.hasMessage()) {
            chatId = update.getMessage().getChatId();
        } else if (update.hasCallbackQuery()) {
            chatId = update.getCallbackQuery().getMessage().getChatId();
        } else {
            return;
        }

        sendText(chatId, GENERIC_ERROR, Menu.NONE);
    }
}
