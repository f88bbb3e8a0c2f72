package com.careerbuddy.bot.keyboard;

import com.careerbuddy.bot.dto.Menu;
import com.careerbuddy.bot.model.DocumentTemplate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.ArrayList;
import java.util.List;

public class InlineKeyboardFactory {

    public static final String CALLBACK_RESUME = "choose_resume";

    public static final String CALLBACK_CV = "choose_cv";

    public static final String CALLBACK_COVER = "choose_cover";

    public static final String CALLBACK_REVAMP = "choose_revamp";

    @Nullable
    public static InlineKeyboardMarkup forMenu(@NotNull Menu menu) {
        return switch (menu) {
            case DOCUMENT_MENU -> createDocumentMenu();
            case TEMPLATE_MENU -> createTemplateMenu();
            case NONE -> null;
        };
    }

    @NotNull
    public static InlineKeyboardMarkup createDocumentMenu() {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();

        List<InlineKeyboardButton> row1 = new ArrayList<>();
        row1.add(button("📄 Resume", CALLBACK_RESUME));
        row1.add(button("📋 CV", CALLBACK_CV));
        rows.add(row1);

        List<InlineKeyboardButton> row2 = new ArrayList<>();
        row2.add(button("💼 Cover Letter", CALLBACK_COVER));
        row2.add(button("✨ Revamp", CALLBACK_REVAMP));
        rows.add(row2);

        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(rows);
        return markup;
    }

    @NotNull
    public static InlineKeyboardMarkup createTemplateMenu() {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (DocumentTemplate template : DocumentTemplate.values()) {
            List<InlineKeyboardButton> row = new ArrayList<>();
            row.add(button(template.getNumber() + ". " + template.getDisplayName(), template.getCallbackData()));
            rows.add(row);
        }

        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(rows);
        return markup;
    }

    @NotNull
    private static InlineKeyboardButton button(String text, String callbackData) {
        InlineKeyboardButton button = new InlineKeyboardButton();
        button.setText(text);
        button.setCallbackData(callbackData);
        return button;
    }
}
