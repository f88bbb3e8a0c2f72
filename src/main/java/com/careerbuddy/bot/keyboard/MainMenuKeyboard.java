package com.careerbuddy.bot.keyboard;

import org.jetbrains.annotations.NotNull;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;

import java.util.ArrayList;
import java.util.List;

public class MainMenuKeyboard {

    public static final String BUTTON_NEW_DOCUMENT = "📄 New Document";

    public static final String BUTTON_STATUS = "📊 Status";

    public static final String BUTTON_HELP = "❓ Help";

    public static final String BUTTON_RESET = "🔄 Reset";

    @NotNull
    public static ReplyKeyboardMarkup create() {
        KeyboardRow row1 = new KeyboardRow();
        row1.add(new KeyboardButton(BUTTON_NEW_DOCUMENT));
        row1.add(new KeyboardButton(BUTTON_STATUS));

        KeyboardRow row2 = new KeyboardRow();
        row2.add(new KeyboardButton(BUTTON_HELP));
        row2.add(new KeyboardButton(BUTTON_RESET));

        List<KeyboardRow> keyboard = new ArrayList<>();
        keyboard.add(row1);
        keyboard.add(row2);

        ReplyKeyboardMarkup replyKeyboardMarkup = new ReplyKeyboardMarkup();
        replyKeyboardMarkup.setKeyboard(keyboard);
        replyKeyboardMarkup.setResizeKeyboard(true);
        replyKeyboardMarkup.setOneTimeKeyboard(false);
        replyKeyboardMarkup.setSelective(false);

        return replyKeyboardMarkup;
    }
}
