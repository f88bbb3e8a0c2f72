package com.careerbuddy.bot.service.flow.input;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.exception.ValidationException;

public class YesNoGrammar {

    public boolean parse(String input) {
        String normalized = input == null ? "" : input.trim().toLowerCase();
        if (BotConstants.YES_WORDS.contains(normalized)) {
            return true;
        }
        if (BotConstants.NO_WORDS.contains(normalized)) {
            return false;
        }
        throw new ValidationException(MessageTemplates.ERR_YES_NO, "yes");
    }

    public boolean isYes(String input) {
        return input != null && BotConstants.YES_WORDS.contains(input.trim().toLowerCase());
    }
}
