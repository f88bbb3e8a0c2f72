package com.careerbuddy.bot.service.flow.input;

import com.careerbuddy.bot.exception.ValidationException;
import org.jetbrains.annotations.NotNull;

public class FreeTextGrammar {

    private final int minLength;
    private final int maxLength;
    private final String errorMessage;
    private final String example;

    public FreeTextGrammar(int minLength, int maxLength, String errorMessage, String example) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.errorMessage = errorMessage;
        this.example = example;
    }

    public FreeTextGrammar(String errorMessage, String example) {
        this(1, 2000, errorMessage, example);
    }

    @NotNull
    public String parse(String input) {
        String text = input == null ? "" : input.trim();
        if (text.length() < minLength || text.length() > maxLength) {
            throw new ValidationException(errorMessage, example);
        }
        return text;
    }
}
