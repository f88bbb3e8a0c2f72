package com.careerbuddy.bot.service.flow.input;

import com.careerbuddy.bot.exception.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Variable length comma separated list, bounded in size. Blank items and repeats are dropped.
 */
public class CommaListGrammar {

    private final int min;
    private final int max;
    private final String errorMessage;
    private final String example;

    public CommaListGrammar(int min, int max, String errorMessage, String example) {
        this.min = min;
        this.max = max;
        this.errorMessage = errorMessage;
        this.example = example;
    }

    @NotNull
    public List<String> parse(String input) {
        if (input == null || input.isBlank()) {
            throw new ValidationException(errorMessage, example);
        }
        List<String> items = List.copyOf(Arrays.stream(input.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(LinkedHashSet::new, LinkedHashSet::add, LinkedHashSet::addAll));

        if (items.size() < min || items.size() > max) {
            throw new ValidationException(errorMessage, example);
        }
        return items;
    }
}
