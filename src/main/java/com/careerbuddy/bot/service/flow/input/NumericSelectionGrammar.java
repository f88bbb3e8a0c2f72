package com.careerbuddy.bot.service.flow.input;

import com.careerbuddy.bot.exception.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks items out of a numbered list, e.g. "1, 3,5". Numbers are 1-based; repeats count once.
 */
public class NumericSelectionGrammar {

    private static final Pattern SELECTION = Pattern.compile("\\s*\\d+(\\s*,\\s*\\d+)*\\s*,?\\s*");

    private final int min;
    private final int max;
    private final String errorMessage;
    private final String example;

    public NumericSelectionGrammar(int min, int max, String errorMessage, String example) {
        this.min = min;
        this.max = max;
        this.errorMessage = errorMessage;
        this.example = example;
    }

    /** True when the input is shaped like a numeric selection at all. */
    public boolean matches(String input) {
        return input != null && SELECTION.matcher(input).matches();
    }

    @NotNull
    public <T> List<T> parse(String input, List<T> options) {
        if (!matches(input)) {
            throw new ValidationException(errorMessage, example);
        }

        Set<Integer> picked = new LinkedHashSet<>();
        for (String token : input.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int number;
            try {
                number = Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                throw new ValidationException(errorMessage, example);
            }
            if (number < 1 || number > options.size()) {
                throw new ValidationException(errorMessage, example);
            }
            picked.add(number);
        }

        if (picked.size() < min || picked.size() > max) {
            throw new ValidationException(errorMessage, example);
        }

        List<T> selected = new ArrayList<>();
        for (int number : picked) {
            selected.add(options.get(number - 1));
        }
        return selected;
    }
}
