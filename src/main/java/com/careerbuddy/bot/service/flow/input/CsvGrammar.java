package com.careerbuddy.bot.service.flow.input;

import com.careerbuddy.bot.exception.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-arity comma separated record. Extra commas are kept in the last field, so
 * "Lagos, Nigeria" survives as one location. Missing trailing fields come back as empty strings.
 */
public class CsvGrammar {

    private final int arity;
    private final int required;
    private final String errorMessage;
    private final String example;

    /**
     * @param arity    number of fields in the record
     * @param required number of leading fields that must be non-blank
     */
    public CsvGrammar(int arity, int required, String errorMessage, String example) {
        if (required > arity) {
            throw new IllegalArgumentException("required fields exceed arity");
        }
        this.arity = arity;
        this.required = required;
        this.errorMessage = errorMessage;
        this.example = example;
    }

    @NotNull
    public List<String> parse(String input) {
        if (input == null || input.isBlank() || (required > 1 && !input.contains(","))) {
            throw new ValidationException(errorMessage, example);
        }

        List<String> fields = new ArrayList<>(Arrays.stream(input.split(",", arity))
                .map(String::trim)
                .toList());
        while (fields.size() < arity) {
            fields.add("");
        }

        for (int i = 0; i < required; i++) {
            if (fields.get(i).isEmpty()) {
                throw new ValidationException(errorMessage, example);
            }
        }
        return fields;
    }
}
