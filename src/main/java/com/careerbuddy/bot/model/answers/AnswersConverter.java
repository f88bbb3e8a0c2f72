package com.careerbuddy.bot.model.answers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link Answers} as a JSON document in a single text column.
 */
@Converter
public class AnswersConverter implements AttributeConverter<Answers, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(Answers answers) {
        if (answers == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(answers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize answers", e);
        }
    }

    @Override
    public Answers convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new Answers();
        }
        try {
            return MAPPER.readValue(dbData, Answers.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read stored answers", e);
        }
    }

    /** Deep copy, used to freeze answers for history and background generation. */
    public static Answers copyOf(Answers answers) {
        return MAPPER.convertValue(answers, Answers.class);
    }
}
