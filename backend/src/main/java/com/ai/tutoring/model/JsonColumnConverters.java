package com.ai.tutoring.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.Map;

/**
 * JPA converters that store structured quiz data as JSON text columns.
 */
public final class JsonColumnConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonColumnConverters() {
    }

    abstract static class JsonConverter<T> implements AttributeConverter<T, String> {

        private final TypeReference<T> type;

        JsonConverter(TypeReference<T> type) {
            this.type = type;
        }

        @Override
        public String convertToDatabaseColumn(T attribute) {
            if (attribute == null)
                return null;
            try {
                return MAPPER.writeValueAsString(attribute);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialize column value", e);
            }
        }

        @Override
        public T convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isBlank())
                return null;
            try {
                return MAPPER.readValue(dbData, type);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot deserialize column value", e);
            }
        }
    }

    @Converter
    public static class QuestionListConverter extends JsonConverter<List<QuizQuestion>> {
        public QuestionListConverter() {
            super(new TypeReference<List<QuizQuestion>>() {
            });
        }
    }

    @Converter
    public static class StringListConverter extends JsonConverter<List<String>> {
        public StringListConverter() {
            super(new TypeReference<List<String>>() {
            });
        }
    }

    @Converter
    public static class AnswerMapConverter extends JsonConverter<Map<Integer, String>> {
        public AnswerMapConverter() {
            super(new TypeReference<Map<Integer, String>>() {
            });
        }
    }

    @Converter
    public static class ResultListConverter extends JsonConverter<List<QuestionResult>> {
        public ResultListConverter() {
            super(new TypeReference<List<QuestionResult>>() {
            });
        }
    }
}
