package com.rnfa.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.rnfa.error.InvalidWordInputException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

public class WordListReader {
    private final JsonFactory factory = new JsonFactory();

    public MutableList<String> read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_ARRAY) {
                throw new InvalidWordInputException("Expected a JSON array of words but found " + token);
            }
            return readWords(parser);
        }
    }

    private MutableList<String> readWords(JsonParser parser) throws IOException {
        MutableList<String> words = Lists.mutable.empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Unexpected end of input inside the word list");
            }
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            if (token != JsonToken.VALUE_STRING) {
                throw new InvalidWordInputException("Word #" + (words.size() + 1)
                        + " is not text: " + describe(token));
            }
            words.add(parser.getText());
        }

        return words;
    }

    private static String describe(JsonToken token) {
        return switch (token) {
            case START_OBJECT -> "an object";
            case START_ARRAY -> "an array";
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> "a number";
            case VALUE_TRUE, VALUE_FALSE -> "a boolean";
            case VALUE_NULL -> "null";
            default -> token.toString();
        };
    }
}
