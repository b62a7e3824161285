package com.gt.flashcards.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;

// Accepts only whole-number ratings; 4.7 or "4" is rejected rather than coerced.
public class ReviewQualityDeserializer extends JsonDeserializer<Integer> {
    @Override
    public Integer deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        if (jsonParser.currentToken() != JsonToken.VALUE_NUMBER_INT) {
            return deserializationContext.reportInputMismatch(Integer.class,
                    "Quality rating must be a whole number, got %s", jsonParser.getText());
        }

        return jsonParser.getIntValue();
    }
}
