package com.gt.flashcards.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashcards.model.ReviewRating;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ReviewRatingSerializer extends JsonSerializer<ReviewRating> {
    @Override
    public void serialize(ReviewRating reviewRating, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(reviewRating.getQuality());
    }
}
