package com.artistreach.enrichment.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict decoder for model replies: the whole reply is one JSON object of the expected type. A reply
 * that is exactly one fenced code block is unwrapped first; prose around the object is rejected.
 */
public class GenerativeReplyDecoder {
    private static final Pattern FENCED = Pattern.compile("^```(?:json|JSON)?\\s*\\n(.*?)\\n?```$", Pattern.DOTALL);

    private final ObjectMapper mapper;

    public GenerativeReplyDecoder(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public <T> T decode(String reply, Class<T> type) {
        if (reply == null || reply.isBlank()) {
            throw new ExtractionParseException("Empty generative reply");
        }
        String body = reply.trim();
        Matcher fenced = FENCED.matcher(body);
        if (fenced.matches()) {
            body = fenced.group(1).trim();
        }
        if (!body.startsWith("{") || !body.endsWith("}")) {
            throw new ExtractionParseException("Generative reply is not a single JSON object");
        }
        try {
            T value = mapper.readValue(body, type);
            if (value == null) {
                throw new ExtractionParseException("Generative reply decoded to null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ExtractionParseException("Generative reply does not match " + type.getSimpleName(), e);
        }
    }
}
