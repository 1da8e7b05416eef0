package com.artistreach.enrichment.ai;

public interface GenerativeExtractionCapability {
    boolean isAvailable(GenerativeTier tier);

    /**
     * Sends {@code prompt} followed by {@code literalContent} and decodes the reply as a
     * {@link GenerativeReply}.
     *
     * @throws ExtractionParseException when the reply is not exactly one JSON object of that schema
     */
    GenerativeReply extract(GenerativeTier tier, String prompt, String literalContent);

    <T> T complete(GenerativeTier tier, String prompt, Class<T> replyType);
}
