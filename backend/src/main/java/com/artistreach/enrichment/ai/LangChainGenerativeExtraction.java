package com.artistreach.enrichment.ai;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Generative capability backed by one langchain4j {@link ChatModel} per tier. Tiers without a model
 * report unavailable.
 */
public class LangChainGenerativeExtraction implements GenerativeExtractionCapability {
    private static final Logger log = LoggerFactory.getLogger(LangChainGenerativeExtraction.class);

    static final String SYSTEM_PROMPT =
        "You extract contact details for music artists. Reply with one JSON object and nothing else.";

    private final Map<GenerativeTier, ChatModel> models;
    private final GenerativeReplyDecoder decoder;

    public LangChainGenerativeExtraction(Map<GenerativeTier, ChatModel> models, GenerativeReplyDecoder decoder) {
        this.models = models == null || models.isEmpty() ? new EnumMap<>(GenerativeTier.class) : new EnumMap<>(models);
        this.decoder = decoder;
    }

    @Override
    public boolean isAvailable(GenerativeTier tier) {
        return models.containsKey(tier);
    }

    @Override
    public GenerativeReply extract(GenerativeTier tier, String prompt, String literalContent) {
        String message = literalContent == null || literalContent.isEmpty()
            ? prompt
            : prompt + "\n\nCONTENT:\n" + literalContent;
        return decoder.decode(chat(tier, message), GenerativeReply.class);
    }

    @Override
    public <T> T complete(GenerativeTier tier, String prompt, Class<T> replyType) {
        return decoder.decode(chat(tier, prompt), replyType);
    }

    private String chat(GenerativeTier tier, String userText) {
        ChatModel model = models.get(tier);
        if (model == null) {
            throw new IllegalStateException("Generative tier " + tier + " is not configured");
        }
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(SYSTEM_PROMPT));
        messages.add(UserMessage.from(userText));
        ChatResponse response = model.chat(ChatRequest.builder().messages(messages).build());
        if (response == null || response.aiMessage() == null) {
            throw new ExtractionParseException("No reply from " + tier + " tier");
        }
        String text = response.aiMessage().text();
        log.debug("{} tier replied with {} chars", tier, text == null ? 0 : text.length());
        return text;
    }
}
