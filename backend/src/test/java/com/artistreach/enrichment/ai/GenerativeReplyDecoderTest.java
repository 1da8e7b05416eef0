package com.artistreach.enrichment.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerativeReplyDecoderTest {
    private final GenerativeReplyDecoder decoder = new GenerativeReplyDecoder(new ObjectMapper());

    @Test
    void decodesBareObject() {
        GenerativeReply reply = decoder.decode(
            "{\"email\": \"booking@nightjarband.com\", \"source\": \"footer\"}",
            GenerativeReply.class
        );

        assertThat(reply.email()).isEqualTo("booking@nightjarband.com");
        assertThat(reply.hasEmail()).isTrue();
    }

    @Test
    void unwrapsSingleFencedBlock() {
        GenerativeReply reply = decoder.decode(
            "```json\n{\"email\": null, \"source\": null, \"booking_agent\": \"Wasted Youth Agency\"}\n```",
            GenerativeReply.class
        );

        assertThat(reply.hasEmail()).isFalse();
        assertThat(reply.bookingAgent()).isEqualTo("Wasted Youth Agency");
    }

    @Test
    void rejectsProseAroundTheObject() {
        assertThatThrownBy(() -> decoder.decode(
            "Sure! Here is the result: {\"email\": \"booking@nightjarband.com\"}",
            GenerativeReply.class
        )).isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void rejectsUnknownFields() {
        assertThatThrownBy(() -> decoder.decode(
            "{\"email\": \"booking@nightjarband.com\", \"phone\": \"555\"}",
            GenerativeReply.class
        )).isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void rejectsTwoObjects() {
        assertThatThrownBy(() -> decoder.decode("{\"email\": null} {\"email\": null}", GenerativeReply.class))
            .isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void rejectsEmptyReply() {
        assertThatThrownBy(() -> decoder.decode("  ", GenerativeReply.class))
            .isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void decodesChannelVerdict() {
        ChannelVerdict verdict = decoder.decode(
            "{\"channelId\": \"UC123\", \"confidence\": 0.8, \"reasoning\": \"music uploads\"}",
            ChannelVerdict.class
        );

        assertThat(verdict.names("UC123")).isTrue();
        assertThat(verdict.confidence()).isEqualTo(0.8);
    }
}
