package com.example.ukprocurement;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class NoticePayloadDecoderTest {
    private final NoticePayloadDecoder decoder = new NoticePayloadDecoder();

    @Test
    void decode_readsValidUtf8() {
        byte[] payload = "<TOWN>Ynys Môn</TOWN>".getBytes(StandardCharsets.UTF_8);

        assertThat(decoder.decode(payload)).isEqualTo("<TOWN>Ynys Môn</TOWN>");
    }

    @Test
    void decode_fallsBackToLatin1() {
        byte[] payload = "<OFFICIALNAME>Café £</OFFICIALNAME>".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(decoder.decode(payload)).isEqualTo("<OFFICIALNAME>Café £</OFFICIALNAME>");
    }

    @Test
    void decode_usesGivenFallbackCharset() {
        byte[] payload = {(byte) 0x80};

        assertThat(new NoticePayloadDecoder(java.nio.charset.Charset.forName("windows-1252")).decode(payload))
                .isEqualTo("€");
    }
}
