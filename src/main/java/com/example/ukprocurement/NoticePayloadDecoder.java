package com.example.ukprocurement;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Байты XML-уведомления в текст: строго UTF-8, а при ошибке декодирования
 * запасная кодировка из конфигурации (по умолчанию ISO-8859-1).
 */
@Slf4j
public class NoticePayloadDecoder {
    private final Charset fallback;

    public NoticePayloadDecoder() {
        this(Config.getFallbackCharset());
    }

    public NoticePayloadDecoder(Charset fallback) {
        this.fallback = fallback;
    }

    public String decode(byte[] payload) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Payload is not valid UTF-8, decoding as {}", fallback.name());
            return new String(payload, fallback);
        }
    }
}
