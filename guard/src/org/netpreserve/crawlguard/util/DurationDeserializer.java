package org.netpreserve.crawlguard.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads a duration given as milliseconds (number) or as a compact string like "500ms", "1.5s", "24h" or "7d".
 * ISO-8601 strings ("PT2S") are accepted too.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        try {
            return parse(jsonParser.getText());
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new JsonMappingException(jsonParser, "Invalid duration: " + jsonParser.getText(), e);
        }
    }

    public static Duration parse(String text) {
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (value.startsWith("P")) return Duration.parse(value);
        if (value.endsWith("MS")) {
            var millis = new BigDecimal(value.substring(0, value.length() - 2).trim());
            return Duration.ofNanos(millis.movePointRight(6).longValueExact());
        }
        if (value.endsWith("D")) return Duration.parse("P" + value);
        return Duration.parse("PT" + value);
    }
}
