package org.listingwatch.tracker.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient field extraction from scraper JSON. Every accessor returns null instead of failing
 * when a path is missing or a value cannot be interpreted.
 */
@Slf4j
final class JsonFields {

    private static final Pattern DOLLAR_AMOUNT =
            Pattern.compile("\\$\\s*(\\d[\\d,]*(?:\\.\\d+)?)\\s*(million|mil|m|k)?\\b");
    private static final Pattern PLAIN_AMOUNT = Pattern.compile("^\\d[\\d,]*(?:\\.\\d+)?$");
    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)");
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private JsonFields() {
    }

    static JsonNode at(JsonNode root, String... path) {
        JsonNode node = root == null ? MissingNode.getInstance() : root;
        for (String key : path) {
            node = node.path(key);
        }
        return node;
    }

    static String text(JsonNode root, String... path) {
        JsonNode node = at(root, path);
        if (!node.isValueNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * A string, or the elements of an array of strings joined by a space.
     */
    static String joinedText(JsonNode root, String... path) {
        JsonNode node = at(root, path);
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            node.forEach(part -> {
                if (part.isValueNode() && !part.asText().isBlank()) {
                    parts.add(part.asText().trim());
                }
            });
            return parts.isEmpty() ? null : String.join(" ", parts);
        }
        return text(root, path);
    }

    static Integer integer(JsonNode root, String... path) {
        JsonNode node = at(root, path);
        if (node.isNumber()) {
            return node.intValue();
        }
        BigDecimal parsed = firstNumber(text(root, path));
        return parsed != null ? parsed.intValue() : null;
    }

    static BigDecimal decimal(JsonNode root, String... path) {
        JsonNode node = at(root, path);
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return firstNumber(text(root, path));
    }

    static Double coordinate(JsonNode root, String... path) {
        JsonNode node = at(root, path);
        if (node.isNumber()) {
            return node.doubleValue();
        }
        String value = text(root, path);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric coordinate '{}'", value);
            return null;
        }
    }

    /**
     * A price from a number or a display string such as "$750,000", "$1.2m" or
     * "$700k - $750k" (lower bound). Negative or unreadable prices give null.
     */
    static BigDecimal price(JsonNode root, String... path) {
        JsonNode node = at(root, path);
        BigDecimal price = node.isNumber() ? node.decimalValue() : parsePrice(text(root, path));
        if (price != null && price.signum() < 0) {
            log.debug("Ignoring negative price {}", price);
            return null;
        }
        return price;
    }

    static BigDecimal parsePrice(String display) {
        if (display == null) {
            return null;
        }
        String value = display.toLowerCase(Locale.ROOT).trim();
        if (PLAIN_AMOUNT.matcher(value).matches()) {
            return new BigDecimal(value.replace(",", ""));
        }
        Matcher m = DOLLAR_AMOUNT.matcher(value);
        if (!m.find()) {
            log.debug("No price in display text '{}'", display);
            return null;
        }
        BigDecimal amount = new BigDecimal(m.group(1).replace(",", ""));
        String suffix = m.group(2);
        if (suffix == null) {
            return amount;
        }
        BigDecimal scaled = amount.multiply("k".equals(suffix) ? THOUSAND : MILLION).stripTrailingZeros();
        return scaled.scale() < 0 ? scaled.setScale(0) : scaled;
    }

    /**
     * An ISO-8601 offset date-time, a local date-time interpreted in {@code zone}, or epoch millis.
     */
    static OffsetDateTime dateTime(JsonNode root, ZoneId zone, String... path) {
        JsonNode node = at(root, path);
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue()).atZone(zone).toOffsetDateTime();
        }
        String value = text(root, path);
        if (value == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime
                    ? (OffsetDateTime) parsed
                    : ((LocalDateTime) parsed).atZone(zone).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date-time '{}', ignoring", value);
            return null;
        }
    }

    private static BigDecimal firstNumber(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = FIRST_NUMBER.matcher(value);
        return m.find() ? new BigDecimal(m.group(1).replace(",", "")) : null;
    }
}
