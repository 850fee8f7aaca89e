package com.delta.mailverify.verify.bounce;

import com.delta.mailverify.config.VerifierProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses provider bounce notifications, optionally wrapped in an SNS envelope whose
 * {@code Message} field holds the event as a string.
 */
@Component
public class BounceNotificationParser {
    private static final Logger log = LoggerFactory.getLogger(BounceNotificationParser.class);
    private static final Pattern SUBJECT_TOKEN = Pattern.compile("\\(token=([^)]+)\\)");

    private final ObjectMapper objectMapper;
    private final VerifierProperties properties;

    public BounceNotificationParser(ObjectMapper objectMapper, VerifierProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return the bounce, or empty when the body is not JSON or not a {@code Bounce} notification
     */
    public Optional<BounceNotification> parse(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode event;
        try {
            JsonNode outer = objectMapper.readTree(body);
            JsonNode message = outer.get("Message");
            event = message != null && message.isTextual() ? objectMapper.readTree(message.asText()) : outer;
        } catch (JsonProcessingException e) {
            log.warn("Skipping bounce message that is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (event == null || !"Bounce".equals(event.path("notificationType").asText(null))) {
            return Optional.empty();
        }

        JsonNode mail = event.path("mail");
        JsonNode bounce = event.path("bounce");
        JsonNode recipient = bounce.path("bouncedRecipients").path(0);
        String recipientEmail = text(recipient, "emailAddress");
        String prefix = properties.getTestSend().getBouncePrefix();

        String token = tokenFromTags(mail);
        if (token == null) {
            token = tokenFromMailFields(mail, prefix);
        }
        if (token == null) {
            token = tokenFromSubject(mail);
        }
        if (token == null) {
            token = tokenFromBody(body, prefix);
        }
        if (token == null) {
            log.warn(
                "Bounce without token: recipient={} returnPath={} subject={}",
                recipientEmail,
                text(mail.path("commonHeaders"), "returnPath"),
                text(mail.path("commonHeaders"), "subject")
            );
        }

        boolean hard = "permanent".equalsIgnoreCase(text(bounce, "bounceType"));
        String reason = text(recipient, "diagnosticCode");
        if (reason == null) {
            reason = text(bounce, "bounceSubType");
        }
        return Optional.of(new BounceNotification(recipientEmail, token, hard, text(recipient, "status"), reason));
    }

    String tokenFromTags(JsonNode mail) {
        JsonNode values = mail.path("tags").path(properties.getTestSend().getTokenTag());
        if (values.isArray() && values.size() > 0) {
            return blankToNull(values.get(0).asText());
        }
        if (values.isTextual()) {
            return blankToNull(values.asText());
        }
        return null;
    }

    static String tokenFromMailFields(JsonNode mail, String prefix) {
        JsonNode headers = mail.path("commonHeaders");
        for (String field : new String[] {"returnPath", "source"}) {
            String value = text(headers, field);
            if (value == null) {
                value = text(mail, field);
            }
            String token = tokenFromReturnPath(value, prefix);
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    static String tokenFromReturnPath(String returnPath, String prefix) {
        if (returnPath == null) {
            return null;
        }
        String address = returnPath.trim();
        int open = address.indexOf('<');
        int close = address.indexOf('>');
        if (open >= 0 && close > open) {
            address = address.substring(open + 1, close);
        }
        int at = address.indexOf('@');
        String localPart = at < 0 ? address : address.substring(0, at);
        int plus = localPart.indexOf('+');
        if (plus < 0 || !localPart.substring(0, plus).equals(prefix)) {
            return null;
        }
        return blankToNull(localPart.substring(plus + 1));
    }

    static String tokenFromSubject(JsonNode mail) {
        String subject = text(mail.path("commonHeaders"), "subject");
        if (subject == null) {
            return null;
        }
        Matcher matcher = SUBJECT_TOKEN.matcher(subject);
        return matcher.find() ? blankToNull(matcher.group(1)) : null;
    }

    static String tokenFromBody(String body, String prefix) {
        Matcher matcher = Pattern.compile(Pattern.quote(prefix) + "\\+([A-Za-z0-9_-]+)@").matcher(body);
        return matcher.find() ? blankToNull(matcher.group(1)) : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return blankToNull(value.asText());
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
