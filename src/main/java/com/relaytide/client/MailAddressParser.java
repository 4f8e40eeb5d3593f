package com.relaytide.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses RFC 5322-ish address headers as they show up in practice:
 *   "Jane Doe" <jane@example.com>
 *   Jane Doe <jane@example.com>
 *   jane@example.com
 */
public final class MailAddressParser {

    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");
    private static final Pattern DISPLAY_NAME = Pattern.compile("^\"?([^\"<]+)\"?\\s*<");

    private MailAddressParser() {
    }

    public static Optional<ContactAddress> parse(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String value = header.trim();

        Matcher angle = ANGLE_ADDRESS.matcher(value);
        String email = angle.find() ? angle.group(1) : value;
        email = email.trim().toLowerCase(Locale.ROOT);
        if (email.isEmpty() || !email.contains("@")) {
            return Optional.empty();
        }

        Matcher name = DISPLAY_NAME.matcher(value);
        String displayName = name.find() ? name.group(1).trim() : null;
        if (displayName != null && displayName.isEmpty()) {
            displayName = null;
        }
        return Optional.of(new ContactAddress(email, displayName));
    }

    /**
     * Splits a To/Cc header on commas that are not inside a quoted display name.
     */
    public static List<ContactAddress> parseList(String header) {
        List<ContactAddress> result = new ArrayList<>();
        if (header == null || header.isBlank()) {
            return result;
        }
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                parse(header.substring(start, i)).ifPresent(result::add);
                start = i + 1;
            }
        }
        parse(header.substring(start)).ifPresent(result::add);
        return result;
    }
}
