package com.example.importservice.client.auth;

import com.example.importservice.exception.InvalidCredentialFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a cookie string pasted from browser dev tools into a single valid Cookie header.
 *
 * Line breaks and control characters are removed, Set-Cookie attributes
 * (Path, Domain, Secure, ...) and bare tokens are dropped, and the remaining
 * name=value pairs are joined with "; ". Applying it twice yields the same result.
 */
public final class CookieSanitizer {

    private static final Set<String> COOKIE_ATTRIBUTES = Set.of(
            "path", "domain", "expires", "max-age", "secure", "httponly",
            "samesite", "priority", "partitioned", "version", "comment");

    private CookieSanitizer() {
    }

    /**
     * @throws InvalidCredentialFormatException if no name=value pair survives
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            throw new InvalidCredentialFormatException("Cookie string is empty");
        }

        List<String> pairs = new ArrayList<>();
        for (String segment : raw.split("[;\\r\\n]+")) {
            String pair = stripControlCharacters(segment).trim();
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue; // empty or bare attribute such as "Secure"
            }
            String name = pair.substring(0, eq).trim();
            if (name.isEmpty() || COOKIE_ATTRIBUTES.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            pairs.add(name + "=" + pair.substring(eq + 1).trim());
        }

        if (pairs.isEmpty()) {
            throw new InvalidCredentialFormatException(
                    "Cookie string contains no name=value pairs after sanitization");
        }
        return String.join("; ", pairs);
    }

    private static String stripControlCharacters(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
