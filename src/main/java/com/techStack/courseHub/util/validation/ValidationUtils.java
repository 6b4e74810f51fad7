package com.techStack.courseHub.util.validation;

import com.techStack.courseHub.exception.validation.InvalidInputException;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Request-boundary validation. Every failure is an {@link InvalidInputException}.
 */
public final class ValidationUtils {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private static final Pattern RESERVED_ID_PATTERN = Pattern.compile("^__.*__$");

    private ValidationUtils() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Returns the trimmed value, or fails with the given message when blank
     */
    public static String requireParameter(String value, String field, String message) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidInputException(field, message);
        }
        return value.trim();
    }

    /**
     * Parses a numeric query parameter; ids such as programId are stored as numbers
     */
    public static long parseNumericParameter(String value, String field) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(field, field + " must be a whole number");
        }
    }

    /**
     * A single Firestore document id: non-blank, free of '/', not a relative
     * segment ("." or "..") and not a reserved {@code __name__} id.
     */
    public static String requirePathSegment(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidInputException(field, field + " must not be blank");
        }
        if (value.contains("/")) {
            throw new InvalidInputException(field, field + " must not contain '/'");
        }
        if (".".equals(value) || "..".equals(value)) {
            throw new InvalidInputException(field, field + " must not be '.' or '..'");
        }
        if (RESERVED_ID_PATTERN.matcher(value).matches()) {
            throw new InvalidInputException(field, field + " must not be a reserved id");
        }
        return value;
    }

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email.trim()).matches();
    }

    /**
     * Keeps only the entries whose key is allowed; everything else is dropped silently
     */
    public static Map<String, Object> filterForAllowedKeys(Map<String, ?> updates, Collection<String> allowedKeys) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (updates == null) {
            return filtered;
        }
        updates.forEach((key, value) -> {
            if (allowedKeys.contains(key)) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }
}
