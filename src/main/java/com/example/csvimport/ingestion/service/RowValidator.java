package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.RejectionReason;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Field rules for one {@code name,email,age} row. Checks run in a fixed order (name, email, age) and
 * the first failing rule is reported. Email uniqueness needs the store and is not checked here.
 */
@Component
public class RowValidator {

    static final int MIN_NAME_LENGTH = 2;
    static final int MIN_AGE = 1;
    static final int MAX_AGE = 120;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?[0-9]+$");

    public ValidationResult validate(String rawName, String rawEmail, String rawAge) {
        String name = safeStrip(rawName);
        String email = safeStrip(rawEmail);
        String age = safeStrip(rawAge);

        if (name.codePointCount(0, name.length()) < MIN_NAME_LENGTH) {
            return new ValidationResult.Rejected(RejectionReason.NAME_TOO_SHORT);
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            return new ValidationResult.Rejected(RejectionReason.INVALID_EMAIL_FORMAT);
        }
        if (!INTEGER_PATTERN.matcher(age).matches()) {
            return new ValidationResult.Rejected(RejectionReason.AGE_NOT_INTEGER);
        }

        int parsedAge;
        try {
            parsedAge = Integer.parseInt(age);
        } catch (NumberFormatException ex) {
            // digits only, so this is an overflow
            return new ValidationResult.Rejected(RejectionReason.AGE_OUT_OF_RANGE);
        }
        if (parsedAge < MIN_AGE || parsedAge > MAX_AGE) {
            return new ValidationResult.Rejected(RejectionReason.AGE_OUT_OF_RANGE);
        }
        return new ValidationResult.Accepted(name, email, parsedAge);
    }

    /**
     * Strips leading and trailing whitespace including no-break spaces, which {@link String#strip()}
     * keeps.
     */
    private static String safeStrip(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && isBlankCodePoint(value.codePointAt(start))) {
            start += Character.charCount(value.codePointAt(start));
        }
        while (end > start && isBlankCodePoint(value.codePointBefore(end))) {
            end -= Character.charCount(value.codePointBefore(end));
        }
        return value.substring(start, end);
    }

    private static boolean isBlankCodePoint(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }
}
