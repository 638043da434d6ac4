package com.makeitso.ledger.auth;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Reports every broken rule as its own violation. */
public class StrongPasswordValidator implements ConstraintValidator<StrongPassword, String> {

    static final int MIN_LENGTH = 12;

    static final Set<String> COMMON_PASSWORDS = Set.of(
            "password", "123456", "qwerty", "admin", "letmein", "welcome", "password123", "admin123");

    private static final Pattern LOWER   = Pattern.compile("[a-z]");
    private static final Pattern UPPER   = Pattern.compile("[A-Z]");
    private static final Pattern DIGIT   = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*()_+\\-=\\[\\]{};':\"\\\\|,.<>/?]");

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        if (password == null) {
            return true;
        }
        List<String> problems = violations(password);
        if (problems.isEmpty()) {
            return true;
        }
        context.disableDefaultConstraintViolation();
        for (String problem : problems) {
            context.buildConstraintViolationWithTemplate(problem).addConstraintViolation();
        }
        return false;
    }

    static List<String> violations(String password) {
        List<String> problems = new ArrayList<>();
        if (password.length() < MIN_LENGTH) {
            problems.add("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (!LOWER.matcher(password).find()) {
            problems.add("Password must contain lowercase letters");
        }
        if (!UPPER.matcher(password).find()) {
            problems.add("Password must contain uppercase letters");
        }
        if (!DIGIT.matcher(password).find()) {
            problems.add("Password must contain numbers");
        }
        if (!SPECIAL.matcher(password).find()) {
            problems.add("Password must contain special characters");
        }
        String lower = password.toLowerCase(Locale.ROOT);
        if (COMMON_PASSWORDS.stream().anyMatch(lower::contains)) {
            problems.add("Password contains common patterns");
        }
        return problems;
    }
}
