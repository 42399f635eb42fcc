package com.numaansystems.headersso.model;

import java.util.Arrays;

/**
 * First and last name derived for a newly provisioned user.
 *
 * @param firstName first whitespace separated token
 * @param lastName  remaining tokens joined by single spaces, empty if none
 */
public record PersonName(String firstName, String lastName) {

    /**
     * Derives the name from the display name header, falling back to the
     * local part of the email when no display name was sent.
     *
     * <p>{@code "Grace Hopper"} gives Grace / Hopper;
     * {@code bob@example.com} without display name gives bob / "".</p>
     *
     * @param displayName display name, may be null or blank
     * @param email       the resolution email
     * @return the derived name, never null
     */
    public static PersonName derive(String displayName, String email) {
        String source = displayName;
        if (source == null || source.isBlank()) {
            source = localPart(email);
        }

        String[] tokens = source.trim().split("\\s+");
        String firstName = tokens[0];
        String lastName = String.join(" ", Arrays.copyOfRange(tokens, 1, tokens.length));
        return new PersonName(firstName, lastName);
    }

    private static String localPart(String email) {
        if (email == null) {
            return "";
        }
        int at = email.indexOf('@');
        return at >= 0 ? email.substring(0, at) : email;
    }
}
