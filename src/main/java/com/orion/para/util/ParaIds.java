package com.orion.para.util;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Entity id generation: {@code <prefix>_<12 lowercase alphanumerics>}, e.g. {@code proj_a1b2c3d4e5f6}.
 */
public final class ParaIds {
    public static final String PROJECT = "proj";
    public static final String AREA = "area";
    public static final String CONTACT = "cont";
    public static final String INBOX = "inbox";
    public static final String RESOURCE = "res";
    public static final String TEMPLATE = "tmpl";

    static final int ID_LENGTH = 12;
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final SecureRandom RANDOM = new SecureRandom();

    private ParaIds() {
    }

    public static String projectId() {
        return generate(PROJECT);
    }

    public static String areaId() {
        return generate(AREA);
    }

    public static String contactId() {
        return generate(CONTACT);
    }

    public static String inboxId() {
        return generate(INBOX);
    }

    public static String resourceId() {
        return generate(RESOURCE);
    }

    public static String templateId() {
        return generate(TEMPLATE);
    }

    public static String generate(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length() + 1 + ID_LENGTH);
        sb.append(prefix).append('_');
        for (int i = 0; i < ID_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static boolean hasPrefix(String id, String prefix) {
        return id != null && id.matches(Pattern.quote(prefix) + "_[0-9a-z]{" + ID_LENGTH + "}");
    }
}
