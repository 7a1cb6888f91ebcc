package com.hronboard.backend.modules.checklist.application;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

/**
 * Random, URL-safe slugs for shared checklists. Letters and digits only, so every generated
 * value passes the slug check applied on lookup.
 */
@Component
public class ShareSlugGenerator {

    static final int SLUG_LENGTH = 10;
    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public String next() {
        char[] slug = new char[SLUG_LENGTH];
        for (int i = 0; i < SLUG_LENGTH; i++) {
            slug[i] = ALPHABET[SECURE_RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(slug);
    }
}
