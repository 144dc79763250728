package com.jobd.util;

import java.util.concurrent.ThreadLocalRandom;

public final class Ids {
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private Ids() {}

    /** {@code <prefix>_<epochMillis>_<9 random chars>}, e.g. {@code job_1718000000000_k3j9x0a2b}. */
    public static String generate(String prefix) {
        StringBuilder sb = new StringBuilder(prefix).append('_').append(System.currentTimeMillis()).append('_');
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        for (int i = 0; i < 9; i++) sb.append(ALPHABET.charAt(rnd.nextInt(ALPHABET.length())));
        return sb.toString();
    }
}
