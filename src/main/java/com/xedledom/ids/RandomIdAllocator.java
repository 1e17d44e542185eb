package com.xedledom.ids;

import java.util.Collection;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * Draws random tokens and rejects any already used, for registries that outlive a run.
 * Seed it with the ids already present so they are never handed out again.
 */
public final class RandomIdAllocator implements IdAllocator {

    private static final String DIGITS = "0123456789";
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final String prefix;
    private final int length;
    private final String alphabet;
    private final Random random;
    private final Set<String> used = new HashSet<>();

    private RandomIdAllocator(String prefix, int length, String alphabet, Random random, Collection<String> existing) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be >= 1");
        }
        this.prefix = prefix == null ? "" : prefix;
        this.length = length;
        this.alphabet = alphabet;
        this.random = random == null ? new Random() : random;
        if (existing != null) {
            used.addAll(existing);
        }
    }

    /** {@code A} followed by {@code length} digits, e.g. {@code A4821}. */
    public static RandomIdAllocator numeric(String prefix, int length, Random random, Collection<String> existing) {
        return new RandomIdAllocator(prefix, length, DIGITS, random, existing);
    }

    /** Uppercase letters and digits with no prefix, e.g. {@code Q7ZK}. */
    public static RandomIdAllocator alphanumeric(int length, Random random, Collection<String> existing) {
        return new RandomIdAllocator("", length, ALPHANUMERIC, random, existing);
    }

    @Override
    public synchronized String next() {
        if (countInSpace() >= capacity()) {
            throw new IllegalStateException("Id space exhausted for length " + length);
        }
        while (true) {
            StringBuilder sb = new StringBuilder(prefix);
            for (int i = 0; i < length; i++) {
                sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            String candidate = sb.toString();
            if (used.add(candidate)) {
                return candidate;
            }
        }
    }

    public synchronized boolean isUsed(String id) {
        return used.contains(id);
    }

    private long countInSpace() {
        return used.stream()
                .filter(id -> id.length() == prefix.length() + length && id.startsWith(prefix))
                .filter(id -> id.substring(prefix.length()).chars().allMatch(c -> alphabet.indexOf(c) >= 0))
                .count();
    }

    private long capacity() {
        double space = Math.pow(alphabet.length(), length);
        return space > Long.MAX_VALUE ? Long.MAX_VALUE : (long) space;
    }
}
