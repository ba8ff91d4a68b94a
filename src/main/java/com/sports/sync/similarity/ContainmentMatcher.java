package com.sports.sync.similarity;

/**
 * Last-resort name test: true when a normalized token of one string (of at least
 * {@code minimumTokenLength} characters) occurs inside the normalized form of the other.
 * Catches short forms such as "Vini" against "Vinicius Junior".
 */
public class ContainmentMatcher {

    public static final int DEFAULT_MINIMUM_TOKEN_LENGTH = 2;

    private final int minimumTokenLength;

    public ContainmentMatcher() {
        this(DEFAULT_MINIMUM_TOKEN_LENGTH);
    }

    public ContainmentMatcher(int minimumTokenLength) {
        if (minimumTokenLength < 1) {
            throw new IllegalArgumentException("minimumTokenLength must be at least 1");
        }
        this.minimumTokenLength = minimumTokenLength;
    }

    public boolean matches(String a, String b) {
        return containsTokenOf(a, b) || containsTokenOf(b, a);
    }

    public int getMinimumTokenLength() {
        return minimumTokenLength;
    }

    private boolean containsTokenOf(String source, String target) {
        String normalizedTarget = TextNormalizer.normalize(target);
        if (normalizedTarget.isEmpty()) {
            return false;
        }
        for (String token : TextNormalizer.tokens(source)) {
            if (token.length() >= minimumTokenLength && normalizedTarget.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
