package com.github.dimitryivaniuta.jwt;

/** Helpers that corrupt compact tokens in controlled ways. */
public final class TokenTampering {
    private TokenTampering() {}

    /**
     * Flips one character in the middle of the signature segment. The last
     * character is avoided since its low bits may be padding.
     */
    public static String alterSignature(final String token) {
        int signatureStart = token.lastIndexOf('.') + 1;
        char[] chars = token.toCharArray();
        int i = signatureStart + 5;
        chars[i] = chars[i] == 'A' ? 'B' : 'A';
        return new String(chars);
    }

    /** Replaces the payload segment with the payload of another token, keeping the signature. */
    public static String swapPayload(final String token, final String donor) {
        String[] target = token.split("\\.");
        String[] source = donor.split("\\.");
        return target[0] + "." + source[1] + "." + target[2];
    }
}
