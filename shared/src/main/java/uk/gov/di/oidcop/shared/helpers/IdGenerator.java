package uk.gov.di.oidcop.shared.helpers;

import java.security.SecureRandom;
import java.util.Base64;

public class IdGenerator {
    private static final int ENTROPY_BYTES = 20;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    public static String generate() {
        return generate(ENTROPY_BYTES);
    }

    public static byte[] randomBytes(int length) {
        byte[] buffer = new byte[length];
        RANDOM.nextBytes(buffer);
        return buffer;
    }

    static String generate(int entropyBytes) {
        return ENCODER.encodeToString(randomBytes(entropyBytes));
    }
}
