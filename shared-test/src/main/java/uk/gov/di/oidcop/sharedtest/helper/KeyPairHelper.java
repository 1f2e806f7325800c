package uk.gov.di.oidcop.sharedtest.helper;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;

import java.util.List;

import static java.util.Objects.isNull;

public class KeyPairHelper {

    public static final String EC_KEY_ID = "ec-signing-key";
    public static final String RSA_KEY_ID = "rsa-signing-key";

    private static RSAKey cachedRsaKey = null;

    private KeyPairHelper() {}

    public static ECKey generateEcSigningKey() {
        try {
            return new ECKeyGenerator(Curve.P_256)
                    .keyID(EC_KEY_ID)
                    .keyUse(KeyUse.SIGNATURE)
                    .algorithm(JWSAlgorithm.ES256)
                    .generate();
        } catch (JOSEException e) {
            throw new RuntimeException(e);
        }
    }

    public static RSAKey generateRsaSigningKey() {
        if (isNull(cachedRsaKey)) {
            try {
                cachedRsaKey =
                        new RSAKeyGenerator(2048)
                                .keyID(RSA_KEY_ID)
                                .keyUse(KeyUse.SIGNATURE)
                                .algorithm(JWSAlgorithm.RS256)
                                .generate();
            } catch (JOSEException e) {
                throw new RuntimeException(e);
            }
        }
        return cachedRsaKey;
    }

    public static JWKSet generateSigningKeys() {
        return new JWKSet(List.of(generateEcSigningKey(), generateRsaSigningKey()));
    }
}
