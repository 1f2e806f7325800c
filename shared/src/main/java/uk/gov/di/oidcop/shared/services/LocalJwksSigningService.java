package uk.gov.di.oidcop.shared.services;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Signs JWTs with private keys held in a local JWK set. Supports ES256 and RS256. */
public class LocalJwksSigningService implements JwtSigningService {

    private static final Logger LOG = LogManager.getLogger(LocalJwksSigningService.class);

    private final JWKSet jwkSet;

    public LocalJwksSigningService(JWKSet jwkSet) throws ConfigurationException {
        if (jwkSet.getKeys().stream().noneMatch(JWK::isPrivate)) {
            throw new ConfigurationException("Signing JWK set holds no private keys");
        }
        this.jwkSet = jwkSet;
    }

    public static LocalJwksSigningService fromConfiguration(
            ConfigurationService configurationService) throws ConfigurationException {
        var jwks = configurationService.getTokenSigningJwks();
        if (jwks.isPresent()) {
            try {
                return new LocalJwksSigningService(JWKSet.parse(jwks.get()));
            } catch (ParseException e) {
                throw new ConfigurationException("Unable to parse signing JWK set", e);
            }
        }
        LOG.warn("No signing keys configured, generating ephemeral keys");
        try {
            var ecKey =
                    new ECKeyGenerator(Curve.P_256)
                            .keyID(UUID.randomUUID().toString())
                            .keyUse(KeyUse.SIGNATURE)
                            .algorithm(JWSAlgorithm.ES256)
                            .generate();
            var rsaKey =
                    new RSAKeyGenerator(2048)
                            .keyID(UUID.randomUUID().toString())
                            .keyUse(KeyUse.SIGNATURE)
                            .algorithm(JWSAlgorithm.RS256)
                            .generate();
            return new LocalJwksSigningService(new JWKSet(List.of(ecKey, rsaKey)));
        } catch (JOSEException e) {
            throw new ConfigurationException("Unable to generate signing keys", e);
        }
    }

    @Override
    public SignedJWT sign(JWTClaimsSet claims, JWSAlgorithm algorithm) {
        var signingKey =
                findKey(algorithm)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "No signing key for algorithm " + algorithm));
        try {
            JWSSigner signer;
            if (signingKey instanceof ECKey) {
                signer = new ECDSASigner(signingKey.toECKey());
            } else {
                signer = new RSASSASigner(signingKey.toRSAKey());
            }
            var signedJWT =
                    new SignedJWT(
                            new JWSHeader.Builder(algorithm).keyID(signingKey.getKeyID()).build(),
                            claims);
            signedJWT.sign(signer);
            return signedJWT;
        } catch (JOSEException e) {
            LOG.error("Failed to sign JWT with {}", algorithm);
            throw new RuntimeException(e);
        }
    }

    @Override
    public List<JWSAlgorithm> getSupportedAlgorithms() {
        List<JWSAlgorithm> algorithms = new ArrayList<>();
        if (findKey(JWSAlgorithm.ES256).isPresent()) {
            algorithms.add(JWSAlgorithm.ES256);
        }
        if (findKey(JWSAlgorithm.RS256).isPresent()) {
            algorithms.add(JWSAlgorithm.RS256);
        }
        return algorithms;
    }

    @Override
    public JWKSet getPublicJwkSet() {
        return jwkSet.toPublicJWKSet();
    }

    private Optional<JWK> findKey(JWSAlgorithm algorithm) {
        return jwkSet.getKeys().stream()
                .filter(JWK::isPrivate)
                .filter(k -> k.getKeyUse() == null || KeyUse.SIGNATURE.equals(k.getKeyUse()))
                .filter(
                        k -> {
                            if (JWSAlgorithm.ES256.equals(algorithm)) {
                                return k instanceof ECKey
                                        && Curve.P_256.equals(((ECKey) k).getCurve());
                            }
                            if (JWSAlgorithm.RS256.equals(algorithm)) {
                                return k instanceof RSAKey;
                            }
                            return false;
                        })
                .findFirst();
    }
}
