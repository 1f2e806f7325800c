package uk.gov.di.oidcop.shared.services;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.Token;
import uk.gov.di.oidcop.shared.entity.TokenInfo;
import uk.gov.di.oidcop.shared.entity.TokenType;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.helpers.IdGenerator;

import java.text.ParseException;
import java.util.Date;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mints and decodes the values of one kind of token. Values are HS256 signed JWTs so their
 * integrity can be checked without looking anything up.
 */
public class TokenHandler {

    private static final Logger LOG = LogManager.getLogger(TokenHandler.class);

    public static final int MINIMUM_SECRET_LENGTH = 32;
    static final String SESSION_ID_CLAIM = "sid";
    static final String TOKEN_TYPE_CLAIM = "token_type";

    private final TokenType type;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Set<String> issuedIds = ConcurrentHashMap.newKeySet();

    public TokenHandler(TokenType type, byte[] secret) throws ConfigurationException {
        if (secret == null || secret.length < MINIMUM_SECRET_LENGTH) {
            throw new ConfigurationException(
                    String.format(
                            "Secret for %s handler must be at least %d bits",
                            type.getValue(), MINIMUM_SECRET_LENGTH * 8));
        }
        try {
            this.signer = new MACSigner(secret);
            this.verifier = new MACVerifier(secret);
        } catch (JOSEException e) {
            throw new ConfigurationException("Unable to create token handler", e);
        }
        this.type = type;
    }

    public TokenType getType() {
        return type;
    }

    public Token mint(String sessionId, long issuedAt, long expiresAt, String basedOn) {
        if (expiresAt <= issuedAt) {
            throw new IllegalArgumentException("Token lifetime must be positive");
        }
        var tokenId = IdGenerator.generate();
        while (!issuedIds.add(tokenId)) {
            tokenId = IdGenerator.generate();
        }
        var claims =
                new JWTClaimsSet.Builder()
                        .jwtID(tokenId)
                        .claim(SESSION_ID_CLAIM, sessionId)
                        .claim(TOKEN_TYPE_CLAIM, type.getValue())
                        .issueTime(new Date(issuedAt * 1000))
                        .expirationTime(new Date(expiresAt * 1000))
                        .build();
        var jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            LOG.error("Unable to sign {}", type.getValue());
            throw new RuntimeException(e);
        }
        return new Token(type, jwt.serialize(), sessionId, issuedAt, expiresAt, basedOn);
    }

    public Optional<TokenInfo> decode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            var jwt = SignedJWT.parse(value);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())
                    || !jwt.verify(verifier)) {
                LOG.warn("Signature of {} could not be verified", type.getValue());
                return Optional.empty();
            }
            var claims = jwt.getJWTClaimsSet();
            if (!type.getValue().equals(claims.getStringClaim(TOKEN_TYPE_CLAIM))
                    || claims.getIssueTime() == null
                    || claims.getExpirationTime() == null) {
                return Optional.empty();
            }
            return Optional.of(
                    new TokenInfo(
                            type,
                            claims.getJWTID(),
                            claims.getStringClaim(SESSION_ID_CLAIM),
                            claims.getIssueTime().toInstant().getEpochSecond(),
                            claims.getExpirationTime().toInstant().getEpochSecond()));
        } catch (ParseException | JOSEException e) {
            LOG.warn("Unable to decode {}", type.getValue());
            return Optional.empty();
        }
    }
}
