package uk.gov.di.oidcop.shared.services;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.util.List;

public interface JwtSigningService {

    SignedJWT sign(JWTClaimsSet claims, JWSAlgorithm algorithm);

    List<JWSAlgorithm> getSupportedAlgorithms();

    JWKSet getPublicJwkSet();
}
