package uk.gov.di.oidcop.shared.services;

import com.nimbusds.jwt.SignedJWT;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import uk.gov.di.oidcop.shared.entity.TokenType;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.sharedtest.logging.CaptureLoggingExtension;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static uk.gov.di.oidcop.sharedtest.logging.LogEventMatcher.withLevel;
import static uk.gov.di.oidcop.sharedtest.logging.LogEventMatcher.withMessageContaining;

class TokenHandlerTest {

    @RegisterExtension
    public final CaptureLoggingExtension logging = new CaptureLoggingExtension(TokenHandler.class);

    private static final byte[] SECRET =
            "a-token-handler-secret-of-at-least-256-bits".getBytes(StandardCharsets.UTF_8);
    private static final long ISSUED_AT = 1_196_676_930L;

    @Test
    void shouldMintTokenWhichDecodesToTheSameDetails() throws Exception {
        var handler = new TokenHandler(TokenType.ACCESS_TOKEN, SECRET);

        var token = handler.mint("session-id", ISSUED_AT, ISSUED_AT + 180, "parent");
        var info = handler.decode(token.getValue()).orElseThrow();

        assertThat(info.type(), equalTo(TokenType.ACCESS_TOKEN));
        assertThat(info.sessionId(), equalTo("session-id"));
        assertThat(info.issuedAt(), equalTo(ISSUED_AT));
        assertThat(info.expiresAt(), equalTo(ISSUED_AT + 180));
        assertThat(token.getBasedOn().orElseThrow(), equalTo("parent"));
        assertThat(
                SignedJWT.parse(token.getValue()).getJWTClaimsSet().getStringClaim("token_type"),
                equalTo("access_token"));
    }

    @Test
    void shouldMintUniqueValues() throws Exception {
        var handler = new TokenHandler(TokenType.AUTHORIZATION_CODE, SECRET);
        var values = new HashSet<String>();

        IntStream.range(0, 200)
                .forEach(i -> values.add(handler.mint("sid", ISSUED_AT, ISSUED_AT + 1, null).getValue()));

        assertThat(values.size(), equalTo(200));
    }

    @Test
    void shouldNotDecodeTamperedOrForeignValues() throws Exception {
        var handler = new TokenHandler(TokenType.ACCESS_TOKEN, SECRET);
        var otherSecret =
                "another-token-handler-secret-of-256-bits!!".getBytes(StandardCharsets.UTF_8);
        var otherHandler = new TokenHandler(TokenType.ACCESS_TOKEN, otherSecret);
        var value = handler.mint("sid", ISSUED_AT, ISSUED_AT + 180, null).getValue();

        assertTrue(otherHandler.decode(value).isEmpty());
        assertTrue(handler.decode(value + "x").isEmpty());
        assertTrue(handler.decode("not-a-token").isEmpty());
        assertTrue(handler.decode(null).isEmpty());
    }

    @Test
    void shouldNotDecodeValueOfAnotherKind() throws Exception {
        var handlers = new TokenHandlers(SECRET);
        var refreshToken =
                handlers.get(TokenType.REFRESH_TOKEN).mint("sid", ISSUED_AT, ISSUED_AT + 10, null);

        assertTrue(handlers.get(TokenType.ACCESS_TOKEN).decode(refreshToken.getValue()).isEmpty());
        assertThat(
                handlers.decode(refreshToken.getValue()).orElseThrow().type(),
                equalTo(TokenType.REFRESH_TOKEN));
    }

    @Test
    void shouldDecodeEveryKindWithoutVerificationWarnings() throws Exception {
        var handlers = new TokenHandlers(SECRET);

        for (TokenType type : TokenType.values()) {
            var token = handlers.get(type).mint("sid", ISSUED_AT, ISSUED_AT + 10, null);
            assertThat(handlers.decode(token.getValue()).orElseThrow().type(), equalTo(type));
        }

        assertThat(logging.events(), not(hasItem(withLevel(Level.WARN))));
    }

    @Test
    void shouldWarnWhenSignatureDoesNotVerify() throws Exception {
        var handlers = new TokenHandlers(SECRET);
        var foreign =
                new TokenHandlers(
                                "another-token-handler-secret-of-256-bits!!"
                                        .getBytes(StandardCharsets.UTF_8))
                        .get(TokenType.ACCESS_TOKEN)
                        .mint("sid", ISSUED_AT, ISSUED_AT + 10, null);

        assertTrue(handlers.decode(foreign.getValue()).isEmpty());
        assertThat(
                logging.events(),
                hasItem(withMessageContaining("Signature of access_token could not be verified")));
    }

    @Test
    void shouldRejectNonPositiveLifetime() throws Exception {
        var handler = new TokenHandler(TokenType.ACCESS_TOKEN, SECRET);

        assertThrows(
                IllegalArgumentException.class,
                () -> handler.mint("sid", ISSUED_AT, ISSUED_AT, null));
    }

    @Test
    void shouldRejectShortSecret() {
        var exception =
                assertThrows(
                        ConfigurationException.class,
                        () ->
                                new TokenHandlers(
                                        "too-short".getBytes(StandardCharsets.UTF_8)));

        assertEquals("Token handler secret must be at least 256 bits", exception.getMessage());
    }

    @Test
    void shouldGenerateSecretWhenNoneIsConfigured() throws Exception {
        var configurationService = mock(ConfigurationService.class);
        when(configurationService.getTokenHandlerSecret()).thenReturn(java.util.Optional.empty());

        var handlers = new TokenHandlers(configurationService);
        var token = handlers.get(TokenType.ACCESS_TOKEN).mint("sid", ISSUED_AT, ISSUED_AT + 5, null);

        assertTrue(handlers.decode(token.getValue()).isPresent());
    }
}
