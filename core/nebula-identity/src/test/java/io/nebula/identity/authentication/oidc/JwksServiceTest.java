package io.nebula.identity.authentication.oidc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Signature checks of JwksService, with key lookup stubbed out.
 */
class JwksServiceTest {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private KeyPair keyPair;
    private JwksService service;

    @BeforeEach
    void setUp() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();

        service = spy(new JwksService());
        doReturn((RSAPublicKey) keyPair.getPublic()).when(service).getPublicKey("k1");
    }

    @Test
    @DisplayName("verifySignature should accept a token signed with the provider key")
    void verifySignature_shouldReturnTrue_whenSignedWithKnownKey() throws Exception {
        assertThat(service.verifySignature(signedToken("{\"alg\":\"RS256\",\"kid\":\"k1\"}"))).isTrue();
    }

    @Test
    @DisplayName("verifySignature should return false when the payload was altered")
    void verifySignature_shouldReturnFalse_whenPayloadTampered() throws Exception {
        String[] parts = signedToken("{\"alg\":\"RS256\",\"kid\":\"k1\"}").split("\\.");
        String forged = parts[0] + "." + ENCODER.encodeToString("{\"sub\":\"admin\"}".getBytes(StandardCharsets.UTF_8))
            + "." + parts[2];

        assertThat(service.verifySignature(forged)).isFalse();
    }

    @Test
    @DisplayName("verifySignature should refuse algorithms other than RS256")
    void verifySignature_shouldThrow_whenAlgorithmNotRs256() {
        assertThatThrownBy(() -> service.verifySignature(signedToken("{\"alg\":\"HS256\",\"kid\":\"k1\"}")))
            .isInstanceOf(JwksService.JwksException.class)
            .hasMessageContaining("HS256");
    }

    @Test
    @DisplayName("verifySignature should require a key id")
    void verifySignature_shouldThrow_whenKidMissing() {
        assertThatThrownBy(() -> service.verifySignature(signedToken("{\"alg\":\"RS256\"}")))
            .isInstanceOf(JwksService.JwksException.class)
            .hasMessageContaining("kid");
    }

    private String signedToken(String headerJson) throws Exception {
        String header = ENCODER.encodeToString(headerJson.getBytes(StandardCharsets.UTF_8));
        String payload = ENCODER.encodeToString("{\"sub\":\"subject-1\"}".getBytes(StandardCharsets.UTF_8));

        Signature signer = Signature.getInstance("SHA256withRSA");
        signer.initSign(keyPair.getPrivate());
        signer.update((header + "." + payload).getBytes(StandardCharsets.UTF_8));
        return header + "." + payload + "." + ENCODER.encodeToString(signer.sign());
    }
}
