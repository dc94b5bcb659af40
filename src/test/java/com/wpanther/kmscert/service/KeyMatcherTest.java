package com.wpanther.kmscert.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.util.Base64;

import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.wpanther.kmscert.exception.UnsupportedPublicKeyFormatException;
import com.wpanther.kmscert.util.PemUtil;

/**
 * Unit tests for KeyMatcher
 */
class KeyMatcherTest {

    private static String rsaPem;
    private static String otherRsaPem;
    private static String ecPem;
    private static PublicKey rsaKey;

    private final PemUtil pemUtil = new PemUtil();
    private final KeyMatcher keyMatcher = new KeyMatcher(pemUtil);

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyMatcher matcher = new KeyMatcher(new PemUtil());
        rsaKey = LocalSigningKey.rsa().keyPair().getPublic();
        rsaPem = matcher.toCanonicalPem(rsaKey);
        otherRsaPem = matcher.toCanonicalPem(LocalSigningKey.rsa().keyPair().getPublic());
        ecPem = matcher.toCanonicalPem(LocalSigningKey.ec("secp256r1").keyPair().getPublic());
    }

    @Test
    void testEqualIsReflexive() {
        assertThat(keyMatcher.equal(rsaPem, rsaPem)).isTrue();
        assertThat(keyMatcher.equal(ecPem, ecPem)).isTrue();
    }

    @Test
    void testEqualIsSymmetric() {
        assertThat(keyMatcher.equal(rsaPem, otherRsaPem)).isFalse();
        assertThat(keyMatcher.equal(otherRsaPem, rsaPem)).isFalse();
        assertThat(keyMatcher.equal(rsaPem, ecPem)).isEqualTo(keyMatcher.equal(ecPem, rsaPem));
    }

    @Test
    void testLineEndingsAndTrailingNewlineIgnored() {
        String crlf = rsaPem.replace("\n", "\r\n");
        String noTrailingNewline = rsaPem.strip();

        assertThat(keyMatcher.equal(rsaPem, crlf)).isTrue();
        assertThat(keyMatcher.equal(noTrailingNewline, rsaPem)).isTrue();
    }

    @Test
    void testDifferentWrappingIsNotEqual() {
        // Same key, base64 body on one line instead of 64-character lines
        String body = Base64.getEncoder().encodeToString(rsaKey.getEncoded());
        String singleLine = "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";

        assertThat(keyMatcher.equal(rsaPem, singleLine)).isFalse();
    }

    @Test
    void testCanonicalPemIsStable() throws Exception {
        SubjectPublicKeyInfo info = pemUtil.readPublicKeyPem(rsaPem);

        assertThat(keyMatcher.toCanonicalPem(info)).isEqualTo(rsaPem);
        assertThat(rsaPem).startsWith("-----BEGIN PUBLIC KEY-----\n").endsWith("-----END PUBLIC KEY-----\n");
    }

    @Test
    void testEd25519KeyRejected() throws Exception {
        PublicKey ed25519 = KeyPairGenerator.getInstance("Ed25519").generateKeyPair().getPublic();
        String ed25519Pem = pemUtil.toPem(SubjectPublicKeyInfo.getInstance(ed25519.getEncoded()));

        assertThatThrownBy(() -> keyMatcher.equal(ed25519Pem, rsaPem))
            .isInstanceOf(UnsupportedPublicKeyFormatException.class);
        assertThatThrownBy(() -> keyMatcher.toCanonicalPem(ed25519))
            .isInstanceOf(UnsupportedPublicKeyFormatException.class);
    }

    @Test
    void testNonKeyPemRejected() {
        assertThatThrownBy(() -> keyMatcher.equal("not a key", rsaPem))
            .isInstanceOf(UnsupportedPublicKeyFormatException.class);
        assertThatThrownBy(() -> keyMatcher.equal(rsaPem, null))
            .isInstanceOf(UnsupportedPublicKeyFormatException.class);
    }
}
