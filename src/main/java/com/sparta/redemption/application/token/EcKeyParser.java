package com.sparta.redemption.application.token;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * PEM 형식 EC 키 파서
 */
final class EcKeyParser {

    private static final String ALGORITHM = "EC";

    private EcKeyParser() {
    }

    static PrivateKey parsePrivateKey(String pem) {
        try {
            byte[] der = decodePem(pem);
            return KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("EC 개인키(PKCS#8 PEM)를 읽을 수 없습니다", e);
        }
    }

    static PublicKey parsePublicKey(String pem) {
        try {
            byte[] der = decodePem(pem);
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("EC 공개키(X.509 PEM)를 읽을 수 없습니다", e);
        }
    }

    private static byte[] decodePem(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("PEM 키가 비어 있습니다");
        }
        String body = pem
                .replaceAll("-----BEGIN [A-Z ]+-----", "")
                .replaceAll("-----END [A-Z ]+-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }
}
