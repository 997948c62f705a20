package com.neev.storefront.infrastructure.gateway;

import com.neev.storefront.domain.payment.gateway.SignatureVerifier;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 웹훅 서명 검증
 *
 * 서명 = hex(HMAC-SHA256(secret, rawBody)), 상수 시간 비교
 * 시크릿/서명이 비어 있으면 항상 false
 */
@Component
public class HmacSignatureVerifier implements SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    @Override
    public boolean verify(byte[] rawBody, String signature, String secret) {
        if (rawBody == null || signature == null || signature.isBlank() || secret == null || secret.isEmpty()) {
            return false;
        }
        byte[] expected = sign(rawBody, secret).getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signature.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided);
    }

    /**
     * 본문 서명 (소문자 hex)
     */
    public String sign(byte[] rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC 계산 실패", e);
        }
    }
}
