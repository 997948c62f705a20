package com.neev.storefront.domain.payment.gateway;

/**
 * 웹훅 서명 검증기
 */
public interface SignatureVerifier {

    /**
     * @return 시크릿이 없거나 서명이 일치하지 않으면 false
     */
    boolean verify(byte[] rawBody, String signature, String secret);
}
