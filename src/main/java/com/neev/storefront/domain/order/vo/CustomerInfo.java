package com.neev.storefront.domain.order.vo;

import com.neev.storefront.domain.order.exception.InvalidOrderException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * 주문자 정보 Value Object
 * 이름/연락처/주소는 필수, 이메일은 선택
 */
@Embeddable
public record CustomerInfo(
        @Column(name = "customer_name", length = 255)
        String name,

        @Column(name = "customer_email", length = 255)
        String email,

        @Column(name = "customer_phone", length = 255)
        String phone,

        @Column(name = "address", length = 1000)
        String address
) {

    static final int MAX_FIELD_LENGTH = 255;
    static final int MAX_ADDRESS_LENGTH = 1000;

    /**
     * 폼 입력으로부터 생성 (공백 제거 + 필수값 검증)
     */
    public static CustomerInfo of(String name, String email, String phone, String address) {
        String trimmedName = trim(name);
        String trimmedPhone = trim(phone);
        String trimmedAddress = trim(address);
        if (trimmedName.isEmpty() || trimmedPhone.isEmpty() || trimmedAddress.isEmpty()) {
            throw new InvalidOrderException("이름, 연락처, 주소는 필수입니다");
        }
        String trimmedEmail = trim(email);
        requireMaxLength(trimmedName, MAX_FIELD_LENGTH, "이름");
        requireMaxLength(trimmedEmail, MAX_FIELD_LENGTH, "이메일");
        requireMaxLength(trimmedPhone, MAX_FIELD_LENGTH, "연락처");
        requireMaxLength(trimmedAddress, MAX_ADDRESS_LENGTH, "주소");
        return new CustomerInfo(trimmedName, trimmedEmail.isEmpty() ? null : trimmedEmail, trimmedPhone, trimmedAddress);
    }

    private static void requireMaxLength(String value, int maxLength, String field) {
        if (value.length() > maxLength) {
            throw new InvalidOrderException(field + "은(는) " + maxLength + "자 이하여야 합니다");
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
