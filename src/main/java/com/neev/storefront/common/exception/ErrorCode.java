package com.neev.storefront.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * 코드, 기본 메시지, 응답 HTTP 상태를 함께 관리
 */
public enum ErrorCode {
    // 상품 관련 에러
    P001("P001", "상품을 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    P002("P002", "재고가 부족합니다", HttpStatus.CONFLICT),
    P003("P003", "상품 정보가 올바르지 않습니다", HttpStatus.BAD_REQUEST),

    // 장바구니 관련 에러
    CART001("CART001", "유효하지 않은 수량입니다", HttpStatus.BAD_REQUEST),
    CART002("CART002", "장바구니가 비어있습니다", HttpStatus.BAD_REQUEST),

    // 주문 관련 에러
    O001("O001", "주문 정보가 올바르지 않습니다", HttpStatus.BAD_REQUEST),
    O002("O002", "주문을 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    O003("O003", "현재 주문 상태에서는 처리할 수 없습니다", HttpStatus.CONFLICT),

    // 결제 관련 에러
    PAY001("PAY001", "결제 게이트웨이에 연결할 수 없습니다", HttpStatus.BAD_GATEWAY),
    PAY002("PAY002", "웹훅 서명 검증에 실패했습니다", HttpStatus.BAD_REQUEST),

    // 관리자 관련 에러
    ADM001("ADM001", "관리자 비밀번호가 올바르지 않습니다", HttpStatus.UNAUTHORIZED),
    ADM002("ADM002", "로그인 시도 횟수를 초과하여 잠겨 있습니다", HttpStatus.LOCKED),

    // 공통 에러
    COMMON001("COMMON001", "필수 파라미터가 누락되었습니다", HttpStatus.BAD_REQUEST),
    COMMON002("COMMON002", "잘못된 요청 형식입니다", HttpStatus.BAD_REQUEST),
    COMMON004("COMMON004", "서버 내부 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(String code, String message, HttpStatus status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
