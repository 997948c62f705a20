package com.neev.storefront.presentation.controller.webhook;

import com.neev.storefront.application.webhook.usecase.HandleWebhookUseCase;
import com.neev.storefront.domain.payment.exception.InvalidSignatureException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 결제 게이트웨이 웹훅 수신
 *
 * - 200 {ok:true}: 처리 완료 또는 감사 기록 후 수신 확인 (재전송 불필요)
 * - 400: 서명 검증 실패
 * - 500 {ok:false}: 예상하지 못한 내부 오류 (게이트웨이 재전송 대상)
 */
@Slf4j
@Tag(name = "웹훅", description = "결제 게이트웨이 이벤트 수신 API")
@RestController
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    private final HandleWebhookUseCase handleWebhookUseCase;

    @Operation(summary = "웹훅 수신", description = "원문 본문의 HMAC-SHA256 서명을 검증한 뒤 결제 완료 이벤트를 주문에 반영합니다")
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody(required = false) byte[] body,
            @Parameter(description = "HMAC-SHA256 hex 서명") @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @Parameter(description = "서명 없는 테스트 요청 (허용 설정 시에만)") @RequestParam(required = false) String test) {

        handleWebhookUseCase.execute(body == null ? new byte[0] : body, signature, "1".equals(test));
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSignature(InvalidSignatureException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("ok", false, "code", e.getCode(), "message", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("웹훅 처리 실패", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("ok", false));
    }
}
