package com.neev.storefront.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 스토어 설정 (application.yml 의 neev.* 항목)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "neev")
public class StoreProperties {

    /**
     * 모든 금액에 사용하는 통화 코드
     */
    private String currency = "INR";

    /**
     * 프리미엄 옵션 선택 시 주문 금액에 더해지는 고정 금액
     */
    private BigDecimal premiumSurcharge = new BigDecimal("999.00");

    private Upi upi = new Upi();
    private Gateway gateway = new Gateway();
    private Admin admin = new Admin();
    private Seed seed = new Seed();

    @Getter
    @Setter
    public static class Upi {
        private String payeeId = "neev@upi";
        private String merchantName = "NEEV";
    }

    @Getter
    @Setter
    public static class Gateway {
        private String keyId = "";
        private String keySecret = "";
        private String webhookSecret = "";
        private String baseUrl = "https://api.razorpay.com/v1";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(10);

        /**
         * 웹훅 시크릿이 없을 때 ?test=1 요청을 서명 없이 허용할지 여부 (운영 환경에서는 false)
         */
        private boolean allowUnsignedWebhooks = false;

        public boolean hasCredentials() {
            return hasText(keyId) && hasText(keySecret);
        }

        public boolean hasWebhookSecret() {
            return hasText(webhookSecret);
        }
    }

    @Getter
    @Setter
    public static class Admin {
        private String password = "2468";
        private int maxAttempts = 3;
        private Duration lockoutDuration = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Seed {
        private boolean enabled = true;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
