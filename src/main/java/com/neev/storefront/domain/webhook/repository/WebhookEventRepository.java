package com.neev.storefront.domain.webhook.repository;

import com.neev.storefront.domain.webhook.entity.WebhookEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

    List<WebhookEvent> findByExternalId(String externalId);
}
