package com.riskmonitor.notification;

import com.riskmonitor.domain.enums.AlertLevel;
import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.exception.AlertHandlerException;
import com.riskmonitor.monitor.AlertHandler;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends alerts through the Telegram Bot API.
 *
 * <p>Non-critical alerts are rate limited to {@code max-messages-per-minute}; an alert over
 * the limit is rejected with {@link AlertHandlerException}. CRITICAL alerts bypass the limiter.
 * Alerts below {@code min-level} and all alerts while disabled are skipped silently.
 */
@Component
public class TelegramAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(TelegramAlertHandler.class);

    static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;

    @Autowired
    public TelegramAlertHandler(TelegramConfig telegramConfig, RestTemplateBuilder restTemplateBuilder) {
        this(telegramConfig, restTemplateBuilder.build());
    }

    public TelegramAlertHandler(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        this.rateLimiter = new Semaphore(telegramConfig.getMaxMessagesPerMinute());
    }

    @Override
    public void handle(Alert alert) throws AlertHandlerException {
        if (!telegramConfig.isEnabled()) {
            log.debug("Telegram notifications disabled, skipping {}", alert.getId());
            return;
        }
        if (alert.getLevel().ordinal() < telegramConfig.getMinLevel().ordinal()) {
            return;
        }

        if (alert.getLevel() != AlertLevel.CRITICAL) {
            if (!rateLimiter.tryAcquire()) {
                throw new AlertHandlerException("Telegram rate limit reached, alert " + alert.getId() + " dropped");
            }
            CompletableFuture.delayedExecutor(1, TimeUnit.MINUTES).execute(rateLimiter::release);
        }

        String url = String.format(TELEGRAM_API_URL, telegramConfig.getBotToken());
        Map<String, Object> payload = Map.of(
                "chat_id", telegramConfig.getChatId(),
                "text", formatText(alert),
                "disable_web_page_preview", true);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.debug("Telegram alert {} sent", alert.getId());
        } catch (RestClientException e) {
            throw new AlertHandlerException("Failed to send Telegram alert " + alert.getId(), e);
        }
    }

    /** Public for testability. */
    public String formatText(Alert alert) {
        String levelMarker =
                switch (alert.getLevel()) {
                    case CRITICAL -> "\u26A0\uFE0F"; // warning sign
                    case WARNING -> "\u26A1"; // high voltage
                    case INFO -> "\u2139\uFE0F";
                };
        return levelMarker + " [" + alert.getTraderId() + "] " + alert.getTitle() + "\n" + alert.getMessage();
    }

    /** Visible for testing. */
    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }
}
