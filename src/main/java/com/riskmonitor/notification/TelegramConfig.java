package com.riskmonitor.notification;

import com.riskmonitor.domain.enums.AlertLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API settings for alert delivery.
 *
 * <pre>
 * notifications.telegram.enabled=false
 * notifications.telegram.bot-token=${TELEGRAM_BOT_TOKEN:}
 * notifications.telegram.chat-id=${TELEGRAM_CHAT_ID:}
 * notifications.telegram.max-messages-per-minute=20
 * notifications.telegram.min-level=WARNING
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "notifications.telegram")
public class TelegramConfig {

    private boolean enabled = false;
    private String botToken;
    private String chatId;
    private int maxMessagesPerMinute = 20;

    /** Alerts below this level are not sent. */
    private AlertLevel minLevel = AlertLevel.WARNING;
}
