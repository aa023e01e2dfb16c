package com.riskmonitor.notification;

import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.exception.AlertHandlerException;
import com.riskmonitor.monitor.AlertHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes alerts to STOMP subscribers of {@code /topic/monitor/{traderId}/alerts}.
 */
@Component
public class WebSocketAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(WebSocketAlertHandler.class);

    private static final String TOPIC_TEMPLATE = "/topic/monitor/%s/alerts";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public WebSocketAlertHandler(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Override
    public void handle(Alert alert) throws AlertHandlerException {
        String destination = destinationFor(alert.getTraderId());
        try {
            simpMessagingTemplate.convertAndSend(destination, alert);
            log.debug("WebSocket alert {} sent to {}", alert.getId(), destination);
        } catch (MessagingException e) {
            throw new AlertHandlerException("Failed to push alert " + alert.getId() + " to " + destination, e);
        }
    }

    public static String destinationFor(String traderId) {
        return String.format(TOPIC_TEMPLATE, traderId);
    }
}
