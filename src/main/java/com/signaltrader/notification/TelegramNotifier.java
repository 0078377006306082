package com.signaltrader.notification;

import com.signaltrader.domain.enums.AlertSeverity;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends messages via the Telegram Bot API with rate limiting.
 *
 * <p>A semaphore of {@code maxMessagesPerMinute} permits, each released a minute after
 * use, keeps delivery within the bot limit. Messages that find no permit wait in a
 * priority queue, most severe first, drained every second.
 *
 * <p>CRITICAL alerts (breaker trips, emergency stop, liquidation) skip the limiter and go
 * out immediately. Delivery failures are logged and dropped.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;

    private final BlockingQueue<TelegramMessage> messageQueue = new PriorityBlockingQueue<>(
            100, Comparator.comparingInt(m -> m.getSeverity().ordinal()));

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        this.rateLimiter = new Semaphore(Math.max(1, telegramConfig.getMaxMessagesPerMinute()));
    }

    public void send(String message, AlertSeverity severity) {
        if (!telegramConfig.isEnabled()) {
            log.debug("Telegram notifications disabled");
            return;
        }

        TelegramMessage telegramMessage = TelegramMessage.builder()
                .text(message)
                .severity(severity)
                .timestamp(System.currentTimeMillis())
                .build();

        if (severity == AlertSeverity.CRITICAL) {
            sendMessage(telegramMessage);
            return;
        }

        if (rateLimiter.tryAcquire()) {
            sendMessage(telegramMessage);
            scheduleRateLimiterRelease();
        } else {
            messageQueue.offer(telegramMessage);
            log.warn("Telegram rate limit reached, message queued. Queue size: {}", messageQueue.size());
        }
    }

    @Scheduled(fixedRate = 1000)
    public void processQueue() {
        while (!messageQueue.isEmpty() && rateLimiter.tryAcquire()) {
            TelegramMessage message = messageQueue.poll();
            if (message != null) {
                sendMessage(message);
                scheduleRateLimiterRelease();
            } else {
                rateLimiter.release();
            }
        }
    }

    private void sendMessage(TelegramMessage message) {
        try {
            String url = String.format(TELEGRAM_API_URL, telegramConfig.getBotToken());
            String prefix =
                    switch (message.getSeverity()) {
                        case CRITICAL -> "⚠️";
                        case WARNING -> "⚡";
                        case INFO -> "ℹ️";
                    };

            Map<String, Object> payload = Map.of(
                    "chat_id",
                    telegramConfig.getChatId(),
                    "text",
                    prefix + " " + message.getText(),
                    "parse_mode",
                    "HTML",
                    "disable_web_page_preview",
                    true);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.debug("Telegram message sent");
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
        }
    }

    private void scheduleRateLimiterRelease() {
        CompletableFuture.delayedExecutor(1, TimeUnit.MINUTES).execute(rateLimiter::release);
    }

    public int getQueueSize() {
        return messageQueue.size();
    }

    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }

    /** Takes every free permit, so the next non-critical message is queued. */
    public void drainPermits() {
        rateLimiter.drainPermits();
    }
}
