package com.khaounen.edgeguard.security.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.edgeguard.config.RequestContext;
import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;
import com.khaounen.edgeguard.security.exclusion.ExclusionListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class ExclusionAlertDispatcher implements ExclusionListener {

    private final ExclusionAlertProperties properties;
    private final ObjectProvider<ObjectMapper> objectMapperProvider;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public ExclusionAlertDispatcher(
            ExclusionAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        this.properties = properties;
        this.objectMapperProvider = objectMapperProvider;
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public void onExcluded(ExclusionEntry entry) {
        if (properties == null) {
            return;
        }
        String userAgent = RequestContext.getUserAgent();
        sendWebhook(entry, userAgent);
        sendSmtp(entry, userAgent);
    }

    private void sendWebhook(ExclusionEntry entry, String userAgent) {
        ExclusionAlertProperties.Webhook webhook = properties.getWebhook();
        if (webhook == null || !webhook.isEnabled() || webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }
        try {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
            String payload = mapper.writeValueAsString(buildPayload(entry, userAgent, webhook.isIncludeContext()));
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofMillis(webhook.getConnectTimeoutMs()))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(webhook.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
            client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                    .whenComplete((response, ex) -> {
                        if (ex != null) {
                            log.warn("exclusion webhook alert failed: {}", ex.getMessage());
                        }
                    });
        } catch (Exception ex) {
            log.warn("exclusion webhook alert failed: {}", ex.getMessage());
        }
    }

    private void sendSmtp(ExclusionEntry entry, String userAgent) {
        ExclusionAlertProperties.Smtp smtp = properties.getSmtp();
        if (smtp == null || !smtp.isEnabled()) {
            return;
        }
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null || smtp.getFrom() == null || smtp.getFrom().isBlank() || smtp.getTo().isEmpty()) {
            return;
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(smtp.getFrom());
        message.setTo(smtp.getTo().toArray(new String[0]));
        message.setSubject(smtp.getSubject());
        message.setText(buildMailBody(entry, userAgent, smtp.isIncludeContext()));
        CompletableFuture.runAsync(() -> sender.send(message))
                .whenComplete((ignored, ex) -> {
                    if (ex != null) {
                        log.warn("exclusion smtp alert failed: {}", ex.getMessage());
                    }
                });
    }

    Map<String, Object> buildPayload(ExclusionEntry entry, String userAgent, boolean includeContext) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("address", entry.address());
        payload.put("tier", entry.tier().name());
        payload.put("source", entry.source().name());
        payload.put("permanent", entry.isPermanent());
        payload.put("expiresAt", entry.isPermanent() ? null : entry.expiresAt().toString());
        if (includeContext) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("createdAt", entry.createdAt().toString());
            ctx.put("userAgent", userAgent);
            payload.put("context", ctx);
        }
        return payload;
    }

    private String buildMailBody(ExclusionEntry entry, String userAgent, boolean includeContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("Address excluded\n");
        sb.append("timestamp: ").append(Instant.now()).append('\n');
        sb.append("address: ").append(entry.address()).append('\n');
        sb.append("tier: ").append(entry.tier()).append('\n');
        sb.append("source: ").append(entry.source()).append('\n');
        sb.append("expires: ").append(entry.isPermanent() ? "never" : entry.expiresAt()).append('\n');
        if (includeContext) {
            sb.append("createdAt: ").append(entry.createdAt()).append('\n');
            sb.append("userAgent: ").append(userAgent).append('\n');
        }
        return sb.toString();
    }
}
