package dev.quorum.controller;

import dev.quorum.service.WebhookGateway;
import dev.quorum.service.WebhookOutcome;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * GitHub webhook receiver. The body is taken as raw bytes so the HMAC is computed
 * over exactly what GitHub signed. The run is synchronous: the response is sent
 * once the outcome has been recorded.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private final WebhookGateway gateway;

    public WebhookController(WebhookGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(@RequestHeader HttpHeaders headers,
                                                             @RequestBody(required = false) byte[] body) {
        WebhookOutcome outcome = gateway.handle(body != null ? body : new byte[0], headers.toSingleValueMap());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", outcome.disposition().name().toLowerCase(Locale.ROOT));
        if (outcome.reason() != null) response.put("reason", outcome.reason());
        if (outcome.reviewId() != null) response.put("reviewId", outcome.reviewId().toString());
        return ResponseEntity.status(outcome.disposition().httpStatus()).body(response);
    }
}
