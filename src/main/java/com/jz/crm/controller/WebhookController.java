package com.jz.crm.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.jz.crm.channel.ChannelAddresses;
import com.jz.crm.channel.MetaWebhookParser;
import com.jz.crm.chat.dispatch.Dispatcher;
import com.jz.crm.config.MetaWebhookProperties;
import com.jz.crm.domain.dto.InboundMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Channel callbacks. Both answer immediately; the dispatch runs on the worker pool. */
@Slf4j
@RestController
@RequestMapping("webhook")
@RequiredArgsConstructor
public class WebhookController {

    private final Dispatcher dispatcher;
    private final MetaWebhookParser metaParser;
    private final MetaWebhookProperties metaProps;

    @GetMapping
    public ResponseEntity<String> verify(@RequestParam(name = "hub.mode", required = false) String mode,
                                         @RequestParam(name = "hub.verify_token", required = false) String token,
                                         @RequestParam(name = "hub.challenge", required = false) String challenge) {
        if ("subscribe".equals(mode) && StringUtils.hasText(metaProps.getVerifyToken())
                && metaProps.getVerifyToken().equals(token)) {
            log.info("[Webhook] meta verification ok");
            return ResponseEntity.ok(challenge);
        }
        log.warn("[Webhook] meta verification failed, mode={}", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Verification failed");
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> receiveMeta(@RequestBody JsonNode body) {
        try {
            List<InboundMessage> messages = metaParser.parse(body);
            if (messages.isEmpty()) {
                return Map.of("status", "ignored");
            }
            messages.forEach(dispatcher::submit);
            return Map.of("status", "ok");
        } catch (Exception e) {
            log.error("[Webhook] meta payload failed: {}", e.getMessage(), e);
            return Map.of("status", "error");
        }
    }

    @PostMapping(value = "/twilio", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.TEXT_XML_VALUE)
    public String receiveTwilio(@RequestParam Map<String, String> form) {
        String from = ChannelAddresses.normalize(form.getOrDefault("From", ""));
        String body = form.getOrDefault("Body", "");
        if (!StringUtils.hasText(body) || !StringUtils.hasText(from)) {
            return "";
        }
        try {
            dispatcher.submit(InboundMessage.builder()
                    .from(from)
                    .text(body)
                    .channelMessageId(form.get("MessageSid"))
                    .senderName(form.get("ProfileName"))
                    .build());
        } catch (Exception e) {
            log.error("[Webhook] twilio dispatch failed, from={}, err={}", from, e.getMessage(), e);
        }
        return "";
    }
}
