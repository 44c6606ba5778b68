package com.jz.crm.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.config.TwilioProperties;
import com.jz.crm.domain.dto.SendResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Twilio Programmable Messaging over the WhatsApp channel.
 * POST {apiBase}/Accounts/{sid}/Messages.json, form encoded, basic auth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TwilioMessageSender implements MessageSender {

    private final RestTemplate restTemplate;
    private final TwilioProperties props;
    private final ObjectMapper mapper;

    @Override
    public SendResult send(String to, String text) {
        if (!props.isConfigured()) {
            log.error("[Twilio] credentials not configured, drop message to {}", to);
            return SendResult.failed("Twilio not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(props.getAccountSid(), props.getAuthToken());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", "whatsapp:" + props.getWhatsappNumber());
        form.add("To", ChannelAddresses.toWhatsapp(to));
        form.add("Body", text);

        String url = props.getApiBase() + "/Accounts/" + props.getAccountSid() + "/Messages.json";
        try {
            ResponseEntity<String> resp = restTemplate.postForEntity(url, new HttpEntity<>(form, headers), String.class);
            JsonNode body = mapper.readTree(resp.getBody() == null ? "{}" : resp.getBody());
            String sid = body.path("sid").asText(null);
            String status = body.path("status").asText(null);
            log.info("[Twilio] sent sid={} status={} to={}", sid, status, to);
            return SendResult.sent(sid, status);
        } catch (RestClientResponseException e) {
            log.error("[Twilio] rejected to={} http={} body={}", to, e.getStatusCode().value(), e.getResponseBodyAsString());
            return SendResult.failed(errorMessage(e));
        } catch (RestClientException e) {
            log.error("[Twilio] transport error to={}: {}", to, e.getMessage());
            return SendResult.failed(e.getMessage());
        } catch (Exception e) {
            log.error("[Twilio] unexpected error to={}: {}", to, e.getMessage(), e);
            return SendResult.failed(e.getMessage());
        }
    }

    // Twilio error bodies look like {"code":21211,"message":"...","status":400}
    private String errorMessage(RestClientResponseException e) {
        try {
            JsonNode n = mapper.readTree(e.getResponseBodyAsString());
            if (n.hasNonNull("message")) {
                return n.path("code").asText("") + " - " + n.path("message").asText();
            }
        } catch (Exception ex) {
            log.debug("[Twilio] error body not json: {}", ex.getMessage());
        }
        return "HTTP " + e.getStatusCode().value();
    }
}
