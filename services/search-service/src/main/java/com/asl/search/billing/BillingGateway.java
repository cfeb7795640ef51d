package com.asl.search.billing;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class BillingGateway implements BillingLedger {
    private final RestTemplate restTemplate;
    private final BillingProperties properties;

    public BillingGateway(@Qualifier("billingRestTemplate") RestTemplate restTemplate, BillingProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public void billTeam(String teamId, Long apiKeyId, int credits) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("team_id", teamId);
        if (apiKeyId != null) {
            body.put("api_key_id", apiKeyId);
        }
        body.put("credits", credits);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.exchange(buildUrl("/credits/bill"), HttpMethod.POST, new HttpEntity<>(body, headers), Void.class);
        } catch (ResourceAccessException e) {
            throw new BillingUnavailableException("Billing service unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new BillingUnavailableException("Billing service error: " + e.getStatusCode(), e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
