package com.backupcenter.server.service.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MattermostServiceTest {

    private static final String WEBHOOK_URL = "https://chat.example.com/hooks/abc123";

    private MockRestServiceServer server;

    private MattermostService mattermostService;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        this.server = MockRestServiceServer.bindTo(builder).build();
        this.mattermostService = new MattermostService(builder.build());
        ReflectionTestUtils.setField(this.mattermostService, "enabled", true);
        ReflectionTestUtils.setField(this.mattermostService, "webhookUrl", WEBHOOK_URL);
        ReflectionTestUtils.setField(this.mattermostService, "username", "Backup Server");
        ReflectionTestUtils.setField(this.mattermostService, "iconUrl", "https://example.com/icon.png");
    }

    @Test
    void ShouldPostPayloadWhenEnabled() {
        this.server.expect(requestTo(WEBHOOK_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.text").value("hello"))
                .andExpect(jsonPath("$.username").value("Backup Server"))
                .andExpect(jsonPath("$.icon_url").value("https://example.com/icon.png"))
                .andRespond(withSuccess());

        assertTrue(this.mattermostService.sendMessage("hello"));
        this.server.verify();
    }

    @Test
    void ShouldReturnFalseWhenWebhookRejects() {
        this.server.expect(requestTo(WEBHOOK_URL)).andRespond(withServerError());
        assertFalse(this.mattermostService.sendMessage("hello"));

        this.server.reset();
        this.server.expect(requestTo(WEBHOOK_URL)).andRespond(withStatus(HttpStatus.CREATED));
        assertFalse(this.mattermostService.sendMessage("hello"));
    }

    @Test
    void ShouldIncludeTaskAndAgentWhenAlerting() {
        this.server.expect(requestTo(WEBHOOK_URL))
                .andExpect(jsonPath("$.text").value(containsString("**Task:** www data")))
                .andExpect(jsonPath("$.text").value(containsString("**Agent:** web-01")))
                .andExpect(jsonPath("$.text").value(containsString("disk full")))
                .andRespond(withSuccess());

        assertTrue(this.mattermostService.sendBackupAlert("www data", "web-01", "disk full"));
    }

    @Test
    void ShouldSkipWhenDisabled() {
        ReflectionTestUtils.setField(this.mattermostService, "enabled", false);

        assertFalse(this.mattermostService.sendMessage("hello"));
        this.server.verify();
    }
}
