package com.backupcenter.server.service.agent;

import com.backupcenter.server.model.agent.AgentBackupInfo;
import com.backupcenter.server.model.agent.AgentBackupsResponse;
import com.backupcenter.server.model.agent.AgentHttpResponse;
import com.backupcenter.server.model.entity.AgentEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AgentClientTest {

    private MockRestServiceServer server;

    private AgentClient agentClient;

    private AgentEntity agent;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        this.server = MockRestServiceServer.bindTo(builder).build();
        this.agentClient = new AgentClient(builder.build());
        this.agent = new AgentEntity();
        this.agent.setName("web-01");
        this.agent.setIpAddress("10.0.0.5");
    }

    @Test
    void ShouldPingRootPathWhenPortDefault() {
        this.server.expect(requestTo("http://10.0.0.5:11540/ping"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("pong", MediaType.TEXT_PLAIN));

        AgentHttpResponse<String> response = this.agentClient.ping(this.agent);

        assertTrue(response.isSuccess());
        assertEquals("pong", response.getData());
        this.server.verify();
    }

    @Test
    void ShouldParseSnakeCaseWhenBackupsListed() {
        this.agent.setPort(9000);
        this.server.expect(requestTo("http://10.0.0.5:9000/api/backups"))
                .andRespond(withSuccess("{\"backups\": [{\"source_path\": \"/var/www\", "
                        + "\"archive_name\": \"www.tar.gz\", \"backup_date\": \"2024-01-01T02:00:00\", "
                        + "\"archive_size_mb\": 12.5, \"status\": \"error\", "
                        + "\"error_message\": \"disk full\", \"extra\": 1}]}", MediaType.APPLICATION_JSON));

        AgentHttpResponse<AgentBackupsResponse> response = this.agentClient.getBackups(this.agent);

        assertTrue(response.isSuccess());
        AgentBackupInfo backup = response.getData().getBackups().get(0);
        assertEquals("/var/www", backup.getSourcePath());
        assertEquals(12.5, backup.getArchiveSizeMb());
        assertEquals("disk full", backup.getErrorMessage());
    }

    @Test
    void ShouldReturnErrorWhenAgentAnswersNon2xx() {
        this.server.expect(requestTo("http://10.0.0.5:11540/api/system"))
                .andRespond(withServerError().body("boom"));

        AgentHttpResponse<?> response = this.agentClient.getSystemInfo(this.agent);

        assertFalse(response.isSuccess());
        assertEquals(500, response.getHttpCode());
        assertTrue(response.getTransportException().getMessage().contains("boom"));
    }
}
