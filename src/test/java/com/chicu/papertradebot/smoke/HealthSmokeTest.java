package com.chicu.papertradebot.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class HealthSmokeTest {

    @LocalServerPort
    int port;

    TestRestTemplate rest = new TestRestTemplate();

    @Test
    @SuppressWarnings({"rawtypes", "unchecked"})
    void actuatorHealthShouldBeUp_andReportRiskWatcher() {
        String url = "http://localhost:" + port + "/actuator/health";
        ResponseEntity<Map> resp = rest.getForEntity(url, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("UP", resp.getBody().get("status"));

        Map<String, Object> components = (Map<String, Object>) resp.getBody().get("components");
        assertNotNull(components, "show-details=always должен отдавать компоненты");

        Map<String, Object> riskWatcher = (Map<String, Object>) components.get("riskWatcher");
        assertNotNull(riskWatcher);
        assertEquals("UP", riskWatcher.get("status"));
    }
}
