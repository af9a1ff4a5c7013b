package com.neuralroots.orchestrator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class WorkflowOrchestratorApplicationTest {

    @Autowired
    private WebTestClient client;

    @Test
    @DisplayName("seeded application assesses a Pune tomato batch end to end")
    void assessWithSeed() {
        client.post().uri("/api/v1/workflow/assess")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"cropName":"tomato","temperature":22,"humidity":85,"ageHours":8,"quantity":200,
                 "origin":"Pune, Maharashtra","destination":"Mumbai","distanceKm":150,
                 "urgency":"HIGH","targetMarket":"Pune"}
                """)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.market.comparableCount").isEqualTo(3)
            .jsonPath("$.logistics.carriers[0].carrierId").isEqualTo("CR-PUN-01")
            .jsonPath("$.weather.source").isEqualTo("fetched");

        client.get().uri("/api/v1/workflow/health").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.workflowsExecuted").isEqualTo(1)
            .jsonPath("$.historySize").isEqualTo(1);
    }
}
