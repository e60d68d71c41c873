package com.phillippitts.vibedj;

import com.phillippitts.vibedj.service.catalog.CatalogIndex;
import com.phillippitts.vibedj.service.catalog.IndexedCatalogIndex;
import com.phillippitts.vibedj.service.coordinator.DjCoordinator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "spring.datasource.url=jdbc:h2:mem:vibedj-context;DB_CLOSE_DELAY=-1", // no file database in tests
        "dj.oracle.vibe-url=http://localhost:1/vibe",
        "dj.oracle.recommender-url=http://localhost:1/recommend"
    }
)
class VibeDjApplicationTests {

    @Autowired
    private DjCoordinator coordinator;

    @Autowired
    private CatalogIndex catalogIndex;

    @Autowired
    private TestRestTemplate rest;

    @Test
    void contextLoads() {
        assertThat(coordinator.isRunning()).isTrue();
        assertThat(coordinator.getStatus().enabled()).isFalse();
        assertThat(catalogIndex).isInstanceOf(IndexedCatalogIndex.class);
    }

    @Test
    void shouldEnableAndDisableThroughRestApi() {
        ResponseEntity<Map> enabled = rest.postForEntity("/api/dj/enable?continuous=false", null, Map.class);

        assertThat(enabled.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        await().until(() -> coordinator.getStatus().enabled());
        assertThat(coordinator.getStatus().continuousMode()).isFalse();

        ResponseEntity<Map> status = rest.getForEntity("/api/dj/status?strict=true", Map.class);
        assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(status.getBody()).containsEntry("enabled", true);

        rest.postForEntity("/api/dj/disable", null, Map.class);
        await().until(() -> !coordinator.getStatus().enabled());
    }

    @Test
    void shouldRejectUnknownWeightScope() {
        ResponseEntity<Map> response = rest.postForEntity(
                "/api/dj/weights/set?scope=album&genre=jazz&factor=0", null, Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

}
