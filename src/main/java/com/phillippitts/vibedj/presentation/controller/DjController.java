package com.phillippitts.vibedj.presentation.controller;

import com.phillippitts.vibedj.config.properties.CoordinatorProperties;
import com.phillippitts.vibedj.domain.PickResult;
import com.phillippitts.vibedj.domain.ScoredCandidate;
import com.phillippitts.vibedj.domain.WeightScope;
import com.phillippitts.vibedj.service.coordinator.DjCoordinator;
import com.phillippitts.vibedj.service.coordinator.DjStatus;
import com.phillippitts.vibedj.service.weights.WeightChange;
import com.phillippitts.vibedj.service.weights.WeightOverrideService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator controls for the DJ: enable/disable, continuous mode, manual picks, backups,
 * status and sampling weight overrides.
 */
@RestController
@RequestMapping("/api/dj")
class DjController {

    private static final Logger LOG = LogManager.getLogger(DjController.class);

    private final DjCoordinator coordinator;
    private final WeightOverrideService weights;
    private final Duration pickTimeout;
    private final Duration statusTimeout;

    DjController(DjCoordinator coordinator, WeightOverrideService weights, CoordinatorProperties props) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.pickTimeout = Duration.ofMillis(props.getPickTimeoutMs());
        this.statusTimeout = Duration.ofMillis(props.getJoinTimeoutMs());
    }

    @PostMapping("/enable")
    ResponseEntity<Map<String, Object>> enable(@RequestParam(defaultValue = "true") boolean continuous) {
        LOG.info("Enable requested (continuous={})", continuous);
        coordinator.enable(continuous);
        return ResponseEntity.accepted().body(Map.of("enabled", true, "continuous", continuous));
    }

    @PostMapping("/disable")
    ResponseEntity<Map<String, Object>> disable() {
        LOG.info("Disable requested");
        coordinator.disable();
        return ResponseEntity.accepted().body(Map.of("enabled", false));
    }

    @PostMapping("/settings")
    ResponseEntity<Map<String, Object>> settings(@RequestParam boolean continuous) {
        coordinator.setContinuousMode(continuous);
        return ResponseEntity.accepted().body(Map.of("continuous", continuous));
    }

    /**
     * Picks without queueing. 204 when nothing was picked (disabled, busy or timed out).
     */
    @PostMapping("/pick")
    ResponseEntity<PickResult> pick(@RequestParam(defaultValue = "manual") String reason) {
        return orNoContent(coordinator.pickSong(reason, pickTimeout));
    }

    @PostMapping("/pick_once")
    ResponseEntity<PickResult> pickOnce(@RequestParam(defaultValue = "manual") String reason) {
        return orNoContent(coordinator.pickSongOnce(reason, pickTimeout));
    }

    @PostMapping("/pick_and_queue")
    ResponseEntity<Map<String, Object>> pickAndQueue(@RequestParam(defaultValue = "manual") String reason) {
        coordinator.requestPickAndQueue(reason);
        return ResponseEntity.accepted().body(Map.of("requested", true, "reason", reason));
    }

    @PostMapping("/backup")
    ResponseEntity<ScoredCandidate> backup(@RequestParam(defaultValue = "true") boolean queue) {
        return orNoContent(coordinator.useBackup(queue, pickTimeout));
    }

    /**
     * Approximate snapshot by default; {@code strict=true} round-trips through the loop.
     */
    @GetMapping("/status")
    ResponseEntity<DjStatus> status(@RequestParam(defaultValue = "false") boolean strict) {
        if (!strict) {
            return ResponseEntity.ok(coordinator.getStatus());
        }
        return coordinator.getStatusStrict(statusTimeout)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }

    @PostMapping("/weights/adjust")
    ResponseEntity<WeightChange> adjustWeight(@RequestParam String scope,
                                              @RequestParam(required = false) String title,
                                              @RequestParam(required = false) String artist,
                                              @RequestParam(required = false) String genre,
                                              @RequestParam double delta) {
        WeightScope s = parseScope(scope);
        return ResponseEntity.ok(weights.adjust(s, WeightOverrideService.keyFor(s, title, artist, genre), delta));
    }

    @PostMapping("/weights/set")
    ResponseEntity<WeightChange> setWeight(@RequestParam String scope,
                                           @RequestParam(required = false) String title,
                                           @RequestParam(required = false) String artist,
                                           @RequestParam(required = false) String genre,
                                           @RequestParam double factor) {
        WeightScope s = parseScope(scope);
        return ResponseEntity.ok(weights.set(s, WeightOverrideService.keyFor(s, title, artist, genre), factor));
    }

    private static WeightScope parseScope(String scope) {
        return WeightScope.parse(scope)
                .orElseThrow(() -> new IllegalArgumentException("Unknown weight scope: " + scope));
    }

    private static <T> ResponseEntity<T> orNoContent(Optional<T> value) {
        return value.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }
}
