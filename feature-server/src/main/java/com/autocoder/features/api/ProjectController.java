package com.autocoder.features.api;

import com.autocoder.features.api.dto.StopStatusResponse;
import com.autocoder.features.service.StopSignalService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Graceful stop of the running agent.
 *
 * POST   /project/stop — ask the agent to stop after its current feature
 * GET    /project/stop — is a stop pending?
 * DELETE /project/stop — withdraw a pending stop request
 */
@RestController
@RequestMapping("/project/stop")
public class ProjectController {

    private final StopSignalService stopSignal;

    public ProjectController(StopSignalService stopSignal) {
        this.stopSignal = stopSignal;
    }

    @PostMapping
    public ResponseEntity<StopStatusResponse> requestStop() {
        stopSignal.requestStop();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status());
    }

    @GetMapping
    public StopStatusResponse getStatus() {
        return status();
    }

    @DeleteMapping
    public StopStatusResponse clearStop() {
        stopSignal.clearStop();
        return status();
    }

    private StopStatusResponse status() {
        return new StopStatusResponse(stopSignal.isStopRequested(), stopSignal.stopFile().toString());
    }
}
