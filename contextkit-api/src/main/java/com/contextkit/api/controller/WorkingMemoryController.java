package com.contextkit.api.controller;

import com.contextkit.api.dto.request.StateRequest;
import com.contextkit.api.dto.request.TurnRequest;
import com.contextkit.core.working.InMemoryWorkingState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Feeds the in-memory working state behind the dynamic prompt layer.
 */
@RestController
@RequestMapping("/api/v1/working-memory")
@RequiredArgsConstructor
public class WorkingMemoryController {

    private final InMemoryWorkingState workingState;

    @PostMapping("/turns")
    public ResponseEntity<Map<String, Object>> recordTurn(@Valid @RequestBody TurnRequest request) {
        workingState.recordTurn(request.getText());
        return ResponseEntity.ok(Map.of("turns", workingState.turnCount()));
    }

    @PutMapping("/state/{key}")
    public ResponseEntity<Map<String, Object>> putState(
            @PathVariable String key,
            @Valid @RequestBody StateRequest request) {
        workingState.putState(key, request.getValue());
        return ResponseEntity.ok(Map.of("key", key, "value", request.getValue()));
    }

    @DeleteMapping("/state/{key}")
    public ResponseEntity<Void> removeState(@PathVariable String key) {
        workingState.removeState(key);
        return ResponseEntity.noContent().build();
    }
}
