package com.minipivot.api.controller;

import javax.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.minipivot.api.entity.request.CreateSessionRequest;
import com.minipivot.api.entity.request.DecisionRequest;
import com.minipivot.api.entity.request.PivotSubmitRequest;
import com.minipivot.api.entity.response.PivotResponse;
import com.minipivot.api.entity.response.SessionCreateResponse;
import com.minipivot.api.exception.SessionNotFoundException;
import com.minipivot.api.service.PivotService;
import com.minipivot.api.session.SessionManager;
import com.minipivot.backend.session.SessionStatus;

@RestController
@RequestMapping("/api/sessions")
@Validated
public class SessionController {

    private final SessionManager sessionManager;
    private final PivotService pivotService;

    public SessionController(SessionManager sessionManager, PivotService pivotService) {
        this.sessionManager = sessionManager;
        this.pivotService = pivotService;
    }

    @PostMapping
    public ResponseEntity<PivotResponse<SessionCreateResponse>> createSession(@Valid @RequestBody CreateSessionRequest request) {
        PivotResponse<SessionCreateResponse> response = pivotService.createSession(request.getRecords());
        if (!response.isSuccess()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{sessionId}/pivot")
    public ResponseEntity<PivotResponse<SessionStatus>> submit(@PathVariable String sessionId,
                                                               @Valid @RequestBody PivotSubmitRequest request) {
        return ResponseEntity.ok(pivotService.submit(sessionId, request));
    }

    @GetMapping("/{sessionId}/pivot")
    public ResponseEntity<PivotResponse<SessionStatus>> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(pivotService.status(sessionId));
    }

    @PostMapping("/{sessionId}/decision")
    public ResponseEntity<PivotResponse<SessionStatus>> decide(@PathVariable String sessionId,
                                                               @Valid @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(pivotService.decide(sessionId, request.getProceed()));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        boolean removed = sessionManager.closeSession(sessionId);
        if (removed) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<PivotResponse<Void>> handleSessionNotFound(SessionNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(PivotResponse.failure(ex.getMessage()));
    }
}
