package com.tracker.hierarchy.controller;

import com.tracker.hierarchy.model.ExtractionSummary;
import com.tracker.hierarchy.model.FinalNode;
import com.tracker.hierarchy.model.HierarchyRequest;
import com.tracker.hierarchy.service.FetchInterruptedException;
import com.tracker.hierarchy.service.RootNotFoundException;
import com.tracker.hierarchy.service.impl.HierarchyServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchy extraction REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/hierarchy")
public class HierarchyController {

    @Autowired
    private HierarchyServiceImpl hierarchyService;

    /**
     * Extract and store the hierarchy under one root epic.
     *
     * @param request root and options
     * @return extraction statistics
     */
    @PostMapping("/extract")
    public ExtractionSummary extract(@RequestBody HierarchyRequest request) {
        log.info("Received extraction request: root={}, strategy={}",
                request.rootLocator(), request.getStrategy());
        return hierarchyService.extract(request);
    }

    /**
     * Stored nodes of one root, in assembly order.
     */
    @GetMapping("/nodes")
    public List<FinalNode> nodes(@RequestParam("rootId") String rootId) {
        return hierarchyService.getNodes(rootId);
    }

    @ExceptionHandler(RootNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleRootNotFound(RootNotFoundException e) {
        log.error("[Input] root not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException e) {
        log.error("[Input] invalid request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(FetchInterruptedException.class)
    public ResponseEntity<Map<String, String>> handleInterrupted(FetchInterruptedException e) {
        log.error("[Input] extraction interrupted: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
