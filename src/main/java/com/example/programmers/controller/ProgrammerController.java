package com.example.programmers.controller;

import com.example.programmers.dto.OnCreate;
import com.example.programmers.dto.ProgrammerForm;
import com.example.programmers.dto.ProgrammerResponse;
import com.example.programmers.entity.Programmer;
import com.example.programmers.service.ProgrammerService;
import jakarta.validation.groups.Default;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resource controller for programmers. Every route answers with or without a {@code .json}
 * suffix, and writes accept JSON as well as form-encoded bodies.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ProgrammerController {
    private static final Logger logger = LoggerFactory.getLogger(ProgrammerController.class);

    private static final String COLLECTION = "/programmers";
    private static final String COLLECTION_JSON = "/programmers.json";
    private static final String MEMBER = "/programmers/{id}";
    private static final String MEMBER_JSON = "/programmers/{id}.json";

    private final ProgrammerService programmerService;

    @GetMapping({COLLECTION, COLLECTION_JSON})
    public List<ProgrammerResponse> index() {
        List<ProgrammerResponse> responses = programmerService.findAll().stream()
            .map(this::mapToResponse)
            .collect(Collectors.toList());
        logger.debug("Listing {} programmers", responses.size());
        return responses;
    }

    @GetMapping({MEMBER, MEMBER_JSON})
    public ProgrammerResponse show(@PathVariable Long id) {
        return mapToResponse(programmerService.findById(id));
    }

    @PostMapping(value = {COLLECTION, COLLECTION_JSON}, consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProgrammerResponse> createFromJson(
        @Validated({Default.class, OnCreate.class}) @RequestBody ProgrammerForm form) {
        return created(programmerService.create(form));
    }

    @PostMapping(value = {COLLECTION, COLLECTION_JSON}, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<ProgrammerResponse> createFromForm(
        @Validated({Default.class, OnCreate.class}) @ModelAttribute ProgrammerForm form) {
        return created(programmerService.create(form));
    }

    @RequestMapping(value = {MEMBER, MEMBER_JSON}, method = {RequestMethod.PUT, RequestMethod.PATCH},
        consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProgrammerResponse updateFromJson(@PathVariable Long id,
                                             @Validated @RequestBody ProgrammerForm form) {
        return mapToResponse(programmerService.update(id, form));
    }

    @RequestMapping(value = {MEMBER, MEMBER_JSON}, method = {RequestMethod.PUT, RequestMethod.PATCH},
        consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ProgrammerResponse updateFromForm(@PathVariable Long id,
                                             @Validated @ModelAttribute ProgrammerForm form) {
        return mapToResponse(programmerService.update(id, form));
    }

    @DeleteMapping({MEMBER, MEMBER_JSON})
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void destroy(@PathVariable Long id) {
        programmerService.delete(id);
    }

    private ResponseEntity<ProgrammerResponse> created(Programmer programmer) {
        URI location = ServletUriComponentsBuilder.fromCurrentContextPath()
            .path("/api/programmers/{id}")
            .buildAndExpand(programmer.getId())
            .toUri();
        return ResponseEntity.created(location).body(mapToResponse(programmer));
    }

    private ProgrammerResponse mapToResponse(Programmer programmer) {
        ProgrammerResponse response = new ProgrammerResponse();
        response.setId(programmer.getId());
        response.setName(programmer.getName());
        response.setAge(programmer.getAge());
        response.setCreatedAt(programmer.getCreatedAt());
        response.setUpdatedAt(programmer.getUpdatedAt());
        return response;
    }
}
