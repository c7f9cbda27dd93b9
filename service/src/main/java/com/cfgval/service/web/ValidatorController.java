package com.cfgval.service.web;

import com.cfgval.generator.enumerate.EnumerationBounds;
import com.cfgval.service.ValidationReport;
import com.cfgval.service.ValidatorService;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.server.mvc.WebMvcLinkBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/validator")
class ValidatorController {

    private final ValidatorService validatorService;

    ValidatorController(ValidatorService validatorService) {
        this.validatorService = validatorService;
    }

    @GetMapping(value = "/message", produces = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<String> message() {
        return ResponseEntity.ok(validatorService.message());
    }

    /**
     * Generates the bounded word sample of grammar {@code id} and reports whether {@code word} is
     * in it. A {@code false} answer only means the word was not found within the bounds.
     */
    @GetMapping("/validate/{id}")
    EntityModel<ValidationReport> validate(
            @PathVariable String id,
            @RequestParam(required = false) String word,
            @RequestParam(defaultValue = "10") int maxDepth,
            @RequestParam(defaultValue = "1000") int maxWords,
            @RequestParam(defaultValue = "30") int maxTokens) {
        EnumerationBounds bounds;
        try {
            bounds = new EnumerationBounds(maxDepth, maxWords, maxTokens);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }

        ValidationReport report =
                validatorService
                        .validate(id, word, bounds)
                        .orElseThrow(
                                () ->
                                        new ResponseStatusException(
                                                HttpStatus.NOT_FOUND, "Grammar not found: " + id));

        return EntityModel.of(
                report,
                WebMvcLinkBuilder.linkTo(
                                WebMvcLinkBuilder.methodOn(ValidatorController.class)
                                        .validate(id, word, maxDepth, maxWords, maxTokens))
                        .withSelfRel());
    }
}
