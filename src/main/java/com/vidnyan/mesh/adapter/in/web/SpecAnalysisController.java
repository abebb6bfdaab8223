package com.vidnyan.mesh.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.mesh.application.port.in.AnalyzeImpactUseCase;
import com.vidnyan.mesh.application.port.in.ValidateSpecUseCase;
import com.vidnyan.mesh.application.port.out.SpecificationLoadException;
import com.vidnyan.mesh.application.port.out.SpecificationLoader;
import com.vidnyan.mesh.application.port.out.SpecificationLoader.LoadedSpecification;
import com.vidnyan.mesh.domain.graph.ChangeType;
import com.vidnyan.mesh.domain.graph.ImpactAnalysis;
import com.vidnyan.mesh.domain.graph.NodeKind;
import com.vidnyan.mesh.domain.graph.SpecSlice;
import com.vidnyan.mesh.domain.rule.ValidationReport;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

/**
 * REST API for validating specifications and querying their dependency graph.
 * Every request carries the specification document itself.
 */
@Slf4j
@RestController
@RequestMapping("/api/spec")
@RequiredArgsConstructor
public class SpecAnalysisController {

    private final SpecificationLoader specificationLoader;
    private final ValidateSpecUseCase validateSpecUseCase;
    private final AnalyzeImpactUseCase analyzeImpactUseCase;

    @PostMapping("/validate")
    public ValidationReport validate(@RequestBody JsonNode specification) {
        log.info("Received validation request");
        return validateSpecUseCase.validate(load(specification));
    }

    @PostMapping("/impact")
    public ImpactAnalysis impact(@RequestBody ImpactRequest request) {
        log.info("Received impact request: {} {}:{}", request.changeType(), request.kind(), request.name());
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Impact target name is required");
        }
        NodeKind kind = NodeKind.fromPrefix(request.kind())
                .orElseThrow(() -> new IllegalArgumentException("Unknown element kind '" + request.kind() + "'"));
        ChangeType changeType = parseChangeType(request.changeType());
        return analyzeImpactUseCase.analyzeImpact(
                load(request.specification()).specification(), kind, request.name(), changeType);
    }

    @PostMapping("/slice/{function}")
    public SpecSlice slice(@PathVariable("function") String function, @RequestBody JsonNode specification) {
        log.info("Received slice request for function {}", function);
        return analyzeImpactUseCase.slice(load(specification).specification(), function);
    }

    @PostMapping("/slice/{function}/specification")
    public Specification sliceSpecification(@PathVariable("function") String function,
                                            @RequestBody JsonNode specification) {
        log.info("Received slice specification request for function {}", function);
        return analyzeImpactUseCase.sliceSpecification(load(specification).specification(), function);
    }

    @GetMapping("/health")
    public String health() {
        return "OK - Mesh specification integrity engine";
    }

    @ExceptionHandler({IllegalArgumentException.class, SpecificationLoadException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse badRequest(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return new ErrorResponse(e.getMessage());
    }

    private LoadedSpecification load(JsonNode specification) {
        if (specification == null || !specification.isObject()) {
            throw new IllegalArgumentException("Request must carry a specification object");
        }
        return specificationLoader.parse(specification.toString());
    }

    private static ChangeType parseChangeType(String value) {
        if (value == null) {
            return ChangeType.MODIFY;
        }
        try {
            return ChangeType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown change type '" + value + "'", e);
        }
    }

    /**
     * {@code kind} is a node prefix such as {@code entity} or {@code state_machine};
     * {@code changeType} defaults to MODIFY.
     */
    public record ImpactRequest(
        JsonNode specification,
        String kind,
        String name,
        String changeType
    ) {}

    public record ErrorResponse(String error) {}
}
