package com.relaygate.api.controller;

import com.relaygate.api.dto.request.BenchmarkRequest;
import com.relaygate.api.dto.request.ProviderTestRequest;
import com.relaygate.api.exception.CompletionFailedException;
import com.relaygate.api.exception.ProviderNotFoundException;
import com.relaygate.llm.benchmark.BenchmarkReport;
import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.EngineStatus;
import com.relaygate.llm.model.KeyUsageReport;
import com.relaygate.llm.model.ModelEntry;
import com.relaygate.llm.model.ProviderDescriptor;
import com.relaygate.llm.model.ProviderUsage;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.service.UnifiedLlmService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Operator endpoints: engine status, per-key usage, direct provider tests and runtime controls.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ProviderController {

    private final UnifiedLlmService llmService;

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderDescriptor>> listProviders() {
        return ResponseEntity.ok(llmService.listProviders());
    }

    @GetMapping("/providers/status")
    public ResponseEntity<EngineStatus> status() {
        return ResponseEntity.ok(llmService.getStatus());
    }

    @GetMapping("/providers/usage")
    public ResponseEntity<Map<String, ProviderUsage>> usage() {
        return ResponseEntity.ok(llmService.getUsageStats());
    }

    @GetMapping("/providers/{name}/keys")
    public ResponseEntity<Map<String, KeyUsageReport>> keyReport(@PathVariable String name) {
        return llmService.getKeyReport(name)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ProviderNotFoundException(name));
    }

    @PostMapping("/providers/{name}/test")
    public ResponseEntity<RequestOutcome> testProvider(
            @PathVariable String name,
            @RequestBody(required = false) ProviderTestRequest request
    ) {
        String message = request != null ? request.getMessage() : null;
        RequestOutcome outcome = llmService.testProvider(name, message);
        if (outcome.hasErrorKind(ErrorKind.PROVIDER_NOT_FOUND)) {
            throw new CompletionFailedException(outcome);
        }
        log.info("[API] Provider test | provider={} | success={} | kind={}", name, outcome.isSuccess(), outcome.getErrorKind());
        return ResponseEntity.ok(outcome);
    }

    /**
     * Sets the enabled flag, or flips it when {@code enabled} is omitted.
     */
    @PostMapping("/providers/{name}/toggle")
    public ResponseEntity<Map<String, Object>> toggle(
            @PathVariable String name,
            @RequestParam(required = false) Boolean enabled
    ) {
        ProviderDescriptor provider = llmService.listProviders().stream()
                .filter(p -> p.id().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new ProviderNotFoundException(name));

        boolean target = enabled != null ? enabled : !provider.enabled();
        llmService.setProviderEnabled(provider.id(), target);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("provider", provider.id());
        response.put("enabled", target);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/providers/{name}/roll-key")
    public ResponseEntity<Map<String, Object>> rollKey(@PathVariable String name) {
        if (llmService.getKeyReport(name).isEmpty()) {
            throw new ProviderNotFoundException(name);
        }
        OptionalInt index = llmService.rollCredential(name);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("provider", name);
        response.put("rotated", index.isPresent());
        if (index.isPresent()) {
            response.put("currentKey", "Key #" + (index.getAsInt() + 1));
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/providers/benchmark")
    public ResponseEntity<BenchmarkReport> benchmark(@Valid @RequestBody(required = false) BenchmarkRequest request) {
        BenchmarkRequest effective = request != null ? request : new BenchmarkRequest();
        int iterations = effective.getIterations() != null ? effective.getIterations() : 3;
        boolean optimize = Boolean.TRUE.equals(effective.getOptimizePriorities());
        return ResponseEntity.ok(llmService.runBenchmark(iterations, optimize));
    }

    @GetMapping("/autodecide/{model}")
    public ResponseEntity<Map<String, Object>> autodecide(@PathVariable String model) {
        List<ModelEntry> providers = llmService.findModelProviders(model);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("model", model);
        response.put("found", !providers.isEmpty());
        response.put("providers", providers);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/models/refresh")
    public ResponseEntity<Map<String, Object>> refreshModels() {
        boolean refreshed = llmService.refreshModels();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("refreshed", refreshed);
        response.put("models", llmService.listModels().size());
        return ResponseEntity.ok(response);
    }
}
