package io.teleops.api.v1;

import io.teleops.evaluation.BenchmarkReport;
import io.teleops.evaluation.EvaluationReport;
import io.teleops.evaluation.EvaluationService;
import io.teleops.evaluation.RcaBenchmarkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST API controller for hypothesis quality evaluation and latency benchmarks.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/evaluation")
@Tag(name = "Evaluation", description = "Hypothesis quality and latency evaluation")
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final RcaBenchmarkService benchmarkService;

    public EvaluationController(EvaluationService evaluationService, RcaBenchmarkService benchmarkService) {
        this.evaluationService = evaluationService;
        this.benchmarkService = benchmarkService;
    }

    @PostMapping("/run")
    @Operation(summary = "Run evaluation",
               description = "Grade every hypothesis source against synthetic scenarios and manual labels")
    public Mono<ResponseEntity<EvaluationReport>> run(
            @Parameter(description = "Number of synthetic scenarios; configured default when absent")
            @RequestParam(required = false) Integer runs) {

        return Mono.fromCallable(() -> ResponseEntity.ok(
                        runs != null ? evaluationService.run(runs) : evaluationService.run()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/benchmark")
    @Operation(summary = "Benchmark RCA latency", description = "Time the baseline matcher over synthetic scenarios")
    public Mono<ResponseEntity<BenchmarkReport>> benchmark(
            @Parameter(description = "Number of scenarios; configured default when absent")
            @RequestParam(required = false) Integer runs) {

        return Mono.fromCallable(() -> ResponseEntity.ok(
                        runs != null ? benchmarkService.run(runs) : benchmarkService.run()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
