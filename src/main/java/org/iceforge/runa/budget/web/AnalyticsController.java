package org.iceforge.runa.budget.web;

import jakarta.validation.Valid;
import org.iceforge.runa.budget.model.AnalyticsSeries;
import org.iceforge.runa.budget.model.CountyHeatmapPoint;
import org.iceforge.runa.budget.model.EntityAnalyticsPage;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.model.UatHeatmapPoint;
import org.iceforge.runa.budget.service.AnalyticsError;
import org.iceforge.runa.budget.service.AnalyticsResult;
import org.iceforge.runa.budget.service.AnalyticsSeriesService;
import org.iceforge.runa.budget.service.CountyHeatmapService;
import org.iceforge.runa.budget.service.EntityAnalyticsService;
import org.iceforge.runa.budget.service.NormalizationOptionsResolver;
import org.iceforge.runa.budget.service.UatHeatmapService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    private final UatHeatmapService uatHeatmap;
    private final CountyHeatmapService countyHeatmap;
    private final EntityAnalyticsService entityAnalytics;
    private final AnalyticsSeriesService series;

    public AnalyticsController(UatHeatmapService uatHeatmap,
                               CountyHeatmapService countyHeatmap,
                               EntityAnalyticsService entityAnalytics,
                               AnalyticsSeriesService series) {
        this.uatHeatmap = Objects.requireNonNull(uatHeatmap);
        this.countyHeatmap = Objects.requireNonNull(countyHeatmap);
        this.entityAnalytics = Objects.requireNonNull(entityAnalytics);
        this.series = Objects.requireNonNull(series);
    }

    @PostMapping("/heatmap/uat")
    public Mono<ResponseEntity<List<UatHeatmapPoint>>> uatHeatmap(@Valid @RequestBody AnalyticsRequest req) {
        return uatHeatmap.getHeatmapData(req.getFilter(), options(req)).flatMap(AnalyticsController::toResponse);
    }

    @PostMapping("/heatmap/county")
    public Mono<ResponseEntity<List<CountyHeatmapPoint>>> countyHeatmap(@Valid @RequestBody AnalyticsRequest req) {
        return countyHeatmap.getHeatmapData(req.getFilter(), options(req)).flatMap(AnalyticsController::toResponse);
    }

    @PostMapping("/entities")
    public Mono<ResponseEntity<EntityAnalyticsPage>> entities(@Valid @RequestBody EntityAnalyticsRequest req) {
        return entityAnalytics.getEntityAnalytics(req.getFilter(), options(req), req.getSort(), req.getLimit(), req.getOffset())
                .flatMap(AnalyticsController::toResponse);
    }

    @PostMapping("/series")
    public Mono<ResponseEntity<AnalyticsSeries>> series(@Valid @RequestBody SeriesRequest req) {
        boolean growth = NormalizationOptionsResolver.periodGrowth(req.getFilter(), req.getShowPeriodGrowth());
        return series.getSeries(req.getFilter(), options(req), growth).flatMap(AnalyticsController::toResponse);
    }

    private static TransformationOptions options(AnalyticsRequest req) {
        return NormalizationOptionsResolver.resolve(req.getFilter(), req.getNormalization(), req.getCurrency(), req.getInflationAdjusted());
    }

    private static <T> Mono<ResponseEntity<T>> toResponse(AnalyticsResult<T> result) {
        if (result.isOk()) {
            return Mono.just(ResponseEntity.ok(result.getValue()));
        }
        return Mono.error(new AnalyticsRequestException(result.getError()));
    }

    static HttpStatus statusFor(AnalyticsError.Kind kind) {
        return switch (kind) {
            case MISSING_REQUIRED_FILTER -> HttpStatus.BAD_REQUEST;
            case TIMEOUT_ERROR -> HttpStatus.GATEWAY_TIMEOUT;
            case DATABASE_ERROR, NORMALIZATION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(AnalyticsRequestException.class)
    public ResponseEntity<ErrorResponse> analyticsError(AnalyticsRequestException e) {
        AnalyticsError error = e.getError();
        HttpStatus status = statusFor(error.getKind());
        if (status.is5xxServerError()) {
            log.error("Analytics request failed: {}", error, error.getCause());
        }
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(error.getKind().name(), error.getMessage(), error.isRetryable()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> validationError(WebExchangeBindException e) {
        String detail = e.getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", detail));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> badInput(ServerWebInputException e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", e.getReason()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> serverError(RuntimeException e) {
        log.error("Unexpected failure", e);
        return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("SERVER_ERROR", e.getMessage()));
    }
}
