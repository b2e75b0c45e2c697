package io.github.jakubt4.astrolabe.controller;

import io.github.jakubt4.astrolabe.dto.AnalysisRequestBody;
import io.github.jakubt4.astrolabe.service.dispatch.AnalysisResult;
import io.github.jakubt4.astrolabe.service.dispatch.ServiceDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint in front of the {@link ServiceDispatcher}.
 *
 * <p>Failures are turned into status codes by {@link AnalysisExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final ServiceDispatcher serviceDispatcher;

    /**
     * Runs one catalog analysis.
     *
     * @param analysisId catalog id, e.g. {@code birth-chart}
     * @param body       birth data, optional second birth, as-of date and parameters
     * @return {@code 200 OK} with the analysis result
     */
    @PostMapping("/{analysisId}")
    public ResponseEntity<AnalysisResult> analyze(@PathVariable final String analysisId,
                                                  @RequestBody final AnalysisRequestBody body) {
        log.info("Analysis [{}] requested", analysisId);
        return ResponseEntity.ok(serviceDispatcher.invoke(body.toRequest(analysisId)));
    }
}
