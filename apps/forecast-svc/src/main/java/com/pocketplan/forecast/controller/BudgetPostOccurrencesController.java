package com.pocketplan.forecast.controller;

import com.pocketplan.forecast.controller.dto.BulkOccurrencesResponseDto;
import com.pocketplan.forecast.controller.dto.OccurrenceDto;
import com.pocketplan.forecast.controller.dto.OccurrencesResponseDto;
import com.pocketplan.forecast.controller.dto.PostOccurrencesResponseDto;
import com.pocketplan.forecast.controller.dto.PreviewOccurrencesRequestDto;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.preview.TimelinePreviewService;
import com.pocketplan.forecast.service.OccurrenceService;
import com.pocketplan.forecast.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budgets/{budgetId}/budget-posts")
public class BudgetPostOccurrencesController {

    private final TimelinePreviewService previewService;
    private final OccurrenceService occurrenceService;
    private final RecurrencePatternMapper patternMapper;

    public BudgetPostOccurrencesController(
            TimelinePreviewService previewService,
            OccurrenceService occurrenceService,
            RecurrencePatternMapper patternMapper
    ) {
        this.previewService = previewService;
        this.occurrenceService = occurrenceService;
        this.patternMapper = patternMapper;
    }

    // Draft patterns; nothing is looked up or saved
    @PostMapping("/preview-occurrences")
    public ResponseEntity<OccurrencesResponseDto> previewOccurrences(
            @PathVariable("budgetId") UUID budgetId,
            @Valid @RequestBody PreviewOccurrencesRequestDto request
    ) {
        DateWindow window = new DateWindow(request.fromDate(), request.toDate());
        List<Occurrence> occurrences = previewService.preview(patternMapper.toAmountPatterns(request.amountPatterns()), window);
        return ResponseEntity.ok(new OccurrencesResponseDto(map(occurrences), traceId()));
    }

    @GetMapping("/{budgetPostId}/occurrences")
    public ResponseEntity<PostOccurrencesResponseDto> getPostOccurrences(
            @PathVariable("budgetId") UUID budgetId,
            @PathVariable("budgetPostId") UUID budgetPostId,
            @RequestParam(value = "from_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(value = "to_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate
    ) {
        OccurrenceService.PostOccurrences result = occurrenceService.forPost(budgetId, budgetPostId, fromDate, toDate);
        return ResponseEntity.ok(map(result));
    }

    @GetMapping("/occurrences")
    public ResponseEntity<BulkOccurrencesResponseDto> getBudgetOccurrences(
            @PathVariable("budgetId") UUID budgetId,
            @RequestParam(value = "from_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(value = "to_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate
    ) {
        List<PostOccurrencesResponseDto> data = occurrenceService.forBudget(budgetId, fromDate, toDate).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new BulkOccurrencesResponseDto(data, traceId()));
    }

    private PostOccurrencesResponseDto map(OccurrenceService.PostOccurrences postOccurrences) {
        return new PostOccurrencesResponseDto(postOccurrences.budgetPostId(), map(postOccurrences.occurrences()));
    }

    private List<OccurrenceDto> map(List<Occurrence> occurrences) {
        return occurrences.stream()
                .map(occurrence -> new OccurrenceDto(occurrence.patternIndex(), occurrence.date(), occurrence.amount()))
                .toList();
    }

    private static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
