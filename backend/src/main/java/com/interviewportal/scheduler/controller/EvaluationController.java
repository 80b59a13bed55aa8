package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.dto.DtoMapper;
import com.interviewportal.scheduler.dto.EvaluationResponseDto;
import com.interviewportal.scheduler.dto.EvaluationSubmissionDto;
import com.interviewportal.scheduler.dto.EvaluationSummaryDto;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.EvaluationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/interviews/{interviewId}/evaluations")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;

    @PutMapping
    public EvaluationResponseDto submitEvaluation(Caller caller,
                                                  @PathVariable UUID interviewId,
                                                  @RequestBody EvaluationSubmissionDto dto) {
        return DtoMapper.toDto(evaluationService.submitEvaluation(caller, interviewId, dto));
    }

    @GetMapping
    public List<EvaluationResponseDto> listEvaluations(@PathVariable UUID interviewId) {
        return evaluationService.listEvaluations(interviewId).stream()
                .map(DtoMapper::toDto)
                .collect(Collectors.toList());
    }

    @GetMapping("/summary")
    public EvaluationSummaryDto summarize(@PathVariable UUID interviewId) {
        return evaluationService.summarize(interviewId);
    }
}
