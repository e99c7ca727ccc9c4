package com.reasonai.interfaces.api.reasoning;

import com.reasonai.application.reasoning.ReasoningAppService;
import com.reasonai.domain.reasoning.model.PipelineResult;
import com.reasonai.interfaces.api.dto.ReasoningRequest;
import com.reasonai.interfaces.api.dto.ReasoningResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reasoning")
@RequiredArgsConstructor
public class ReasoningController {

    private final ReasoningAppService reasoningAppService;

    @PostMapping
    public ResponseEntity<ReasoningResponse> reason(@Valid @RequestBody ReasoningRequest request) {
        PipelineResult result = reasoningAppService.reason(
                request.prompt(),
                request.context(),
                request.constraints(),
                request.metadata(),
                request.maxTokens(),
                request.temperature());

        return ResponseEntity.ok(ReasoningResponse.from(result));
    }
}
