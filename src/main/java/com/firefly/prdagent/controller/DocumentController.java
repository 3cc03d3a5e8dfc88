package com.firefly.prdagent.controller;

import com.firefly.prdagent.citation.DocCitation;
import com.firefly.prdagent.citation.DocCitationExtractor;
import com.firefly.prdagent.dto.CitationRequest;
import com.firefly.prdagent.entity.PrdDocument;
import com.firefly.prdagent.service.ChatSessionService;
import com.firefly.prdagent.vo.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final ChatSessionService chatSessionService;
    private final DocCitationExtractor citationExtractor;

    @PostMapping("/{documentId}/citations")
    public ResponseEntity<ApiResponse<List<DocCitation>>> citations(@PathVariable String documentId,
                                                                    @Valid @RequestBody CitationRequest request) {
        PrdDocument document = chatSessionService.requireDocument(documentId);
        int max = request.getMaxCitations() != null ? request.getMaxCitations() : DocCitationExtractor.DEFAULT_MAX_CITATIONS;
        List<DocCitation> citations = citationExtractor.extract(document.getRawContent(), request.getAnswerText(), max);
        return ResponseEntity.ok(ApiResponse.success(citations));
    }
}
