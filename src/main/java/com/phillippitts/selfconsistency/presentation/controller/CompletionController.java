package com.phillippitts.selfconsistency.presentation.controller;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.AggregateResult;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.DocumentExtractionException;
import com.phillippitts.selfconsistency.exception.ValidationException;
import com.phillippitts.selfconsistency.presentation.dto.ChatCompletionRequestBody;
import com.phillippitts.selfconsistency.presentation.dto.ChatCompletionResponseBody;
import com.phillippitts.selfconsistency.presentation.dto.ChatMessage;
import com.phillippitts.selfconsistency.presentation.dto.CompletionRequestBody;
import com.phillippitts.selfconsistency.presentation.dto.CompletionResponseBody;
import com.phillippitts.selfconsistency.presentation.dto.DocumentInfo;
import com.phillippitts.selfconsistency.service.aggregation.ReasoningAggregationService;
import com.phillippitts.selfconsistency.service.document.DocumentExtractor;
import com.phillippitts.selfconsistency.service.document.ExtractedDocument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Completion endpoints. Thin adapters: map wire parameters onto a {@link PromptRequest} and
 * delegate to {@link ReasoningAggregationService}; errors are rendered by the global handler.
 */
@RestController
class CompletionController {

    private static final Logger LOG = LogManager.getLogger(CompletionController.class);

    private final ReasoningAggregationService aggregationService;
    private final DocumentExtractor documentExtractor;
    private final PromptRequestMapper mapper;

    CompletionController(ReasoningAggregationService aggregationService,
                         DocumentExtractor documentExtractor,
                         ReasoningProperties properties) {
        this.aggregationService = aggregationService;
        this.documentExtractor = documentExtractor;
        this.mapper = new PromptRequestMapper(properties.getDefaults());
    }

    @PostMapping(path = "/v1/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<CompletionResponseBody> complete(@RequestBody CompletionRequestBody body) {
        PromptRequest request = mapper.toRequest(body.prompt(), body.systemPrompt(), null,
                body.numSelfConsistency(), body.numCot(), body.model(), body.temperature());
        AggregateResult result = aggregationService.runAggregation(request);
        return ResponseEntity.ok(new CompletionResponseBody(result, null));
    }

    @PostMapping(path = "/v1/completions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<CompletionResponseBody> completeWithDocument(
            @RequestParam("pdf_file") MultipartFile pdfFile,
            @RequestParam(value = "prompt", required = false) String prompt,
            @RequestParam(value = "system_prompt", required = false) String systemPrompt,
            @RequestParam(value = "num_self_consistency", required = false) Integer numSelfConsistency,
            @RequestParam(value = "num_cot", required = false) Integer numCot,
            @RequestParam(value = "model", required = false) String model,
            @RequestParam(value = "temperature", required = false) Double temperature) {
        String filename = pdfFile.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new ValidationException("pdf_file", "must be a .pdf file");
        }
        ExtractedDocument document = documentExtractor.extract(readBytes(pdfFile));
        LOG.info("Document attached: file={}, pages={}, warnings={}", filename, document.pageCount(),
                document.warnings().size());

        PromptRequest request = mapper.toRequest(prompt, systemPrompt, document.text(), numSelfConsistency,
                numCot, model, temperature);
        AggregateResult result = aggregationService.runAggregation(request);
        DocumentInfo info = new DocumentInfo(filename, document.pageCount(), document.text().length(),
                document.warnings());
        return ResponseEntity.ok(new CompletionResponseBody(result, info));
    }

    @PostMapping(path = "/v1/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ChatCompletionResponseBody> chat(@RequestBody ChatCompletionRequestBody body) {
        List<ChatMessage> messages = body.messages();
        if (messages == null || messages.isEmpty()) {
            throw new ValidationException("messages", "must not be empty");
        }
        String prompt = null;
        for (int i = messages.size() - 1; i >= 0 && prompt == null; i--) {
            if ("user".equals(messages.get(i).role())) {
                prompt = messages.get(i).content();
            }
        }
        if (prompt == null) {
            throw new ValidationException("messages", "no user message found");
        }
        String systemPrompt = messages.stream()
                .filter(m -> "system".equals(m.role()))
                .map(ChatMessage::content)
                .findFirst()
                .orElse(null);

        PromptRequest request = mapper.toRequest(prompt, systemPrompt, null, body.numSelfConsistency(),
                body.numCot(), body.model(), body.temperature());
        AggregateResult result = aggregationService.runAggregation(request);

        ChatCompletionResponseBody response = new ChatCompletionResponseBody(
                "chatcmpl-" + UUID.randomUUID(),
                "chat.completion",
                Instant.now().getEpochSecond(),
                result.modelUsed(),
                List.of(new ChatCompletionResponseBody.Choice(0,
                        new ChatMessage("assistant", result.finalAnswer()), "stop")),
                new ChatCompletionResponseBody.Usage(result.tokenUsage().promptTokens(),
                        result.tokenUsage().completionTokens(), result.tokenUsage().totalTokens()),
                result);
        return ResponseEntity.ok(response);
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new DocumentExtractionException("Could not read uploaded file", e);
        }
    }
}
