package com.clapgrow.tempmail.api.controller;

import com.clapgrow.tempmail.api.dto.ApiResponse;
import com.clapgrow.tempmail.api.dto.FetchMessageRequest;
import com.clapgrow.tempmail.api.dto.ListMessagesRequest;
import com.clapgrow.tempmail.api.service.MailService;
import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/mail")
@RequiredArgsConstructor
@Tag(name = "Mail", description = "Disposable address creation and inbox access")
@SecurityRequirement(name = "bearerAuth")
public class MailController {

    private final MailService mailService;

    @PostMapping("/create")
    @Operation(summary = "Create a disposable address",
            description = "Uses the requested provider, or the best one offering the requested domain, prefix and expiration.")
    public Mono<ResponseEntity<ApiResponse<CreatedEmail>>> createEmail(
            @RequestBody(required = false) CreateEmailRequest request) {
        return mailService.createEmail(request)
                .map(response -> respond(response, HttpStatus.BAD_REQUEST));
    }

    @PostMapping("/list")
    @Operation(summary = "List messages of an address")
    public Mono<ResponseEntity<ApiResponse<List<EmailMessage>>>> listMessages(
            @Valid @RequestBody ListMessagesRequest request) {
        return mailService.listMessages(request.toQuery())
                .map(response -> respond(response, HttpStatus.BAD_REQUEST));
    }

    @PostMapping("/content")
    @Operation(summary = "Fetch full content of one message")
    public Mono<ResponseEntity<ApiResponse<EmailMessage>>> fetchMessage(
            @Valid @RequestBody FetchMessageRequest request) {
        return mailService.fetchMessage(request.getAddress().trim(), request.getEmailId(),
                        request.getProvider(), request.getAccessToken())
                .map(response -> respond(response, HttpStatus.NOT_FOUND));
    }

    private static <T> ResponseEntity<ApiResponse<T>> respond(ApiResponse<T> response, HttpStatus failureStatus) {
        return ResponseEntity.status(response.success() ? HttpStatus.OK : failureStatus).body(response);
    }
}
