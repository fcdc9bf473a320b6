package com.teamA.cra.api.web;

import com.teamA.cra.api.auth.UserResolver;
import com.teamA.cra.api.web.dto.CreateRequestBody;
import com.teamA.cra.api.web.dto.EditRequestBody;
import com.teamA.cra.api.web.dto.NotifyBody;
import com.teamA.cra.api.web.dto.RequestResponse;
import com.teamA.cra.api.web.dto.TransitionBody;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.Actor;
import com.teamA.cra.common.notification.DispatchOutcome;
import com.teamA.cra.common.request.CreateRequestCommand;
import com.teamA.cra.common.request.CreatedRequest;
import com.teamA.cra.common.request.EditRequestCommand;
import com.teamA.cra.common.request.EditedRequest;
import com.teamA.cra.common.request.RequestCreationService;
import com.teamA.cra.common.request.RequestEditService;
import com.teamA.cra.common.transition.StateTransitionService;
import com.teamA.cra.common.transition.TransitionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * request 쓰기 API (생성 / 상태 전이 / 수정 / 알림 재발송)
 *
 * 변경 주체는 항상 로그인 사용자
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/requests")
public class RequestCommandController {

    private final RequestCreationService requestCreationService;
    private final StateTransitionService stateTransitionService;
    private final RequestEditService requestEditService;
    private final UserResolver userResolver;

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateRequestBody body) {
        Actor actor = userResolver.currentActor();
        CreatedRequest result = requestCreationService.create(CreateRequestCommand.builder()
                .status(body.getStatus())
                .draftSessionKey(body.getDraftSessionKey())
                .payload(body.toPayload())
                .build(), actor);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("request", RequestResponse.from(result.request()));
        response.put("created", result.created());
        response.put("notification", result.notification());

        // 기존 draft 재사용이면 200
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
    }

    @PostMapping("/{requestId}/status")
    public ResponseEntity<Map<String, Object>> changeStatus(
            @PathVariable String requestId,
            @Validated @RequestBody TransitionBody body
    ) {
        Actor actor = userResolver.currentActor();
        TransitionResult result = stateTransitionService.applyTransition(requestId, body.getStatus(), body.getComment(), actor);
        return toResponse(result);
    }

    @PutMapping("/{requestId}")
    public ResponseEntity<Map<String, Object>> edit(
            @PathVariable String requestId,
            @RequestBody EditRequestBody body
    ) {
        Actor actor = userResolver.currentActor();
        EditedRequest result = requestEditService.edit(requestId, EditRequestCommand.builder()
                .payload(body.toPayload())
                .markEdited(body.isMarkEdited())
                .renotify(body.isRenotify())
                .build(), actor);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("request", RequestResponse.from(result.request()));
        response.put("notification", result.notification());
        return ResponseEntity.ok(response);
    }

    /** history 변경 없이 알림만 */
    @PostMapping("/{requestId}/notify")
    public ResponseEntity<DispatchOutcome> notify(
            @PathVariable String requestId,
            @RequestBody(required = false) NotifyBody body
    ) {
        NotifyBody b = body == null ? new NotifyBody() : body;
        DispatchOutcome outcome = requestEditService.renotify(
                requestId, b.getEventType(), b.getStatus(), b.getPreviousStatus(), b.getComment(),
                userResolver.currentActor());
        return ResponseEntity.ok(outcome);
    }

    static ResponseEntity<Map<String, Object>> toResponse(TransitionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();

        if (result instanceof TransitionResult.Success success) {
            body.put("request", RequestResponse.from(success.request()));
            body.put("previousStatus", success.previousStatus().code());
            body.put("notification", success.notification());
            return ResponseEntity.ok(body);
        }
        if (result instanceof TransitionResult.UnknownStatus unknown) {
            body.put("error", "unknown_status");
            body.put("message", "Unknown status: " + unknown.requestedStatus());
            return ResponseEntity.badRequest().body(body);
        }
        if (result instanceof TransitionResult.IllegalTransition illegal) {
            List<String> allowed = illegal.allowed().stream().map(RequestStatus::code).sorted().toList();
            body.put("error", "illegal_transition");
            body.put("message", "Transition " + illegal.from().code() + " -> " + illegal.to().code() + " is not allowed");
            body.put("allowedTransitions", allowed);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }
        if (result instanceof TransitionResult.MissingRequiredField missing) {
            body.put("error", "missing_required_field");
            body.put("field", missing.field());
            body.put("message", missing.reason());
            return ResponseEntity.badRequest().body(body);
        }
        if (result instanceof TransitionResult.NotFound notFound) {
            body.put("error", "not_found");
            body.put("message", "Request not found: " + notFound.requestId());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }

        TransitionResult.ConditionFailed conflict = (TransitionResult.ConditionFailed) result;
        body.put("error", "conflict");
        body.put("message", "Request " + conflict.requestId() + " was modified concurrently, retry");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }
}
