package com.teamA.cra.api.web;

import com.teamA.cra.api.web.dto.RequestResponse;
import com.teamA.cra.common.request.RequestStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class RequestQueryController {

    private final RequestStore requestStore;

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<RequestResponse> getRequest(@PathVariable String requestId) {
        return requestStore.findById(requestId)
                .map(RequestResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
