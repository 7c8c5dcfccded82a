package com.rkflow.caseengine.api.dto;

import com.rkflow.caseengine.status.TransitionCheck;

import java.util.List;

public record TransitionCheckResponse(boolean allowed, String reason, List<String> suggestions) {

    public static TransitionCheckResponse from(TransitionCheck check) {
        return new TransitionCheckResponse(check.allowed(), check.reason(), check.suggestions());
    }
}
