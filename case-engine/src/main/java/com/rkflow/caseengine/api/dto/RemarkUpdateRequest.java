package com.rkflow.caseengine.api.dto;

public record RemarkUpdateRequest(String remarkText) {}
