package com.credwallet.backend.modules.share.presentation.dto;

import java.util.List;

public record ShareListResponse(List<ShareResponse> items) {
}
