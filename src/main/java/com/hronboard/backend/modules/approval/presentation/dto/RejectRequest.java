package com.hronboard.backend.modules.approval.presentation.dto;

import jakarta.validation.constraints.Size;

public record RejectRequest(
        @Size(max = 1000) String comments,
        @Size(max = 2000) String changesRequested
) {
}
