package com.hronboard.backend.modules.approval.presentation.dto;

import jakarta.validation.constraints.Size;

public record SubmitForApprovalRequest(@Size(max = 1000) String comments) {
}
