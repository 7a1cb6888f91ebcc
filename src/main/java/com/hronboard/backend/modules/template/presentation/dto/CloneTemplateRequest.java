package com.hronboard.backend.modules.template.presentation.dto;

import jakarta.validation.constraints.Size;

public record CloneTemplateRequest(@Size(max = 200) String name) {
}
