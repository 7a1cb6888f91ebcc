package com.hronboard.backend.modules.template.presentation.dto;

import java.util.List;

import com.hronboard.backend.global.common.PageInfo;

public record TemplateListResponse(List<TemplateSummaryResponse> templates, PageInfo pagination) {
}
