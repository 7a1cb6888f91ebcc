package com.hronboard.backend.global.config;

import com.hronboard.backend.modules.approval.domain.ApprovalStatus;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.template.domain.TemplateStatus;

import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Query parameters carry the lower-case wire codes ({@code hr_manager}, {@code pending_approval}),
 * not the enum constant names.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, UserRole.class, (Converter<String, UserRole>) UserRole::fromCode);
        registry.addConverter(String.class, TemplateStatus.class, (Converter<String, TemplateStatus>) TemplateStatus::fromCode);
        registry.addConverter(String.class, ApprovalStatus.class, (Converter<String, ApprovalStatus>) ApprovalStatus::fromCode);
    }
}
