package com.hronboard.backend.modules.users.presentation.dto;

import java.util.List;

import com.hronboard.backend.global.common.PageInfo;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;

public record UserListResponse(List<UserResponse> users, PageInfo pagination) {
}
