package com.chainpulse.analytics.security;

import com.chainpulse.common.dto.ErrorResponseDTO;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;

/**
 * Shared-secret authentication: every API call must carry the configured token in the
 * {@code X-Auth-Token} header (name configurable).
 */
@Component
@Slf4j
public class AuthTokenInterceptor implements HandlerInterceptor {

	private static final String ERROR_CODE_UNAUTHORIZED = "UNAUTHORIZED";

	private final String headerName;
	private final byte[] expectedToken;
	private final ObjectMapper objectMapper;

	public AuthTokenInterceptor(@Value("${security.auth-header:X-Auth-Token}") String headerName,
	                            @Value("${security.auth-token:}") String authToken,
	                            ObjectMapper objectMapper) {
		if (StringUtils.isBlank(authToken)) {
			throw new IllegalStateException("security.auth-token must be configured (env AUTH_TOKEN)");
		}
		this.headerName = headerName;
		this.expectedToken = authToken.getBytes(StandardCharsets.UTF_8);
		this.objectMapper = objectMapper;
	}

	@Override
	public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
		String presented = request.getHeader(headerName);

		if (StringUtils.isBlank(presented)) {
			log.warn("Missing {} header: {} {}", headerName, request.getMethod(), request.getRequestURI());
			reject(request, response, "Missing authentication token");
			return false;
		}

		// constant time
		if (!MessageDigest.isEqual(expectedToken, presented.getBytes(StandardCharsets.UTF_8))) {
			log.warn("Invalid authentication token: {} {}", request.getMethod(), request.getRequestURI());
			reject(request, response, "Invalid authentication token");
			return false;
		}

		return true;
	}

	private void reject(HttpServletRequest request, HttpServletResponse response, String message) throws IOException {
		ErrorResponseDTO error = ErrorResponseDTO.builder()
			.errorCode(ERROR_CODE_UNAUTHORIZED)
			.message(message)
			.timestamp(LocalDateTime.now())
			.path(request.getRequestURI())
			.build();

		response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
		response.setContentType(MediaType.APPLICATION_JSON_VALUE);
		response.setCharacterEncoding(StandardCharsets.UTF_8.name());
		response.getWriter().write(objectMapper.writeValueAsString(error));
	}
}
