package com.interviewportal.scheduler.security;

import com.interviewportal.scheduler.exception.ValidationException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.UUID;

public class CallerArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Caller.class.equals(parameter.getParameterType());
    }

    @Override
    public Caller resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory)
            throws MissingRequestHeaderException {
        String rawUserId = webRequest.getHeader(USER_ID_HEADER);
        String rawRole = webRequest.getHeader(ROLE_HEADER);
        if (rawUserId == null || rawUserId.isBlank()) {
            throw new MissingRequestHeaderException(USER_ID_HEADER, parameter);
        }
        if (rawRole == null || rawRole.isBlank()) {
            throw new MissingRequestHeaderException(ROLE_HEADER, parameter);
        }
        UUID userId;
        try {
            userId = UUID.fromString(rawUserId.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(USER_ID_HEADER + " must be a UUID");
        }
        return Caller.of(userId, Role.fromHeader(rawRole));
    }
}
