package org.docstore.controller;

import org.docstore.exception.CustomException;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * 调用方身份由上游网关通过 X-User-Id 请求头传入
 */
public final class UserHeader {

    public static final String NAME = "X-User-Id";

    private UserHeader() {
    }

    public static UUID parse(String value) {
        if (value == null || value.isBlank()) {
            throw new CustomException("Missing " + NAME + " header", HttpStatus.UNAUTHORIZED);
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new CustomException("Invalid " + NAME + " header", HttpStatus.UNAUTHORIZED, e);
        }
    }
}
