package org.docstore.exception;

import org.springframework.http.HttpStatus;

/**
 * 输入不合法（路径、参数等）
 */
public class ValidationException extends CustomException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST);
    }
}
