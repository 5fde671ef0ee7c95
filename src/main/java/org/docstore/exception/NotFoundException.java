package org.docstore.exception;

import org.springframework.http.HttpStatus;

/**
 * 引用的文档、版本或知识库不存在
 */
public class NotFoundException extends CustomException {

    public NotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, HttpStatus.NOT_FOUND, cause);
    }
}
