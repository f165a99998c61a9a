/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.exception;

/**
 * Base exception for all MQFacade errors.
 */
public class MQFacadeException extends RuntimeException {
    private final String errorCode;

    public MQFacadeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
