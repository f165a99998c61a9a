/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

/**
 * Outcome reported by a {@link MessageListener}.
 */
public final class ConsumeResult {

    private static final ConsumeResult SUCCESS = new ConsumeResult(true, null, null);

    private final boolean success;
    private final String detail;
    private final Throwable cause;

    private ConsumeResult(boolean success, String detail, Throwable cause) {
        this.success = success;
        this.detail = detail;
        this.cause = cause;
    }

    public static ConsumeResult success() { return SUCCESS; }

    public static ConsumeResult failure(String detail) {
        return new ConsumeResult(false, detail, null);
    }

    public static ConsumeResult failure(String detail, Throwable cause) {
        return new ConsumeResult(false, detail, cause);
    }

    public boolean isSuccess() { return success; }
    public String getDetail() { return detail; }
    public Throwable getCause() { return cause; }

    @Override
    public String toString() {
        return success ? "ConsumeResult{success}" : "ConsumeResult{failure: " + detail + "}";
    }
}
