/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.codec;

public class CodecException extends Exception {
    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
