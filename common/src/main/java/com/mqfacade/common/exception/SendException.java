/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.exception;

public class SendException extends MQFacadeException {
    public SendException(String topic, Throwable cause) {
        super("MQF_SEND", "Send to topic='" + topic + "' failed: " + cause.getMessage(), cause);
    }
}
