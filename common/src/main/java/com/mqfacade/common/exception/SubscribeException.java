/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.exception;

public class SubscribeException extends MQFacadeException {
    public SubscribeException(String topic, String subscriptionName, Throwable cause) {
        super("MQF_SUBSCRIBE",
              "Subscribe rejected for topic='" + topic + "' subscription='" + subscriptionName + "': "
                      + cause.getMessage(), cause);
    }
}
