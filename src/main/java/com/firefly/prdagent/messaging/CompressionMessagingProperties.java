package com.firefly.prdagent.messaging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.messaging.compression")
public class CompressionMessagingProperties {

    private String exchange = "prd.compression.exchange";
    private String queue = "prd.compression.queue";
    private String routingKey = "prd.compression.routing";
    private int concurrency = 2;
}
