package com.firefly.prdagent;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@MapperScan("com.firefly.prdagent.mapper")
@ConfigurationPropertiesScan
public class PrdAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrdAgentApplication.class, args);
    }

}
