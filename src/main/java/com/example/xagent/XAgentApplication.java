package com.example.xagent;

import com.example.xagent.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class XAgentApplication {

	public static void main(String[] args) {
		SpringApplication.run(XAgentApplication.class, args);
	}

}
