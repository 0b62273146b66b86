package com.odin.call_signaling_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.client.discovery.EnableDiscoveryClient;

@EnableDiscoveryClient
@SpringBootApplication
public class CallSignalingServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(CallSignalingServiceApplication.class, args);
	}

}
