package com.slb.staking_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.staking_backend")
@MapperScan("com.slb.staking_backend.modules.*.mapper")
public class StakingBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(StakingBackendApplication.class, args);
	}

}
