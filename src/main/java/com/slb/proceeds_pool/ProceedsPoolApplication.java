package com.slb.proceeds_pool;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.proceeds_pool")
@MapperScan("com.slb.proceeds_pool.modules.*.mapper")
public class ProceedsPoolApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProceedsPoolApplication.class, args);
	}

}
