package com.sandkev.tradewise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EntityScan(basePackages = "com.sandkev.tradewise.instrument")
@EnableJpaRepositories(basePackages = "com.sandkev.tradewise")
public class TradewiseApplication {

	public static void main(String[] args) {
		SpringApplication.run(TradewiseApplication.class, args);
	}

}
