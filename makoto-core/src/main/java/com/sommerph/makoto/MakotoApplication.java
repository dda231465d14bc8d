package com.sommerph.makoto;

import com.sommerph.makoto.config.MakotoProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MakotoProperties.class)
public class MakotoApplication {

	public static void main(String[] args) {
		SpringApplication.run(MakotoApplication.class, args);
	}

}
