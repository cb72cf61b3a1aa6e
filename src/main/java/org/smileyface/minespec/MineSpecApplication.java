package org.smileyface.minespec;

import org.smileyface.minespec.config.HarvestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(HarvestProperties.class)
public class MineSpecApplication {

	public static void main(String[] args) {
		SpringApplication.run(MineSpecApplication.class, args);
	}
}
