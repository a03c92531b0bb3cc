package com.singkhmer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SingKhmerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SingKhmerApplication.class, args);
	}

}
