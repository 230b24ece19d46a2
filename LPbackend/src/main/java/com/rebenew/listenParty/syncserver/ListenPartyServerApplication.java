package com.rebenew.listenParty.syncserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ListenPartyServerApplication {
	public static void main(String[] args) {
		SpringApplication.run(ListenPartyServerApplication.class, args);
	}
}
