package com.bbthechange.matchtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SpringBootApplication
public class MatchTrackerApplication {

	private static final Logger logger = LoggerFactory.getLogger(MatchTrackerApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(MatchTrackerApplication.class);
		app.run(args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Match tracker listening on port {}", event.getWebServer().getPort());
	}

}
