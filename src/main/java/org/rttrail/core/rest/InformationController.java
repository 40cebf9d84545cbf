package org.rttrail.core.rest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.AllArgsConstructor;
import lombok.Data;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/information")
public class InformationController {

	@Value("${rttrail.version:unknown}")
	private String version;

	@GetMapping
	public Mono<Information> information() {
		return Mono.just(new Information(true, version));
	}
	
	@Data
	@AllArgsConstructor
	public static class Information {
		private boolean ready;
		private String version;
	}
	
}
