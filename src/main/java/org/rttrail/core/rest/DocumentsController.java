package org.rttrail.core.rest;

import java.util.regex.Pattern;

import org.rttrail.global.exceptions.NotFoundException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

/** Public documents bundled under {@code assets/}. */
@RestController
@RequestMapping("/api")
public class DocumentsController {

	private static final String ASSETS = "assets/";
	private static final Pattern STYLE_NAME = Pattern.compile("^[A-Za-z0-9_-]+$");
	private static final MediaType TEXT_CSS = MediaType.parseMediaType("text/css");
	private static final MediaType IMAGE_ICON = MediaType.parseMediaType("image/x-icon");

	@GetMapping("/privacy")
	public Mono<ResponseEntity<Resource>> privacy() {
		return asset("privacy.txt", MediaType.TEXT_PLAIN);
	}

	@GetMapping("/terms-and-conditions")
	public Mono<ResponseEntity<Resource>> termsAndConditions() {
		return asset("terms-and-conditions.txt", MediaType.TEXT_PLAIN);
	}

	@GetMapping("/support")
	public Mono<ResponseEntity<Resource>> support() {
		return asset("support.txt", MediaType.TEXT_PLAIN);
	}

	@GetMapping({"/security.txt", "/.well-known/security.txt"})
	public Mono<ResponseEntity<Resource>> securityTxt() {
		return asset("security.txt", MediaType.TEXT_PLAIN);
	}

	@GetMapping("/robots.txt")
	public Mono<ResponseEntity<Resource>> robotsTxt() {
		return asset("robots.txt", MediaType.TEXT_PLAIN);
	}

	@GetMapping("/style/{file}.css")
	public Mono<ResponseEntity<Resource>> style(@PathVariable("file") String file) {
		// plain names only, nothing can leave the style directory
		if (!STYLE_NAME.matcher(file).matches()) return Mono.error(new NotFoundException("file", file + ".css"));
		return asset("style/" + file + ".css", TEXT_CSS);
	}

	@GetMapping("/favicon.ico")
	public Mono<ResponseEntity<Resource>> favicon() {
		return asset("images/favicon.ico", IMAGE_ICON);
	}

	private static Mono<ResponseEntity<Resource>> asset(String path, MediaType type) {
		Resource resource = new ClassPathResource(ASSETS + path);
		if (!resource.exists()) return Mono.error(new NotFoundException("file", path));
		return Mono.just(ResponseEntity.ok().contentType(type).body(resource));
	}

}
