package org.rttrail.poi.rest;

import java.util.UUID;

import org.rttrail.auth.Authenticated;
import org.rttrail.global.rest.RetryRest;
import org.rttrail.poi.PoiService;
import org.rttrail.poi.dto.Poi;
import org.rttrail.poi.dto.PoiCreate;
import org.rttrail.poi.dto.PoiUpdate;
import org.rttrail.poi.dto.VoteRequest;
import org.rttrail.user.db.UserEntity;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/poi/v1")
@RequiredArgsConstructor
public class PoiV1Controller {

	private final PoiService service;
	
	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<Poi> create(@RequestBody PoiCreate request, @Authenticated UserEntity user) {
		return service.create(request, user);
	}
	
	@GetMapping("/{id}")
	public Mono<Poi> get(@PathVariable("id") UUID id, @Authenticated UserEntity user) {
		return RetryRest.retry(service.get(id));
	}
	
	@GetMapping
	public Flux<Poi> getInBox(
		@RequestParam(name = "minLat", required = false) Double minLat,
		@RequestParam(name = "maxLat", required = false) Double maxLat,
		@RequestParam(name = "minLng", required = false) Double minLng,
		@RequestParam(name = "maxLng", required = false) Double maxLng,
		@Authenticated UserEntity user
	) {
		return RetryRest.retry(service.getInBox(minLat, maxLat, minLng, maxLng));
	}
	
	@PatchMapping("/{id}")
	public Mono<Poi> update(@PathVariable("id") UUID id, @RequestBody PoiUpdate update, @Authenticated UserEntity user) {
		return service.update(id, update, user);
	}
	
	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> delete(@PathVariable("id") UUID id, @Authenticated UserEntity user) {
		return service.delete(id, user);
	}
	
	@PutMapping("/{id}/vote")
	public Mono<Poi> vote(@PathVariable("id") UUID id, @RequestBody VoteRequest request, @Authenticated UserEntity user) {
		return service.vote(id, request, user);
	}
	
	@DeleteMapping("/{id}/vote")
	public Mono<Poi> removeVote(@PathVariable("id") UUID id, @Authenticated UserEntity user) {
		return service.removeVote(id, user);
	}
	
}
