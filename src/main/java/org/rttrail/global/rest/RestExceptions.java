package org.rttrail.global.rest;

import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.RttrailException;
import org.rttrail.global.exceptions.UnauthorizedException;
import org.rttrail.global.exceptions.ValidationUtils;
import org.springframework.core.MethodParameter;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@Slf4j(topic = RttrailUtils.LOG_ERROR)
public class RestExceptions {

	@ExceptionHandler(RttrailException.class)
	public Mono<ResponseEntity<ApiError>> handleRttrailError(RttrailException error, ServerWebExchange exchange) {
		log.warn("Error returned by {} {}: {} - {} - {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getErrorCode(), error.getMessage(), requestId(exchange));
		return Mono.fromSupplier(() -> {
			var response = ResponseEntity.status(error.getStatus());
			if (error instanceof UnauthorizedException) response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
			return response.body(error.toApiError());
		});
	}

	@ExceptionHandler(DataIntegrityViolationException.class)
	public Mono<ResponseEntity<ApiError>> handleIntegrityError(DataIntegrityViolationException error, ServerWebExchange exchange) {
		log.warn("Integrity error returned by {} {}: {} - {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getMessage(), requestId(exchange));
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(new ApiError(400, BadRequestException.INTEGRITY_ERROR, "Database integrity error")));
	}

	@ExceptionHandler(WebExchangeBindException.class)
	public Mono<ResponseEntity<ApiError>> handleBindError(WebExchangeBindException error, ServerWebExchange exchange) {
		ApiError result;
		if (error.hasFieldErrors()) {
			result = new ApiError(400, ValidationUtils.INVALID_PREFIX + error.getFieldError().getField(), error.getFieldError().getDefaultMessage());
		} else {
			result = new ApiError(400, "invalid-input", "Invalid request");
		}
		log.warn("Framework bind input error returned by {} {}: 400 - {} => {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getMessage(), result, requestId(exchange));
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	@ExceptionHandler(ServerWebInputException.class)
	public Mono<ResponseEntity<ApiError>> handleInputError(ServerWebInputException error, ServerWebExchange exchange) {
		ApiError result;
		String parameterName = getParameterName(error.getMethodParameter());
		if (parameterName != null) {
			result = new ApiError(400, ValidationUtils.INVALID_PREFIX + parameterName, error.getReason());
		} else {
			result = new ApiError(400, "invalid-input", "Invalid request");
		}
		log.warn("Framework input error returned by {} {}: 400 - {} => {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getMessage(), result, requestId(exchange));
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	private String getParameterName(MethodParameter p) {
		if (p == null) return null;
		PathVariable pv = p.getParameterAnnotation(PathVariable.class);
		if (pv != null && !pv.name().isBlank()) return pv.name();
		RequestParam rp = p.getParameterAnnotation(RequestParam.class);
		if (rp != null && !rp.name().isBlank()) return rp.name();
		return p.getParameterName();
	}

	@ExceptionHandler(ErrorResponseException.class)
	public Mono<ResponseEntity<ApiError>> handleFrameworkError(ErrorResponseException error, ServerWebExchange exchange) {
		int status = error.getStatusCode().value();
		var body = error.getBody();
		var result = new ApiError(status, body.getTitle(), body.getDetail());
		log.warn("Framework error returned by {} {}: {} - {} - {} => {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), status, error.getMessage(), result, requestId(exchange));
		return Mono.fromSupplier(() -> ResponseEntity.status(status).body(result));
	}

	@ExceptionHandler(Exception.class)
	public Mono<ResponseEntity<ApiError>> handleOtherError(Exception error, ServerWebExchange exchange) {
		log.error("Generic error returned by {} {}: {} - {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getMessage(), requestId(exchange), error);
		return Mono.fromSupplier(() -> ResponseEntity.status(500).body(new ApiError(500, "internal-error", "Internal server error")));
	}

	private static String requestId(ServerWebExchange exchange) {
		return exchange.getAttribute(RequestId.KEY);
	}

}
