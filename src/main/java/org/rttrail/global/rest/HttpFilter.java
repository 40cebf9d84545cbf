package org.rttrail.global.rest;

import java.net.InetSocketAddress;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.mutable.MutableObject;
import org.rttrail.global.RttrailUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.context.Context;

@Slf4j(topic = RttrailUtils.LOG_ACCESS)
public class HttpFilter implements WebFilter {

	@Override
	public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
		long start = System.currentTimeMillis();
		String requestId = UUID.randomUUID().toString();
		exchange.getAttributes().put(RequestId.KEY, requestId);
		exchange.getResponse().getHeaders().set(RequestId.HEADER, requestId);
		MutableObject<Disposable> schedule = new MutableObject<>(null);
		exchange.getResponse().beforeCommit(() -> Mono.fromRunnable(() -> {
			Disposable d = schedule.getValue();
			if (d != null && !d.isDisposed()) d.dispose();
			long time = System.currentTimeMillis() - start;
			HttpStatusCode status = exchange.getResponse().getStatusCode();
			log.info("{} - \"{} {}\" {} ({})", client(exchange), exchange.getRequest().getMethod(), exchange.getRequest().getPath(), status != null ? status.value() : 200, requestId);
			if (time > 2000) log.warn("Request took {} ms: {} {} ({})", time, exchange.getRequest().getMethod(), exchange.getRequest().getPath(), requestId);
		}));
		schedule.setValue(Schedulers.boundedElastic().schedule(() -> {
			schedule.setValue(null);
			log.warn("Request not committed after 10 seconds: {} {} ({})", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), requestId);
		}, 10, TimeUnit.SECONDS));
		return chain.filter(exchange).contextWrite(Context.of(RequestId.KEY, requestId));
	}
	
	private static String client(ServerWebExchange exchange) {
		InetSocketAddress address = exchange.getRequest().getRemoteAddress();
		if (address == null) return "unknown";
		return address.getHostString() + ":" + address.getPort();
	}
	
}
