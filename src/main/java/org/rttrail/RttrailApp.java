package org.rttrail;

import org.rttrail.init.InitDB;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.admin.SpringApplicationAdminJmxAutoConfiguration;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jmx.JmxAutoConfiguration;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseAutoConfiguration;
import org.springframework.boot.autoconfigure.security.oauth2.client.reactive.ReactiveOAuth2ClientAutoConfiguration;
import org.springframework.boot.autoconfigure.security.oauth2.resource.reactive.ReactiveOAuth2ResourceServerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.ReactiveMultipartAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.WebSessionIdResolverAutoConfiguration;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.SmartLifecycle;

import lombok.extern.slf4j.Slf4j;

@SpringBootApplication(exclude= {
	FlywayAutoConfiguration.class,
	JmxAutoConfiguration.class,
	LiquibaseAutoConfiguration.class,
	ReactiveMultipartAutoConfiguration.class,
	ReactiveOAuth2ClientAutoConfiguration.class,
	ReactiveOAuth2ResourceServerAutoConfiguration.class,
	SpringApplicationAdminJmxAutoConfiguration.class,
	SqlInitializationAutoConfiguration.class,
	WebSessionIdResolverAutoConfiguration.class,
})
@Slf4j
public class RttrailApp implements SmartLifecycle, ApplicationContextAware {

	public static void main(String[] args) {
		SpringApplication.run(RttrailApp.class, args);
	}
	
	@Value("${rttrail.init.db:true}")
	private boolean initDb;
	
	public void initApp() {
		if (!initDb) {
			log.info("Database initialization disabled");
			return;
		}
		InitDB init = new InitDB();
		context.getAutowireCapableBeanFactory().autowireBean(init);
		init.init();
	}

	private boolean running = false;
	private ApplicationContext context;
	
	@Override
	public void start() {
		initApp();
		running = true;
	}

	@Override
	public void stop() {
		running = false;
	}

	@Override
	public boolean isRunning() {
		return running;
	}
	
	@Override
	public int getPhase() {
		// WebServerStartStopLifecycle - 1 to do it before the web server is exposed
		return WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 1025;
	}

	@Override
	public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
		context = applicationContext;
	}
}
