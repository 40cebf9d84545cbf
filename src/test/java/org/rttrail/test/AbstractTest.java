package org.rttrail.test;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.UnsupportedEncodingException;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.rttrail.mailhog.MailHogDtos;
import org.rttrail.mailhog.MailHogDtos.Message;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.SpringBootTest.WebEnvironment;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;

import io.restassured.RestAssured;
import io.restassured.specification.RequestSpecification;
import jakarta.mail.internet.MimeUtility;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@SpringBootTest(webEnvironment = WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
	"rttrail.jwt.secret=test-secret",
	"rttrail.jwt.issuer=rttrail-tests",
	"rttrail.mail.from.email=" + AbstractTest.MAIL_FROM,
	"rttrail.mail-migration.archive=./target/test-data/mail-migration-archives.txt",
	"rttrail.init.superuser.email=" + AbstractTest.SUPERUSER_EMAIL,
	"rttrail.init.superuser.password=" + AbstractTest.SUPERUSER_PASSWORD,
	"rttrail.version=test",
	"spring.r2dbc.username=postgres",
	"spring.r2dbc.password=postgres",
})
public abstract class AbstractTest {
	
	public static final String MAIL_FROM = "no-reply@rttrail.org";
	public static final String SUPERUSER_EMAIL = "admin@rttrail.org";
	public static final String SUPERUSER_PASSWORD = "admin-password";
	
	@SuppressWarnings("resource")
	static PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:16-alpine").withUsername("postgres").withPassword("postgres").withDatabaseName("rttrail");
	@SuppressWarnings({ "rawtypes", "resource" })
	static GenericContainer smtp = new GenericContainer<>("mailhog/mailhog:v1.0.1").withExposedPorts(1025, 8025);
	
	private static void start() {
		Mono.zip(
			Mono.fromRunnable(postgreSQLContainer::start).subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel()).then(Mono.just(1)),
			Mono.fromRunnable(smtp::start).subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel()).then(Mono.just(1))
		).block();
	}

	@LocalServerPort
	private Integer port;
	
	@Autowired
	protected TestService test;
	
	@BeforeEach
	void setupRestAssured() {
		RestAssured.port = port;
	}
	
	@DynamicPropertySource
	static void postgreSQLProperties(DynamicPropertyRegistry registry) {
		start();
		registry.add("spring.r2dbc.url", () -> "r2dbc:postgresql://postgres@" + postgreSQLContainer.getHost() + ":" + postgreSQLContainer.getMappedPort(5432) + "/rttrail");
	}
	
	@DynamicPropertySource
	static void mailProperties(DynamicPropertyRegistry registry) {
		start();
		registry.add("spring.mail.host", () -> smtp.getHost());
		registry.add("spring.mail.port", () -> smtp.getMappedPort(1025));
		registry.add("spring.mail.properties.mail.smtp.auth", () -> "false");
		registry.add("spring.mail.properties.mail.smtp.starttls.enable", () -> "false");
	}
	
	protected RequestSpecification mailHogRequest() {
		return RestAssured.given().baseUri("http://" + smtp.getHost() + ":" + smtp.getMappedPort(8025) + "/api");
	}
	
	/** Waits for a mail to the given address, deletes it from MailHog and returns its decoded subject. */
	@SuppressWarnings("java:S2925")
	protected String assertMailSent(String to) {
		MailHogDtos.Message message = null;
		for (var trial = 0; trial < 300; trial++) {
			var messageOpt = searchMail(to);
			if (messageOpt.isPresent()) {
				message = messageOpt.get();
				break;
			}
			try {
				Thread.sleep(100);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		assertThat(message).as("mail to " + to).isNotNull();

		var subject = message.getContent().getHeaders().get("Subject").get(0);
		try {
			subject = MimeUtility.decodeText(subject);
		} catch (UnsupportedEncodingException e) {
			throw new AssertionError(e);
		}
		mailHogRequest().delete("/v1/messages/" + message.getId());
		return subject;
	}
	
	@SuppressWarnings("java:S2925")
	protected void assertMailNotSent(String to) {
		try {
			Thread.sleep(2000);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		assertThat(searchMail(to)).isEmpty();
	}
	
	protected Optional<Message> searchMail(String to) {
		var response = mailHogRequest().get("/v2/messages");
		assertThat(response.statusCode()).isEqualTo(200);
		var messages = response.getBody().as(MailHogDtos.Messages.class);
		return messages.getItems().stream()
			.filter(m -> MAIL_FROM.equals(m.fromAddress()) && to.toLowerCase().equals(m.toAddress()))
			.findAny();
	}
}
