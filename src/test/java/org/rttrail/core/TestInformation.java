package org.rttrail.core;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.rttrail.test.AbstractTest;

import io.restassured.RestAssured;

class TestInformation extends AbstractTest {

	@Test
	void testInformation() {
		var response = RestAssured.given().get("/api/information");
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().jsonPath().getBoolean("ready")).isTrue();
		assertThat(response.getBody().jsonPath().getString("version")).isEqualTo("test");
		assertThat(response.getHeader("X-Request-Id")).isNotBlank();
	}
	
}
